/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge;

import java.util.Set;

import lombok.Builder;
import lombok.Value;

/** Point-in-time diagnostics of a {@link RedisBridgeClient}. */
@Value
@Builder
public class BridgeStatus {
  ConnectionState state;
  Set<String> channels;
  Set<String> patterns;
  boolean subscriberMode;
  boolean pollingActive;

  /** Generation of the live subscription connection; 0 when there is none. */
  long subscriptionGeneration;

  boolean publishConnectionOpen;
  int listenerCount;
}
