/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.pubsub;

import com.macstab.oss.redis.bridge.spi.SubscriberSession;

import lombok.NonNull;
import lombok.Value;

/**
 * The live subscription connection: a session fixed to one {@link SubscriptionSet} plus the worker
 * polling it. Replaced as a whole whenever the set changes.
 */
@Value
public class SubscriptionConnection {
  long generation;
  @NonNull SubscriptionSet subscriptions;
  @NonNull SubscriberSession session;
  @NonNull PollWorker worker;
}
