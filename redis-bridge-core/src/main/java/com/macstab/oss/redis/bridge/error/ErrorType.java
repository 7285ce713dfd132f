/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Failure categories used to decide between retry, suppression and propagation. */
@Getter
@RequiredArgsConstructor
public enum ErrorType {
  CONNECTION(true, false),
  CLOSING(false, true),
  TIMEOUT(true, false),
  COMMAND(false, false),
  AUTHENTICATION(false, false),
  NETWORK(true, false),
  UNKNOWN(false, false);

  /** Whether repeating the same operation may succeed. */
  private final boolean retryable;

  /** Whether the failure is expected during shutdown and may be logged at DEBUG only. */
  private final boolean suppressible;
}
