/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge;

import java.time.Duration;

import com.macstab.oss.redis.bridge.pubsub.SubscriptionCounting;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Immutable client options.
 *
 * <pre>{@code
 * RedisBridgeOptions options = RedisBridgeOptions.builder()
 *     .connectionName("orders")
 *     .pollTimeout(Duration.ofMillis(50))
 *     .build();
 * }</pre>
 */
@Getter
@ToString
@Builder(toBuilder = true)
public final class RedisBridgeOptions {

  public static final String DEFAULT_CONNECTION_NAME = "default";
  public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(100);
  public static final Duration DEFAULT_READY_TIMEOUT = Duration.ofSeconds(10);
  public static final Duration DEFAULT_RETIRE_TIMEOUT = Duration.ofSeconds(1);
  public static final int DEFAULT_MAX_CONSECUTIVE_POLL_FAILURES = 3;
  public static final Duration DEFAULT_POLL_FAILURE_BACKOFF = Duration.ofSeconds(1);

  /** Metrics tag and thread name component. */
  @NonNull @Builder.Default private final String connectionName = DEFAULT_CONNECTION_NAME;

  /** Bounded wait of one poll; bounds how long a retiring worker keeps running. */
  @NonNull @Builder.Default private final Duration pollTimeout = DEFAULT_POLL_TIMEOUT;

  /** Upper bound for a new subscription connection to confirm its subscriptions. */
  @NonNull @Builder.Default private final Duration readyTimeout = DEFAULT_READY_TIMEOUT;

  /** How long retirement waits for the old worker to exit before closing its session anyway. */
  @NonNull @Builder.Default private final Duration retireTimeout = DEFAULT_RETIRE_TIMEOUT;

  /** Consecutive poll failures that raise an {@code error} event and trigger the backoff. */
  @Builder.Default
  private final int maxConsecutivePollFailures = DEFAULT_MAX_CONSECUTIVE_POLL_FAILURES;

  /** Base pause after a failed poll; multiplied by the consecutive failure count. */
  @NonNull @Builder.Default
  private final Duration pollFailureBackoff = DEFAULT_POLL_FAILURE_BACKOFF;

  @NonNull @Builder.Default
  private final SubscriptionCounting subscriptionCounting = SubscriptionCounting.REFERENCE_COUNTED;

  /** Connect on first command instead of requiring an explicit {@code connect()}. */
  @Builder.Default private final boolean autoConnect = true;

  public static RedisBridgeOptions defaults() {
    return builder().build();
  }

  /**
   * Validates value ranges.
   *
   * @return this instance
   * @throws IllegalArgumentException on a blank name, non-positive durations or failure threshold
   */
  public RedisBridgeOptions validate() {
    if (connectionName.isBlank()) {
      throw new IllegalArgumentException("connectionName must not be blank");
    }
    requirePositive("pollTimeout", pollTimeout);
    requirePositive("readyTimeout", readyTimeout);
    requirePositive("retireTimeout", retireTimeout);
    if (pollFailureBackoff.isNegative()) {
      throw new IllegalArgumentException("pollFailureBackoff must not be negative");
    }
    if (maxConsecutivePollFailures < 1) {
      throw new IllegalArgumentException(
          "maxConsecutivePollFailures must be >= 1, got " + maxConsecutivePollFailures);
    }
    return this;
  }

  private static void requirePositive(final String name, final Duration value) {
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive, got " + value);
    }
  }
}
