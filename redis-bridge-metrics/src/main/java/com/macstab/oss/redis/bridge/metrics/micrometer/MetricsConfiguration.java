/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.metrics.micrometer;

import lombok.experimental.UtilityClass;

/**
 * Meter names and tag keys published by {@link MicrometerRedisBridgeMetrics}.
 *
 * <p>Names follow the hierarchical {@code domain.client.feature} scheme so they render as {@code
 * redis_bridge_*} in Prometheus.
 */
@UtilityClass
public class MetricsConfiguration {

  /** Metric name prefix. */
  public static final String PREFIX = "redis.bridge";

  /** Gauge: distinct active channels or patterns. */
  public static final String SUBSCRIPTIONS_ACTIVE = PREFIX + ".subscriptions.active";

  /** Counter: listener events produced from received messages. */
  public static final String MESSAGES_DISPATCHED = PREFIX + ".messages.dispatched";

  /** Counter: failed subscriber polls. */
  public static final String POLL_FAILURES = PREFIX + ".poll.failures";

  /** Counter: subscription connection swaps. */
  public static final String SUBSCRIPTION_SWAPS = PREFIX + ".subscription.swaps";

  /** Counter: executed pipelines and transactions. */
  public static final String BATCH_EXECUTED = PREFIX + ".batch.executed";

  /** Counter: commands sent inside batches. */
  public static final String BATCH_COMMANDS = PREFIX + ".batch.commands";

  /** Counter: batch slots that carried an error. */
  public static final String BATCH_COMMAND_FAILURES = PREFIX + ".batch.command.failures";

  /** Counter: transactions aborted by a watched key change. */
  public static final String TRANSACTION_ABORTED = PREFIX + ".transaction.aborted";

  // Tag keys
  public static final String TAG_CONNECTION_NAME = "connection.name";
  public static final String TAG_KIND = "kind";
  public static final String TAG_MODE = "mode";
}
