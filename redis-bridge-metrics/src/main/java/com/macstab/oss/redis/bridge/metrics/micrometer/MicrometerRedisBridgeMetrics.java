/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.metrics.micrometer;

import static com.macstab.oss.redis.bridge.metrics.micrometer.MetricsConfiguration.*;

import java.util.Locale;
import java.util.Objects;

import com.macstab.oss.redis.bridge.metrics.RedisBridgeMetrics;
import com.macstab.oss.redis.bridge.pubsub.SubscriptionKind;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Micrometer implementation of {@link RedisBridgeMetrics} with dimensional tags.
 *
 * <p>One instance may serve several bridge clients: every meter carries the {@code
 * connection.name} tag of the client that reported it.
 *
 * <p><strong>Metrics Published:</strong>
 *
 * <table>
 *   <caption>Metric Summary</caption>
 *   <thead>
 *     <tr><th>Metric</th><th>Type</th><th>Tags</th></tr>
 *   </thead>
 *   <tbody>
 *     <tr><td>{@code redis.bridge.subscriptions.active}</td><td>Gauge</td>
 *         <td>connection.name, kind</td></tr>
 *     <tr><td>{@code redis.bridge.messages.dispatched}</td><td>Counter</td>
 *         <td>connection.name, kind</td></tr>
 *     <tr><td>{@code redis.bridge.poll.failures}</td><td>Counter</td>
 *         <td>connection.name</td></tr>
 *     <tr><td>{@code redis.bridge.subscription.swaps}</td><td>Counter</td>
 *         <td>connection.name</td></tr>
 *     <tr><td>{@code redis.bridge.batch.executed}</td><td>Counter</td>
 *         <td>connection.name, mode</td></tr>
 *     <tr><td>{@code redis.bridge.batch.commands}</td><td>Counter</td>
 *         <td>connection.name, mode</td></tr>
 *     <tr><td>{@code redis.bridge.batch.command.failures}</td><td>Counter</td>
 *         <td>connection.name, mode</td></tr>
 *     <tr><td>{@code redis.bridge.transaction.aborted}</td><td>Counter</td>
 *         <td>connection.name</td></tr>
 *   </tbody>
 * </table>
 *
 * <p><strong>Thread Safety:</strong> all methods may be called concurrently from poll worker and
 * application threads.
 *
 * <p><strong>Memory Management:</strong> {@link #close(String)} unregisters the meters of one
 * connection, {@link #close()} unregisters all of them. Calls after {@link #close()} are ignored.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class MicrometerRedisBridgeMetrics implements RedisBridgeMetrics {

  /** Default bound of {@link MetricCache}. */
  public static final int DEFAULT_MAX_CACHE_SIZE = 1000;

  private final MetricCache cache;

  private volatile boolean closed = false;

  /**
   * Creates Micrometer metrics collector.
   *
   * @param registry Micrometer meter registry
   * @param maxCacheSize maximum cached meters
   * @throws NullPointerException if registry is null
   * @throws IllegalArgumentException if maxCacheSize &lt;= 0
   */
  public MicrometerRedisBridgeMetrics(final MeterRegistry registry, final int maxCacheSize) {
    this.cache =
        new MetricCache(
            Objects.requireNonNull(registry, "MeterRegistry must not be null"), maxCacheSize);

    log.debug("Created MicrometerRedisBridgeMetrics (maxCacheSize: {})", maxCacheSize);
  }

  /**
   * Creates Micrometer metrics collector with the default cache size.
   *
   * @param registry Micrometer meter registry
   */
  public MicrometerRedisBridgeMetrics(@NonNull final MeterRegistry registry) {
    this(registry, DEFAULT_MAX_CACHE_SIZE);
  }

  @Override
  public void setActiveSubscriptions(
      final String connectionName, final SubscriptionKind kind, final int count) {
    if (closed) {
      return;
    }

    if (count < 0) {
      log.warn("Invalid subscription count: {} (negative), skipping metric", count);
      return;
    }

    cache
        .gaugeValue(
            SUBSCRIPTIONS_ACTIVE,
            "Distinct active channel or pattern subscriptions",
            TAG_CONNECTION_NAME,
            connectionName,
            TAG_KIND,
            tagValue(kind))
        .set(count);
  }

  @Override
  public void recordMessageDispatched(final String connectionName, final SubscriptionKind kind) {
    if (closed) {
      return;
    }

    cache
        .counter(
            MESSAGES_DISPATCHED,
            "Listener events produced from received pub/sub messages",
            TAG_CONNECTION_NAME,
            connectionName,
            TAG_KIND,
            tagValue(kind))
        .increment();
  }

  @Override
  public void recordPollFailure(final String connectionName) {
    if (closed) {
      return;
    }

    cache
        .counter(POLL_FAILURES, "Failed subscriber polls", TAG_CONNECTION_NAME, connectionName)
        .increment();
  }

  @Override
  public void recordSubscriptionSwap(final String connectionName) {
    if (closed) {
      return;
    }

    cache
        .counter(
            SUBSCRIPTION_SWAPS,
            "Subscription connection replacements",
            TAG_CONNECTION_NAME,
            connectionName)
        .increment();
  }

  @Override
  public void recordBatch(
      final String connectionName, final String mode, final int commands, final int failures) {
    if (closed) {
      return;
    }

    cache
        .counter(
            BATCH_EXECUTED,
            "Executed pipelines and transactions",
            TAG_CONNECTION_NAME,
            connectionName,
            TAG_MODE,
            mode)
        .increment();

    if (commands > 0) {
      cache
          .counter(
              BATCH_COMMANDS,
              "Commands sent inside pipelines and transactions",
              TAG_CONNECTION_NAME,
              connectionName,
              TAG_MODE,
              mode)
          .increment(commands);
    }

    if (failures > 0) {
      cache
          .counter(
              BATCH_COMMAND_FAILURES,
              "Batch result slots carrying an error",
              TAG_CONNECTION_NAME,
              connectionName,
              TAG_MODE,
              mode)
          .increment(failures);
    }
  }

  @Override
  public void recordTransactionAborted(final String connectionName) {
    if (closed) {
      return;
    }

    cache
        .counter(
            TRANSACTION_ABORTED,
            "Transactions aborted because a watched key changed",
            TAG_CONNECTION_NAME,
            connectionName)
        .increment();
  }

  @Override
  public void close(final String connectionName) {
    if (closed) {
      return;
    }

    try {
      final var removed = cache.removeConnection(connectionName);
      log.info("Removed {} bridge meters for connection '{}'", removed, connectionName);
    } catch (final RuntimeException e) {
      // called from client cleanup, must not throw
      log.error("Error during metrics cleanup for connection '{}'", connectionName, e);
    }
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;

    try {
      cache.clear();
    } catch (final RuntimeException e) {
      log.error("Error during metrics cleanup", e);
    }
  }

  boolean isClosed() {
    return closed;
  }

  int getCacheSize() {
    return cache.getCacheSize();
  }

  private static String tagValue(final SubscriptionKind kind) {
    return kind.name().toLowerCase(Locale.ROOT);
  }
}
