/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.metrics;

import com.macstab.oss.redis.bridge.pubsub.SubscriptionKind;

/**
 * Metrics SPI for the bridge (framework-independent, no Micrometer dependency).
 *
 * <p>All methods are default no-ops. The core library never holds a {@code null} collector: when
 * none is supplied it uses {@link #NOOP}. The {@code redis-bridge-metrics} module provides a
 * Micrometer implementation.
 *
 * <p><strong>Thread safety:</strong> implementations MUST be thread-safe. Dispatch counters are
 * called from poll worker threads, batch counters from application threads.
 *
 * <p><strong>Dimensional tags:</strong> every method takes the client's {@code connectionName} so
 * several bridge clients can share one registry.
 */
public interface RedisBridgeMetrics extends AutoCloseable {

  /** No-op singleton instance (uses default methods). */
  RedisBridgeMetrics NOOP = new RedisBridgeMetrics() {};

  /**
   * Reports the number of distinct active subscriptions of one kind.
   *
   * <p><strong>Metric Type:</strong> Gauge. <strong>Expected name:</strong> {@code
   * redis.bridge.subscriptions.active}, tags {@code connection.name}, {@code kind}.
   *
   * @param connectionName client connection name
   * @param kind channel or pattern
   * @param count distinct active entries after the mutation
   */
  default void setActiveSubscriptions(String connectionName, SubscriptionKind kind, int count) {
    // No-op by default
  }

  /**
   * Records one listener event produced by the dispatcher ({@code message} or {@code pmessage}).
   *
   * <p><strong>Metric Type:</strong> Counter. <strong>Expected name:</strong> {@code
   * redis.bridge.messages.dispatched}, tags {@code connection.name}, {@code kind}.
   */
  default void recordMessageDispatched(String connectionName, SubscriptionKind kind) {
    // No-op by default
  }

  /**
   * Records a failed poll of a subscriber session.
   *
   * <p><strong>Metric Type:</strong> Counter. <strong>Expected name:</strong> {@code
   * redis.bridge.poll.failures}.
   */
  default void recordPollFailure(String connectionName) {
    // No-op by default
  }

  /**
   * Records a swap of the current subscription connection (subscription change or rebuild).
   *
   * <p><strong>Metric Type:</strong> Counter. <strong>Expected name:</strong> {@code
   * redis.bridge.subscription.swaps}.
   */
  default void recordSubscriptionSwap(String connectionName) {
    // No-op by default
  }

  /**
   * Records one executed batch.
   *
   * <p><strong>Metric Type:</strong> Counters. <strong>Expected names:</strong> {@code
   * redis.bridge.batch.executed}, {@code redis.bridge.batch.commands} and {@code
   * redis.bridge.batch.command.failures}, tags {@code connection.name}, {@code mode}.
   *
   * @param connectionName client connection name
   * @param mode {@code "pipeline"} or {@code "transaction"}
   * @param commands number of commands sent
   * @param failures number of commands whose result slot carries an error
   */
  default void recordBatch(String connectionName, String mode, int commands, int failures) {
    // No-op by default
  }

  /**
   * Records a transaction aborted because a watched key changed.
   *
   * <p><strong>Metric Type:</strong> Counter. <strong>Expected name:</strong> {@code
   * redis.bridge.transaction.aborted}.
   */
  default void recordTransactionAborted(String connectionName) {
    // No-op by default
  }

  /**
   * Removes gauges registered for a connection.
   *
   * <p>Called from {@code RedisBridgeClient.cleanup()}. Gauges hold strong references in the
   * registry, so skipping this leaks them.
   */
  default void close(String connectionName) {
    // No-op by default
  }

  @Override
  default void close() {
    // No-op by default
  }
}
