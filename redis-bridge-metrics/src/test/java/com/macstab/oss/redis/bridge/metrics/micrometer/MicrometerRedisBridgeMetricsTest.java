/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.metrics.micrometer;

import static com.macstab.oss.redis.bridge.metrics.micrometer.MetricsConfiguration.*;
import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.macstab.oss.redis.bridge.pubsub.SubscriptionKind;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Tests for {@link MicrometerRedisBridgeMetrics}.
 *
 * <p>{@link SimpleMeterRegistry} per test, values asserted directly on the registry.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@DisplayName("MicrometerRedisBridgeMetrics")
class MicrometerRedisBridgeMetricsTest {

  private SimpleMeterRegistry registry;
  private MicrometerRedisBridgeMetrics metrics;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    metrics = new MicrometerRedisBridgeMetrics(registry, 100);
  }

  @Nested
  @DisplayName("Constructor")
  class ConstructorTests {

    @Test
    @DisplayName("should reject null MeterRegistry")
    void shouldRejectNullMeterRegistry() {
      // Act & Assert
      assertThatNullPointerException()
          .isThrownBy(() -> new MicrometerRedisBridgeMetrics(null, 100))
          .withMessageContaining("MeterRegistry must not be null");
    }

    @Test
    @DisplayName("should reject invalid max cache size")
    void shouldRejectInvalidMaxCacheSize() {
      // Act & Assert
      assertThatIllegalArgumentException()
          .isThrownBy(() -> new MicrometerRedisBridgeMetrics(new SimpleMeterRegistry(), 0))
          .withMessageContaining("maxCacheSize must be > 0");
    }
  }

  @Nested
  @DisplayName("Subscriptions")
  class SubscriptionTests {

    @Test
    @DisplayName("should publish active subscriptions per kind")
    void shouldPublishActiveSubscriptionsPerKind() {
      // Act
      metrics.setActiveSubscriptions("primary", SubscriptionKind.CHANNEL, 3);
      metrics.setActiveSubscriptions("primary", SubscriptionKind.PATTERN, 1);
      metrics.setActiveSubscriptions("primary", SubscriptionKind.CHANNEL, 2);

      // Assert
      assertThat(
              registry
                  .get(SUBSCRIPTIONS_ACTIVE)
                  .tags(TAG_CONNECTION_NAME, "primary", TAG_KIND, "channel")
                  .gauge()
                  .value())
          .isEqualTo(2.0);
      assertThat(
              registry
                  .get(SUBSCRIPTIONS_ACTIVE)
                  .tags(TAG_CONNECTION_NAME, "primary", TAG_KIND, "pattern")
                  .gauge()
                  .value())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should ignore negative counts")
    void shouldIgnoreNegativeCounts() {
      // Act
      metrics.setActiveSubscriptions("primary", SubscriptionKind.CHANNEL, -1);

      // Assert
      assertThat(registry.find(SUBSCRIPTIONS_ACTIVE).gauge()).isNull();
    }

    @Test
    @DisplayName("should count dispatched messages and swaps")
    void shouldCountDispatchedMessagesAndSwaps() {
      // Act
      metrics.recordMessageDispatched("primary", SubscriptionKind.PATTERN);
      metrics.recordMessageDispatched("primary", SubscriptionKind.PATTERN);
      metrics.recordSubscriptionSwap("primary");
      metrics.recordPollFailure("primary");

      // Assert
      assertThat(
              registry
                  .counter(MESSAGES_DISPATCHED, TAG_CONNECTION_NAME, "primary", TAG_KIND, "pattern")
                  .count())
          .isEqualTo(2.0);
      assertThat(registry.counter(SUBSCRIPTION_SWAPS, TAG_CONNECTION_NAME, "primary").count())
          .isEqualTo(1.0);
      assertThat(registry.counter(POLL_FAILURES, TAG_CONNECTION_NAME, "primary").count())
          .isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("Batches")
  class BatchTests {

    @Test
    @DisplayName("should count batches, commands and failures by mode")
    void shouldCountBatchesByMode() {
      // Act
      metrics.recordBatch("primary", "pipeline", 3, 1);
      metrics.recordBatch("primary", "pipeline", 2, 0);
      metrics.recordBatch("primary", "transaction", 4, 0);
      metrics.recordTransactionAborted("primary");

      // Assert
      assertThat(
              registry
                  .counter(BATCH_EXECUTED, TAG_CONNECTION_NAME, "primary", TAG_MODE, "pipeline")
                  .count())
          .isEqualTo(2.0);
      assertThat(
              registry
                  .counter(BATCH_COMMANDS, TAG_CONNECTION_NAME, "primary", TAG_MODE, "pipeline")
                  .count())
          .isEqualTo(5.0);
      assertThat(
              registry
                  .counter(
                      BATCH_COMMAND_FAILURES, TAG_CONNECTION_NAME, "primary", TAG_MODE, "pipeline")
                  .count())
          .isEqualTo(1.0);
      assertThat(
              registry
                  .counter(BATCH_COMMANDS, TAG_CONNECTION_NAME, "primary", TAG_MODE, "transaction")
                  .count())
          .isEqualTo(4.0);
      assertThat(registry.counter(TRANSACTION_ABORTED, TAG_CONNECTION_NAME, "primary").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should not register failure counter for clean batches")
    void shouldNotRegisterFailureCounterForCleanBatches() {
      // Act
      metrics.recordBatch("primary", "pipeline", 2, 0);

      // Assert
      assertThat(registry.find(BATCH_COMMAND_FAILURES).counter()).isNull();
    }
  }

  @Nested
  @DisplayName("Close")
  class CloseTests {

    @Test
    @DisplayName("should remove meters of one connection only")
    void shouldRemoveMetersOfOneConnection() {
      // Arrange
      metrics.setActiveSubscriptions("primary", SubscriptionKind.CHANNEL, 1);
      metrics.recordPollFailure("primary");
      metrics.setActiveSubscriptions("cache", SubscriptionKind.CHANNEL, 4);

      // Act
      metrics.close("primary");

      // Assert
      assertThat(registry.find(SUBSCRIPTIONS_ACTIVE).tag(TAG_CONNECTION_NAME, "primary").gauge())
          .isNull();
      assertThat(registry.find(POLL_FAILURES).tag(TAG_CONNECTION_NAME, "primary").counter())
          .isNull();
      assertThat(
              registry.find(SUBSCRIPTIONS_ACTIVE).tag(TAG_CONNECTION_NAME, "cache").gauge().value())
          .isEqualTo(4.0);
      assertThat(metrics.isClosed()).isFalse();
    }

    @Test
    @DisplayName("should unregister all meters and ignore later calls after close")
    void shouldIgnoreCallsAfterClose() {
      // Arrange
      metrics.recordPollFailure("primary");

      // Act
      metrics.close();
      metrics.recordPollFailure("primary");
      metrics.close();

      // Assert
      assertThat(metrics.isClosed()).isTrue();
      assertThat(metrics.getCacheSize()).isZero();
      assertThat(registry.getMeters()).isEmpty();
    }
  }
}
