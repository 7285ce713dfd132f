/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.spring3;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.macstab.oss.redis.bridge.RedisBridgeOptions;
import com.macstab.oss.redis.bridge.pubsub.SubscriptionCounting;

import lombok.Data;

/**
 * Bridge client configuration under {@code redis.bridge.*}.
 *
 * <p>Server coordinates (host, port, credentials, database, SSL, timeouts) come from Spring Boot's
 * {@code spring.data.redis.*}; this class only carries the bridge's own tuning.
 *
 * <pre>{@code
 * redis:
 *   bridge:
 *     connection-name: events
 *     poll-timeout: 100ms
 *     subscription-counting: reference-counted
 * }</pre>
 *
 * @see RedisBridgeOptions
 */
@Data
@ConfigurationProperties(prefix = "redis.bridge")
public class RedisBridgeProperties {

  /** Enables the bridge auto-configuration. */
  private boolean enabled = true;

  /** Name used in logs, thread names and the {@code connection.name} metric tag. */
  private String connectionName = RedisBridgeOptions.DEFAULT_CONNECTION_NAME;

  /** Maximum wait of one subscriber poll. */
  private Duration pollTimeout = RedisBridgeOptions.DEFAULT_POLL_TIMEOUT;

  /** Maximum wait for a new subscriber connection to confirm its subscriptions. */
  private Duration readyTimeout = RedisBridgeOptions.DEFAULT_READY_TIMEOUT;

  /** Maximum wait for a replaced poll worker to stop. */
  private Duration retireTimeout = RedisBridgeOptions.DEFAULT_RETIRE_TIMEOUT;

  /** Consecutive poll failures before an error event is emitted. */
  private int maxConsecutivePollFailures = RedisBridgeOptions.DEFAULT_MAX_CONSECUTIVE_POLL_FAILURES;

  /** Base back-off after a failed poll, multiplied by the consecutive failure count. */
  private Duration pollFailureBackoff = RedisBridgeOptions.DEFAULT_POLL_FAILURE_BACKOFF;

  /** Whether repeated subscribes to one channel need as many unsubscribes. */
  private SubscriptionCounting subscriptionCounting = SubscriptionCounting.REFERENCE_COUNTED;

  /** Open the publish connection on the first command instead of requiring connect(). */
  private boolean autoConnect = true;

  /**
   * Converts to validated core options.
   *
   * @return options for {@code RedisBridgeClient}
   * @throws IllegalArgumentException if a value is out of range
   */
  public RedisBridgeOptions toOptions() {
    return RedisBridgeOptions.builder()
        .connectionName(connectionName)
        .pollTimeout(pollTimeout)
        .readyTimeout(readyTimeout)
        .retireTimeout(retireTimeout)
        .maxConsecutivePollFailures(maxConsecutivePollFailures)
        .pollFailureBackoff(pollFailureBackoff)
        .subscriptionCounting(subscriptionCounting)
        .autoConnect(autoConnect)
        .build()
        .validate();
  }
}
