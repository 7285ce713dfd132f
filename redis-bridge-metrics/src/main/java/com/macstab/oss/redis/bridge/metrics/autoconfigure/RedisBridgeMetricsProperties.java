/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.metrics.autoconfigure;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.macstab.oss.redis.bridge.metrics.micrometer.MicrometerRedisBridgeMetrics;

import lombok.Data;

/**
 * Configuration properties for bridge metrics.
 *
 * <pre>{@code
 * management:
 *   metrics:
 *     redis-bridge:
 *       enabled: true
 *       max-cache-size: 1000
 * }</pre>
 */
@Data
@ConfigurationProperties(prefix = "management.metrics.redis-bridge")
public class RedisBridgeMetricsProperties {

  /** Publish bridge meters when a {@code MeterRegistry} is present. */
  private boolean enabled = true;

  /** Upper bound of cached meters (counters and gauges across all connections). */
  private int maxCacheSize = MicrometerRedisBridgeMetrics.DEFAULT_MAX_CACHE_SIZE;
}
