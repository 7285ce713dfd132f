/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.metrics.autoconfigure;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import com.macstab.oss.redis.bridge.metrics.RedisBridgeMetrics;
import com.macstab.oss.redis.bridge.metrics.micrometer.MicrometerRedisBridgeMetrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Auto-configuration for bridge metrics.
 *
 * <p><strong>Activation:</strong>
 *
 * <ul>
 *   <li>Micrometer on the classpath and a {@link MeterRegistry} bean present
 *   <li>{@code management.metrics.redis-bridge.enabled} not {@code false}
 *   <li>No user-defined {@link RedisBridgeMetrics} bean
 * </ul>
 *
 * <p>Otherwise {@link RedisBridgeMetrics#NOOP} is registered so the client configuration always
 * finds a collector.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
@AutoConfiguration(
    afterName =
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(MeterRegistry.class)
@EnableConfigurationProperties(RedisBridgeMetricsProperties.class)
public class RedisBridgeMetricsAutoConfiguration {

  /**
   * Micrometer collector.
   *
   * <p>Destroyed with the context: {@code close()} unregisters every bridge meter.
   */
  @Bean(destroyMethod = "close")
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnProperty(
      prefix = "management.metrics.redis-bridge",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean(RedisBridgeMetrics.class)
  public RedisBridgeMetrics micrometerRedisBridgeMetrics(
      final MeterRegistry registry, final RedisBridgeMetricsProperties properties) {

    log.info(
        "Activating Redis bridge metrics (Micrometer) - maxCacheSize: {}",
        properties.getMaxCacheSize());

    return new MicrometerRedisBridgeMetrics(registry, properties.getMaxCacheSize());
  }

  /** Fallback when Micrometer metrics are disabled or no registry exists. */
  @Bean
  @ConditionalOnMissingBean(RedisBridgeMetrics.class)
  public RedisBridgeMetrics noOpRedisBridgeMetrics() {
    log.debug("Redis bridge metrics disabled - using NOOP singleton");
    return RedisBridgeMetrics.NOOP;
  }
}
