/* (C)2026 Macstab GmbH */

/**
 * Micrometer binding of the bridge metrics SPI.
 *
 * <p>Add {@code redis-bridge-metrics} next to the starter; with Spring Boot Actuator on the
 * classpath the meters appear under {@code redis.bridge.*} (Prometheus: {@code redis_bridge_*}).
 * Without Spring, construct {@link
 * com.macstab.oss.redis.bridge.metrics.micrometer.MicrometerRedisBridgeMetrics} and pass it to
 * {@code RedisBridgeClient}.
 */
package com.macstab.oss.redis.bridge.metrics.micrometer;
