/* (C)2026 Macstab GmbH */

/**
 * Spring Boot 3 integration for the Redis bridge.
 *
 * <h2>Quick Start</h2>
 *
 * <pre>{@code
 * spring:
 *   data:
 *     redis:
 *       host: localhost
 *       port: 6379
 * redis:
 *   bridge:
 *     connection-name: events
 * }</pre>
 *
 * <p>Inject {@link com.macstab.oss.redis.bridge.RedisBridgeClient} and register a {@link
 * com.macstab.oss.redis.bridge.pubsub.PubSubListener}. Add {@code redis-bridge-metrics} for
 * Micrometer meters.
 */
package com.macstab.oss.redis.bridge.spring3;
