/* (C)2026 Macstab GmbH */
/**
 * Push-style Redis client API ({@link com.macstab.oss.redis.bridge.RedisBridgeClient}) over a
 * pull-style transport.
 *
 * <p>Sub-packages:
 *
 * <ul>
 *   <li>{@code pubsub}: subscription registry, subscription connection lifecycle, polling and
 *       dispatch
 *   <li>{@code command}: pipelines and optimistic transactions
 *   <li>{@code spi}: transport seam; {@code lettuce}: Lettuce implementation
 *   <li>{@code error}, {@code metrics}: exception hierarchy and metrics SPI
 * </ul>
 */
package com.macstab.oss.redis.bridge;
