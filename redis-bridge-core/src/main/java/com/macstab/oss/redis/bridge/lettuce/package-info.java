/* (C)2026 Macstab GmbH */
/**
 * Lettuce implementation of the transport SPI.
 *
 * <p>Entry point is {@link com.macstab.oss.redis.bridge.lettuce.LettuceRedisTransport}; every
 * other class is package private.
 */
package com.macstab.oss.redis.bridge.lettuce;
