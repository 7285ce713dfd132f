/* (C)2026 Macstab GmbH */
/**
 * Transport seam between the bridge and a concrete pull-style Redis client.
 *
 * <p>The bridge only talks to these interfaces. Tests supply an in-memory implementation; the
 * {@code lettuce} package supplies the production one.
 */
package com.macstab.oss.redis.bridge.spi;
