/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.metrics.micrometer;

import static com.macstab.oss.redis.bridge.metrics.micrometer.MetricsConfiguration.TAG_CONNECTION_NAME;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Thread-safe cache of the meters registered by {@link MicrometerRedisBridgeMetrics}.
 *
 * <p>Counters are cached by {@code name:tag=value:...} key so the dispatch path does not pay a
 * registry lookup per message. Gauges are backed by an {@link AtomicInteger} held here, which also
 * keeps the value strongly reachable (Micrometer only holds gauge state weakly).
 *
 * <p><strong>Bounded:</strong> at most {@code maxCacheSize} entries. Beyond the bound counters are
 * resolved through the registry on every call and gauge updates are not exported; both cases log a
 * warning.
 *
 * <p><strong>Cleanup:</strong> {@link #removeConnection(String)} unregisters every cached meter
 * tagged with the given {@code connection.name}.
 */
@Slf4j
final class MetricCache {

  private final MeterRegistry registry;
  private final int maxCacheSize;

  private final ConcurrentHashMap<String, Counter> counters;
  private final ConcurrentHashMap<String, GaugeEntry> gauges;
  private final AtomicInteger cacheSize;

  /**
   * Creates metric cache.
   *
   * @param registry Micrometer meter registry
   * @param maxCacheSize maximum cached meters
   * @throws NullPointerException if registry is null
   * @throws IllegalArgumentException if maxCacheSize &lt;= 0
   */
  MetricCache(@NonNull final MeterRegistry registry, final int maxCacheSize) {
    this.registry = Objects.requireNonNull(registry, "MeterRegistry must not be null");

    if (maxCacheSize <= 0) {
      throw new IllegalArgumentException("maxCacheSize must be > 0, got: " + maxCacheSize);
    }

    this.maxCacheSize = maxCacheSize;
    this.counters = new ConcurrentHashMap<>(64);
    this.gauges = new ConcurrentHashMap<>(16);
    this.cacheSize = new AtomicInteger(0);
  }

  /**
   * Gets or registers a counter.
   *
   * @param name meter name
   * @param description meter description
   * @param tagPairs tag key-value pairs [key1, value1, key2, value2, ...]
   * @return counter (cached, or resolved through the registry when the cache is full)
   * @throws IllegalArgumentException if tagPairs length is odd
   */
  Counter counter(final String name, final String description, final String... tagPairs) {
    validateTagPairs(tagPairs);

    final var key = buildKey(name, tagPairs);
    final var cached = counters.get(key);
    if (cached != null) {
      return cached;
    }

    if (cacheSize.get() >= maxCacheSize) {
      log.warn("Metric cache full at {} entries, counter not cached: {}", maxCacheSize, key);
      return createCounter(name, description, tagPairs);
    }

    return counters.computeIfAbsent(
        key,
        k -> {
          cacheSize.incrementAndGet();
          return createCounter(name, description, tagPairs);
        });
  }

  /**
   * Gets or registers the value backing a gauge.
   *
   * @param name meter name
   * @param description meter description
   * @param tagPairs tag key-value pairs [key1, value1, key2, value2, ...]
   * @return value read by the gauge (detached, not exported, when the cache is full)
   * @throws IllegalArgumentException if tagPairs length is odd
   */
  AtomicInteger gaugeValue(final String name, final String description, final String... tagPairs) {
    validateTagPairs(tagPairs);

    final var key = buildKey(name, tagPairs);
    final var cached = gauges.get(key);
    if (cached != null) {
      return cached.getValue();
    }

    if (cacheSize.get() >= maxCacheSize) {
      log.warn("Metric cache full at {} entries, gauge not exported: {}", maxCacheSize, key);
      return new AtomicInteger();
    }

    return gauges
        .computeIfAbsent(
            key,
            k -> {
              cacheSize.incrementAndGet();
              final var value = new AtomicInteger();
              final var gauge =
                  Gauge.builder(name, value, AtomicInteger::get)
                      .description(description)
                      .tags(tagPairs)
                      .register(registry);
              return new GaugeEntry(value, gauge);
            })
        .getValue();
  }

  /**
   * Unregisters and evicts every cached meter tagged with the connection name.
   *
   * @param connectionName connection whose meters are removed
   * @return number of meters removed
   */
  int removeConnection(final String connectionName) {
    final var removed = new AtomicInteger();
    counters.entrySet().removeIf(e -> evictIfOwned(e.getValue(), connectionName, removed));
    gauges.entrySet().removeIf(e -> evictIfOwned(e.getValue().getGauge(), connectionName, removed));

    if (log.isDebugEnabled()) {
      log.debug("Removed {} meters for connection '{}'", removed.get(), connectionName);
    }
    return removed.get();
  }

  /** Unregisters and evicts every cached meter. */
  void clear() {
    counters.values().forEach(registry::remove);
    counters.clear();
    gauges.values().forEach(entry -> registry.remove(entry.getGauge()));
    gauges.clear();
    cacheSize.set(0);
  }

  private boolean evictIfOwned(
      final Meter meter, final String connectionName, final AtomicInteger removed) {
    if (!connectionName.equals(meter.getId().getTag(TAG_CONNECTION_NAME))) {
      return false;
    }
    registry.remove(meter);
    cacheSize.decrementAndGet();
    removed.incrementAndGet();
    return true;
  }

  /** Builds {@code name:key1=value1:key2=value2}. */
  private String buildKey(final String name, final String... tagPairs) {
    final var key = new StringBuilder(32 + tagPairs.length * 12);
    key.append(name);
    for (int i = 0; i < tagPairs.length; i += 2) {
      key.append(':').append(tagPairs[i]).append('=').append(tagPairs[i + 1]);
    }
    return key.toString();
  }

  private Counter createCounter(
      final String name, final String description, final String... tagPairs) {
    return Counter.builder(name).description(description).tags(tagPairs).register(registry);
  }

  private void validateTagPairs(final String... tagPairs) {
    if (tagPairs.length % 2 != 0) {
      throw new IllegalArgumentException(
          "Tag pairs must have even length (key-value pairs), got: " + tagPairs.length);
    }
  }

  int getCacheSize() {
    return cacheSize.get();
  }

  int getMaxCacheSize() {
    return maxCacheSize;
  }

  @Value
  private static class GaugeEntry {
    AtomicInteger value;
    Gauge gauge;
  }
}
