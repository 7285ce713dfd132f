/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.pubsub;

import static lombok.AccessLevel.PRIVATE;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;

/**
 * Authoritative set of channels and patterns the client is subscribed to.
 *
 * <p><strong>Counting:</strong> every mutation returns the number of DISTINCT active entries of the
 * mutated kind, independent of {@link SubscriptionCounting}. With {@link
 * SubscriptionCounting#REFERENCE_COUNTED} an entry subscribed N times needs N removals before it
 * leaves the active set; with {@link SubscriptionCounting#IDEMPOTENT} one removal is enough.
 *
 * <p><strong>Thread safety:</strong> mutations are synchronized. {@link #listActive()} returns a
 * volatile immutable snapshot and never blocks, so the dispatcher can filter on every message
 * without contending with subscribe calls.
 *
 * <p>The registry itself never talks to the server. The {@link ConnectionLifecycleManager} runs
 * each mutation together with the reconcile it triggers and restores a {@link Checkpoint} when the
 * reconcile fails.
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class SubscriptionRegistry {

  SubscriptionCounting counting;
  Map<String, Integer> channels = new LinkedHashMap<>();
  Map<String, Integer> patterns = new LinkedHashMap<>();

  @NonFinal volatile SubscriptionSet snapshot = SubscriptionSet.EMPTY;

  public SubscriptionRegistry() {
    this(SubscriptionCounting.REFERENCE_COUNTED);
  }

  public SubscriptionRegistry(@NonNull final SubscriptionCounting counting) {
    this.counting = counting;
  }

  /**
   * Adds a subscription.
   *
   * @return distinct active entries of the subscription's kind after the add
   */
  public synchronized int add(@NonNull final Subscription subscription) {
    final var entries = entries(subscription.getKind());
    final var references = entries.get(subscription.getName());
    if (references == null) {
      entries.put(subscription.getName(), 1);
      publishSnapshot();
    } else if (counting == SubscriptionCounting.REFERENCE_COUNTED) {
      entries.put(subscription.getName(), references + 1);
    }
    return entries.size();
  }

  /**
   * Removes a subscription. Removing an entry that is not present is a no-op.
   *
   * @return distinct active entries of the subscription's kind after the removal
   */
  public synchronized int remove(@NonNull final Subscription subscription) {
    final var entries = entries(subscription.getKind());
    final var references = entries.get(subscription.getName());
    if (references == null) {
      if (log.isDebugEnabled()) {
        log.debug("Ignoring removal of unknown subscription {}", subscription);
      }
    } else if (references > 1 && counting == SubscriptionCounting.REFERENCE_COUNTED) {
      entries.put(subscription.getName(), references - 1);
    } else {
      entries.remove(subscription.getName());
      publishSnapshot();
    }
    return entries.size();
  }

  /**
   * Removes every entry of one kind regardless of reference counts.
   *
   * @return removed names in subscription order
   */
  public synchronized List<String> removeAll(@NonNull final SubscriptionKind kind) {
    final var entries = entries(kind);
    final List<String> removed = new ArrayList<>(entries.keySet());
    if (!removed.isEmpty()) {
      entries.clear();
      publishSnapshot();
    }
    return removed;
  }

  public SubscriptionSet listActive() {
    return snapshot;
  }

  public boolean isActive(@NonNull final Subscription subscription) {
    return snapshot.contains(subscription);
  }

  public int count(@NonNull final SubscriptionKind kind) {
    return snapshot.size(kind);
  }

  /** Outstanding references for an entry; 0 when it is not subscribed. */
  public synchronized int references(@NonNull final Subscription subscription) {
    return entries(subscription.getKind()).getOrDefault(subscription.getName(), 0);
  }

  public synchronized void clear() {
    channels.clear();
    patterns.clear();
    publishSnapshot();
  }

  public synchronized Checkpoint checkpoint() {
    return new Checkpoint(new LinkedHashMap<>(channels), new LinkedHashMap<>(patterns));
  }

  public synchronized void restore(@NonNull final Checkpoint checkpoint) {
    channels.clear();
    channels.putAll(checkpoint.channels);
    patterns.clear();
    patterns.putAll(checkpoint.patterns);
    publishSnapshot();
  }

  public SubscriptionCounting getCounting() {
    return counting;
  }

  private Map<String, Integer> entries(final SubscriptionKind kind) {
    return kind == SubscriptionKind.PATTERN ? patterns : channels;
  }

  private void publishSnapshot() {
    snapshot = SubscriptionSet.of(channels.keySet(), patterns.keySet());
  }

  /** Copy of the registry state taken before a mutation. */
  public static final class Checkpoint {
    private final Map<String, Integer> channels;
    private final Map<String, Integer> patterns;

    private Checkpoint(final Map<String, Integer> channels, final Map<String, Integer> patterns) {
      this.channels = channels;
      this.patterns = patterns;
    }
  }
}
