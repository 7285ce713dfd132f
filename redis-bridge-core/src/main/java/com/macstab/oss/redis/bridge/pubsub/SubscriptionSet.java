/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.pubsub;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Immutable snapshot of the channels and patterns a subscription connection must carry.
 *
 * <p>Iteration order is subscription order. Equality ignores order, so a reordered but otherwise
 * identical set does not trigger a reconnect.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class SubscriptionSet {

  public static final SubscriptionSet EMPTY = new SubscriptionSet(Set.of(), Set.of());

  private final Set<String> channels;
  private final Set<String> patterns;

  private SubscriptionSet(final Set<String> channels, final Set<String> patterns) {
    this.channels = channels;
    this.patterns = patterns;
  }

  public static SubscriptionSet of(
      @NonNull final Collection<String> channels, @NonNull final Collection<String> patterns) {
    if (channels.isEmpty() && patterns.isEmpty()) {
      return EMPTY;
    }
    return new SubscriptionSet(
        Collections.unmodifiableSet(new LinkedHashSet<>(channels)),
        Collections.unmodifiableSet(new LinkedHashSet<>(patterns)));
  }

  public boolean isEmpty() {
    return channels.isEmpty() && patterns.isEmpty();
  }

  public boolean contains(@NonNull final Subscription subscription) {
    return subscription.isPattern()
        ? patterns.contains(subscription.getName())
        : channels.contains(subscription.getName());
  }

  public int size(@NonNull final SubscriptionKind kind) {
    return kind == SubscriptionKind.PATTERN ? patterns.size() : channels.size();
  }
}
