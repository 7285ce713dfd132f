/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.pubsub;

import lombok.NonNull;
import lombok.Value;

/** A single exact-channel or pattern subscription. */
@Value
public class Subscription {

  @NonNull SubscriptionKind kind;
  @NonNull String name;

  public static Subscription channel(final String channel) {
    return new Subscription(SubscriptionKind.CHANNEL, channel);
  }

  public static Subscription pattern(final String pattern) {
    return new Subscription(SubscriptionKind.PATTERN, pattern);
  }

  public boolean isPattern() {
    return kind == SubscriptionKind.PATTERN;
  }
}
