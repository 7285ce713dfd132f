/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.pubsub;

/**
 * How repeated subscriptions to the same channel or pattern are counted by the {@link
 * SubscriptionRegistry}.
 *
 * <p>Either way the server sees a channel at most once and the count returned to callers is the
 * number of DISTINCT active entries.
 */
public enum SubscriptionCounting {

  /** Every subscribe adds a reference; the entry stays active until the same number of unsubscribes. */
  REFERENCE_COUNTED,

  /** Subscribing again is a no-op; a single unsubscribe removes the entry. */
  IDEMPOTENT
}
