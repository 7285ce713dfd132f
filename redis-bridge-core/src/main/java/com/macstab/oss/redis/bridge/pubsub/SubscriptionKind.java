/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.pubsub;

/** Exact channel subscription ({@code SUBSCRIBE}) or glob pattern subscription ({@code PSUBSCRIBE}). */
public enum SubscriptionKind {
  CHANNEL,
  PATTERN
}
