/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.pubsub;

/**
 * Push-style pub/sub callbacks.
 *
 * <p>All methods are default no-ops; implement only the events of interest. Message callbacks run
 * on the poll worker thread of the subscription connection, one message at a time, so a slow
 * listener delays the next poll (queue depth effectively 1). Subscription callbacks run on the
 * thread that called {@code subscribe}/{@code unsubscribe}.
 *
 * <p>For every delivery the string callback runs first, then the buffer callback with the raw
 * payload bytes. Exceptions thrown by a listener are logged and do not affect other listeners.
 */
public interface PubSubListener {

  /** Exact channel delivery ({@code message} event). */
  default void onMessage(String channel, String message) {}

  /** Exact channel delivery with the raw payload ({@code messageBuffer} event). */
  default void onMessageBuffer(String channel, byte[] message) {}

  /** Pattern delivery ({@code pmessage} event). */
  default void onPatternMessage(String pattern, String channel, String message) {}

  /** Pattern delivery with the raw payload ({@code pmessageBuffer} event). */
  default void onPatternMessageBuffer(String pattern, String channel, byte[] message) {}

  default void onSubscribe(String channel, int count) {}

  default void onUnsubscribe(String channel, int count) {}

  default void onPatternSubscribe(String pattern, int count) {}

  default void onPatternUnsubscribe(String pattern, int count) {}

  /** Background failure ({@code error} event). */
  default void onError(Throwable error) {}
}
