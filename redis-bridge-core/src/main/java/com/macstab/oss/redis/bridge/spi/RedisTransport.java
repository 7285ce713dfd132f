/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.spi;

import java.time.Duration;

import com.macstab.oss.redis.bridge.pubsub.SubscriptionSet;

/**
 * Pull-style Redis client the bridge mediates.
 *
 * <p>A transport opens two kinds of connections:
 *
 * <ul>
 *   <li>{@link CommandConnection}: regular commands, batches, publishing
 *   <li>{@link SubscriberSession}: a subscription set fixed at creation; messages are pulled with
 *       a bounded wait
 * </ul>
 *
 * <p>Implementations must be thread-safe. {@code com.macstab.oss.redis.bridge.lettuce} provides
 * the Lettuce-backed transport.
 */
public interface RedisTransport {

  /**
   * Opens a command connection.
   *
   * @throws com.macstab.oss.redis.bridge.error.ConnectionException if the server is unreachable
   */
  CommandConnection connect();

  /**
   * Opens a subscriber session carrying exactly {@code subscriptions} and waits until the server
   * confirmed every subscription.
   *
   * @param subscriptions non-empty subscription set
   * @param readyTimeout upper bound for connect plus subscribe confirmation
   * @throws com.macstab.oss.redis.bridge.error.ConnectionException if the session is not ready in
   *     time
   */
  SubscriberSession openSubscriber(SubscriptionSet subscriptions, Duration readyTimeout);
}
