/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.spi;

import java.time.Duration;
import java.util.Optional;

import com.macstab.oss.redis.bridge.pubsub.PubSubMessage;
import com.macstab.oss.redis.bridge.pubsub.SubscriptionSet;

/**
 * Pull-style subscription connection with a subscription set fixed at creation.
 *
 * <p>Polled by exactly one worker thread; {@link #close()} may be called from any thread and is
 * idempotent.
 */
public interface SubscriberSession extends AutoCloseable {

  /**
   * Waits at most {@code timeout} for the next message.
   *
   * @return the next message, or empty when none arrived in time
   * @throws com.macstab.oss.redis.bridge.error.SubscriberClosedException once the session is closed
   * @throws InterruptedException if the polling thread is interrupted
   */
  Optional<PubSubMessage> nextMessage(Duration timeout) throws InterruptedException;

  SubscriptionSet getSubscriptions();

  boolean isOpen();

  @Override
  void close();
}
