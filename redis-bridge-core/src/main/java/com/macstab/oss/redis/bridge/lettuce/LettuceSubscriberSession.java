/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.lettuce;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import com.macstab.oss.redis.bridge.error.ConnectionException;
import com.macstab.oss.redis.bridge.error.ErrorClassifier;
import com.macstab.oss.redis.bridge.error.SubscriberClosedException;
import com.macstab.oss.redis.bridge.pubsub.PubSubMessage;
import com.macstab.oss.redis.bridge.pubsub.SubscriptionSet;
import com.macstab.oss.redis.bridge.spi.SubscriberSession;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.codec.ByteArrayCodec;
import io.lettuce.core.pubsub.RedisPubSubAdapter;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import lombok.extern.slf4j.Slf4j;

/**
 * Pull view of a Lettuce pub/sub connection.
 *
 * <p>Lettuce pushes messages into a listener on its event loop; the listener only appends them to
 * an unbounded inbox which {@link #nextMessage(Duration)} drains. Each frame keeps the route Redis
 * gave it ({@code message} or {@code pmessage}), so overlapping exact and pattern subscriptions
 * yield one message per subscription.
 *
 * <p>Construction blocks until the server confirmed every {@code SUBSCRIBE}/{@code PSUBSCRIBE} or
 * the ready timeout elapsed.
 */
@Slf4j
final class LettuceSubscriberSession implements SubscriberSession {

  private final StatefulRedisPubSubConnection<byte[], byte[]> connection;
  private final SubscriptionSet subscriptions;
  private final BlockingQueue<PubSubMessage> inbox = new LinkedBlockingQueue<>();
  private final AtomicBoolean closed = new AtomicBoolean();

  private LettuceSubscriberSession(
      final StatefulRedisPubSubConnection<byte[], byte[]> connection,
      final SubscriptionSet subscriptions) {
    this.connection = connection;
    this.subscriptions = subscriptions;
  }

  static LettuceSubscriberSession open(
      final RedisClient client, final SubscriptionSet subscriptions, final Duration readyTimeout) {
    final StatefulRedisPubSubConnection<byte[], byte[]> connection;
    try {
      connection = client.connectPubSub(ByteArrayCodec.INSTANCE);
    } catch (RedisException e) {
      throw new ConnectionException("Failed to open subscription connection", e);
    }

    final var session = new LettuceSubscriberSession(connection, subscriptions);
    try {
      connection.setTimeout(readyTimeout);
      session.subscribeAll();
      return session;
    } catch (RuntimeException e) {
      session.close();
      throw new ConnectionException(
          "Subscription connection did not become ready: " + ErrorClassifier.format(e), e);
    }
  }

  private void subscribeAll() {
    connection.addListener(new InboxListener());
    final var commands = connection.sync();
    if (!subscriptions.getChannels().isEmpty()) {
      commands.subscribe(encode(subscriptions.getChannels()));
    }
    if (!subscriptions.getPatterns().isEmpty()) {
      commands.psubscribe(encode(subscriptions.getPatterns()));
    }
    if (log.isDebugEnabled()) {
      log.debug("Subscriber session ready for {}", subscriptions);
    }
  }

  @Override
  public Optional<PubSubMessage> nextMessage(final Duration timeout) throws InterruptedException {
    if (closed.get() && inbox.isEmpty()) {
      throw new SubscriberClosedException("Subscription connection closed");
    }
    final var message = inbox.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    if (message != null) {
      return Optional.of(message);
    }
    if (closed.get() || !connection.isOpen()) {
      throw new SubscriberClosedException("Subscription connection closed");
    }
    return Optional.empty();
  }

  @Override
  public SubscriptionSet getSubscriptions() {
    return subscriptions;
  }

  @Override
  public boolean isOpen() {
    return !closed.get() && connection.isOpen();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    try {
      connection.close();
    } catch (RedisException e) {
      log.warn("Closing subscriber connection failed: {}", ErrorClassifier.format(e));
    }
  }

  private static byte[][] encode(final Collection<String> names) {
    final var encoded = new byte[names.size()][];
    int i = 0;
    for (final var name : names) {
      encoded[i++] = name.getBytes(StandardCharsets.UTF_8);
    }
    return encoded;
  }

  private static String decode(final byte[] bytes) {
    return new String(bytes, StandardCharsets.UTF_8);
  }

  private final class InboxListener extends RedisPubSubAdapter<byte[], byte[]> {

    @Override
    public void message(final byte[] channel, final byte[] message) {
      inbox.offer(PubSubMessage.channel(decode(channel), message));
    }

    @Override
    public void message(final byte[] pattern, final byte[] channel, final byte[] message) {
      inbox.offer(PubSubMessage.pattern(decode(pattern), decode(channel), message));
    }
  }
}
