/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.lettuce;

import java.time.Duration;

import com.macstab.oss.redis.bridge.error.ConnectionException;
import com.macstab.oss.redis.bridge.pubsub.SubscriptionSet;
import com.macstab.oss.redis.bridge.spi.CommandConnection;
import com.macstab.oss.redis.bridge.spi.RedisTransport;
import com.macstab.oss.redis.bridge.spi.SubscriberSession;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.codec.StringCodec;
import io.lettuce.core.protocol.ProtocolVersion;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link RedisTransport} backed by a Lettuce {@link RedisClient}.
 *
 * <p><strong>Client options:</strong> the client is switched to RESP2, so pub/sub messages arrive
 * on dedicated subscriber connections, and to {@code REJECT_COMMANDS} while disconnected, so a
 * broken connection fails batches fast instead of buffering them. Other options the caller set are
 * kept.
 *
 * <p>The transport does not own the {@link RedisClient}; shutting it down is the caller's job.
 */
@Slf4j
public final class LettuceRedisTransport implements RedisTransport {

  private final RedisClient client;

  public LettuceRedisTransport(@NonNull final RedisClient client) {
    this.client = client;
    configureClientOptions();
  }

  private void configureClientOptions() {
    final var existing = client.getOptions();
    final var builder = existing != null ? existing.mutate() : ClientOptions.builder();
    client.setOptions(
        builder
            .protocolVersion(ProtocolVersion.RESP2)
            .autoReconnect(true)
            .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
            .build());
    log.debug("Configured Lettuce client for bridge use (RESP2, REJECT_COMMANDS)");
  }

  @Override
  public CommandConnection connect() {
    try {
      return new LettuceCommandConnection(client, client.connect(StringCodec.UTF8));
    } catch (RedisException e) {
      throw new ConnectionException("Failed to connect to Redis: " + e.getMessage(), e);
    }
  }

  @Override
  public SubscriberSession openSubscriber(
      @NonNull final SubscriptionSet subscriptions, @NonNull final Duration readyTimeout) {
    if (subscriptions.isEmpty()) {
      throw new IllegalArgumentException("A subscriber session needs at least one subscription");
    }
    return LettuceSubscriberSession.open(client, subscriptions, readyTimeout);
  }
}
