/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.lettuce;

import java.util.ArrayList;
import java.util.List;

import com.macstab.oss.redis.bridge.command.QueuedCommand;
import com.macstab.oss.redis.bridge.error.ConnectionException;
import com.macstab.oss.redis.bridge.spi.CommandConnection;
import com.macstab.oss.redis.bridge.spi.TransactionSession;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisFuture;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.codec.StringCodec;
import lombok.extern.slf4j.Slf4j;

/**
 * Shared command connection. Lettuce multiplexes concurrent callers on one connection, so no
 * locking is needed here.
 */
@Slf4j
final class LettuceCommandConnection implements CommandConnection {

  private final RedisClient client;
  private final StatefulRedisConnection<String, String> connection;

  LettuceCommandConnection(
      final RedisClient client, final StatefulRedisConnection<String, String> connection) {
    this.client = client;
    this.connection = connection;
  }

  @Override
  public Object execute(final QueuedCommand command) {
    ensureOpen();
    try {
      return connection
          .sync()
          .dispatch(
              LettuceCommands.keyword(command), new ReplyOutput(), LettuceCommands.args(command));
    } catch (RedisException e) {
      throw LettuceCommands.translate(e);
    }
  }

  @Override
  public List<Object> executeBatch(final List<QueuedCommand> commands) {
    ensureOpen();
    final var async = connection.async();
    final List<RedisFuture<Object>> futures = new ArrayList<>(commands.size());
    try {
      for (final var command : commands) {
        futures.add(
            async.dispatch(
                LettuceCommands.keyword(command), new ReplyOutput(), LettuceCommands.args(command)));
      }
    } catch (RedisException e) {
      throw LettuceCommands.translate(e);
    }

    final long deadline = System.nanoTime() + connection.getTimeout().toNanos();
    final List<Object> outcomes = new ArrayList<>(futures.size());
    for (final var future : futures) {
      outcomes.add(LettuceCommands.await(future, deadline));
    }
    return outcomes;
  }

  @Override
  public TransactionSession openTransaction() {
    ensureOpen();
    try {
      return new LettuceTransactionSession(client.connect(StringCodec.UTF8));
    } catch (RedisException e) {
      throw new ConnectionException("Failed to open transaction connection", e);
    }
  }

  @Override
  public boolean isOpen() {
    return connection.isOpen();
  }

  @Override
  public void close() {
    connection.close();
    log.debug("Command connection closed");
  }

  private void ensureOpen() {
    if (!connection.isOpen()) {
      throw new ConnectionException("Connection is closed");
    }
  }
}
