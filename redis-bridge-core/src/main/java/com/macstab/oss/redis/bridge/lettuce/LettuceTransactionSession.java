/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.lettuce;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

import com.macstab.oss.redis.bridge.command.QueuedCommand;
import com.macstab.oss.redis.bridge.command.WatchSet;
import com.macstab.oss.redis.bridge.command.WatchToken;
import com.macstab.oss.redis.bridge.error.CommandException;
import com.macstab.oss.redis.bridge.error.ErrorClassifier;
import com.macstab.oss.redis.bridge.spi.TransactionSession;

import io.lettuce.core.RedisCommandExecutionException;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisFuture;
import io.lettuce.core.api.StatefulRedisConnection;
import lombok.extern.slf4j.Slf4j;

/**
 * {@code WATCH}/{@code MULTI}/{@code EXEC} on a dedicated Lettuce connection.
 *
 * <p>The server checks the watched keys when it runs {@code EXEC}; the {@link WatchSet} tokens are
 * all {@link WatchToken#isServerTracked() server tracked}.
 */
@Slf4j
final class LettuceTransactionSession implements TransactionSession {

  private final StatefulRedisConnection<String, String> connection;

  LettuceTransactionSession(final StatefulRedisConnection<String, String> connection) {
    this.connection = connection;
  }

  @Override
  public WatchToken watch(final String key) {
    try {
      connection.sync().watch(key);
      return WatchToken.serverTracked(key);
    } catch (RedisException e) {
      throw LettuceCommands.translate(e);
    }
  }

  @Override
  public void unwatch() {
    try {
      connection.sync().unwatch();
    } catch (RedisException e) {
      throw LettuceCommands.translate(e);
    }
  }

  @Override
  public Optional<List<Object>> exec(final WatchSet watchSet, final List<QueuedCommand> commands) {
    final var sync = connection.sync();
    final var async = connection.async();
    final List<RedisFuture<Object>> futures = new ArrayList<>(commands.size());

    try {
      sync.multi();
      for (final var command : commands) {
        futures.add(
            async.dispatch(
                LettuceCommands.keyword(command), new ReplyOutput(), LettuceCommands.args(command)));
      }
      final var result = sync.exec();
      if (result.wasDiscarded()) {
        return Optional.empty();
      }
    } catch (RedisCommandExecutionException e) {
      return Optional.of(abortedOutcomes(futures, new CommandException(e.getMessage(), e)));
    } catch (RedisException e) {
      throw LettuceCommands.translate(e);
    }

    final long deadline = System.nanoTime() + connection.getTimeout().toNanos();
    final List<Object> outcomes = new ArrayList<>(futures.size());
    for (final var future : futures) {
      outcomes.add(LettuceCommands.await(future, deadline));
    }
    return Optional.of(outcomes);
  }

  /**
   * {@code EXECABORT}: nothing was applied. Commands rejected at queue time keep their own error,
   * every other slot carries the abort error.
   */
  private List<Object> abortedOutcomes(
      final List<RedisFuture<Object>> futures, final CommandException abort) {
    final List<Object> outcomes = new ArrayList<>(futures.size());
    for (final var future : futures) {
      outcomes.add(queueTimeError(future).orElse(abort));
    }
    return outcomes;
  }

  private Optional<Object> queueTimeError(final RedisFuture<Object> future) {
    if (!future.isDone() || future.isCancelled()) {
      future.cancel(false);
      return Optional.empty();
    }
    try {
      future.get();
      return Optional.empty();
    } catch (ExecutionException e) {
      return Optional.of(LettuceCommands.translate(e.getCause() != null ? e.getCause() : e));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return Optional.empty();
    }
  }

  @Override
  public void close() {
    try {
      connection.close();
    } catch (RedisException e) {
      log.warn("Closing transaction connection failed: {}", ErrorClassifier.format(e));
    }
  }
}
