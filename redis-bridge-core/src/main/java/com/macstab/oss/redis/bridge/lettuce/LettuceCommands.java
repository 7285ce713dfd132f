/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.lettuce;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.macstab.oss.redis.bridge.command.QueuedCommand;
import com.macstab.oss.redis.bridge.error.CommandException;
import com.macstab.oss.redis.bridge.error.ConnectionException;
import com.macstab.oss.redis.bridge.error.RedisBridgeException;

import io.lettuce.core.RedisCommandExecutionException;
import io.lettuce.core.RedisCommandInterruptedException;
import io.lettuce.core.RedisCommandTimeoutException;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisFuture;
import io.lettuce.core.codec.StringCodec;
import io.lettuce.core.protocol.CommandArgs;
import io.lettuce.core.protocol.ProtocolKeyword;
import lombok.experimental.UtilityClass;

/** Conversions between queued commands, Lettuce commands and bridge exceptions. */
@UtilityClass
class LettuceCommands {

  ProtocolKeyword keyword(final QueuedCommand command) {
    return new RawKeyword(command.getName());
  }

  CommandArgs<String, String> args(final QueuedCommand command) {
    final var args = new CommandArgs<>(StringCodec.UTF8);
    for (final var arg : command.getArgs()) {
      if (arg instanceof byte[]) {
        args.add((byte[]) arg);
      } else {
        args.add((String) arg);
      }
    }
    return args;
  }

  /**
   * Waits for one reply of a batch.
   *
   * @return the reply value, or the translated failure as a per-slot outcome
   * @throws ConnectionException if the waiting thread is interrupted
   */
  Object await(final RedisFuture<?> future, final long deadlineNanos) {
    final long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
    try {
      return future.get(remaining, TimeUnit.NANOSECONDS);
    } catch (ExecutionException e) {
      return translate(e.getCause() != null ? e.getCause() : e);
    } catch (CancellationException e) {
      return new ConnectionException("Command was cancelled", e);
    } catch (TimeoutException e) {
      future.cancel(false);
      return new ConnectionException("Command timed out waiting for its reply", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ConnectionException("Interrupted while waiting for replies", e);
    }
  }

  RedisBridgeException translate(final Throwable error) {
    if (error instanceof RedisBridgeException) {
      return (RedisBridgeException) error;
    }
    if (error instanceof RedisCommandExecutionException) {
      return new CommandException(error.getMessage(), error);
    }
    if (error instanceof RedisCommandTimeoutException) {
      return new ConnectionException("Command timed out: " + error.getMessage(), error);
    }
    if (error instanceof RedisCommandInterruptedException) {
      Thread.currentThread().interrupt();
      return new ConnectionException("Command interrupted", error);
    }
    if (error instanceof RedisException) {
      return new ConnectionException(error.getMessage(), error);
    }
    return new RedisBridgeException(String.valueOf(error.getMessage()), error);
  }
}
