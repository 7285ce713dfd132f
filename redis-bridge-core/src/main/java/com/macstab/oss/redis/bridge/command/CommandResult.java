/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.command;

import com.macstab.oss.redis.bridge.error.RedisBridgeException;

import lombok.NonNull;
import lombok.Value;

/**
 * Per-command slot of a pipeline or transaction result: either an error or a value, never both.
 *
 * <p>{@code error} is usually a {@link com.macstab.oss.redis.bridge.error.CommandException}; a
 * command that timed out in the middle of a batch carries a {@link
 * com.macstab.oss.redis.bridge.error.ConnectionException}.
 */
@Value
public class CommandResult {

  RedisBridgeException error;
  Object value;

  public static CommandResult success(final Object value) {
    return new CommandResult(null, value);
  }

  public static CommandResult failure(@NonNull final RedisBridgeException error) {
    return new CommandResult(error, null);
  }

  public boolean isSuccess() {
    return error == null;
  }
}
