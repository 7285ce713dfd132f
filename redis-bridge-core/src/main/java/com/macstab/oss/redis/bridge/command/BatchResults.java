/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.command;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.macstab.oss.redis.bridge.error.CommandException;
import com.macstab.oss.redis.bridge.error.RedisBridgeException;

import lombok.experimental.UtilityClass;

/** Converts raw transport outcomes into ordered {@link CommandResult} slots. */
@UtilityClass
class BatchResults {

  List<CommandResult> repack(final List<QueuedCommand> commands, final List<Object> outcomes) {
    if (outcomes.size() != commands.size()) {
      throw new RedisBridgeException(
          "Transport returned " + outcomes.size() + " outcomes for " + commands.size() + " commands");
    }
    final List<CommandResult> results = new ArrayList<>(outcomes.size());
    for (final var outcome : outcomes) {
      results.add(
          outcome instanceof Throwable
              ? CommandResult.failure(toBridgeException((Throwable) outcome))
              : CommandResult.success(outcome));
    }
    return Collections.unmodifiableList(results);
  }

  int failures(final List<CommandResult> results) {
    int failures = 0;
    for (final var result : results) {
      if (!result.isSuccess()) {
        failures++;
      }
    }
    return failures;
  }

  private RedisBridgeException toBridgeException(final Throwable failure) {
    if (failure instanceof RedisBridgeException) {
      return (RedisBridgeException) failure;
    }
    return new CommandException(String.valueOf(failure.getMessage()), failure);
  }
}
