/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.spi;

import java.util.List;
import java.util.Optional;

import com.macstab.oss.redis.bridge.command.QueuedCommand;
import com.macstab.oss.redis.bridge.command.WatchSet;
import com.macstab.oss.redis.bridge.command.WatchToken;

/**
 * One optimistic transaction on a dedicated connection.
 *
 * <p>Not thread-safe; owned by a single {@code TransactionCoordinator}.
 */
public interface TransactionSession extends AutoCloseable {

  /** Starts watching {@code key} and returns the token that {@link #exec} validates. */
  WatchToken watch(String key);

  void unwatch();

  /**
   * Validates {@code watchSet} and applies {@code commands} atomically.
   *
   * <p>Validation and application are one atomic step on the server: no write from another client
   * can land between them.
   *
   * @return empty if a watched key changed (nothing was applied); otherwise one outcome per
   *     command, a {@link Throwable} in the slot of a failed command
   */
  Optional<List<Object>> exec(WatchSet watchSet, List<QueuedCommand> commands);

  @Override
  void close();
}
