/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.spi;

import java.util.List;

import com.macstab.oss.redis.bridge.command.QueuedCommand;

/** Connection for regular commands. Shared by all application threads; must be thread-safe. */
public interface CommandConnection extends AutoCloseable {

  /**
   * Executes one command and waits for its reply.
   *
   * @throws com.macstab.oss.redis.bridge.error.CommandException on a server error reply
   * @throws com.macstab.oss.redis.bridge.error.ConnectionException on connection failure
   */
  Object execute(QueuedCommand command);

  /**
   * Sends all commands without waiting between them, then collects the replies.
   *
   * <p>The returned list has one element per command in submission order. A failed command is
   * represented by its {@link Throwable} in that slot; other slots are unaffected.
   *
   * @throws com.macstab.oss.redis.bridge.error.ConnectionException if the batch could not be sent
   */
  List<Object> executeBatch(List<QueuedCommand> commands);

  /** Opens a dedicated connection for one transaction ({@code WATCH} is connection scoped). */
  TransactionSession openTransaction();

  boolean isOpen();

  @Override
  void close();
}
