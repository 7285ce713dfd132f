/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.command;

import static lombok.AccessLevel.PRIVATE;

import java.util.List;
import java.util.function.Supplier;

import com.macstab.oss.redis.bridge.metrics.RedisBridgeMetrics;
import com.macstab.oss.redis.bridge.spi.CommandConnection;

import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;

/**
 * Pipeline: commands sent together without atomicity.
 *
 * <p>{@link #exec()} returns one {@link CommandResult} per queued command in submission order. A
 * failing command only fills its own slot; the other commands are still applied. After {@code
 * exec()} the queue is empty, so a repeated {@code exec()} returns an empty list without contacting
 * the server.
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class CommandQueue extends AbstractCommandQueue<CommandQueue> {

  Supplier<CommandConnection> connection;
  RedisBridgeMetrics metrics;
  String connectionName;

  public CommandQueue(
      @NonNull final Supplier<CommandConnection> connection,
      @NonNull final RedisBridgeMetrics metrics,
      @NonNull final String connectionName) {
    this.connection = connection;
    this.metrics = metrics;
    this.connectionName = connectionName;
  }

  @Override
  protected CommandQueue self() {
    return this;
  }

  /**
   * Sends all queued commands.
   *
   * @return ordered per-command results; empty when nothing was queued
   * @throws com.macstab.oss.redis.bridge.error.ConnectionException if the batch could not be sent
   * @throws IllegalStateException if another {@code exec()} is running on this pipeline
   */
  public List<CommandResult> exec() {
    beginExec();
    try {
      final var batch = drain();
      if (batch.isEmpty()) {
        return List.of();
      }

      final var outcomes = connection.get().executeBatch(batch);
      final var results = BatchResults.repack(batch, outcomes);
      final int failures = BatchResults.failures(results);
      metrics.recordBatch(connectionName, "pipeline", batch.size(), failures);

      if (log.isDebugEnabled()) {
        log.debug(
            "Pipeline on '{}' executed {} commands ({} failed)",
            connectionName,
            batch.size(),
            failures);
      }
      return results;
    } finally {
      endExec();
    }
  }
}
