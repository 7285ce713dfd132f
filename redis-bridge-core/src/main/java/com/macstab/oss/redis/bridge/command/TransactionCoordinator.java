/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.command;

import static lombok.AccessLevel.PRIVATE;

import java.util.List;
import java.util.function.Supplier;

import com.macstab.oss.redis.bridge.metrics.RedisBridgeMetrics;
import com.macstab.oss.redis.bridge.spi.CommandConnection;
import com.macstab.oss.redis.bridge.spi.TransactionSession;

import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;

/**
 * Optimistic transaction ({@code WATCH}/{@code MULTI}/{@code EXEC}).
 *
 * <p><strong>Watch semantics:</strong> {@link #watch(String...)} opens a dedicated {@link
 * TransactionSession} immediately, because a server-side watch belongs to a connection. If any
 * watched key is modified by another client before {@link #exec()}, the whole transaction is
 * aborted: nothing is applied and {@code exec()} returns {@code null}. Checking the watched keys and
 * applying the commands happen as one atomic step inside the session.
 *
 * <p><strong>Rules:</strong>
 *
 * <ul>
 *   <li>{@code watch()} after the first queued command is rejected ({@code WATCH inside MULTI})
 *   <li>an empty transaction commits with {@code []} without contacting the server
 *   <li>a per-command error fills that command's slot only; the other commands are applied
 *   <li>{@code discard()} drops the queue and releases the watch
 * </ul>
 *
 * <p>The session is always closed after {@code exec()}, {@code discard()} or {@code unwatch()}.
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class TransactionCoordinator extends AbstractCommandQueue<TransactionCoordinator> {

  Supplier<CommandConnection> connection;
  RedisBridgeMetrics metrics;
  String connectionName;
  WatchSet watchSet = new WatchSet();

  @NonFinal TransactionSession session;
  @NonFinal volatile TransactionState state = TransactionState.UNWATCHED;

  public TransactionCoordinator(
      @NonNull final Supplier<CommandConnection> connection,
      @NonNull final RedisBridgeMetrics metrics,
      @NonNull final String connectionName) {
    this.connection = connection;
    this.metrics = metrics;
    this.connectionName = connectionName;
  }

  @Override
  protected TransactionCoordinator self() {
    return this;
  }

  /**
   * Watches keys for modification until {@code exec()}.
   *
   * @throws IllegalStateException if commands are already queued
   * @throws IllegalArgumentException if no key is given
   */
  public TransactionCoordinator watch(@NonNull final String... keys) {
    if (keys.length == 0) {
      throw new IllegalArgumentException("watch() requires at least one key");
    }
    lock.lock();
    try {
      if (state == TransactionState.QUEUING) {
        throw new IllegalStateException("WATCH inside MULTI is not allowed");
      }
      if (session == null) {
        session = connection.get().openTransaction();
      }
      for (final var key : keys) {
        if (!watchSet.contains(key)) {
          watchSet.add(session.watch(key));
        }
      }
      state = TransactionState.WATCHING;
      if (log.isDebugEnabled()) {
        log.debug("Transaction on '{}' watching {}", connectionName, watchSet);
      }
    } finally {
      lock.unlock();
    }
    return this;
  }

  /** Forgets all watched keys. Queued commands stay queued. */
  public TransactionCoordinator unwatch() {
    lock.lock();
    try {
      try {
        if (session != null && !watchSet.isEmpty()) {
          session.unwatch();
        }
      } finally {
        releaseSession();
      }
      if (state == TransactionState.WATCHING) {
        state = TransactionState.UNWATCHED;
      }
    } finally {
      lock.unlock();
    }
    return this;
  }

  /** Drops queued commands and releases the watch. */
  @Override
  public TransactionCoordinator discard() {
    lock.lock();
    try {
      super.discard();
      releaseSession();
      state = TransactionState.UNWATCHED;
    } finally {
      lock.unlock();
    }
    return this;
  }

  @Override
  protected void beforeAppend(final QueuedCommand command) {
    state = TransactionState.QUEUING;
  }

  /**
   * Push-style {@code exec()}: per-command results, or {@code null} when a watched key changed.
   *
   * @see #commit()
   */
  public List<CommandResult> exec() {
    return commit().resultsOrNull();
  }

  /**
   * Validates the watch and applies the queued commands atomically.
   *
   * @throws com.macstab.oss.redis.bridge.error.ConnectionException on connection failure
   * @throws IllegalStateException if another {@code exec()} is running on this transaction
   */
  public TransactionOutcome commit() {
    beginExec();
    try {
      final List<QueuedCommand> batch;
      final TransactionSession active;
      final WatchSet watched;
      lock.lock();
      try {
        batch = drain();
        if (batch.isEmpty()) {
          releaseSession();
          state = TransactionState.COMMITTED;
          return TransactionOutcome.committed(List.of());
        }
        active = session != null ? session : connection.get().openTransaction();
        watched = watchSet.copy();
        session = null;
        watchSet.clear();
      } finally {
        lock.unlock();
      }

      try {
        final var outcomes = active.exec(watched, batch);
        if (outcomes.isEmpty()) {
          state = TransactionState.ABORTED;
          metrics.recordTransactionAborted(connectionName);
          if (log.isDebugEnabled()) {
            log.debug(
                "Transaction on '{}' aborted: watched keys {} changed", connectionName, watched.keys());
          }
          return TransactionOutcome.aborted();
        }

        final var results = BatchResults.repack(batch, outcomes.get());
        state = TransactionState.COMMITTED;
        metrics.recordBatch(
            connectionName, "transaction", batch.size(), BatchResults.failures(results));
        return TransactionOutcome.committed(results);
      } finally {
        active.close();
      }
    } finally {
      endExec();
    }
  }

  public TransactionState getState() {
    return state;
  }

  public boolean isWatching() {
    lock.lock();
    try {
      return !watchSet.isEmpty();
    } finally {
      lock.unlock();
    }
  }

  private void releaseSession() {
    watchSet.clear();
    if (session != null) {
      final var released = session;
      session = null;
      released.close();
    }
  }
}
