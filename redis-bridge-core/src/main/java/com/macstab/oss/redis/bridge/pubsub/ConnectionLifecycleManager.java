/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.pubsub;

import static lombok.AccessLevel.PRIVATE;

import java.util.Optional;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.macstab.oss.redis.bridge.RedisBridgeOptions;
import com.macstab.oss.redis.bridge.error.ConnectionException;
import com.macstab.oss.redis.bridge.error.ErrorClassifier;
import com.macstab.oss.redis.bridge.error.SubscriptionException;
import com.macstab.oss.redis.bridge.metrics.RedisBridgeMetrics;
import com.macstab.oss.redis.bridge.spi.CommandConnection;
import com.macstab.oss.redis.bridge.spi.RedisTransport;

import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the publish connection and the single live subscription connection.
 *
 * <h2>Reconcile</h2>
 *
 * <p>A subscriber session carries a subscription set fixed at creation, so every change of the
 * {@link SubscriptionRegistry} replaces the subscription connection:
 *
 * <ol>
 *   <li>open a new session for the desired set and wait until it is ready
 *   <li>start its {@link PollWorker}
 *   <li>atomically swap it in as the current connection
 *   <li>retire the previous connection: stop its worker, wait up to {@code retireTimeout}, close
 *       its session
 * </ol>
 *
 * <p>The new connection is ready before the old one stops, so subscriptions kept across the change
 * have no gap. During the short overlap both workers may deliver the same publish once each.
 * Reconciles are serialized by one lock; concurrent subscribe calls queue behind it.
 *
 * <h2>Failure handling</h2>
 *
 * <ul>
 *   <li>Caller-triggered mutation: if the new connection cannot be built, the registry is restored
 *       to its state before the mutation, the old connection stays current and the {@link
 *       ConnectionException} propagates.
 *   <li>Invalidated connection (session closed underneath a running worker): rebuilt on a
 *       background thread; a failed rebuild is reported through the {@code error} event.
 * </ul>
 *
 * <h2>Teardown</h2>
 *
 * <p>{@link #disconnect()} unconditionally retires the subscription connection, closes the publish
 * connection and clears the registry. It is safe to call repeatedly. Until the next {@link
 * #connect()}, no subscription connection is opened and a pending background rebuild gives up
 * without reporting an error.
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class ConnectionLifecycleManager {

  private static final int REBUILD_ATTEMPTS = 3;

  RedisTransport transport;
  SubscriptionRegistry registry;
  EventDispatcher dispatcher;
  RedisBridgeOptions options;
  RedisBridgeMetrics metrics;
  ThreadFactory pollThreads;
  ThreadFactory rebuildThreads;

  ReentrantLock reconcileLock = new ReentrantLock();
  AtomicReference<SubscriptionConnection> current = new AtomicReference<>();
  AtomicLong generations = new AtomicLong();

  @NonFinal volatile CommandConnection publisher;
  @NonFinal volatile boolean accepting;

  public ConnectionLifecycleManager(
      @NonNull final RedisTransport transport,
      @NonNull final SubscriptionRegistry registry,
      @NonNull final EventDispatcher dispatcher,
      @NonNull final RedisBridgeOptions options,
      @NonNull final RedisBridgeMetrics metrics) {
    this.transport = transport;
    this.registry = registry;
    this.dispatcher = dispatcher;
    this.options = options;
    this.metrics = metrics;

    final var threadName = options.getConnectionName().replace("%", "%%");
    this.pollThreads =
        new ThreadFactoryBuilder()
            .setNameFormat("redis-bridge-poll-" + threadName + "-%d")
            .setDaemon(true)
            .build();
    this.rebuildThreads =
        new ThreadFactoryBuilder()
            .setNameFormat("redis-bridge-rebuild-" + threadName + "-%d")
            .setDaemon(true)
            .build();
  }

  /** Opens the publish connection if it is not open yet. */
  public void connect() {
    reconcileLock.lock();
    try {
      accepting = true;
      if (publisher == null) {
        publisher = transport.connect();
        if (log.isInfoEnabled()) {
          log.info("Redis bridge '{}' connected", options.getConnectionName());
        }
      }
    } finally {
      reconcileLock.unlock();
    }
  }

  /**
   * @throws ConnectionException if {@link #connect()} was not called or the manager is
   *     disconnected
   */
  public CommandConnection getPublisher() {
    final var connection = publisher;
    if (connection == null) {
      throw new ConnectionException("Connection is closed");
    }
    return connection;
  }

  public boolean hasPublisher() {
    return publisher != null;
  }

  /**
   * Applies a registry mutation and reconciles the subscription connection with its result.
   *
   * @return the mutation's result
   * @throws ConnectionException if the replacement subscription connection cannot be built, or
   *     the mutation leaves subscriptions behind while the manager is disconnected; the registry is
   *     rolled back
   */
  public <R> R mutate(@NonNull final Function<SubscriptionRegistry, R> mutation) {
    reconcileLock.lock();
    try {
      final var checkpoint = registry.checkpoint();
      final R result = mutation.apply(registry);
      try {
        reconcileLocked();
      } catch (RuntimeException e) {
        registry.restore(checkpoint);
        throw e;
      }
      return result;
    } finally {
      reconcileLock.unlock();
    }
  }

  /** Brings the subscription connection in line with the registry. */
  public void reconcile() {
    reconcileLock.lock();
    try {
      reconcileLocked();
    } finally {
      reconcileLock.unlock();
    }
  }

  /** Retires every connection and resets the registry. Idempotent. */
  public void disconnect() {
    reconcileLock.lock();
    try {
      accepting = false;
      final var previous = current.getAndSet(null);
      if (previous != null) {
        retire(previous);
      }
      registry.clear();

      final var connection = publisher;
      publisher = null;
      if (connection != null) {
        try {
          connection.close();
        } catch (RuntimeException e) {
          log.error(
              "Failed to close publish connection of '{}'", options.getConnectionName(), e);
        }
        if (log.isInfoEnabled()) {
          log.info("Redis bridge '{}' disconnected", options.getConnectionName());
        }
      }
    } finally {
      reconcileLock.unlock();
    }
  }

  public Optional<SubscriptionConnection> getCurrent() {
    return Optional.ofNullable(current.get());
  }

  public boolean isPolling() {
    final var live = current.get();
    return live != null && live.getWorker().isActive();
  }

  public long currentGeneration() {
    final var live = current.get();
    return live != null ? live.getGeneration() : 0L;
  }

  private void reconcileLocked() {
    final var desired = registry.listActive();
    if (!accepting) {
      if (!desired.isEmpty()) {
        throw new ConnectionException("Connection is closed");
      }
      return;
    }
    final var previous = current.get();
    final var live = previous != null ? previous.getSubscriptions() : SubscriptionSet.EMPTY;
    final boolean healthy = previous == null || previous.getWorker().isActive();

    if (desired.equals(live) && healthy) {
      return;
    }

    final var replacement = desired.isEmpty() ? null : open(desired);
    current.set(replacement);
    metrics.recordSubscriptionSwap(options.getConnectionName());

    if (log.isDebugEnabled()) {
      log.debug(
          "Subscription connection of '{}' swapped: generation {} -> {} {}",
          options.getConnectionName(),
          previous != null ? previous.getGeneration() : 0,
          replacement != null ? replacement.getGeneration() : 0,
          desired);
    }

    if (previous != null) {
      retire(previous);
    }
  }

  private SubscriptionConnection open(final SubscriptionSet desired) {
    final long generation = generations.incrementAndGet();
    final var session = transport.openSubscriber(desired, options.getReadyTimeout());
    try {
      final var worker =
          PollWorker.builder()
              .name(options.getConnectionName() + "#" + generation)
              .session(session)
              .dispatcher(dispatcher)
              .metrics(metrics)
              .connectionName(options.getConnectionName())
              .pollTimeout(options.getPollTimeout())
              .maxConsecutiveFailures(options.getMaxConsecutivePollFailures())
              .failureBackoff(options.getPollFailureBackoff())
              .onSessionLost(this::onSessionLost)
              .build();
      final var connection = new SubscriptionConnection(generation, desired, session, worker);
      worker.start(pollThreads);
      return connection;
    } catch (RuntimeException e) {
      session.close();
      throw e;
    }
  }

  /**
   * Stops the worker and closes the session. Does not wait when called from the worker's own
   * thread, which would otherwise wait for itself.
   */
  private void retire(final SubscriptionConnection connection) {
    final var worker = connection.getWorker();
    worker.stop();
    if (!worker.isWorkerThread()) {
      try {
        if (!worker.awaitStopped(options.getRetireTimeout())) {
          log.warn(
              "Poll worker {} did not stop within {}; closing its session",
              worker.getName(),
              options.getRetireTimeout());
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while retiring poll worker {}", worker.getName());
      }
    }
    try {
      connection.getSession().close();
    } catch (RuntimeException e) {
      log.error("Failed to close subscription session of {}", worker.getName(), e);
    }
  }

  private void onSessionLost(final PollWorker worker) {
    if (!accepting) {
      return;
    }
    rebuildThreads.newThread(() -> rebuild(worker)).start();
  }

  /**
   * Retries the replacement of a lost connection. The lock is held per attempt, never across a
   * backoff.
   */
  private void rebuild(final PollWorker lost) {
    RuntimeException failure = null;
    for (int attempt = 1; attempt <= REBUILD_ATTEMPTS; attempt++) {
      reconcileLock.lock();
      try {
        if (!stillLost(lost)) {
          return;
        }
        reconcileLocked();
        if (log.isInfoEnabled()) {
          log.info(
              "Rebuilt subscription connection of '{}' (generation {})",
              options.getConnectionName(),
              currentGeneration());
        }
        return;
      } catch (RuntimeException e) {
        failure = e;
        log.warn(
            "Rebuild attempt {}/{} of '{}' failed: {}",
            attempt,
            REBUILD_ATTEMPTS,
            options.getConnectionName(),
            ErrorClassifier.format(e));
      } finally {
        reconcileLock.unlock();
      }
      if (attempt < REBUILD_ATTEMPTS && !sleep(attempt)) {
        break;
      }
    }

    reconcileLock.lock();
    try {
      if (!stillLost(lost)) {
        return;
      }
      current.set(null);
      log.error(
          "Subscription connection of '{}' could not be rebuilt; subscriptions {} are inactive"
              + " until the next subscription change",
          options.getConnectionName(),
          registry.listActive(),
          failure);
      dispatcher.fireError(
          new SubscriptionException("Failed to rebuild subscription connection", failure));
    } finally {
      reconcileLock.unlock();
    }
  }

  /** True while the manager is connected and {@code lost} still backs the current connection. */
  private boolean stillLost(final PollWorker lost) {
    final var live = current.get();
    return accepting && live != null && live.getWorker() == lost;
  }

  private boolean sleep(final int attempt) {
    try {
      Thread.sleep(options.getPollFailureBackoff().multipliedBy(attempt).toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
