/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.pubsub;

import static lombok.AccessLevel.PRIVATE;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import com.macstab.oss.redis.bridge.error.ErrorClassifier;
import com.macstab.oss.redis.bridge.error.ErrorType;
import com.macstab.oss.redis.bridge.error.SubscriberClosedException;
import com.macstab.oss.redis.bridge.error.SubscriptionException;
import com.macstab.oss.redis.bridge.metrics.RedisBridgeMetrics;
import com.macstab.oss.redis.bridge.spi.SubscriberSession;

import lombok.Builder;
import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;

/**
 * Pulls messages from one {@link SubscriberSession} and hands them to the {@link EventDispatcher}.
 *
 * <p><strong>Loop:</strong> while active, wait at most {@code pollTimeout} for the next message and
 * dispatch it completely before polling again. Messages of one connection are therefore delivered
 * in arrival order, one at a time.
 *
 * <p><strong>Stopping:</strong> {@link #stop()} only clears the active flag; the loop exits after
 * its current poll returns, so a stop takes at most one poll timeout plus the running dispatch. A
 * message that arrives after the flag was cleared is not dispatched. The worker closes its session
 * on exit.
 *
 * <p><strong>Failures:</strong> a failed poll is logged and polling resumes after a backoff of
 * {@code pollFailureBackoff * consecutiveFailures}. Reaching {@code maxConsecutiveFailures} emits
 * an {@code error} event and resets the counter; the worker keeps running. A session that reports
 * itself closed while the worker is still active ends the loop and invokes {@code onSessionLost}.
 *
 * <p><strong>Threading:</strong> runs on one dedicated thread obtained from the supplied {@link
 * ThreadFactory}.
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class PollWorker implements Runnable {

  String name;
  SubscriberSession session;
  EventDispatcher dispatcher;
  RedisBridgeMetrics metrics;
  String connectionName;
  Duration pollTimeout;
  int maxConsecutiveFailures;
  Duration failureBackoff;
  Consumer<PollWorker> onSessionLost;

  AtomicBoolean started = new AtomicBoolean();
  AtomicBoolean active = new AtomicBoolean();
  AtomicReference<PollWorkerState> state = new AtomicReference<>(PollWorkerState.IDLE);
  AtomicLong dispatched = new AtomicLong();
  CountDownLatch stopped = new CountDownLatch(1);

  @NonFinal volatile Thread thread;

  @Builder
  private PollWorker(
      @NonNull final String name,
      @NonNull final SubscriberSession session,
      @NonNull final EventDispatcher dispatcher,
      final RedisBridgeMetrics metrics,
      @NonNull final String connectionName,
      @NonNull final Duration pollTimeout,
      final int maxConsecutiveFailures,
      @NonNull final Duration failureBackoff,
      final Consumer<PollWorker> onSessionLost) {
    this.name = name;
    this.session = session;
    this.dispatcher = dispatcher;
    this.metrics = metrics != null ? metrics : RedisBridgeMetrics.NOOP;
    this.connectionName = connectionName;
    this.pollTimeout = pollTimeout;
    this.maxConsecutiveFailures = Math.max(1, maxConsecutiveFailures);
    this.failureBackoff = failureBackoff;
    this.onSessionLost = onSessionLost != null ? onSessionLost : worker -> {};
  }

  /**
   * Starts the loop on a new thread.
   *
   * @throws IllegalStateException if the worker was started before
   */
  public void start(@NonNull final ThreadFactory threadFactory) {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Poll worker " + name + " already started");
    }
    active.set(true);
    final var worker = threadFactory.newThread(this);
    thread = worker;
    worker.start();
  }

  /** Requests a cooperative stop. Idempotent. */
  public void stop() {
    active.set(false);
    if (!started.get()) {
      state.set(PollWorkerState.STOPPED);
      stopped.countDown();
    }
  }

  /**
   * Waits for the loop to exit.
   *
   * @return {@code true} if the worker stopped within {@code timeout}
   */
  public boolean awaitStopped(@NonNull final Duration timeout) throws InterruptedException {
    return stopped.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  /** {@code true} when called from the worker's own thread (e.g. inside a listener). */
  public boolean isWorkerThread() {
    return Thread.currentThread() == thread;
  }

  public boolean isActive() {
    return active.get();
  }

  public PollWorkerState getState() {
    return state.get();
  }

  public long getDispatchedCount() {
    return dispatched.get();
  }

  public String getName() {
    return name;
  }

  @Override
  public void run() {
    state.set(PollWorkerState.POLLING);
    if (log.isDebugEnabled()) {
      log.debug("Poll worker {} started for {}", name, session.getSubscriptions());
    }

    boolean sessionLost = false;
    int failures = 0;
    try {
      while (active.get()) {
        final Optional<PubSubMessage> next;
        try {
          next = session.nextMessage(pollTimeout);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          log.debug("Poll worker {} interrupted", name);
          break;
        } catch (SubscriberClosedException e) {
          sessionLost = active.get();
          break;
        } catch (RuntimeException e) {
          if (ErrorClassifier.classify(e) == ErrorType.CLOSING) {
            sessionLost = active.get();
            break;
          }
          failures = onPollFailure(e, failures + 1);
          continue;
        }

        failures = 0;
        if (next.isPresent() && active.get()) {
          dispatch(next.get());
        }
      }
    } finally {
      active.set(false);
      state.set(PollWorkerState.STOPPED);
      closeSession();
      stopped.countDown();
      if (log.isDebugEnabled()) {
        log.debug("Poll worker {} stopped after {} messages", name, dispatched.get());
      }
    }

    if (sessionLost) {
      log.warn("Subscription session of poll worker {} closed unexpectedly", name);
      onSessionLost.accept(this);
    }
  }

  private void dispatch(final PubSubMessage message) {
    state.set(PollWorkerState.DISPATCHING);
    try {
      dispatcher.dispatch(message);
      dispatched.incrementAndGet();
    } catch (RuntimeException e) {
      log.error("Dispatch of {} failed on poll worker {}", message, name, e);
    } finally {
      state.compareAndSet(PollWorkerState.DISPATCHING, PollWorkerState.POLLING);
    }
  }

  /** Returns the consecutive failure count to continue with. */
  private int onPollFailure(final RuntimeException error, final int failures) {
    metrics.recordPollFailure(connectionName);
    log.warn(
        "Poll on worker {} failed ({} consecutive): {}",
        name,
        failures,
        ErrorClassifier.format(error));

    final var backoff = failureBackoff.multipliedBy(failures);
    if (failures >= maxConsecutiveFailures) {
      dispatcher.fireError(
          new SubscriptionException(
              "Polling on " + name + " failed " + failures + " consecutive times", error));
      pause(backoff);
      return 0;
    }
    pause(backoff);
    return failures;
  }

  /** Sleeps in slices of {@code pollTimeout} so a stop request is honored promptly. */
  private void pause(final Duration backoff) {
    long remaining = backoff.toNanos();
    final long slice = pollTimeout.toNanos();
    while (remaining > 0 && active.get()) {
      final long step = Math.min(remaining, slice);
      try {
        TimeUnit.NANOSECONDS.sleep(step);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        active.set(false);
        return;
      }
      remaining -= step;
    }
  }

  private void closeSession() {
    try {
      session.close();
    } catch (RuntimeException e) {
      log.warn("Closing session of poll worker {} failed: {}", name, ErrorClassifier.format(e));
    }
  }
}
