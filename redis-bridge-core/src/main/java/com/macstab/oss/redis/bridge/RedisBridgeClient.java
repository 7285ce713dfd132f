/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge;

import static lombok.AccessLevel.PRIVATE;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import com.macstab.oss.redis.bridge.command.CommandQueue;
import com.macstab.oss.redis.bridge.command.QueuedCommand;
import com.macstab.oss.redis.bridge.command.TransactionCoordinator;
import com.macstab.oss.redis.bridge.error.CommandException;
import com.macstab.oss.redis.bridge.error.ConnectionException;
import com.macstab.oss.redis.bridge.lettuce.LettuceRedisTransport;
import com.macstab.oss.redis.bridge.metrics.RedisBridgeMetrics;
import com.macstab.oss.redis.bridge.pubsub.ConnectionLifecycleManager;
import com.macstab.oss.redis.bridge.pubsub.EventDispatcher;
import com.macstab.oss.redis.bridge.pubsub.PubSubListener;
import com.macstab.oss.redis.bridge.pubsub.Subscription;
import com.macstab.oss.redis.bridge.pubsub.SubscriptionKind;
import com.macstab.oss.redis.bridge.pubsub.SubscriptionRegistry;
import com.macstab.oss.redis.bridge.spi.CommandConnection;
import com.macstab.oss.redis.bridge.spi.RedisTransport;

import io.lettuce.core.RedisClient;
import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;

/**
 * Push-style Redis client on top of a pull-style {@link RedisTransport}.
 *
 * <h2>Pub/Sub</h2>
 *
 * <p>{@link #subscribe(String...)} and {@link #psubscribe(String...)} register interest in the
 * {@link SubscriptionRegistry}; the {@link ConnectionLifecycleManager} keeps exactly one
 * subscription connection carrying the registry's set, and its poll worker pushes every delivery
 * to the registered {@link PubSubListener}s:
 *
 * <pre>{@code
 * RedisBridgeClient client = RedisBridgeClient.create(RedisClient.create("redis://localhost"));
 * client.addListener(new PubSubListener() {
 *   public void onMessage(String channel, String message) { ... }
 * });
 * client.subscribe("orders");
 * }</pre>
 *
 * <h2>Batches</h2>
 *
 * <p>{@link #pipeline()} queues commands and sends them together; {@link #multi()} does the same
 * atomically, optionally guarded by {@link #watch(String...)}. Both report per-command results.
 *
 * <h2>Lifecycle</h2>
 *
 * <p>State moves {@code WAIT -> CONNECTING -> READY -> END}. With {@code autoConnect} (default) the
 * first command connects. {@link #disconnect()} tears everything down and keeps listeners; {@link
 * #cleanup()} also removes listeners. Both are idempotent.
 *
 * <p><strong>Thread safety:</strong> all methods are thread-safe. Queues returned by {@link
 * #pipeline()} and {@link #multi()} belong to the caller.
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class RedisBridgeClient implements AutoCloseable {

  RedisBridgeOptions options;
  RedisBridgeMetrics metrics;
  SubscriptionRegistry registry;
  EventDispatcher dispatcher;
  ConnectionLifecycleManager lifecycle;
  AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.WAIT);
  Object connectMonitor = new Object();
  Object watchMonitor = new Object();

  /** Coordinator created by a client-level {@link #watch(String...)}; handed to {@link #multi()}. */
  @NonFinal TransactionCoordinator pendingWatch;

  public RedisBridgeClient(@NonNull final RedisTransport transport) {
    this(transport, RedisBridgeOptions.defaults(), Optional.empty());
  }

  public RedisBridgeClient(
      @NonNull final RedisTransport transport, @NonNull final RedisBridgeOptions options) {
    this(transport, options, Optional.empty());
  }

  public RedisBridgeClient(
      @NonNull final RedisTransport transport,
      @NonNull final RedisBridgeOptions options,
      @NonNull final Optional<RedisBridgeMetrics> metrics) {
    this.options = options.validate();
    this.metrics = metrics.orElse(RedisBridgeMetrics.NOOP);
    this.registry = new SubscriptionRegistry(options.getSubscriptionCounting());
    this.dispatcher = new EventDispatcher(registry, this.metrics, options.getConnectionName());
    this.lifecycle =
        new ConnectionLifecycleManager(transport, registry, dispatcher, options, this.metrics);
  }

  /** Client over a Lettuce {@link RedisClient} with default options. */
  public static RedisBridgeClient create(@NonNull final RedisClient redisClient) {
    return new RedisBridgeClient(new LettuceRedisTransport(redisClient));
  }

  // ---------------------------------------------------------------- lifecycle

  /**
   * Opens the publish connection. No-op when already {@code READY}.
   *
   * @throws ConnectionException if the server is unreachable (state returns to {@code WAIT})
   */
  public void connect() {
    synchronized (connectMonitor) {
      if (state.get() == ConnectionState.READY) {
        return;
      }
      state.set(ConnectionState.CONNECTING);
      try {
        lifecycle.connect();
        state.set(ConnectionState.READY);
      } catch (ConnectionException e) {
        state.set(ConnectionState.WAIT);
        throw e;
      } catch (RuntimeException e) {
        state.set(ConnectionState.WAIT);
        throw new ConnectionException("Failed to connect '" + options.getConnectionName() + "'", e);
      }
    }
  }

  /** Closes every connection, stops polling and clears all subscriptions. Listeners stay. */
  public void disconnect() {
    synchronized (connectMonitor) {
      final TransactionCoordinator watched;
      synchronized (watchMonitor) {
        watched = pendingWatch;
        pendingWatch = null;
      }
      if (watched != null) {
        watched.discard();
      }
      lifecycle.disconnect();
      metrics.setActiveSubscriptions(options.getConnectionName(), SubscriptionKind.CHANNEL, 0);
      metrics.setActiveSubscriptions(options.getConnectionName(), SubscriptionKind.PATTERN, 0);
      state.set(ConnectionState.END);
    }
  }

  /** Graceful variant of {@link #disconnect()}; replies {@code "OK"}. */
  public String quit() {
    disconnect();
    return "OK";
  }

  /** {@link #disconnect()} plus removal of all listeners. */
  public void cleanup() {
    disconnect();
    dispatcher.removeAllListeners();
    metrics.close(options.getConnectionName());
  }

  @Override
  public void close() {
    cleanup();
  }

  public ConnectionState getState() {
    return state.get();
  }

  public RedisBridgeOptions getOptions() {
    return options;
  }

  // ---------------------------------------------------------------- commands

  /**
   * Executes one command outside any batch.
   *
   * @throws CommandException on a server error reply
   * @throws ConnectionException when not connected or the connection fails
   */
  public Object call(@NonNull final String command, final Object... args) {
    return connection().execute(QueuedCommand.of(command, args));
  }

  /** @return number of clients that received the message */
  public long publish(@NonNull final String channel, @NonNull final String message) {
    return publish(channel, message.getBytes(StandardCharsets.UTF_8));
  }

  /** @return number of clients that received the message */
  public long publish(@NonNull final String channel, @NonNull final byte[] message) {
    final var reply = call("PUBLISH", channel, message);
    if (reply instanceof Number) {
      return ((Number) reply).longValue();
    }
    throw new CommandException("Unexpected PUBLISH reply: " + reply);
  }

  public CommandQueue pipeline() {
    return new CommandQueue(this::connection, metrics, options.getConnectionName());
  }

  /**
   * Starts a transaction. If {@link #watch(String...)} was called on the client, the returned
   * transaction carries those watched keys.
   */
  public TransactionCoordinator multi() {
    synchronized (watchMonitor) {
      if (pendingWatch != null) {
        final var watched = pendingWatch;
        pendingWatch = null;
        return watched;
      }
    }
    return newTransaction();
  }

  /**
   * Watches keys for the next {@link #multi()}.
   *
   * @return {@code "OK"}
   */
  public String watch(@NonNull final String... keys) {
    synchronized (watchMonitor) {
      if (pendingWatch == null) {
        pendingWatch = newTransaction();
      }
      pendingWatch.watch(keys);
    }
    return "OK";
  }

  /** Forgets keys watched with {@link #watch(String...)}. Replies {@code "OK"}. */
  public String unwatch() {
    releasePendingWatch();
    return "OK";
  }

  // ---------------------------------------------------------------- pub/sub

  /**
   * Subscribes to exact channels.
   *
   * @return distinct subscribed channels after the call
   * @throws ConnectionException if the subscription connection cannot be built (nothing changes)
   */
  public int subscribe(@NonNull final String... channels) {
    return addSubscriptions(SubscriptionKind.CHANNEL, channels);
  }

  /**
   * Subscribes to glob patterns.
   *
   * @return distinct subscribed patterns after the call
   */
  public int psubscribe(@NonNull final String... patterns) {
    return addSubscriptions(SubscriptionKind.PATTERN, patterns);
  }

  /**
   * Unsubscribes from channels; without arguments from every channel.
   *
   * @return distinct subscribed channels after the call
   */
  public int unsubscribe(@NonNull final String... channels) {
    return removeSubscriptions(SubscriptionKind.CHANNEL, channels);
  }

  /**
   * Unsubscribes from patterns; without arguments from every pattern.
   *
   * @return distinct subscribed patterns after the call
   */
  public int punsubscribe(@NonNull final String... patterns) {
    return removeSubscriptions(SubscriptionKind.PATTERN, patterns);
  }

  public void addListener(@NonNull final PubSubListener listener) {
    dispatcher.addListener(listener);
  }

  public boolean removeListener(@NonNull final PubSubListener listener) {
    return dispatcher.removeListener(listener);
  }

  /** {@code true} while any channel or pattern is subscribed. */
  public boolean isSubscriberMode() {
    return !registry.listActive().isEmpty();
  }

  public BridgeStatus getStatus() {
    final var active = registry.listActive();
    return BridgeStatus.builder()
        .state(state.get())
        .channels(active.getChannels())
        .patterns(active.getPatterns())
        .subscriberMode(!active.isEmpty())
        .pollingActive(lifecycle.isPolling())
        .subscriptionGeneration(lifecycle.currentGeneration())
        .publishConnectionOpen(lifecycle.hasPublisher())
        .listenerCount(dispatcher.listenerCount())
        .build();
  }

  // ---------------------------------------------------------------- internals

  private int addSubscriptions(final SubscriptionKind kind, final String[] names) {
    requireNames(kind, names);
    ensureConnected();

    final int[] counts =
        lifecycle.mutate(
            subscriptions -> {
              final var result = new int[names.length];
              for (int i = 0; i < names.length; i++) {
                result[i] = subscriptions.add(new Subscription(kind, names[i]));
              }
              return result;
            });

    for (int i = 0; i < names.length; i++) {
      dispatcher.fireSubscribed(kind, names[i], counts[i]);
    }
    final int count = counts[counts.length - 1];
    metrics.setActiveSubscriptions(options.getConnectionName(), kind, count);
    return count;
  }

  private int removeSubscriptions(final SubscriptionKind kind, final String[] names) {
    if (names.length == 0) {
      final List<String> removed = lifecycle.mutate(subscriptions -> subscriptions.removeAll(kind));
      for (int i = 0; i < removed.size(); i++) {
        dispatcher.fireUnsubscribed(kind, removed.get(i), removed.size() - 1 - i);
      }
      metrics.setActiveSubscriptions(options.getConnectionName(), kind, 0);
      return 0;
    }

    requireNames(kind, names);
    final int[] counts =
        lifecycle.mutate(
            subscriptions -> {
              final var result = new int[names.length];
              for (int i = 0; i < names.length; i++) {
                result[i] = subscriptions.remove(new Subscription(kind, names[i]));
              }
              return result;
            });

    for (int i = 0; i < names.length; i++) {
      dispatcher.fireUnsubscribed(kind, names[i], counts[i]);
    }
    final int count = counts[counts.length - 1];
    metrics.setActiveSubscriptions(options.getConnectionName(), kind, count);
    return count;
  }

  private static void requireNames(final SubscriptionKind kind, final String[] names) {
    if (names.length == 0) {
      throw new IllegalArgumentException(
          "At least one " + kind.name().toLowerCase(Locale.ROOT) + " name is required");
    }
    for (final var name : names) {
      if (name == null) {
        throw new IllegalArgumentException(kind.name().toLowerCase(Locale.ROOT) + " name must not be null");
      }
    }
  }

  private CommandConnection connection() {
    ensureConnected();
    return lifecycle.getPublisher();
  }

  private void ensureConnected() {
    final var current = state.get();
    if (current == ConnectionState.READY) {
      return;
    }
    if (current == ConnectionState.END) {
      throw new ConnectionException("Connection is closed");
    }
    if (!options.isAutoConnect()) {
      throw new ConnectionException(
          "Client '" + options.getConnectionName() + "' is not connected; call connect() first");
    }
    connect();
  }

  private TransactionCoordinator newTransaction() {
    return new TransactionCoordinator(this::connection, metrics, options.getConnectionName());
  }

  private void releasePendingWatch() {
    final TransactionCoordinator watched;
    synchronized (watchMonitor) {
      watched = pendingWatch;
      pendingWatch = null;
    }
    if (watched != null) {
      watched.unwatch();
    }
  }
}
