/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.pubsub;

import static lombok.AccessLevel.PRIVATE;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import com.macstab.oss.redis.bridge.metrics.RedisBridgeMetrics;

import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns pulled {@link PubSubMessage}s into push-style listener callbacks.
 *
 * <p><strong>Routing:</strong>
 *
 * <ul>
 *   <li>{@link MessageRoute#CHANNEL}: one {@code message} event if the channel is still subscribed
 *   <li>{@link MessageRoute#PATTERN}: one {@code pmessage} event if the carried pattern is still
 *       subscribed and matches the channel
 *   <li>{@link MessageRoute#UNROUTED}: one {@code message} event for an exact subscription plus one
 *       {@code pmessage} event per active pattern matching the channel
 * </ul>
 *
 * <p>Exact subscriptions never produce pattern events and vice versa. Deliveries for subscriptions
 * no longer in the {@link SubscriptionRegistry} are dropped, so a retiring connection cannot leak
 * events after an unsubscribe.
 *
 * <p><strong>Listener failures:</strong> an exception thrown by one listener is logged and the
 * remaining listeners still run.
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
public final class EventDispatcher {

  SubscriptionRegistry registry;
  RedisBridgeMetrics metrics;
  String connectionName;
  List<PubSubListener> listeners = new CopyOnWriteArrayList<>();

  public EventDispatcher(
      @NonNull final SubscriptionRegistry registry,
      @NonNull final RedisBridgeMetrics metrics,
      @NonNull final String connectionName) {
    this.registry = registry;
    this.metrics = metrics;
    this.connectionName = connectionName;
  }

  public void addListener(@NonNull final PubSubListener listener) {
    listeners.add(listener);
  }

  public boolean removeListener(@NonNull final PubSubListener listener) {
    return listeners.remove(listener);
  }

  public void removeAllListeners() {
    listeners.clear();
  }

  public int listenerCount() {
    return listeners.size();
  }

  /**
   * Delivers one message to all listeners.
   *
   * @return number of events produced (0 when the message matched no active subscription)
   */
  public int dispatch(@NonNull final PubSubMessage message) {
    final var active = registry.listActive();
    final var channel = message.getChannel();
    int events = 0;

    switch (message.getRoute()) {
      case CHANNEL:
        if (active.getChannels().contains(channel)) {
          deliverMessage(message);
          events++;
        }
        break;
      case PATTERN:
        final var pattern = message.getMatchedPattern().orElse(null);
        if (pattern != null
            && active.getPatterns().contains(pattern)
            && GlobMatcher.matches(pattern, channel)) {
          deliverPatternMessage(pattern, message);
          events++;
        }
        break;
      default:
        if (active.getChannels().contains(channel)) {
          deliverMessage(message);
          events++;
        }
        for (final var candidate : active.getPatterns()) {
          if (GlobMatcher.matches(candidate, channel)) {
            deliverPatternMessage(candidate, message);
            events++;
          }
        }
        break;
    }

    if (events == 0 && log.isDebugEnabled()) {
      log.debug("Dropped {} (no active subscription)", message);
    }
    return events;
  }

  public void fireSubscribed(
      @NonNull final SubscriptionKind kind, @NonNull final String name, final int count) {
    if (kind == SubscriptionKind.PATTERN) {
      notifyListeners("psubscribe", listener -> listener.onPatternSubscribe(name, count));
    } else {
      notifyListeners("subscribe", listener -> listener.onSubscribe(name, count));
    }
  }

  public void fireUnsubscribed(
      @NonNull final SubscriptionKind kind, @NonNull final String name, final int count) {
    if (kind == SubscriptionKind.PATTERN) {
      notifyListeners("punsubscribe", listener -> listener.onPatternUnsubscribe(name, count));
    } else {
      notifyListeners("unsubscribe", listener -> listener.onUnsubscribe(name, count));
    }
  }

  /** Emits an {@code error} event; logged at ERROR when nobody listens. */
  public void fireError(@NonNull final Throwable error) {
    if (listeners.isEmpty()) {
      log.error("Unhandled bridge error on '{}' (no listener registered)", connectionName, error);
      return;
    }
    notifyListeners("error", listener -> listener.onError(error));
  }

  private void deliverMessage(final PubSubMessage message) {
    final var channel = message.getChannel();
    final var text = message.getPayloadAsString();
    final var bytes = message.getPayload();
    notifyListeners(
        "message",
        listener -> {
          listener.onMessage(channel, text);
          listener.onMessageBuffer(channel, bytes.clone());
        });
    metrics.recordMessageDispatched(connectionName, SubscriptionKind.CHANNEL);
  }

  private void deliverPatternMessage(final String pattern, final PubSubMessage message) {
    final var channel = message.getChannel();
    final var text = message.getPayloadAsString();
    final var bytes = message.getPayload();
    notifyListeners(
        "pmessage",
        listener -> {
          listener.onPatternMessage(pattern, channel, text);
          listener.onPatternMessageBuffer(pattern, channel, bytes.clone());
        });
    metrics.recordMessageDispatched(connectionName, SubscriptionKind.PATTERN);
  }

  private void notifyListeners(final String event, final Consumer<PubSubListener> callback) {
    for (final var listener : listeners) {
      try {
        callback.accept(listener);
      } catch (RuntimeException e) {
        log.warn("Listener {} failed handling '{}' event", listener, event, e);
      }
    }
  }
}
