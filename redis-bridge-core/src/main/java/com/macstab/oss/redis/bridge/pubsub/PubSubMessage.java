/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.pubsub;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * One pub/sub delivery pulled from a subscriber session.
 *
 * <p>Transient: produced by a poll worker, consumed once by the dispatcher.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class PubSubMessage {

  private final String channel;

  @Getter(AccessLevel.NONE)
  private final byte[] payload;

  /** Pattern the transport matched; {@code null} unless {@link #getRoute()} is PATTERN. */
  @Getter(AccessLevel.NONE)
  private final String pattern;

  private final MessageRoute route;

  public static PubSubMessage channel(@NonNull final String channel, @NonNull final byte[] payload) {
    return new PubSubMessage(channel, payload, null, MessageRoute.CHANNEL);
  }

  public static PubSubMessage pattern(
      @NonNull final String pattern, @NonNull final String channel, @NonNull final byte[] payload) {
    return new PubSubMessage(channel, payload, pattern, MessageRoute.PATTERN);
  }

  public static PubSubMessage unrouted(@NonNull final String channel, @NonNull final byte[] payload) {
    return new PubSubMessage(channel, payload, null, MessageRoute.UNROUTED);
  }

  public Optional<String> getMatchedPattern() {
    return Optional.ofNullable(pattern);
  }

  /** Returns a copy of the raw payload. */
  public byte[] getPayload() {
    return payload.clone();
  }

  public String getPayloadAsString() {
    return new String(payload, StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return "PubSubMessage[channel="
        + channel
        + ", route="
        + route
        + (pattern != null ? ", pattern=" + pattern : "")
        + ", bytes="
        + payload.length
        + "]";
  }

  @Override
  public boolean equals(final Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof PubSubMessage)) {
      return false;
    }
    final var that = (PubSubMessage) other;
    return channel.equals(that.channel)
        && route == that.route
        && Arrays.equals(payload, that.payload)
        && java.util.Objects.equals(pattern, that.pattern);
  }

  @Override
  public int hashCode() {
    return java.util.Objects.hash(channel, route, pattern) * 31 + Arrays.hashCode(payload);
  }
}
