/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.pubsub;

/**
 * How a transport already resolved the subscription that produced a message.
 *
 * <p>Redis itself sends one frame per matching subscription ({@code message} for the channel,
 * one {@code pmessage} per matching pattern), so a Redis-backed transport reports {@link #CHANNEL}
 * or {@link #PATTERN}. A transport delivering one frame per publish reports {@link #UNROUTED} and
 * the {@link EventDispatcher} fans the frame out itself.
 */
public enum MessageRoute {
  CHANNEL,
  PATTERN,
  UNROUTED
}
