/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.error;

/**
 * Failure of the subscription machinery after the subscribing call already returned.
 *
 * <p>Never thrown at a caller. Delivered through {@code PubSubListener.onError(Throwable)} when
 * polling keeps failing or when a subscription connection cannot be rebuilt.
 */
public class SubscriptionException extends RedisBridgeException {

  private static final long serialVersionUID = 1L;

  public SubscriptionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
