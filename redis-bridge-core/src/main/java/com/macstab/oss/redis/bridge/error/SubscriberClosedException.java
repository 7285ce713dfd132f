/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.error;

/** The subscriber session was closed underneath its poll worker. */
public class SubscriberClosedException extends ConnectionException {

  private static final long serialVersionUID = 1L;

  public SubscriberClosedException(final String message) {
    super(message);
  }

  public SubscriberClosedException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
