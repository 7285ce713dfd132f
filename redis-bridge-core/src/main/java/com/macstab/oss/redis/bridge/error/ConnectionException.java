/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.error;

/**
 * Connection-level failure.
 *
 * <p>Thrown to the caller for operations without a per-item result slot (initial {@code
 * connect()}, a single non-batched command, a subscribe whose replacement connection could not be
 * built). Background failures of the same kind are delivered as {@code error} events instead.
 */
public class ConnectionException extends RedisBridgeException {

  private static final long serialVersionUID = 1L;

  public ConnectionException(final String message) {
    super(message);
  }

  public ConnectionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
