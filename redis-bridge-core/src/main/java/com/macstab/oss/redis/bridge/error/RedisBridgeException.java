/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.error;

/**
 * Root of the bridge exception hierarchy.
 *
 * <p>All bridge exceptions are unchecked. Per-command failures inside a pipeline or transaction are
 * never thrown; they are captured into the command's result slot (see {@link CommandException}).
 */
public class RedisBridgeException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public RedisBridgeException(final String message) {
    super(message);
  }

  public RedisBridgeException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
