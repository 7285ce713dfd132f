/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge;

/** Client connection status as seen by push-style callers. */
public enum ConnectionState {

  /** Created, nothing connected yet. */
  WAIT,

  CONNECTING,

  READY,

  /** Disconnected by the application. {@code connect()} starts over. */
  END
}
