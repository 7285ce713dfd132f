/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.command;

import lombok.NonNull;
import lombok.Value;

/** Version of a watched key captured at {@code watch()} time. */
@Value
public class WatchToken {

  /** Version marker for transports where the server tracks the version itself. */
  public static final long SERVER_TRACKED = -1L;

  @NonNull String key;
  long version;

  public static WatchToken serverTracked(final String key) {
    return new WatchToken(key, SERVER_TRACKED);
  }

  public boolean isServerTracked() {
    return version == SERVER_TRACKED;
  }
}
