/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.pubsub;

/**
 * {@code IDLE -> POLLING -> (DISPATCHING -> POLLING)* -> STOPPED}.
 *
 * <p>STOPPED is terminal; a worker is never restarted.
 */
public enum PollWorkerState {
  IDLE,
  POLLING,
  DISPATCHING,
  STOPPED
}
