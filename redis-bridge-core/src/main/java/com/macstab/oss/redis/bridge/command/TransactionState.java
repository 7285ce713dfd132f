/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.command;

/**
 * Life cycle of a {@link TransactionCoordinator}.
 *
 * <pre>
 * UNWATCHED --watch--> WATCHING --queue--> QUEUING --exec--> COMMITTED | ABORTED
 *     \________________________queue______/
 * </pre>
 *
 * <p>{@code discard()} and {@code unwatch()} return to UNWATCHED from any state.
 */
public enum TransactionState {
  UNWATCHED,
  WATCHING,
  QUEUING,
  COMMITTED,
  ABORTED
}
