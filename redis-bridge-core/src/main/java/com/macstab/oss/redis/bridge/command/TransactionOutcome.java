/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.command;

import java.util.List;

import lombok.NonNull;

/**
 * Result of a transaction: committed with one {@link CommandResult} per command, or aborted
 * because a watched key changed.
 */
public final class TransactionOutcome {

  private static final TransactionOutcome ABORTED = new TransactionOutcome(null);

  private final List<CommandResult> results;

  private TransactionOutcome(final List<CommandResult> results) {
    this.results = results;
  }

  public static TransactionOutcome committed(@NonNull final List<CommandResult> results) {
    return new TransactionOutcome(List.copyOf(results));
  }

  public static TransactionOutcome aborted() {
    return ABORTED;
  }

  public boolean isAborted() {
    return results == null;
  }

  /**
   * @throws IllegalStateException if the transaction was aborted
   */
  public List<CommandResult> getResults() {
    if (results == null) {
      throw new IllegalStateException("Transaction was aborted; no results");
    }
    return results;
  }

  /** Results, or {@code null} when aborted (the push-style client contract). */
  public List<CommandResult> resultsOrNull() {
    return results;
  }

  @Override
  public String toString() {
    return results == null ? "TransactionOutcome[aborted]" : "TransactionOutcome" + results;
  }
}
