/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.command;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.macstab.oss.redis.bridge.error.CommandException;
import com.macstab.oss.redis.bridge.metrics.RedisBridgeMetrics;
import com.macstab.oss.redis.bridge.spi.CommandConnection;
import com.macstab.oss.redis.bridge.support.InMemoryRedisTransport;

/**
 * Tests for {@link TransactionCoordinator}.
 *
 * <p><strong>What we're testing:</strong>
 *
 * <ul>
 *   <li>A watched key modified by another client aborts the whole transaction ({@code null})
 *   <li>Without interference every command is applied and reported in order
 *   <li>{@code watch()} after queuing is rejected
 *   <li>Queue-time errors abort with an error in every slot
 * </ul>
 */
class TransactionCoordinatorTest {

  private InMemoryRedisTransport transport;
  private CommandConnection connection;
  private CommandConnection otherClient;
  private RedisBridgeMetrics metrics;

  @BeforeEach
  void setUp() {
    transport = new InMemoryRedisTransport();
    connection = transport.connect();
    otherClient = transport.connect();
    metrics = mock(RedisBridgeMetrics.class);
  }

  private TransactionCoordinator newTransaction() {
    return new TransactionCoordinator(() -> connection, metrics, "test");
  }

  @Nested
  @DisplayName("Watch")
  class Watch {

    @Test
    @DisplayName("Concurrent write to a watched key aborts: exec() returns null, nothing applied")
    void watchedKeyChanged_Aborts() {
      // Arrange
      connection.execute(QueuedCommand.of("SET", "balance", "100"));
      final var tx = newTransaction().watch("balance");
      otherClient.execute(QueuedCommand.of("SET", "balance", "50"));

      // Act
      final var results = tx.set("balance", "90").set("audit", "debit").exec();

      // Assert
      assertThat(results).isNull();
      assertThat(tx.getState()).isEqualTo(TransactionState.ABORTED);
      assertThat(otherClient.execute(QueuedCommand.of("GET", "balance"))).isEqualTo("50");
      assertThat(transport.redis().containsKey("audit")).isFalse();
      verify(metrics).recordTransactionAborted("test");
    }

    @Test
    @DisplayName("Untouched watched key commits")
    void watchedKeyUnchanged_Commits() {
      connection.execute(QueuedCommand.of("SET", "balance", "100"));
      final var tx = newTransaction().watch("balance");

      final var outcome = tx.incrby("balance", -10).get("balance").commit();

      assertThat(outcome.isAborted()).isFalse();
      assertThat(outcome.getResults()).extracting(CommandResult::getValue)
          .containsExactly(90L, "90");
      assertThat(tx.getState()).isEqualTo(TransactionState.COMMITTED);
      assertThat(tx.isWatching()).isFalse();
    }

    @Test
    @DisplayName("watch() after a queued command is rejected")
    void watchAfterQueue_Rejected() {
      final var tx = newTransaction().set("a", "1");

      assertThatThrownBy(() -> tx.watch("a"))
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("WATCH inside MULTI");
    }

    @Test
    @DisplayName("unwatch() forgets the watch so a concurrent write no longer aborts")
    void unwatch_ForgetsKeys() {
      final var tx = newTransaction().watch("k");
      tx.unwatch();
      otherClient.execute(QueuedCommand.of("SET", "k", "changed"));

      final var results = tx.set("k", "mine").exec();

      assertThat(results).hasSize(1);
      assertThat(otherClient.execute(QueuedCommand.of("GET", "k"))).isEqualTo("mine");
    }

    @Test
    @DisplayName("discard() releases the watch and empties the queue")
    void discard_ReleasesWatch() {
      final var tx = newTransaction().watch("k").set("k", "v");

      tx.discard();

      assertThat(tx.getState()).isEqualTo(TransactionState.UNWATCHED);
      assertThat(tx.isWatching()).isFalse();
      assertThat(tx.exec()).isEmpty();
      assertThat(transport.redis().containsKey("k")).isFalse();
    }
  }

  @Nested
  @DisplayName("Exec")
  class Exec {

    @Test
    @DisplayName("Counter transaction reports [error, value] pairs in queue order")
    void counterTransaction_PairsInOrder() {
      final var results =
          newTransaction()
              .set("counter", "0")
              .incr("counter")
              .incr("counter")
              .get("counter")
              .exec();

      assertThat(results)
          .extracting(CommandResult::getError, CommandResult::getValue)
          .containsExactly(
              tuple(null, "OK"), tuple(null, 1L), tuple(null, 2L), tuple(null, "2"));
    }

    @Test
    @DisplayName("Empty transaction commits [] without contacting the server")
    void emptyTransaction_NoServerCall() {
      final var unused = mock(CommandConnection.class);
      final var tx = new TransactionCoordinator(() -> unused, metrics, "test");

      assertThat(tx.exec()).isEmpty();
      verifyNoInteractions(unused);
    }

    @Test
    @DisplayName("Runtime error fills its slot; other commands are applied")
    void runtimeError_OtherCommandsApplied() {
      final var results =
          newTransaction().set("s", "text").incr("s").set("after", "yes").exec();

      assertThat(results).hasSize(3);
      assertThat(results.get(0).getValue()).isEqualTo("OK");
      assertThat(results.get(1).getError()).isInstanceOf(CommandException.class);
      assertThat(results.get(2).getValue()).isEqualTo("OK");
      assertThat(transport.redis().containsKey("after")).isTrue();
    }

    @Test
    @DisplayName("Queue-time error aborts: every slot carries an error, nothing applied")
    void queueTimeError_AbortsEverySlot() {
      final var results = newTransaction().set("x", "1").call("BOGUS").exec();

      assertThat(results).hasSize(2);
      assertThat(results).noneMatch(CommandResult::isSuccess);
      assertThat(((CommandException) results.get(0).getError()).getErrorCode())
          .isEqualTo("EXECABORT");
      assertThat(results.get(1).getError()).hasMessageContaining("unknown command");
      assertThat(transport.redis().containsKey("x")).isFalse();
    }

    @Test
    @DisplayName("A second exec() returns []")
    void repeatedExec_ReturnsEmpty() {
      final var tx = newTransaction().set("a", "1");

      assertThat(tx.exec()).hasSize(1);
      assertThat(tx.exec()).isEmpty();
    }

    @Test
    @DisplayName("commit() on an aborted transaction has no results")
    void abortedOutcome_HasNoResults() {
      final var outcome = TransactionOutcome.aborted();

      assertThat(outcome.resultsOrNull()).isNull();
      assertThatThrownBy(outcome::getResults).isInstanceOf(IllegalStateException.class);
    }
  }
}
