/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.command;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.macstab.oss.redis.bridge.error.CommandException;
import com.macstab.oss.redis.bridge.error.RedisBridgeException;
import com.macstab.oss.redis.bridge.metrics.RedisBridgeMetrics;
import com.macstab.oss.redis.bridge.spi.CommandConnection;
import com.macstab.oss.redis.bridge.support.InMemoryRedisTransport;

/**
 * Tests for {@link CommandQueue} (pipelines).
 *
 * <p><strong>What we're testing:</strong>
 *
 * <ul>
 *   <li>One result per command in submission order
 *   <li>A failing command does not affect its siblings
 *   <li>Empty, discarded and repeated exec() never reach the server
 *   <li>Concurrent exec() on one pipeline is rejected
 * </ul>
 */
class CommandQueueTest {

  private InMemoryRedisTransport transport;
  private CommandConnection connection;
  private RedisBridgeMetrics metrics;
  private CommandQueue pipeline;

  @BeforeEach
  void setUp() {
    transport = new InMemoryRedisTransport();
    connection = transport.connect();
    metrics = mock(RedisBridgeMetrics.class);
    pipeline = new CommandQueue(() -> connection, metrics, "test");
  }

  @Test
  @DisplayName("Results come back in submission order")
  void exec_ReturnsOrderedResults() {
    // Act
    final var results =
        pipeline.set("a", "1").incr("a").get("a").rpush("list", "x", "y").lrange("list", 0, -1).exec();

    // Assert
    assertThat(results).extracting(CommandResult::getValue)
        .containsExactly("OK", 2L, "2", 2L, List.of("x", "y"));
    assertThat(results).allMatch(CommandResult::isSuccess);
    verify(metrics).recordBatch("test", "pipeline", 5, 0);
  }

  @Test
  @DisplayName("WRONGTYPE fills only its own slot; later commands still apply")
  void failingCommand_IsolatedToItsSlot() {
    // Act
    final var results =
        pipeline.set("k", "string").lpush("k", "x").set("other", "v").get("other").exec();

    // Assert
    assertThat(results).hasSize(4);
    assertThat(results.get(0).getValue()).isEqualTo("OK");
    assertThat(results.get(1).isSuccess()).isFalse();
    assertThat(results.get(1).getError()).isInstanceOf(CommandException.class);
    assertThat(((CommandException) results.get(1).getError()).getErrorCode())
        .isEqualTo("WRONGTYPE");
    assertThat(results.get(2).getValue()).isEqualTo("OK");
    assertThat(results.get(3).getValue()).isEqualTo("v");
    verify(metrics).recordBatch("test", "pipeline", 4, 1);
  }

  @Test
  @DisplayName("Hash, set and sorted set commands")
  void collectionCommands() {
    final var fields = new LinkedHashMap<String, String>();
    fields.put("m1", "a");
    fields.put("m2", "b");

    final var results =
        pipeline
            .hset("h", "f", "v")
            .hget("h", "f")
            .hgetall("h")
            .sadd("s", "x", "y", "x")
            .scard("s")
            .zadd("z", 2, "two")
            .zadd("z", 1, "one")
            .zrange("z", 0, -1)
            .zrevrange("z", 0, 0)
            .zcount("z", 0, 1.5)
            .mset(fields)
            .mget("m1", "m2", "missing")
            .exec();

    assertThat(results).extracting(CommandResult::getValue)
        .containsExactly(
            1L,
            "v",
            List.of("f", "v"),
            2L,
            2L,
            1L,
            1L,
            List.of("one", "two"),
            List.of("two"),
            1L,
            "OK",
            java.util.Arrays.asList("a", "b", null));
  }

  @Test
  @DisplayName("Empty pipeline returns [] without contacting the server")
  void emptyPipeline_NoServerCall() {
    final var unused = mock(CommandConnection.class);
    final var empty = new CommandQueue(() -> unused, metrics, "test");

    assertThat(empty.exec()).isEmpty();
    verifyNoInteractions(unused);
  }

  @Test
  @DisplayName("discard() clears the queue; exec() then returns []")
  void discard_ClearsQueue() {
    pipeline.set("a", "1").set("b", "2");

    assertThat(pipeline.discard().length()).isZero();
    assertThat(pipeline.exec()).isEmpty();
    assertThat(transport.redis().containsKey("a")).isFalse();
  }

  @Test
  @DisplayName("A repeated exec() returns []")
  void repeatedExec_ReturnsEmpty() {
    pipeline.set("a", "1");

    assertThat(pipeline.exec()).hasSize(1);
    assertThat(pipeline.exec()).isEmpty();
  }

  @Test
  @DisplayName("Unknown commands via call() fail in their slot")
  void call_UnknownCommand() {
    final var results = pipeline.call("NOPE", "x").call("PING").exec();

    assertThat(results.get(0).getError()).hasMessageContaining("unknown command");
    assertThat(results.get(1).getValue()).isEqualTo("PONG");
  }

  @Test
  @DisplayName("Concurrent exec() on the same pipeline is rejected")
  void concurrentExec_Rejected() throws Exception {
    // Arrange
    final var entered = new CountDownLatch(1);
    final var release = new CountDownLatch(1);
    final var slow = mock(CommandConnection.class);
    when(slow.executeBatch(anyList()))
        .thenAnswer(
            invocation -> {
              entered.countDown();
              release.await(5, TimeUnit.SECONDS);
              return List.of("OK");
            });
    final var queue = new CommandQueue(() -> slow, metrics, "test");
    queue.set("a", "1");
    final var first = new Thread(queue::exec);
    first.start();
    assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

    // Act & Assert
    try {
      assertThatThrownBy(queue::exec).isInstanceOf(IllegalStateException.class);
    } finally {
      release.countDown();
      first.join(5000);
    }
  }

  @Test
  @DisplayName("A transport returning the wrong number of outcomes is reported")
  void outcomeCountMismatch_Throws() {
    final var broken = mock(CommandConnection.class);
    when(broken.executeBatch(anyList())).thenReturn(List.of());
    final var queue = new CommandQueue(() -> broken, metrics, "test");
    queue.get("a");

    assertThatThrownBy(queue::exec).isInstanceOf(RedisBridgeException.class);
  }
}
