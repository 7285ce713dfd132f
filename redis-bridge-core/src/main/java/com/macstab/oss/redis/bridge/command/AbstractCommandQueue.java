/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.command;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

import lombok.NonNull;

/**
 * Fluent command queue shared by pipelines and transactions.
 *
 * <p>Commands are only recorded here; nothing reaches the server before {@code exec()}. Every
 * command method returns the queue itself, so calls chain:
 *
 * <pre>{@code
 * client.pipeline().set("a", "1").incr("counter").get("a").exec();
 * }</pre>
 *
 * <p><strong>Thread safety:</strong> appends are serialized by {@link #lock}. At most one {@code
 * exec()} runs at a time per queue; a concurrent one is rejected with {@link
 * IllegalStateException}.
 *
 * @param <Q> concrete queue type returned by the fluent methods
 */
public abstract class AbstractCommandQueue<Q extends AbstractCommandQueue<Q>> {

  protected final ReentrantLock lock = new ReentrantLock();

  private final List<QueuedCommand> commands = new ArrayList<>();
  private final AtomicBoolean executing = new AtomicBoolean();

  protected abstract Q self();

  /** Hook invoked under {@link #lock} before a command is recorded. */
  protected void beforeAppend(final QueuedCommand command) {}

  /** Queues an arbitrary command. */
  public Q call(@NonNull final String command, final Object... args) {
    return append(QueuedCommand.of(command, args));
  }

  /** Number of queued commands. */
  public int length() {
    lock.lock();
    try {
      return commands.size();
    } finally {
      lock.unlock();
    }
  }

  /** Drops every queued command. */
  public Q discard() {
    lock.lock();
    try {
      commands.clear();
    } finally {
      lock.unlock();
    }
    return self();
  }

  protected Q append(final QueuedCommand command) {
    lock.lock();
    try {
      beforeAppend(command);
      commands.add(command);
    } finally {
      lock.unlock();
    }
    return self();
  }

  /** Removes and returns the queued commands in submission order. */
  protected List<QueuedCommand> drain() {
    lock.lock();
    try {
      final var batch = List.copyOf(commands);
      commands.clear();
      return batch;
    } finally {
      lock.unlock();
    }
  }

  protected void beginExec() {
    if (!executing.compareAndSet(false, true)) {
      throw new IllegalStateException("exec() already in progress on this queue");
    }
  }

  protected void endExec() {
    executing.set(false);
  }

  // ---- strings and keys ----

  public Q set(@NonNull final String key, @NonNull final Object value) {
    return call("SET", key, value);
  }

  public Q get(@NonNull final String key) {
    return call("GET", key);
  }

  public Q mget(@NonNull final String... keys) {
    return call("MGET", (Object[]) keys);
  }

  public Q mset(@NonNull final Map<String, ?> entries) {
    final List<Object> args = new ArrayList<>(entries.size() * 2);
    entries.forEach(
        (key, value) -> {
          args.add(key);
          args.add(value);
        });
    return call("MSET", args.toArray());
  }

  public Q del(@NonNull final String... keys) {
    return call("DEL", (Object[]) keys);
  }

  public Q exists(@NonNull final String... keys) {
    return call("EXISTS", (Object[]) keys);
  }

  public Q expire(@NonNull final String key, final long seconds) {
    return call("EXPIRE", key, seconds);
  }

  public Q pexpire(@NonNull final String key, final long milliseconds) {
    return call("PEXPIRE", key, milliseconds);
  }

  public Q ttl(@NonNull final String key) {
    return call("TTL", key);
  }

  public Q pttl(@NonNull final String key) {
    return call("PTTL", key);
  }

  public Q incr(@NonNull final String key) {
    return call("INCR", key);
  }

  public Q decr(@NonNull final String key) {
    return call("DECR", key);
  }

  public Q incrby(@NonNull final String key, final long increment) {
    return call("INCRBY", key, increment);
  }

  // ---- hashes ----

  public Q hset(@NonNull final String key, @NonNull final String field, @NonNull final Object value) {
    return call("HSET", key, field, value);
  }

  public Q hget(@NonNull final String key, @NonNull final String field) {
    return call("HGET", key, field);
  }

  public Q hgetall(@NonNull final String key) {
    return call("HGETALL", key);
  }

  public Q hdel(@NonNull final String key, @NonNull final String... fields) {
    return call("HDEL", prepend(key, fields));
  }

  public Q hlen(@NonNull final String key) {
    return call("HLEN", key);
  }

  public Q hkeys(@NonNull final String key) {
    return call("HKEYS", key);
  }

  public Q hvals(@NonNull final String key) {
    return call("HVALS", key);
  }

  // ---- lists ----

  public Q lpush(@NonNull final String key, @NonNull final Object... values) {
    return call("LPUSH", prepend(key, values));
  }

  public Q rpush(@NonNull final String key, @NonNull final Object... values) {
    return call("RPUSH", prepend(key, values));
  }

  public Q lpop(@NonNull final String key) {
    return call("LPOP", key);
  }

  public Q rpop(@NonNull final String key) {
    return call("RPOP", key);
  }

  public Q llen(@NonNull final String key) {
    return call("LLEN", key);
  }

  public Q lrange(@NonNull final String key, final long start, final long stop) {
    return call("LRANGE", key, start, stop);
  }

  public Q lrem(@NonNull final String key, final long count, @NonNull final Object value) {
    return call("LREM", key, count, value);
  }

  public Q ltrim(@NonNull final String key, final long start, final long stop) {
    return call("LTRIM", key, start, stop);
  }

  // ---- sets ----

  public Q sadd(@NonNull final String key, @NonNull final Object... members) {
    return call("SADD", prepend(key, members));
  }

  public Q srem(@NonNull final String key, @NonNull final Object... members) {
    return call("SREM", prepend(key, members));
  }

  public Q smembers(@NonNull final String key) {
    return call("SMEMBERS", key);
  }

  public Q scard(@NonNull final String key) {
    return call("SCARD", key);
  }

  // ---- sorted sets ----

  public Q zadd(@NonNull final String key, final double score, @NonNull final Object member) {
    return call("ZADD", key, score, member);
  }

  public Q zrem(@NonNull final String key, @NonNull final Object... members) {
    return call("ZREM", prepend(key, members));
  }

  public Q zrange(@NonNull final String key, final long start, final long stop) {
    return call("ZRANGE", key, start, stop);
  }

  public Q zrevrange(@NonNull final String key, final long start, final long stop) {
    return call("ZREVRANGE", key, start, stop);
  }

  public Q zcard(@NonNull final String key) {
    return call("ZCARD", key);
  }

  public Q zcount(@NonNull final String key, final double min, final double max) {
    return call("ZCOUNT", key, min, max);
  }

  private static Object[] prepend(final String key, final Object[] rest) {
    final var args = new Object[rest.length + 1];
    args[0] = key;
    System.arraycopy(rest, 0, args, 1, rest.length);
    return args;
  }
}
