/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;

import com.macstab.oss.redis.bridge.command.QueuedCommand;
import com.macstab.oss.redis.bridge.error.CommandException;

/**
 * Single-threaded Redis keyspace emulation for unit tests.
 *
 * <p>Covers the command set of the bridge's pipelines plus {@code PING}, {@code ECHO} and {@code
 * PUBLISH}. Every write bumps a per-key version that transaction sessions use to emulate {@code
 * WATCH}. All access is synchronized on this instance, which also makes {@code EXEC} atomic.
 */
public final class InMemoryRedis {

  private static final String WRONGTYPE =
      "WRONGTYPE Operation against a key holding the wrong kind of value";
  private static final String NOT_INTEGER = "ERR value is not an integer or out of range";

  private final Map<String, Object> keyspace = new HashMap<>();
  private final Map<String, Long> versions = new HashMap<>();
  private final Map<String, Long> expiries = new HashMap<>();
  private final Map<String, BiFunction<InMemoryRedis, QueuedCommand, Object>> commands =
      new HashMap<>();

  private BiFunction<String, byte[], Integer> publisher = (channel, payload) -> 0;
  private long executed;

  public InMemoryRedis() {
    register("PING", (redis, c) -> c.arity() == 0 ? "PONG" : c.argAsString(0));
    register("ECHO", (redis, c) -> redis.arg(c, 0));
    register("PUBLISH", InMemoryRedis::publish);

    register("SET", (redis, c) -> redis.write(c, 0, redis.arg(c, 1)));
    register("GET", (redis, c) -> redis.string(redis.arg(c, 0)));
    register("MGET", InMemoryRedis::mget);
    register("MSET", InMemoryRedis::mset);
    register("DEL", InMemoryRedis::del);
    register("EXISTS", InMemoryRedis::exists);
    register("EXPIRE", (redis, c) -> redis.expire(c, 1000L));
    register("PEXPIRE", (redis, c) -> redis.expire(c, 1L));
    register("TTL", (redis, c) -> redis.ttl(c, 1000L));
    register("PTTL", (redis, c) -> redis.ttl(c, 1L));
    register("INCR", (redis, c) -> redis.incrBy(redis.arg(c, 0), 1L));
    register("DECR", (redis, c) -> redis.incrBy(redis.arg(c, 0), -1L));
    register("INCRBY", (redis, c) -> redis.incrBy(redis.arg(c, 0), redis.longArg(c, 1)));

    register("HSET", InMemoryRedis::hset);
    register("HGET", (redis, c) -> redis.hash(redis.arg(c, 0), false).get(redis.arg(c, 1)));
    register("HGETALL", InMemoryRedis::hgetall);
    register("HDEL", InMemoryRedis::hdel);
    register("HLEN", (redis, c) -> (long) redis.hash(redis.arg(c, 0), false).size());
    register("HKEYS", (redis, c) -> new ArrayList<>(redis.hash(redis.arg(c, 0), false).keySet()));
    register("HVALS", (redis, c) -> new ArrayList<>(redis.hash(redis.arg(c, 0), false).values()));

    register("LPUSH", (redis, c) -> redis.push(c, true));
    register("RPUSH", (redis, c) -> redis.push(c, false));
    register("LPOP", (redis, c) -> redis.pop(c, true));
    register("RPOP", (redis, c) -> redis.pop(c, false));
    register("LLEN", (redis, c) -> (long) redis.list(redis.arg(c, 0), false).size());
    register("LRANGE", InMemoryRedis::lrange);
    register("LREM", InMemoryRedis::lrem);
    register("LTRIM", InMemoryRedis::ltrim);

    register("SADD", InMemoryRedis::sadd);
    register("SREM", InMemoryRedis::srem);
    register("SMEMBERS", (redis, c) -> new ArrayList<>(redis.set(redis.arg(c, 0), false)));
    register("SCARD", (redis, c) -> (long) redis.set(redis.arg(c, 0), false).size());

    register("ZADD", InMemoryRedis::zadd);
    register("ZREM", InMemoryRedis::zrem);
    register("ZRANGE", (redis, c) -> redis.zrange(c, false));
    register("ZREVRANGE", (redis, c) -> redis.zrange(c, true));
    register("ZCARD", (redis, c) -> (long) redis.zset(redis.arg(c, 0), false).size());
    register("ZCOUNT", InMemoryRedis::zcount);
  }

  private void register(
      final String name, final BiFunction<InMemoryRedis, QueuedCommand, Object> handler) {
    commands.put(name, handler);
  }

  /** Routes {@code PUBLISH}; returns the number of receivers. */
  synchronized void onPublish(final BiFunction<String, byte[], Integer> publisher) {
    this.publisher = publisher;
  }

  public synchronized boolean isKnown(final String command) {
    return commands.containsKey(command);
  }

  /**
   * Executes one command.
   *
   * @throws CommandException on unknown commands, wrong arity, type and value errors
   */
  public synchronized Object execute(final QueuedCommand command) {
    final var handler = commands.get(command.getName());
    if (handler == null) {
      throw new CommandException("ERR unknown command '" + command.getName().toLowerCase() + "'");
    }
    executed++;
    try {
      return handler.apply(this, command);
    } catch (IndexOutOfBoundsException e) {
      throw new CommandException(
          "ERR wrong number of arguments for '" + command.getName().toLowerCase() + "' command");
    }
  }

  public synchronized long version(final String key) {
    return versions.getOrDefault(key, 0L);
  }

  public synchronized long executedCommands() {
    return executed;
  }

  public synchronized boolean containsKey(final String key) {
    return keyspace.containsKey(key);
  }

  // ---------------------------------------------------------------- helpers

  private String arg(final QueuedCommand command, final int index) {
    return command.argAsString(index);
  }

  private long longArg(final QueuedCommand command, final int index) {
    try {
      return Long.parseLong(arg(command, index));
    } catch (NumberFormatException e) {
      throw new CommandException(NOT_INTEGER);
    }
  }

  private double doubleArg(final QueuedCommand command, final int index) {
    try {
      return Double.parseDouble(arg(command, index));
    } catch (NumberFormatException e) {
      throw new CommandException("ERR value is not a valid float");
    }
  }

  private void touch(final String key) {
    versions.merge(key, 1L, Long::sum);
  }

  private Object write(final QueuedCommand command, final int keyIndex, final Object value) {
    final var key = arg(command, keyIndex);
    keyspace.put(key, value);
    expiries.remove(key);
    touch(key);
    return "OK";
  }

  private String string(final String key) {
    final var value = keyspace.get(key);
    if (value != null && !(value instanceof String)) {
      throw new CommandException(WRONGTYPE);
    }
    return (String) value;
  }

  @SuppressWarnings("unchecked")
  private <T> T typed(final String key, final Class<?> type, final boolean create, final T empty) {
    final var value = keyspace.get(key);
    if (value == null) {
      if (create) {
        keyspace.put(key, empty);
      }
      return empty;
    }
    if (!type.isInstance(value)) {
      throw new CommandException(WRONGTYPE);
    }
    return (T) value;
  }

  private Map<String, String> hash(final String key, final boolean create) {
    return typed(key, LinkedHashMap.class, create, new LinkedHashMap<String, String>());
  }

  private LinkedList<String> list(final String key, final boolean create) {
    return typed(key, LinkedList.class, create, new LinkedList<String>());
  }

  private Set<String> set(final String key, final boolean create) {
    return typed(key, LinkedHashSet.class, create, new LinkedHashSet<String>());
  }

  private Map<String, Double> zset(final String key, final boolean create) {
    return typed(key, ZSet.class, create, new ZSet());
  }

  private void dropIfEmpty(final String key, final boolean empty) {
    if (empty) {
      keyspace.remove(key);
      expiries.remove(key);
    }
  }

  private static int index(final long index, final int size) {
    final long resolved = index < 0 ? size + index : index;
    return (int) Math.max(0, Math.min(resolved, Integer.MAX_VALUE));
  }

  private static <T> List<T> range(final List<T> items, final long start, final long stop) {
    final int from = index(start, items.size());
    final int to = Math.min(index(stop, items.size()), items.size() - 1);
    if (items.isEmpty() || from > to || (stop < 0 && stop + items.size() < 0)) {
      return new ArrayList<>();
    }
    return new ArrayList<>(items.subList(from, to + 1));
  }

  // ---------------------------------------------------------------- commands

  private Object publish(final QueuedCommand command) {
    return (long) publisher.apply(arg(command, 0), command.argAsBytes(1));
  }

  private Object mget(final QueuedCommand command) {
    final List<Object> values = new ArrayList<>();
    for (int i = 0; i < command.arity(); i++) {
      final var value = keyspace.get(arg(command, i));
      values.add(value instanceof String ? value : null);
    }
    return values;
  }

  private Object mset(final QueuedCommand command) {
    if (command.arity() == 0 || command.arity() % 2 != 0) {
      throw new CommandException("ERR wrong number of arguments for 'mset' command");
    }
    for (int i = 0; i < command.arity(); i += 2) {
      write(command, i, arg(command, i + 1));
    }
    return "OK";
  }

  private Object del(final QueuedCommand command) {
    long removed = 0;
    for (int i = 0; i < command.arity(); i++) {
      final var key = arg(command, i);
      if (keyspace.remove(key) != null) {
        expiries.remove(key);
        touch(key);
        removed++;
      }
    }
    return removed;
  }

  private Object exists(final QueuedCommand command) {
    long found = 0;
    for (int i = 0; i < command.arity(); i++) {
      if (keyspace.containsKey(arg(command, i))) {
        found++;
      }
    }
    return found;
  }

  private Object expire(final QueuedCommand command, final long unitMillis) {
    final var key = arg(command, 0);
    final long amount = longArg(command, 1);
    if (!keyspace.containsKey(key)) {
      return 0L;
    }
    expiries.put(key, System.currentTimeMillis() + amount * unitMillis);
    touch(key);
    return 1L;
  }

  private Object ttl(final QueuedCommand command, final long unitMillis) {
    final var key = arg(command, 0);
    if (!keyspace.containsKey(key)) {
      return -2L;
    }
    final var expiry = expiries.get(key);
    if (expiry == null) {
      return -1L;
    }
    return Math.max(0L, (expiry - System.currentTimeMillis() + unitMillis - 1) / unitMillis);
  }

  private Object incrBy(final String key, final long delta) {
    final var current = string(key);
    final long value;
    try {
      value = current == null ? 0L : Long.parseLong(current);
    } catch (NumberFormatException e) {
      throw new CommandException(NOT_INTEGER);
    }
    final long next = value + delta;
    keyspace.put(key, Long.toString(next));
    touch(key);
    return next;
  }

  private Object hset(final QueuedCommand command) {
    if (command.arity() < 3 || command.arity() % 2 == 0) {
      throw new CommandException("ERR wrong number of arguments for 'hset' command");
    }
    final var key = arg(command, 0);
    final var hash = hash(key, true);
    long added = 0;
    for (int i = 1; i < command.arity(); i += 2) {
      if (hash.put(arg(command, i), arg(command, i + 1)) == null) {
        added++;
      }
    }
    touch(key);
    return added;
  }

  private Object hgetall(final QueuedCommand command) {
    final List<Object> flat = new ArrayList<>();
    hash(arg(command, 0), false)
        .forEach(
            (field, value) -> {
              flat.add(field);
              flat.add(value);
            });
    return flat;
  }

  private Object hdel(final QueuedCommand command) {
    final var key = arg(command, 0);
    final var hash = hash(key, false);
    long removed = 0;
    for (int i = 1; i < command.arity(); i++) {
      if (hash.remove(arg(command, i)) != null) {
        removed++;
      }
    }
    if (removed > 0) {
      touch(key);
      dropIfEmpty(key, hash.isEmpty());
    }
    return removed;
  }

  private Object push(final QueuedCommand command, final boolean head) {
    if (command.arity() < 2) {
      throw new IndexOutOfBoundsException();
    }
    final var key = arg(command, 0);
    final var list = list(key, true);
    for (int i = 1; i < command.arity(); i++) {
      if (head) {
        list.addFirst(arg(command, i));
      } else {
        list.addLast(arg(command, i));
      }
    }
    touch(key);
    return (long) list.size();
  }

  private Object pop(final QueuedCommand command, final boolean head) {
    final var key = arg(command, 0);
    final var list = list(key, false);
    if (list.isEmpty()) {
      return null;
    }
    final var value = head ? list.removeFirst() : list.removeLast();
    touch(key);
    dropIfEmpty(key, list.isEmpty());
    return value;
  }

  private Object lrange(final QueuedCommand command) {
    return range(list(arg(command, 0), false), longArg(command, 1), longArg(command, 2));
  }

  private Object lrem(final QueuedCommand command) {
    final var key = arg(command, 0);
    final long count = longArg(command, 1);
    final var value = arg(command, 2);
    final var list = list(key, false);
    final List<String> ordered = count < 0 ? reversed(list) : new ArrayList<>(list);
    long removed = 0;
    final var kept = new ArrayList<String>();
    for (final var item : ordered) {
      if (item.equals(value) && (count == 0 || removed < Math.abs(count))) {
        removed++;
      } else {
        kept.add(item);
      }
    }
    if (count < 0) {
      Collections.reverse(kept);
    }
    list.clear();
    list.addAll(kept);
    if (removed > 0) {
      touch(key);
      dropIfEmpty(key, list.isEmpty());
    }
    return removed;
  }

  private static List<String> reversed(final List<String> list) {
    final var copy = new ArrayList<>(list);
    Collections.reverse(copy);
    return copy;
  }

  private Object ltrim(final QueuedCommand command) {
    final var key = arg(command, 0);
    final var list = list(key, false);
    final var kept = range(list, longArg(command, 1), longArg(command, 2));
    list.clear();
    list.addAll(kept);
    touch(key);
    dropIfEmpty(key, list.isEmpty());
    return "OK";
  }

  private Object sadd(final QueuedCommand command) {
    final var key = arg(command, 0);
    final var set = set(key, true);
    long added = 0;
    for (int i = 1; i < command.arity(); i++) {
      if (set.add(arg(command, i))) {
        added++;
      }
    }
    touch(key);
    return added;
  }

  private Object srem(final QueuedCommand command) {
    final var key = arg(command, 0);
    final var set = set(key, false);
    long removed = 0;
    for (int i = 1; i < command.arity(); i++) {
      if (set.remove(arg(command, i))) {
        removed++;
      }
    }
    if (removed > 0) {
      touch(key);
      dropIfEmpty(key, set.isEmpty());
    }
    return removed;
  }

  private Object zadd(final QueuedCommand command) {
    final var key = arg(command, 0);
    final double score = doubleArg(command, 1);
    final var zset = zset(key, true);
    final boolean added = zset.put(arg(command, 2), score) == null;
    touch(key);
    return added ? 1L : 0L;
  }

  private Object zrem(final QueuedCommand command) {
    final var key = arg(command, 0);
    final var zset = zset(key, false);
    long removed = 0;
    for (int i = 1; i < command.arity(); i++) {
      if (zset.remove(arg(command, i)) != null) {
        removed++;
      }
    }
    if (removed > 0) {
      touch(key);
      dropIfEmpty(key, zset.isEmpty());
    }
    return removed;
  }

  private Object zrange(final QueuedCommand command, final boolean reverse) {
    final var zset = zset(arg(command, 0), false);
    final List<String> members = new ArrayList<>(zset.keySet());
    Comparator<String> order =
        Comparator.<String>comparingDouble(zset::get).thenComparing(Comparator.naturalOrder());
    if (reverse) {
      order = order.reversed();
    }
    members.sort(order);
    return range(members, longArg(command, 1), longArg(command, 2));
  }

  private Object zcount(final QueuedCommand command) {
    final var zset = zset(arg(command, 0), false);
    final double min = doubleArg(command, 1);
    final double max = doubleArg(command, 2);
    return zset.values().stream().filter(score -> score >= min && score <= max).count();
  }

  /** Sorted set storage: member to score. */
  private static final class ZSet extends HashMap<String, Double> {
    private static final long serialVersionUID = 1L;
  }
}
