/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.lettuce;

import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import io.lettuce.core.codec.StringCodec;
import io.lettuce.core.output.CommandOutput;

/**
 * Generic reply decoder for commands dispatched by name.
 *
 * <p>Bulk and status replies become {@link String} (UTF-8), integers {@link Long}, doubles {@link
 * Double}, booleans {@link Boolean}, arrays (nested to any depth) {@link List}, nil {@code null}.
 */
final class ReplyOutput extends CommandOutput<String, String, Object> {

  private final Deque<Frame> frames = new ArrayDeque<>();

  ReplyOutput() {
    super(StringCodec.UTF8, null);
  }

  @Override
  public void set(final ByteBuffer bytes) {
    add(bytes == null ? null : codec.decodeValue(bytes));
  }

  @Override
  public void set(final long integer) {
    add(integer);
  }

  @Override
  public void set(final double number) {
    add(number);
  }

  @Override
  public void set(final boolean value) {
    add(value);
  }

  @Override
  public void multi(final int count) {
    if (count < 0) {
      add(null);
      return;
    }
    final List<Object> items = new ArrayList<>(count);
    attach(items);
    if (count > 0) {
      frames.push(new Frame(items, count));
    } else {
      popCompleted();
    }
  }

  private void add(final Object value) {
    attach(value);
    popCompleted();
  }

  private void attach(final Object value) {
    if (frames.isEmpty()) {
      output = value;
    } else {
      frames.peek().items.add(value);
    }
  }

  private void popCompleted() {
    while (!frames.isEmpty() && frames.peek().isComplete()) {
      frames.pop();
    }
  }

  private static final class Frame {
    private final List<Object> items;
    private final int expected;

    private Frame(final List<Object> items, final int expected) {
      this.items = items;
      this.expected = expected;
    }

    private boolean isComplete() {
      return items.size() >= expected;
    }
  }
}
