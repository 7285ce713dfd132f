/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.command;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import lombok.NonNull;
import lombok.Value;

/**
 * One command as it goes on the wire: an upper-cased name plus arguments normalized to {@link
 * String} or {@code byte[]}.
 */
@Value
public class QueuedCommand {

  String name;
  List<Object> args;

  private QueuedCommand(final String name, final List<Object> args) {
    this.name = name;
    this.args = args;
  }

  /**
   * Builds a command. {@code byte[]} arguments are kept as-is, numbers and booleans are rendered
   * with {@link String#valueOf(Object)}, anything else with {@code toString()}.
   *
   * @throws IllegalArgumentException on a blank name or a {@code null} argument
   */
  public static QueuedCommand of(@NonNull final String name, final Object... args) {
    if (name.isBlank()) {
      throw new IllegalArgumentException("Command name must not be blank");
    }
    final List<Object> normalized = new ArrayList<>(args == null ? 0 : args.length);
    if (args != null) {
      for (int i = 0; i < args.length; i++) {
        normalized.add(normalize(name, i, args[i]));
      }
    }
    return new QueuedCommand(name.trim().toUpperCase(Locale.ROOT), List.copyOf(normalized));
  }

  public int arity() {
    return args.size();
  }

  /** Argument rendered as text; binary arguments are decoded as UTF-8. */
  public String argAsString(final int index) {
    final var arg = args.get(index);
    return arg instanceof byte[]
        ? new String((byte[]) arg, StandardCharsets.UTF_8)
        : (String) arg;
  }

  /** Argument as bytes; text arguments are encoded as UTF-8. */
  public byte[] argAsBytes(final int index) {
    final var arg = args.get(index);
    return arg instanceof byte[]
        ? ((byte[]) arg).clone()
        : ((String) arg).getBytes(StandardCharsets.UTF_8);
  }

  private static Object normalize(final String command, final int index, final Object arg) {
    if (arg == null) {
      throw new IllegalArgumentException(
          "Argument " + index + " of " + command + " must not be null");
    }
    if (arg instanceof byte[]) {
      return ((byte[]) arg).clone();
    }
    if (arg instanceof String) {
      return arg;
    }
    return String.valueOf(arg);
  }

  @Override
  public String toString() {
    return name + " (" + args.size() + " args)";
  }
}
