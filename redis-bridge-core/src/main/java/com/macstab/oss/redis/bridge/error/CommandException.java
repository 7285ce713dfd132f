/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.error;

import java.util.Locale;

/**
 * Server-side failure of a single command (e.g. {@code WRONGTYPE}, {@code ERR unknown command}).
 *
 * <p>Inside a pipeline or transaction this exception is stored in the failing command's {@code
 * CommandResult} and never aborts sibling commands. For a single command ({@code
 * RedisBridgeClient.call(...)}) it is thrown.
 */
public class CommandException extends RedisBridgeException {

  private static final long serialVersionUID = 1L;

  private final String errorCode;

  public CommandException(final String message) {
    this(message, null);
  }

  public CommandException(final String message, final Throwable cause) {
    super(message, cause);
    this.errorCode = parseErrorCode(message);
  }

  /**
   * Returns the leading upper-case token of the server reply ({@code WRONGTYPE}, {@code ERR},
   * {@code EXECABORT}, ...), or {@code "ERR"} when the reply carries none.
   */
  public String getErrorCode() {
    return errorCode;
  }

  static String parseErrorCode(final String message) {
    if (message == null || message.isBlank()) {
      return "ERR";
    }

    final var trimmed = message.strip();
    final int space = trimmed.indexOf(' ');
    final var token = space > 0 ? trimmed.substring(0, space) : trimmed;

    if (!token.isEmpty() && token.equals(token.toUpperCase(Locale.ROOT)) && isWord(token)) {
      return token;
    }
    return "ERR";
  }

  private static boolean isWord(final String token) {
    for (int i = 0; i < token.length(); i++) {
      if (!Character.isLetter(token.charAt(i))) {
        return false;
      }
    }
    return true;
  }
}
