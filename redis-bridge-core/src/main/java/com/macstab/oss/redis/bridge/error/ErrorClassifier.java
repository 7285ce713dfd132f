/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.error;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.util.concurrent.TimeoutException;

import lombok.NonNull;
import lombok.experimental.UtilityClass;

/**
 * Classifies failures raised by the transport.
 *
 * <p>Typed checks run first (bridge exceptions, JDK I/O and timeout types). Message heuristics are
 * the fallback for transports that only surface a generic exception with the server or socket text
 * (e.g. {@code "ECONNREFUSED"}, {@code "NOAUTH"}, {@code "WRONGTYPE"}).
 *
 * <p>The cause chain is walked up to {@value #MAX_CAUSE_DEPTH} levels so wrapped failures (an
 * {@code ExecutionException} around a socket error) classify as their root.
 */
@UtilityClass
public class ErrorClassifier {

  private static final int MAX_CAUSE_DEPTH = 8;

  public ErrorType classify(@NonNull final Throwable error) {
    Throwable current = error;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
      final var type = classifySingle(current);
      if (type != ErrorType.UNKNOWN) {
        return type;
      }
      current = current.getCause();
    }
    return ErrorType.UNKNOWN;
  }

  public boolean isRetryable(@NonNull final Throwable error) {
    return classify(error).isRetryable();
  }

  public boolean isSuppressible(@NonNull final Throwable error) {
    return classify(error).isSuppressible();
  }

  /** Formats a failure for logging: {@code [TYPE] ExceptionClass: message}. */
  public String format(@NonNull final Throwable error) {
    return "[" + classify(error) + "] " + error.getClass().getSimpleName() + ": " + error.getMessage();
  }

  private ErrorType classifySingle(final Throwable error) {
    if (error instanceof SubscriberClosedException) {
      return ErrorType.CLOSING;
    }
    if (error instanceof CommandException) {
      return authenticationOr(error.getMessage(), ErrorType.COMMAND);
    }
    if (error instanceof TimeoutException) {
      return ErrorType.TIMEOUT;
    }
    if (error instanceof ConnectException) {
      return ErrorType.CONNECTION;
    }
    if (error instanceof SocketException) {
      return ErrorType.NETWORK;
    }

    final var fromMessage = classifyMessage(error.getClass().getSimpleName(), error.getMessage());
    if (fromMessage != ErrorType.UNKNOWN) {
      return fromMessage;
    }

    if (error instanceof ConnectionException) {
      return ErrorType.CONNECTION;
    }
    if (error instanceof IOException) {
      return ErrorType.NETWORK;
    }
    return ErrorType.UNKNOWN;
  }

  private ErrorType classifyMessage(final String typeName, final String message) {
    final var text = message == null ? "" : message;

    if (typeName.contains("Closing")
        || text.contains("Client is closed")
        || text.contains("Connection closed")) {
      return ErrorType.CLOSING;
    }
    if (text.contains("ECONNREFUSED")
        || text.contains("ENOTFOUND")
        || text.contains("EHOSTUNREACH")
        || text.contains("Connection refused")) {
      return ErrorType.CONNECTION;
    }
    if (typeName.contains("Timeout") || text.contains("timeout") || text.contains("ETIMEDOUT")) {
      return ErrorType.TIMEOUT;
    }
    final var auth = authenticationOr(text, ErrorType.UNKNOWN);
    if (auth != ErrorType.UNKNOWN) {
      return auth;
    }
    if (text.startsWith("ERR")
        || text.startsWith("WRONGTYPE")
        || text.contains("wrong number of arguments")) {
      return ErrorType.COMMAND;
    }
    if (text.contains("EPIPE") || text.contains("ECONNRESET") || text.contains("socket")) {
      return ErrorType.NETWORK;
    }
    return ErrorType.UNKNOWN;
  }

  private ErrorType authenticationOr(final String message, final ErrorType fallback) {
    final var text = message == null ? "" : message;
    if (text.contains("NOAUTH") || text.contains("WRONGPASS") || text.contains("Authentication")) {
      return ErrorType.AUTHENTICATION;
    }
    return fallback;
  }
}
