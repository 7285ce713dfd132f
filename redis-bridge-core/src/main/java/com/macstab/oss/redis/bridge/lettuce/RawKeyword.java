/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.lettuce;

import java.nio.charset.StandardCharsets;

import io.lettuce.core.protocol.ProtocolKeyword;

/** Command keyword taken verbatim from a queued command, so any command name can be dispatched. */
final class RawKeyword implements ProtocolKeyword {

  private final String name;
  private final byte[] bytes;

  RawKeyword(final String name) {
    this.name = name;
    this.bytes = name.getBytes(StandardCharsets.US_ASCII);
  }

  @Override
  public byte[] getBytes() {
    return bytes;
  }

  public String name() {
    return name;
  }

  @Override
  public String toString() {
    return name;
  }
}
