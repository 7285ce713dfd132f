/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.command;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import lombok.NonNull;

/** Keys watched by one transaction with their captured tokens, in watch order. Not thread-safe. */
public final class WatchSet {

  private final Map<String, WatchToken> tokens = new LinkedHashMap<>();

  public void add(@NonNull final WatchToken token) {
    tokens.putIfAbsent(token.getKey(), token);
  }

  public boolean contains(@NonNull final String key) {
    return tokens.containsKey(key);
  }

  public Set<String> keys() {
    return Collections.unmodifiableSet(tokens.keySet());
  }

  public Collection<WatchToken> tokens() {
    return Collections.unmodifiableCollection(tokens.values());
  }

  public int size() {
    return tokens.size();
  }

  public boolean isEmpty() {
    return tokens.isEmpty();
  }

  public void clear() {
    tokens.clear();
  }

  public WatchSet copy() {
    final var copy = new WatchSet();
    copy.tokens.putAll(tokens);
    return copy;
  }

  @Override
  public String toString() {
    return "WatchSet" + tokens.keySet();
  }
}
