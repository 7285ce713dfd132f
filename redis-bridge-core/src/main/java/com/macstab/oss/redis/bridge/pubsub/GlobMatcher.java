/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.bridge.pubsub;

import lombok.NonNull;
import lombok.experimental.UtilityClass;

/**
 * Redis-compatible glob matching for pattern subscriptions.
 *
 * <p>The whole channel must match (anchored) and comparison is case-sensitive. Supported syntax:
 *
 * <ul>
 *   <li>{@code *} any sequence of characters, including none
 *   <li>{@code ?} exactly one character
 *   <li>{@code [abc]}, {@code [a-z]}, {@code [^a]} character classes (reversed ranges are accepted)
 *   <li>{@code \x} the literal character {@code x}
 * </ul>
 *
 * <p>An unterminated class runs to the end of the pattern, as the server does.
 */
@UtilityClass
public class GlobMatcher {

  public boolean matches(@NonNull final String pattern, @NonNull final String text) {
    final int patternLength = pattern.length();
    final int textLength = text.length();
    int p = 0;
    int t = 0;
    // Position after the last star and the text index it is currently matched up to.
    int starP = -1;
    int starT = -1;

    while (t < textLength) {
      if (p < patternLength && pattern.charAt(p) == '*') {
        while (p < patternLength && pattern.charAt(p) == '*') {
          p++;
        }
        if (p == patternLength) {
          return true;
        }
        starP = p;
        starT = t;
        continue;
      }

      final int next = p < patternLength ? step(pattern, p, text.charAt(t)) : -1;
      if (next >= 0) {
        p = next;
        t++;
      } else if (starP >= 0) {
        p = starP;
        t = ++starT;
      } else {
        return false;
      }
    }

    while (p < patternLength && pattern.charAt(p) == '*') {
      p++;
    }
    return p == patternLength;
  }

  /**
   * Matches one non-star pattern element at {@code p} against {@code ch}.
   *
   * @return the index after the element, or -1 on mismatch
   */
  private int step(final String pattern, final int p, final char ch) {
    final int patternLength = pattern.length();
    final char c = pattern.charAt(p);
    if (c == '?') {
      return p + 1;
    }
    if (c == '[') {
      final int end = classEnd(pattern, p + 1);
      if (!classMatches(pattern, p + 1, end, ch)) {
        return -1;
      }
      return end < patternLength ? end + 1 : end;
    }
    if (c == '\\' && p + 1 < patternLength) {
      return pattern.charAt(p + 1) == ch ? p + 2 : -1;
    }
    return c == ch ? p + 1 : -1;
  }

  /** Index of the closing bracket, or the pattern length when the class is unterminated. */
  private int classEnd(final String pattern, final int start) {
    int i = start;
    if (i < pattern.length() && pattern.charAt(i) == '^') {
      i++;
    }
    while (i < pattern.length()) {
      final char c = pattern.charAt(i);
      if (c == '\\' && i + 1 < pattern.length()) {
        i += 2;
      } else if (c == ']') {
        return i;
      } else {
        i++;
      }
    }
    return pattern.length();
  }

  private boolean classMatches(final String pattern, final int start, final int end, final char ch) {
    int i = start;
    boolean negate = false;
    if (i < end && pattern.charAt(i) == '^') {
      negate = true;
      i++;
    }

    boolean matched = false;
    while (i < end) {
      final char c = pattern.charAt(i);
      if (c == '\\' && i + 1 < end) {
        matched |= pattern.charAt(i + 1) == ch;
        i += 2;
      } else if (i + 2 < end && pattern.charAt(i + 1) == '-') {
        char low = c;
        char high = pattern.charAt(i + 2);
        if (low > high) {
          final char swap = low;
          low = high;
          high = swap;
        }
        matched |= ch >= low && ch <= high;
        i += 3;
      } else {
        matched |= c == ch;
        i++;
      }
    }
    return negate != matched;
  }
}
