package io.trielex.table.api;

import java.util.Objects;

/**
 * A token produced by a {@link TableIterator}: the value of the longest pattern matched at
 * {@code start} and the matched text.
 *
 * @param value the value registered for the matched pattern
 * @param text the matched input substring, never empty
 * @param start 0-based offset of the first matched character
 * @param <T> value type
 */
public record Token<T>(T value, String text, int start) {

  public Token {
    Objects.requireNonNull(value, "value must not be null");
    Objects.requireNonNull(text, "text must not be null");
    if (start < 0) {
      throw new IllegalArgumentException("start must not be negative: " + start);
    }
  }

  /** Offset one past the last matched character. */
  public int end() {
    return start + text.length();
  }

  public int length() {
    return text.length();
  }
}
