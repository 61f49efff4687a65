package io.trielex.table.internal_api.collections;

/**
 * Immutable membership bitmap over the 128 ASCII code points.
 *
 * <p>Two {@code long} words, zero hashing. Characters outside {@code 0..127} are never members.
 */
public final class AsciiSet {
  private final long low;
  private final long high;

  private AsciiSet(long low, long high) {
    this.low = low;
    this.high = high;
  }

  /**
   * Builds a set from the ASCII characters of {@code chars}; any other character is skipped.
   *
   * @param chars the characters to include, duplicates allowed
   * @return the set of ASCII members
   */
  public static AsciiSet of(CharSequence chars) {
    long low = 0L;
    long high = 0L;
    for (int i = 0; i < chars.length(); i++) {
      char c = chars.charAt(i);
      if (c < 64) {
        low |= 1L << c;
      } else if (c < 128) {
        high |= 1L << (c - 64);
      }
    }
    return new AsciiSet(low, high);
  }

  public boolean contains(char c) {
    if (c < 64) {
      return (low & (1L << c)) != 0;
    }
    if (c < 128) {
      return (high & (1L << (c - 64))) != 0;
    }
    return false;
  }

  /** Returns {@code true} when every character of {@code s} is in {@code 0..127}. */
  public static boolean isAscii(CharSequence s) {
    for (int i = 0; i < s.length(); i++) {
      if (s.charAt(i) > 127) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof AsciiSet)) return false;
    AsciiSet other = (AsciiSet) o;
    return low == other.low && high == other.high;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(low) * 31 + Long.hashCode(high);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("AsciiSet[");
    for (char c = 0; c < 128; c++) {
      if (contains(c)) {
        sb.append(c);
      }
    }
    return sb.append(']').toString();
  }
}
