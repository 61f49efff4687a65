package io.trielex.table.impl;

import it.unimi.dsi.fastutil.chars.CharArrayList;
import it.unimi.dsi.fastutil.chars.CharList;
import it.unimi.dsi.fastutil.chars.CharLists;

/**
 * One pattern element: a literal character or a character class, optionally repeated one or
 * more times.
 *
 * <p>A literal is represented as a class with a single member. Members are distinct and kept in
 * first-occurrence order.
 *
 * @param chars class members, never empty
 * @param literal {@code true} if written as a bare character rather than a bracketed class
 * @param repeated {@code true} if followed by {@code +}
 */
public record Atom(CharList chars, boolean literal, boolean repeated) {

  public Atom {
    if (chars.isEmpty()) {
      throw new IllegalArgumentException("atom must have at least one character");
    }
    chars = CharLists.unmodifiable(new CharArrayList(chars));
  }

  static Atom literal(char c, boolean repeated) {
    return new Atom(CharArrayList.wrap(new char[] {c}), true, repeated);
  }

  static Atom charClass(CharList members, boolean repeated) {
    return new Atom(members, false, repeated);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (literal) {
      sb.append(chars.getChar(0));
    } else {
      sb.append('[');
      for (int i = 0; i < chars.size(); i++) {
        sb.append(chars.getChar(i));
      }
      sb.append(']');
    }
    if (repeated) {
      sb.append('+');
    }
    return sb.toString();
  }
}
