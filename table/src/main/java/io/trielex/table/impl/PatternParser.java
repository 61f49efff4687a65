package io.trielex.table.impl;

import io.trielex.table.api.InvalidPatternException;
import io.trielex.table.internal_api.collections.AsciiSet;
import it.unimi.dsi.fastutil.chars.CharArrayList;
import it.unimi.dsi.fastutil.chars.CharList;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses a pattern into atoms. Grammar:
 *
 * <pre>
 * pattern := atom+
 * atom    := (char | '[' char+ ']') '+'?
 * </pre>
 *
 * <p>{@code [} always opens a class and {@code +} always repeats the preceding atom, even when
 * they are members of the alphabet. Inside a class every character up to the first {@code ]}
 * is a member, except that the body may not start with {@code +}. A {@code ]} outside a class is
 * an ordinary character.
 */
public final class PatternParser {
  private final String pattern;
  private final AsciiSet alphabet;
  private int pos = 0;

  private PatternParser(String pattern, AsciiSet alphabet) {
    this.pattern = pattern;
    this.alphabet = alphabet;
  }

  /**
   * Parses {@code pattern} against {@code alphabet}.
   *
   * @param pattern the pattern text
   * @param alphabet the allowed characters
   * @return the atoms in pattern order, never empty
   * @throws InvalidPatternException if the pattern is malformed or uses a character outside the
   *     alphabet
   */
  public static List<Atom> parse(String pattern, AsciiSet alphabet)
      throws InvalidPatternException {
    if (!AsciiSet.isAscii(pattern)) {
      throw InvalidPatternException.invalidString(pattern);
    }
    if (pattern.isEmpty()) {
      throw InvalidPatternException.invalidRange(pattern, 0, "empty pattern");
    }
    return new PatternParser(pattern, alphabet).parseAtoms();
  }

  private List<Atom> parseAtoms() throws InvalidPatternException {
    List<Atom> atoms = new ArrayList<>();
    while (!eof()) {
      char c = pattern.charAt(pos);
      if (c == '+') {
        throw InvalidPatternException.invalidRange(pattern, pos, "'+' without a preceding atom");
      }
      if (c == '[') {
        int open = pos++;
        CharList members = parseClassBody(open);
        atoms.add(Atom.charClass(members, consumePlus()));
      } else {
        requireInAlphabet(c, pos);
        pos++;
        atoms.add(Atom.literal(c, consumePlus()));
      }
    }
    return atoms;
  }

  private CharList parseClassBody(int open) throws InvalidPatternException {
    if (peek() == '+') {
      throw InvalidPatternException.invalidRange(pattern, pos, "'+' immediately after '['");
    }
    CharList members = new CharArrayList();
    while (!eof() && peek() != ']') {
      char c = pattern.charAt(pos);
      requireInAlphabet(c, pos);
      if (!members.contains(c)) {
        members.add(c);
      }
      pos++;
    }
    if (eof()) {
      throw InvalidPatternException.invalidRange(pattern, open, "unclosed '['");
    }
    pos++; // ]
    if (members.isEmpty()) {
      throw InvalidPatternException.invalidRange(pattern, open, "empty class");
    }
    return members;
  }

  private boolean consumePlus() {
    if (peek() == '+') {
      pos++;
      return true;
    }
    return false;
  }

  private void requireInAlphabet(char c, int offset) throws InvalidPatternException {
    if (!alphabet.contains(c)) {
      throw InvalidPatternException.invalidInput(pattern, c, offset);
    }
  }

  private int peek() {
    return eof() ? -1 : pattern.charAt(pos);
  }

  private boolean eof() {
    return pos >= pattern.length();
  }
}
