package io.trielex.table.api;

/**
 * Exception raised by a {@link TableIterator} when scanning cannot continue. It ends the scan:
 * once thrown, the iterator reports no further elements.
 */
public final class LexerException extends RuntimeException {

  public enum Kind {
    /** A character outside the alphabet was met mid-scan. */
    UNKNOWN_CHAR,
    /** No pattern accepts any prefix of the input starting at the token start. */
    UNEXPECTED_END
  }

  private final Kind kind;
  private final char character;
  private final int position;

  private LexerException(Kind kind, String message, char character, int position) {
    super(message);
    this.kind = kind;
    this.character = character;
    this.position = position;
  }

  public static LexerException unknownChar(char ch, int position) {
    return new LexerException(
        Kind.UNKNOWN_CHAR,
        String.format("Unknown character '%c' at position %d", ch, position),
        ch,
        position);
  }

  public static LexerException unexpectedEnd(int position) {
    return new LexerException(
        Kind.UNEXPECTED_END, "No pattern matches at position " + position, '\0', position);
  }

  public Kind getKind() {
    return kind;
  }

  /** The unknown character, or {@code '\0'} for {@link Kind#UNEXPECTED_END}. */
  public char getCharacter() {
    return character;
  }

  /** 0-based position in the scanned input. */
  public int getPosition() {
    return position;
  }
}
