package io.trielex.table.api;

/**
 * Exception thrown by {@link Table#add(String, Object)} when a pattern cannot be parsed. The
 * table is left unchanged.
 */
public class InvalidPatternException extends TableException {

    /** What went wrong with the pattern. */
    public enum Kind {
        /** The pattern contains a non-ASCII character. */
        INVALID_STRING,
        /** A literal or class member is not part of the alphabet. */
        INVALID_INPUT,
        /** Malformed structure: unclosed or empty class, dangling {@code +}, empty pattern. */
        INVALID_RANGE
    }

    private final Kind kind;
    private final char character;
    private final int offset;

    public InvalidPatternException(Kind kind, String message, String pattern, char character, int offset) {
        super(message, pattern, kind.name());
        this.kind = kind;
        this.character = character;
        this.offset = offset;
    }

    public static InvalidPatternException invalidString(String pattern) {
        return new InvalidPatternException(
            Kind.INVALID_STRING,
            "Invalid string (non-ASCII)",
            pattern,
            '\0',
            -1
        );
    }

    public static InvalidPatternException invalidInput(String pattern, char ch, int offset) {
        return new InvalidPatternException(
            Kind.INVALID_INPUT,
            String.format("Invalid input character '%c' at offset %d", ch, offset),
            pattern,
            ch,
            offset
        );
    }

    public static InvalidPatternException invalidRange(String pattern, int offset, String reason) {
        return new InvalidPatternException(
            Kind.INVALID_RANGE,
            String.format("Invalid range at offset %d: %s", offset, reason),
            pattern,
            '\0',
            offset
        );
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The offending character, or {@code '\0'} when the error is not tied to a single character.
     */
    public char getCharacter() {
        return character;
    }

    /** 0-based offset into the pattern, or {@code -1} if not applicable. */
    public int getOffset() {
        return offset;
    }

    public String getPattern() {
        return getContext();
    }
}
