package io.trielex.table.api;

/**
 * Exception thrown when a query passed to {@link Table#get(String)} or {@link Table#lexer(String)}
 * is not representable over the table's alphabet.
 */
public class InvalidQueryException extends TableException {

    public enum Kind {
        /** The query contains a non-ASCII character. */
        INVALID_STRING,
        /** The query contains an ASCII character outside the alphabet. */
        INVALID_CHARACTER
    }

    private final Kind kind;
    private final char character;
    private final int position;

    public InvalidQueryException(Kind kind, String message, String query, char character, int position) {
        super(message, query, kind.name());
        this.kind = kind;
        this.character = character;
        this.position = position;
    }

    public static InvalidQueryException invalidString(String query) {
        return new InvalidQueryException(
            Kind.INVALID_STRING,
            "Invalid string (non-ASCII)",
            query,
            '\0',
            -1
        );
    }

    public static InvalidQueryException invalidCharacter(String query, char ch, int position) {
        return new InvalidQueryException(
            Kind.INVALID_CHARACTER,
            String.format("Invalid character '%c' at position %d", ch, position),
            query,
            ch,
            position
        );
    }

    public Kind getKind() {
        return kind;
    }

    public char getCharacter() {
        return character;
    }

    /** 0-based position in the query, or {@code -1} if not applicable. */
    public int getPosition() {
        return position;
    }
}
