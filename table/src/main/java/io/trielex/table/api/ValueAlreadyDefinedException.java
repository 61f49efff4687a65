package io.trielex.table.api;

/**
 * Exception thrown when a pattern reaches a trie node that already carries a value. The stored
 * value is kept; the insertion that raised this exception is rolled back.
 */
public class ValueAlreadyDefinedException extends TableException {
    private final transient Object current;
    private final transient Object requested;

    public ValueAlreadyDefinedException(String pattern, Object current, Object requested) {
        super(
            String.format("Value already defined: current=%s, requested=%s", current, requested),
            pattern,
            "VALUE_ALREADY_DEFINED"
        );
        this.current = current;
        this.requested = requested;
    }

    /** The value already stored for the conflicting node. */
    public Object getCurrent() {
        return current;
    }

    /** The value passed to the failed {@link Table#add(String, Object)} call. */
    public Object getRequested() {
        return requested;
    }

    public String getPattern() {
        return getContext();
    }
}
