package io.trielex.table.api;

/**
 * Base exception for all errors reported by a {@link Table}.
 * Provides contextual information to help with debugging.
 */
public class TableException extends Exception {
    private final String context;
    private final String errorCode;

    public TableException(String message) {
        this(message, null, null);
    }

    public TableException(String message, String context, String errorCode) {
        super(formatMessage(message, context, errorCode));
        this.context = context;
        this.errorCode = errorCode;
    }

    private static String formatMessage(String message, String context, String errorCode) {
        StringBuilder sb = new StringBuilder(message);
        if (context != null) {
            sb.append(" [Context: ").append(context).append("]");
        }
        if (errorCode != null) {
            sb.append(" [Error Code: ").append(errorCode).append("]");
        }
        return sb.toString();
    }

    public String getContext() {
        return context;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
