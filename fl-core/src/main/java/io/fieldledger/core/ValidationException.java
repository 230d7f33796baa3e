package io.fieldledger.core;

/**
 * A candidate payload or envelope does not match the declared shape of its kind.
 * Raised before anything touches the chain and never retried automatically.
 */
public class ValidationException extends LedgerException {
    private final String field;

    public ValidationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public ValidationException(String field, String message, Throwable cause) {
        super(field + ": " + message, cause);
        this.field = field;
    }

    /** Name of the offending field (dotted path for nested values). */
    public String field() {
        return field;
    }
}
