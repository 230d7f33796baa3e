package io.fieldledger.core;

/**
 * Hash mismatch or missing predecessor in an operation stream.
 * The store refuses further appends to that stream until it is reconciled.
 */
public class ChainIntegrityException extends LedgerException {
    private final String operationId;
    private final long position;

    public ChainIntegrityException(String operationId, long position, String message) {
        super("chain break in operation " + operationId + " at position " + position + ": " + message);
        this.operationId = operationId;
        this.position = position;
    }

    public String operationId() {
        return operationId;
    }

    public long position() {
        return position;
    }
}
