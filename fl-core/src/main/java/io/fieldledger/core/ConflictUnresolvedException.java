package io.fieldledger.core;

/** A manual-policy conflict has no chosen winner. Surfaced, never retried. */
public class ConflictUnresolvedException extends LedgerException {
    private final String conflictId;

    public ConflictUnresolvedException(String conflictId, String message) {
        super("conflict " + conflictId + ": " + message);
        this.conflictId = conflictId;
    }

    public String conflictId() {
        return conflictId;
    }
}
