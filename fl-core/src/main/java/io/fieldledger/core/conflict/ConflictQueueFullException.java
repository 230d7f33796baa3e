package io.fieldledger.core.conflict;

import io.fieldledger.core.LedgerException;

public class ConflictQueueFullException extends LedgerException {
    public ConflictQueueFullException(int capacity) {
        super("manual conflict queue is full (" + capacity + " open conflicts)");
    }
}
