package io.fieldledger.core.conflict;

import io.fieldledger.core.EventKind;
import io.fieldledger.core.LedgerException;

/** Resolution asked for a kind nobody chose a policy for. There is no default. */
public class UnconfiguredPolicyException extends LedgerException {
    private final EventKind kind;

    public UnconfiguredPolicyException(EventKind kind) {
        super("no conflict policy configured for " + kind.wireName());
        this.kind = kind;
    }

    public EventKind kind() {
        return kind;
    }
}
