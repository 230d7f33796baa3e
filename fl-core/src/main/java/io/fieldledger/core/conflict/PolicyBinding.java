package io.fieldledger.core.conflict;

import io.fieldledger.core.EventKind;

/** One row of the policy table. {@code mergeFunction} is set only for {@link ConflictPolicy#DOMAIN}. */
public record PolicyBinding(EventKind kind, ConflictPolicy policy, String mergeFunction) {
    @Override
    public String toString() {
        return kind.wireName() + "=" + (mergeFunction == null ? policy : policy + ":" + mergeFunction);
    }
}
