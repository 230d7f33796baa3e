package io.fieldledger.core.conflict;

import java.util.Set;

/** Result of a commutative merge. */
public sealed interface MergeValue {

    record Counter(long total) implements MergeValue {}

    /** Elements present after concurrent adds and removes; a concurrent add wins. */
    record Membership(Set<String> present) implements MergeValue {
        public Membership {
            present = Set.copyOf(present);
        }
    }
}
