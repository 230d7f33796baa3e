package io.fieldledger.core.conflict;

import io.fieldledger.core.Event;

import java.util.List;

/** Outcome of resolving concurrent candidates on one target. */
public sealed interface Resolution {

    ConflictPolicy policy();

    /** LWW or FWW picked one candidate. */
    record Selected(ConflictPolicy policy, Event winner, List<Event> losers) implements Resolution {
        public Selected {
            losers = List.copyOf(losers);
        }
    }

    /** Every candidate contributed to the value. */
    record Merged(MergeValue value, List<Event> inputs) implements Resolution {
        public Merged {
            inputs = List.copyOf(inputs);
        }

        @Override
        public ConflictPolicy policy() {
            return ConflictPolicy.CRDT;
        }
    }

    /** A merge function kept one candidate and undid the others with compensating events. */
    record Compensated(String mergeFunction, Event winner, List<Event> losers, List<Event> compensations)
            implements Resolution {
        public Compensated {
            losers = List.copyOf(losers);
            compensations = List.copyOf(compensations);
        }

        @Override
        public ConflictPolicy policy() {
            return ConflictPolicy.DOMAIN;
        }
    }

    record Queued(ManualConflict conflict) implements Resolution {
        @Override
        public ConflictPolicy policy() {
            return ConflictPolicy.MANUAL;
        }
    }
}
