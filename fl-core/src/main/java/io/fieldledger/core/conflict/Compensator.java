package io.fieldledger.core.conflict;

import io.fieldledger.core.Event;
import io.fieldledger.core.EventKind;
import io.fieldledger.core.payload.Payload;

/** Builds the events a merge function emits to undo a losing candidate. */
@FunctionalInterface
public interface Compensator {

    /**
     * Event caused by {@code cause}. Must be deterministic: every replica deriving from the
     * same cause gets the same id and hash, so duplicate compensations collapse on append.
     */
    Event derive(Event cause, EventKind kind, Payload payload);
}
