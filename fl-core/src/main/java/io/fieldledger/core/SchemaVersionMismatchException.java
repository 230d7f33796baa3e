package io.fieldledger.core;

import java.util.UUID;

/** An event was written with a schema version the projector cannot read directly. */
public class SchemaVersionMismatchException extends LedgerException {
    private final UUID eventId;
    private final EventKind kind;
    private final int found;
    private final int expected;

    public SchemaVersionMismatchException(UUID eventId, EventKind kind, int found, int expected) {
        super("event " + eventId + " (" + kind.wireName() + ") has schema v" + found + ", projector expects v" + expected);
        this.eventId = eventId;
        this.kind = kind;
        this.found = found;
        this.expected = expected;
    }

    public UUID eventId() { return eventId; }
    public EventKind kind() { return kind; }
    public int found() { return found; }
    public int expected() { return expected; }
}
