package io.fieldledger.core;

import java.util.UUID;

/**
 * An event waited too long for its cause, or the awaiting-parent buffer is full.
 * Either way the local replica needs a full sync.
 */
public class MissingParentException extends LedgerException {
    private final UUID eventId;
    private final UUID causationId;

    public MissingParentException(UUID eventId, UUID causationId, String message) {
        super("event " + eventId + " is missing parent " + causationId + ": " + message);
        this.eventId = eventId;
        this.causationId = causationId;
    }

    public UUID eventId() { return eventId; }
    public UUID causationId() { return causationId; }
}
