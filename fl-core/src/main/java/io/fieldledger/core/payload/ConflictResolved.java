package io.fieldledger.core.payload;

import java.util.List;

/**
 * A human decision on a queued conflict. The event is caused by the chosen candidate
 * and names every rejected one.
 */
public record ConflictResolved(String conflictId, String conflictKind, String target,
                               String chosenEventId, List<String> rejectedEventIds) implements Payload {
    public ConflictResolved {
        rejectedEventIds = rejectedEventIds == null ? null : List.copyOf(rejectedEventIds);
    }

    @Override public String target() { return "conflict:" + conflictId; }

    @Override
    public void validate(int schemaVersion) {
        Fields.requireText(conflictId, "conflictId");
        Fields.requireText(conflictKind, "conflictKind");
        Fields.requireText(target, "target");
        Fields.requireText(chosenEventId, "chosenEventId");
        Fields.requireTexts(rejectedEventIds, "rejectedEventIds");
    }
}
