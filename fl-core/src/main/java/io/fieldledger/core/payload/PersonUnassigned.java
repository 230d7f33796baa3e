package io.fieldledger.core.payload;

/**
 * Ends a person's active assignment. When {@code assignmentEventId} is set only that
 * assignment is released, which is how conflict compensations are expressed.
 */
public record PersonUnassigned(String personId, String assignmentEventId, String reason) implements Payload {
    @Override public String target() { return "person:" + personId; }

    @Override
    public void validate(int schemaVersion) {
        Fields.requireText(personId, "personId");
    }
}
