package io.fieldledger.core.payload;

public record WorkAssignmentCompleted(String assignmentId) implements Payload {
    @Override public String target() { return "work:" + assignmentId + ":completion"; }

    @Override
    public void validate(int schemaVersion) {
        Fields.requireText(assignmentId, "assignmentId");
    }
}
