package io.fieldledger.core.payload;

public record WorkAssignmentUpdated(String assignmentId, String title, String priority) implements Payload {
    @Override public String target() { return "work:" + assignmentId; }

    @Override
    public void validate(int schemaVersion) {
        Fields.requireText(assignmentId, "assignmentId");
        Fields.requireAny("title|priority", title, priority);
        Fields.optionalOneOf(priority, "priority", WorkAssignmentCreated.PRIORITIES);
    }
}
