package io.fieldledger.core.payload;

import java.util.Set;

public record WorkAssignmentCreated(String assignmentId, String title, String priority, String facilityId)
        implements Payload {
    public static final Set<String> PRIORITIES = Set.of("high", "medium", "low");

    @Override public String target() { return "work:" + assignmentId; }

    @Override
    public void validate(int schemaVersion) {
        Fields.requireText(assignmentId, "assignmentId");
        Fields.requireText(title, "title");
        Fields.requireOneOf(priority, "priority", PRIORITIES);
    }
}
