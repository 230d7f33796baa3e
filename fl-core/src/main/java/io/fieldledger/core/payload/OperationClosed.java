package io.fieldledger.core.payload;

public record OperationClosed(String reason) implements Payload {
    @Override public String target() { return "operation"; }

    @Override
    public void validate(int schemaVersion) {
        Fields.requireText(reason, "reason");
    }
}
