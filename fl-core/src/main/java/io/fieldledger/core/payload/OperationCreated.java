package io.fieldledger.core.payload;

public record OperationCreated(String operationNumber, String operationName, String disasterType,
                               String activationLevel, String drNumber) implements Payload {
    @Override public String target() { return "operation"; }

    @Override
    public void validate(int schemaVersion) {
        Fields.requireText(operationNumber, "operationNumber");
        Fields.requireText(operationName, "operationName");
        Fields.requireText(disasterType, "disasterType");
        Fields.requireText(activationLevel, "activationLevel");
    }
}
