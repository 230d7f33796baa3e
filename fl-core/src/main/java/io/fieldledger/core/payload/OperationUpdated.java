package io.fieldledger.core.payload;

public record OperationUpdated(String operationName, String disasterType, String activationLevel) implements Payload {
    @Override public String target() { return "operation"; }

    @Override
    public void validate(int schemaVersion) {
        Fields.requireAny("operationName|disasterType|activationLevel", operationName, disasterType, activationLevel);
    }
}
