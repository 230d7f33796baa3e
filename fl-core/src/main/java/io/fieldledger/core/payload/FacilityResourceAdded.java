package io.fieldledger.core.payload;

public record FacilityResourceAdded(String facilityId, String resourceType, Long quantity)
        implements Payload, CounterDelta {
    @Override public String target() { return "facility:" + facilityId + ":resource:" + resourceType; }
    @Override public long delta() { return quantity; }

    @Override
    public void validate(int schemaVersion) {
        Fields.requireText(facilityId, "facilityId");
        Fields.requireText(resourceType, "resourceType");
        Fields.requirePositive(quantity, "quantity");
    }
}
