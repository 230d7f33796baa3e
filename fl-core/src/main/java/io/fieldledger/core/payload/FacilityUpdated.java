package io.fieldledger.core.payload;

public record FacilityUpdated(String facilityId, String name, String address, Integer capacity) implements Payload {
    @Override public String target() { return "facility:" + facilityId; }

    @Override
    public void validate(int schemaVersion) {
        Fields.requireText(facilityId, "facilityId");
        Fields.requireAny("name|address|capacity", name, address, capacity);
        Fields.optionalNonNegative(capacity, "capacity");
    }
}
