package io.fieldledger.core.payload;

/**
 * v1 had no capacity; v2 requires it.
 */
public record FacilityCreated(String facilityId, String facilityType, String name,
                              String address, String county, Integer capacity) implements Payload {
    @Override public String target() { return "facility:" + facilityId; }

    @Override
    public void validate(int schemaVersion) {
        Fields.requireText(facilityId, "facilityId");
        Fields.requireText(facilityType, "facilityType");
        Fields.requireText(name, "name");
        if (schemaVersion >= 2) {
            Fields.requireNonNegative(capacity, "capacity");
        } else {
            Fields.optionalNonNegative(capacity, "capacity");
        }
    }

    public FacilityCreated withCapacity(int value) {
        return new FacilityCreated(facilityId, facilityType, name, address, county, value);
    }
}
