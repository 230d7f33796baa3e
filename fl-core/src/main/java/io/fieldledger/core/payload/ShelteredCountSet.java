package io.fieldledger.core.payload;

public record ShelteredCountSet(Long count, String facilityId) implements Payload {
    @Override public String target() { return "metric:sheltered:" + scope(); }

    /** Facility the head count belongs to, {@code all} for an operation-wide figure. */
    public String scope() {
        return facilityId == null ? "all" : facilityId;
    }

    @Override
    public void validate(int schemaVersion) {
        Fields.requireNonNegative(count, "count");
    }
}
