package io.fieldledger.core.payload;

public record CountyRemoved(String countyId) implements Payload, MembershipChange {
    @Override public String target() { return "county:" + countyId; }
    @Override public String element() { return countyId; }
    @Override public boolean adds() { return false; }

    @Override
    public void validate(int schemaVersion) {
        Fields.requireText(countyId, "countyId");
    }
}
