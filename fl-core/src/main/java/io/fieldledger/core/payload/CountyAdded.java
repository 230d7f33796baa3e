package io.fieldledger.core.payload;

public record CountyAdded(String countyId, String countyName, String state, String fips)
        implements Payload, MembershipChange {
    @Override public String target() { return "county:" + countyId; }
    @Override public String element() { return countyId; }
    @Override public boolean adds() { return true; }

    @Override
    public void validate(int schemaVersion) {
        Fields.requireText(countyId, "countyId");
        Fields.requireText(countyName, "countyName");
        Fields.requireText(state, "state");
        Fields.requireText(fips, "fips");
    }
}
