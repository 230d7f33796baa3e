package io.fieldledger.core.payload;

import java.util.Set;

public record FacilityStatusChanged(String facilityId, String status) implements Payload {
    public static final Set<String> STATUSES = Set.of("planned", "open", "standby", "closed");

    @Override public String target() { return "facility:" + facilityId + ":status"; }

    @Override
    public void validate(int schemaVersion) {
        Fields.requireText(facilityId, "facilityId");
        Fields.requireOneOf(status, "status", STATUSES);
    }
}
