package io.fieldledger.core.payload;

/** Places a person into one position; a person holds at most one active assignment. */
public record PersonAssigned(String personId, String position, String section,
                             String facilityId, String reportingTo) implements Payload {
    @Override public String target() { return "person:" + personId; }

    @Override
    public void validate(int schemaVersion) {
        Fields.requireText(personId, "personId");
        Fields.requireText(position, "position");
        Fields.requireText(section, "section");
    }
}
