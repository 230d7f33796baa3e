package io.fieldledger.core.payload;

public record IapSectionUpdated(Integer iapNumber, String section, String content) implements Payload {
    @Override public String target() { return "iap:" + iapNumber + ":" + section; }

    @Override
    public void validate(int schemaVersion) {
        Fields.requirePositive(iapNumber, "iapNumber");
        Fields.requireText(section, "section");
        Fields.requirePresent(content, "content");
    }
}
