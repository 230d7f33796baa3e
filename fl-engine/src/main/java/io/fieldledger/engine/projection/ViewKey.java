package io.fieldledger.engine.projection;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/** Addressable sections of an {@link OperationView}. */
public enum ViewKey {
    OPERATION("operation"),
    FACILITIES("facilities"),
    ROSTER("roster"),
    GEOGRAPHY("geography"),
    METRICS("metrics"),
    WORK_ASSIGNMENTS("work-assignments"),
    IAP("iap"),
    CONFLICTS("conflicts");

    private final String path;

    ViewKey(String path) {
        this.path = path;
    }

    @JsonValue
    public String path() {
        return path;
    }

    public static ViewKey fromPath(String path) {
        return Arrays.stream(values())
                .filter(k -> k.path.equals(path))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown view '" + path + "'"));
    }
}
