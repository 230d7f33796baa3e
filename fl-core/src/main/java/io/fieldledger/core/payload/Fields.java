package io.fieldledger.core.payload;

import io.fieldledger.core.ValidationException;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

/** Structural checks shared by the payload records. */
final class Fields {
    private Fields() {}

    static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, "is required");
        }
    }

    static void requirePresent(Object value, String field) {
        if (value == null) throw new ValidationException(field, "is required");
    }

    static void requirePositive(Number value, String field) {
        if (value == null) throw new ValidationException(field, "is required");
        if (value.longValue() <= 0) throw new ValidationException(field, "must be positive, was " + value);
    }

    static void requireNonNegative(Number value, String field) {
        if (value == null) throw new ValidationException(field, "is required");
        if (value.longValue() < 0) throw new ValidationException(field, "must not be negative, was " + value);
    }

    static void optionalNonNegative(Number value, String field) {
        if (value != null && value.longValue() < 0) {
            throw new ValidationException(field, "must not be negative, was " + value);
        }
    }

    static void requireOneOf(String value, String field, Set<String> allowed) {
        requireText(value, field);
        optionalOneOf(value, field, allowed);
    }

    static void optionalOneOf(String value, String field, Set<String> allowed) {
        if (value != null && !allowed.contains(value)) {
            throw new ValidationException(field, "must be one of " + allowed.stream().sorted().toList() + ", was '" + value + "'");
        }
    }

    /** At least one of the optional update fields must be present. */
    static void requireAny(String fields, Object... values) {
        if (Arrays.stream(values).allMatch(v -> v == null)) {
            throw new ValidationException(fields, "at least one field must be set");
        }
    }

    static void requireTexts(List<String> values, String field) {
        if (values == null) throw new ValidationException(field, "is required");
        for (int i = 0; i < values.size(); i++) {
            requireText(values.get(i), field + "[" + i + "]");
        }
    }
}
