package com.ihcstruct.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall staining result recorded for a marker.
 */
public enum MarkerResult {
    POSITIVE("Positive"),
    NEGATIVE("Negative"),
    NOT_DONE("Not Done");

    private final String value;

    MarkerResult(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static MarkerResult fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (MarkerResult result : values()) {
            if (result.value.equalsIgnoreCase(value)) {
                return result;
            }
        }
        throw new IllegalArgumentException("Unknown MarkerResult: " + value);
    }
}
