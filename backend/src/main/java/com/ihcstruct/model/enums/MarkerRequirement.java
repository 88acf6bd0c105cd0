package com.ihcstruct.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per-marker reporting requirements declared in the dictionary.
 */
public enum MarkerRequirement {
    PERCENT_REQUIRED("percent_required"),
    INTENSITY_REQUIRED("intensity_required");

    private final String value;

    MarkerRequirement(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static MarkerRequirement fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (MarkerRequirement requirement : values()) {
            if (requirement.value.equalsIgnoreCase(value)) {
                return requirement;
            }
        }
        throw new IllegalArgumentException("Unknown MarkerRequirement: " + value);
    }
}
