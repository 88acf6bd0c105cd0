package com.ihcstruct.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Staining intensity grade.
 */
public enum StainingIntensity {
    WEAK("weak"),
    MODERATE("moderate"),
    STRONG("strong");

    private final String value;

    StainingIntensity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static StainingIntensity fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (StainingIntensity v : values()) {
            if (v.value.equalsIgnoreCase(value)) {
                return v;
            }
        }
        throw new IllegalArgumentException("Unknown StainingIntensity: " + value);
    }
}
