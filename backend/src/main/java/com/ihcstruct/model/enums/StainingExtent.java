package com.ihcstruct.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Distribution of staining across the tumour.
 */
public enum StainingExtent {
    FOCAL("focal"),
    DIFFUSE("diffuse");

    private final String value;

    StainingExtent(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static StainingExtent fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (StainingExtent v : values()) {
            if (v.value.equalsIgnoreCase(value)) {
                return v;
            }
        }
        throw new IllegalArgumentException("Unknown StainingExtent: " + value);
    }
}
