package com.ihcstruct.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Subcellular staining pattern.
 */
public enum StainingPattern {
    NUCLEAR("nuclear"),
    CYTOPLASMIC("cytoplasmic"),
    MEMBRANOUS("membranous");

    private final String value;

    StainingPattern(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static StainingPattern fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (StainingPattern pattern : values()) {
            if (pattern.value.equalsIgnoreCase(value)) {
                return pattern;
            }
        }
        throw new IllegalArgumentException("Unknown StainingPattern: " + value);
    }
}
