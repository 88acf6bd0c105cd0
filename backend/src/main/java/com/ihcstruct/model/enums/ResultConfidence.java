package com.ihcstruct.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a marker's result was established.
 * EXPLICIT is the default; UNCERTAIN comes from hedged wording and INFERRED
 * from supporting attributes without a stated polarity.
 */
public enum ResultConfidence {
    EXPLICIT("explicit"),
    UNCERTAIN("uncertain"),
    INFERRED("inferred");

    private final String value;

    ResultConfidence(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ResultConfidence fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ResultConfidence level : values()) {
            if (level.value.equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown ResultConfidence: " + value);
    }
}
