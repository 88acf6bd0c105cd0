package com.ihcstruct.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Marker record fields a validation issue can point at.
 */
public enum MarkerField {
    RESULT("result"),
    PATTERN("pattern"),
    INTENSITY("intensity"),
    PERCENT_POSITIVE("percent_positive"),
    MARKER_NAME("marker_name");

    private final String value;

    MarkerField(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static MarkerField fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (MarkerField field : values()) {
            if (field.value.equals(value)) {
                return field;
            }
        }
        throw new IllegalArgumentException("Unknown MarkerField: " + value);
    }
}
