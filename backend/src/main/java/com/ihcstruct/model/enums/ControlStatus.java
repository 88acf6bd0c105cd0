package com.ihcstruct.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reported state of the run controls.
 */
public enum ControlStatus {
    NOT_MENTIONED("not mentioned"),
    ADEQUATE("adequate"),
    INADEQUATE("inadequate");

    private final String value;

    ControlStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ControlStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ControlStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown ControlStatus: " + value);
    }
}
