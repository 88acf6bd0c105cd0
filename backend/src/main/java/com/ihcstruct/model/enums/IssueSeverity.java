package com.ihcstruct.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of a validation issue. Errors fail the case, warnings only flag it for review.
 */
public enum IssueSeverity {
    ERROR("error"),
    WARNING("warning");

    private final String value;

    IssueSeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static IssueSeverity fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (IssueSeverity severity : values()) {
            if (severity.value.equals(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown IssueSeverity: " + value);
    }
}
