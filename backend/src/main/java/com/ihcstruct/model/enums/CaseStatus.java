package com.ihcstruct.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Overall case status derived from the validation issues.
 */
public enum CaseStatus {
    OK("ok"),
    NEEDS_REVIEW("needs_review"),
    FAILED("failed");

    private final String value;

    CaseStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static CaseStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (CaseStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown CaseStatus: " + value);
    }
}
