package com.ihcstruct.model.enums;

/**
 * Codes for validation issues. Serialized by name.
 */
public enum IssueCode {
    // Raised while merging clauses
    DIAGNOSTIC_LANGUAGE_DETECTED,
    RESULT_INFERRED,
    CONTRADICTORY_RESULT,
    LOW_CONFIDENCE,
    PERCENT_APPROXIMATE,
    UNKNOWN_MARKER,
    NO_MARKERS_FOUND,

    // Raised by the rule engine over merged state
    RESULT_MISSING,
    CONTRADICTORY_RESULT_PERCENT,
    INVALID_PATTERN,
    UNUSUAL_PATTERN,
    PERCENT_REQUIRED_MISSING,
    INTENSITY_REQUIRED_MISSING,
    PERCENT_OUT_OF_RANGE
}
