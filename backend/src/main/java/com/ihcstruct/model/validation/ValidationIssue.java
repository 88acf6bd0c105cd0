package com.ihcstruct.model.validation;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ihcstruct.model.enums.IssueCode;
import com.ihcstruct.model.enums.IssueSeverity;
import com.ihcstruct.model.enums.MarkerField;

/**
 * One validation finding.
 *
 * @param code            machine-readable issue code
 * @param message         human-readable description
 * @param severity        ERROR fails the case, WARNING sends it to review
 * @param markerCanonical marker the issue belongs to (nullable)
 * @param field           marker field the issue points at (nullable)
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ValidationIssue(
    IssueCode code,
    String message,
    IssueSeverity severity,
    String markerCanonical,
    MarkerField field
) {
}
