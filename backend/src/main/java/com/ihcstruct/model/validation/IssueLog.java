package com.ihcstruct.model.validation;

import com.ihcstruct.model.enums.CaseStatus;
import com.ihcstruct.model.enums.IssueCode;
import com.ihcstruct.model.enums.IssueSeverity;
import com.ihcstruct.model.enums.MarkerField;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered error and warning sequences for one case.
 */
public class IssueLog {

    private final List<ValidationIssue> errors = new ArrayList<>();
    private final List<ValidationIssue> warnings = new ArrayList<>();

    public void error(IssueCode code, String message, String markerCanonical, MarkerField field) {
        errors.add(new ValidationIssue(code, message, IssueSeverity.ERROR, markerCanonical, field));
    }

    public void warning(IssueCode code, String message, String markerCanonical, MarkerField field) {
        warnings.add(new ValidationIssue(code, message, IssueSeverity.WARNING, markerCanonical, field));
    }

    public List<ValidationIssue> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<ValidationIssue> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    /**
     * failed if any error, needs_review if only warnings, ok otherwise.
     */
    public CaseStatus status() {
        if (!errors.isEmpty()) {
            return CaseStatus.FAILED;
        }
        if (!warnings.isEmpty()) {
            return CaseStatus.NEEDS_REVIEW;
        }
        return CaseStatus.OK;
    }
}
