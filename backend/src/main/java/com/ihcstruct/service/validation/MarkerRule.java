package com.ihcstruct.service.validation;

import com.ihcstruct.model.dictionary.MarkerDefinition;
import com.ihcstruct.model.state.MarkerState;
import com.ihcstruct.model.validation.IssueLog;

/**
 * One validation check over a merged marker record.
 */
@FunctionalInterface
public interface MarkerRule {

    void check(MarkerState state, MarkerDefinition definition, IssueLog issues);
}
