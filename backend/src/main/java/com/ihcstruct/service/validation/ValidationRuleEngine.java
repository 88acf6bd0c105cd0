package com.ihcstruct.service.validation;

import com.ihcstruct.model.dictionary.MarkerDefinition;
import com.ihcstruct.model.dictionary.MarkerDictionary;
import com.ihcstruct.model.enums.CaseStatus;
import com.ihcstruct.model.enums.IssueCode;
import com.ihcstruct.model.enums.MarkerField;
import com.ihcstruct.model.enums.MarkerRequirement;
import com.ihcstruct.model.enums.MarkerResult;
import com.ihcstruct.model.state.CaseAccumulator;
import com.ihcstruct.model.state.MarkerState;
import com.ihcstruct.model.validation.IssueLog;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Validation Rule Engine
 *
 * Runs once over the merged markers, in first-seen order. Per marker the rules
 * run in this order:
 * 1. RESULT_MISSING (error)
 * 2. CONTRADICTORY_RESULT_PERCENT (error) - Negative with percent above zero
 * 3. INVALID_PATTERN (error) / UNUSUAL_PATTERN (warning) - pattern outside the allowed set
 * 4. PERCENT_REQUIRED_MISSING - error, or warning when only an approximate percent was given
 * 5. INTENSITY_REQUIRED_MISSING (error)
 * 6. PERCENT_OUT_OF_RANGE (error) - outside [0, 100]
 *
 * Requirement rules skip markers reported as Not Done.
 */
@Service
public class ValidationRuleEngine {

    private static final List<MarkerRule> RULES = List.of(
        ValidationRuleEngine::resultPresent,
        ValidationRuleEngine::negativeWithoutPercent,
        ValidationRuleEngine::patternAllowed,
        ValidationRuleEngine::percentWhenRequired,
        ValidationRuleEngine::intensityWhenRequired,
        ValidationRuleEngine::percentInRange
    );

    /**
     * Validate all merged markers and return the resulting case status.
     */
    public CaseStatus validate(CaseAccumulator accumulator, MarkerDictionary dictionary) {
        IssueLog issues = accumulator.issues();
        for (MarkerState state : accumulator.markers()) {
            MarkerDefinition definition = dictionary.require(state.getMarkerCanonical());
            for (MarkerRule rule : RULES) {
                rule.check(state, definition, issues);
            }
        }
        return issues.status();
    }

    // ========================================================================
    // Rules
    // ========================================================================

    static void resultPresent(MarkerState state, MarkerDefinition definition, IssueLog issues) {
        if (state.getResult() == null) {
            String can = state.getMarkerCanonical();
            issues.error(IssueCode.RESULT_MISSING, "Missing result for " + can + ".", can, MarkerField.RESULT);
        }
    }

    static void negativeWithoutPercent(MarkerState state, MarkerDefinition definition, IssueLog issues) {
        Double percent = state.getPercentPositive();
        if (state.getResult() == MarkerResult.NEGATIVE && percent != null && percent > 0) {
            String can = state.getMarkerCanonical();
            issues.error(IssueCode.CONTRADICTORY_RESULT_PERCENT,
                "Negative result with non-zero percent for " + can + ".", can, MarkerField.PERCENT_POSITIVE);
        }
    }

    static void patternAllowed(MarkerState state, MarkerDefinition definition, IssueLog issues) {
        if (state.getPattern() == null || definition.allowsPattern(state.getPattern())) {
            return;
        }
        String can = state.getMarkerCanonical();
        String pattern = state.getPattern().getValue();
        if (definition.hardPatternEnforce()) {
            issues.error(IssueCode.INVALID_PATTERN,
                "Invalid pattern for " + can + ": " + pattern, can, MarkerField.PATTERN);
        } else {
            issues.warning(IssueCode.UNUSUAL_PATTERN,
                "Unusual pattern for " + can + ": " + pattern, can, MarkerField.PATTERN);
        }
    }

    static void percentWhenRequired(MarkerState state, MarkerDefinition definition, IssueLog issues) {
        if (!definition.requires(MarkerRequirement.PERCENT_REQUIRED)
                || state.getResult() == MarkerResult.NOT_DONE
                || state.getPercentPositive() != null) {
            return;
        }
        String can = state.getMarkerCanonical();
        if (state.isPercentApproximate()) {
            issues.warning(IssueCode.PERCENT_REQUIRED_MISSING,
                "Exact percent required for " + can + "; approximate provided.", can, MarkerField.PERCENT_POSITIVE);
        } else {
            issues.error(IssueCode.PERCENT_REQUIRED_MISSING,
                "Percent required for " + can + ".", can, MarkerField.PERCENT_POSITIVE);
        }
    }

    static void intensityWhenRequired(MarkerState state, MarkerDefinition definition, IssueLog issues) {
        if (definition.requires(MarkerRequirement.INTENSITY_REQUIRED)
                && state.getResult() != MarkerResult.NOT_DONE
                && state.getIntensity() == null) {
            String can = state.getMarkerCanonical();
            issues.error(IssueCode.INTENSITY_REQUIRED_MISSING,
                "Intensity required for " + can + ".", can, MarkerField.INTENSITY);
        }
    }

    static void percentInRange(MarkerState state, MarkerDefinition definition, IssueLog issues) {
        Double percent = state.getPercentPositive();
        if (percent != null && (percent < 0 || percent > 100)) {
            String can = state.getMarkerCanonical();
            issues.error(IssueCode.PERCENT_OUT_OF_RANGE,
                "Percent out of range for " + can + ".", can, MarkerField.PERCENT_POSITIVE);
        }
    }
}
