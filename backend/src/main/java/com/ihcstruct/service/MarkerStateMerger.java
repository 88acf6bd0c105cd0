package com.ihcstruct.service;

import com.ihcstruct.model.enums.ControlStatus;
import com.ihcstruct.model.enums.IssueCode;
import com.ihcstruct.model.enums.MarkerField;
import com.ihcstruct.model.enums.MarkerResult;
import com.ihcstruct.model.enums.ResultConfidence;
import com.ihcstruct.model.extraction.Clause;
import com.ihcstruct.model.extraction.ExtractedAttributes;
import com.ihcstruct.model.extraction.MarkerSegment;
import com.ihcstruct.model.state.CaseAccumulator;
import com.ihcstruct.model.state.EvidenceSpan;
import com.ihcstruct.model.state.MarkerState;
import com.ihcstruct.model.validation.IssueLog;
import com.ihcstruct.service.extraction.AttributeExtractor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Marker State Merger
 *
 * Folds marker segments into a {@link CaseAccumulator}, one clause at a time:
 * {@link #openCase} -> {@link #mergeClause} per clause -> {@link #closeCase}.
 *
 * Result resolution for a segment, in order:
 * 1. The segment's own result
 * 2. The clause-level result
 * 3. Negative, if the clause says "negative for"
 * 4. Positive (inferred), if the segment carries pattern/intensity/percent/extent
 *
 * Merge rules per marker:
 * - result: last write wins; a differing non-null result also raises CONTRADICTORY_RESULT
 * - pattern, intensity, extent, percent: any non-null value overwrites
 * - controls, confidence: only non-default values overwrite
 * - approximate percent: sticky flag plus PERCENT_APPROXIMATE warning
 */
@Service
public class MarkerStateMerger {

    private static final Pattern DIAGNOSTIC_LANGUAGE = Pattern.compile(
        "\\b(supports?|consistent with|suggestive of|favor|favours?|primary|metastasis|metastatic)\\b",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern NEGATIVE_FOR = Pattern.compile("\\bnegative\\s+for\\b", Pattern.CASE_INSENSITIVE);

    // Case-sensitive: polarity words must be lower case
    private static final Pattern UNKNOWN_MARKER_SHAPE = Pattern.compile("\\b([A-Za-z]{2,}\\d*)\\s+(?:positive|negative)\\b");

    private static final int MIN_UNKNOWN_TOKEN_LENGTH = 3;

    private final AttributeExtractor attributeExtractor;

    public MarkerStateMerger(AttributeExtractor attributeExtractor) {
        this.attributeExtractor = attributeExtractor;
    }

    // ========================================================================
    // Case lifecycle
    // ========================================================================

    /**
     * Start a new fold for a case. Flags diagnostic wording in the raw text up front.
     */
    public CaseAccumulator openCase(String rawText) {
        CaseAccumulator accumulator = new CaseAccumulator();
        if (rawText != null && DIAGNOSTIC_LANGUAGE.matcher(rawText).find()) {
            accumulator.issues().warning(IssueCode.DIAGNOSTIC_LANGUAGE_DETECTED,
                "Diagnostic language found in input.", null, null);
        }
        return accumulator;
    }

    /**
     * Merge one clause. With no segments the clause is scanned for unknown markers instead.
     */
    public void mergeClause(Clause clause, List<MarkerSegment> segments, CaseAccumulator accumulator) {
        if (segments.isEmpty()) {
            flagUnknownMarkers(clause, accumulator.issues());
            return;
        }

        ExtractedAttributes clauseLevel = attributeExtractor.extract(clause.text());
        boolean negativeFor = NEGATIVE_FOR.matcher(clause.text()).find();

        for (MarkerSegment segment : segments) {
            ExtractedAttributes attributes = attributeExtractor.extract(segment.text());
            attributes = resolveResult(attributes, clauseLevel, negativeFor);
            apply(segment, attributes, clause.index(), accumulator);
        }
    }

    /**
     * Finish the fold. A case without any marker gets a single NO_MARKERS_FOUND error.
     */
    public void closeCase(CaseAccumulator accumulator) {
        if (!accumulator.hasMarkers()) {
            accumulator.issues().error(IssueCode.NO_MARKERS_FOUND, "No known markers found.", null, null);
        }
    }

    // ========================================================================
    // Segment merge
    // ========================================================================

    /**
     * Fill a missing segment result from clause-level fallbacks.
     */
    ExtractedAttributes resolveResult(ExtractedAttributes segment, ExtractedAttributes clauseLevel, boolean negativeFor) {
        if (segment.result() != null) {
            return segment;
        }
        if (clauseLevel.result() != null) {
            return segment.withResult(clauseLevel.result());
        }
        if (negativeFor) {
            return segment.withResult(MarkerResult.NEGATIVE);
        }
        return segment;
    }

    /**
     * Apply already-resolved attributes for one segment to the marker's running state.
     */
    public void apply(MarkerSegment segment, ExtractedAttributes attributes, int clauseIndex,
                      CaseAccumulator accumulator) {
        IssueLog issues = accumulator.issues();
        String canonical = segment.markerCanonical();
        MarkerState state = accumulator.stateFor(segment);

        MarkerResult result = attributes.result();
        if (result == null && attributes.hasSupportingAttributes()) {
            result = MarkerResult.POSITIVE;
            state.setConfidence(ResultConfidence.INFERRED);
            issues.warning(IssueCode.RESULT_INFERRED,
                "Result inferred from attributes for " + canonical + ".", canonical, MarkerField.RESULT);
        }

        if (result != null) {
            MarkerResult previous = state.getResult();
            if (previous != null && previous != result) {
                issues.error(IssueCode.CONTRADICTORY_RESULT,
                    "Conflicting results for " + canonical + ".", canonical, MarkerField.RESULT);
            }
            state.setResult(result);
        }

        if (attributes.pattern() != null) {
            state.setPattern(attributes.pattern());
        }
        if (attributes.intensity() != null) {
            state.setIntensity(attributes.intensity());
        }
        if (attributes.extent() != null) {
            state.setExtent(attributes.extent());
        }
        if (attributes.percent() != null) {
            state.setPercentPositive(attributes.percent());
        }

        if (attributes.controls() != ControlStatus.NOT_MENTIONED) {
            state.setControls(attributes.controls());
        }

        if (attributes.isHedged()) {
            state.setConfidence(ResultConfidence.UNCERTAIN);
            issues.warning(IssueCode.LOW_CONFIDENCE,
                "Uncertain wording for " + canonical + ".", canonical, null);
        }

        if (attributes.percentApproximate()) {
            state.setPercentApproximate(true);
            issues.warning(IssueCode.PERCENT_APPROXIMATE,
                "Approximate/range percent for " + canonical + ".", canonical, MarkerField.PERCENT_POSITIVE);
        }

        state.getEvidence().add(new EvidenceSpan(segment.text(), clauseIndex, segment.start(), segment.end()));
    }

    // ========================================================================
    // Unknown markers
    // ========================================================================

    private void flagUnknownMarkers(Clause clause, IssueLog issues) {
        Matcher m = UNKNOWN_MARKER_SHAPE.matcher(clause.text());
        while (m.find()) {
            String token = m.group(1);
            if (token.length() < MIN_UNKNOWN_TOKEN_LENGTH) {
                continue; // short acronyms are mostly noise
            }
            issues.error(IssueCode.UNKNOWN_MARKER, "Unknown marker: " + token, null, MarkerField.MARKER_NAME);
        }
    }
}
