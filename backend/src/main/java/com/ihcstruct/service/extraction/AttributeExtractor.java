package com.ihcstruct.service.extraction;

import com.ihcstruct.model.enums.ControlStatus;
import com.ihcstruct.model.enums.MarkerResult;
import com.ihcstruct.model.enums.ResultConfidence;
import com.ihcstruct.model.enums.StainingExtent;
import com.ihcstruct.model.enums.StainingIntensity;
import com.ihcstruct.model.enums.StainingPattern;
import com.ihcstruct.model.extraction.ExtractedAttributes;
import com.ihcstruct.model.extraction.PercentReading;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Attribute Extractor
 *
 * Rule-based reader for one span of IHC text. Each field is resolved
 * independently from its own rule table:
 * - result: precedence Not Done > Positive > Negative
 * - pattern, intensity, extent: earliest keyword in the span
 * - percent: see {@link PercentParser}
 * - controls: only read when the span talks about controls; inadequate > adequate
 * - confidence: hedge words make it uncertain
 *
 * Never throws for clinical text; anything not found stays null/default.
 */
@Service
public class AttributeExtractor {

    static final RuleTable<MarkerResult> RESULT_RULES = RuleTable.<MarkerResult>builder()
        .rule("\\b(not\\s+done|awaited|pending)\\b", MarkerResult.NOT_DONE)
        .rule("\\b(positive|positivity)\\b", MarkerResult.POSITIVE)
        .keyword("negative", MarkerResult.NEGATIVE)
        .build();

    static final RuleTable<StainingPattern> PATTERN_RULES = RuleTable.<StainingPattern>builder()
        .keyword("nuclear", StainingPattern.NUCLEAR)
        .keyword("cytoplasmic", StainingPattern.CYTOPLASMIC)
        .keyword("membranous", StainingPattern.MEMBRANOUS)
        .build();

    static final RuleTable<StainingIntensity> INTENSITY_RULES = RuleTable.<StainingIntensity>builder()
        .keyword("weak", StainingIntensity.WEAK)
        .keyword("moderate", StainingIntensity.MODERATE)
        .keyword("strong", StainingIntensity.STRONG)
        .build();

    static final RuleTable<StainingExtent> EXTENT_RULES = RuleTable.<StainingExtent>builder()
        .keyword("focal", StainingExtent.FOCAL)
        .keyword("diffuse", StainingExtent.DIFFUSE)
        .build();

    // "inadequate" is matched as a substring so "inadequately" counts too
    static final RuleTable<ControlStatus> CONTROL_RULES = RuleTable.<ControlStatus>builder()
        .rule("inadequate", ControlStatus.INADEQUATE)
        .rule("\\b(adequate|fine)\\b", ControlStatus.ADEQUATE)
        .build();

    static final RuleTable<ResultConfidence> HEDGE_RULES = RuleTable.<ResultConfidence>builder()
        .rule("\\b(maybe|kind of|around)\\b", ResultConfidence.UNCERTAIN)
        .build();

    private static final Pattern CONTROL_MENTION =
        Pattern.compile("\\b(control|controls|internal control)\\b", Pattern.CASE_INSENSITIVE);

    /**
     * Extract all attributes from a span of text.
     */
    public ExtractedAttributes extract(String text) {
        if (text == null || text.isBlank()) {
            return ExtractedAttributes.empty();
        }

        PercentReading percent = PercentParser.parse(text);

        return ExtractedAttributes.builder()
            .result(RESULT_RULES.firstRule(text))
            .pattern(PATTERN_RULES.earliestMatch(text))
            .intensity(INTENSITY_RULES.earliestMatch(text))
            .extent(EXTENT_RULES.earliestMatch(text))
            .percent(percent.value())
            .percentApproximate(percent.approximate())
            .controls(extractControls(text))
            .confidence(HEDGE_RULES.firstRule(text))
            .build();
    }

    private ControlStatus extractControls(String text) {
        if (!CONTROL_MENTION.matcher(text).find()) {
            return ControlStatus.NOT_MENTIONED;
        }
        ControlStatus status = CONTROL_RULES.firstRule(text);
        return status != null ? status : ControlStatus.NOT_MENTIONED;
    }
}
