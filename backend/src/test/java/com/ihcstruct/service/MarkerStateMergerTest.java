package com.ihcstruct.service;

import com.ihcstruct.model.enums.ControlStatus;
import com.ihcstruct.model.enums.IssueCode;
import com.ihcstruct.model.enums.MarkerField;
import com.ihcstruct.model.enums.MarkerResult;
import com.ihcstruct.model.enums.ResultConfidence;
import com.ihcstruct.model.enums.StainingExtent;
import com.ihcstruct.model.enums.StainingIntensity;
import com.ihcstruct.model.enums.StainingPattern;
import com.ihcstruct.model.extraction.Clause;
import com.ihcstruct.model.extraction.ExtractedAttributes;
import com.ihcstruct.model.extraction.MarkerSegment;
import com.ihcstruct.model.state.CaseAccumulator;
import com.ihcstruct.model.state.EvidenceSpan;
import com.ihcstruct.model.state.MarkerState;
import com.ihcstruct.model.validation.ValidationIssue;
import com.ihcstruct.service.extraction.AttributeExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MarkerStateMergerTest {

    private MarkerStateMerger merger;
    private CaseAccumulator acc;

    @BeforeEach
    void setUp() {
        merger = new MarkerStateMerger(new AttributeExtractor());
        acc = merger.openCase("");
    }

    private static MarkerSegment segment(String canonical, String text) {
        return new MarkerSegment(canonical, canonical, text, 0, text.length());
    }

    private static List<IssueCode> codes(List<ValidationIssue> issues) {
        return issues.stream().map(ValidationIssue::code).toList();
    }

    @Nested
    @DisplayName("result resolution")
    class ResultResolution {

        @Test
        void segmentResultWins() {
            ExtractedAttributes seg = ExtractedAttributes.builder().result(MarkerResult.POSITIVE).build();
            ExtractedAttributes clause = ExtractedAttributes.builder().result(MarkerResult.NEGATIVE).build();

            assertThat(merger.resolveResult(seg, clause, true).result()).isEqualTo(MarkerResult.POSITIVE);
        }

        @Test
        void fallsBackToClauseResult() {
            ExtractedAttributes clause = ExtractedAttributes.builder().result(MarkerResult.NOT_DONE).build();

            assertThat(merger.resolveResult(ExtractedAttributes.empty(), clause, false).result())
                .isEqualTo(MarkerResult.NOT_DONE);
        }

        @Test
        void negativeForFallback() {
            assertThat(merger.resolveResult(ExtractedAttributes.empty(), ExtractedAttributes.empty(), true).result())
                .isEqualTo(MarkerResult.NEGATIVE);
        }

        @Test
        void staysEmptyWithoutFallbacks() {
            assertThat(merger.resolveResult(ExtractedAttributes.empty(), ExtractedAttributes.empty(), false).result())
                .isNull();
        }

        @Test
        @DisplayName("a segment without polarity borrows the clause result")
        void clauseFallbackThroughMergeClause() {
            String text = "TTF1 and CK7 positive, diffuse";
            merger.mergeClause(new Clause(0, text), List.of(
                new MarkerSegment("TTF1", "TTF-1", "TTF1 and", 0, 8),
                new MarkerSegment("CK7", "CK7", "CK7 positive, diffuse", 9, 30)
            ), acc);

            assertThat(acc.get("TTF1").getResult()).isEqualTo(MarkerResult.POSITIVE);
            assertThat(acc.get("TTF1").getExtent()).isNull();
            assertThat(acc.get("CK7").getExtent()).isEqualTo(StainingExtent.DIFFUSE);
            assertThat(acc.issues().getWarnings()).isEmpty();
        }
    }

    @Nested
    @DisplayName("apply")
    class Apply {

        @Test
        @DisplayName("supporting attributes without a result infer Positive")
        void infersPositive() {
            ExtractedAttributes attrs = ExtractedAttributes.builder()
                .pattern(StainingPattern.NUCLEAR)
                .intensity(StainingIntensity.STRONG)
                .build();

            merger.apply(segment("TTF1", "TTF1 strong nuclear staining"), attrs, 0, acc);

            MarkerState state = acc.get("TTF1");
            assertThat(state.getResult()).isEqualTo(MarkerResult.POSITIVE);
            assertThat(state.getConfidence()).isEqualTo(ResultConfidence.INFERRED);
            assertThat(acc.issues().getWarnings()).singleElement().satisfies(w -> {
                assertThat(w.code()).isEqualTo(IssueCode.RESULT_INFERRED);
                assertThat(w.markerCanonical()).isEqualTo("TTF1");
                assertThat(w.field()).isEqualTo(MarkerField.RESULT);
            });
        }

        @Test
        void nothingToInferLeavesResultMissing() {
            merger.apply(segment("ER", "ER"), ExtractedAttributes.empty(), 0, acc);

            assertThat(acc.get("ER").getResult()).isNull();
            assertThat(acc.issues().getWarnings()).isEmpty();
            assertThat(acc.issues().getErrors()).isEmpty();
        }

        @Test
        @DisplayName("differing results raise CONTRADICTORY_RESULT and the last one wins")
        void lastResultWins() {
            merger.apply(segment("HER2", "HER2 positive"),
                ExtractedAttributes.builder().result(MarkerResult.POSITIVE).build(), 0, acc);
            merger.apply(segment("HER2", "HER2 negative"),
                ExtractedAttributes.builder().result(MarkerResult.NEGATIVE).build(), 1, acc);

            assertThat(acc.get("HER2").getResult()).isEqualTo(MarkerResult.NEGATIVE);
            assertThat(codes(acc.issues().getErrors())).containsExactly(IssueCode.CONTRADICTORY_RESULT);
        }

        @Test
        void repeatedSameResultIsQuiet() {
            ExtractedAttributes positive = ExtractedAttributes.builder().result(MarkerResult.POSITIVE).build();
            merger.apply(segment("ER", "ER positive"), positive, 0, acc);
            merger.apply(segment("ER", "ER positive"), positive, 1, acc);

            assertThat(acc.issues().getErrors()).isEmpty();
            assertThat(acc.get("ER").getEvidence()).hasSize(2);
        }

        @Test
        @DisplayName("later non-null fields overwrite, nulls never erase")
        void fieldsOverwrite() {
            merger.apply(segment("KI67", "Ki-67 positive, weak, 10%"), ExtractedAttributes.builder()
                .result(MarkerResult.POSITIVE)
                .intensity(StainingIntensity.WEAK)
                .percent(10.0)
                .build(), 0, acc);
            merger.apply(segment("KI67", "Ki-67 strong, 30%"), ExtractedAttributes.builder()
                .intensity(StainingIntensity.STRONG)
                .percent(30.0)
                .build(), 1, acc);

            MarkerState state = acc.get("KI67");
            assertThat(state.getResult()).isEqualTo(MarkerResult.POSITIVE);
            assertThat(state.getIntensity()).isEqualTo(StainingIntensity.STRONG);
            assertThat(state.getPercentPositive()).isEqualTo(30.0);
        }

        @Test
        void controlsOnlyOverwriteWhenMentioned() {
            merger.apply(segment("ER", "ER positive, controls adequate"), ExtractedAttributes.builder()
                .result(MarkerResult.POSITIVE)
                .controls(ControlStatus.ADEQUATE)
                .build(), 0, acc);
            merger.apply(segment("ER", "ER positive"),
                ExtractedAttributes.builder().result(MarkerResult.POSITIVE).build(), 1, acc);

            assertThat(acc.get("ER").getControls()).isEqualTo(ControlStatus.ADEQUATE);
        }

        @Test
        void hedgedWordingLowersConfidence() {
            merger.apply(segment("ER", "ER maybe positive"), ExtractedAttributes.builder()
                .result(MarkerResult.POSITIVE)
                .confidence(ResultConfidence.UNCERTAIN)
                .build(), 0, acc);

            assertThat(acc.get("ER").getConfidence()).isEqualTo(ResultConfidence.UNCERTAIN);
            assertThat(codes(acc.issues().getWarnings())).containsExactly(IssueCode.LOW_CONFIDENCE);
        }

        @Test
        @DisplayName("an approximate percent stays flagged after a later exact one")
        void approximateIsSticky() {
            merger.apply(segment("HER2", "HER2 positive in 10 to 20 percent"), ExtractedAttributes.builder()
                .result(MarkerResult.POSITIVE)
                .percentApproximate(true)
                .build(), 0, acc);
            merger.apply(segment("HER2", "HER2 15%"),
                ExtractedAttributes.builder().percent(15.0).build(), 1, acc);

            MarkerState state = acc.get("HER2");
            assertThat(state.isPercentApproximate()).isTrue();
            assertThat(state.getPercentPositive()).isEqualTo(15.0);
            assertThat(codes(acc.issues().getWarnings())).containsExactly(IssueCode.PERCENT_APPROXIMATE);
        }

        @Test
        void evidenceRecordsClauseAndOffsets() {
            merger.apply(new MarkerSegment("PR", "PR", "PR negative", 13, 24),
                ExtractedAttributes.builder().result(MarkerResult.NEGATIVE).build(), 2, acc);

            assertThat(acc.get("PR").getEvidence())
                .containsExactly(new EvidenceSpan("PR negative", 2, 13, 24));
        }
    }

    @Nested
    @DisplayName("case lifecycle")
    class Lifecycle {

        @Test
        void diagnosticLanguageWarning() {
            CaseAccumulator diag = merger.openCase("Findings consistent with lung primary");

            assertThat(codes(diag.issues().getWarnings())).containsExactly(IssueCode.DIAGNOSTIC_LANGUAGE_DETECTED);
            assertThat(merger.openCase("ER positive").issues().getWarnings()).isEmpty();
        }

        @Test
        void emptyCaseGetsSingleNoMarkersError() {
            merger.mergeClause(new Clause(0, "Tissue is adequate for review"), List.of(), acc);
            merger.closeCase(acc);

            assertThat(codes(acc.issues().getErrors())).containsExactly(IssueCode.NO_MARKERS_FOUND);
        }

        @Test
        void closeIsQuietWhenMarkersExist() {
            merger.apply(segment("ER", "ER positive"),
                ExtractedAttributes.builder().result(MarkerResult.POSITIVE).build(), 0, acc);
            merger.closeCase(acc);

            assertThat(acc.issues().getErrors()).isEmpty();
        }

        @Test
        void markersKeepFirstSeenOrder() {
            ExtractedAttributes positive = ExtractedAttributes.builder().result(MarkerResult.POSITIVE).build();
            merger.apply(segment("PR", "PR positive"), positive, 0, acc);
            merger.apply(segment("ER", "ER positive"), positive, 0, acc);
            merger.apply(segment("PR", "PR positive"), positive, 1, acc);

            assertThat(acc.markers()).extracting(MarkerState::getMarkerCanonical).containsExactly("PR", "ER");
        }
    }

    @Nested
    @DisplayName("unknown markers")
    class UnknownMarkers {

        @Test
        void unknownMarkerShapeIsReported() {
            merger.mergeClause(new Clause(0, "CD99 positive"), List.of(), acc);

            assertThat(acc.issues().getErrors()).singleElement().satisfies(e -> {
                assertThat(e.code()).isEqualTo(IssueCode.UNKNOWN_MARKER);
                assertThat(e.message()).isEqualTo("Unknown marker: CD99");
                assertThat(e.field()).isEqualTo(MarkerField.MARKER_NAME);
            });
        }

        @Test
        void shortTokensAreIgnored() {
            merger.mergeClause(new Clause(0, "AE positive"), List.of(), acc);

            assertThat(acc.issues().getErrors()).isEmpty();
        }

        @Test
        void polarityMustBeLowerCase() {
            merger.mergeClause(new Clause(0, "CD99 POSITIVE"), List.of(), acc);

            assertThat(acc.issues().getErrors()).isEmpty();
        }

        @Test
        void clausesWithKnownMarkersAreNotScanned() {
            String text = "ER positive, CD99 positive";
            merger.mergeClause(new Clause(0, text),
                List.of(new MarkerSegment("ER", "ER", text, 0, text.length())), acc);

            assertThat(acc.issues().getErrors()).isEmpty();
        }
    }
}
