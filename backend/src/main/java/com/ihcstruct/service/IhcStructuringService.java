package com.ihcstruct.service;

import com.ihcstruct.dto.mapper.CaseOutputMapper;
import com.ihcstruct.dto.request.IhcCaseRequest;
import com.ihcstruct.dto.response.CaseOutput;
import com.ihcstruct.dto.response.CaseOutput.RenderedSection;
import com.ihcstruct.model.dictionary.MarkerDictionary;
import com.ihcstruct.model.enums.CaseStatus;
import com.ihcstruct.model.extraction.Clause;
import com.ihcstruct.model.extraction.MarkerMention;
import com.ihcstruct.model.extraction.MarkerSegment;
import com.ihcstruct.model.state.CaseAccumulator;
import com.ihcstruct.service.extraction.ClauseSplitter;
import com.ihcstruct.service.extraction.MarkerLocator;
import com.ihcstruct.service.extraction.SegmentScoper;
import com.ihcstruct.service.validation.ValidationRuleEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * IHC Structuring Service
 *
 * Runs one case through the pipeline:
 * 1. Split raw text into clauses
 * 2. Per clause: locate markers, scope segments, merge into the case accumulator
 * 3. Validate the merged markers
 * 4. Render narrative and table
 *
 * Each call owns its own accumulator; the dictionary is read-only, so cases
 * can be processed concurrently.
 */
@Service
@Slf4j
public class IhcStructuringService {

    private final ClauseSplitter clauseSplitter;
    private final MarkerLocator markerLocator;
    private final SegmentScoper segmentScoper;
    private final MarkerStateMerger markerStateMerger;
    private final ValidationRuleEngine validationRuleEngine;
    private final NarrativeRenderer narrativeRenderer;
    private final CaseOutputMapper caseOutputMapper;
    private final MarkerDictionary markerDictionary;

    public IhcStructuringService(
            ClauseSplitter clauseSplitter,
            MarkerLocator markerLocator,
            SegmentScoper segmentScoper,
            MarkerStateMerger markerStateMerger,
            ValidationRuleEngine validationRuleEngine,
            NarrativeRenderer narrativeRenderer,
            CaseOutputMapper caseOutputMapper,
            MarkerDictionary markerDictionary) {
        this.clauseSplitter = clauseSplitter;
        this.markerLocator = markerLocator;
        this.segmentScoper = segmentScoper;
        this.markerStateMerger = markerStateMerger;
        this.validationRuleEngine = validationRuleEngine;
        this.narrativeRenderer = narrativeRenderer;
        this.caseOutputMapper = caseOutputMapper;
        this.markerDictionary = markerDictionary;
    }

    // ========================================================================
    // Public API
    // ========================================================================

    /**
     * Structure one case against the configured dictionary.
     */
    public CaseOutput process(IhcCaseRequest request) {
        return process(request, markerDictionary);
    }

    /**
     * Structure one case against an explicit dictionary.
     *
     * @throws IllegalArgumentException if required case fields are missing
     */
    public CaseOutput process(IhcCaseRequest request, MarkerDictionary dictionary) {
        requireValid(request);
        if (dictionary == null) {
            throw new IllegalArgumentException("Marker dictionary is required");
        }

        String rawText = request.rawText().strip();
        List<Clause> clauses = clauseSplitter.split(rawText);
        log.debug("Case {}: {} clauses", request.inputId(), clauses.size());

        CaseAccumulator accumulator = markerStateMerger.openCase(rawText);
        for (Clause clause : clauses) {
            List<MarkerMention> mentions = markerLocator.locate(clause.text(), dictionary);
            List<MarkerSegment> segments = segmentScoper.scope(clause.text(), mentions);
            markerStateMerger.mergeClause(clause, segments, accumulator);
        }
        markerStateMerger.closeCase(accumulator);

        CaseStatus status = validationRuleEngine.validate(accumulator, dictionary);
        RenderedSection rendered = narrativeRenderer.render(
            accumulator.markers(), caseOutputMapper.specimenLabel(request));

        log.debug("Case {}: {} markers, {} errors, {} warnings, status {}",
            request.inputId(),
            accumulator.markers().size(),
            accumulator.issues().getErrors().size(),
            accumulator.issues().getWarnings().size(),
            status.getValue());

        return caseOutputMapper.toOutput(request, accumulator, status, rendered);
    }

    /**
     * Structure several independent cases, in order.
     */
    public List<CaseOutput> processAll(List<IhcCaseRequest> requests) {
        List<CaseOutput> outputs = new ArrayList<>(requests.size());
        for (IhcCaseRequest request : requests) {
            outputs.add(process(request));
        }
        return outputs;
    }

    public MarkerDictionary getMarkerDictionary() {
        return markerDictionary;
    }

    private void requireValid(IhcCaseRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Case request is required");
        }
        if (request.inputId() == null || request.inputId().isBlank()) {
            throw new IllegalArgumentException("input_id is required");
        }
        if (request.inputType() == null || request.inputType().isBlank()) {
            throw new IllegalArgumentException("input_type is required");
        }
        if (request.rawText() == null) {
            throw new IllegalArgumentException("raw_text is required");
        }
    }
}
