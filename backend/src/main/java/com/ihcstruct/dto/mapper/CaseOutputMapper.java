package com.ihcstruct.dto.mapper;

import com.ihcstruct.config.IhcProperties;
import com.ihcstruct.dto.request.IhcCaseRequest;
import com.ihcstruct.dto.request.IhcCaseRequest.CaseContext;
import com.ihcstruct.dto.response.CaseOutput;
import com.ihcstruct.dto.response.CaseOutput.IhcSection;
import com.ihcstruct.dto.response.CaseOutput.ProvenanceSection;
import com.ihcstruct.dto.response.CaseOutput.RenderedSection;
import com.ihcstruct.dto.response.CaseOutput.ValidationSection;
import com.ihcstruct.dto.response.MarkerDefinitionDto;
import com.ihcstruct.dto.response.MarkerDto;
import com.ihcstruct.model.dictionary.MarkerDefinition;
import com.ihcstruct.model.dictionary.MarkerDictionary;
import com.ihcstruct.model.enums.CaseStatus;
import com.ihcstruct.model.enums.MarkerRequirement;
import com.ihcstruct.model.enums.StainingPattern;
import com.ihcstruct.model.state.CaseAccumulator;
import com.ihcstruct.model.state.MarkerState;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Mapper from engine state to response DTOs.
 */
@Component
public class CaseOutputMapper {

    private final IhcProperties properties;

    public CaseOutputMapper(IhcProperties properties) {
        this.properties = properties;
    }

    // ========================================================================
    // Case output
    // ========================================================================

    /**
     * Assemble the full case output. A fresh output id is generated on every call.
     */
    public CaseOutput toOutput(IhcCaseRequest request, CaseAccumulator accumulator,
                               CaseStatus status, RenderedSection rendered) {
        CaseContext context = request.context();

        IhcSection ihc = new IhcSection(
            context != null ? context.panelHint() : null,
            context != null ? context.caseId() : null,
            context != null ? context.specimenId() : null,
            accumulator.markers().stream().map(this::toDto).toList()
        );

        return new CaseOutput(
            UUID.randomUUID().toString(),
            request.inputId(),
            status,
            ihc,
            rendered,
            new ValidationSection(
                List.copyOf(accumulator.issues().getErrors()),
                List.copyOf(accumulator.issues().getWarnings())
            ),
            new ProvenanceSection(
                request.inputType(),
                properties.getProvenance().getExtractionModel(),
                properties.getProvenance().getVersion()
            )
        );
    }

    /**
     * Specimen label for rendering: the case's own id, or the configured default.
     */
    public String specimenLabel(IhcCaseRequest request) {
        CaseContext context = request.context();
        if (context != null && context.specimenId() != null && !context.specimenId().isBlank()) {
            return context.specimenId();
        }
        return properties.getDefaultSpecimen();
    }

    public MarkerDto toDto(MarkerState state) {
        return new MarkerDto(
            state.getMarkerName(),
            state.getMarkerCanonical(),
            state.getResult(),
            state.getPattern(),
            state.getIntensity(),
            state.getPercentPositive(),
            state.getExtent(),
            state.getControls(),
            state.getComment(),
            state.getConfidence(),
            List.copyOf(state.getEvidence())
        );
    }

    // ========================================================================
    // Dictionary
    // ========================================================================

    public List<MarkerDefinitionDto> toDefinitionDtos(MarkerDictionary dictionary) {
        return dictionary.definitions().stream()
            .map(this::toDefinitionDto)
            .toList();
    }

    private MarkerDefinitionDto toDefinitionDto(MarkerDefinition definition) {
        return new MarkerDefinitionDto(
            definition.canonical(),
            definition.displayName(),
            definition.aliases(),
            definition.hardPatternEnforce(),
            definition.allowedPatterns().stream().map(StainingPattern::getValue).toList(),
            definition.requirements().stream().map(MarkerRequirement::getValue).toList()
        );
    }
}
