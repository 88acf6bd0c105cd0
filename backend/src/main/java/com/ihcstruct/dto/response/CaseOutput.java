package com.ihcstruct.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ihcstruct.model.enums.CaseStatus;
import com.ihcstruct.model.validation.ValidationIssue;

import java.util.List;

/**
 * Structured result for one case: marker records, rendered text, validation
 * issues and provenance. This is the only artifact the engine produces.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CaseOutput(
    String outputId,
    String inputId,
    CaseStatus status,
    IhcSection ihc,
    RenderedSection rendered,
    ValidationSection validation,
    ProvenanceSection provenance
) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record IhcSection(
        String panelName,
        String caseId,
        String specimenId,
        List<MarkerDto> markers
    ) {}

    public record RenderedSection(
        String narrative,
        List<TableRowDto> table
    ) {}

    public record ValidationSection(
        List<ValidationIssue> errors,
        List<ValidationIssue> warnings
    ) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ProvenanceSection(
        String sourceType,
        String extractionModel,
        String version
    ) {}
}
