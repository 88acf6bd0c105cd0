package com.ihcstruct.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for structuring one IHC case.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IhcCaseRequest(
    @NotBlank(message = "input_id is required")
    String inputId,

    @NotBlank(message = "input_type is required")
    String inputType,

    // Empty text is allowed and reported as NO_MARKERS_FOUND
    @NotNull(message = "raw_text is required")
    String rawText,

    @Valid
    CaseContext context
) {

    public static final String TEXT_INPUT = "text";

    /**
     * Plain-text case with only a specimen id in its context.
     */
    public static IhcCaseRequest text(String inputId, String rawText, String specimenId) {
        return new IhcCaseRequest(inputId, TEXT_INPUT, rawText, new CaseContext(null, specimenId, null));
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record CaseContext(
        String caseId,
        String specimenId,
        String panelHint
    ) {}
}
