package com.ihcstruct.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Response DTO for a dictionary entry.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MarkerDefinitionDto(
    String markerCanonical,
    String displayName,
    List<String> aliases,
    boolean hardPatternEnforce,
    List<String> allowedPatterns,
    List<String> requirements
) {}
