package com.ihcstruct.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ihcstruct.model.enums.StainingExtent;
import com.ihcstruct.model.enums.StainingIntensity;
import com.ihcstruct.model.enums.StainingPattern;

/**
 * One row of the rendered results table. Result is "" when missing.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TableRowDto(
    String marker,
    String result,
    StainingPattern pattern,
    StainingIntensity intensity,
    Double percentPositive,
    StainingExtent extent,
    String comment
) {}
