package com.ihcstruct.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.ihcstruct.model.enums.ControlStatus;
import com.ihcstruct.model.enums.MarkerResult;
import com.ihcstruct.model.enums.ResultConfidence;
import com.ihcstruct.model.enums.StainingExtent;
import com.ihcstruct.model.enums.StainingIntensity;
import com.ihcstruct.model.enums.StainingPattern;
import com.ihcstruct.model.state.EvidenceSpan;

import java.util.List;

/**
 * Response DTO for one merged marker record.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MarkerDto(
    String markerName,
    String markerCanonical,
    MarkerResult result,
    StainingPattern pattern,
    StainingIntensity intensity,
    Double percentPositive,
    StainingExtent extent,
    ControlStatus controls,
    String comment,
    ResultConfidence confidence,
    List<EvidenceSpan> evidence
) {}
