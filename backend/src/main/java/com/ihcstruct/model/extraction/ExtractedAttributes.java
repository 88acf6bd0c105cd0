package com.ihcstruct.model.extraction;

import com.ihcstruct.model.enums.ControlStatus;
import com.ihcstruct.model.enums.MarkerResult;
import com.ihcstruct.model.enums.ResultConfidence;
import com.ihcstruct.model.enums.StainingExtent;
import com.ihcstruct.model.enums.StainingIntensity;
import com.ihcstruct.model.enums.StainingPattern;
import lombok.Builder;

/**
 * Attributes read from one span of text. Absent fields are null; controls and
 * confidence default to NOT_MENTIONED and EXPLICIT.
 */
@Builder(toBuilder = true)
public record ExtractedAttributes(
    MarkerResult result,
    StainingPattern pattern,
    StainingIntensity intensity,
    StainingExtent extent,
    Double percent,
    boolean percentApproximate,
    ControlStatus controls,
    ResultConfidence confidence
) {

    public ExtractedAttributes {
        if (controls == null) {
            controls = ControlStatus.NOT_MENTIONED;
        }
        if (confidence == null) {
            confidence = ResultConfidence.EXPLICIT;
        }
    }

    public static ExtractedAttributes empty() {
        return ExtractedAttributes.builder().build();
    }

    public ExtractedAttributes withResult(MarkerResult newResult) {
        return toBuilder().result(newResult).build();
    }

    /**
     * True if any attribute that only makes sense for stained tissue is present.
     */
    public boolean hasSupportingAttributes() {
        return intensity != null
            || pattern != null
            || percent != null
            || percentApproximate
            || extent != null;
    }

    public boolean isHedged() {
        return confidence != ResultConfidence.EXPLICIT;
    }
}
