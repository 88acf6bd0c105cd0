package com.ihcstruct.model.state;

import com.ihcstruct.model.enums.ControlStatus;
import com.ihcstruct.model.enums.MarkerResult;
import com.ihcstruct.model.enums.ResultConfidence;
import com.ihcstruct.model.enums.StainingExtent;
import com.ihcstruct.model.enums.StainingIntensity;
import com.ihcstruct.model.enums.StainingPattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Running record for one marker within one case.
 * Updated clause by clause by the merger, then read by validation and rendering.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarkerState {

    private String markerCanonical;

    private String markerName;

    private MarkerResult result;

    private StainingPattern pattern;

    private StainingIntensity intensity;

    /**
     * Not clamped; out-of-range values are reported by validation.
     */
    private Double percentPositive;

    /**
     * Sticky once any mention gave a range instead of a number.
     */
    private boolean percentApproximate;

    private StainingExtent extent;

    @Builder.Default
    private ControlStatus controls = ControlStatus.NOT_MENTIONED;

    /**
     * Free-text reviewer note. Extraction never fills it.
     */
    private String comment;

    @Builder.Default
    private ResultConfidence confidence = ResultConfidence.EXPLICIT;

    @Builder.Default
    private List<EvidenceSpan> evidence = new ArrayList<>();

    public static MarkerState start(String markerCanonical, String markerName) {
        return MarkerState.builder()
            .markerCanonical(markerCanonical)
            .markerName(markerName)
            .build();
    }
}
