package com.ihcstruct.model.state;

import com.ihcstruct.model.extraction.MarkerSegment;
import com.ihcstruct.model.validation.IssueLog;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fold state for one case: marker records keyed by canonical id in first-seen
 * order, plus the issues raised so far. Never shared between cases.
 */
public class CaseAccumulator {

    private final Map<String, MarkerState> markers = new LinkedHashMap<>();
    private final IssueLog issues = new IssueLog();

    public MarkerState stateFor(MarkerSegment segment) {
        return markers.computeIfAbsent(
            segment.markerCanonical(),
            canonical -> MarkerState.start(canonical, segment.displayName()));
    }

    public MarkerState get(String markerCanonical) {
        return markers.get(markerCanonical);
    }

    public Collection<MarkerState> markers() {
        return Collections.unmodifiableCollection(markers.values());
    }

    public boolean hasMarkers() {
        return !markers.isEmpty();
    }

    public IssueLog issues() {
        return issues;
    }
}
