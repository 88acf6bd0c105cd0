package com.ihcstruct.model.extraction;

/**
 * Marker-scoped slice of a clause: from the marker's mention up to the next mention
 * (or clause end), with separators trimmed. Offsets are clause-relative.
 */
public record MarkerSegment(
    String markerCanonical,
    String displayName,
    String text,
    int start,
    int end
) {
}
