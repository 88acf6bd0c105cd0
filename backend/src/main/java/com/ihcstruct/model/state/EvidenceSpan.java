package com.ihcstruct.model.state;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Raw text a marker's attributes were read from, for audit.
 * Offsets are relative to the clause identified by {@code clauseIndex}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EvidenceSpan(
    String textSpan,
    int clauseIndex,
    int startChar,
    int endChar
) {
}
