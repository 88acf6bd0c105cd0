package com.ihcstruct.model.extraction;

import com.ihcstruct.model.dictionary.MarkerDefinition;

/**
 * A dictionary alias found inside a clause. Offsets are clause-relative, end exclusive.
 */
public record MarkerMention(
    MarkerDefinition definition,
    int start,
    int end,
    String matchedText
) {

    public int length() {
        return end - start;
    }

    public boolean isWithin(int otherStart, int otherEnd) {
        return start >= otherStart && end <= otherEnd;
    }
}
