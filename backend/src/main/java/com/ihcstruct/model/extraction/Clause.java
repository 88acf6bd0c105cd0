package com.ihcstruct.model.extraction;

/**
 * Sentence-like unit of case text. Index is the position within the case.
 */
public record Clause(int index, String text) {
}
