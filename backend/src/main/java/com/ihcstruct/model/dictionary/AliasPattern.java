package com.ihcstruct.model.dictionary;

import java.util.regex.Pattern;

/**
 * A normalized alias compiled to a case-insensitive, word-bounded matcher.
 */
public record AliasPattern(
    String alias,
    Pattern pattern,
    MarkerDefinition definition
) {

    static AliasPattern compile(String alias, MarkerDefinition definition) {
        Pattern pattern = Pattern.compile(
            "\\b" + Pattern.quote(alias) + "\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        return new AliasPattern(alias, pattern, definition);
    }
}
