package com.ihcstruct.service.extraction;

import com.ihcstruct.model.extraction.PercentReading;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads percent positivity from free text.
 *
 * Order:
 * 1. A range ("10 to 20 percent", "ten to twenty %", "10-20%") reads as approximate, no value
 * 2. A literal number ("40%", "40 %", "40 percent")
 * 3. A single spelled-out tens word ("thirty percent")
 */
final class PercentParser {

    private static final Pattern RANGE = Pattern.compile("\\b(\\w+)\\s+to\\s+(\\w+)\\s*(?:%|percent\\b)");
    // Hyphenated ranges need digits on both sides so "ki-67 30%" is not a range
    private static final Pattern DASH_RANGE = Pattern.compile("\\b(\\d{1,3})\\s*-\\s*(\\d{1,3})\\s*(?:%|percent\\b)");
    private static final Pattern SYMBOL = Pattern.compile("\\b(\\d{1,3})\\s*%");
    private static final Pattern WORD_PERCENT_NUMERIC = Pattern.compile("\\b(\\d{1,3})\\s+percent\\b");
    private static final Pattern WORD_PERCENT = Pattern.compile("\\b(\\w+)\\s+percent\\b");

    private static final Map<String, Integer> NUMBER_WORDS = Map.ofEntries(
        Map.entry("zero", 0),
        Map.entry("ten", 10),
        Map.entry("twenty", 20),
        Map.entry("thirty", 30),
        Map.entry("forty", 40),
        Map.entry("fifty", 50),
        Map.entry("sixty", 60),
        Map.entry("seventy", 70),
        Map.entry("eighty", 80),
        Map.entry("ninety", 90),
        Map.entry("hundred", 100)
    );

    private PercentParser() {
    }

    static PercentReading parse(String text) {
        if (text == null || text.isEmpty()) {
            return PercentReading.NONE;
        }
        String lower = text.toLowerCase(Locale.ROOT);

        if (RANGE.matcher(lower).find() || DASH_RANGE.matcher(lower).find()) {
            return PercentReading.APPROXIMATE;
        }

        Matcher m = SYMBOL.matcher(lower);
        if (!m.find()) {
            m = WORD_PERCENT_NUMERIC.matcher(lower);
            if (!m.find()) {
                m = null;
            }
        }
        if (m != null) {
            return PercentReading.exact(Double.parseDouble(m.group(1)));
        }

        Matcher word = WORD_PERCENT.matcher(lower);
        if (word.find()) {
            Integer value = NUMBER_WORDS.get(word.group(1));
            if (value != null) {
                return PercentReading.exact(value);
            }
        }
        return PercentReading.NONE;
    }
}
