package com.ihcstruct;

import com.ihcstruct.model.dictionary.MarkerDefinition;
import com.ihcstruct.model.dictionary.MarkerDictionary;
import com.ihcstruct.model.enums.MarkerRequirement;
import com.ihcstruct.model.enums.StainingPattern;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Small fixed dictionary shared by the engine tests.
 *
 * ER, PR, HER2 and P40 enforce patterns strictly; TTF1, CK7 and NAPSINA only warn.
 * KI67 requires a percent, P40 requires an intensity.
 */
public final class TestDictionaries {

    private TestDictionaries() {
    }

    public static MarkerDictionary standard() {
        return MarkerDictionary.of(List.of(
            marker("ER", "ER", List.of("er", "estrogen receptor"), true, EnumSet.of(StainingPattern.NUCLEAR)),
            marker("PR", "PR", List.of("pr", "progesterone receptor"), true, EnumSet.of(StainingPattern.NUCLEAR)),
            marker("HER2", "HER2", List.of("her2", "her-2"), true, EnumSet.of(StainingPattern.MEMBRANOUS)),
            marker("KI67", "Ki-67", List.of("ki-67", "ki67"), true, EnumSet.of(StainingPattern.NUCLEAR),
                MarkerRequirement.PERCENT_REQUIRED),
            marker("TTF1", "TTF-1", List.of("ttf1", "ttf-1"), false, EnumSet.of(StainingPattern.NUCLEAR)),
            marker("CK7", "CK7", List.of("ck7"), false, EnumSet.of(StainingPattern.CYTOPLASMIC)),
            marker("NAPSINA", "Napsin A", List.of("napsin a", "napsin"), false, EnumSet.of(StainingPattern.CYTOPLASMIC)),
            marker("P40", "p40", List.of("p40"), true, EnumSet.of(StainingPattern.NUCLEAR),
                MarkerRequirement.INTENSITY_REQUIRED)
        ));
    }

    public static MarkerDefinition marker(String canonical, String displayName, List<String> aliases,
                                          boolean hardPatternEnforce, Set<StainingPattern> patterns,
                                          MarkerRequirement... requirements) {
        Set<MarkerRequirement> reqs = EnumSet.noneOf(MarkerRequirement.class);
        reqs.addAll(List.of(requirements));
        return new MarkerDefinition(canonical, displayName, aliases, hardPatternEnforce, patterns, reqs);
    }
}
