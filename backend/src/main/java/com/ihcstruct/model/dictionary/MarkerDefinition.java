package com.ihcstruct.model.dictionary;

import com.ihcstruct.model.enums.MarkerRequirement;
import com.ihcstruct.model.enums.StainingPattern;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable dictionary entry for one IHC marker.
 *
 * Aliases are normalized on construction (trimmed, lower-cased, inner whitespace
 * collapsed) so lookups never depend on how the dictionary was written.
 *
 * @param canonical          unique lookup key, e.g. "KI67"
 * @param displayName        name used in rendered output, e.g. "Ki-67"
 * @param aliases            normalized alias strings matched in narrative text
 * @param hardPatternEnforce true if a disallowed pattern is an error rather than a warning
 * @param allowedPatterns    staining patterns expected for this marker
 * @param requirements       reporting requirements (percent, intensity)
 */
public record MarkerDefinition(
    String canonical,
    String displayName,
    List<String> aliases,
    boolean hardPatternEnforce,
    Set<StainingPattern> allowedPatterns,
    Set<MarkerRequirement> requirements
) {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public MarkerDefinition {
        if (canonical == null || canonical.isBlank()) {
            throw new IllegalArgumentException("Marker canonical id is required");
        }
        canonical = canonical.strip();
        displayName = displayName == null || displayName.isBlank() ? canonical : displayName.strip();

        if (aliases == null || aliases.isEmpty()) {
            throw new IllegalArgumentException("Marker " + canonical + " has no aliases");
        }
        LinkedHashSet<String> normalized = new LinkedHashSet<>();
        for (String alias : aliases) {
            String n = normalizeAlias(alias);
            if (n.isEmpty()) {
                throw new IllegalArgumentException("Marker " + canonical + " has a blank alias");
            }
            normalized.add(n);
        }
        aliases = List.copyOf(normalized);

        allowedPatterns = allowedPatterns == null || allowedPatterns.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(allowedPatterns));
        requirements = requirements == null || requirements.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(requirements));
    }

    public boolean requires(MarkerRequirement requirement) {
        return requirements.contains(requirement);
    }

    public boolean allowsPattern(StainingPattern pattern) {
        return allowedPatterns.contains(pattern);
    }

    /**
     * Lower-case, trim and collapse runs of whitespace to a single space.
     */
    public static String normalizeAlias(String alias) {
        if (alias == null) {
            return "";
        }
        return WHITESPACE.matcher(alias.strip().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }
}
