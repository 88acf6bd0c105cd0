package com.ihcstruct.model.dictionary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only marker dictionary, built once and shared across cases.
 *
 * Construction validates the definitions and fails fast on:
 * - duplicate canonical ids
 * - an alias claimed by two different markers
 * (blank ids and empty alias lists are rejected by {@link MarkerDefinition} itself)
 *
 * Alias patterns are compiled up front, in dictionary order.
 */
public final class MarkerDictionary {

    private final Map<String, MarkerDefinition> byCanonical;
    private final List<AliasPattern> aliasPatterns;

    private MarkerDictionary(Map<String, MarkerDefinition> byCanonical, List<AliasPattern> aliasPatterns) {
        this.byCanonical = Collections.unmodifiableMap(byCanonical);
        this.aliasPatterns = Collections.unmodifiableList(aliasPatterns);
    }

    public static MarkerDictionary of(List<MarkerDefinition> definitions) {
        if (definitions == null) {
            throw new IllegalArgumentException("Marker definitions are required");
        }

        Map<String, MarkerDefinition> byCanonical = new LinkedHashMap<>();
        Map<String, String> aliasOwners = new HashMap<>();
        List<AliasPattern> aliasPatterns = new ArrayList<>();

        for (MarkerDefinition definition : definitions) {
            if (definition == null) {
                throw new IllegalArgumentException("Null marker definition");
            }
            if (byCanonical.putIfAbsent(definition.canonical(), definition) != null) {
                throw new IllegalArgumentException("Duplicate marker canonical id: " + definition.canonical());
            }
            for (String alias : definition.aliases()) {
                String owner = aliasOwners.putIfAbsent(alias, definition.canonical());
                if (owner != null) {
                    throw new IllegalArgumentException(
                        "Alias '" + alias + "' is claimed by both " + owner + " and " + definition.canonical());
                }
                aliasPatterns.add(AliasPattern.compile(alias, definition));
            }
        }

        return new MarkerDictionary(byCanonical, aliasPatterns);
    }

    public Optional<MarkerDefinition> find(String canonical) {
        return Optional.ofNullable(byCanonical.get(canonical));
    }

    public MarkerDefinition require(String canonical) {
        return find(canonical)
            .orElseThrow(() -> new IllegalArgumentException("Marker not in dictionary: " + canonical));
    }

    public List<MarkerDefinition> definitions() {
        return List.copyOf(byCanonical.values());
    }

    public List<AliasPattern> aliasPatterns() {
        return aliasPatterns;
    }

    public int size() {
        return byCanonical.size();
    }

    public boolean isEmpty() {
        return byCanonical.isEmpty();
    }
}
