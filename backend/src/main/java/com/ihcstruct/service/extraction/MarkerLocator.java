package com.ihcstruct.service.extraction;

import com.ihcstruct.model.dictionary.AliasPattern;
import com.ihcstruct.model.dictionary.MarkerDictionary;
import com.ihcstruct.model.extraction.MarkerMention;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Marker Locator
 *
 * Finds dictionary aliases in a clause (case-insensitive, whole words).
 * Candidates are ordered by start ascending, then length descending, and
 * accepted greedily: a candidate lying entirely inside an accepted span is
 * dropped, so "napsin a" wins over a bare "napsin" at the same position.
 */
@Service
public class MarkerLocator {

    private static final Comparator<MarkerMention> BY_POSITION = Comparator
        .comparingInt(MarkerMention::start)
        .thenComparing(Comparator.comparingInt(MarkerMention::length).reversed());

    public List<MarkerMention> locate(String clause, MarkerDictionary dictionary) {
        List<MarkerMention> candidates = new ArrayList<>();
        if (clause == null || clause.isEmpty()) {
            return candidates;
        }

        for (AliasPattern alias : dictionary.aliasPatterns()) {
            Matcher m = alias.pattern().matcher(clause);
            while (m.find()) {
                candidates.add(new MarkerMention(alias.definition(), m.start(), m.end(), m.group()));
            }
        }
        candidates.sort(BY_POSITION);

        List<MarkerMention> accepted = new ArrayList<>();
        for (MarkerMention candidate : candidates) {
            boolean covered = accepted.stream()
                .anyMatch(a -> candidate.isWithin(a.start(), a.end()));
            if (!covered) {
                accepted.add(candidate);
            }
        }
        return accepted;
    }
}
