package com.ihcstruct.service.extraction;

import com.ihcstruct.model.extraction.MarkerMention;
import com.ihcstruct.model.extraction.MarkerSegment;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Segment Scoper
 *
 * Cuts a clause into one segment per mention, running from the mention's start
 * to the next mention's start (or the clause end). In "TTF1 negative, CK7
 * positive, diffuse" the word "diffuse" lands only in CK7's segment.
 */
@Service
public class SegmentScoper {

    private static final String TRIM_CHARS = " ,;";

    public List<MarkerSegment> scope(String clause, List<MarkerMention> mentions) {
        List<MarkerSegment> segments = new ArrayList<>();
        if (mentions == null || mentions.isEmpty()) {
            return segments;
        }

        List<MarkerMention> ordered = new ArrayList<>(mentions);
        ordered.sort(Comparator.comparingInt(MarkerMention::start));

        for (int i = 0; i < ordered.size(); i++) {
            MarkerMention mention = ordered.get(i);
            int start = mention.start();
            int end = i + 1 < ordered.size() ? ordered.get(i + 1).start() : clause.length();

            while (start < end && TRIM_CHARS.indexOf(clause.charAt(start)) >= 0) {
                start++;
            }
            while (end > start && TRIM_CHARS.indexOf(clause.charAt(end - 1)) >= 0) {
                end--;
            }

            segments.add(new MarkerSegment(
                mention.definition().canonical(),
                mention.definition().displayName(),
                clause.substring(start, end),
                start,
                end));
        }
        return segments;
    }
}
