package com.ihcstruct.service.extraction;

import com.ihcstruct.model.extraction.Clause;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits case text into clauses. Newlines end a sentence; runs of '.' or ';'
 * are the delimiters. Blank pieces are dropped.
 */
@Service
public class ClauseSplitter {

    private static final Pattern DELIMITERS = Pattern.compile("[.;]+");

    public List<Clause> split(String text) {
        List<Clause> clauses = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return clauses;
        }

        String normalized = text.replace("\n", ". ");
        for (String piece : DELIMITERS.split(normalized)) {
            String clause = piece.strip();
            if (!clause.isEmpty()) {
                clauses.add(new Clause(clauses.size(), clause));
            }
        }
        return clauses;
    }
}
