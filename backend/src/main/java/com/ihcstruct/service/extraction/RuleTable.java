package com.ihcstruct.service.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered (pattern, value) rules for one attribute.
 *
 * Two lookup modes:
 * - {@link #firstRule}: precedence order, the first rule that matches anywhere wins
 * - {@link #earliestMatch}: position order, the rule matching earliest in the text wins
 *   (ties go to the rule declared first)
 *
 * New vocabulary is added by adding a rule; callers never branch on keywords.
 */
public final class RuleTable<T> {

    private final List<Rule<T>> rules;

    private RuleTable(List<Rule<T>> rules) {
        this.rules = List.copyOf(rules);
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public T firstRule(String text) {
        if (text == null) return null;
        for (Rule<T> rule : rules) {
            if (rule.pattern().matcher(text).find()) {
                return rule.value();
            }
        }
        return null;
    }

    public T earliestMatch(String text) {
        if (text == null) return null;
        T best = null;
        int bestStart = Integer.MAX_VALUE;
        for (Rule<T> rule : rules) {
            Matcher m = rule.pattern().matcher(text);
            if (m.find() && m.start() < bestStart) {
                bestStart = m.start();
                best = rule.value();
            }
        }
        return best;
    }

    public int size() {
        return rules.size();
    }

    record Rule<T>(Pattern pattern, T value) {}

    public static final class Builder<T> {

        private final List<Rule<T>> rules = new ArrayList<>();

        /**
         * Add a rule from a regex, compiled case-insensitively.
         */
        public Builder<T> rule(String regex, T value) {
            rules.add(new Rule<>(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), value));
            return this;
        }

        /**
         * Add a whole-word keyword rule.
         */
        public Builder<T> keyword(String word, T value) {
            return rule("\\b" + Pattern.quote(word) + "\\b", value);
        }

        public RuleTable<T> build() {
            return new RuleTable<>(rules);
        }
    }
}
