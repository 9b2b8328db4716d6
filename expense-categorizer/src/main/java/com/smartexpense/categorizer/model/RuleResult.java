package com.smartexpense.categorizer.model;

import java.util.List;

/**
 * Outcome of a lexicon lookup. {@code category} is null when nothing matched.
 */
public record RuleResult(String category, double score, List<String> trace) {

    public static final double EXACT_SCORE = 1.0;
    public static final double FUZZY_SCORE = 0.85;

    public RuleResult {
        trace = trace == null ? List.of() : List.copyOf(trace);
    }

    public static RuleResult exact(String token, String category) {
        return new RuleResult(category, EXACT_SCORE, List.of("exact: " + token + " -> " + category));
    }

    public static RuleResult fuzzy(String token, String keyword, String category) {
        return new RuleResult(category, FUZZY_SCORE, List.of("fuzzy: " + token + "~" + keyword + " -> " + category));
    }

    public static RuleResult noMatch() {
        return new RuleResult(null, 0.0, List.of());
    }

    public boolean matched() {
        return category != null;
    }
}
