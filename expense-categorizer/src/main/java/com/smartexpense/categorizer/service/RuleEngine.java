package com.smartexpense.categorizer.service;

import com.smartexpense.categorizer.model.RuleResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Deterministic keyword matcher over the {@link KeywordLexicon}.
 * <p>
 * Runs two full passes: exact equality first, then edit-distance matching. An exact hit anywhere
 * in the lexicon always wins over a fuzzy hit. Within a pass the first hit in
 * category / keyword / token order is returned.
 */
@Component
public class RuleEngine {

    private final KeywordLexicon lexicon;

    public RuleEngine(KeywordLexicon lexicon) {
        this.lexicon = lexicon;
    }

    public RuleResult match(List<String> tokens) {
        if (tokens == null || tokens.isEmpty()) return RuleResult.noMatch();
        Map<String, List<String>> keywordsByCategory = lexicon.asMap();

        for (Map.Entry<String, List<String>> e : keywordsByCategory.entrySet()) {
            for (String keyword : e.getValue()) {
                for (String token : tokens) {
                    if (token.equals(keyword)) {
                        return RuleResult.exact(token, e.getKey());
                    }
                }
            }
        }

        for (Map.Entry<String, List<String>> e : keywordsByCategory.entrySet()) {
            for (String keyword : e.getValue()) {
                int maxDist = maxEditDistance(keyword);
                for (String token : tokens) {
                    // length gap alone already exceeds the budget
                    if (Math.abs(token.length() - keyword.length()) > maxDist) continue;
                    if (levenshteinDistance(token, keyword) <= maxDist) {
                        return RuleResult.fuzzy(token, keyword, e.getKey());
                    }
                }
            }
        }
        return RuleResult.noMatch();
    }

    /** Edit budget for fuzzy matching: one edit for keywords up to 6 characters, two for longer ones. */
    static int maxEditDistance(String keyword) {
        return keyword.length() <= 6 ? 1 : 2;
    }

    // two-row Levenshtein, insert/delete/substitute all cost 1
    static int levenshteinDistance(String a, String b) {
        int la = a.length(), lb = b.length();
        int[] prev = new int[lb + 1];
        int[] curr = new int[lb + 1];

        for (int j = 0; j <= lb; j++) prev[j] = j;
        for (int i = 1; i <= la; i++) {
            curr[0] = i;
            for (int j = 1; j <= lb; j++) {
                int cost = (a.charAt(i - 1) == b.charAt(j - 1)) ? 0 : 1;
                curr[j] = Math.min(Math.min(prev[j] + 1, curr[j - 1] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev; prev = curr; curr = tmp;
        }
        return prev[lb];
    }
}
