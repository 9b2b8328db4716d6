package com.smartexpense.categorizer.service;

import com.smartexpense.categorizer.config.CategorizerProperties;
import com.smartexpense.categorizer.model.CategoryTotal;
import com.smartexpense.categorizer.model.NbResult;
import com.smartexpense.categorizer.model.NoPredictionReason;
import com.smartexpense.categorizer.model.WordCount;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Multinomial naive-Bayes scoring against the counters in the {@link FrequencyStore}.
 * <p>
 * Scoring is presence based: each distinct token counts once no matter how often it repeats.
 * Tokens that never appeared in training are left out instead of being smoothed in. Laplace
 * smoothing uses the global vocabulary size. Nothing is cached between calls.
 */
@Slf4j
@Service
public class NaiveBayesPredictor {

    private final Tokenizer tokenizer;
    private final FrequencyStore store;
    private final double minConfidence;

    public NaiveBayesPredictor(Tokenizer tokenizer, FrequencyStore store, CategorizerProperties properties) {
        this.tokenizer = tokenizer;
        this.store = store;
        this.minConfidence = properties.getNbMinConfidence();
    }

    public NbResult predictNB(String text) {
        return predictNB(tokenizer.tokenize(text));
    }

    public NbResult predictNB(List<String> tokens) {
        Scoring scoring = score(tokens);
        if (scoring.reason != null) {
            return NbResult.none(scoring.reason);
        }

        Map<String, Double> distribution = softmax(scoring.logScores);
        String best = null;
        double bestProbability = -1;
        // strict '>' keeps the first category in store order on ties
        for (Map.Entry<String, Double> e : distribution.entrySet()) {
            if (e.getValue() > bestProbability) {
                best = e.getKey();
                bestProbability = e.getValue();
            }
        }

        List<String> trace = new ArrayList<>(scoring.reasons.get(best));
        if (bestProbability < minConfidence) {
            log.debug("NB best guess {} at {} is below gate {}", best, bestProbability, minConfidence);
            trace.add(0, String.format(Locale.ROOT, "NB: low confidence (best %s p=%.3f)", best, bestProbability));
            return NbResult.none(NoPredictionReason.LOW_CONFIDENCE, bestProbability, trace);
        }
        log.debug("NB predicted {} with p={}", best, bestProbability);
        return NbResult.predicted(best, bestProbability, trace);
    }

    /**
     * Posterior probability of every known category for {@code text}, before the confidence gate.
     *
     * @return category -> probability in store order, empty when no prediction is possible
     */
    public Map<String, Double> posterior(String text) {
        Scoring scoring = score(tokenizer.tokenize(text));
        if (scoring.reason != null) return Collections.emptyMap();
        return softmax(scoring.logScores);
    }

    private Scoring score(List<String> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return Scoring.declined(NoPredictionReason.EMPTY_INPUT);
        }

        List<CategoryTotal> totals = store.listCategoryTotals();
        long vocabSize = store.getVocabSize();
        if (vocabSize <= 0) vocabSize = 1;

        long totalDocs = 0;
        for (CategoryTotal t : totals) totalDocs += Math.max(0, t.docCount());
        if (totalDocs == 0) {
            return Scoring.declined(NoPredictionReason.UNTRAINED);
        }

        Set<String> uniqueTokens = new LinkedHashSet<>(tokens);
        Map<String, Map<String, Long>> countsByWord = new HashMap<>();
        for (WordCount wc : store.lookupWords(uniqueTokens)) {
            if (wc.count() <= 0) continue;
            countsByWord.computeIfAbsent(wc.word(), k -> new HashMap<>()).put(wc.category(), wc.count());
        }

        List<String> seenTokens = new ArrayList<>();
        for (String token : uniqueTokens) {
            if (countsByWord.containsKey(token)) seenTokens.add(token);
        }
        if (seenTokens.isEmpty()) {
            return Scoring.declined(NoPredictionReason.ALL_TOKENS_UNSEEN);
        }

        Map<String, Double> logScores = new LinkedHashMap<>();
        Map<String, List<String>> reasons = new HashMap<>();
        for (CategoryTotal cat : totals) {
            long docs = Math.max(1, cat.docCount());
            double logScore = Math.log((double) docs / totalDocs);
            List<String> why = new ArrayList<>();
            why.add("Prior " + docs + "/" + totalDocs + " for " + cat.category());

            double denominator = (double) cat.totalWords() + vocabSize;
            for (String token : seenTokens) {
                long count = countsByWord.get(token).getOrDefault(cat.category(), 0L);
                logScore += Math.log((count + 1) / denominator);
                if (count > 0) {
                    why.add("Token \"" + token + "\" found " + count + "x in " + cat.category());
                }
            }
            logScores.put(cat.category(), logScore);
            reasons.put(cat.category(), why);
        }
        return new Scoring(null, logScores, reasons);
    }

    // max-shifted softmax; preserves the iteration order of the input
    static Map<String, Double> softmax(Map<String, Double> logScores) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : logScores.values()) max = Math.max(max, v);

        Map<String, Double> exp = new LinkedHashMap<>();
        double sum = 0;
        for (Map.Entry<String, Double> e : logScores.entrySet()) {
            double v = Math.exp(e.getValue() - max);
            exp.put(e.getKey(), v);
            sum += v;
        }
        Map<String, Double> probabilities = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : exp.entrySet()) {
            probabilities.put(e.getKey(), e.getValue() / sum);
        }
        return probabilities;
    }

    private static final class Scoring {
        final NoPredictionReason reason;
        final Map<String, Double> logScores;
        final Map<String, List<String>> reasons;

        Scoring(NoPredictionReason reason, Map<String, Double> logScores, Map<String, List<String>> reasons) {
            this.reason = reason;
            this.logScores = logScores;
            this.reasons = reasons;
        }

        static Scoring declined(NoPredictionReason reason) {
            return new Scoring(reason, Collections.emptyMap(), Collections.emptyMap());
        }
    }
}
