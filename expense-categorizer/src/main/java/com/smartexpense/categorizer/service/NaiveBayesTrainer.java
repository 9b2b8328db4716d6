package com.smartexpense.categorizer.service;

import com.smartexpense.categorizer.model.TrainingExample;
import com.smartexpense.categorizer.model.WordFrequency;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Online training: folds one user-confirmed (text, category) pair into the stored counters.
 * <p>
 * Counters only grow. Each call is a separate labelling event, so training the same transaction
 * twice counts it twice.
 * <p>
 * One call is one transaction. Word rows are upserted in sorted order, then the category row, then
 * the vocabulary counter, so concurrent trainers always lock rows in the same order. Two trainers
 * inserting the same new key still collide on the primary key; the loser's transaction is rolled
 * back and the whole call is retried, by which time the row exists.
 */
@Slf4j
@Service
public class NaiveBayesTrainer {

    private final Tokenizer tokenizer;
    private final FrequencyStore store;
    private final Clock clock;

    @Autowired
    public NaiveBayesTrainer(Tokenizer tokenizer, FrequencyStore store) {
        this(tokenizer, store, Clock.systemUTC());
    }

    NaiveBayesTrainer(Tokenizer tokenizer, FrequencyStore store, Clock clock) {
        this.tokenizer = tokenizer;
        this.store = store;
        this.clock = clock;
    }

    public void train(String transactionId, String text, String category) {
        train(transactionId, text, category, 1);
    }

    /**
     * @param weight repetition factor, coerced to the nearest integer of at least 1
     * @throws IllegalArgumentException if the category is longer than {@link WordFrequency#KEY_LENGTH}
     */
    @Retryable(retryFor = {DataIntegrityViolationException.class, ConcurrencyFailureException.class},
            maxAttempts = 5, backoff = @Backoff(delay = 20, multiplier = 2.0, maxDelay = 500, random = true))
    @Transactional
    public void train(String transactionId, String text, String category, double weight) {
        if (category == null || category.isBlank()) return;
        if (category.trim().length() > WordFrequency.KEY_LENGTH) {
            throw new IllegalArgumentException("Category longer than " + WordFrequency.KEY_LENGTH + " characters");
        }
        List<String> tokens = tokenizer.tokenize(text);
        if (tokens.isEmpty()) {
            log.debug("Nothing to learn from transaction {}: no usable tokens", transactionId);
            return;
        }
        String label = category.trim();
        long multiplier = coerceWeight(weight);

        // sorted: fixes the row lock order across concurrent trainers
        Map<String, Long> tokenCounts = new TreeMap<>();
        for (String t : tokens) tokenCounts.merge(t, 1L, Long::sum);
        tokenCounts.replaceAll((t, n) -> n * multiplier);

        store.recordTrainingExample(new TrainingExample(UUID.randomUUID().toString(),
                truncate(transactionId, WordFrequency.KEY_LENGTH),
                truncate(text, TrainingExample.TEXT_LENGTH),
                label, Instant.now(clock)));

        // must be read before the word upserts below
        Set<String> known = store.knownWords(tokenCounts.keySet());
        long newWords = tokenCounts.keySet().stream().filter(t -> !known.contains(t)).count();

        long tokenMass = 0;
        for (Map.Entry<String, Long> e : tokenCounts.entrySet()) {
            store.incrementWord(e.getKey(), label, e.getValue());
            tokenMass += e.getValue();
        }
        store.incrementCategoryTotals(label, tokenMass);
        store.addToVocabSize(newWords);

        log.debug("Trained category={} tokens={} weighted={} newWords={} transaction={}",
                label, tokens.size(), tokenMass, newWords, transactionId);
    }

    static long coerceWeight(double weight) {
        if (!Double.isFinite(weight)) return 1;
        return Math.max(1L, Math.round(weight));
    }

    // audit columns are bounded; the counters are built from the full text
    private static String truncate(String s, int max) {
        if (s == null) return null;
        return s.length() <= max ? s : s.substring(0, max);
    }
}
