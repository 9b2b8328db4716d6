package com.smartexpense.categorizer.service;

import com.smartexpense.categorizer.model.CategoryTotal;
import com.smartexpense.categorizer.model.ModelSnapshot;
import com.smartexpense.categorizer.model.NbResult;
import com.smartexpense.categorizer.model.RuleResult;
import com.smartexpense.categorizer.model.Suggestion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The only entry point the rest of the application needs: predict a category for a
 * transaction and learn from the category the user confirmed.
 */
@Slf4j
@Service
public class CategorizationService {

    private final Tokenizer tokenizer;
    private final RuleEngine ruleEngine;
    private final NaiveBayesPredictor predictor;
    private final NaiveBayesTrainer trainer;
    private final HybridCombiner combiner;
    private final FrequencyStore store;

    public CategorizationService(Tokenizer tokenizer,
                                 RuleEngine ruleEngine,
                                 NaiveBayesPredictor predictor,
                                 NaiveBayesTrainer trainer,
                                 HybridCombiner combiner,
                                 FrequencyStore store) {
        this.tokenizer = tokenizer;
        this.ruleEngine = ruleEngine;
        this.predictor = predictor;
        this.trainer = trainer;
        this.combiner = combiner;
        this.store = store;
    }

    public Suggestion predict(String text) {
        if (text == null || text.isBlank()) return combiner.emptyInput();

        List<String> tokens = tokenizer.tokenize(text);
        RuleResult rule = ruleEngine.match(tokens);
        NbResult nb = predictor.predictNB(tokens);
        Suggestion suggestion = combiner.combine(rule, nb);
        log.debug("predict '{}' -> {} ({}, {})", text, suggestion.category(), suggestion.source(), suggestion.confidence());
        return suggestion;
    }

    /**
     * Predicts from the note and merchant of a transaction, joined with a space.
     */
    public Suggestion predict(String note, String merchant) {
        return predict(joinText(note, merchant));
    }

    public void train(String transactionId, String text, String category) {
        train(transactionId, text, category, 1);
    }

    public void train(String transactionId, String text, String category, double weight) {
        trainer.train(transactionId, text, category, weight);
    }

    /**
     * Learns from a transaction whose category the user just set or edited.
     */
    public void trainOnTransaction(String transactionId, String note, String merchant, String category, double weight) {
        if (category == null || category.isBlank()) return;
        String text = joinText(note, merchant);
        if (text.isEmpty()) return;
        train(transactionId, text, category, weight);
    }

    @Transactional
    public void resetModel() {
        store.clear();
        log.info("Categorization model reset");
    }

    @Transactional(readOnly = true)
    public ModelSnapshot modelSnapshot() {
        List<CategoryTotal> totals = store.listCategoryTotals();
        long totalDocs = totals.stream().mapToLong(CategoryTotal::docCount).sum();
        return new ModelSnapshot(store.getVocabSize(), totalDocs, totals);
    }

    static String joinText(String note, String merchant) {
        return Stream.of(note, merchant)
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining(" "));
    }
}
