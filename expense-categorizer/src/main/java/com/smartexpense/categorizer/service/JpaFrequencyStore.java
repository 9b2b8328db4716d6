package com.smartexpense.categorizer.service;

import com.smartexpense.categorizer.model.CategoryTotal;
import com.smartexpense.categorizer.model.ModelMeta;
import com.smartexpense.categorizer.model.TrainingExample;
import com.smartexpense.categorizer.model.WordCount;
import com.smartexpense.categorizer.model.WordFrequency;
import com.smartexpense.categorizer.repository.CategoryTotalsRepository;
import com.smartexpense.categorizer.repository.ModelMetaRepository;
import com.smartexpense.categorizer.repository.TrainingExampleRepository;
import com.smartexpense.categorizer.repository.WordFrequencyRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link FrequencyStore} backed by the JPA repositories. Increments go through native MERGE
 * statements so concurrent trainers never lose updates on the same key. Keys wider than the key
 * columns are rejected rather than cut down by the cast.
 */
@Slf4j
@Component
public class JpaFrequencyStore implements FrequencyStore {

    private final WordFrequencyRepository wordFrequencyRepository;
    private final CategoryTotalsRepository categoryTotalsRepository;
    private final ModelMetaRepository modelMetaRepository;
    private final TrainingExampleRepository trainingExampleRepository;

    public JpaFrequencyStore(WordFrequencyRepository wordFrequencyRepository,
                             CategoryTotalsRepository categoryTotalsRepository,
                             ModelMetaRepository modelMetaRepository,
                             TrainingExampleRepository trainingExampleRepository) {
        this.wordFrequencyRepository = wordFrequencyRepository;
        this.categoryTotalsRepository = categoryTotalsRepository;
        this.modelMetaRepository = modelMetaRepository;
        this.trainingExampleRepository = trainingExampleRepository;
    }

    @Override
    @Transactional
    public void incrementWord(String word, String category, long delta) {
        requireKeyWidth(word);
        requireKeyWidth(category);
        wordFrequencyRepository.upsertIncrement(word, category, delta);
    }

    @Override
    @Transactional
    public void incrementCategoryTotals(String category, long tokenMass) {
        requireKeyWidth(category);
        categoryTotalsRepository.upsertIncrement(category, tokenMass);
    }

    @Override
    @Transactional
    public void setVocabSize(long vocabSize) {
        modelMetaRepository.upsertNumber(ModelMeta.VOCAB_SIZE, vocabSize);
    }

    @Override
    @Transactional(readOnly = true)
    public long getVocabSize() {
        return modelMetaRepository.findById(ModelMeta.VOCAB_SIZE)
                .map(ModelMeta::getValue)
                .map(this::parseCounter)
                .orElse(0L);
    }

    @Override
    @Transactional
    public void addToVocabSize(long delta) {
        if (delta == 0) return;
        modelMetaRepository.upsertAdd(ModelMeta.VOCAB_SIZE, delta);
    }

    @Override
    @Transactional(readOnly = true)
    public List<WordCount> lookupWords(Collection<String> words) {
        if (words == null || words.isEmpty()) return Collections.emptyList();
        return wordFrequencyRepository.findByWordIn(words).stream()
                .map(w -> new WordCount(w.getWord(), w.getCategory(), w.getCount()))
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public Set<String> knownWords(Collection<String> words) {
        if (words == null || words.isEmpty()) return Collections.emptySet();
        return new LinkedHashSet<>(wordFrequencyRepository.findKnownWords(words));
    }

    @Override
    @Transactional(readOnly = true)
    public List<CategoryTotal> listCategoryTotals() {
        return categoryTotalsRepository.findAllByOrderByCategoryAsc().stream()
                .map(t -> new CategoryTotal(t.getCategory(), t.getTotalWords(), t.getDocCount()))
                .collect(Collectors.toList());
    }

    @Override
    @Transactional
    public void recordTrainingExample(TrainingExample example) {
        trainingExampleRepository.save(example);
    }

    @Override
    @Transactional(readOnly = true)
    public List<TrainingExample> listTrainingExamples() {
        return trainingExampleRepository.findAllByOrderByCreatedAtAsc();
    }

    @Override
    @Transactional
    public void clear() {
        trainingExampleRepository.deleteAllInBatch();
        wordFrequencyRepository.deleteAllInBatch();
        categoryTotalsRepository.deleteAllInBatch();
        modelMetaRepository.deleteAllInBatch();
        log.info("Cleared all learned counters and training examples");
    }

    private static void requireKeyWidth(String key) {
        if (key.length() > WordFrequency.KEY_LENGTH) {
            throw new IllegalArgumentException("Key longer than " + WordFrequency.KEY_LENGTH + " characters: "
                    + key.substring(0, 32) + "...");
        }
    }

    private long parseCounter(String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Corrupt model_meta value for " + ModelMeta.VOCAB_SIZE + ": " + raw, e);
        }
    }
}
