package com.smartexpense.categorizer.service;

import com.smartexpense.categorizer.model.CategoryTotal;
import com.smartexpense.categorizer.model.TrainingExample;
import com.smartexpense.categorizer.model.WordCount;
import com.smartexpense.categorizer.model.WordFrequencyId;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Map-backed {@link FrequencyStore} for engine tests. Same ordering contract as the JPA store.
 */
class InMemoryFrequencyStore implements FrequencyStore {

    final Map<WordFrequencyId, Long> words = new LinkedHashMap<>();
    final Map<String, long[]> totals = new TreeMap<>();
    final List<TrainingExample> examples = new ArrayList<>();
    final List<String> incrementOrder = new ArrayList<>();
    long vocabSize;

    @Override
    public synchronized void incrementWord(String word, String category, long delta) {
        words.merge(new WordFrequencyId(word, category), delta, Long::sum);
        incrementOrder.add(word);
    }

    @Override
    public synchronized void incrementCategoryTotals(String category, long tokenMass) {
        long[] t = totals.computeIfAbsent(category, k -> new long[2]);
        t[0] += tokenMass;
        t[1] += 1;
    }

    @Override
    public synchronized void setVocabSize(long vocabSize) {
        this.vocabSize = vocabSize;
    }

    @Override
    public synchronized long getVocabSize() {
        return vocabSize;
    }

    @Override
    public synchronized void addToVocabSize(long delta) {
        vocabSize += delta;
    }

    @Override
    public synchronized List<WordCount> lookupWords(Collection<String> lookup) {
        return words.entrySet().stream()
                .filter(e -> lookup.contains(e.getKey().getWord()))
                .map(e -> new WordCount(e.getKey().getWord(), e.getKey().getCategory(), e.getValue()))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized Set<String> knownWords(Collection<String> lookup) {
        Set<String> known = new HashSet<>();
        for (WordFrequencyId id : words.keySet()) {
            if (lookup.contains(id.getWord())) known.add(id.getWord());
        }
        return known;
    }

    @Override
    public synchronized List<CategoryTotal> listCategoryTotals() {
        return totals.entrySet().stream()
                .map(e -> new CategoryTotal(e.getKey(), e.getValue()[0], e.getValue()[1]))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized void recordTrainingExample(TrainingExample example) {
        examples.add(example);
    }

    @Override
    public synchronized List<TrainingExample> listTrainingExamples() {
        return new ArrayList<>(examples);
    }

    @Override
    public synchronized void clear() {
        words.clear();
        totals.clear();
        examples.clear();
        incrementOrder.clear();
        vocabSize = 0;
    }

    long count(String word, String category) {
        return words.getOrDefault(new WordFrequencyId(word, category), 0L);
    }

    long docCount(String category) {
        long[] t = totals.get(category);
        return t == null ? 0 : t[1];
    }

    long totalWords(String category) {
        long[] t = totals.get(category);
        return t == null ? 0 : t[0];
    }
}
