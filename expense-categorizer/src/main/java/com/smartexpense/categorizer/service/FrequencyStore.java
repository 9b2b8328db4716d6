package com.smartexpense.categorizer.service;

import com.smartexpense.categorizer.model.CategoryTotal;
import com.smartexpense.categorizer.model.TrainingExample;
import com.smartexpense.categorizer.model.WordCount;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Persistent counters behind the naive-Bayes model.
 * <p>
 * Every increment must be a single atomic upsert in the backing store; callers never
 * read-then-write a counter. Implementations must only run parameterized statements.
 */
public interface FrequencyStore {

    default void incrementWord(String word, String category) {
        incrementWord(word, category, 1);
    }

    /** Adds {@code delta} to the (word, category) count, inserting the row if absent. */
    void incrementWord(String word, String category, long delta);

    /** totalWords += tokenMass and docCount += 1, inserting the row if absent. */
    void incrementCategoryTotals(String category, long tokenMass);

    void setVocabSize(long vocabSize);

    /** @return the stored vocabulary size, 0 when never set */
    long getVocabSize();

    void addToVocabSize(long delta);

    List<WordCount> lookupWords(Collection<String> words);

    /** @return the subset of {@code words} that has a row under at least one category */
    Set<String> knownWords(Collection<String> words);

    /** @return all category totals ordered by category id ascending */
    List<CategoryTotal> listCategoryTotals();

    void recordTrainingExample(TrainingExample example);

    List<TrainingExample> listTrainingExamples();

    /** Drops every counter and audit row. */
    void clear();
}
