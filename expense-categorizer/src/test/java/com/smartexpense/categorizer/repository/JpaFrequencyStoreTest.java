package com.smartexpense.categorizer.repository;

import com.smartexpense.categorizer.model.CategoryTotal;
import com.smartexpense.categorizer.model.TrainingExample;
import com.smartexpense.categorizer.model.WordCount;
import com.smartexpense.categorizer.service.JpaFrequencyStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Runs the MERGE-based upserts against the embedded H2 database.
 */
@DataJpaTest
@ActiveProfiles("test")
@Import(JpaFrequencyStore.class)
@DisplayName("JpaFrequencyStore Integration Tests")
class JpaFrequencyStoreTest {

    @Autowired
    private JpaFrequencyStore store;

    @Autowired
    private WordFrequencyRepository wordFrequencyRepository;

    @Test
    @DisplayName("incrementWord inserts then accumulates")
    void incrementWordUpserts() {
        store.incrementWord("uber", "transport");
        store.incrementWord("uber", "transport");
        store.incrementWord("uber", "transport", 3);
        store.incrementWord("uber", "food");

        List<WordCount> rows = store.lookupWords(List.of("uber", "missing"));

        assertThat(rows).extracting(WordCount::word, WordCount::category, WordCount::count)
                .containsExactlyInAnyOrder(tuple("uber", "transport", 5L), tuple("uber", "food", 1L));
        assertThat(wordFrequencyRepository.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("incrementCategoryTotals adds mass and one document per call")
    void incrementCategoryTotalsUpserts() {
        store.incrementCategoryTotals("transport", 2);
        store.incrementCategoryTotals("transport", 4);
        store.incrementCategoryTotals("food", 1);

        assertThat(store.listCategoryTotals()).containsExactly(
                new CategoryTotal("food", 1, 1),
                new CategoryTotal("transport", 6, 2));
    }

    @Test
    @DisplayName("vocab size defaults to zero and supports set and add")
    void vocabSize() {
        assertThat(store.getVocabSize()).isZero();

        store.addToVocabSize(3);
        assertThat(store.getVocabSize()).isEqualTo(3);

        store.addToVocabSize(2);
        store.addToVocabSize(0);
        assertThat(store.getVocabSize()).isEqualTo(5);

        store.setVocabSize(42);
        assertThat(store.getVocabSize()).isEqualTo(42);
    }

    @Test
    @DisplayName("knownWords only reports words with a row")
    void knownWords() {
        store.incrementWord("netflix", "subscriptions");
        store.incrementWord("netflix", "bills");

        Set<String> known = store.knownWords(List.of("netflix", "spotify"));

        assertThat(known).containsExactly("netflix");
        assertThat(store.knownWords(List.of())).isEmpty();
        assertThat(store.lookupWords(List.of())).isEmpty();
    }

    @Test
    @DisplayName("words are bound as parameters, never spliced into SQL")
    void quotesInWordsAreHarmless() {
        store.incrementWord("o'reilly", "books");
        store.incrementWord("x'); DROP TABLE word_frequency; --", "books");

        assertThat(store.lookupWords(List.of("o'reilly"))).singleElement()
                .extracting(WordCount::count).isEqualTo(1L);
        assertThat(wordFrequencyRepository.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("keys wider than the key columns are rejected instead of truncated")
    void overlongKeysAreRejected() {
        String word = "ab".repeat(150);

        assertThatThrownBy(() -> store.incrementWord(word, "transport", 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.incrementCategoryTotals("c".repeat(256), 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(wordFrequencyRepository.count()).isZero();
        assertThat(store.listCategoryTotals()).isEmpty();
    }

    @Test
    @DisplayName("keys exactly as wide as the key columns round-trip unchanged")
    void fullWidthKeysAreFoundAgain() {
        String word = "w".repeat(255);
        store.incrementWord(word, "transport", 1);

        assertThat(store.lookupWords(List.of(word))).singleElement()
                .extracting(WordCount::word).isEqualTo(word);
        assertThat(store.knownWords(List.of(word))).containsExactly(word);
    }

    @Test
    @DisplayName("audit text up to 2000 characters is stored")
    void longAuditTextIsStored() {
        String text = "x".repeat(TrainingExample.TEXT_LENGTH);
        store.recordTrainingExample(new TrainingExample("id-1", "t1", text, "transport", Instant.now()));

        assertThat(store.listTrainingExamples()).singleElement()
                .extracting(TrainingExample::getText).isEqualTo(text);
    }

    @Test
    @DisplayName("clear wipes every relation")
    void clearRemovesEverything() {
        store.recordTrainingExample(new TrainingExample("id-1", "t1", "uber ride", "transport", Instant.now()));
        store.incrementWord("uber", "transport");
        store.incrementCategoryTotals("transport", 2);
        store.addToVocabSize(2);

        assertThat(store.listTrainingExamples()).hasSize(1);

        store.clear();

        assertThat(store.listTrainingExamples()).isEmpty();
        assertThat(store.lookupWords(List.of("uber"))).isEmpty();
        assertThat(store.listCategoryTotals()).isEmpty();
        assertThat(store.getVocabSize()).isZero();
    }
}
