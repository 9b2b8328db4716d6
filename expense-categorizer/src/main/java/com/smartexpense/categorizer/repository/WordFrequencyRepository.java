package com.smartexpense.categorizer.repository;

import com.smartexpense.categorizer.model.WordFrequency;
import com.smartexpense.categorizer.model.WordFrequencyId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

@Repository
public interface WordFrequencyRepository extends JpaRepository<WordFrequency, WordFrequencyId> {

    List<WordFrequency> findByWordIn(Collection<String> words);

    @Query("select distinct w.word from WordFrequency w where w.word in :words")
    List<String> findKnownWords(@Param("words") Collection<String> words);

    /**
     * Single-statement upsert: adds {@code delta} to the (word, category) counter, creating it if absent.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = """
            MERGE INTO word_frequency wf
            USING (SELECT CAST(:word AS VARCHAR(255)) AS word,
                          CAST(:category AS VARCHAR(255)) AS category,
                          CAST(:delta AS BIGINT) AS delta) src
            ON wf.word = src.word AND wf.category = src.category
            WHEN MATCHED THEN UPDATE SET word_count = wf.word_count + src.delta
            WHEN NOT MATCHED THEN INSERT (word, category, word_count) VALUES (src.word, src.category, src.delta)
            """, nativeQuery = true)
    int upsertIncrement(@Param("word") String word, @Param("category") String category, @Param("delta") long delta);
}
