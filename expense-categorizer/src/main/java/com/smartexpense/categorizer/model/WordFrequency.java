package com.smartexpense.categorizer.model;

import jakarta.persistence.*;

@Entity
@Table(name = "word_frequency")
@IdClass(WordFrequencyId.class)
public class WordFrequency {

    // width of every word and category key column; the MERGE casts use the same width
    public static final int KEY_LENGTH = 255;

    @Id
    @Column(length = KEY_LENGTH)
    private String word;

    @Id
    @Column(length = KEY_LENGTH)
    private String category;

    @Column(name = "word_count", nullable = false)
    private long count;

    public WordFrequency() {}

    public WordFrequency(String word, String category, long count) {
        this.word = word;
        this.category = category;
        this.count = count;
    }

    public String getWord() { return word; }
    public void setWord(String word) { this.word = word; }

    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }

    public long getCount() { return count; }
    public void setCount(long count) { this.count = count; }
}
