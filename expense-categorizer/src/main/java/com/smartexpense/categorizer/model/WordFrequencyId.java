package com.smartexpense.categorizer.model;

import java.io.Serializable;
import java.util.Objects;

public class WordFrequencyId implements Serializable {

    private String word;
    private String category;

    public WordFrequencyId() {}

    public WordFrequencyId(String word, String category) {
        this.word = word;
        this.category = category;
    }

    public String getWord() { return word; }
    public String getCategory() { return category; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WordFrequencyId)) return false;
        WordFrequencyId that = (WordFrequencyId) o;
        return Objects.equals(word, that.word) && Objects.equals(category, that.category);
    }

    @Override
    public int hashCode() {
        return Objects.hash(word, category);
    }
}
