package com.smartexpense.categorizer.model;

import jakarta.persistence.*;

@Entity
@Table(name = "category_totals")
public class CategoryTotals {

    @Id
    @Column(length = WordFrequency.KEY_LENGTH)
    private String category;

    // weighted token mass ever added for this category
    @Column(name = "total_words", nullable = false)
    private long totalWords;

    // one per training call
    @Column(name = "doc_count", nullable = false)
    private long docCount;

    public CategoryTotals() {}

    public CategoryTotals(String category, long totalWords, long docCount) {
        this.category = category;
        this.totalWords = totalWords;
        this.docCount = docCount;
    }

    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }

    public long getTotalWords() { return totalWords; }
    public void setTotalWords(long totalWords) { this.totalWords = totalWords; }

    public long getDocCount() { return docCount; }
    public void setDocCount(long docCount) { this.docCount = docCount; }
}
