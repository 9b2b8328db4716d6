package com.smartexpense.categorizer.model;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * One lexicon row: a keyword that maps to a category.
 */
public class CategoryRule {

    private static final Pattern SINGLE_WORD = Pattern.compile("[a-z0-9]{3,}");

    private final String category;
    private final String keyword;

    public CategoryRule(String category, String keyword) {
        this.category = category == null ? "" : category.trim();
        this.keyword = keyword == null ? "" : keyword.trim().toLowerCase(Locale.ROOT);
    }

    public String getCategory() { return category; }
    public String getKeyword() { return keyword; }

    /**
     * True when the keyword could ever be produced by the tokenizer (a single lowercase
     * alphanumeric word longer than two characters).
     */
    public boolean isMatchable() {
        return !category.isEmpty() && SINGLE_WORD.matcher(keyword).matches();
    }

    @Override
    public String toString() {
        return keyword + " -> " + category;
    }
}
