package com.smartexpense.categorizer.model;

/**
 * Why the naive-Bayes predictor declined to name a category.
 */
public enum NoPredictionReason {
    EMPTY_INPUT("empty input"),
    UNTRAINED("untrained"),
    ALL_TOKENS_UNSEEN("all tokens unseen"),
    LOW_CONFIDENCE("low confidence");

    private final String description;

    NoPredictionReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
