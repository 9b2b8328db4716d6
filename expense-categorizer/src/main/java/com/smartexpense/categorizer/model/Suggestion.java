package com.smartexpense.categorizer.model;

/**
 * Final answer handed to the UI. {@code category} is null when neither engine was confident.
 */
public record Suggestion(String category, double confidence, PredictionSource source, String explanation) {

    public boolean hasCategory() {
        return category != null;
    }
}
