package com.smartexpense.categorizer.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which engine produced the final decision.
 */
public enum PredictionSource {
    RULE("rule"),
    NB("nb"),
    NONE("none");

    private final String label;

    PredictionSource(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
