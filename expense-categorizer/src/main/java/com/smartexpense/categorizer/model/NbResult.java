package com.smartexpense.categorizer.model;

import java.util.List;

/**
 * Outcome of the naive-Bayes predictor. Either {@code category} or {@code reason} is set.
 * {@code probability} is reported for low-confidence results too.
 */
public record NbResult(String category, double probability, NoPredictionReason reason, List<String> trace) {

    public NbResult {
        trace = trace == null ? List.of() : List.copyOf(trace);
    }

    public static NbResult predicted(String category, double probability, List<String> trace) {
        return new NbResult(category, probability, null, trace);
    }

    public static NbResult none(NoPredictionReason reason, double probability, List<String> trace) {
        return new NbResult(null, probability, reason, trace);
    }

    public static NbResult none(NoPredictionReason reason) {
        return none(reason, 0.0, List.of("NB: " + reason.getDescription()));
    }

    public boolean matched() {
        return category != null;
    }
}
