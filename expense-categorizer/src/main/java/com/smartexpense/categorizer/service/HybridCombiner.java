package com.smartexpense.categorizer.service;

import com.smartexpense.categorizer.config.CategorizerProperties;
import com.smartexpense.categorizer.model.NbResult;
import com.smartexpense.categorizer.model.PredictionSource;
import com.smartexpense.categorizer.model.RuleResult;
import com.smartexpense.categorizer.model.Suggestion;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reconciles the rule engine and the naive-Bayes predictor into one {@link Suggestion}.
 * <p>
 * A rule hit wins unless NB is very sure of a different category; without a rule hit NB is used
 * above the normal threshold. Stateless.
 */
@Component
public class HybridCombiner {

    static final String EXPLANATION_SEPARATOR = "; ";

    private final double nbThreshold;
    private final double nbOverrideThreshold;

    @Autowired
    public HybridCombiner(CategorizerProperties properties) {
        this(properties.getNbThreshold(), properties.getNbOverrideThreshold());
    }

    HybridCombiner(double nbThreshold, double nbOverrideThreshold) {
        this.nbThreshold = nbThreshold;
        this.nbOverrideThreshold = nbOverrideThreshold;
    }

    public Suggestion emptyInput() {
        return new Suggestion(null, 0.0, PredictionSource.NONE, "No text provided");
    }

    public Suggestion combine(RuleResult rule, NbResult nb) {
        if (rule.matched()) {
            if (nb.matched() && !nb.category().equals(rule.category()) && nb.probability() >= nbOverrideThreshold) {
                return new Suggestion(nb.category(), nb.probability(), PredictionSource.NB,
                        explain(format("NB override of rule %s (p=%.3f)", rule.category(), nb.probability()), rule, nb));
            }
            return new Suggestion(rule.category(), rule.score(), PredictionSource.RULE,
                    explain(format("Rule match used (score=%.2f, NB p=%.3f)", rule.score(), nb.probability()), rule, nb));
        }

        if (nb.matched() && nb.probability() >= nbThreshold) {
            return new Suggestion(nb.category(), nb.probability(), PredictionSource.NB,
                    explain(format("NB used, no rule match (p=%.3f)", nb.probability()), rule, nb));
        }

        return new Suggestion(null, Math.max(rule.score(), nb.probability()), PredictionSource.NONE,
                explain("Low confidence from both engines", rule, nb));
    }

    private static String explain(String branch, RuleResult rule, NbResult nb) {
        List<String> lines = new ArrayList<>();
        lines.add(branch);
        lines.addAll(rule.trace());
        lines.addAll(nb.trace());
        return String.join(EXPLANATION_SEPARATOR, lines);
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
