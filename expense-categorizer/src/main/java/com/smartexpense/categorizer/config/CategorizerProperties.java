package com.smartexpense.categorizer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables for the categorization engine, bound from {@code categorizer.*}.
 */
@ConfigurationProperties(prefix = "categorizer")
public class CategorizerProperties {

    /** Where the keyword lexicon CSV lives. Falls back to the built-in lexicon when missing. */
    private String lexiconLocation = "classpath:lexicon.csv";

    /** Naive-Bayes predictions below this probability are suppressed. */
    private double nbMinConfidence = 0.55;

    /** NB probability needed to categorize when no rule matched. */
    private double nbThreshold = 0.6;

    /** NB probability needed to override a rule match with a different category. */
    private double nbOverrideThreshold = 0.85;

    private int maxTokens = 10;

    public String getLexiconLocation() { return lexiconLocation; }
    public void setLexiconLocation(String lexiconLocation) { this.lexiconLocation = lexiconLocation; }

    public double getNbMinConfidence() { return nbMinConfidence; }
    public void setNbMinConfidence(double nbMinConfidence) { this.nbMinConfidence = nbMinConfidence; }

    public double getNbThreshold() { return nbThreshold; }
    public void setNbThreshold(double nbThreshold) { this.nbThreshold = nbThreshold; }

    public double getNbOverrideThreshold() { return nbOverrideThreshold; }
    public void setNbOverrideThreshold(double nbOverrideThreshold) { this.nbOverrideThreshold = nbOverrideThreshold; }

    public int getMaxTokens() { return maxTokens; }
    public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }
}
