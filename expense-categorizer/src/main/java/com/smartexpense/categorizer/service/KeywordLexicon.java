package com.smartexpense.categorizer.service;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import com.smartexpense.categorizer.config.CategorizerProperties;
import com.smartexpense.categorizer.model.CategoryRule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static category -> keywords mapping used by the {@link RuleEngine}.
 * <p>
 * Loaded once from {@code categorizer.lexicon-location} (CSV rows {@code category,keyword}, file
 * order is declaration order). When the resource is absent the built-in lexicon is used.
 * The mapping is immutable after construction.
 */
@Slf4j
@Component
public class KeywordLexicon {

    // fallback lexicon, used when no CSV is shipped
    private static final List<CategoryRule> BUILT_IN_RULES = List.of(
            new CategoryRule("food", "zomato"), new CategoryRule("food", "swiggy"),
            new CategoryRule("food", "dominos"), new CategoryRule("food", "pizza"),
            new CategoryRule("food", "kfc"), new CategoryRule("food", "mcdonalds"),
            new CategoryRule("food", "burger"), new CategoryRule("food", "cafe"),
            new CategoryRule("food", "restaurant"), new CategoryRule("food", "meal"),
            new CategoryRule("food", "lunch"), new CategoryRule("food", "dinner"),
            new CategoryRule("food", "biryani"),
            new CategoryRule("transport", "uber"), new CategoryRule("transport", "ola"),
            new CategoryRule("transport", "rapido"), new CategoryRule("transport", "taxi"),
            new CategoryRule("transport", "cab"), new CategoryRule("transport", "bus"),
            new CategoryRule("transport", "metro"), new CategoryRule("transport", "fuel"),
            new CategoryRule("transport", "petrol"), new CategoryRule("transport", "diesel"),
            new CategoryRule("transport", "bike"), new CategoryRule("transport", "train"),
            new CategoryRule("shopping", "amazon"), new CategoryRule("shopping", "flipkart"),
            new CategoryRule("shopping", "myntra"), new CategoryRule("shopping", "ajio"),
            new CategoryRule("shopping", "meesho"), new CategoryRule("shopping", "dmart"),
            new CategoryRule("shopping", "bigbasket"), new CategoryRule("shopping", "nykaa"),
            new CategoryRule("shopping", "zara"),
            new CategoryRule("bills", "electricity"), new CategoryRule("bills", "water"),
            new CategoryRule("bills", "gas"), new CategoryRule("bills", "recharge"),
            new CategoryRule("bills", "airtel"), new CategoryRule("bills", "jio"),
            new CategoryRule("bills", "broadband"), new CategoryRule("bills", "wifi"),
            new CategoryRule("bills", "dth"), new CategoryRule("bills", "bill"),
            new CategoryRule("bills", "rent"),
            new CategoryRule("health", "pharmacy"), new CategoryRule("health", "medical"),
            new CategoryRule("health", "chemist"), new CategoryRule("health", "hospital"),
            new CategoryRule("health", "clinic"), new CategoryRule("health", "medlife"),
            new CategoryRule("health", "1mg"), new CategoryRule("health", "apollo"),
            new CategoryRule("subscriptions", "spotify"), new CategoryRule("subscriptions", "netflix"),
            new CategoryRule("subscriptions", "prime"), new CategoryRule("subscriptions", "hotstar"),
            new CategoryRule("subscriptions", "youtube"), new CategoryRule("subscriptions", "apple"),
            new CategoryRule("subscriptions", "google"), new CategoryRule("subscriptions", "itunes")
    );

    private final Map<String, List<String>> keywordsByCategory;

    @Autowired
    public KeywordLexicon(CategorizerProperties properties, ResourceLoader resourceLoader) {
        this(loadRules(resourceLoader.getResource(properties.getLexiconLocation())));
    }

    public KeywordLexicon(List<CategoryRule> rules) {
        Map<String, List<String>> grouped = new LinkedHashMap<>();
        for (CategoryRule rule : rules) {
            if (!rule.isMatchable()) {
                log.warn("Skipping lexicon entry '{}': keyword must be a single alphanumeric word of 3+ chars", rule);
                continue;
            }
            List<String> keywords = grouped.computeIfAbsent(rule.getCategory(), k -> new ArrayList<>());
            if (!keywords.contains(rule.getKeyword())) keywords.add(rule.getKeyword());
        }
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        grouped.forEach((category, keywords) -> frozen.put(category, List.copyOf(keywords)));
        this.keywordsByCategory = Collections.unmodifiableMap(frozen);
        log.info("Keyword lexicon ready: {} categories, {} keywords",
                keywordsByCategory.size(), keywordsByCategory.values().stream().mapToInt(List::size).sum());
    }

    public static KeywordLexicon builtIn() {
        return new KeywordLexicon(BUILT_IN_RULES);
    }

    /** @return categories in declaration order, each with its keywords in declaration order */
    public Map<String, List<String>> asMap() {
        return keywordsByCategory;
    }

    private static List<CategoryRule> loadRules(Resource resource) {
        if (resource == null || !resource.exists()) {
            log.info("No lexicon at {}, using built-in keywords", resource == null ? "<none>" : resource.getDescription());
            return BUILT_IN_RULES;
        }
        try (Reader in = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
            List<CategoryRule> rules = readCsv(in);
            log.info("Loaded {} lexicon rows from {}", rules.size(), resource.getDescription());
            return rules;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read keyword lexicon " + resource.getDescription(), e);
        }
    }

    static List<CategoryRule> readCsv(Reader in) throws IOException {
        List<CategoryRule> rules = new ArrayList<>();
        try (CSVReader reader = new CSVReader(in)) {
            String[] row;
            boolean first = true;
            while ((row = reader.readNext()) != null) {
                if (row.length < 2) continue;
                String category = row[0] == null ? "" : row[0].trim();
                String keyword = row[1] == null ? "" : row[1].trim();
                // optional header
                if (first && category.equalsIgnoreCase("category") && keyword.equalsIgnoreCase("keyword")) {
                    first = false;
                    continue;
                }
                first = false;
                if (category.isBlank() || keyword.isBlank() || category.startsWith("#")) continue;
                rules.add(new CategoryRule(category, keyword));
            }
        } catch (CsvValidationException e) {
            throw new IOException("Lexicon CSV parse error at line " + e.getLineNumber(), e);
        }
        return rules;
    }
}
