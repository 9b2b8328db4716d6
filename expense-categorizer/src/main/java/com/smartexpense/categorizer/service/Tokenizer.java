package com.smartexpense.categorizer.service;

import com.smartexpense.categorizer.config.CategorizerProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns a transaction note / merchant string into the bounded token list both engines work on.
 * Stateless; safe to share.
 */
@Component
public class Tokenizer {

    public static final int DEFAULT_MAX_TOKENS = 10;

    // longer runs are hashes or pasted junk, never a merchant word
    public static final int MAX_TOKEN_LENGTH = 64;

    // kept small so merchant names are not lost
    private static final Set<String> STOPWORDS = Set.of(
            "the", "a", "an", "and", "or", "in", "on", "at", "to", "for", "from",
            "with", "of", "by", "is", "was", "were", "be", "been", "are"
    );

    private static final Pattern NON_ALPHANUM = Pattern.compile("[^a-z0-9]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern ELONGATED = Pattern.compile("(.)\\1{2,}");

    private final int maxTokens;

    public Tokenizer() {
        this(DEFAULT_MAX_TOKENS);
    }

    @Autowired
    public Tokenizer(CategorizerProperties properties) {
        this(properties.getMaxTokens());
    }

    Tokenizer(int maxTokens) {
        this.maxTokens = Math.max(1, maxTokens);
    }

    public List<String> tokenize(String text) {
        if (text == null || text.isBlank()) return Collections.emptyList();

        String cleaned = NON_ALPHANUM.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ");
        List<String> tokens = new ArrayList<>();
        for (String raw : WHITESPACE.split(cleaned.trim())) {
            if (raw.isEmpty()) continue;
            String token = ELONGATED.matcher(raw).replaceAll("$1$1");
            if (token.length() <= 2 || token.length() > MAX_TOKEN_LENGTH || STOPWORDS.contains(token)) continue;
            tokens.add(token);
            if (tokens.size() == maxTokens) break;
        }
        return tokens;
    }
}
