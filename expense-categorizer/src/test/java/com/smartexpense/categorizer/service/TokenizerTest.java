package com.smartexpense.categorizer.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Tokenizer")
class TokenizerTest {

    private final Tokenizer tokenizer = new Tokenizer();

    @Test
    void stripsPunctuationAndKeepsOrder() {
        assertThat(tokenizer.tokenize("Zomato Order!! 123")).containsExactly("zomato", "order", "123");
    }

    @Test
    void collapsesElongatedRuns() {
        assertThat(tokenizer.tokenize("sooooo good")).containsExactly("soo", "good");
        assertThat(tokenizer.tokenize("sooooo")).containsExactly("soo");
    }

    @Test
    void dropsShortTokensAndStopwords() {
        assertThat(tokenizer.tokenize("The cab to the airport and back")).containsExactly("cab", "airport", "back");
        assertThat(tokenizer.tokenize("ok go at it")).isEmpty();
    }

    @Test
    void punctuationInsideWordsSplitsThem() {
        assertThat(tokenizer.tokenize("UPI/amazon-pay@icici")).containsExactly("upi", "amazon", "pay", "icici");
    }

    @Test
    void keepsOnlyFirstTenTokens() {
        String text = "a b c one two three four five six seven eight nine ten eleven twelve";
        assertThat(tokenizer.tokenize(text))
                .hasSize(10)
                .startsWith("one")
                .endsWith("ten");
    }

    @Test
    void blankInputYieldsNothing() {
        assertThat(tokenizer.tokenize(null)).isEmpty();
        assertThat(tokenizer.tokenize("   ")).isEmpty();
        assertThat(tokenizer.tokenize("!!! ??")).isEmpty();
    }

    @Test
    void repeatedTokensAreKept() {
        assertThat(tokenizer.tokenize("pizza pizza hut")).containsExactly("pizza", "pizza", "hut");
    }

    @Test
    void dropsTokensLongerThanTheLimit() {
        String longest = "abc".repeat(21) + "d";
        String tooLong = "ab".repeat(150);

        assertThat(longest).hasSize(Tokenizer.MAX_TOKEN_LENGTH);
        assertThat(tokenizer.tokenize("uber " + tooLong + " ride")).containsExactly("uber", "ride");
        assertThat(tokenizer.tokenize("uber " + longest)).containsExactly("uber", longest);
    }
}
