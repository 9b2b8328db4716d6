package com.smartexpense.categorizer.service;

import com.smartexpense.categorizer.model.CategoryRule;
import com.smartexpense.categorizer.model.RuleResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RuleEngine")
class RuleEngineTest {

    private final RuleEngine engine = new RuleEngine(KeywordLexicon.builtIn());

    @Test
    void exactKeywordMatchScoresOne() {
        RuleResult result = engine.match(List.of("uber", "ride"));

        assertThat(result.category()).isEqualTo("transport");
        assertThat(result.score()).isEqualTo(1.0);
        assertThat(result.trace()).containsExactly("exact: uber -> transport");
    }

    @Test
    void fuzzyMatchWithinEditBudget() {
        RuleResult result = engine.match(List.of("zomatoo"));

        assertThat(result.category()).isEqualTo("food");
        assertThat(result.score()).isEqualTo(0.85);
        assertThat(result.trace()).containsExactly("fuzzy: zomatoo~zomato -> food");
    }

    @Test
    void longKeywordsTolerateTwoEdits() {
        RuleResult result = engine.match(List.of("electrcty"));

        assertThat(result.category()).isEqualTo("bills");
        assertThat(result.score()).isEqualTo(0.85);
    }

    @Test
    void exactMatchAnywhereBeatsEarlierFuzzyMatch() {
        // "piza" is a fuzzy hit in food, which is declared before bills
        RuleResult result = engine.match(List.of("piza", "rent"));

        assertThat(result.category()).isEqualTo("bills");
        assertThat(result.score()).isEqualTo(1.0);
    }

    @Test
    void categoryDeclarationOrderDecidesBetweenExactHits() {
        RuleResult result = engine.match(List.of("rent", "uber"));

        assertThat(result.category()).isEqualTo("transport");
    }

    @Test
    void noMatchScoresZero() {
        RuleResult result = engine.match(List.of("salary", "credit"));

        assertThat(result.matched()).isFalse();
        assertThat(result.category()).isNull();
        assertThat(result.score()).isZero();
        assertThat(engine.match(List.of()).matched()).isFalse();
    }

    @Test
    void keywordOrderWithinCategoryIsRespected() {
        RuleEngine custom = new RuleEngine(new KeywordLexicon(List.of(
                new CategoryRule("travel", "flight"),
                new CategoryRule("travel", "hotel"),
                new CategoryRule("lodging", "hotel"))));

        RuleResult result = custom.match(List.of("hotel", "flight"));

        assertThat(result.category()).isEqualTo("travel");
        assertThat(result.trace()).containsExactly("exact: flight -> travel");
    }

    @Test
    void shortKeywordsAllowOnlyOneEdit() {
        RuleEngine custom = new RuleEngine(new KeywordLexicon(List.of(new CategoryRule("food", "pizza"))));

        assertThat(custom.match(List.of("pizzza")).category()).isEqualTo("food");
        assertThat(custom.match(List.of("pzzaa")).matched()).isFalse();
    }

    @Test
    void editBudgetGrowsPastSixCharacters() {
        assertThat(RuleEngine.maxEditDistance("swiggy")).isEqualTo(1);
        assertThat(RuleEngine.maxEditDistance("netflix")).isEqualTo(2);
    }

    @Test
    void levenshteinDistance() {
        assertThat(RuleEngine.levenshteinDistance("kitten", "sitting")).isEqualTo(3);
        assertThat(RuleEngine.levenshteinDistance("", "abc")).isEqualTo(3);
        assertThat(RuleEngine.levenshteinDistance("flaw", "lawn")).isEqualTo(2);
        assertThat(RuleEngine.levenshteinDistance("same", "same")).isZero();
    }
}
