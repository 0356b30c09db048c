package com.purchasingpower.fanout.query;

import com.purchasingpower.fanout.model.SearchResult;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class DomainHeuristicCategorizerTest {

    private final DomainHeuristicCategorizer categorizer = new DomainHeuristicCategorizer();

    @ParameterizedTest
    @CsvSource({
            "https://www.reuters.com/world/europe, news",
            "https://opencorporates.com/companies/gb/123, corporate_registry",
            "https://acme.medium.com/story, blog",
            "https://cs.stanford.edu/people/x, academic",
            "https://forums.example.org/t/1, forum",
            "https://example.com/press/2024-results, news",
            "https://example.com/about, uncategorized"
    })
    void categorize_shouldApplyHostThenPathRules(String url, String expected) {
        SearchResult result = SearchResult.builder().url(url).build();

        assertThat(categorizer.categorize(result)).isEqualTo(expected);
    }
}
