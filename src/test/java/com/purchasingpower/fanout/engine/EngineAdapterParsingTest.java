package com.purchasingpower.fanout.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.fanout.model.RawResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineAdapterParsingTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void brave_shouldReadWebResultsAndSkipEntriesWithoutUrl() throws Exception {
        // Given
        BraveEngineAdapter.BraveConfig config = new BraveEngineAdapter.BraveConfig();
        config.setApiKey("test-key");
        BraveEngineAdapter adapter = new BraveEngineAdapter(config, objectMapper);
        String body = """
                {"web": {"results": [
                  {"url": "https://example.com/a", "title": "Example A", "description": "About A", "age": "2 days ago"},
                  {"title": "No url"},
                  {"url": "https://example.com/b"}
                ]}}
                """;

        // When
        List<RawResult> results = adapter.parseResults(body);

        // Then
        assertThat(results).extracting(RawResult::getUrl).containsExactly("https://example.com/a", "https://example.com/b");
        assertThat(results.get(0).getSnippet()).isEqualTo("About A");
        assertThat(results.get(0).getMetadata()).containsEntry("age", "2 days ago");
        assertThat(results.get(1).getTitle()).isEmpty();
        assertThat(adapter.parseResults("{}")).isEmpty();
    }

    @Test
    void tavily_shouldReadContentAsSnippetAndKeepScore() throws Exception {
        TavilyEngineAdapter.TavilyConfig config = new TavilyEngineAdapter.TavilyConfig();
        config.setApiKey("test-key");
        TavilyEngineAdapter adapter = new TavilyEngineAdapter(config, objectMapper);
        String body = """
                {"results": [{"url": "https://example.org", "title": "Org", "content": "Org content", "score": 0.87}]}
                """;

        List<RawResult> results = adapter.parseResults(body);

        assertThat(results).singleElement().satisfies(r -> {
            assertThat(r.getSnippet()).isEqualTo("Org content");
            assertThat(r.getMetadata()).containsEntry("score", 0.87);
        });
    }

    @Test
    void missingApiKey_shouldFailFast() {
        assertThatThrownBy(() -> new BraveEngineAdapter(new BraveEngineAdapter.BraveConfig(), objectMapper))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("api-key");
    }
}
