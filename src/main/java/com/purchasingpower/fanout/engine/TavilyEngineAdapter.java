package com.purchasingpower.fanout.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.purchasingpower.fanout.model.RawResult;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Web search through the Tavily API (engine code {@code TV}).
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.engines.tavily", name = "enabled", havingValue = "true")
@EnableConfigurationProperties(TavilyEngineAdapter.TavilyConfig.class)
public class TavilyEngineAdapter implements EngineAdapter {

    public static final String CODE = "TV";
    private static final String ENDPOINT = "https://api.tavily.com/search";

    private final TavilyConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public TavilyEngineAdapter(TavilyConfig config, ObjectMapper objectMapper) {
        Preconditions.checkArgument(config.getApiKey() != null && !config.getApiKey().isBlank(),
                "app.engines.tavily.api-key is required when Tavily is enabled");
        this.config = config;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .build();
    }

    @Override
    public String code() {
        return CODE;
    }

    @Override
    public List<RawResult> search(String query, int maxResults) {
        Preconditions.checkNotNull(query, "Query cannot be null");
        int limit = Math.min(maxResults, config.getMaxResults());

        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(ENDPOINT))
                    .header("Content-Type", "application/json")
                    .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                    .POST(HttpRequest.BodyPublishers.ofString(buildRequest(query, limit)))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new EngineException(CODE, "HTTP " + response.statusCode());
            }
            List<RawResult> results = parseResults(response.body());
            log.debug("Tavily returned {} results for '{}'", results.size(), query);
            return results;

        } catch (IOException e) {
            throw new EngineException(CODE, "request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineException(CODE, "interrupted", e);
        }
    }

    private String buildRequest(String query, int limit) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("api_key", config.getApiKey());
        body.put("query", query);
        body.put("search_depth", config.getSearchDepth());
        body.put("include_answer", false);
        body.put("max_results", limit);
        return objectMapper.writeValueAsString(body);
    }

    List<RawResult> parseResults(String body) throws IOException {
        JsonNode root = objectMapper.readTree(body);
        List<RawResult> results = new ArrayList<>();
        for (JsonNode item : root.path("results")) {
            if (!item.hasNonNull("url")) {
                continue;
            }
            RawResult.RawResultBuilder builder = RawResult.builder()
                    .url(item.get("url").asText())
                    .title(item.path("title").asText(""))
                    .snippet(item.path("content").asText(""));
            if (item.has("score")) {
                builder.metadataEntry("score", item.get("score").asDouble());
            }
            results.add(builder.build());
        }
        return results;
    }

    @Data
    @ConfigurationProperties(prefix = "app.engines.tavily")
    public static class TavilyConfig {
        private boolean enabled = false;
        private String apiKey;
        private int maxResults = 20;
        private int timeoutSeconds = 15;
        private String searchDepth = "basic";
    }
}
