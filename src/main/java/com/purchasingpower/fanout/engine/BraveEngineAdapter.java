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
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Brave Search web API (engine code {@code BR}). Brave pages at 20 results, so larger
 * requests are split across offsets.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.engines.brave", name = "enabled", havingValue = "true")
@EnableConfigurationProperties(BraveEngineAdapter.BraveConfig.class)
public class BraveEngineAdapter implements EngineAdapter {

    public static final String CODE = "BR";
    private static final String ENDPOINT = "https://api.search.brave.com/res/v1/web/search";
    private static final int PAGE_SIZE = 20;
    private static final int MAX_OFFSET = 9;

    private final BraveConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public BraveEngineAdapter(BraveConfig config, ObjectMapper objectMapper) {
        Preconditions.checkArgument(config.getApiKey() != null && !config.getApiKey().isBlank(),
                "app.engines.brave.api-key is required when Brave is enabled");
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
        int wanted = Math.min(maxResults, config.getMaxResults());
        List<RawResult> results = new ArrayList<>();

        for (int offset = 0; results.size() < wanted && offset <= MAX_OFFSET; offset++) {
            List<RawResult> page = fetchPage(query, offset);
            if (page.isEmpty()) {
                break;
            }
            results.addAll(page);
            if (page.size() < PAGE_SIZE) {
                break;
            }
        }
        return results.size() > wanted ? new ArrayList<>(results.subList(0, wanted)) : results;
    }

    private List<RawResult> fetchPage(String query, int offset) {
        String uri = ENDPOINT + "?q=" + URLEncoder.encode(query, StandardCharsets.UTF_8)
                + "&count=" + PAGE_SIZE + "&offset=" + offset;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(uri))
                    .header("Accept", "application/json")
                    .header("X-Subscription-Token", config.getApiKey())
                    .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                    .GET()
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() == 429) {
                throw new EngineException(CODE, "rate limited");
            }
            if (response.statusCode() != 200) {
                throw new EngineException(CODE, "HTTP " + response.statusCode());
            }
            return parseResults(response.body());

        } catch (IOException e) {
            throw new EngineException(CODE, "request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineException(CODE, "interrupted", e);
        }
    }

    List<RawResult> parseResults(String body) throws IOException {
        JsonNode root = objectMapper.readTree(body);
        List<RawResult> results = new ArrayList<>();
        for (JsonNode item : root.path("web").path("results")) {
            if (!item.hasNonNull("url")) {
                continue;
            }
            RawResult.RawResultBuilder builder = RawResult.builder()
                    .url(item.get("url").asText())
                    .title(item.path("title").asText(""))
                    .snippet(item.path("description").asText(""));
            if (item.hasNonNull("age")) {
                builder.metadataEntry("age", item.get("age").asText());
            }
            results.add(builder.build());
        }
        return results;
    }

    @Data
    @ConfigurationProperties(prefix = "app.engines.brave")
    public static class BraveConfig {
        private boolean enabled = false;
        private String apiKey;
        private int maxResults = 100;
        private int timeoutSeconds = 15;
    }
}
