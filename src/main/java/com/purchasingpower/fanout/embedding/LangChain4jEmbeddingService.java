package com.purchasingpower.fanout.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Embeddings from a local Ollama model through LangChain4j, which handles retries and timeouts.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "app.sinks.vector", name = "enabled", havingValue = "true")
public class LangChain4jEmbeddingService implements EmbeddingService {

    private final EmbeddingModel embeddingModel;

    public LangChain4jEmbeddingService(
            @Value("${app.ollama.base-url:http://localhost:11434}") String ollamaBaseUrl,
            @Value("${app.ollama.embedding-model:mxbai-embed-large}") String modelName,
            @Value("${app.ollama.timeout-seconds:120}") int timeoutSeconds,
            @Value("${app.ollama.max-retries:3}") int maxRetries) {

        log.info("🔷 Initializing embedding service: model={} at {} (timeout {}s, retries {})",
                modelName, ollamaBaseUrl, timeoutSeconds, maxRetries);

        this.embeddingModel = OllamaEmbeddingModel.builder()
                .baseUrl(ollamaBaseUrl)
                .modelName(modelName)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .maxRetries(maxRetries)
                .logRequests(false)
                .logResponses(false)
                .build();
    }

    LangChain4jEmbeddingService(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public List<Float> embed(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Cannot embed empty text");
        }
        try {
            Response<Embedding> response = embeddingModel.embed(text);
            return response.content().vectorAsList();
        } catch (RuntimeException e) {
            log.error("❌ Embedding failed after retries: {}", e.getMessage());
            throw new IllegalStateException("Embedding generation failed", e);
        }
    }

    @Override
    public List<List<Float>> embedAll(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        List<TextSegment> segments = texts.stream()
                .map(t -> TextSegment.from(t == null || t.isBlank() ? " " : t))
                .toList();
        try {
            Response<List<Embedding>> response = embeddingModel.embedAll(segments);
            List<List<Float>> vectors = response.content().stream()
                    .map(Embedding::vectorAsList)
                    .toList();
            log.debug("Generated {} embeddings", vectors.size());
            return vectors;
        } catch (RuntimeException e) {
            log.error("❌ Batch embedding failed after retries: {}", e.getMessage());
            throw new IllegalStateException("Batch embedding generation failed", e);
        }
    }
}
