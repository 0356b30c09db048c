package com.purchasingpower.fanout.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.fanout.backend.InMemorySearchBackend;
import com.purchasingpower.fanout.backend.Neo4jSearchBackend;
import com.purchasingpower.fanout.backend.UnifiedBackendRouter;
import com.purchasingpower.fanout.embedding.EmbeddingService;
import com.purchasingpower.fanout.indexing.BackgroundIndexWriter;
import com.purchasingpower.fanout.indexing.DocumentMapper;
import com.purchasingpower.fanout.indexing.IndexSink;
import com.purchasingpower.fanout.indexing.IndexWriterFactory;
import com.purchasingpower.fanout.indexing.SearchIndexSink;
import com.purchasingpower.fanout.indexing.VectorIndexSink;
import io.pinecone.clients.Pinecone;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Storage side: Neo4j primary, in-memory secondary, the router over both, and the index sinks
 * fed by the background writer.
 */
@Slf4j
@Configuration
public class BackendConfig {

    @Bean
    public UnifiedBackendRouter unifiedBackendRouter(Neo4jProperties neo4jProperties,
                                                     BackendProperties backendProperties,
                                                     ObjectMapper objectMapper,
                                                     @Qualifier("backendExecutor") Executor backendExecutor) {
        return new UnifiedBackendRouter(
                new Neo4jSearchBackend(neo4jProperties, objectMapper),
                new InMemorySearchBackend(),
                backendProperties,
                backendExecutor);
    }

    @Bean
    public IndexWriterFactory indexWriterFactory(UnifiedBackendRouter router,
                                                 DocumentMapper documentMapper,
                                                 VectorSinkProperties vectorProperties,
                                                 ObjectProvider<EmbeddingService> embeddingService,
                                                 SearchProperties searchProperties) {
        List<IndexSink> sinks = new ArrayList<>();
        sinks.add(new SearchIndexSink(router));

        EmbeddingService embeddings = embeddingService.getIfAvailable();
        if (vectorProperties.isEnabled() && embeddings != null) {
            Pinecone pinecone = new Pinecone.Builder(vectorProperties.getApiKey()).build();
            sinks.add(new VectorIndexSink(pinecone, embeddings, vectorProperties));
        } else if (vectorProperties.isEnabled()) {
            log.warn("⚠️ Vector sink enabled but no embedding service is available, skipping it");
        }

        SearchProperties.Writer writer = searchProperties.getWriter();
        BackgroundIndexWriter.Settings settings = new BackgroundIndexWriter.Settings(
                writer.getBatchSize(),
                writer.getFlushInterval(),
                writer.getPollInterval(),
                writer.getQueueCapacity(),
                writer.getOfferTimeout());

        log.info("✅ Index sinks: {}", sinks.stream().map(IndexSink::name).toList());
        return new IndexWriterFactory(sinks, documentMapper, settings);
    }
}
