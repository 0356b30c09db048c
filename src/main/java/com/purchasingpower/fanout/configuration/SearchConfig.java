package com.purchasingpower.fanout.configuration;

import com.purchasingpower.fanout.backend.UnifiedBackendRouter;
import com.purchasingpower.fanout.engine.AdaptiveRateLimiter;
import com.purchasingpower.fanout.engine.AnchorSearcher;
import com.purchasingpower.fanout.engine.EngineAdapter;
import com.purchasingpower.fanout.engine.EngineAnchorSearcher;
import com.purchasingpower.fanout.engine.EngineRegistry;
import com.purchasingpower.fanout.engine.RateLimiter;
import com.purchasingpower.fanout.indexing.IndexWriterFactory;
import com.purchasingpower.fanout.orchestrator.CorpusSearcher;
import com.purchasingpower.fanout.orchestrator.QueryPreparer;
import com.purchasingpower.fanout.orchestrator.StreamingSearchOrchestrator;
import com.purchasingpower.fanout.query.PhraseMatcher;
import com.purchasingpower.fanout.query.ResultCategorizer;
import com.purchasingpower.fanout.recall.RecallConfig;
import com.purchasingpower.fanout.recall.RecallStrategyPlanner;
import com.purchasingpower.fanout.routing.QueryOperatorRouter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Search side: engines, rate limiting, recall planning and the orchestrator.
 */
@Configuration
public class SearchConfig {

    @Bean
    @ConfigurationProperties(prefix = "app.recall")
    public RecallConfig recallConfig() {
        return RecallConfig.balanced();
    }

    @Bean
    public RecallStrategyPlanner recallStrategyPlanner(RecallConfig recallConfig) {
        return new RecallStrategyPlanner(recallConfig);
    }

    @Bean
    public EngineRegistry engineRegistry(ObjectProvider<EngineAdapter> adapters) {
        return new EngineRegistry(adapters.orderedStream().toList());
    }

    @Bean
    public RateLimiter rateLimiter(RateLimitProperties properties) {
        return new AdaptiveRateLimiter(properties);
    }

    @Bean
    public AnchorSearcher anchorSearcher(EngineRegistry registry, RateLimiter rateLimiter, SearchProperties properties) {
        return new EngineAnchorSearcher(registry, rateLimiter, properties.getAnchorEngine());
    }

    @Bean
    public CorpusSearcher corpusSearcher(UnifiedBackendRouter router, BackendProperties backendProperties,
                                         SearchProperties searchProperties) {
        return new CorpusSearcher(router, backendProperties.getDefaultZone(), searchProperties.getCorpusLimit());
    }

    @Bean
    public StreamingSearchOrchestrator streamingSearchOrchestrator(
            QueryOperatorRouter operatorRouter,
            RecallStrategyPlanner planner,
            QueryPreparer queryPreparer,
            EngineRegistry engineRegistry,
            RateLimiter rateLimiter,
            AnchorSearcher anchorSearcher,
            CorpusSearcher corpusSearcher,
            PhraseMatcher phraseMatcher,
            ResultCategorizer categorizer,
            IndexWriterFactory writerFactory,
            SearchProperties searchProperties,
            BackendProperties backendProperties,
            @Qualifier("engineExecutor") Executor engineExecutor,
            @Qualifier("anchorExecutor") Executor anchorExecutor) {
        return new StreamingSearchOrchestrator(operatorRouter, planner, queryPreparer, engineRegistry,
                rateLimiter, anchorSearcher, corpusSearcher, phraseMatcher, categorizer, writerFactory,
                searchProperties, backendProperties.getDefaultZone(), engineExecutor, anchorExecutor);
    }
}
