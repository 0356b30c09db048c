package com.purchasingpower.fanout.engine;

import com.purchasingpower.fanout.model.RawResult;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Anchor searcher that delegates to one registered engine, going through the same rate limiter
 * as regular engine calls. Returns nothing when the configured engine is not registered.
 */
@Slf4j
public class EngineAnchorSearcher implements AnchorSearcher {

    private final EngineRegistry registry;
    private final RateLimiter rateLimiter;
    private final String engineCode;

    public EngineAnchorSearcher(EngineRegistry registry, RateLimiter rateLimiter, String engineCode) {
        this.registry = registry;
        this.rateLimiter = rateLimiter;
        this.engineCode = engineCode;
        if (!registry.isRegistered(engineCode)) {
            log.warn("Anchor engine {} is not registered, anchor expansion will return no results", engineCode);
        }
    }

    @Override
    public List<RawResult> search(String anchorQuery, int maxResults) {
        EngineDescriptor engine = registry.find(engineCode).orElse(null);
        if (engine == null) {
            return List.of();
        }
        try {
            rateLimiter.waitIfNeeded(engineCode);
            List<RawResult> results = engine.getAdapter().search(anchorQuery, maxResults);
            rateLimiter.reportSuccess(engineCode);
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineException(engineCode, "interrupted while waiting for anchor clearance", e);
        } catch (RuntimeException e) {
            rateLimiter.reportError(engineCode);
            throw e;
        }
    }
}
