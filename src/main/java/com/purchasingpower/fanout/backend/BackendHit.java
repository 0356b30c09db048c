package com.purchasingpower.fanout.backend;

/**
 * One search hit with a backend-specific relevance score.
 */
public record BackendHit(String id, double score, IndexedDocument document) {
}
