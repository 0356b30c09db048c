package com.purchasingpower.fanout.indexing;

/**
 * Per-run attribution stamped on every indexed document.
 *
 * @param query     raw query that produced the results
 * @param projectId optional, may be null
 */
public record IndexContext(String query, String zone, String userId, String projectId) {
}
