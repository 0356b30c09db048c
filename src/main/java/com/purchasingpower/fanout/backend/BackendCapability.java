package com.purchasingpower.fanout.backend;

/**
 * Optional search features a backend may support. Keyword search is always available.
 */
public enum BackendCapability {
    KEYWORD,
    VECTOR,
    HYBRID,
    GRAPH
}
