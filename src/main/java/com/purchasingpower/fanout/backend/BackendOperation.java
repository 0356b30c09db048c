package com.purchasingpower.fanout.backend;

/**
 * Every operation the router can dispatch. Writes are the ones mirrored by dual indexing.
 */
public enum BackendOperation {
    INDEX_ENTITY(true),
    INDEX_DOCUMENT(true),
    SEARCH_KEYWORD(false),
    SEARCH_VECTOR(false),
    SEARCH_HYBRID(false),
    TRAVERSE_GRAPH(false),
    GET_BY_ID(false),
    DELETE_BY_ID(false),
    COUNT(false);

    private final boolean write;

    BackendOperation(boolean write) {
        this.write = write;
    }

    public boolean isWrite() {
        return write;
    }
}
