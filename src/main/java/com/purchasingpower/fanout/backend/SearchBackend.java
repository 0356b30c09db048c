package com.purchasingpower.fanout.backend;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Uniform operation set implemented by every storage backend the router can dispatch to.
 *
 * <p>Operations outside {@link #capabilities()} may throw {@link UnsupportedOperationException};
 * the router substitutes the nearest supported operation before calling them.
 *
 * @since 1.0.0
 */
public interface SearchBackend {

    String name();

    /**
     * Connects and prepares storage. Called once by the router before any operation;
     * throws if the backend cannot be used.
     */
    void initialize();

    Set<BackendCapability> capabilities();

    String indexEntity(GraphEntity entity);

    String indexDocument(IndexedDocument document);

    List<BackendHit> searchKeyword(String query, String zone, String docType, int limit);

    List<BackendHit> searchVector(List<Float> vector, String zone, String docType, int limit);

    List<BackendHit> searchHybrid(String text, List<Float> vector, String zone, String docType, int limit);

    GraphTraversal traverseGraph(String startId, int maxDepth, List<String> relationFilter, String zone);

    Optional<IndexedDocument> getById(String id);

    boolean deleteById(String id);

    long count(String zone, String docType);

    default void close() {
    }
}
