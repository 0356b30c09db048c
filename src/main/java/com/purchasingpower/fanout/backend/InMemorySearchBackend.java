package com.purchasingpower.fanout.backend;

import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local keyword backend used as the secondary store. Keeps documents and entities in
 * concurrent maps; contents are lost on restart. Supports keyword search only.
 */
@Slf4j
public class InMemorySearchBackend implements SearchBackend {

    static final String NAME = "memory";

    private final Map<String, IndexedDocument> documents = new ConcurrentHashMap<>();
    private final Map<String, GraphEntity> entities = new ConcurrentHashMap<>();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void initialize() {
        log.info("In-memory backend ready ({} documents)", documents.size());
    }

    @Override
    public Set<BackendCapability> capabilities() {
        return EnumSet.of(BackendCapability.KEYWORD);
    }

    @Override
    public String indexEntity(GraphEntity entity) {
        entities.put(entity.getId(), entity);
        return entity.getId();
    }

    @Override
    public String indexDocument(IndexedDocument document) {
        documents.merge(document.getId(), document, (existing, incoming) ->
                incoming.getCreatedAt() == null && existing.getCreatedAt() != null
                        ? incoming.toBuilder().createdAt(existing.getCreatedAt()).build()
                        : incoming);
        return document.getId();
    }

    @Override
    public List<BackendHit> searchKeyword(String query, String zone, String docType, int limit) {
        List<String> terms = query == null || query.isBlank()
                ? List.of()
                : Arrays.stream(query.toLowerCase(Locale.ROOT).split("\\s+"))
                        .map(t -> t.replace("\"", ""))
                        .filter(t -> !t.isBlank())
                        .distinct()
                        .toList();

        return documents.values().stream()
                .filter(d -> zone == null || zone.equals(d.getZone()))
                .filter(d -> docType == null || docType.equals(d.getType()))
                .map(d -> new BackendHit(d.getId(), score(d, terms), d))
                .filter(hit -> terms.isEmpty() || hit.score() > 0)
                .sorted(Comparator.comparingDouble(BackendHit::score).reversed()
                        .thenComparing(BackendHit::id))
                .limit(limit)
                .toList();
    }

    private static double score(IndexedDocument document, List<String> terms) {
        if (terms.isEmpty()) {
            return 0.0;
        }
        String text = (Objects.toString(document.getLabel(), "") + " "
                + Objects.toString(document.getContent(), "")).toLowerCase(Locale.ROOT);
        long matched = terms.stream().filter(text::contains).count();
        return (double) matched / terms.size();
    }

    @Override
    public List<BackendHit> searchVector(List<Float> vector, String zone, String docType, int limit) {
        throw new UnsupportedOperationException("Vector search not supported by " + NAME);
    }

    @Override
    public List<BackendHit> searchHybrid(String text, List<Float> vector, String zone, String docType, int limit) {
        throw new UnsupportedOperationException("Hybrid search not supported by " + NAME);
    }

    @Override
    public GraphTraversal traverseGraph(String startId, int maxDepth, List<String> relationFilter, String zone) {
        throw new UnsupportedOperationException("Graph traversal not supported by " + NAME);
    }

    @Override
    public Optional<IndexedDocument> getById(String id) {
        return Optional.ofNullable(documents.get(id));
    }

    @Override
    public boolean deleteById(String id) {
        boolean removedDocument = documents.remove(id) != null;
        boolean removedEntity = entities.remove(id) != null;
        return removedDocument || removedEntity;
    }

    @Override
    public long count(String zone, String docType) {
        return documents.values().stream()
                .filter(d -> zone == null || zone.equals(d.getZone()))
                .filter(d -> docType == null || docType.equals(d.getType()))
                .count();
    }
}
