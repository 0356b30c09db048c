package com.purchasingpower.fanout.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.fanout.configuration.Neo4jProperties;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Record;
import org.neo4j.driver.Result;
import org.neo4j.driver.Session;
import org.neo4j.driver.Value;
import org.neo4j.driver.types.Node;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Primary backend on Neo4j.
 *
 * <p>Documents are {@code :SearchDocument} nodes, graph entities are {@code :Entity} nodes joined by
 * {@code :RELATED} relationships carrying a {@code type} property. Metadata maps are stored as JSON
 * strings since Neo4j properties cannot hold nested maps. Keyword scoring is the fraction of query
 * terms found in label plus content.
 *
 * @since 1.0.0
 */
@Slf4j
public class Neo4jSearchBackend implements SearchBackend {

    static final String NAME = "neo4j";
    private static final String VECTOR_INDEX = "search_document_embedding";
    private static final int MAX_TRAVERSAL_DEPTH = 5;

    private final Neo4jProperties properties;
    private final ObjectMapper objectMapper;
    private volatile Driver driver;

    public Neo4jSearchBackend(Neo4jProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void initialize() {
        log.info("Initializing Neo4j backend at: {}", properties.getUri());
        Driver candidate = GraphDatabase.driver(properties.getUri(),
                AuthTokens.basic(properties.getUsername(), properties.getPassword()));
        try {
            candidate.verifyConnectivity();
            createSchema(candidate);
        } catch (RuntimeException e) {
            candidate.close();
            throw e;
        }
        Driver previous = driver;
        driver = candidate;
        if (previous != null) {
            previous.close();
        }
    }

    private void createSchema(Driver target) {
        try (Session session = target.session()) {
            session.run("CREATE CONSTRAINT search_document_id IF NOT EXISTS FOR (d:SearchDocument) REQUIRE d.id IS UNIQUE");
            session.run("CREATE CONSTRAINT entity_id IF NOT EXISTS FOR (e:Entity) REQUIRE e.id IS UNIQUE");
            session.run("CREATE INDEX search_document_zone IF NOT EXISTS FOR (d:SearchDocument) ON (d.zone)");
            session.run("CREATE INDEX search_document_type IF NOT EXISTS FOR (d:SearchDocument) ON (d.type)");
            log.info("✅ Neo4j constraints and indexes created");

            try {
                session.run(String.format("""
                        CREATE VECTOR INDEX %s IF NOT EXISTS
                        FOR (d:SearchDocument) ON (d.embedding)
                        OPTIONS {indexConfig: {
                          `vector.dimensions`: %d,
                          `vector.similarity_function`: 'cosine'
                        }}
                        """, VECTOR_INDEX, properties.getVectorDimensions()));
            } catch (RuntimeException e) {
                log.warn("⚠️ Failed to create vector index (requires Neo4j 5.x+): {}", e.getMessage());
            }
        }
    }

    @Override
    public void close() {
        Driver current = driver;
        if (current != null) {
            current.close();
            log.info("Neo4j backend connection closed");
        }
    }

    @Override
    public Set<BackendCapability> capabilities() {
        return EnumSet.allOf(BackendCapability.class);
    }

    // ======================== WRITES ========================

    @Override
    public String indexEntity(GraphEntity entity) {
        String cypher = """
            MERGE (e:Entity {id: $id})
            SET e.type = $type,
                e.name = $name,
                e.zone = $zone,
                e.properties = $properties,
                e.updatedAt = $updatedAt
            WITH e
            UNWIND $relations AS rel
            MERGE (t:Entity {id: rel.targetId})
            MERGE (e)-[r:RELATED {type: rel.type}]->(t)
            """;

        List<Map<String, Object>> relations = new ArrayList<>();
        for (GraphEntity.Relation relation : entity.getRelations()) {
            relations.add(Map.of("type", relation.type(), "targetId", relation.targetId()));
        }

        try (Session session = session()) {
            session.executeWrite(tx -> {
                tx.run(cypher, createParams(
                        "id", entity.getId(),
                        "type", entity.getType(),
                        "name", entity.getName(),
                        "zone", entity.getZone(),
                        "properties", toJson(entity.getProperties()),
                        "updatedAt", Instant.now().toString(),
                        "relations", relations
                )).consume();
                return null;
            });
        }
        return entity.getId();
    }

    @Override
    public String indexDocument(IndexedDocument document) {
        String cypher = """
            MERGE (d:SearchDocument {id: $id})
            ON CREATE SET d.createdAt = $createdAt
            SET d.label = $label,
                d.content = $content,
                d.className = $className,
                d.type = $type,
                d.zone = $zone,
                d.userId = $userId,
                d.projectId = $projectId,
                d.urls = $urls,
                d.domains = $domains,
                d.tags = $tags,
                d.metadata = $metadata,
                d.updatedAt = $updatedAt,
                d.lastSeen = $lastSeen,
                d.timestamp = $timestamp,
                d.indexedAt = $indexedAt
            FOREACH (_ IN CASE WHEN $embedding IS NULL THEN [] ELSE [1] END |
                SET d.embedding = $embedding)
            """;

        try (Session session = session()) {
            session.executeWrite(tx -> {
                tx.run(cypher, createParams(
                        "id", document.getId(),
                        "label", document.getLabel(),
                        "content", document.getContent(),
                        "className", document.getClassName(),
                        "type", document.getType(),
                        "zone", document.getZone(),
                        "userId", document.getUserId(),
                        "projectId", document.getProjectId(),
                        "urls", document.getUrls(),
                        "domains", document.getDomains(),
                        "tags", document.getTags(),
                        "metadata", toJson(document.getMetadata()),
                        "createdAt", isoOrNow(document.getCreatedAt()),
                        "updatedAt", isoOrNow(document.getUpdatedAt()),
                        "lastSeen", iso(document.getLastSeen()),
                        "timestamp", iso(document.getTimestamp()),
                        "indexedAt", iso(document.getIndexedAt()),
                        "embedding", document.getEmbedding()
                )).consume();
                return null;
            });
        }
        return document.getId();
    }

    // ======================== SEARCH ========================

    @Override
    public List<BackendHit> searchKeyword(String query, String zone, String docType, int limit) {
        String cypher = """
            MATCH (d:SearchDocument)
            WHERE ($zone IS NULL OR d.zone = $zone)
              AND ($docType IS NULL OR d.type = $docType)
            WITH d, toLower(coalesce(d.label, '') + ' ' + coalesce(d.content, '')) AS text
            WITH d, size([t IN $terms WHERE text CONTAINS t]) AS matched
            WHERE size($terms) = 0 OR matched > 0
            RETURN d, CASE WHEN size($terms) = 0 THEN 0.0 ELSE toFloat(matched) / size($terms) END AS score
            ORDER BY score DESC, d.updatedAt DESC
            LIMIT $limit
            """;

        try (Session session = session()) {
            return session.executeRead(tx -> {
                Result result = tx.run(cypher, createParams(
                        "zone", zone,
                        "docType", docType,
                        "terms", terms(query),
                        "limit", limit
                ));
                return toHits(result);
            });
        }
    }

    @Override
    public List<BackendHit> searchVector(List<Float> vector, String zone, String docType, int limit) {
        String cypher = """
            CALL db.index.vector.queryNodes($index, $candidates, $vector)
            YIELD node AS d, score
            WHERE ($zone IS NULL OR d.zone = $zone)
              AND ($docType IS NULL OR d.type = $docType)
            RETURN d, score
            ORDER BY score DESC
            LIMIT $limit
            """;

        try (Session session = session()) {
            return session.executeRead(tx -> {
                Result result = tx.run(cypher, createParams(
                        "index", VECTOR_INDEX,
                        "candidates", limit * 3,
                        "vector", vector,
                        "zone", zone,
                        "docType", docType,
                        "limit", limit
                ));
                return toHits(result);
            });
        }
    }

    /**
     * Equal-weight blend of keyword and vector scores, merged by document id.
     */
    @Override
    public List<BackendHit> searchHybrid(String text, List<Float> vector, String zone, String docType, int limit) {
        Map<String, BackendHit> keyword = byId(searchKeyword(text, zone, docType, limit * 2));
        Map<String, BackendHit> semantic = vector == null || vector.isEmpty()
                ? Map.of()
                : byId(searchVector(vector, zone, docType, limit * 2));

        Map<String, BackendHit> merged = new LinkedHashMap<>();
        for (String id : union(keyword.keySet(), semantic.keySet())) {
            BackendHit k = keyword.get(id);
            BackendHit v = semantic.get(id);
            double score = 0.5 * (k == null ? 0 : k.score()) + 0.5 * (v == null ? 0 : v.score());
            IndexedDocument document = k != null ? k.document() : v.document();
            merged.put(id, new BackendHit(id, score, document));
        }
        return merged.values().stream()
                .sorted((a, b) -> Double.compare(b.score(), a.score()))
                .limit(limit)
                .toList();
    }

    // ======================== GRAPH ========================

    @Override
    public GraphTraversal traverseGraph(String startId, int maxDepth, List<String> relationFilter, String zone) {
        int depth = Math.max(1, Math.min(MAX_TRAVERSAL_DEPTH, maxDepth));
        // variable-length bounds cannot be parameterized
        String cypher = String.format("""
            MATCH path = (s:Entity {id: $id})-[rels:RELATED*1..%d]-(n:Entity)
            WHERE ($zone IS NULL OR n.zone = $zone)
              AND ($filter IS NULL OR all(r IN rels WHERE r.type IN $filter))
            UNWIND relationships(path) AS r
            WITH DISTINCT n, r
            RETURN n.id AS id, n.type AS type, n.name AS name,
                   startNode(r).id AS source, endNode(r).id AS target, r.type AS relType
            """, depth);

        try (Session session = session()) {
            return session.executeRead(tx -> {
                Result result = tx.run(cypher, createParams(
                        "id", startId,
                        "zone", zone,
                        "filter", relationFilter == null || relationFilter.isEmpty() ? null : relationFilter
                ));
                Map<String, GraphTraversal.Node> nodes = new LinkedHashMap<>();
                Map<String, GraphTraversal.Edge> edges = new LinkedHashMap<>();
                while (result.hasNext()) {
                    Record record = result.next();
                    String id = record.get("id").asString();
                    nodes.putIfAbsent(id, new GraphTraversal.Node(id,
                            stringOrNull(record.get("type")), stringOrNull(record.get("name"))));
                    GraphTraversal.Edge edge = new GraphTraversal.Edge(record.get("source").asString(),
                            record.get("target").asString(), stringOrNull(record.get("relType")));
                    edges.putIfAbsent(edge.source() + "|" + edge.type() + "|" + edge.target(), edge);
                }
                return new GraphTraversal(startId, depth, new ArrayList<>(nodes.values()),
                        new ArrayList<>(edges.values()), false);
            });
        }
    }

    // ======================== UTILITY ========================

    @Override
    public Optional<IndexedDocument> getById(String id) {
        String cypher = "MATCH (d:SearchDocument {id: $id}) RETURN d";

        try (Session session = session()) {
            return session.executeRead(tx -> {
                Result result = tx.run(cypher, Collections.singletonMap("id", id));
                if (result.hasNext()) {
                    return Optional.of(nodeToDocument(result.single().get("d").asNode()));
                }
                return Optional.empty();
            });
        }
    }

    @Override
    public boolean deleteById(String id) {
        String cypher = """
            MATCH (d)
            WHERE (d:SearchDocument OR d:Entity) AND d.id = $id
            DETACH DELETE d
            RETURN count(*) AS deleted
            """;

        try (Session session = session()) {
            return session.executeWrite(tx ->
                    tx.run(cypher, Collections.singletonMap("id", id)).single().get("deleted").asLong() > 0);
        }
    }

    @Override
    public long count(String zone, String docType) {
        String cypher = """
            MATCH (d:SearchDocument)
            WHERE ($zone IS NULL OR d.zone = $zone)
              AND ($docType IS NULL OR d.type = $docType)
            RETURN count(d) AS total
            """;

        try (Session session = session()) {
            return session.executeRead(tx ->
                    tx.run(cypher, createParams("zone", zone, "docType", docType))
                            .single().get("total").asLong());
        }
    }

    // ======================== MAPPING ========================

    private Session session() {
        Driver current = driver;
        if (current == null) {
            throw new BackendUnavailableException("Neo4j backend is not initialized");
        }
        return current.session();
    }

    private List<BackendHit> toHits(Result result) {
        List<BackendHit> hits = new ArrayList<>();
        while (result.hasNext()) {
            Record record = result.next();
            IndexedDocument document = nodeToDocument(record.get("d").asNode());
            hits.add(new BackendHit(document.getId(), record.get("score").asDouble(), document));
        }
        return hits;
    }

    private IndexedDocument nodeToDocument(Node node) {
        return IndexedDocument.builder()
                .id(node.get("id").asString())
                .label(stringOrNull(node.get("label")))
                .content(stringOrNull(node.get("content")))
                .className(stringOrNull(node.get("className")))
                .type(stringOrNull(node.get("type")))
                .zone(stringOrNull(node.get("zone")))
                .userId(stringOrNull(node.get("userId")))
                .projectId(stringOrNull(node.get("projectId")))
                .urls(stringList(node.get("urls")))
                .domains(stringList(node.get("domains")))
                .tags(stringList(node.get("tags")))
                .metadata(fromJson(stringOrNull(node.get("metadata"))))
                .createdAt(instant(node.get("createdAt")))
                .updatedAt(instant(node.get("updatedAt")))
                .lastSeen(instant(node.get("lastSeen")))
                .timestamp(instant(node.get("timestamp")))
                .indexedAt(instant(node.get("indexedAt")))
                .build();
    }

    private String toJson(Map<String, Object> map) {
        try {
            return objectMapper.writeValueAsString(map == null ? Map.of() : map);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Metadata is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {
            });
        } catch (JsonProcessingException e) {
            log.warn("Unreadable metadata JSON, ignoring: {}", e.getOriginalMessage());
            return Map.of();
        }
    }

    private static List<String> terms(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        return Arrays.stream(query.toLowerCase(Locale.ROOT).split("\\s+"))
                .map(t -> t.replace("\"", ""))
                .filter(t -> !t.isBlank())
                .distinct()
                .toList();
    }

    private static Map<String, BackendHit> byId(List<BackendHit> hits) {
        Map<String, BackendHit> map = new LinkedHashMap<>();
        hits.forEach(h -> map.putIfAbsent(h.id(), h));
        return map;
    }

    private static List<String> union(Set<String> a, Set<String> b) {
        List<String> all = new ArrayList<>(a);
        b.stream().filter(id -> !a.contains(id)).forEach(all::add);
        return all;
    }

    private static String stringOrNull(Value value) {
        return value == null || value.isNull() ? null : value.asString();
    }

    private static List<String> stringList(Value value) {
        return value == null || value.isNull() ? List.of() : value.asList(Value::asString);
    }

    private static Instant instant(Value value) {
        String text = stringOrNull(value);
        return text == null ? null : Instant.parse(text);
    }

    private static String iso(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    private static String isoOrNow(Instant instant) {
        return (instant == null ? Instant.now() : instant).toString();
    }

    private static Map<String, Object> createParams(Object... keyValues) {
        Map<String, Object> params = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            params.put((String) keyValues[i], keyValues[i + 1]);
        }
        return params;
    }
}
