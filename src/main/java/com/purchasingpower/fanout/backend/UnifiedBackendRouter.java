package com.purchasingpower.fanout.backend;

import com.google.common.base.Preconditions;
import com.purchasingpower.fanout.configuration.BackendProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Routes storage calls to a primary or secondary backend with automatic failover.
 *
 * <p>Every call goes to the active backend first. On failure it is retried once on the other
 * backend (if that one is available) and the result is flagged as a fallback. Successful writes
 * are mirrored best-effort to the non-serving backend when dual indexing is enabled.
 *
 * <p>Availability flags and the active pointer change only under {@code stateLock}, so failover
 * decisions, manual switches and health probes never interleave. Exactly one backend is active
 * at any time.
 *
 * @since 1.0.0
 */
@Slf4j
public class UnifiedBackendRouter implements AutoCloseable {

    private final Map<BackendRole, SearchBackend> backends = new EnumMap<>(BackendRole.class);
    private final Map<BackendRole, BackendHealth> health = new EnumMap<>(BackendRole.class);
    private final BackendProperties properties;
    private final Executor writeExecutor;

    private final Object stateLock = new Object();
    private BackendRole active;
    private boolean pinned;

    private final AtomicLong fallbacks = new AtomicLong();
    private final AtomicLong dualIndexed = new AtomicLong();

    /**
     * Initializes both backends.
     *
     * @throws BackendUnavailableException if neither backend initializes
     */
    public UnifiedBackendRouter(SearchBackend primary, SearchBackend secondary,
                                BackendProperties properties, Executor writeExecutor) {
        Preconditions.checkNotNull(primary, "Primary backend cannot be null");
        Preconditions.checkNotNull(secondary, "Secondary backend cannot be null");
        this.properties = properties;
        this.writeExecutor = writeExecutor;

        backends.put(BackendRole.PRIMARY, primary);
        backends.put(BackendRole.SECONDARY, secondary);

        RuntimeException primaryError = initialize(BackendRole.PRIMARY, primary);
        RuntimeException secondaryError = initialize(BackendRole.SECONDARY, secondary);

        if (primaryError != null && secondaryError != null) {
            BackendUnavailableException fatal = new BackendUnavailableException(String.format(
                    "No backend available. %s: %s, %s: %s",
                    primary.name(), primaryError.getMessage(), secondary.name(), secondaryError.getMessage()),
                    primaryError);
            fatal.addSuppressed(secondaryError);
            throw fatal;
        }

        BackendRole preferred = preferredRole();
        this.active = health.get(preferred).isAvailable() ? preferred : preferred.other();

        log.info("Backend router ready: primary={} ({}), secondary={} ({}), active={}, dualIndexing={}",
                primary.name(), availability(BackendRole.PRIMARY),
                secondary.name(), availability(BackendRole.SECONDARY),
                backends.get(active).name(), properties.isDualIndexing());
    }

    private RuntimeException initialize(BackendRole role, SearchBackend backend) {
        try {
            backend.initialize();
            health.put(role, new BackendHealth(role, backend.name(), true));
            return null;
        } catch (RuntimeException e) {
            log.warn("⚠️ {} backend {} failed to initialize: {}", role, backend.name(), e.getMessage());
            health.put(role, new BackendHealth(role, backend.name(), false));
            return e;
        }
    }

    // ======================== ROUTING CORE ========================

    /**
     * Runs {@code call} on the active backend, retrying once on the other backend if it fails.
     *
     * @throws BackendOperationException  when both backends fail
     * @throws BackendUnavailableException when no backend is available
     * @throws RuntimeException           the original failure when no fallback backend is available
     */
    public <T> BackendResult<T> executeWithFallback(BackendOperation operation, BackendCall<T> call) {
        BackendRole role = selectBackend();
        SearchBackend backend = backends.get(role);

        T value;
        try {
            value = call.apply(backend);
            health.get(role).recordCall();
        } catch (RuntimeException e) {
            health.get(role).recordFailure();
            log.warn("⚠️ {} failed for {}: {}", backend.name(), operation, e.getMessage());
            return fallback(operation, call, role, e);
        }

        if (operation.isWrite() && properties.isDualIndexing()) {
            mirrorWrite(operation, call, role);
        }
        return new BackendResult<>(value, backend.name(), role, false);
    }

    private <T> BackendResult<T> fallback(BackendOperation operation, BackendCall<T> call,
                                          BackendRole failedRole, RuntimeException cause) {
        BackendRole other = failedRole.other();
        if (!health.get(other).isAvailable()) {
            throw cause;
        }

        SearchBackend fallbackBackend = backends.get(other);
        fallbacks.incrementAndGet();
        log.info("🔄 Falling back to {} for {}", fallbackBackend.name(), operation);
        try {
            T value = call.apply(fallbackBackend);
            health.get(other).recordCall();
            return new BackendResult<>(value, fallbackBackend.name(), other, true);
        } catch (RuntimeException fallbackError) {
            health.get(other).recordFailure();
            BackendOperationException aggregated = new BackendOperationException(operation,
                    backends.get(failedRole).name(), cause, fallbackBackend.name(), fallbackError);
            log.error("❌ {}", aggregated.getMessage());
            throw aggregated;
        }
    }

    private <T> void mirrorWrite(BackendOperation operation, BackendCall<T> call, BackendRole servedBy) {
        BackendRole mirror = servedBy.other();
        if (!health.get(mirror).isAvailable()) {
            return;
        }
        try {
            call.apply(backends.get(mirror));
            dualIndexed.incrementAndGet();
        } catch (RuntimeException e) {
            log.warn("⚠️ Dual indexing of {} to {} failed (non-critical): {}",
                    operation, backends.get(mirror).name(), e.getMessage());
        }
    }

    private BackendRole selectBackend() {
        synchronized (stateLock) {
            if (health.get(active).isAvailable()) {
                return active;
            }
            BackendRole other = active.other();
            if (health.get(other).isAvailable()) {
                log.warn("Active backend {} unavailable, switching to {}",
                        backends.get(active).name(), backends.get(other).name());
                active = other;
                return active;
            }
        }
        throw new BackendUnavailableException("No backend available");
    }

    // ======================== OPERATIONS ========================

    public BackendResult<String> indexEntity(GraphEntity entity) {
        Preconditions.checkNotNull(entity, "Entity cannot be null");
        GraphEntity zoned = entity.getZone() != null ? entity : GraphEntity.builder()
                .id(entity.getId())
                .type(entity.getType())
                .name(entity.getName())
                .zone(properties.getDefaultZone())
                .properties(entity.getProperties())
                .relations(entity.getRelations())
                .build();
        return executeWithFallback(BackendOperation.INDEX_ENTITY, b -> b.indexEntity(zoned));
    }

    public BackendResult<String> indexDocument(IndexedDocument document) {
        Preconditions.checkNotNull(document, "Document cannot be null");
        IndexedDocument zoned = document.getZone() != null
                ? document
                : document.toBuilder().zone(properties.getDefaultZone()).build();
        return executeWithFallback(BackendOperation.INDEX_DOCUMENT, b -> b.indexDocument(zoned));
    }

    public BackendResult<List<BackendHit>> searchKeyword(String query, String zone, String docType, int limit) {
        return executeWithFallback(BackendOperation.SEARCH_KEYWORD,
                b -> b.searchKeyword(query, zone, docType, limit));
    }

    /**
     * Vector search; backends without vector support answer with an unfiltered keyword search.
     */
    public BackendResult<List<BackendHit>> searchVector(List<Float> vector, String zone, String docType, int limit) {
        return executeWithFallback(BackendOperation.SEARCH_VECTOR, b -> {
            if (b.capabilities().contains(BackendCapability.VECTOR)) {
                return b.searchVector(vector, zone, docType, limit);
            }
            log.warn("⚠️ Vector search not available in {}, using keyword search", b.name());
            return b.searchKeyword("", zone, docType, limit);
        });
    }

    /**
     * Hybrid search; backends without hybrid support answer with keyword search on the text.
     */
    public BackendResult<List<BackendHit>> searchHybrid(String text, List<Float> vector,
                                                         String zone, String docType, int limit) {
        return executeWithFallback(BackendOperation.SEARCH_HYBRID, b -> {
            if (b.capabilities().contains(BackendCapability.HYBRID)) {
                return b.searchHybrid(text, vector, zone, docType, limit);
            }
            log.warn("⚠️ Hybrid search not available in {}, using keyword search only", b.name());
            return b.searchKeyword(text, zone, docType, limit);
        });
    }

    /**
     * Graph traversal; backends without graph support return just the start node, if stored.
     */
    public BackendResult<GraphTraversal> traverseGraph(String startId, int maxDepth,
                                                       List<String> relationFilter, String zone) {
        return executeWithFallback(BackendOperation.TRAVERSE_GRAPH, b -> {
            if (b.capabilities().contains(BackendCapability.GRAPH)) {
                return b.traverseGraph(startId, maxDepth, relationFilter, zone);
            }
            log.warn("⚠️ Graph traversal not available in {}, returning start node only", b.name());
            return GraphTraversal.startOnly(startId, b.getById(startId).orElse(null));
        });
    }

    public BackendResult<Optional<IndexedDocument>> getById(String id) {
        return executeWithFallback(BackendOperation.GET_BY_ID, b -> b.getById(id));
    }

    public BackendResult<Boolean> deleteById(String id) {
        return executeWithFallback(BackendOperation.DELETE_BY_ID, b -> b.deleteById(id));
    }

    public BackendResult<Long> count(String zone, String docType) {
        return executeWithFallback(BackendOperation.COUNT, b -> b.count(zone, docType));
    }

    // ======================== PARALLEL DUAL WRITE ========================

    /**
     * Writes one document to both backends concurrently. Timestamps and tags are normalized once
     * before dispatch; each backend succeeds or fails independently.
     *
     * @param tags extra tags, prefixed with {@code #} when missing and merged with existing ones
     * @throws BackendUnavailableException if neither backend is available
     */
    public DualWriteResult indexDocumentDualParallel(IndexedDocument document, String zone, List<String> tags) {
        Preconditions.checkNotNull(document, "Document cannot be null");
        IndexedDocument prepared = prepareForDualWrite(document, zone, tags);

        Map<BackendRole, CompletableFuture<String>> writes = new EnumMap<>(BackendRole.class);
        for (BackendRole role : BackendRole.values()) {
            if (health.get(role).isAvailable()) {
                SearchBackend backend = backends.get(role);
                writes.put(role, CompletableFuture.supplyAsync(() -> backend.indexDocument(prepared), writeExecutor));
            }
        }
        if (writes.isEmpty()) {
            throw new BackendUnavailableException("No backends available for indexing");
        }

        Map<BackendRole, String> ids = new EnumMap<>(BackendRole.class);
        List<String> errors = new ArrayList<>();
        writes.forEach((role, future) -> {
            SearchBackend backend = backends.get(role);
            try {
                String id = future.join();
                ids.put(role, id);
                health.get(role).recordCall();
                log.debug("✅ {} indexed {}", backend.name(), id);
            } catch (RuntimeException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                health.get(role).recordFailure();
                errors.add(backend.name() + " indexing failed: " + cause.getMessage());
                log.warn("❌ {} indexing failed: {}", backend.name(), cause.getMessage());
            }
        });

        if (ids.size() == 2) {
            dualIndexed.incrementAndGet();
        }

        BackendRole canonical = ids.containsKey(BackendRole.PRIMARY) ? BackendRole.PRIMARY
                : ids.containsKey(BackendRole.SECONDARY) ? BackendRole.SECONDARY : null;

        return DualWriteResult.builder()
                .primaryId(ids.get(BackendRole.PRIMARY))
                .secondaryId(ids.get(BackendRole.SECONDARY))
                .success(canonical != null)
                .canonicalRole(canonical)
                .canonicalBackend(canonical == null ? null : backends.get(canonical).name())
                .canonicalId(canonical == null ? null : ids.get(canonical))
                .errors(errors)
                .build();
    }

    private IndexedDocument prepareForDualWrite(IndexedDocument document, String zone, List<String> tags) {
        Instant now = Instant.now();
        IndexedDocument.IndexedDocumentBuilder builder = document.toBuilder()
                .zone(zone != null ? zone : properties.getDefaultZone());
        if (document.getTimestamp() == null) {
            builder.timestamp(now);
        }
        if (document.getIndexedAt() == null) {
            builder.indexedAt(now);
        }
        if (tags != null && !tags.isEmpty()) {
            Set<String> merged = new LinkedHashSet<>(document.getTags());
            for (String tag : tags) {
                merged.add(tag.startsWith("#") ? tag : "#" + tag);
            }
            builder.clearTags().tags(merged);
        }
        return builder.build();
    }

    // ======================== HEALTH & STATS ========================

    /**
     * Probes every backend with a cheap count. A failing backend is demoted; a previously demoted
     * backend that answers again is re-initialized if needed and restored.
     */
    public BackendHealthReport healthCheck() {
        Map<String, BackendHealthReport.BackendStatus> statuses = new LinkedHashMap<>();

        for (BackendRole role : BackendRole.values()) {
            SearchBackend backend = backends.get(role);
            BackendHealth state = health.get(role);
            boolean wasAvailable = state.isAvailable();
            String status;
            boolean healthy;
            try {
                if (!wasAvailable) {
                    backend.initialize();
                }
                backend.count(null, null);
                healthy = true;
                status = wasAvailable ? "healthy" : "recovered";
            } catch (RuntimeException e) {
                healthy = false;
                status = wasAvailable ? "unhealthy: " + e.getMessage() : "unavailable";
            }

            synchronized (stateLock) {
                state.setAvailable(healthy);
                if (!healthy && wasAvailable) {
                    log.warn("⚠️ Backend {} demoted: {}", backend.name(), status);
                } else if (healthy && !wasAvailable) {
                    log.info("✅ Backend {} recovered", backend.name());
                }
                rebalance();
            }
            statuses.put(backend.name(), new BackendHealthReport.BackendStatus(role, healthy, status));
        }
        return new BackendHealthReport(statuses, activeBackendName());
    }

    // caller holds stateLock
    private void rebalance() {
        BackendRole preferred = preferredRole();
        if (!health.get(active).isAvailable() && health.get(active.other()).isAvailable()) {
            active = active.other();
            pinned = false;
        } else if (!pinned && active != preferred && health.get(preferred).isAvailable()) {
            active = preferred;
        }
    }

    public BackendStats getStats() {
        Map<String, BackendStats.BackendCounters> counters = new LinkedHashMap<>();
        long totalCalls = 0;
        for (BackendRole role : BackendRole.values()) {
            BackendHealth state = health.get(role);
            counters.put(state.getName(), new BackendStats.BackendCounters(
                    state.getRole(), state.isAvailable(), state.getCalls(), state.getFailures()));
            totalCalls += state.getCalls();
        }
        long fallbackCount = fallbacks.get();
        return BackendStats.builder()
                .backends(counters)
                .fallbacks(fallbackCount)
                .dualIndexed(dualIndexed.get())
                .activeBackend(activeBackendName())
                .fallbackRate(fallbackCount > 0 ? (double) fallbackCount / Math.max(1, totalCalls) * 100 : 0.0)
                .build();
    }

    /**
     * Manually makes the named backend active. The choice sticks until the backend becomes unavailable.
     *
     * @param backend backend name or role ({@code primary} / {@code secondary})
     * @throws IllegalArgumentException if the backend is unknown or unavailable
     */
    public void switchBackend(String backend) {
        Preconditions.checkNotNull(backend, "Backend cannot be null");
        BackendRole target = null;
        for (BackendRole role : BackendRole.values()) {
            if (role.name().equalsIgnoreCase(backend) || backends.get(role).name().equalsIgnoreCase(backend)) {
                target = role;
            }
        }
        synchronized (stateLock) {
            if (target == null || !health.get(target).isAvailable()) {
                throw new IllegalArgumentException("Backend " + backend + " is not available");
            }
            active = target;
            pinned = true;
        }
        log.info("✅ Switched to {}", backends.get(target).name());
    }

    public String activeBackendName() {
        synchronized (stateLock) {
            return backends.get(active).name();
        }
    }

    public boolean isAvailable(BackendRole role) {
        return health.get(role).isAvailable();
    }

    public long getFallbackCount() {
        return fallbacks.get();
    }

    public long getDualIndexedCount() {
        return dualIndexed.get();
    }

    private BackendRole preferredRole() {
        return properties.isPreferPrimary() ? BackendRole.PRIMARY : BackendRole.SECONDARY;
    }

    private String availability(BackendRole role) {
        return health.get(role).isAvailable() ? "✓" : "✗";
    }

    @Override
    public void close() {
        for (SearchBackend backend : backends.values()) {
            try {
                backend.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close backend {}: {}", backend.name(), e.getMessage());
            }
        }
    }
}
