package com.purchasingpower.fanout.backend;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A document as stored by a search backend.
 *
 * <p>{@code className} groups documents by origin (e.g. {@code source}); {@code type} is the
 * finer document kind (e.g. {@code search_result}).
 */
@Value
@Builder(toBuilder = true)
public class IndexedDocument {

    String id;
    String label;
    String content;
    String className;
    String type;
    String zone;
    String userId;
    String projectId;

    @Singular
    List<String> urls;

    @Singular
    List<String> domains;

    @Singular
    List<String> tags;

    @Singular("metadataEntry")
    Map<String, Object> metadata;

    /** Optional dense vector; only backends with vector capability use it. */
    List<Float> embedding;

    Instant createdAt;
    Instant updatedAt;
    Instant lastSeen;
    Instant timestamp;
    Instant indexedAt;
}
