package com.purchasingpower.fanout.indexing;

import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import com.purchasingpower.fanout.backend.IndexedDocument;
import com.purchasingpower.fanout.configuration.VectorSinkProperties;
import com.purchasingpower.fanout.embedding.EmbeddingService;
import io.pinecone.clients.Index;
import io.pinecone.clients.Pinecone;
import io.pinecone.unsigned_indices_model.VectorWithUnsignedIndices;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Embeds each document (label + content) and upserts it into a Pinecone index.
 */
@Slf4j
public class VectorIndexSink implements IndexSink {

    private static final int MAX_METADATA_TEXT = 1000;

    private final Pinecone pinecone;
    private final EmbeddingService embeddingService;
    private final VectorSinkProperties properties;
    private volatile Index index;

    public VectorIndexSink(Pinecone pinecone, EmbeddingService embeddingService, VectorSinkProperties properties) {
        this.pinecone = pinecone;
        this.embeddingService = embeddingService;
        this.properties = properties;
    }

    @Override
    public String name() {
        return "vector";
    }

    @Override
    public void indexBatch(List<IndexedDocument> documents) {
        if (documents.isEmpty()) {
            return;
        }
        List<String> texts = documents.stream()
                .map(d -> d.getLabel() + "\n" + d.getContent())
                .toList();
        List<List<Float>> embeddings = embeddingService.embedAll(texts);
        if (embeddings.size() != documents.size()) {
            throw new IndexSinkException(String.format("Embedding count mismatch: expected %d, got %d",
                    documents.size(), embeddings.size()));
        }

        List<VectorWithUnsignedIndices> vectors = new ArrayList<>();
        for (int i = 0; i < documents.size(); i++) {
            vectors.add(createVector(documents.get(i), embeddings.get(i)));
        }

        int batchSize = properties.getUpsertBatchSize();
        for (int i = 0; i < vectors.size(); i += batchSize) {
            int end = Math.min(i + batchSize, vectors.size());
            index().upsert(vectors.subList(i, end), properties.getNamespace());
        }
        log.debug("Upserted {} vectors to Pinecone index '{}'", vectors.size(), properties.getIndexName());
    }

    private VectorWithUnsignedIndices createVector(IndexedDocument document, List<Float> embedding) {
        Struct.Builder metadata = Struct.newBuilder();
        putString(metadata, "url", document.getUrls().isEmpty() ? "" : document.getUrls().get(0));
        putString(metadata, "title", document.getLabel());
        putString(metadata, "snippet", truncate(document.getContent()));
        putString(metadata, "zone", document.getZone());
        Map<String, Object> docMetadata = document.getMetadata();
        putString(metadata, "query", String.valueOf(docMetadata.getOrDefault("search_query", "")));
        putString(metadata, "category", String.valueOf(docMetadata.getOrDefault("category", "")));
        putString(metadata, "engines", String.valueOf(docMetadata.getOrDefault("search_engines", "")));

        return new VectorWithUnsignedIndices(document.getId(), embedding, metadata.build(), null);
    }

    private Index index() {
        Index current = index;
        if (current == null) {
            synchronized (this) {
                if (index == null) {
                    index = pinecone.getIndexConnection(properties.getIndexName());
                }
                current = index;
            }
        }
        return current;
    }

    private static void putString(Struct.Builder builder, String key, String value) {
        if (value != null) {
            builder.putFields(key, Value.newBuilder().setStringValue(value).build());
        }
    }

    private static String truncate(String text) {
        if (text == null) {
            return null;
        }
        return text.length() > MAX_METADATA_TEXT ? text.substring(0, MAX_METADATA_TEXT) : text;
    }
}
