package com.purchasingpower.fanout.indexing;

import com.purchasingpower.fanout.backend.IndexedDocument;

import java.util.List;

/**
 * Destination for flushed result batches. Each sink is written independently; a sink that
 * throws does not affect the others.
 */
public interface IndexSink {

    String name();

    void indexBatch(List<IndexedDocument> documents);
}
