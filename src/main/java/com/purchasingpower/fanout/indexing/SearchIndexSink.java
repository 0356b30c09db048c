package com.purchasingpower.fanout.indexing;

import com.purchasingpower.fanout.backend.IndexedDocument;
import com.purchasingpower.fanout.backend.UnifiedBackendRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Writes documents through the unified backend router, which handles failover and mirroring.
 * Every document is attempted; failures are reported together once the batch is done.
 */
@Slf4j
@RequiredArgsConstructor
public class SearchIndexSink implements IndexSink {

    private final UnifiedBackendRouter router;

    @Override
    public String name() {
        return "search-index";
    }

    @Override
    public void indexBatch(List<IndexedDocument> documents) {
        int failed = 0;
        RuntimeException firstError = null;
        for (IndexedDocument document : documents) {
            try {
                router.indexDocument(document);
            } catch (RuntimeException e) {
                failed++;
                if (firstError == null) {
                    firstError = e;
                }
            }
        }
        if (failed > 0) {
            throw new IndexSinkException(String.format("%d of %d documents failed: %s",
                    failed, documents.size(), firstError.getMessage()), firstError);
        }
        log.debug("Indexed {} docs to {}", documents.size(), router.activeBackendName());
    }
}
