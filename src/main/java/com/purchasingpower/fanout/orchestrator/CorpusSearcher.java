package com.purchasingpower.fanout.orchestrator;

import com.purchasingpower.fanout.backend.BackendHit;
import com.purchasingpower.fanout.backend.IndexedDocument;
import com.purchasingpower.fanout.backend.UnifiedBackendRouter;
import com.purchasingpower.fanout.model.RawResult;
import com.purchasingpower.fanout.query.CorpusFilter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Searches previously indexed documents through the backend router.
 *
 * <p>Never fails a run: any backend error yields an empty result list.
 */
@Slf4j
public class CorpusSearcher {

    public static final String SOURCE_CODE = "CORPUS";
    static final int MAX_SNIPPET_LENGTH = 300;

    private final UnifiedBackendRouter router;
    private final String zone;
    private final int limit;

    public CorpusSearcher(UnifiedBackendRouter router, String zone, int limit) {
        this.router = router;
        this.zone = zone;
        this.limit = limit;
    }

    public List<RawResult> search(PreparedQuery query) {
        List<BackendHit> hits;
        try {
            hits = router.searchKeyword(query.getConcreteQuery(), zone, null, limit).value();
        } catch (RuntimeException e) {
            log.warn("⚠️ Corpus search failed for '{}': {}", query.getConcreteQuery(), e.getMessage());
            return List.of();
        }

        CorpusFilter filter = query.getCorpusFilter();
        List<RawResult> results = new ArrayList<>();
        for (BackendHit hit : hits) {
            IndexedDocument document = hit.document();
            if (document == null || document.getUrls().isEmpty()) {
                continue;
            }
            String url = document.getUrls().get(0);
            if (filter != null && !filter.isEmpty() && !filter.accepts(UrlNormalizer.domainOf(url))) {
                continue;
            }
            results.add(RawResult.builder()
                    .url(url)
                    .title(document.getLabel())
                    .snippet(truncate(document.getContent()))
                    .metadataEntry("corpus_id", hit.id())
                    .metadataEntry("corpus_score", hit.score())
                    .build());
        }
        log.info("Corpus returned {} of {} hits for '{}'", results.size(), hits.size(), query.getConcreteQuery());
        return results;
    }

    private static String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= MAX_SNIPPET_LENGTH ? text : text.substring(0, MAX_SNIPPET_LENGTH);
    }
}
