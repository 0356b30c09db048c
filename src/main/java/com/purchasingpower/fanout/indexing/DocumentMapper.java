package com.purchasingpower.fanout.indexing;

import com.google.common.hash.Hashing;
import com.purchasingpower.fanout.backend.IndexedDocument;
import com.purchasingpower.fanout.model.SearchResult;
import com.purchasingpower.fanout.query.ResultCategorizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps accepted search results to source documents.
 *
 * <p>Ids are {@code search_<sha256(url)>} so re-sightings across runs update the same document.
 */
@Slf4j
@Component
public class DocumentMapper {

    static final int MAX_LABEL_LENGTH = 200;
    static final String CLASS_NAME = "source";
    static final String TYPE = "search_result";

    private final Clock clock;

    public DocumentMapper() {
        this(Clock.systemUTC());
    }

    DocumentMapper(Clock clock) {
        this.clock = clock;
    }

    public IndexedDocument map(SearchResult result, IndexContext context) {
        String url = result.getUrl();
        Instant now = clock.instant();

        String label = result.getTitle() == null || result.getTitle().isBlank() ? url : result.getTitle();
        if (label.length() > MAX_LABEL_LENGTH) {
            label = label.substring(0, MAX_LABEL_LENGTH);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("search_query", context.query());
        metadata.put("search_engines", new ArrayList<>(result.getFoundBy()));
        metadata.put("category", result.getCategory() == null ? ResultCategorizer.UNCATEGORIZED : result.getCategory());
        metadata.put("found_at", now.toString());
        metadata.put("quality_score", result.getQualityScore());

        return IndexedDocument.builder()
                .id(documentId(url))
                .label(label)
                .content(result.getSnippet() == null ? "" : result.getSnippet())
                .className(CLASS_NAME)
                .type(TYPE)
                .zone(context.zone())
                .userId(context.userId())
                .projectId(context.projectId())
                .url(url)
                .domains(domainsOf(url))
                .metadata(metadata)
                .createdAt(now)
                .updatedAt(now)
                .lastSeen(now)
                .build();
    }

    public static String documentId(String url) {
        return "search_" + Hashing.sha256().hashString(url, StandardCharsets.UTF_8);
    }

    private static List<String> domainsOf(String url) {
        try {
            String host = URI.create(url).getHost();
            return host == null ? List.of() : List.of(host);
        } catch (IllegalArgumentException e) {
            log.debug("No domain for unparseable url {}", url);
            return List.of();
        }
    }
}
