package com.purchasingpower.fanout.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A deduplicated search hit, keyed by its normalized URL.
 *
 * <p>Instances are mutated on every later sighting of the same URL and are not thread-safe;
 * the owning ledger serializes access. Anything leaving the ledger should be a {@link #copy()}.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResult {

    private String url;
    private String title;
    private String snippet;

    /** Source codes in the order they first reported this URL. */
    @Builder.Default
    private Set<String> foundBy = new LinkedHashSet<>();

    private int qualityScore;
    private String category;
    private Instant firstSeenAt;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    /**
     * @return true if the source was not already recorded
     */
    public boolean addSource(String sourceCode) {
        return foundBy.add(sourceCode);
    }

    /**
     * Replaces the snippet only when the candidate is strictly longer.
     */
    public boolean replaceSnippetIfLonger(String candidate) {
        if (candidate == null) {
            return false;
        }
        int current = snippet == null ? 0 : snippet.length();
        if (candidate.length() > current) {
            snippet = candidate;
            return true;
        }
        return false;
    }

    public SearchResult copy() {
        return SearchResult.builder()
                .url(url)
                .title(title)
                .snippet(snippet)
                .foundBy(new LinkedHashSet<>(foundBy))
                .qualityScore(qualityScore)
                .category(category)
                .firstSeenAt(firstSeenAt)
                .metadata(new LinkedHashMap<>(metadata))
                .build();
    }
}
