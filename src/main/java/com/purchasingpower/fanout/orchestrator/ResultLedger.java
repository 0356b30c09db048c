package com.purchasingpower.fanout.orchestrator;

import com.google.common.base.Preconditions;
import com.purchasingpower.fanout.model.RawResult;
import com.purchasingpower.fanout.model.SearchResult;
import com.purchasingpower.fanout.query.PhraseMatcher;
import com.purchasingpower.fanout.query.ResultCategorizer;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Per-run dedup map and seen-domain set, shared by every engine, anchor and corpus task.
 *
 * <p>Exactly one {@link SearchResult} exists per normalized URL. A new URL is inserted with its
 * reporting source; a later sighting adds the source if absent, keeps the longer snippet and
 * rescores. When the query carried exact phrases, results whose title and snippet contain neither
 * an exact nor a close (distance 2) match of any phrase are dropped.
 *
 * <p>All mutations happen under one lock. Categorization and hand-off to the index writer run
 * outside it, on copies.
 *
 * @since 1.0.0
 */
@Slf4j
public class ResultLedger {

    static final String CORPUS_CATEGORY = "corpus";
    static final int PHRASE_PROXIMITY = 2;

    private final PhraseMatcher phraseMatcher;
    private final ResultCategorizer categorizer;
    private final List<String> phrases;
    private final Consumer<SearchResult> onNewResult;
    private final int maxAnchorDomains;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, SearchResult> results = new LinkedHashMap<>();
    private final Set<String> seenDomains = new HashSet<>();
    private final AtomicInteger skippedDomains = new AtomicInteger();
    private final AtomicInteger filteredOut = new AtomicInteger();

    /**
     * @param onNewResult receives a copy of every newly inserted result, after categorization
     */
    public ResultLedger(PhraseMatcher phraseMatcher, ResultCategorizer categorizer, List<String> phrases,
                        Consumer<SearchResult> onNewResult, int maxAnchorDomains) {
        Preconditions.checkArgument(maxAnchorDomains >= 0, "maxAnchorDomains must be >= 0");
        this.phraseMatcher = phraseMatcher;
        this.categorizer = categorizer;
        this.phrases = phrases == null ? List.of() : List.copyOf(phrases);
        this.onNewResult = onNewResult;
        this.maxAnchorDomains = maxAnchorDomains;
    }

    /**
     * Merges one source's results.
     *
     * @return copies of the results that were new to this run, in input order
     */
    public List<SearchResult> merge(List<RawResult> rawResults, String sourceCode) {
        Preconditions.checkNotNull(sourceCode, "Source code cannot be null");
        if (rawResults == null || rawResults.isEmpty()) {
            return List.of();
        }

        boolean corpus = CorpusSearcher.SOURCE_CODE.equals(sourceCode);
        List<SearchResult> added = new ArrayList<>();

        for (RawResult raw : rawResults) {
            String url = UrlNormalizer.normalize(raw.getUrl());
            if (url.isEmpty()) {
                continue;
            }
            String title = raw.getTitle() == null ? "" : raw.getTitle();
            String snippet = raw.getSnippet() == null ? "" : raw.getSnippet();

            if (!passesPhraseFilter(title, snippet)) {
                filteredOut.incrementAndGet();
                log.debug("Filtered out (no phrase match): {}", url);
                continue;
            }

            SearchResult inserted = upsert(url, title, snippet, raw.getMetadata(), sourceCode, corpus);
            if (inserted != null) {
                added.add(inserted);
            }
        }

        if (!corpus) {
            added.forEach(this::categorize);
        }
        added.forEach(onNewResult);
        return added;
    }

    private SearchResult upsert(String url, String title, String snippet, Map<String, Object> metadata,
                                String sourceCode, boolean corpus) {
        lock.lock();
        try {
            SearchResult existing = results.get(url);
            if (existing != null) {
                boolean changed = existing.addSource(sourceCode);
                changed |= existing.replaceSnippetIfLonger(snippet);
                if (changed) {
                    existing.setQualityScore(score(existing));
                }
                return null;
            }

            Set<String> foundBy = new LinkedHashSet<>();
            foundBy.add(sourceCode);
            SearchResult entry = SearchResult.builder()
                    .url(url)
                    .title(title)
                    .snippet(snippet)
                    .foundBy(foundBy)
                    .category(corpus ? CORPUS_CATEGORY : null)
                    .firstSeenAt(Instant.now())
                    .metadata(metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata))
                    .build();
            entry.setQualityScore(score(entry));
            results.put(url, entry);
            return entry.copy();
        } finally {
            lock.unlock();
        }
    }

    private void categorize(SearchResult copy) {
        String category;
        try {
            category = categorizer.categorize(copy);
        } catch (RuntimeException e) {
            log.warn("Categorization failed for {}: {}", copy.getUrl(), e.getMessage());
            return;
        }
        copy.setCategory(category);
        lock.lock();
        try {
            SearchResult live = results.get(copy.getUrl());
            if (live != null && live.getCategory() == null) {
                live.setCategory(category);
            }
        } finally {
            lock.unlock();
        }
    }

    private boolean passesPhraseFilter(String title, String snippet) {
        if (phrases.isEmpty()) {
            return true;
        }
        String text = title + " " + snippet;
        for (String phrase : phrases) {
            if (phraseMatcher.checkExactMatch(text, phrase)) {
                return true;
            }
            if (phraseMatcher.checkProximity(text, phrase, PHRASE_PROXIMITY).matched()) {
                return true;
            }
        }
        return false;
    }

    private static int score(SearchResult result) {
        return QualityScorer.score(result.getFoundBy(), result.getTitle(), result.getSnippet());
    }

    /**
     * Registers a domain for anchor expansion.
     *
     * @return true if the domain was unseen and the per-run domain cap was not yet reached
     */
    public boolean claimDomain(String domain) {
        if (domain == null || domain.isEmpty()) {
            return false;
        }
        lock.lock();
        try {
            if (seenDomains.contains(domain)) {
                return false;
            }
            if (seenDomains.size() >= maxAnchorDomains) {
                skippedDomains.incrementAndGet();
                return false;
            }
            seenDomains.add(domain);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public int uniqueCount() {
        lock.lock();
        try {
            return results.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copies of every result, highest quality first.
     */
    public List<SearchResult> snapshot() {
        List<SearchResult> copies = new ArrayList<>();
        lock.lock();
        try {
            results.values().forEach(r -> copies.add(r.copy()));
        } finally {
            lock.unlock();
        }
        copies.sort(Comparator.comparingInt(SearchResult::getQualityScore).reversed());
        return copies;
    }

    public SearchResult get(String url) {
        lock.lock();
        try {
            SearchResult result = results.get(UrlNormalizer.normalize(url));
            return result == null ? null : result.copy();
        } finally {
            lock.unlock();
        }
    }

    public int getSkippedDomains() {
        return skippedDomains.get();
    }

    /**
     * Counts results a caller dropped before merging, e.g. for low relevance.
     */
    public void recordFilteredOut(int count) {
        filteredOut.addAndGet(count);
    }

    public int getFilteredOut() {
        return filteredOut.get();
    }
}
