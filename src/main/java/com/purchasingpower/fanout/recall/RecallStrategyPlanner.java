package com.purchasingpower.fanout.recall;

import com.google.common.base.Preconditions;
import com.purchasingpower.fanout.model.SearchResult;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decides, round by round, how broad a search should be and whether another round is worth it.
 *
 * <p>A strategy is built in three layers: the recall mode baseline, the filtering level
 * adjustment, then search-type specific extras gated by round number. The planner never
 * dispatches anything itself; the orchestrator executes what it decides.
 *
 * <p>Thread-safe: configuration is read-only and metrics are atomic counters.
 *
 * @since 1.0.0
 */
@Slf4j
public class RecallStrategyPlanner {

    private static final List<String> LOW_TRUST_TLDS = List.of(".tk", ".ml", ".ga", ".cf");
    private static final List<String> DOCUMENT_EXTENSIONS = List.of(".pdf", ".doc", ".xls", ".ppt", ".zip");

    public static final String LOCATION_RELEVANCE = "location_relevance";
    public static final String LANGUAGE_SCORE = "language_score";

    @Getter
    private final RecallConfig config;

    private final AtomicLong searchesPerformed = new AtomicLong();
    private final AtomicLong fallbackTriggered = new AtomicLong();
    private final AtomicLong expansionUsed = new AtomicLong();
    private final AtomicLong totalResultsFound = new AtomicLong();
    private final AtomicLong uniqueResults = new AtomicLong();
    private final AtomicLong runsRecorded = new AtomicLong();
    private final AtomicLong roundsRecorded = new AtomicLong();

    public RecallStrategyPlanner(RecallConfig config) {
        Preconditions.checkNotNull(config, "Recall config cannot be null");
        Preconditions.checkArgument(config.getSearchRounds() >= 1, "searchRounds must be >= 1");
        this.config = config;
    }

    public SearchStrategy getSearchStrategy(SearchType searchType, int currentResults, int roundNum) {
        Preconditions.checkNotNull(searchType, "Search type cannot be null");
        Preconditions.checkArgument(roundNum >= 1, "Round numbers start at 1");

        SearchStrategy strategy = baseline(currentResults, roundNum);
        applyFilteringLevel(strategy);
        adjustForSearchType(strategy, searchType, roundNum);

        if (config.isTrackMetrics()) {
            searchesPerformed.incrementAndGet();
            if (strategy.isUseExpansion()) {
                expansionUsed.incrementAndGet();
            }
            if (strategy.isFallbackNeeded()) {
                fallbackTriggered.incrementAndGet();
            }
        }
        return strategy;
    }

    private SearchStrategy baseline(int currentResults, int roundNum) {
        int threshold = config.getMinResultsThreshold();
        switch (config.getRecallMode()) {
            case MAXIMUM: {
                List<ExpansionType> types = new ArrayList<>(List.of(
                        ExpansionType.SYNONYMS, ExpansionType.SEMANTIC, ExpansionType.MODIFIERS, ExpansionType.STEMS));
                if (config.isEnableMisspellings()) {
                    types.add(ExpansionType.MISSPELLINGS);
                }
                return SearchStrategy.builder()
                        .useExpansion(true)
                        .expansionTypes(types)
                        .filteringEnabled(false)
                        .filterThreshold(0.0)
                        .maxVariations(20)
                        .enginesToUse(EngineSelection.ALL)
                        .fallbackNeeded(currentResults < threshold)
                        .relaxationLevel(roundNum - 1)
                        .build();
            }
            case BALANCED:
                return SearchStrategy.builder()
                        .useExpansion(roundNum > 1 || currentResults < threshold)
                        .expansionTypes(roundNum > 1
                                ? new ArrayList<>(List.of(ExpansionType.SYNONYMS, ExpansionType.SEMANTIC))
                                : new ArrayList<>(List.of(ExpansionType.SYNONYMS)))
                        .filteringEnabled(true)
                        .filterThreshold(0.3)
                        .maxVariations(15)
                        .enginesToUse(roundNum == 1 ? EngineSelection.PRIMARY : EngineSelection.ALL)
                        .fallbackNeeded(currentResults < threshold / 2)
                        .relaxationLevel(Math.max(0, roundNum - 2))
                        .build();
            case PRECISION:
                return SearchStrategy.builder()
                        .useExpansion(false)
                        .filteringEnabled(true)
                        .filterThreshold(0.7)
                        .maxVariations(5)
                        .enginesToUse(EngineSelection.PRIMARY)
                        .fallbackNeeded(false)
                        .relaxationLevel(0)
                        .build();
            default:
                return SearchStrategy.builder().build();
        }
    }

    private void applyFilteringLevel(SearchStrategy strategy) {
        switch (config.getFilteringLevel()) {
            case NONE -> {
                strategy.setFilteringEnabled(false);
                strategy.setFilterThreshold(0.0);
            }
            case MINIMAL -> strategy.setFilterThreshold(Math.max(0.1, strategy.getFilterThreshold() - 0.2));
            case STRICT -> strategy.setFilterThreshold(Math.min(0.9, strategy.getFilterThreshold() + 0.2));
            case MODERATE -> {
                // baseline threshold stands
            }
        }
    }

    private void adjustForSearchType(SearchStrategy strategy, SearchType searchType, int roundNum) {
        switch (searchType) {
            case FILETYPE -> {
                if (roundNum == 1) {
                    strategy.getSpecialPatterns().addAll(List.of("index_of", "parent_directory"));
                } else if (roundNum == 2) {
                    strategy.getSpecialPatterns().addAll(List.of("file_hosting", "download_sites"));
                    strategy.getExpansionTypes().add(ExpansionType.MODIFIERS);
                } else {
                    strategy.flag(StrategyFlag.REMOVE_EXTENSION_FILTER, true);
                    strategy.flag(StrategyFlag.SEARCH_CONTENT_NOT_URL, true);
                }
            }
            case PROXIMITY -> {
                strategy.flag(StrategyFlag.BIDIRECTIONAL, true);
                strategy.flag(StrategyFlag.DISTANCE_VARIATIONS, true);
                strategy.flag(StrategyFlag.DISABLE_SNIPPET_VALIDATION, roundNum > 1);
                strategy.flag(StrategyFlag.USE_WILDCARDS, roundNum > 1);
                strategy.flag(StrategyFlag.SEMANTIC_PROXIMITY, roundNum > 2);
            }
            case LOCATION -> {
                strategy.flag(StrategyFlag.USE_GEO_EXPANSION, true);
                strategy.flag(StrategyFlag.INCLUDE_NEARBY_REGIONS, roundNum > 1);
                strategy.flag(StrategyFlag.USE_LOCAL_ENGINES, true);
                strategy.flag(StrategyFlag.EXPAND_TO_COUNTRY, roundNum > 2);
            }
            case CORPORATE -> {
                strategy.flag(StrategyFlag.USE_ENTITY_VARIANTS, true);
                strategy.flag(StrategyFlag.INCLUDE_SUBSIDIARIES, roundNum > 1);
                strategy.flag(StrategyFlag.SEARCH_BUSINESS_SITES, true);
                strategy.flag(StrategyFlag.USE_GENERAL_WEB_SEARCH, roundNum > 2);
            }
            case DATE -> {
                strategy.flag(StrategyFlag.DATE_FORMAT_VARIANTS, true);
                strategy.flag(StrategyFlag.RELATIVE_DATES, roundNum > 1);
                strategy.flag(StrategyFlag.SEASONAL_SEARCH, roundNum > 2);
                strategy.flag(StrategyFlag.USE_ARCHIVE_ENGINES, true);
            }
            case LANGUAGE -> {
                strategy.flag(StrategyFlag.USE_TRANSLITERATION, roundNum > 1);
                strategy.flag(StrategyFlag.INCLUDE_DIALECTS, roundNum > 2);
                strategy.flag(StrategyFlag.USE_REGIONAL_ENGINES, true);
                strategy.flag(StrategyFlag.CHARACTER_VARIANTS, true);
            }
            case GENERAL -> {
                // no specialization
            }
        }
    }

    /**
     * Continuation gate evaluated after each round.
     */
    public boolean shouldContinueSearching(int currentResults, int roundNum, SearchType searchType) {
        if (roundNum >= config.getSearchRounds()) {
            return false;
        }
        if (config.getRecallMode() == RecallMode.MAXIMUM) {
            return true;
        }

        int threshold = config.getMinResultsThreshold();
        if (currentResults >= threshold * 2) {
            return false;
        }
        if (currentResults < threshold) {
            return true;
        }
        if (config.getRecallMode() == RecallMode.BALANCED) {
            return currentResults < threshold * 1.5;
        }
        if (config.getRecallMode() == RecallMode.PRECISION) {
            return currentResults < 5;
        }
        return false;
    }

    /**
     * Relevance confidence in [0, 1].
     *
     * <p>Location and language searches read {@value #LOCATION_RELEVANCE} / {@value #LANGUAGE_SCORE}
     * from the result metadata when an upstream component supplied them.
     */
    public double scoreResult(SearchResult result, SearchType searchType, List<String> queryTerms) {
        Preconditions.checkNotNull(result, "Result cannot be null");
        List<String> terms = queryTerms == null ? List.of() : queryTerms.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(t -> t.toLowerCase(Locale.ROOT))
                .toList();

        String title = lower(result.getTitle());
        String snippet = lower(result.getSnippet());
        String url = lower(result.getUrl());

        double score = 0.5;
        if (!terms.isEmpty()) {
            if (!title.isEmpty()) {
                score += ratio(terms, title) * 0.3;
            }
            if (!snippet.isEmpty()) {
                score += ratio(terms, snippet) * 0.2;
            }
            if (!url.isEmpty()) {
                score += ratio(terms, url) * 0.1;
            }
        }
        if (!url.isEmpty() && hasLowTrustTld(url)) {
            score -= 0.2;
        }

        switch (searchType == null ? SearchType.GENERAL : searchType) {
            case FILETYPE -> {
                if (DOCUMENT_EXTENSIONS.stream().anyMatch(url::contains)) {
                    score += 0.2;
                }
            }
            case PROXIMITY -> {
                if (terms.size() >= 2 && snippet.contains(terms.get(0)) && snippet.contains(terms.get(1))) {
                    score += 0.3;
                }
            }
            case LOCATION -> score += signal(result, LOCATION_RELEVANCE) * 0.4;
            case LANGUAGE -> score += signal(result, LANGUAGE_SCORE) * 0.4;
            default -> {
                // no type bonus
            }
        }

        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    public List<FallbackStrategy> getFallbackStrategies(SearchType searchType, int roundNum) {
        List<FallbackStrategy> strategies = new ArrayList<>();

        if (roundNum == 2) {
            strategies.add(new FallbackStrategy("broad_match",
                    "Remove quotes and exact match requirements",
                    Set.of("remove_quotes", "use_or_operator", "add_related_terms")));
        }
        if (roundNum >= 3) {
            strategies.add(new FallbackStrategy("semantic_expansion",
                    "Use semantic search and concept expansion",
                    Set.of("use_semantic_search", "concept_expansion", "category_search")));
        }

        if (searchType == SearchType.FILETYPE) {
            strategies.add(new FallbackStrategy("content_search",
                    "Search content not URLs",
                    Set.of("ignore_url_patterns", "search_file_content", "use_ocr_results")));
            strategies.add(new FallbackStrategy("archive_search",
                    "Search archived content",
                    Set.of("use_wayback", "use_common_crawl", "search_cached_pages")));
        } else if (searchType == SearchType.PROXIMITY) {
            strategies.add(new FallbackStrategy("relaxed_proximity",
                    "Increase proximity distance",
                    Set.of("double_distance", "remove_order_requirement", "paragraph_proximity")));
            strategies.add(new FallbackStrategy("co_occurrence",
                    "Find documents with both terms",
                    Set.of("no_proximity_requirement", "same_page_only", "boost_both_terms")));
        }
        return strategies;
    }

    /**
     * Records the outcome of a finished multi-round run.
     */
    public void recordRun(int rounds, long totalResults, long unique) {
        if (!config.isTrackMetrics()) {
            return;
        }
        runsRecorded.incrementAndGet();
        roundsRecorded.addAndGet(rounds);
        totalResultsFound.addAndGet(totalResults);
        uniqueResults.addAndGet(unique);
    }

    public RecallMetricsSummary getMetricsSummary() {
        long searches = searchesPerformed.get();
        long runs = runsRecorded.get();
        return RecallMetricsSummary.builder()
                .totalSearches(searches)
                .totalResults(totalResultsFound.get())
                .uniqueResults(uniqueResults.get())
                .fallbackRate((double) fallbackTriggered.get() / Math.max(1, searches))
                .expansionRate((double) expansionUsed.get() / Math.max(1, searches))
                .averageRounds((double) roundsRecorded.get() / Math.max(1, runs))
                .build();
    }

    private static double ratio(List<String> terms, String text) {
        long matching = terms.stream().filter(text::contains).count();
        return (double) matching / terms.size();
    }

    private static boolean hasLowTrustTld(String url) {
        String host;
        try {
            host = URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            host = null;
        }
        String target = host != null ? host : url;
        return LOW_TRUST_TLDS.stream().anyMatch(target::endsWith);
    }

    private static double signal(SearchResult result, String key) {
        if (result.getMetadata() == null) {
            return 0.0;
        }
        Object value = result.getMetadata().get(key);
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isFinite(d) ? d : 0.0;
        }
        return 0.0;
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
