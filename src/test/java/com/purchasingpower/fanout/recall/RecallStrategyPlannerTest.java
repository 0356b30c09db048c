package com.purchasingpower.fanout.recall;

import com.purchasingpower.fanout.model.SearchResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

@DisplayName("Recall strategy planner")
class RecallStrategyPlannerTest {

    @Nested
    @DisplayName("getSearchStrategy")
    class Strategies {

        @Test
        void balancedFirstRound_shouldUsePrimaryEnginesAndMinimalFilter() {
            // Given
            RecallStrategyPlanner planner = new RecallStrategyPlanner(RecallConfig.balanced());

            // When
            SearchStrategy strategy = planner.getSearchStrategy(SearchType.GENERAL, 50, 1);

            // Then
            assertThat(strategy.getEnginesToUse()).isEqualTo(EngineSelection.PRIMARY);
            assertThat(strategy.isUseExpansion()).isFalse();
            assertThat(strategy.getExpansionTypes()).containsExactly(ExpansionType.SYNONYMS);
            assertThat(strategy.isFilteringEnabled()).isTrue();
            assertThat(strategy.getFilterThreshold()).isEqualTo(0.1, offset(1e-9));
            assertThat(strategy.isFallbackNeeded()).isFalse();
        }

        @Test
        void balancedLaterRound_shouldWidenToAllEngines() {
            RecallStrategyPlanner planner = new RecallStrategyPlanner(RecallConfig.balanced());

            SearchStrategy strategy = planner.getSearchStrategy(SearchType.GENERAL, 2, 3);

            assertThat(strategy.getEnginesToUse()).isEqualTo(EngineSelection.ALL);
            assertThat(strategy.isUseExpansion()).isTrue();
            assertThat(strategy.getExpansionTypes()).containsExactly(ExpansionType.SYNONYMS, ExpansionType.SEMANTIC);
            assertThat(strategy.isFallbackNeeded()).isTrue();
            assertThat(strategy.getRelaxationLevel()).isEqualTo(1);
        }

        @Test
        void maximumRecall_shouldDisableFiltering() {
            RecallStrategyPlanner planner = new RecallStrategyPlanner(RecallConfig.maximumRecall());

            SearchStrategy strategy = planner.getSearchStrategy(SearchType.GENERAL, 0, 1);

            assertThat(strategy.isFilteringEnabled()).isFalse();
            assertThat(strategy.getFilterThreshold()).isZero();
            assertThat(strategy.getMaxVariations()).isEqualTo(20);
            assertThat(strategy.getExpansionTypes()).doesNotContain(ExpansionType.MISSPELLINGS);
        }

        @Test
        void precision_shouldTightenThresholdAndStayPrimary() {
            RecallStrategyPlanner planner = new RecallStrategyPlanner(RecallConfig.precision());

            SearchStrategy strategy = planner.getSearchStrategy(SearchType.GENERAL, 0, 1);

            assertThat(strategy.isUseExpansion()).isFalse();
            assertThat(strategy.getFilterThreshold()).isEqualTo(0.9, offset(1e-9));
            assertThat(strategy.getEnginesToUse()).isEqualTo(EngineSelection.PRIMARY);
        }

        @Test
        void filetype_shouldProgressThroughPatternsThenDropExtensionFilter() {
            RecallStrategyPlanner planner = new RecallStrategyPlanner(RecallConfig.balanced());

            SearchStrategy first = planner.getSearchStrategy(SearchType.FILETYPE, 0, 1);
            SearchStrategy second = planner.getSearchStrategy(SearchType.FILETYPE, 0, 2);
            SearchStrategy third = planner.getSearchStrategy(SearchType.FILETYPE, 0, 3);

            assertThat(first.getSpecialPatterns()).containsExactly("index_of", "parent_directory");
            assertThat(second.getSpecialPatterns()).containsExactly("file_hosting", "download_sites");
            assertThat(second.getExpansionTypes()).contains(ExpansionType.MODIFIERS);
            assertThat(third.has(StrategyFlag.REMOVE_EXTENSION_FILTER)).isTrue();
            assertThat(third.has(StrategyFlag.SEARCH_CONTENT_NOT_URL)).isTrue();
        }

        @Test
        void proximity_shouldGateFlagsByRound() {
            RecallStrategyPlanner planner = new RecallStrategyPlanner(RecallConfig.balanced());

            SearchStrategy first = planner.getSearchStrategy(SearchType.PROXIMITY, 0, 1);
            SearchStrategy third = planner.getSearchStrategy(SearchType.PROXIMITY, 0, 3);

            assertThat(first.has(StrategyFlag.BIDIRECTIONAL)).isTrue();
            assertThat(first.has(StrategyFlag.USE_WILDCARDS)).isFalse();
            assertThat(third.has(StrategyFlag.USE_WILDCARDS)).isTrue();
            assertThat(third.has(StrategyFlag.SEMANTIC_PROXIMITY)).isTrue();
        }

        @Test
        void roundZero_shouldBeRejected() {
            RecallStrategyPlanner planner = new RecallStrategyPlanner(RecallConfig.balanced());

            assertThatThrownBy(() -> planner.getSearchStrategy(SearchType.GENERAL, 0, 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("shouldContinueSearching")
    class Continuation {

        @ParameterizedTest
        @EnumSource(RecallMode.class)
        void lastRound_shouldAlwaysStop(RecallMode mode) {
            // Given
            RecallConfig config = RecallConfig.builder().recallMode(mode).searchRounds(3).build();
            RecallStrategyPlanner planner = new RecallStrategyPlanner(config);

            // When / Then
            assertThat(planner.shouldContinueSearching(0, 3, SearchType.GENERAL)).isFalse();
            assertThat(planner.shouldContinueSearching(0, 7, SearchType.GENERAL)).isFalse();
        }

        @Test
        void maximumRecall_shouldContinueRegardlessOfCount() {
            RecallStrategyPlanner planner = new RecallStrategyPlanner(RecallConfig.maximumRecall());

            assertThat(planner.shouldContinueSearching(1_000, 4, SearchType.GENERAL)).isTrue();
        }

        @Test
        void balanced_shouldFollowThresholdBands() {
            RecallStrategyPlanner planner = new RecallStrategyPlanner(RecallConfig.balanced());

            assertThat(planner.shouldContinueSearching(5, 1, SearchType.GENERAL)).isTrue();
            assertThat(planner.shouldContinueSearching(12, 1, SearchType.GENERAL)).isTrue();
            assertThat(planner.shouldContinueSearching(16, 1, SearchType.GENERAL)).isFalse();
            assertThat(planner.shouldContinueSearching(20, 1, SearchType.GENERAL)).isFalse();
        }

        @Test
        void precision_shouldStopOncePastThreshold() {
            RecallStrategyPlanner planner = new RecallStrategyPlanner(RecallConfig.precision());

            assertThat(planner.shouldContinueSearching(25, 1, SearchType.GENERAL)).isFalse();
            assertThat(planner.shouldContinueSearching(3, 1, SearchType.GENERAL)).isTrue();
        }
    }

    @Nested
    @DisplayName("scoreResult")
    class Scoring {

        private final RecallStrategyPlanner planner = new RecallStrategyPlanner(RecallConfig.balanced());

        @Test
        void perfectFiletypeMatch_shouldClampToOne() {
            SearchResult result = SearchResult.builder()
                    .url("https://example.com/annual-report.pdf")
                    .title("Annual report")
                    .snippet("The annual report for 2023")
                    .build();

            double score = planner.scoreResult(result, SearchType.FILETYPE, List.of("annual", "report"));

            assertThat(score).isEqualTo(1.0);
        }

        @Test
        void lowTrustDomain_shouldBePenalized() {
            SearchResult result = SearchResult.builder().url("http://free-stuff.tk/page").build();

            double score = planner.scoreResult(result, SearchType.GENERAL, List.of());

            assertThat(score).isEqualTo(0.3, offset(1e-9));
        }

        @Test
        void locationSignal_shouldBeReadFromMetadataAndClamped() {
            SearchResult strong = SearchResult.builder()
                    .url("https://example.com")
                    .metadata(new LinkedHashMap<>(Map.of(RecallStrategyPlanner.LOCATION_RELEVANCE, 5.0)))
                    .build();
            SearchResult garbage = SearchResult.builder()
                    .url("https://example.com")
                    .metadata(new LinkedHashMap<>(Map.of(RecallStrategyPlanner.LOCATION_RELEVANCE, Double.NaN)))
                    .build();

            assertThat(planner.scoreResult(strong, SearchType.LOCATION, null)).isEqualTo(1.0);
            assertThat(planner.scoreResult(garbage, SearchType.LOCATION, null)).isEqualTo(0.5);
        }

        @Test
        void randomInputs_shouldAlwaysScoreWithinUnitInterval() {
            // Given
            Random random = new Random(20240611L);
            String[] urls = {"https://example.com/", "http://free-stuff.tk/", "ftp://host.ml/file.pdf",
                    "not a url | with spaces", "https://例子.中国/路径", "", "://", "https://a.b/c?d=e#f"};
            Object[] signals = {Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY,
                    Double.MAX_VALUE, -Double.MAX_VALUE, 0.0, 1.0, -3, 42L, "0.9", null};

            for (int i = 0; i < 2000; i++) {
                Map<String, Object> metadata = new HashMap<>();
                metadata.put(RecallStrategyPlanner.LOCATION_RELEVANCE, signals[random.nextInt(signals.length)]);
                metadata.put(RecallStrategyPlanner.LANGUAGE_SCORE, signals[random.nextInt(signals.length)]);
                SearchResult result = SearchResult.builder()
                        .url(random.nextInt(5) == 0 ? null : urls[random.nextInt(urls.length)] + randomText(random))
                        .title(random.nextInt(5) == 0 ? null : randomText(random))
                        .snippet(random.nextInt(5) == 0 ? null : randomText(random))
                        .metadata(random.nextInt(6) == 0 ? null : metadata)
                        .build();
                SearchType type = random.nextInt(8) == 0 ? null
                        : SearchType.values()[random.nextInt(SearchType.values().length)];

                // When
                double score = planner.scoreResult(result, type, randomTerms(random));

                // Then
                assertThat(score).as("score for %s / %s", result, type).isBetween(0.0, 1.0);
            }
        }

        private String randomText(Random random) {
            String alphabet = "abc XYZ.pdf/:-_?\"é\t";
            StringBuilder text = new StringBuilder();
            int length = random.nextInt(40);
            for (int i = 0; i < length; i++) {
                text.append(alphabet.charAt(random.nextInt(alphabet.length())));
            }
            return text.toString();
        }

        private List<String> randomTerms(Random random) {
            switch (random.nextInt(4)) {
                case 0:
                    return null;
                case 1:
                    return List.of();
                default:
                    List<String> terms = new ArrayList<>();
                    int count = 1 + random.nextInt(5);
                    for (int i = 0; i < count; i++) {
                        terms.add(random.nextInt(6) == 0 ? null : randomText(random));
                    }
                    if (!terms.isEmpty() && random.nextBoolean()) {
                        terms.add(terms.get(0));
                    }
                    return terms;
            }
        }

        @Test
        void emptyResult_shouldStayInRange() {
            double score = planner.scoreResult(new SearchResult(), SearchType.PROXIMITY, List.of("a", "b"));

            assertThat(score).isBetween(0.0, 1.0);
        }
    }

    @Test
    void fallbackStrategies_shouldCombineRoundAndTypeSpecificEntries() {
        RecallStrategyPlanner planner = new RecallStrategyPlanner(RecallConfig.balanced());

        List<FallbackStrategy> round2 = planner.getFallbackStrategies(SearchType.GENERAL, 2);
        List<FallbackStrategy> round3 = planner.getFallbackStrategies(SearchType.FILETYPE, 3);

        assertThat(round2).extracting(FallbackStrategy::name).containsExactly("broad_match");
        assertThat(round3).extracting(FallbackStrategy::name)
                .containsExactly("semantic_expansion", "content_search", "archive_search");
        assertThat(planner.getFallbackStrategies(SearchType.GENERAL, 1)).isEmpty();
    }

    @Test
    void metrics_shouldTrackStrategiesAndRuns() {
        // Given
        RecallStrategyPlanner planner = new RecallStrategyPlanner(RecallConfig.balanced());

        // When
        planner.getSearchStrategy(SearchType.GENERAL, 0, 1);
        planner.getSearchStrategy(SearchType.GENERAL, 40, 1);
        planner.recordRun(2, 30, 12);

        // Then
        RecallMetricsSummary summary = planner.getMetricsSummary();
        assertThat(summary.getTotalSearches()).isEqualTo(2);
        assertThat(summary.getExpansionRate()).isEqualTo(0.5);
        assertThat(summary.getFallbackRate()).isEqualTo(0.5);
        assertThat(summary.getAverageRounds()).isEqualTo(2.0);
        assertThat(summary.getUniqueResults()).isEqualTo(12);
    }
}
