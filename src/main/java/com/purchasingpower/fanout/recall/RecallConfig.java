package com.purchasingpower.fanout.recall;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Recall tuning knobs.
 *
 * <p>Bound from {@code app.recall.*} and persisted as snake_case JSON by {@link RecallConfigStore}.
 * Defaults are the balanced profile.
 *
 * @since 1.0.0
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RecallConfig {

    @Builder.Default
    private RecallMode recallMode = RecallMode.BALANCED;

    @Builder.Default
    private FilteringLevel filteringLevel = FilteringLevel.MINIMAL;

    /** Number of progressive search rounds. */
    @Builder.Default
    private int searchRounds = 3;

    /** Unique results below which a round is considered under-delivering. */
    @Builder.Default
    private int minResultsThreshold = 10;

    @Builder.Default
    private int maxResultsPerEngine = 100;

    @Builder.Default
    private boolean enableQueryExpansion = true;

    @Builder.Default
    private boolean enableFallbackSearches = true;

    @Builder.Default
    private boolean enableSemanticSearch = true;

    @Builder.Default
    private boolean enableMisspellings = false;

    /** Minimum confidence score; 0 includes everything. */
    @Builder.Default
    private double confidenceThreshold = 0.0;

    @Builder.Default
    private boolean progressiveRelaxation = true;

    @Builder.Default
    private boolean trackMetrics = true;

    public static RecallConfig maximumRecall() {
        return RecallConfig.builder()
                .recallMode(RecallMode.MAXIMUM)
                .filteringLevel(FilteringLevel.NONE)
                .searchRounds(5)
                .minResultsThreshold(5)
                .maxResultsPerEngine(200)
                .build();
    }

    public static RecallConfig balanced() {
        return RecallConfig.builder().build();
    }

    public static RecallConfig precision() {
        return RecallConfig.builder()
                .recallMode(RecallMode.PRECISION)
                .filteringLevel(FilteringLevel.STRICT)
                .searchRounds(2)
                .minResultsThreshold(20)
                .maxResultsPerEngine(50)
                .enableQueryExpansion(false)
                .enableFallbackSearches(false)
                .enableSemanticSearch(false)
                .confidenceThreshold(0.7)
                .progressiveRelaxation(false)
                .build();
    }
}
