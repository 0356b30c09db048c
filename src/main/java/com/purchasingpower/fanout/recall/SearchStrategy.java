package com.purchasingpower.fanout.recall;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Parameters for one search round, produced by {@link RecallStrategyPlanner#getSearchStrategy}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchStrategy {

    private boolean useExpansion;

    @Builder.Default
    private List<ExpansionType> expansionTypes = new ArrayList<>();

    @Builder.Default
    private boolean filteringEnabled = true;

    @Builder.Default
    private double filterThreshold = 0.5;

    @Builder.Default
    private int maxVariations = 10;

    @Builder.Default
    private EngineSelection enginesToUse = EngineSelection.ALL;

    private boolean fallbackNeeded;
    private int relaxationLevel;

    /** URL/content patterns worth adding to the query, e.g. {@code index_of}. */
    @Builder.Default
    private List<String> specialPatterns = new ArrayList<>();

    @Builder.Default
    private Set<StrategyFlag> flags = EnumSet.noneOf(StrategyFlag.class);

    public boolean has(StrategyFlag flag) {
        return flags.contains(flag);
    }

    void flag(StrategyFlag flag, boolean enabled) {
        if (enabled) {
            flags.add(flag);
        } else {
            flags.remove(flag);
        }
    }
}
