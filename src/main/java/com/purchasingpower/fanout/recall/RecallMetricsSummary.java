package com.purchasingpower.fanout.recall;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RecallMetricsSummary {

    long totalSearches;
    long totalResults;
    long uniqueResults;
    double fallbackRate;
    double expansionRate;
    double averageRounds;
}
