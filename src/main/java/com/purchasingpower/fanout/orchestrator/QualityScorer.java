package com.purchasingpower.fanout.orchestrator;

import java.util.Map;
import java.util.Set;

/**
 * Quality score of a deduplicated result. Depends only on the sources that reported it and on
 * title/snippet length, so more sources never lower the score.
 */
public final class QualityScorer {

    static final int BASE = 10;
    static final int PER_EXTRA_SOURCE = 10;
    static final int SHORT_TEXT_PENALTY = 5;

    private static final Map<String, Integer> SOURCE_BONUS = Map.of(
            "GO", 5,
            "BI", 5,
            "EX", 10,
            "BR", 5,
            "AX", 15,
            "PM", 15,
            CorpusSearcher.SOURCE_CODE, 20);

    private QualityScorer() {
    }

    public static int score(Set<String> foundBy, String title, String snippet) {
        int score = BASE + PER_EXTRA_SOURCE * (foundBy.size() - 1);
        for (String source : foundBy) {
            score += SOURCE_BONUS.getOrDefault(source, 0);
        }
        if (title == null || title.length() < 10) {
            score -= SHORT_TEXT_PENALTY;
        }
        if (snippet == null || snippet.length() < 20) {
            score -= SHORT_TEXT_PENALTY;
        }
        return score;
    }
}
