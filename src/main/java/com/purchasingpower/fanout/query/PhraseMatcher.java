package com.purchasingpower.fanout.query;

import java.util.List;

/**
 * Exact-phrase extraction and matching used to filter results of quoted queries.
 */
public interface PhraseMatcher {

    List<String> extractPhrases(String query);

    boolean checkExactMatch(String text, String phrase);

    /**
     * Checks whether the words of {@code phrase} occur in order with at most
     * {@code maxDistance} other tokens between consecutive words.
     */
    ProximityMatch checkProximity(String text, String phrase, int maxDistance);
}
