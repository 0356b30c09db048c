package com.purchasingpower.fanout.query;

/**
 * @param matched  whether the phrase words were found close enough together
 * @param distance largest gap (in tokens) between consecutive phrase words, -1 if not matched
 * @param position token index of the first phrase word, -1 if not matched
 */
public record ProximityMatch(boolean matched, int distance, int position) {

    public static ProximityMatch none() {
        return new ProximityMatch(false, -1, -1);
    }
}
