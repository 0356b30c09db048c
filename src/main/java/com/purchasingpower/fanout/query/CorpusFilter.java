package com.purchasingpower.fanout.query;

import java.util.Locale;
import java.util.Set;

/**
 * Restricts corpus hits to URLs whose host ends in one of the given domain suffixes.
 * An empty suffix set accepts everything.
 */
public record CorpusFilter(Set<String> domainSuffixes) {

    public static CorpusFilter none() {
        return new CorpusFilter(Set.of());
    }

    public boolean isEmpty() {
        return domainSuffixes.isEmpty();
    }

    public boolean accepts(String host) {
        if (domainSuffixes.isEmpty()) {
            return true;
        }
        if (host == null) {
            return false;
        }
        String lower = host.toLowerCase(Locale.ROOT);
        return domainSuffixes.stream().anyMatch(suffix -> lower.endsWith("." + suffix) || lower.equals(suffix));
    }
}
