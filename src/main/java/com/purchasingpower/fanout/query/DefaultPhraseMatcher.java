package com.purchasingpower.fanout.query;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Double-quoted phrase matcher.
 *
 * <p>Both exact and proximity checks normalise text first: lower case, {@code . _ -} treated
 * as spaces, whitespace collapsed. So {@code "acme-corp"} matches "Acme Corp" and "acme_corp".
 * The exact check also accepts the phrase with all spaces removed ("acmecorp").
 */
@Slf4j
@Component
public class DefaultPhraseMatcher implements PhraseMatcher {

    private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"");
    private static final Pattern SEPARATORS = Pattern.compile("[._\\-\\s]+");
    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");

    @Override
    public List<String> extractPhrases(String query) {
        List<String> phrases = new ArrayList<>();
        if (query == null) {
            return phrases;
        }
        Matcher matcher = QUOTED.matcher(query);
        while (matcher.find()) {
            String phrase = matcher.group(1).trim();
            if (!phrase.isEmpty() && !phrases.contains(phrase)) {
                phrases.add(phrase);
            }
        }
        return phrases;
    }

    @Override
    public boolean checkExactMatch(String text, String phrase) {
        if (text == null || phrase == null || phrase.isBlank()) {
            return false;
        }
        String normalizedText = normalize(text);
        String normalizedPhrase = normalize(phrase);
        if (normalizedText.contains(normalizedPhrase)) {
            return true;
        }
        String joined = normalizedPhrase.replace(" ", "");
        return !joined.equals(normalizedPhrase) && normalizedText.replace(" ", "").contains(joined);
    }

    @Override
    public ProximityMatch checkProximity(String text, String phrase, int maxDistance) {
        if (text == null || phrase == null) {
            return ProximityMatch.none();
        }
        List<String> words = tokens(phrase);
        List<String> haystack = tokens(text);
        if (words.isEmpty() || haystack.isEmpty()) {
            return ProximityMatch.none();
        }

        for (int start = 0; start < haystack.size(); start++) {
            if (!haystack.get(start).equals(words.get(0))) {
                continue;
            }
            int previous = start;
            int widestGap = 0;
            boolean complete = true;
            for (int w = 1; w < words.size(); w++) {
                int found = -1;
                int limit = Math.min(haystack.size() - 1, previous + maxDistance + 1);
                for (int i = previous + 1; i <= limit; i++) {
                    if (haystack.get(i).equals(words.get(w))) {
                        found = i;
                        break;
                    }
                }
                if (found < 0) {
                    complete = false;
                    break;
                }
                widestGap = Math.max(widestGap, found - previous - 1);
                previous = found;
            }
            if (complete) {
                return new ProximityMatch(true, widestGap, start);
            }
        }
        return ProximityMatch.none();
    }

    private static String normalize(String value) {
        return SEPARATORS.matcher(value.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    private static List<String> tokens(String value) {
        List<String> tokens = new ArrayList<>();
        for (String token : TOKEN_SPLIT.split(value.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
