package com.purchasingpower.fanout.query;

import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Handles {@code [cXX]} country macros.
 *
 * <p>{@code "apple [cde]"} becomes {@code "apple site:de"} for web engines, {@code "apple"} for
 * the corpus, and a {@code .de} host filter for corpus hits. Several macros combine as an OR
 * group on the web side.
 */
@Component
public class DefaultQueryExpander implements QueryExpander {

    private static final Pattern COUNTRY_MACRO = Pattern.compile("\\[c([a-zA-Z]{2})]");
    private static final Pattern SPACES = Pattern.compile("\\s{2,}");

    @Override
    public String expandForWeb(String query) {
        if (query == null) {
            return "";
        }
        Set<String> countries = countries(query);
        String stripped = parse(query);
        if (countries.isEmpty()) {
            return stripped;
        }
        StringBuilder sites = new StringBuilder();
        for (String country : countries) {
            if (sites.length() > 0) {
                sites.append(" OR ");
            }
            sites.append("site:").append(country);
        }
        String siteClause = countries.size() > 1 ? "(" + sites + ")" : sites.toString();
        return stripped.isEmpty() ? siteClause : stripped + " " + siteClause;
    }

    @Override
    public String parse(String query) {
        if (query == null) {
            return "";
        }
        String stripped = COUNTRY_MACRO.matcher(query).replaceAll(" ");
        return SPACES.matcher(stripped).replaceAll(" ").trim();
    }

    @Override
    public CorpusFilter corpusFilters(String query) {
        Set<String> countries = countries(query);
        return countries.isEmpty() ? CorpusFilter.none() : new CorpusFilter(Set.copyOf(countries));
    }

    private static Set<String> countries(String query) {
        Set<String> countries = new LinkedHashSet<>();
        if (query == null) {
            return countries;
        }
        Matcher matcher = COUNTRY_MACRO.matcher(query);
        while (matcher.find()) {
            countries.add(matcher.group(1).toLowerCase(Locale.ROOT));
        }
        return countries;
    }
}
