package com.purchasingpower.fanout.engine;

import java.util.Map;

import static java.util.Map.entry;

/**
 * Known engine codes with display names and per-query result caps.
 */
final class EngineCatalog {

    static final int DEFAULT_CAP = 100;

    static final Map<String, String> NAMES = Map.ofEntries(
            entry("GO", "Google"),
            entry("BI", "Bing"),
            entry("YA", "Yandex"),
            entry("DD", "DuckDuckGo"),
            entry("BR", "Brave"),
            entry("QW", "Qwant"),
            entry("AR", "Archive.org"),
            entry("EX", "Exa"),
            entry("GD", "GDELT"),
            entry("NA", "NewsAPI"),
            entry("PW", "PublicWWW"),
            entry("SS", "SocialSearcher"),
            entry("BO", "BoardReader"),
            entry("AL", "Aleph"),
            entry("OA", "OpenAlex"),
            entry("GU", "Gutenberg"),
            entry("CR", "Crossref"),
            entry("OL", "OpenLibrary"),
            entry("PM", "PubMed"),
            entry("AX", "arXiv"),
            entry("SE", "SemanticScholar"),
            entry("WP", "Wikipedia"),
            entry("BK", "Books"),
            entry("AA", "Anna's Archive"),
            entry("LG", "LibGen"),
            entry("BA", "Baidu"),
            entry("YO", "You.com"),
            entry("SP", "Startpage"),
            entry("TV", "Tavily")
    );

    static final Map<String, Integer> CAPS = Map.ofEntries(
            entry("DD", 500),
            entry("QW", 200),
            entry("GD", 200),
            entry("PW", 200),
            entry("BA", 200),
            entry("OA", 200),
            entry("GU", 200),
            entry("CR", 200),
            entry("OL", 200),
            entry("AX", 200),
            entry("SE", 200),
            entry("WP", 200),
            entry("TV", 20)
    );

    private EngineCatalog() {
    }

    static String name(String code) {
        return NAMES.getOrDefault(code, code);
    }

    static int cap(String code) {
        return CAPS.getOrDefault(code, DEFAULT_CAP);
    }
}
