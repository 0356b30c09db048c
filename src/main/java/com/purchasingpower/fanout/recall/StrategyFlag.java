package com.purchasingpower.fanout.recall;

/**
 * Search-type specific switches a round strategy may carry.
 */
public enum StrategyFlag {
    // filetype
    REMOVE_EXTENSION_FILTER,
    SEARCH_CONTENT_NOT_URL,

    // proximity
    BIDIRECTIONAL,
    DISTANCE_VARIATIONS,
    DISABLE_SNIPPET_VALIDATION,
    USE_WILDCARDS,
    SEMANTIC_PROXIMITY,

    // location
    USE_GEO_EXPANSION,
    INCLUDE_NEARBY_REGIONS,
    USE_LOCAL_ENGINES,
    EXPAND_TO_COUNTRY,

    // corporate
    USE_ENTITY_VARIANTS,
    INCLUDE_SUBSIDIARIES,
    SEARCH_BUSINESS_SITES,
    USE_GENERAL_WEB_SEARCH,

    // date
    DATE_FORMAT_VARIANTS,
    RELATIVE_DATES,
    SEASONAL_SEARCH,
    USE_ARCHIVE_ENGINES,

    // language
    USE_TRANSLITERATION,
    INCLUDE_DIALECTS,
    USE_REGIONAL_ENGINES,
    CHARACTER_VARIANTS
}
