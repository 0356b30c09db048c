package com.purchasingpower.fanout.recall;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of search a query represents, used to specialize round strategies and result scoring.
 */
public enum SearchType {
    GENERAL,
    FILETYPE,
    PROXIMITY,
    LOCATION,
    CORPORATE,
    DATE,
    LANGUAGE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
