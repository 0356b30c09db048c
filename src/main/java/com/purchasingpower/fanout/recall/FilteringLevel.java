package com.purchasingpower.fanout.recall;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How aggressively low-confidence results are filtered.
 */
public enum FilteringLevel {
    NONE,
    MINIMAL,
    MODERATE,
    STRICT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FilteringLevel fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
