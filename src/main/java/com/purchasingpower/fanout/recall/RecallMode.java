package com.purchasingpower.fanout.recall;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Precision/completeness trade-off of a search run.
 */
public enum RecallMode {

    /** Prioritize recall above all else. */
    MAXIMUM,

    /** Balance recall and precision. */
    BALANCED,

    /** Prioritize precision over recall. */
    PRECISION;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RecallMode fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
