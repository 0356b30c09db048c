package com.purchasingpower.fanout.orchestrator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Which sources a run queries: live web engines, the local corpus, or both.
 */
public enum SearchScope {

    WEB,
    CORPUS,
    BOTH;

    public boolean includesWeb() {
        return this != CORPUS;
    }

    public boolean includesCorpus() {
        return this != WEB;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SearchScope fromValue(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new QuerySyntaxException("Unknown scope: " + value);
        }
    }
}
