package com.purchasingpower.fanout.routing;

/**
 * Top-level classification of query operators used for engine routing.
 *
 * @since 1.0.0
 */
public enum OperatorFamily {

    /**
     * Who or what is being searched for (person, company, username).
     */
    SUBJECT,

    /**
     * Modifiers applied to the query text itself (proximity, negation, translation).
     */
    OBJECT,

    /**
     * Where the answer is expected to live (time, place, field, URL, format, category).
     */
    LOCATION
}
