package com.purchasingpower.fanout.query;

/**
 * Expands query macros for web engines and strips them for corpus search.
 */
public interface QueryExpander {

    /**
     * Query text handed to web engines, macros replaced by engine operators.
     */
    String expandForWeb(String query);

    /**
     * Query text with every macro removed.
     */
    String parse(String query);

    /**
     * Filters the macros imply for corpus (index) search.
     */
    CorpusFilter corpusFilters(String query);
}
