package com.purchasingpower.fanout.orchestrator;

import com.purchasingpower.fanout.query.CorpusFilter;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Immutable, fully derived form of a query for one run.
 */
@Value
@Builder
public class PreparedQuery {

    /** Input as received. */
    String raw;

    /** Input without the {@code +anchor} token. */
    String query;

    boolean forceAnchor;

    /** Macro-free form sent to the corpus. */
    String concreteQuery;

    /** Macro-expanded form sent to web engines. */
    String webQuery;

    List<String> phrases;
    CorpusFilter corpusFilter;
    int level;
    SearchScope scope;
}
