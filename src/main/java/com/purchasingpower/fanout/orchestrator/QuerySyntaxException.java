package com.purchasingpower.fanout.orchestrator;

/**
 * Invalid search input: blank query, level outside 1..3, unknown scope.
 */
public class QuerySyntaxException extends RuntimeException {

    public QuerySyntaxException(String message) {
        super(message);
    }
}
