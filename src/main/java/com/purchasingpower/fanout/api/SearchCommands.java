package com.purchasingpower.fanout.api;

import com.purchasingpower.fanout.orchestrator.SearchCommand;
import com.purchasingpower.fanout.orchestrator.SearchScope;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Request parameter to {@link SearchCommand} conversion shared by the blocking and streaming endpoints.
 */
final class SearchCommands {

    private SearchCommands() {
    }

    static SearchCommand from(String query, List<String> engines, Integer level, String scope) {
        SearchCommand.SearchCommandBuilder builder = SearchCommand.builder()
                .query(query)
                .level(level)
                .scope(scope == null || scope.isBlank() ? null : SearchScope.fromValue(scope));
        if (engines != null) {
            engines.stream()
                    .flatMap(e -> Arrays.stream(e.split(",")))
                    .map(String::trim)
                    .filter(e -> !e.isEmpty())
                    .map(e -> e.toUpperCase(Locale.ROOT))
                    .distinct()
                    .forEach(builder::engine);
        }
        return builder.build();
    }
}
