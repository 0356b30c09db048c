package com.purchasingpower.fanout.orchestrator;

import com.purchasingpower.fanout.configuration.SearchProperties;
import com.purchasingpower.fanout.query.PhraseMatcher;
import com.purchasingpower.fanout.query.QueryExpander;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns a {@link SearchCommand} into a {@link PreparedQuery}: strips the force-anchor token,
 * derives the web and corpus variants and extracts exact phrases.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueryPreparer {

    static final String FORCE_ANCHOR_TOKEN = "+anchor";
    private static final Pattern FORCE_ANCHOR = Pattern.compile("(?i)(^|\\s)\\+anchor(?=\\s|$)");
    private static final Pattern SPACES = Pattern.compile("\\s{2,}");

    private final QueryExpander queryExpander;
    private final PhraseMatcher phraseMatcher;
    private final SearchProperties properties;

    public PreparedQuery prepare(SearchCommand command) {
        if (command == null || command.getQuery() == null || command.getQuery().isBlank()) {
            throw new QuerySyntaxException("Query is required");
        }
        int level = command.getLevel() != null ? command.getLevel() : properties.getDefaultLevel();
        if (level < 1 || level > 3) {
            throw new QuerySyntaxException("Level must be between 1 and 3, got " + level);
        }
        SearchScope scope = command.getScope() != null ? command.getScope() : properties.getDefaultScope();

        String raw = command.getQuery().trim();
        boolean forceAnchor = FORCE_ANCHOR.matcher(raw).find();
        String query = forceAnchor
                ? SPACES.matcher(FORCE_ANCHOR.matcher(raw).replaceAll(" ")).replaceAll(" ").trim()
                : raw;
        if (query.isEmpty()) {
            throw new QuerySyntaxException("Query is empty after removing " + FORCE_ANCHOR_TOKEN);
        }

        List<String> phrases = List.copyOf(phraseMatcher.extractPhrases(query));
        PreparedQuery prepared = PreparedQuery.builder()
                .raw(raw)
                .query(query)
                .forceAnchor(forceAnchor)
                .concreteQuery(queryExpander.parse(query))
                .webQuery(queryExpander.expandForWeb(query))
                .phrases(phrases)
                .corpusFilter(queryExpander.corpusFilters(query))
                .level(level)
                .scope(scope)
                .build();

        log.debug("Prepared query: web='{}', concrete='{}', phrases={}, forceAnchor={}",
                prepared.getWebQuery(), prepared.getConcreteQuery(), phrases, forceAnchor);
        return prepared;
    }
}
