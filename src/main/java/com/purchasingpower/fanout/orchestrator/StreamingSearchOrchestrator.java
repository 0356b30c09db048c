package com.purchasingpower.fanout.orchestrator;

import com.google.common.base.Preconditions;
import com.purchasingpower.fanout.configuration.SearchProperties;
import com.purchasingpower.fanout.engine.AnchorSearcher;
import com.purchasingpower.fanout.engine.EngineDescriptor;
import com.purchasingpower.fanout.engine.EngineRegistry;
import com.purchasingpower.fanout.engine.RateLimiter;
import com.purchasingpower.fanout.indexing.BackgroundIndexWriter;
import com.purchasingpower.fanout.indexing.IndexContext;
import com.purchasingpower.fanout.indexing.IndexWriterFactory;
import com.purchasingpower.fanout.model.RawResult;
import com.purchasingpower.fanout.model.SearchResult;
import com.purchasingpower.fanout.query.PhraseMatcher;
import com.purchasingpower.fanout.query.ResultCategorizer;
import com.purchasingpower.fanout.recall.EngineSelection;
import com.purchasingpower.fanout.recall.FallbackStrategy;
import com.purchasingpower.fanout.recall.RecallStrategyPlanner;
import com.purchasingpower.fanout.recall.SearchStrategy;
import com.purchasingpower.fanout.recall.SearchType;
import com.purchasingpower.fanout.routing.EngineSets;
import com.purchasingpower.fanout.routing.QueryOperatorRouter;
import com.purchasingpower.fanout.routing.RoutingDecision;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fans one query out over every selected engine, merges results as they arrive and streams
 * events to a listener.
 *
 * <p>A run moves through INIT (query preparation, ledger and index writer set up), DISPATCH (one
 * task per engine plus, in the first round, one corpus task), STREAMING (events in completion
 * order) and FINALIZE (writer shutdown, single {@code complete} event). DISPATCH and STREAMING
 * repeat once per recall round: the planner decides each round's parameters and whether another
 * round is worth it.
 *
 * <p>Engine calls run on the engine executor and always pass the rate limiter first. Anchor
 * follow-ups run on a separate executor so engine tasks waiting on them never starve the pool.
 * In-flight engine calls are not cancelled; adapters own their request timeouts.
 *
 * @since 1.0.0
 */
@Slf4j
public class StreamingSearchOrchestrator {

    enum RunState { INIT, DISPATCH, STREAMING, FINALIZE }

    public static final String ANCHOR_SOURCE = AnchorSearcher.ANCHOR_CODE;

    private static final Pattern FILETYPE = Pattern.compile("filetype:(\\w+)");
    private static final Pattern SITE = Pattern.compile("site:([\\w.-]+)");
    private static final Pattern SPACES = Pattern.compile("\\s{2,}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final QueryOperatorRouter operatorRouter;
    private final RecallStrategyPlanner planner;
    private final QueryPreparer queryPreparer;
    private final EngineRegistry engineRegistry;
    private final RateLimiter rateLimiter;
    private final AnchorSearcher anchorSearcher;
    private final CorpusSearcher corpusSearcher;
    private final PhraseMatcher phraseMatcher;
    private final ResultCategorizer categorizer;
    private final IndexWriterFactory writerFactory;
    private final SearchProperties properties;
    private final String zone;
    private final Executor engineExecutor;
    private final Executor anchorExecutor;

    public StreamingSearchOrchestrator(QueryOperatorRouter operatorRouter,
                                       RecallStrategyPlanner planner,
                                       QueryPreparer queryPreparer,
                                       EngineRegistry engineRegistry,
                                       RateLimiter rateLimiter,
                                       AnchorSearcher anchorSearcher,
                                       CorpusSearcher corpusSearcher,
                                       PhraseMatcher phraseMatcher,
                                       ResultCategorizer categorizer,
                                       IndexWriterFactory writerFactory,
                                       SearchProperties properties,
                                       String zone,
                                       Executor engineExecutor,
                                       Executor anchorExecutor) {
        this.operatorRouter = operatorRouter;
        this.planner = planner;
        this.queryPreparer = queryPreparer;
        this.engineRegistry = engineRegistry;
        this.rateLimiter = rateLimiter;
        this.anchorSearcher = anchorSearcher;
        this.corpusSearcher = corpusSearcher;
        this.phraseMatcher = phraseMatcher;
        this.categorizer = categorizer;
        this.writerFactory = writerFactory;
        this.properties = properties;
        this.zone = zone;
        this.engineExecutor = engineExecutor;
        this.anchorExecutor = anchorExecutor;
    }

    /**
     * Runs a search to completion, emitting events to {@code listener} on the calling thread.
     *
     * @throws QuerySyntaxException if the command is invalid; nothing is emitted in that case
     */
    public SearchRunReport execute(SearchCommand command, SearchEventListener listener) {
        Preconditions.checkNotNull(listener, "Listener cannot be null");
        PreparedQuery query = queryPreparer.prepare(command);
        SearchRun run = new SearchRun(command, query, listener);
        return run.execute();
    }

    public SearchRunReport execute(SearchCommand command) {
        return execute(command, SearchEventListener.NO_OP);
    }

    /**
     * Lowercase plain words of a query used for relevance scoring. Quotes are dropped; operator
     * clauses, exclusions and {@code OR} are skipped.
     */
    static List<String> queryTerms(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        Set<String> terms = new LinkedHashSet<>();
        for (String token : WHITESPACE.split(query.trim())) {
            String term = token.replace("\"", "").toLowerCase(Locale.ROOT);
            if (term.isEmpty() || term.contains(":") || term.startsWith("-") || term.equals("or")) {
                continue;
            }
            terms.add(term);
        }
        return List.copyOf(terms);
    }

    /**
     * Web query variants for one engine call. From level 2 on, {@code filetype:} and {@code site:}
     * clauses are additionally rewritten as {@code inurl:} clauses.
     */
    static List<String> queryVariants(String webQuery, int level) {
        Set<String> variants = new LinkedHashSet<>();
        variants.add(webQuery);
        if (level >= 2) {
            Matcher filetype = FILETYPE.matcher(webQuery);
            if (filetype.find()) {
                String base = collapse(webQuery.replace(filetype.group(), ""));
                if (!base.isEmpty()) {
                    variants.add(base + " inurl:." + filetype.group(1));
                }
            }
            Matcher site = SITE.matcher(webQuery);
            if (site.find()) {
                String domain = site.group(1);
                if (domain.contains(".") && !domain.contains("*")) {
                    String base = collapse(webQuery.replace(site.group(), ""));
                    if (!base.isEmpty()) {
                        variants.add(base + " inurl:" + domain);
                    }
                }
            }
        }
        return new ArrayList<>(variants);
    }

    static String anchorQuery(String domain, String webQuery) {
        return "site:" + domain + " anchor:\"" + webQuery + "\"";
    }

    private static String collapse(String text) {
        return SPACES.matcher(text).replaceAll(" ").trim();
    }

    private record TaskOutcome(String source, List<SearchResult> accepted, Throwable error) {

        boolean failed() {
            return error != null;
        }
    }

    /**
     * State of one run. Created per call, never shared between runs.
     */
    private final class SearchRun {

        private final SearchCommand command;
        private final PreparedQuery query;
        private final List<String> queryTerms;
        private final SearchEventListener listener;
        private final RunStatistics stats = new RunStatistics();
        private final Map<String, Set<String>> variantsRun = new HashMap<>();
        private final long startNanos = System.nanoTime();

        private RunState state;
        private BackgroundIndexWriter writer;
        private ResultLedger ledger;
        private boolean completeEmitted;

        SearchRun(SearchCommand command, PreparedQuery query, SearchEventListener listener) {
            this.command = command;
            this.query = query;
            this.queryTerms = queryTerms(query.getConcreteQuery());
            this.listener = listener;
        }

        SearchRunReport execute() {
            transition(RunState.INIT);
            RoutingDecision routing = operatorRouter.routeQuery(query.getQuery());
            SearchType searchType = SearchTypeResolver.resolve(routing.getDetected());
            log.info("🔄 Search started: '{}' level={} scope={} type={} forceAnchor={}",
                    query.getQuery(), query.getLevel(), query.getScope().value(), searchType.value(),
                    query.isForceAnchor());

            writer = writerFactory.start(new IndexContext(query.getQuery(), zone,
                    properties.getUserId(), properties.getProjectId()));
            ledger = new ResultLedger(phraseMatcher, categorizer, query.getPhrases(),
                    writer::submit, properties.getAnchorMaxDomains());

            int roundsRun = 0;
            try {
                for (int round = 1; ; round++) {
                    SearchStrategy strategy = planner.getSearchStrategy(searchType, ledger.uniqueCount(), round);
                    if (!runRound(round, strategy, routing, searchType)) {
                        log.info("Round {} has nothing new to run, stopping", round);
                        break;
                    }
                    roundsRun = round;
                    if (!planner.shouldContinueSearching(ledger.uniqueCount(), round, searchType)) {
                        break;
                    }
                }
            } finally {
                transition(RunState.FINALIZE);
                writer.close(properties.getWriter().getShutdownTimeout());
            }

            SearchEvent.Summary summary = summarize(roundsRun, searchType);
            emitComplete(summary);
            planner.recordRun(roundsRun, stats.getTotalResults(), ledger.uniqueCount());

            log.info("✅ Search complete: '{}' {} unique / {} raw in {}s ({} ok, {} failed, {} rounds)",
                    query.getQuery(), summary.getUniqueUrls(), summary.getTotalResults(),
                    String.format("%.2f", summary.getElapsedTime()), summary.getEnginesSucceeded(),
                    summary.getEnginesFailed(), roundsRun);
            if (stats.getAnchorSearches() > 0) {
                log.info("Anchor expansion: {} searches, {} failed, {} domains skipped",
                        stats.getAnchorSearches(), stats.getAnchorFailures(), ledger.getSkippedDomains());
            }
            if (ledger.getFilteredOut() > 0) {
                log.info("Filtered out {} results (phrase or relevance)", ledger.getFilteredOut());
            }
            if (planner.getConfig().isTrackMetrics()) {
                log.info("📊 Recall metrics: {}", planner.getMetricsSummary());
            }

            return SearchRunReport.builder()
                    .summary(summary)
                    .results(ledger.snapshot())
                    .routing(routing)
                    .searchType(searchType)
                    .build();
        }

        /**
         * @return false if the round had no task to run
         */
        private boolean runRound(int round, SearchStrategy strategy, RoutingDecision routing, SearchType searchType) {
            transition(RunState.DISPATCH);

            if (round >= 2) {
                List<FallbackStrategy> fallbacks = planner.getFallbackStrategies(searchType, round);
                if (!fallbacks.isEmpty()) {
                    log.info("Round {} fallback strategies: {}", round,
                            fallbacks.stream().map(FallbackStrategy::name).toList());
                }
            }

            String roundQuery = round >= 2 ? collapse(query.getWebQuery().replace("\"", "")) : query.getWebQuery();
            List<Callable<TaskOutcome>> tasks = new ArrayList<>();

            if (query.getScope().includesWeb()) {
                for (String code : selectEngines(round, strategy, routing)) {
                    EngineDescriptor engine = engineRegistry.find(code).orElse(null);
                    if (engine == null) {
                        continue;
                    }
                    List<String> variants = new ArrayList<>(queryVariants(roundQuery, query.getLevel()));
                    Set<String> alreadyRun = variantsRun.computeIfAbsent(code, c -> new LinkedHashSet<>());
                    variants.removeAll(alreadyRun);
                    if (variants.isEmpty()) {
                        continue;
                    }
                    alreadyRun.addAll(variants);
                    tasks.add(guarded(code, () -> runEngine(engine, variants, strategy, searchType)));
                }
            }
            if (round == 1 && query.getScope().includesCorpus()) {
                tasks.add(guarded(CorpusSearcher.SOURCE_CODE,
                        () -> ledger.merge(corpusSearcher.search(query), CorpusSearcher.SOURCE_CODE)));
            }

            if (tasks.isEmpty()) {
                return false;
            }
            log.info("Round {}: dispatching {} tasks (engines={}, expansion={}, relaxation={})",
                    round, tasks.size(), strategy.getEnginesToUse(), strategy.isUseExpansion(),
                    strategy.getRelaxationLevel());

            CompletionService<TaskOutcome> completion = new ExecutorCompletionService<>(engineExecutor);
            for (Callable<TaskOutcome> task : tasks) {
                completion.submit(task);
            }

            transition(RunState.STREAMING);
            int total = tasks.size();
            for (int completed = 1; completed <= total; completed++) {
                TaskOutcome outcome = take(completion);
                if (outcome.failed()) {
                    stats.engineFailed();
                    log.warn("⚠️ {} failed: {}", outcome.source(), outcome.error().getMessage());
                } else {
                    stats.engineSucceeded();
                    if (!outcome.accepted().isEmpty()) {
                        emit(SearchEvent.results(outcome.source(), outcome.accepted()));
                    }
                    log.info("{} finished with {} new results", outcome.source(), outcome.accepted().size());
                }
                emit(SearchEvent.progress(SearchEvent.Progress.builder()
                        .completed(completed)
                        .total(total)
                        .percent(completed * 100.0 / total)
                        .resultsCount(stats.getTotalResults())
                        .uniqueUrls(ledger.uniqueCount())
                        .round(round)
                        .build()));
            }
            return true;
        }

        /**
         * Engines for one round. Explicitly requested codes are kept as given, narrowed to routed L1
         * engines when the strategy asks for primary engines only. Without a request, the configured
         * defaults are combined with routed engines. Requested codes that are not registered count as
         * failed once.
         */
        private Set<String> selectEngines(int round, SearchStrategy strategy, RoutingDecision routing) {
            EngineSets routed = routing.getEngines();
            boolean primaryOnly = strategy.getEnginesToUse() == EngineSelection.PRIMARY;
            Set<String> selected = new LinkedHashSet<>();

            if (!command.getEngines().isEmpty()) {
                Set<String> requested = new LinkedHashSet<>(command.getEngines());
                if (primaryOnly) {
                    requested.stream().filter(routed.getL1()::contains).forEach(selected::add);
                }
                if (selected.isEmpty()) {
                    selected.addAll(requested);
                }
                if (round == 1) {
                    for (String code : requested) {
                        if (!engineRegistry.isRegistered(code)) {
                            stats.engineFailed();
                            log.warn("⚠️ Engine {} is not registered", code);
                        }
                    }
                }
            } else if (primaryOnly) {
                routed.getL1().stream().filter(engineRegistry::isRegistered).forEach(selected::add);
                if (selected.isEmpty()) {
                    properties.getDefaultEngines().stream()
                            .limit(properties.getPrimaryEngineCount())
                            .forEach(selected::add);
                }
            } else {
                selected.addAll(properties.getDefaultEngines());
                routed.union().stream().filter(engineRegistry::isRegistered).forEach(selected::add);
            }

            selected.removeIf(code -> !engineRegistry.isRegistered(code));
            return selected;
        }

        private List<SearchResult> runEngine(EngineDescriptor engine, List<String> variants,
                                             SearchStrategy strategy, SearchType searchType)
                throws InterruptedException {
            String code = engine.getCode();
            int cap = Math.min(engine.getMaxResults(), planner.getConfig().getMaxResultsPerEngine());

            List<RawResult> raw = new ArrayList<>();
            try {
                rateLimiter.waitIfNeeded(code);
                for (String variant : variants) {
                    List<RawResult> page = engine.getAdapter().search(variant, cap);
                    if (page != null) {
                        raw.addAll(page);
                    }
                }
            } catch (RuntimeException e) {
                rateLimiter.reportError(code);
                throw e;
            }
            rateLimiter.reportSuccess(code);
            stats.addRawResults(raw.size());

            List<SearchResult> accepted = new ArrayList<>(ledger.merge(relevant(raw, code, strategy, searchType), code));
            if ((query.getLevel() >= 3 || query.isForceAnchor()) && !accepted.isEmpty()) {
                accepted.addAll(expandAnchors(accepted, strategy, searchType));
            }
            return accepted;
        }

        /**
         * Drops results the planner scores below the round's filter threshold (or the configured
         * confidence floor, whichever is higher). A round with filtering disabled keeps everything.
         */
        private List<RawResult> relevant(List<RawResult> raw, String source, SearchStrategy strategy,
                                         SearchType searchType) {
            if (!strategy.isFilteringEnabled() || raw.isEmpty()) {
                return raw;
            }
            double threshold = Math.max(strategy.getFilterThreshold(), planner.getConfig().getConfidenceThreshold());
            List<RawResult> kept = new ArrayList<>(raw.size());
            for (RawResult candidate : raw) {
                SearchResult scored = SearchResult.builder()
                        .url(candidate.getUrl())
                        .title(candidate.getTitle())
                        .snippet(candidate.getSnippet())
                        .metadata(candidate.getMetadata())
                        .build();
                double score = planner.scoreResult(scored, searchType, queryTerms);
                if (score < threshold) {
                    log.debug("Filtered out {} from {}: relevance {} below {}", candidate.getUrl(), source, score, threshold);
                } else {
                    kept.add(candidate);
                }
            }
            int dropped = raw.size() - kept.size();
            if (dropped > 0) {
                ledger.recordFilteredOut(dropped);
            }
            return kept;
        }

        /**
         * Issues one anchor search per unseen domain among {@code accepted} and merges what comes back.
         */
        private List<SearchResult> expandAnchors(List<SearchResult> accepted, SearchStrategy strategy,
                                                 SearchType searchType) {
            Set<String> anchorCategories = properties.getAnchorCategories();
            List<Future<List<RawResult>>> pending = new ArrayList<>();

            for (SearchResult result : accepted) {
                boolean eligible = query.isForceAnchor() || anchorCategories.contains(result.getCategory());
                if (!eligible) {
                    continue;
                }
                String domain = UrlNormalizer.domainOf(result.getUrl());
                if (!ledger.claimDomain(domain)) {
                    continue;
                }
                String anchorQuery = anchorQuery(domain, query.getWebQuery());
                FutureTask<List<RawResult>> task = new FutureTask<>(
                        () -> anchorSearcher.search(anchorQuery, properties.getAnchorMaxResults()));
                anchorExecutor.execute(task);
                pending.add(task);
            }

            List<RawResult> anchorResults = new ArrayList<>();
            for (Future<List<RawResult>> future : pending) {
                try {
                    List<RawResult> found = future.get();
                    stats.anchorSearched(false);
                    if (found != null) {
                        anchorResults.addAll(found);
                    }
                } catch (ExecutionException e) {
                    stats.anchorSearched(true);
                    log.warn("⚠️ Anchor search failed: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while waiting for anchor searches");
                    break;
                }
            }

            if (anchorResults.isEmpty()) {
                return List.of();
            }
            stats.addRawResults(anchorResults.size());
            List<SearchResult> merged = ledger.merge(
                    relevant(anchorResults, ANCHOR_SOURCE, strategy, searchType), ANCHOR_SOURCE);
            log.debug("Anchor expansion over {} domains added {} results", pending.size(), merged.size());
            return merged;
        }

        private Callable<TaskOutcome> guarded(String source, Callable<List<SearchResult>> work) {
            return () -> {
                try {
                    return new TaskOutcome(source, work.call(), null);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return new TaskOutcome(source, List.of(), e);
                } catch (Exception e) {
                    return new TaskOutcome(source, List.of(), e);
                }
            };
        }

        private TaskOutcome take(CompletionService<TaskOutcome> completion) {
            try {
                return completion.take().get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while streaming results", e);
            } catch (ExecutionException e) {
                return new TaskOutcome("unknown", List.of(), e.getCause());
            }
        }

        private SearchEvent.Summary summarize(int rounds, SearchType searchType) {
            return SearchEvent.Summary.builder()
                    .totalResults(stats.getTotalResults())
                    .uniqueUrls(ledger.uniqueCount())
                    .elapsedTime((System.nanoTime() - startNanos) / 1_000_000_000.0)
                    .enginesSucceeded(stats.getEnginesSucceeded())
                    .enginesFailed(stats.getEnginesFailed())
                    .successRatio(stats.successRatio())
                    .indexedCount(writer.getIndexedCount())
                    .rounds(rounds)
                    .searchType(searchType.value())
                    .build();
        }

        private void emitComplete(SearchEvent.Summary summary) {
            if (completeEmitted) {
                return;
            }
            completeEmitted = true;
            emit(SearchEvent.complete(summary));
        }

        private void emit(SearchEvent event) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Event listener failed on {} event: {}", event.getType().value(), e.getMessage());
            }
        }

        private void transition(RunState next) {
            log.debug("Run state {} -> {}", state, next);
            state = next;
        }
    }
}
