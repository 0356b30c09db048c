package com.purchasingpower.fanout.api;

import com.purchasingpower.fanout.backend.BackendUnavailableException;
import com.purchasingpower.fanout.orchestrator.QuerySyntaxException;
import com.purchasingpower.fanout.orchestrator.SearchCommand;
import com.purchasingpower.fanout.orchestrator.SearchRunReport;
import com.purchasingpower.fanout.orchestrator.StreamingSearchOrchestrator;
import com.purchasingpower.fanout.recall.RecallMetricsSummary;
import com.purchasingpower.fanout.recall.RecallStrategyPlanner;
import com.purchasingpower.fanout.routing.QueryOperatorRouter;
import com.purchasingpower.fanout.routing.RouteExecutionEvent;
import com.purchasingpower.fanout.routing.RoutingDecision;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * REST controller for search runs.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/search")
@RequiredArgsConstructor
public class SearchController {

    private final StreamingSearchOrchestrator orchestrator;
    private final SearchStreamService streamService;
    private final QueryOperatorRouter operatorRouter;
    private final RecallStrategyPlanner recallPlanner;

    /**
     * Blocking search.
     *
     * POST /api/v1/search
     */
    @PostMapping
    public ResponseEntity<SearchResponse> search(@RequestBody SearchRequest request) {
        try {
            SearchCommand command = SearchCommands.from(
                    request.getQuery(), request.getEngines(), request.getLevel(), request.getScope());

            log.info("Search: {}", request.getQuery());
            SearchRunReport report = orchestrator.execute(command);

            return ResponseEntity.ok(SearchResponse.builder()
                    .success(true)
                    .searchType(report.getSearchType().value())
                    .summary(report.getSummary())
                    .results(report.getResults())
                    .build());

        } catch (QuerySyntaxException e) {
            return ResponseEntity.badRequest().body(SearchResponse.error(e.getMessage()));
        } catch (BackendUnavailableException e) {
            log.error("Search failed, no backend available", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(SearchResponse.error("Backend unavailable: " + e.getMessage()));
        } catch (Exception e) {
            log.error("Search failed", e);
            return ResponseEntity.internalServerError()
                    .body(SearchResponse.error("Search failed: " + e.getMessage()));
        }
    }

    /**
     * Streaming search over Server-Sent Events. Each event's data is a JSON search event.
     *
     * GET /api/v1/search/stream?query=..&engines=..&level=..&scope=..
     */
    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestParam(required = false) String query,
                             @RequestParam(required = false) List<String> engines,
                             @RequestParam(required = false) Integer level,
                             @RequestParam(required = false) String scope) {
        try {
            return streamService.stream(SearchCommands.from(query, engines, level, scope));
        } catch (QuerySyntaxException e) {
            return streamService.rejected(e.getMessage());
        }
    }

    /**
     * Routing preview.
     *
     * GET /api/v1/search/routing?query=..
     */
    @GetMapping("/routing")
    public ResponseEntity<RoutingResponse> routing(@RequestParam(required = false) String query) {
        if (query == null || query.isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        try {
            RoutingDecision decision = operatorRouter.routeQuery(query);
            List<RouteExecutionEvent> events = new ArrayList<>();
            Iterator<RouteExecutionEvent> iterator = operatorRouter.executeRoutes(decision);
            iterator.forEachRemaining(events::add);
            return ResponseEntity.ok(new RoutingResponse(decision, events));
        } catch (Exception e) {
            log.error("Routing failed for '{}'", query, e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * Recall planner counters accumulated over every run since startup.
     *
     * GET /api/v1/search/recall-metrics
     */
    @GetMapping("/recall-metrics")
    public ResponseEntity<RecallMetricsSummary> recallMetrics() {
        return ResponseEntity.ok(recallPlanner.getMetricsSummary());
    }
}
