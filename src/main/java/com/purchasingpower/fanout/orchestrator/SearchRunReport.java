package com.purchasingpower.fanout.orchestrator;

import com.purchasingpower.fanout.model.SearchResult;
import com.purchasingpower.fanout.recall.SearchType;
import com.purchasingpower.fanout.routing.RoutingDecision;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a finished run: the completion summary and all results, best first.
 */
@Value
@Builder
public class SearchRunReport {

    SearchEvent.Summary summary;
    List<SearchResult> results;
    RoutingDecision routing;
    SearchType searchType;
}
