package com.purchasingpower.fanout.api;

import com.purchasingpower.fanout.routing.RouteExecutionEvent;
import com.purchasingpower.fanout.routing.RoutingDecision;

import java.util.List;

/**
 * Routing preview: the decision for a query and the events its routes would execute.
 */
public record RoutingResponse(RoutingDecision routing, List<RouteExecutionEvent> events) {
}
