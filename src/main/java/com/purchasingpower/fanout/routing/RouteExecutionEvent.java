package com.purchasingpower.fanout.routing;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Event yielded by {@link QueryOperatorRouter#executeRoutes(RoutingDecision)}.
 *
 * <p>A {@link Type#DEFAULT} event carries no route and tells the caller to run an unrouted search.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RouteExecutionEvent {

    Type type;
    String query;
    ModuleRoute route;
    String message;

    public enum Type {
        DEFAULT,
        ROUTE_EXECUTION
    }

    public boolean isDefault() {
        return type == Type.DEFAULT;
    }
}
