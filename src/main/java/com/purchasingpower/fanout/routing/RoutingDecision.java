package com.purchasingpower.fanout.routing;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Full routing output for one query.
 */
@Value
@Builder
public class RoutingDecision {

    String query;
    DetectedOperators detected;
    EngineSets engines;
    List<ModuleRoute> routes;
    Instant timestamp;

    public boolean isHasRouting() {
        return !routes.isEmpty();
    }
}
