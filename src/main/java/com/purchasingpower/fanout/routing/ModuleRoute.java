package com.purchasingpower.fanout.routing;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Routing record for a single matched operator: which handler module should see it and why.
 */
@Value
@Builder
public class ModuleRoute {

    /** Hierarchical module path, e.g. {@code iv.LOCATION.a.KNOWN_UNKNOWN.FORMAT.filetypes}. */
    String modulePath;
    String operator;
    List<String> values;
    OperatorFamily family;
    LocationDimension dimension;
}
