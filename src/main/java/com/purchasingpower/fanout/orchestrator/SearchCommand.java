package com.purchasingpower.fanout.orchestrator;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One search request as the orchestrator receives it. Unset level and scope fall back to the
 * configured defaults; an empty engine list means "use configured and routed engines".
 */
@Value
@Builder
public class SearchCommand {

    String query;

    @Singular
    List<String> engines;

    Integer level;
    SearchScope scope;
}
