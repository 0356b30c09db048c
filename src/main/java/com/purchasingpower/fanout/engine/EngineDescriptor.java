package com.purchasingpower.fanout.engine;

import lombok.Builder;
import lombok.Value;

/**
 * Registry entry for one engine: its code, display name, result cap and adapter.
 */
@Value
@Builder
public class EngineDescriptor {

    String code;
    String name;
    int maxResults;
    EngineAdapter adapter;
}
