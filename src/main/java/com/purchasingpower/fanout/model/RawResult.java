package com.purchasingpower.fanout.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A result exactly as an engine adapter returned it, before normalization and dedup.
 */
@Value
@Builder
public class RawResult {

    String url;
    String title;
    String snippet;
    @Singular("metadataEntry")
    Map<String, Object> metadata;
}
