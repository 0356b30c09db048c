package com.purchasingpower.fanout.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Pinecone vector sink settings ({@code app.sinks.vector.*}). Disabled unless configured.
 */
@Data
@ConfigurationProperties(prefix = "app.sinks.vector")
public class VectorSinkProperties {

    private boolean enabled = false;
    private String apiKey;
    private String indexName = "search-results";
    private String namespace = "";
    private int upsertBatchSize = 100;
}
