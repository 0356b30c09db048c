package com.purchasingpower.fanout.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Unified backend router settings ({@code app.backend.*}).
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.backend")
public class BackendProperties {

    /** Route calls to the primary (Neo4j) backend first when it is available. */
    private boolean preferPrimary = true;

    /** Mirror successful writes to the non-serving backend. */
    private boolean dualIndexing = true;

    @Min(1000)
    private long healthProbeIntervalMs = 30_000;

    @NotBlank
    private String defaultZone = "default";

    @Min(1)
    private int writerThreads = 2;
}
