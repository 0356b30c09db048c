package com.purchasingpower.fanout.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the Neo4j primary backend ({@code app.neo4j.*}).
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.neo4j")
public class Neo4jProperties {

    @NotBlank
    private String uri = "bolt://localhost:7687";

    @NotBlank
    private String username = "neo4j";

    private String password = "password";

    /** Dimension of the document embedding vector index. */
    private int vectorDimensions = 1024;
}
