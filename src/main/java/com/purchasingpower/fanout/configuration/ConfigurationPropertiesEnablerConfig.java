package com.purchasingpower.fanout.configuration;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the {@code app.*} property classes for binding and validation.
 *
 * <p>Engine adapters register their own nested config classes, since they only exist when
 * the engine is enabled.
 */
@Configuration
@EnableConfigurationProperties({
    SearchProperties.class,
    BackendProperties.class,
    Neo4jProperties.class,
    RateLimitProperties.class,
    VectorSinkProperties.class
})
public class ConfigurationPropertiesEnablerConfig {
}
