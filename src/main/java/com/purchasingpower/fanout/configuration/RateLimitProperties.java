package com.purchasingpower.fanout.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Per-engine throttling settings ({@code app.rate-limit.*}).
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.rate-limit")
public class RateLimitProperties {

    /** Starting gap between two calls to the same engine. */
    private Duration baseDelay = Duration.ofMillis(100);

    /** Upper bound the delay can back off to after repeated errors. */
    private Duration maxDelay = Duration.ofSeconds(10);

    /** Lower bound the delay can shrink to after repeated successes. */
    private Duration minDelay = Duration.ofMillis(50);

    @Min(1)
    private int burstCapacity = 10;

    /** Tokens restored per {@link #refillPeriod}. */
    @Min(1)
    private int refillTokens = 10;

    private Duration refillPeriod = Duration.ofSeconds(1);
}
