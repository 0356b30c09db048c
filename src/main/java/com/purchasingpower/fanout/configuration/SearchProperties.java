package com.purchasingpower.fanout.configuration;

import com.purchasingpower.fanout.orchestrator.SearchScope;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Search run settings ({@code app.search.*}).
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.search")
public class SearchProperties {

    /** Engines queried when a request names none. */
    private List<String> defaultEngines = new ArrayList<>(List.of("BR", "TV"));

    /** How many of the default engines count as primary when routing yields no L1 engine. */
    @Min(1)
    private int primaryEngineCount = 2;

    @Min(1)
    @Max(3)
    private int defaultLevel = 2;

    @NotNull
    private SearchScope defaultScope = SearchScope.WEB;

    /** Engine that serves {@code site:<domain> anchor:"<query>"} follow-ups. */
    @NotBlank
    private String anchorEngine = "BR";

    @Min(1)
    private int anchorMaxResults = 10;

    /** Categories whose domains are expanded at level 3. */
    private Set<String> anchorCategories = new LinkedHashSet<>(
            List.of("corporate_registry", "news", "social_media", "blog"));

    /** Distinct domains a single run may expand. */
    @Min(0)
    private int anchorMaxDomains = 50;

    @Min(1)
    private int corpusLimit = 50;

    @NotBlank
    private String userId = "system";

    @NotBlank
    private String projectId = "default";

    @Valid
    private Writer writer = new Writer();

    @Valid
    private Pools pools = new Pools();

    @Data
    public static class Writer {

        @Min(1)
        private int batchSize = 5;

        private Duration flushInterval = Duration.ofSeconds(2);

        private Duration pollInterval = Duration.ofMillis(500);

        @Min(1)
        private int queueCapacity = 1000;

        private Duration offerTimeout = Duration.ofSeconds(1);

        private Duration shutdownTimeout = Duration.ofSeconds(2);
    }

    @Data
    public static class Pools {

        @Min(1)
        private int engineThreads = 8;

        @Min(1)
        private int anchorThreads = 4;

        @Min(1)
        private int streamThreads = 4;
    }
}
