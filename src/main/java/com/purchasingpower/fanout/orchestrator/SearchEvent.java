package com.purchasingpower.fanout.orchestrator;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import com.purchasingpower.fanout.model.SearchResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Locale;

/**
 * Event emitted while a search run streams.
 *
 * Event types:
 * - RESULTS: new results from one source ({@code engine}, {@code count}, {@code data})
 * - PROGRESS: a task finished ({@code progress})
 * - COMPLETE: the run finished, emitted exactly once ({@code summary})
 * - ERROR: the run could not continue ({@code message})
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchEvent {

    private EventType type;
    private String engine;
    private Integer count;
    private List<SearchResult> data;
    private Progress progress;
    private Summary summary;
    private String message;

    public enum EventType {
        RESULTS,
        PROGRESS,
        COMPLETE,
        ERROR;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Progress {
        private int completed;
        private int total;
        private double percent;
        private long resultsCount;
        private int uniqueUrls;
        private int round;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {
        private long totalResults;
        private int uniqueUrls;
        private double elapsedTime;
        /** Engine tasks that completed, counted once per engine per round. */
        private int enginesSucceeded;
        /** Engine tasks that threw, counted per round, plus requested engines that are not registered, counted once. */
        private int enginesFailed;
        private double successRatio;
        private long indexedCount;
        private int rounds;
        private String searchType;
    }

    public static SearchEvent results(String engine, List<SearchResult> data) {
        return SearchEvent.builder()
                .type(EventType.RESULTS)
                .engine(engine)
                .count(data.size())
                .data(data)
                .build();
    }

    public static SearchEvent progress(Progress progress) {
        return SearchEvent.builder()
                .type(EventType.PROGRESS)
                .progress(progress)
                .build();
    }

    public static SearchEvent complete(Summary summary) {
        return SearchEvent.builder()
                .type(EventType.COMPLETE)
                .summary(summary)
                .build();
    }

    public static SearchEvent error(String message) {
        return SearchEvent.builder()
                .type(EventType.ERROR)
                .message(message)
                .build();
    }
}
