package com.purchasingpower.fanout.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.fanout.model.SearchResult;
import com.purchasingpower.fanout.orchestrator.SearchEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Search response: run summary plus every result, highest quality first.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchResponse {

    private boolean success;
    private String error;
    private String searchType;
    private SearchEvent.Summary summary;

    @Builder.Default
    private List<SearchResult> results = new ArrayList<>();

    public static SearchResponse error(String error) {
        return SearchResponse.builder()
                .success(false)
                .error(error)
                .build();
    }
}
