package com.purchasingpower.fanout.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.fanout.backend.BackendUnavailableException;
import com.purchasingpower.fanout.model.SearchResult;
import com.purchasingpower.fanout.orchestrator.QuerySyntaxException;
import com.purchasingpower.fanout.orchestrator.SearchCommand;
import com.purchasingpower.fanout.orchestrator.SearchEvent;
import com.purchasingpower.fanout.orchestrator.SearchRunReport;
import com.purchasingpower.fanout.orchestrator.SearchScope;
import com.purchasingpower.fanout.orchestrator.StreamingSearchOrchestrator;
import com.purchasingpower.fanout.recall.RecallMetricsSummary;
import com.purchasingpower.fanout.recall.RecallStrategyPlanner;
import com.purchasingpower.fanout.recall.SearchType;
import com.purchasingpower.fanout.routing.QueryOperatorRouter;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests for SearchController. The orchestrator and stream service are mocked; routing
 * previews use the real operator router.
 */
@WebMvcTest(SearchController.class)
@Import(QueryOperatorRouter.class)
class SearchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private StreamingSearchOrchestrator orchestrator;

    @MockBean
    private SearchStreamService streamService;

    @MockBean
    private RecallStrategyPlanner recallPlanner;

    private static SearchRunReport report() {
        SearchResult result = SearchResult.builder()
                .url("https://example.com/a")
                .title("Example result")
                .snippet("Example snippet text")
                .foundBy(new LinkedHashSet<>(List.of("BR", "TV")))
                .qualityScore(25)
                .build();
        return SearchRunReport.builder()
                .searchType(SearchType.GENERAL)
                .summary(SearchEvent.Summary.builder()
                        .totalResults(2)
                        .uniqueUrls(1)
                        .enginesSucceeded(2)
                        .successRatio(1.0)
                        .rounds(1)
                        .searchType("general")
                        .build())
                .results(List.of(result))
                .build();
    }

    @Test
    void search_shouldReturnSummaryAndResults() throws Exception {
        // Given
        when(orchestrator.execute(any(SearchCommand.class))).thenReturn(report());
        SearchRequest request = SearchRequest.builder()
                .query("acme merger")
                .engines(List.of("br, tv", "BR"))
                .level(2)
                .scope("both")
                .build();

        // When / Then
        mockMvc.perform(post("/api/v1/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.searchType").value("general"))
                .andExpect(jsonPath("$.summary.uniqueUrls").value(1))
                .andExpect(jsonPath("$.results[0].url").value("https://example.com/a"))
                .andExpect(jsonPath("$.results[0].foundBy[1]").value("TV"));

        ArgumentCaptor<SearchCommand> captor = ArgumentCaptor.forClass(SearchCommand.class);
        verify(orchestrator).execute(captor.capture());
        assertThat(captor.getValue().getEngines()).containsExactly("BR", "TV");
        assertThat(captor.getValue().getScope()).isEqualTo(SearchScope.BOTH);
        assertThat(captor.getValue().getLevel()).isEqualTo(2);
    }

    @Test
    void search_withInvalidQuery_shouldReturnBadRequest() throws Exception {
        when(orchestrator.execute(any(SearchCommand.class))).thenThrow(new QuerySyntaxException("Query is required"));

        mockMvc.perform(post("/api/v1/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Query is required"));
    }

    @Test
    void search_withUnknownScope_shouldReturnBadRequestWithoutRunning() throws Exception {
        mockMvc.perform(post("/api/v1/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"acme\", \"scope\": \"galaxy\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown scope: galaxy"));

        verify(orchestrator, never()).execute(any(SearchCommand.class));
    }

    @Test
    void search_withNoBackend_shouldReturnServiceUnavailable() throws Exception {
        when(orchestrator.execute(any(SearchCommand.class)))
                .thenThrow(new BackendUnavailableException("No backend available"));

        mockMvc.perform(post("/api/v1/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"acme\", \"scope\": \"corpus\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void stream_withUnknownScope_shouldAnswerWithRejectedStream() throws Exception {
        when(streamService.rejected(any())).thenReturn(new SseEmitter());

        mockMvc.perform(get("/api/v1/search/stream")
                        .param("query", "acme")
                        .param("scope", "galaxy"))
                .andExpect(status().isOk());

        verify(streamService).rejected(contains("galaxy"));
        verify(streamService, never()).stream(any());
    }

    @Test
    void routing_shouldPreviewRoutesAndEvents() throws Exception {
        mockMvc.perform(get("/api/v1/search/routing").param("query", "p:john c:acme"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.routing.hasRouting").value(true))
                .andExpect(jsonPath("$.routing.engines.l1").isNotEmpty())
                .andExpect(jsonPath("$.events.length()").value(2));
    }

    @Test
    void routing_withBlankQuery_shouldReturnBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/search/routing").param("query", " "))
                .andExpect(status().isBadRequest());
    }

    @Test
    void recallMetrics_shouldExposePlannerSummary() throws Exception {
        when(recallPlanner.getMetricsSummary()).thenReturn(RecallMetricsSummary.builder()
                .totalSearches(4)
                .totalResults(40)
                .uniqueResults(12)
                .fallbackRate(0.5)
                .expansionRate(0.25)
                .averageRounds(2.0)
                .build());

        mockMvc.perform(get("/api/v1/search/recall-metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_searches").value(4))
                .andExpect(jsonPath("$.unique_results").value(12))
                .andExpect(jsonPath("$.average_rounds").value(2.0));
    }
}
