package com.purchasingpower.fanout.api;

import com.purchasingpower.fanout.backend.BackendHealthReport;
import com.purchasingpower.fanout.backend.BackendRole;
import com.purchasingpower.fanout.backend.BackendStats;
import com.purchasingpower.fanout.backend.UnifiedBackendRouter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(BackendController.class)
class BackendControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private UnifiedBackendRouter router;

    @Test
    void health_shouldReportEachBackend() throws Exception {
        when(router.healthCheck()).thenReturn(new BackendHealthReport(Map.of(
                "neo4j", new BackendHealthReport.BackendStatus(BackendRole.PRIMARY, true, "healthy"),
                "memory", new BackendHealthReport.BackendStatus(BackendRole.SECONDARY, false, "unavailable")),
                "neo4j"));

        mockMvc.perform(get("/api/v1/backends/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activeBackend").value("neo4j"))
                .andExpect(jsonPath("$.backends.neo4j.status").value("healthy"))
                .andExpect(jsonPath("$.backends.memory.available").value(false));
    }

    @Test
    void stats_shouldExposeCounters() throws Exception {
        when(router.getStats()).thenReturn(BackendStats.builder()
                .backends(Map.of("neo4j", new BackendStats.BackendCounters(BackendRole.PRIMARY, true, 4, 2)))
                .fallbacks(2)
                .dualIndexed(1)
                .activeBackend("neo4j")
                .fallbackRate(50.0)
                .build());

        mockMvc.perform(get("/api/v1/backends/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fallbacks").value(2))
                .andExpect(jsonPath("$.fallbackRate").value(50.0))
                .andExpect(jsonPath("$.backends.neo4j.failures").value(2));
    }

    @Test
    void switchBackend_shouldReturnNewActiveBackend() throws Exception {
        when(router.activeBackendName()).thenReturn("memory");

        mockMvc.perform(post("/api/v1/backends/switch").param("backend", "secondary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activeBackend").value("memory"));

        verify(router).switchBackend("secondary");
    }

    @Test
    void switchBackend_withUnknownName_shouldReturnBadRequest() throws Exception {
        doThrow(new IllegalArgumentException("Unknown backend: tertiary")).when(router).switchBackend("tertiary");

        mockMvc.perform(post("/api/v1/backends/switch").param("backend", "tertiary"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown backend: tertiary"));
    }
}
