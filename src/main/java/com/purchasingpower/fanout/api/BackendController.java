package com.purchasingpower.fanout.api;

import com.purchasingpower.fanout.backend.BackendHealthReport;
import com.purchasingpower.fanout.backend.BackendStats;
import com.purchasingpower.fanout.backend.UnifiedBackendRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Backend router health, counters and manual switching.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/backends")
@RequiredArgsConstructor
public class BackendController {

    private final UnifiedBackendRouter router;

    /**
     * GET /api/v1/backends/health
     */
    @GetMapping("/health")
    public ResponseEntity<BackendHealthReport> health() {
        try {
            return ResponseEntity.ok(router.healthCheck());
        } catch (Exception e) {
            log.error("Health check failed", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * GET /api/v1/backends/stats
     */
    @GetMapping("/stats")
    public ResponseEntity<BackendStats> stats() {
        return ResponseEntity.ok(router.getStats());
    }

    /**
     * POST /api/v1/backends/switch?backend=secondary
     */
    @PostMapping("/switch")
    public ResponseEntity<Map<String, String>> switchBackend(@RequestParam String backend) {
        try {
            router.switchBackend(backend);
            return ResponseEntity.ok(Map.of("activeBackend", router.activeBackendName()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
