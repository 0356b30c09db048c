package com.purchasingpower.fanout.backend;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically probes both backends so a failing one is demoted before callers hit it,
 * and a recovered one is put back in rotation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BackendHealthProbe {

    private final UnifiedBackendRouter router;

    @Scheduled(fixedDelayString = "${app.backend.health-probe-interval-ms:30000}",
            initialDelayString = "${app.backend.health-probe-interval-ms:30000}")
    public void probe() {
        BackendHealthReport report = router.healthCheck();
        log.debug("Backend health: {} (active={})", report.backends(), report.activeBackend());
    }
}
