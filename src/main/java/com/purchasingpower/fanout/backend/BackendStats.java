package com.purchasingpower.fanout.backend;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Snapshot of router counters.
 *
 * @see UnifiedBackendRouter#getStats()
 */
@Value
@Builder
public class BackendStats {

    Map<String, BackendCounters> backends;
    long fallbacks;
    long dualIndexed;
    String activeBackend;

    /** Fallbacks as a percentage of all served calls. */
    double fallbackRate;

    public record BackendCounters(BackendRole role, boolean available, long calls, long failures) {
    }
}
