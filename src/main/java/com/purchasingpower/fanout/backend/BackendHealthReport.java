package com.purchasingpower.fanout.backend;

import java.util.Map;

/**
 * Result of one health probe round.
 *
 * @param backends status per backend name: {@code healthy}, {@code recovered}, {@code unhealthy: <cause>}
 *                 or {@code unavailable}
 */
public record BackendHealthReport(Map<String, BackendStatus> backends, String activeBackend) {

    public record BackendStatus(BackendRole role, boolean available, String status) {
    }
}
