package com.purchasingpower.fanout.backend;

/**
 * Value returned by a routed call, annotated with the backend that served it.
 *
 * @param fallback true when the first-choice backend failed and this value came from the other one
 */
public record BackendResult<T>(T value, String backend, BackendRole role, boolean fallback) {
}
