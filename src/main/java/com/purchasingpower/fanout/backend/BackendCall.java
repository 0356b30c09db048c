package com.purchasingpower.fanout.backend;

/**
 * One routed operation bound to its arguments, applied to whichever backend the router picks.
 */
@FunctionalInterface
public interface BackendCall<T> {

    T apply(SearchBackend backend);
}
