package com.purchasingpower.fanout.engine;

/**
 * Per-engine throttle. Every engine call waits for clearance first and reports its outcome
 * afterwards so the limiter can adapt.
 */
public interface RateLimiter {

    void waitIfNeeded(String engineCode) throws InterruptedException;

    void reportSuccess(String engineCode);

    void reportError(String engineCode);
}
