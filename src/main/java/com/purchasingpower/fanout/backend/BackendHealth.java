package com.purchasingpower.fanout.backend;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Availability flag and call counters for one backend. The flag is only flipped by the router
 * while holding its state lock; counters are independent atomics.
 */
public final class BackendHealth {

    private final BackendRole role;
    private final String name;
    private final AtomicLong calls = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private volatile boolean available;

    BackendHealth(BackendRole role, String name, boolean available) {
        this.role = role;
        this.name = name;
        this.available = available;
    }

    public BackendRole getRole() {
        return role;
    }

    public String getName() {
        return name;
    }

    public boolean isAvailable() {
        return available;
    }

    void setAvailable(boolean available) {
        this.available = available;
    }

    public long getCalls() {
        return calls.get();
    }

    public long getFailures() {
        return failures.get();
    }

    void recordCall() {
        calls.incrementAndGet();
    }

    void recordFailure() {
        failures.incrementAndGet();
    }
}
