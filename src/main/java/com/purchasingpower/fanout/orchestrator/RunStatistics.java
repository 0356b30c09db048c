package com.purchasingpower.fanout.orchestrator;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters of one search run. Engine success and failure are counted per completed task.
 */
public class RunStatistics {

    private final AtomicLong totalResults = new AtomicLong();
    private final AtomicInteger enginesSucceeded = new AtomicInteger();
    private final AtomicInteger enginesFailed = new AtomicInteger();
    private final AtomicInteger anchorSearches = new AtomicInteger();
    private final AtomicInteger anchorFailures = new AtomicInteger();

    void addRawResults(int count) {
        totalResults.addAndGet(count);
    }

    void engineSucceeded() {
        enginesSucceeded.incrementAndGet();
    }

    void engineFailed() {
        enginesFailed.incrementAndGet();
    }

    void anchorSearched(boolean failed) {
        anchorSearches.incrementAndGet();
        if (failed) {
            anchorFailures.incrementAndGet();
        }
    }

    public long getTotalResults() {
        return totalResults.get();
    }

    public int getEnginesSucceeded() {
        return enginesSucceeded.get();
    }

    public int getEnginesFailed() {
        return enginesFailed.get();
    }

    public int getAnchorSearches() {
        return anchorSearches.get();
    }

    public int getAnchorFailures() {
        return anchorFailures.get();
    }

    /**
     * Succeeded tasks over completed tasks, 0 when nothing ran.
     */
    public double successRatio() {
        int succeeded = enginesSucceeded.get();
        int total = succeeded + enginesFailed.get();
        return total == 0 ? 0.0 : (double) succeeded / total;
    }
}
