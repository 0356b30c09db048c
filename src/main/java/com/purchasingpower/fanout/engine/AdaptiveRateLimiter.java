package com.purchasingpower.fanout.engine;

import com.purchasingpower.fanout.configuration.RateLimitProperties;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Adaptive delay plus token bucket, kept separately for each engine code.
 *
 * <p>The spacing between calls doubles on every reported error (capped at the max delay) and
 * shrinks by 10% on every success (floored at the min delay). The token bucket bounds bursts
 * independently of the adaptive spacing. Decisions for one code are serialized by that code's
 * lock; the actual sleep happens outside it.
 *
 * @since 1.0.0
 */
@Slf4j
public class AdaptiveRateLimiter implements RateLimiter {

    private static final double BACKOFF_FACTOR = 2.0;
    private static final double RECOVERY_FACTOR = 0.9;

    private final RateLimitProperties properties;
    private final Map<String, EngineThrottle> throttles = new ConcurrentHashMap<>();

    public AdaptiveRateLimiter(RateLimitProperties properties) {
        this.properties = properties;
    }

    @Override
    public void waitIfNeeded(String engineCode) throws InterruptedException {
        EngineThrottle throttle = throttle(engineCode);
        long waitNanos;

        throttle.lock.lock();
        try {
            long now = System.nanoTime();
            long earliest = throttle.lastCallNanos + throttle.delayNanos;
            waitNanos = throttle.called ? Math.max(0, earliest - now) : 0;
            throttle.lastCallNanos = now + waitNanos;
            throttle.called = true;
        } finally {
            throttle.lock.unlock();
        }

        if (waitNanos > 0) {
            log.debug("Throttling {} for {}ms", engineCode, TimeUnit.NANOSECONDS.toMillis(waitNanos));
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        }
        throttle.bucket.asBlocking().consume(1);
    }

    @Override
    public void reportSuccess(String engineCode) {
        EngineThrottle throttle = throttle(engineCode);
        throttle.lock.lock();
        try {
            long floor = properties.getMinDelay().toNanos();
            throttle.delayNanos = Math.max(floor, (long) (throttle.delayNanos * RECOVERY_FACTOR));
            throttle.consecutiveErrors = 0;
        } finally {
            throttle.lock.unlock();
        }
    }

    @Override
    public void reportError(String engineCode) {
        EngineThrottle throttle = throttle(engineCode);
        throttle.lock.lock();
        try {
            long cap = properties.getMaxDelay().toNanos();
            long base = Math.max(throttle.delayNanos, properties.getBaseDelay().toNanos());
            throttle.delayNanos = Math.min(cap, (long) (base * BACKOFF_FACTOR));
            throttle.consecutiveErrors++;
            if (throttle.delayNanos == cap) {
                log.warn("Engine {} backed off to max delay after {} consecutive errors",
                        engineCode, throttle.consecutiveErrors);
            }
        } finally {
            throttle.lock.unlock();
        }
    }

    /**
     * Current spacing for an engine; the base delay if the engine was never seen.
     */
    public Duration currentDelay(String engineCode) {
        EngineThrottle throttle = throttles.get(engineCode);
        if (throttle == null) {
            return properties.getBaseDelay();
        }
        throttle.lock.lock();
        try {
            return Duration.ofNanos(throttle.delayNanos);
        } finally {
            throttle.lock.unlock();
        }
    }

    private EngineThrottle throttle(String engineCode) {
        return throttles.computeIfAbsent(engineCode, code -> new EngineThrottle(
                properties.getBaseDelay().toNanos(), newBucket()));
    }

    private Bucket newBucket() {
        Refill refill = Refill.greedy(properties.getRefillTokens(), properties.getRefillPeriod());
        Bandwidth limit = Bandwidth.classic(properties.getBurstCapacity(), refill);
        return Bucket.builder().addLimit(limit).build();
    }

    private static final class EngineThrottle {
        private final ReentrantLock lock = new ReentrantLock();
        private final Bucket bucket;
        private long delayNanos;
        private long lastCallNanos;
        private boolean called;
        private int consecutiveErrors;

        private EngineThrottle(long delayNanos, Bucket bucket) {
            this.delayNanos = delayNanos;
            this.bucket = bucket;
        }
    }
}
