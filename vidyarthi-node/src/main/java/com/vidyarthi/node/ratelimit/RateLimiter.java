package com.vidyarthi.node.ratelimit;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import io.github.bucket4j.TimeMeter;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Per-key cooldown throttle for user-triggered actions (sign-in attempts, sync buttons, AI prompts).
 *
 * Each key gets a single-token Bucket4j bucket that refills over the cooldown, so a call is
 * granted only when no granted call for the same key happened within the cooldown. Refused
 * calls do not push the window forward. The last grant is kept per key, so a call with a
 * different cooldown gets a new bucket but is still judged against that grant. Keys idle for
 * longer than twice their cooldown are evicted whenever a call is granted.
 */
public class RateLimiter {

    private final Map<String, Throttle> throttles;
    private final TimeMeter timeMeter;

    public RateLimiter(Clock clock) {
        Objects.requireNonNull(clock, "Clock cannot be null");
        this.throttles = new ConcurrentHashMap<>();
        this.timeMeter = new ClockTimeMeter(clock);
    }

    public RateLimiter() {
        this(Clock.systemUTC());
    }

    /**
     * Grants the call if {@code key} had no granted call within {@code cooldown}.
     *
     * @param key      throttle key, such as {@code "login:" + userId}
     * @param cooldown minimum spacing between granted calls
     * @return true if the call may proceed
     */
    public boolean allow(String key, Duration cooldown) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Key cannot be null or blank");
        }
        if (cooldown == null || cooldown.isNegative() || cooldown.isZero()) {
            throw new IllegalArgumentException("Cooldown must be positive");
        }

        boolean[] granted = new boolean[1];
        throttles.compute(key, (k, existing) -> {
            Throttle throttle = existing == null ? newThrottle(cooldown, null) : existing;
            if (!throttle.cooldown().equals(cooldown)) {
                throttle = newThrottle(cooldown, throttle);
            }
            granted[0] = throttle.tryGrant(timeMeter.currentTimeNanos());
            return throttle;
        });

        if (granted[0]) {
            evictIdle(timeMeter.currentTimeNanos());
        }
        return granted[0];
    }

    /**
     * Forgets the history of a key.
     */
    public void reset(String key) {
        if (key != null) {
            throttles.remove(key);
        }
    }

    /**
     * Gets the number of tracked keys (for testing).
     */
    public int trackedKeys() {
        return throttles.size();
    }

    // ==================== Private Methods ====================

    private Throttle newThrottle(Duration cooldown, Throttle previous) {
        Bandwidth limit = Bandwidth.classic(1, Refill.greedy(1, cooldown));
        Bucket bucket = Bucket.builder()
                .addLimit(limit)
                .withCustomTimePrecision(timeMeter)
                .build();
        Throttle throttle = new Throttle(bucket, cooldown);
        if (previous != null && previous.hasGranted()) {
            throttle.markGranted(previous.lastGrantedNanos());
        }
        return throttle;
    }

    private void evictIdle(long nowNanos) {
        for (String key : throttles.keySet()) {
            // atomic with grants for the same key
            throttles.computeIfPresent(key, (k, throttle) -> throttle.isIdle(nowNanos) ? null : throttle);
        }
    }

    // ==================== Inner Types ====================

    private static final class Throttle {
        private final Bucket bucket;
        private final Duration cooldown;
        private volatile long lastGrantedNanos;
        private volatile boolean granted;

        private Throttle(Bucket bucket, Duration cooldown) {
            this.bucket = bucket;
            this.cooldown = cooldown;
        }

        Bucket bucket() {
            return bucket;
        }

        Duration cooldown() {
            return cooldown;
        }

        long lastGrantedNanos() {
            return lastGrantedNanos;
        }

        boolean hasGranted() {
            return granted;
        }

        /**
         * Takes the token if the bucket has one and the last grant is at least a cooldown old.
         */
        boolean tryGrant(long nowNanos) {
            if (granted && nowNanos - lastGrantedNanos < cooldown.toNanos()) {
                return false;
            }
            if (!bucket.tryConsume(1)) {
                return false;
            }
            markGranted(nowNanos);
            return true;
        }

        boolean isIdle(long nowNanos) {
            return granted && nowNanos - lastGrantedNanos > cooldown.multipliedBy(2).toNanos();
        }

        private void markGranted(long nanos) {
            lastGrantedNanos = nanos;
            granted = true;
        }
    }

    /**
     * Feeds Bucket4j from an injectable clock so tests can move time deterministically.
     */
    private static final class ClockTimeMeter implements TimeMeter {
        private final Clock clock;

        private ClockTimeMeter(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long currentTimeNanos() {
            return TimeUnit.MILLISECONDS.toNanos(clock.millis());
        }

        @Override
        public boolean isWallClockBased() {
            return true;
        }
    }
}
