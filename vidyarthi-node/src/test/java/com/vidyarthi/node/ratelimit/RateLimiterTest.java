package com.vidyarthi.node.ratelimit;

import com.vidyarthi.node.common.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterTest {

    private static final Duration COOLDOWN = Duration.ofSeconds(2);

    private MutableClock clock;
    private RateLimiter limiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-04-01T12:00:00Z");
        limiter = new RateLimiter(clock);
    }

    @Test
    void secondCallWithinCooldown_isRefused() {
        assertThat(limiter.allow("k", COOLDOWN)).isTrue();

        clock.advance(Duration.ofMillis(1500));

        assertThat(limiter.allow("k", COOLDOWN)).isFalse();
    }

    @Test
    void callAfterCooldown_isGranted() {
        assertThat(limiter.allow("k", COOLDOWN)).isTrue();
        clock.advance(Duration.ofMillis(500));
        assertThat(limiter.allow("k", COOLDOWN)).isFalse();

        clock.advance(Duration.ofMillis(1600));

        assertThat(limiter.allow("k", COOLDOWN)).isTrue();
    }

    @Test
    void refusedCalls_doNotExtendTheWindow() {
        limiter.allow("k", COOLDOWN);
        for (int i = 0; i < 3; i++) {
            clock.advance(Duration.ofMillis(600));
            assertThat(limiter.allow("k", COOLDOWN)).isFalse();
        }

        clock.advance(Duration.ofMillis(300));

        assertThat(limiter.allow("k", COOLDOWN)).isTrue();
    }

    // ==================== Cooldown Changes ====================

    @Test
    void longerCooldown_isJudgedAgainstLastGrant() {
        // Given
        assertThat(limiter.allow("k", COOLDOWN)).isTrue();
        clock.advance(Duration.ofMillis(500));

        // When / Then
        assertThat(limiter.allow("k", Duration.ofSeconds(5))).isFalse();
        clock.advance(Duration.ofSeconds(4));
        assertThat(limiter.allow("k", Duration.ofSeconds(5))).isFalse();
        clock.advance(Duration.ofMillis(500));
        assertThat(limiter.allow("k", Duration.ofSeconds(5))).isTrue();
    }

    @Test
    void switchingBack_keepsHistory() {
        assertThat(limiter.allow("k", COOLDOWN)).isTrue();
        clock.advance(Duration.ofMillis(200));
        assertThat(limiter.allow("k", Duration.ofSeconds(5))).isFalse();
        clock.advance(Duration.ofMillis(200));

        assertThat(limiter.allow("k", COOLDOWN)).isFalse();
    }

    @Test
    void shorterCooldown_grantsOnceItHasElapsed() {
        assertThat(limiter.allow("k", Duration.ofSeconds(10))).isTrue();
        clock.advance(Duration.ofMillis(1500));

        assertThat(limiter.allow("k", Duration.ofSeconds(1))).isTrue();
        assertThat(limiter.allow("k", Duration.ofSeconds(1))).isFalse();
    }

    @Test
    void keys_areThrottledIndependently() {
        assertThat(limiter.allow("login:asha", COOLDOWN)).isTrue();
        assertThat(limiter.allow("login:ravi", COOLDOWN)).isTrue();
        assertThat(limiter.allow("login:asha", COOLDOWN)).isFalse();
    }

    @Test
    void reset_forgetsKey() {
        limiter.allow("sync", COOLDOWN);

        limiter.reset("sync");

        assertThat(limiter.allow("sync", COOLDOWN)).isTrue();
    }

    @Test
    void idleKeys_areEvicted() {
        limiter.allow("old", COOLDOWN);
        clock.advance(Duration.ofSeconds(5));

        limiter.allow("new", COOLDOWN);

        assertThat(limiter.trackedKeys()).isEqualTo(1);
    }

    @Test
    void concurrentCallers_getExactlyOneGrant() throws Exception {
        int threads = 32;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                start.await();
                if (limiter.allow("ask-ai", COOLDOWN)) {
                    granted.incrementAndGet();
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();

        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        assertThat(granted.get()).isEqualTo(1);
    }

    @Test
    void idleKey_getsOneGrantWhileOtherKeysEvict() throws Exception {
        // Given
        limiter.allow("ask-ai", COOLDOWN);
        clock.advance(Duration.ofSeconds(5));
        int threads = 32;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();

        // When
        for (int i = 0; i < threads; i++) {
            String other = "sync:" + i;
            executor.submit(() -> {
                start.await();
                limiter.allow(other, COOLDOWN);
                if (limiter.allow("ask-ai", COOLDOWN)) {
                    granted.incrementAndGet();
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();

        // Then
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        assertThat(granted.get()).isEqualTo(1);
    }

    @Test
    void invalidArguments_areRejected() {
        assertThatThrownBy(() -> limiter.allow(" ", COOLDOWN)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> limiter.allow("k", Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
    }
}
