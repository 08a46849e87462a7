package com.registrygateway.gateway.ratelimit;

import com.registrygateway.gateway.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TokenBucketRateLimiterTest {

    private final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");

    @Test
    @DisplayName("burst 1, rate 1/min: allow, deny, then allow after a minute")
    void burstOneRateOne() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(1, 1, clock);

        assertTrue(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());

        clock.advance(Duration.ofSeconds(30));
        assertFalse(limiter.tryAcquire(), "half a token is not enough");

        clock.advance(Duration.ofSeconds(30));
        assertTrue(limiter.tryAcquire());
    }

    @Test
    @DisplayName("starts full and serves the whole burst back to back")
    void servesBurst() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(60, 5, clock);
        for (int i = 0; i < 5; i++) {
            assertTrue(limiter.tryAcquire(), "call " + i);
        }
        assertFalse(limiter.tryAcquire());
    }

    @Test
    @DisplayName("refill never exceeds burst")
    void refillCappedAtBurst() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(600, 3, clock);
        limiter.tryAcquire();
        clock.advance(Duration.ofHours(1));
        assertEquals(3.0, limiter.availableTokens(), 1e-9);
    }

    @Test
    @DisplayName("rate 0 serves the initial burst and never refills")
    void zeroRateNeverRefills() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(0, 2, clock);
        assertTrue(limiter.tryAcquire());
        assertTrue(limiter.tryAcquire());
        clock.advance(Duration.ofDays(1));
        assertFalse(limiter.tryAcquire());
    }

    @Test
    @DisplayName("burst below 1 is raised to 1, negative rate to 0")
    void coercesParameters() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(-5, 0, clock);
        assertEquals(1, limiter.burst());
        assertEquals(0.0, limiter.ratePerMinute());
        assertTrue(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());
    }

    @Test
    @DisplayName("clock stepping back does not mint tokens")
    void clockStepBack() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(60, 1, clock);
        assertTrue(limiter.tryAcquire());
        clock.advance(Duration.ofMinutes(-5));
        assertFalse(limiter.tryAcquire());
    }

    @Test
    @DisplayName("concurrent callers share the burst exactly: no token is granted twice")
    void concurrentAcquireIsAtomic() throws Exception {
        int burst = 50;
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(0, burst, clock);
        int threadCount = 8;
        CyclicBarrier barrier = new CyclicBarrier(threadCount);
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        AtomicInteger granted = new AtomicInteger();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threadCount; t++) {
                futures.add(executor.submit(() -> {
                    barrier.await();
                    for (int i = 0; i < 25; i++) {
                        if (limiter.tryAcquire()) {
                            granted.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(burst, granted.get());
        assertFalse(limiter.tryAcquire());
    }
}
