package com.registrygateway.gateway.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Non-blocking token bucket.
 *
 * <p>The bucket starts full at {@code burst} tokens and refills continuously at
 * {@code ratePerMinute}, never above {@code burst}. {@link #tryAcquire()} takes one
 * token or fails immediately; it never sleeps or queues.
 *
 * <p>A rate of zero (or less) never refills: the bucket serves its initial burst and
 * then denies forever. A burst below one is raised to one.
 *
 * <p>Each instance guards its own state, so buckets for different providers never
 * contend with each other.
 */
public final class TokenBucketRateLimiter {

    private static final double NANOS_PER_MINUTE = Duration.ofMinutes(1).toNanos();

    private final double ratePerMinute;
    private final int burst;
    private final Clock clock;

    private double tokens;
    private Instant lastRefill;

    public TokenBucketRateLimiter(double ratePerMinute, int burst, Clock clock) {
        this.ratePerMinute = Math.max(0.0, ratePerMinute);
        this.burst         = Math.max(1, burst);
        this.clock         = clock;
        this.tokens        = this.burst;
        this.lastRefill    = clock.instant();
    }

    /** Takes one token if available. */
    public synchronized boolean tryAcquire() {
        refill();
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return true;
        }
        return false;
    }

    /** Tokens currently available, after applying any pending refill. */
    public synchronized double availableTokens() {
        refill();
        return tokens;
    }

    public double ratePerMinute() {
        return ratePerMinute;
    }

    public int burst() {
        return burst;
    }

    private void refill() {
        Instant now = clock.instant();
        if (!now.isAfter(lastRefill)) {
            return;   // no time passed, or the clock stepped back
        }
        if (ratePerMinute > 0.0) {
            double elapsedMinutes = Duration.between(lastRefill, now).toNanos() / NANOS_PER_MINUTE;
            tokens = Math.min(burst, tokens + elapsedMinutes * ratePerMinute);
        }
        lastRefill = now;
    }
}
