package com.registrygateway.gateway.provider;

import com.registrygateway.common.model.QuotaInfo;
import com.registrygateway.gateway.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class QuotaCounterTest {

    private final MutableClock clock = MutableClock.startingAt("2024-01-31T23:00:00Z");

    @Test
    @DisplayName("limits derive from the per-minute rate: daily = 10 × rate, monthly = 30 × daily")
    void derivedLimits() {
        QuotaInfo info = QuotaCounter.forRateLimit(100, clock).snapshot();
        assertEquals(1000, info.dailyLimit());
        assertEquals(30_000, info.monthlyLimit());
        assertEquals(1000, info.remaining());
        assertEquals(Instant.parse("2024-02-01T00:00:00Z"), info.resetTime());
    }

    @Test
    @DisplayName("calls count against day and month; new day and new month reset their counters")
    void rollover() {
        QuotaCounter counter = new QuotaCounter(10, 100, clock);
        counter.recordCall();
        counter.recordCall();

        QuotaInfo before = counter.snapshot();
        assertEquals(2, before.dailyUsed());
        assertEquals(2, before.monthlyUsed());
        assertEquals(8, before.remaining());

        clock.advance(Duration.ofHours(2));   // 2024-02-01T01:00Z
        counter.recordCall();

        QuotaInfo after = counter.snapshot();
        assertEquals(1, after.dailyUsed());
        assertEquals(1, after.monthlyUsed());
    }

    @Test
    @DisplayName("remaining never goes negative")
    void remainingFloor() {
        QuotaCounter counter = new QuotaCounter(1, 1, clock);
        counter.recordCall();
        counter.recordCall();
        assertEquals(0, counter.snapshot().remaining());
        assertEquals(2.0, counter.snapshot().dailyUsageRatio(), 1e-9);
    }
}
