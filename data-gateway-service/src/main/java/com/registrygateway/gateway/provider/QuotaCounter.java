package com.registrygateway.gateway.provider;

import com.registrygateway.common.model.QuotaInfo;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.YearMonth;

/**
 * Counts calls made to one provider against its daily and monthly allowance.
 * Counters roll over at UTC midnight and at the start of each UTC month.
 *
 * <p>Purely informational: nothing here refuses a call.
 */
public class QuotaCounter {

    private final long dailyLimit;
    private final long monthlyLimit;
    private final Clock clock;

    private LocalDate day;
    private YearMonth month;
    private long dailyUsed;
    private long monthlyUsed;

    public QuotaCounter(long dailyLimit, long monthlyLimit, Clock clock) {
        this.dailyLimit   = dailyLimit;
        this.monthlyLimit = monthlyLimit;
        this.clock        = clock;
        this.day          = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        this.month        = YearMonth.from(day);
    }

    /** Daily allowance derived from a per-minute rate limit (ten minutes of full-rate traffic). */
    public static QuotaCounter forRateLimit(int rateLimitPerMinute, Clock clock) {
        long daily = Math.max(0, rateLimitPerMinute) * 10L;
        return new QuotaCounter(daily, daily * 30, clock);
    }

    public synchronized void recordCall() {
        rollover();
        dailyUsed++;
        monthlyUsed++;
    }

    public synchronized QuotaInfo snapshot() {
        rollover();
        return new QuotaInfo(
            dailyUsed,
            dailyLimit,
            monthlyUsed,
            monthlyLimit,
            day.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC),
            Math.max(0, dailyLimit - dailyUsed));
    }

    private void rollover() {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        if (!today.equals(day)) {
            day = today;
            dailyUsed = 0;
        }
        YearMonth thisMonth = YearMonth.from(today);
        if (!thisMonth.equals(month)) {
            month = thisMonth;
            monthlyUsed = 0;
        }
    }
}
