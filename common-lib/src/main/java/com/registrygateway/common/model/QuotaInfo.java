package com.registrygateway.common.model;

import java.time.Instant;

/**
 * Provider-reported usage snapshot. Informational only: the gateway never
 * blocks a call because of it.
 */
public record QuotaInfo(
    long dailyUsed,
    long dailyLimit,
    long monthlyUsed,
    long monthlyLimit,
    Instant resetTime,
    long remaining
) {
    /** Fraction of the daily limit already used, 0 when the limit is unknown. */
    public double dailyUsageRatio() {
        return dailyLimit <= 0 ? 0.0 : (double) dailyUsed / dailyLimit;
    }
}
