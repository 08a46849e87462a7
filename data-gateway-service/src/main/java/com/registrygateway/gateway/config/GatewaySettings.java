package com.registrygateway.gateway.config;

import java.time.Duration;

/**
 * Immutable gateway configuration. Non-positive numeric values and null durations fall
 * back to the defaults below, so a partially filled configuration is always usable.
 *
 * @param defaultProvider          provider used by direct operations called without a provider name
 * @param fallbackProvider         single provider tried when the primary call fails; blank disables fallback
 * @param rateLimitingEnabled      consult provider and global token buckets before each call
 * @param globalRateLimitPerMinute refill rate (and burst) of the bucket shared by all providers
 * @param providerRateLimitPerMinute rate applied to configured providers that declare none
 * @param cachingEnabled           read and populate the response cache
 * @param cacheTtl                 time-to-live of cached responses
 * @param cacheMaxEntries          cache capacity
 * @param costTrackingEnabled      report per-call cost to the cost tracker
 * @param budgetLimit              spend at which the cost tracker starts warning (advisory)
 * @param costOptimizationEnabled  include the cost term when scoring providers
 * @param validationEnabled        run the selected provider's validation on search results
 * @param qualityThreshold         minimum validated quality score for search results
 * @param alertThreshold           quota and budget usage ratio that triggers warnings
 */
public record GatewaySettings(
    String defaultProvider,
    String fallbackProvider,
    boolean rateLimitingEnabled,
    int globalRateLimitPerMinute,
    int providerRateLimitPerMinute,
    boolean cachingEnabled,
    Duration cacheTtl,
    int cacheMaxEntries,
    boolean costTrackingEnabled,
    double budgetLimit,
    boolean costOptimizationEnabled,
    boolean validationEnabled,
    double qualityThreshold,
    double alertThreshold
) {

    public static final int DEFAULT_GLOBAL_RATE_LIMIT   = 1000;
    public static final int DEFAULT_PROVIDER_RATE_LIMIT = 100;
    public static final Duration DEFAULT_CACHE_TTL      = Duration.ofHours(1);
    public static final int DEFAULT_CACHE_SIZE          = 10_000;
    public static final double DEFAULT_BUDGET_LIMIT     = 1000.0;
    public static final double DEFAULT_QUALITY_THRESHOLD = 0.8;
    public static final double DEFAULT_ALERT_THRESHOLD  = 0.9;

    public GatewaySettings {
        defaultProvider            = blankToNull(defaultProvider);
        fallbackProvider           = blankToNull(fallbackProvider);
        globalRateLimitPerMinute   = globalRateLimitPerMinute > 0 ? globalRateLimitPerMinute : DEFAULT_GLOBAL_RATE_LIMIT;
        providerRateLimitPerMinute = providerRateLimitPerMinute > 0 ? providerRateLimitPerMinute : DEFAULT_PROVIDER_RATE_LIMIT;
        cacheTtl                   = cacheTtl != null && !cacheTtl.isNegative() && !cacheTtl.isZero() ? cacheTtl : DEFAULT_CACHE_TTL;
        cacheMaxEntries            = cacheMaxEntries > 0 ? cacheMaxEntries : DEFAULT_CACHE_SIZE;
        budgetLimit                = budgetLimit > 0 ? budgetLimit : DEFAULT_BUDGET_LIMIT;
        qualityThreshold           = qualityThreshold > 0 ? qualityThreshold : DEFAULT_QUALITY_THRESHOLD;
        alertThreshold             = alertThreshold > 0 ? alertThreshold : DEFAULT_ALERT_THRESHOLD;
    }

    /** Every feature switched on, every limit at its default, no default or fallback provider. */
    public static GatewaySettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .defaultProvider(defaultProvider)
            .fallbackProvider(fallbackProvider)
            .rateLimitingEnabled(rateLimitingEnabled)
            .globalRateLimitPerMinute(globalRateLimitPerMinute)
            .providerRateLimitPerMinute(providerRateLimitPerMinute)
            .cachingEnabled(cachingEnabled)
            .cacheTtl(cacheTtl)
            .cacheMaxEntries(cacheMaxEntries)
            .costTrackingEnabled(costTrackingEnabled)
            .budgetLimit(budgetLimit)
            .costOptimizationEnabled(costOptimizationEnabled)
            .validationEnabled(validationEnabled)
            .qualityThreshold(qualityThreshold)
            .alertThreshold(alertThreshold);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    public static final class Builder {
        private String defaultProvider;
        private String fallbackProvider;
        private boolean rateLimitingEnabled = true;
        private int globalRateLimitPerMinute;
        private int providerRateLimitPerMinute;
        private boolean cachingEnabled = true;
        private Duration cacheTtl;
        private int cacheMaxEntries;
        private boolean costTrackingEnabled = true;
        private double budgetLimit;
        private boolean costOptimizationEnabled = true;
        private boolean validationEnabled = true;
        private double qualityThreshold;
        private double alertThreshold;

        private Builder() {}

        public Builder defaultProvider(String v) { this.defaultProvider = v; return this; }
        public Builder fallbackProvider(String v) { this.fallbackProvider = v; return this; }
        public Builder rateLimitingEnabled(boolean v) { this.rateLimitingEnabled = v; return this; }
        public Builder globalRateLimitPerMinute(int v) { this.globalRateLimitPerMinute = v; return this; }
        public Builder providerRateLimitPerMinute(int v) { this.providerRateLimitPerMinute = v; return this; }
        public Builder cachingEnabled(boolean v) { this.cachingEnabled = v; return this; }
        public Builder cacheTtl(Duration v) { this.cacheTtl = v; return this; }
        public Builder cacheMaxEntries(int v) { this.cacheMaxEntries = v; return this; }
        public Builder costTrackingEnabled(boolean v) { this.costTrackingEnabled = v; return this; }
        public Builder budgetLimit(double v) { this.budgetLimit = v; return this; }
        public Builder costOptimizationEnabled(boolean v) { this.costOptimizationEnabled = v; return this; }
        public Builder validationEnabled(boolean v) { this.validationEnabled = v; return this; }
        public Builder qualityThreshold(double v) { this.qualityThreshold = v; return this; }
        public Builder alertThreshold(double v) { this.alertThreshold = v; return this; }

        public GatewaySettings build() {
            return new GatewaySettings(defaultProvider, fallbackProvider, rateLimitingEnabled,
                globalRateLimitPerMinute, providerRateLimitPerMinute, cachingEnabled, cacheTtl,
                cacheMaxEntries, costTrackingEnabled, budgetLimit, costOptimizationEnabled,
                validationEnabled, qualityThreshold, alertThreshold);
        }
    }
}
