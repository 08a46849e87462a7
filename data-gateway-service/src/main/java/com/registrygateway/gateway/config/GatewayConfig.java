package com.registrygateway.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.registrygateway.gateway.cache.CacheKeyGenerator;
import com.registrygateway.gateway.cache.TtlCache;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class GatewayConfig {

    @Value("${gateway.default-provider:dnb}")
    private String defaultProvider;

    @Value("${gateway.fallback-provider:experian}")
    private String fallbackProvider;

    @Value("${gateway.rate-limiting.enabled:true}")
    private boolean rateLimitingEnabled;

    @Value("${gateway.rate-limiting.global-per-minute:1000}")
    private int globalRateLimitPerMinute;

    @Value("${gateway.rate-limiting.provider-per-minute:100}")
    private int providerRateLimitPerMinute;

    @Value("${gateway.cache.enabled:true}")
    private boolean cachingEnabled;

    @Value("${gateway.cache.ttl:PT1H}")
    private Duration cacheTtl;

    @Value("${gateway.cache.max-entries:10000}")
    private int cacheMaxEntries;

    @Value("${gateway.cost.tracking-enabled:true}")
    private boolean costTrackingEnabled;

    @Value("${gateway.cost.budget-limit:1000.0}")
    private double budgetLimit;

    @Value("${gateway.cost.optimization-enabled:true}")
    private boolean costOptimizationEnabled;

    @Value("${gateway.validation.enabled:true}")
    private boolean validationEnabled;

    @Value("${gateway.validation.quality-threshold:0.8}")
    private double qualityThreshold;

    @Value("${gateway.monitoring.alert-threshold:0.9}")
    private double alertThreshold;

    @Bean
    public GatewaySettings gatewaySettings() {
        return GatewaySettings.builder()
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
            .alertThreshold(alertThreshold)
            .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TtlCache<Object> responseCache(GatewaySettings gatewaySettings, Clock clock) {
        return new TtlCache<>(gatewaySettings.cacheMaxEntries(), clock);
    }

    @Bean
    public CacheKeyGenerator cacheKeyGenerator() {
        return new CacheKeyGenerator();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
