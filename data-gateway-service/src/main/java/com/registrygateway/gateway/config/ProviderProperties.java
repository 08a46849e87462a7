package com.registrygateway.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Provider list read from {@code gateway.providers}.
 *
 * <pre>{@code
 * gateway:
 *   providers:
 *     - name: dnb
 *       type: dnb
 *       quality-score: 0.95
 *       coverage: { US: 0.95, GB: 0.90 }
 *       features: [search, details, financial, compliance, news]
 *       rate-limit-per-minute: 100
 *       cost: { per-request: 0.5, per-financial: 1.5 }
 * }</pre>
 *
 * @see ProviderBootstrap
 */
@ConfigurationProperties(prefix = "gateway")
public record ProviderProperties(List<ProviderEntry> providers) {

    public ProviderProperties {
        providers = providers == null ? List.of() : List.copyOf(providers);
    }

    /**
     * One configured provider. {@code type} selects the adapter; {@code features} are
     * operation codes and, when empty, the adapter's native operations are used.
     * Zero rate and burst take the gateway-wide defaults.
     */
    public record ProviderEntry(
        String name,
        String type,
        @DefaultValue("true") boolean enabled,
        String baseUrl,
        String userAgent,
        @DefaultValue("0.5") double qualityScore,
        Map<String, Double> coverage,
        Set<String> features,
        int rateLimitPerMinute,
        int burstLimit,
        Cost cost,
        @DefaultValue("PT15S") Duration timeout
    ) {

        public ProviderEntry {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("gateway.providers[].name must not be blank");
            }
            type     = type == null || type.isBlank() ? name : type.trim();
            coverage = coverage == null ? Map.of() : Map.copyOf(coverage);
            features = features == null ? Set.of() : Set.copyOf(features);
        }
    }

    public record Cost(
        double perRequest,
        double perSearch,
        double perDetail,
        double perFinancial,
        double perCompliance,
        double perNews
    ) {}
}
