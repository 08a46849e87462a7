package com.registrygateway.gateway.provider;

import com.registrygateway.common.model.OperationKind;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Registration-time description of a provider. Capabilities and coverage are copied
 * into unmodifiable collections so they cannot change once the provider is registered.
 *
 * @param name               unique registry key
 * @param type               adapter family ({@code dnb}, {@code sec}, ...)
 * @param capabilities       operations the provider advertises; drives the selector's feature term
 * @param qualityScore       base data quality in [0,1]
 * @param coverage           country code → coverage confidence in [0,1]
 * @param costs              price per operation kind
 * @param rateLimitPerMinute token-bucket refill rate
 * @param burstLimit         token-bucket capacity
 */
public record ProviderDescriptor(
    String name,
    String type,
    Set<OperationKind> capabilities,
    double qualityScore,
    Map<String, Double> coverage,
    CostTable costs,
    int rateLimitPerMinute,
    int burstLimit
) {

    public ProviderDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("provider name must not be blank");
        }
        type         = type == null ? name : type;
        capabilities = capabilities == null || capabilities.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(OperationKind.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
        coverage     = coverage == null ? Map.of() : Map.copyOf(coverage);
        costs        = costs == null ? CostTable.flat(0.0) : costs;
    }

    public boolean supports(OperationKind operation) {
        return capabilities.contains(operation);
    }

    /** Coverage confidence for {@code country}, 0 when the country is unknown or absent. */
    public double coverageFor(String country) {
        if (country == null) {
            return 0.0;
        }
        return coverage.getOrDefault(country, 0.0);
    }

    /** Same descriptor with a different capability set. */
    public ProviderDescriptor withCapabilities(Set<OperationKind> newCapabilities) {
        return new ProviderDescriptor(name, type, newCapabilities, qualityScore, coverage, costs,
            rateLimitPerMinute, burstLimit);
    }
}
