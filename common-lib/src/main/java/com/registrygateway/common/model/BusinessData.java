package com.registrygateway.common.model;

import java.time.Instant;
import java.util.List;

/**
 * Normalized business record returned by every provider.
 *
 * <p>{@code id} is namespaced as {@code <providerName>:<nativeId>} so records from
 * different sources never collide. Instances are never mutated after construction;
 * a cache hit hands back the very same instance that was stored.
 */
public record BusinessData(
    String id,
    String companyName,
    String legalName,
    String registrationNumber,
    String taxId,
    Address address,
    List<String> industryCodes,
    FinancialData financial,      // nullable
    ComplianceData compliance,    // nullable
    List<NewsItem> news,
    double dataQuality,
    double confidence,
    String providerName,
    Instant lastUpdated
) {

    public BusinessData {
        address       = address == null ? Address.empty() : address;
        industryCodes = industryCodes == null ? List.of() : List.copyOf(industryCodes);
        news          = news == null ? List.of() : List.copyOf(news);
    }

    /** Builds the namespaced id for a provider-native identifier. */
    public static String namespacedId(String providerName, String nativeId) {
        return providerName + ":" + nativeId;
    }

    /**
     * Strips a {@code <providerName>:} prefix from {@code id} if present, returning the
     * provider-native identifier.
     */
    public static String nativeId(String providerName, String id) {
        String prefix = providerName + ":";
        return id != null && id.startsWith(prefix) ? id.substring(prefix.length()) : id;
    }
}
