package com.registrygateway.gateway.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.registrygateway.common.model.OperationKind;
import com.registrygateway.common.model.QuotaInfo;
import com.registrygateway.gateway.provider.BusinessDataProvider;
import com.registrygateway.gateway.provider.ProviderDescriptor;

import java.util.List;
import java.util.Map;

/** Row of GET /api/v1/business-data/providers: descriptor, health flag and quota snapshot. */
public record ProviderStatus(
    @JsonProperty("name")               String name,
    @JsonProperty("type")               String type,
    @JsonProperty("healthy")            boolean healthy,
    @JsonProperty("qualityScore")       double qualityScore,
    @JsonProperty("capabilities")       List<String> capabilities,
    @JsonProperty("coverage")           Map<String, Double> coverage,
    @JsonProperty("rateLimitPerMinute") int rateLimitPerMinute,
    @JsonProperty("burstLimit")         int burstLimit,
    @JsonProperty("quota")              QuotaInfo quota
) {

    public static ProviderStatus from(BusinessDataProvider provider) {
        ProviderDescriptor d = provider.descriptor();
        return new ProviderStatus(
            d.name(),
            d.type(),
            provider.isHealthy(),
            d.qualityScore(),
            d.capabilities().stream().map(OperationKind::code).toList(),
            d.coverage(),
            d.rateLimitPerMinute(),
            d.burstLimit(),
            provider.quota());
    }
}
