package com.registrygateway.gateway.selection;

import com.registrygateway.common.model.BusinessSearchQuery;
import com.registrygateway.common.model.OperationKind;
import com.registrygateway.gateway.config.GatewaySettings;
import com.registrygateway.gateway.provider.BusinessDataProvider;
import com.registrygateway.gateway.provider.ProviderDescriptor;
import com.registrygateway.gateway.registry.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Picks the best healthy provider for a search query.
 *
 * <p><strong>Score</strong> (weights are fixed):
 * <ul>
 *   <li>quality  = {@code qualityScore × 0.3}</li>
 *   <li>coverage = {@code coverage[query.country] × 0.2}, 0 when the country is absent</li>
 *   <li>cost     = {@code clamp(1 − costPerSearch / 10, 0, 1) × 0.2}, only with cost optimization on</li>
 *   <li>features = {@code 0.3 × supported / requested} over the financial, compliance and news
 *       flags set on the query; 0 when none are requested</li>
 * </ul>
 *
 * <p><strong>Ties</strong> go to the provider registered first: providers are scanned in
 * registration order and a later one must score strictly higher to win.
 */
@Component
public class ProviderSelector {

    private static final Logger log = LoggerFactory.getLogger(ProviderSelector.class);

    static final double QUALITY_WEIGHT  = 0.3;
    static final double COVERAGE_WEIGHT = 0.2;
    static final double COST_WEIGHT     = 0.2;
    static final double FEATURE_WEIGHT  = 0.3;

    /** Search cost at which the cost term reaches zero. */
    static final double COST_CEILING = 10.0;

    private final ProviderRegistry registry;
    private final GatewaySettings settings;

    public ProviderSelector(ProviderRegistry registry, GatewaySettings settings) {
        this.registry = registry;
        this.settings = settings;
    }

    public Optional<BusinessDataProvider> selectBest(BusinessSearchQuery query) {
        BusinessDataProvider best = null;
        double bestScore = Double.NEGATIVE_INFINITY;

        for (BusinessDataProvider provider : registry.providers()) {
            if (!provider.isHealthy()) {
                continue;
            }
            double score = score(provider, query);
            if (score > bestScore) {
                best = provider;
                bestScore = score;
            }
        }

        if (best == null) {
            log.warn("PROVIDER_SELECTION_EMPTY registered={} country={}", registry.size(), query.country());
            return Optional.empty();
        }
        log.info("PROVIDER_SELECTED provider={} score={} country={} requestedFeatures={}",
            best.name(), String.format("%.4f", bestScore), query.country(), query.requestedFeatureCount());
        return Optional.of(best);
    }

    public double score(BusinessDataProvider provider, BusinessSearchQuery query) {
        ProviderDescriptor descriptor = provider.descriptor();
        double score = descriptor.qualityScore() * QUALITY_WEIGHT;
        score += descriptor.coverageFor(query.country()) * COVERAGE_WEIGHT;
        if (settings.costOptimizationEnabled()) {
            double cost = provider.costPerOperation(OperationKind.SEARCH);
            score += clamp(1.0 - cost / COST_CEILING) * COST_WEIGHT;
        }
        score += featureScore(descriptor, query);
        return score;
    }

    private static double featureScore(ProviderDescriptor descriptor, BusinessSearchQuery query) {
        int requested = query.requestedFeatureCount();
        if (requested == 0) {
            return 0.0;
        }
        int supported = 0;
        if (query.includeFinancial() && descriptor.supports(OperationKind.FINANCIAL)) supported++;
        if (query.includeCompliance() && descriptor.supports(OperationKind.COMPLIANCE)) supported++;
        if (query.includeNews() && descriptor.supports(OperationKind.NEWS)) supported++;
        return FEATURE_WEIGHT * supported / requested;
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
