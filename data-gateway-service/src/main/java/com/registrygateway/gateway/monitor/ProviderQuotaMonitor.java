package com.registrygateway.gateway.monitor;

import com.registrygateway.common.model.QuotaInfo;
import com.registrygateway.gateway.config.GatewaySettings;
import com.registrygateway.gateway.provider.BusinessDataProvider;
import com.registrygateway.gateway.registry.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Periodic, advisory check of every registered provider.
 *
 * <ul>
 *   <li>logs {@code PROVIDER_HEALTH_CHANGED} when a provider's health flag differs from the
 *       previous check</li>
 *   <li>logs {@code QUOTA_ALERT} when daily usage reaches {@code alertThreshold} of the
 *       provider-reported limit</li>
 * </ul>
 *
 * <p>Never changes routing: health is owned by the providers, quota is informational.
 */
@Component
@ConditionalOnProperty(name = "gateway.monitoring.enabled", havingValue = "true", matchIfMissing = true)
public class ProviderQuotaMonitor {

    private static final Logger log = LoggerFactory.getLogger(ProviderQuotaMonitor.class);

    private final ProviderRegistry registry;
    private final double alertThreshold;
    private final Map<String, Boolean> lastHealth = new ConcurrentHashMap<>();

    public ProviderQuotaMonitor(ProviderRegistry registry, GatewaySettings settings) {
        this.registry       = registry;
        this.alertThreshold = settings.alertThreshold();
    }

    @Scheduled(fixedDelayString = "${gateway.monitoring.health-check-interval-ms:300000}",
               initialDelayString = "${gateway.monitoring.health-check-interval-ms:300000}")
    public void scheduledCheck() {
        List<String> alerts = checkProviders();
        log.debug("PROVIDER_CHECK_COMPLETE providers={} quotaAlerts={}", registry.size(), alerts.size());
    }

    /** Runs one check and returns the names of providers over their quota alert threshold. */
    public List<String> checkProviders() {
        List<String> alerts = new ArrayList<>();
        for (BusinessDataProvider provider : registry.providers()) {
            boolean healthy = provider.isHealthy();
            Boolean previous = lastHealth.put(provider.name(), healthy);
            if (previous != null && previous != healthy) {
                log.warn("PROVIDER_HEALTH_CHANGED provider={} healthy={} previous={}", provider.name(), healthy, previous);
            }

            QuotaInfo quota = provider.quota();
            if (quota.dailyLimit() > 0 && quota.dailyUsageRatio() >= alertThreshold) {
                alerts.add(provider.name());
                log.warn("QUOTA_ALERT provider={} dailyUsed={} dailyLimit={} resetTime={}",
                    provider.name(), quota.dailyUsed(), quota.dailyLimit(), quota.resetTime());
            }
        }
        return alerts;
    }
}
