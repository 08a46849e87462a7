package com.registrygateway.gateway.config;

import com.registrygateway.common.model.OperationKind;
import com.registrygateway.gateway.provider.BusinessDataProvider;
import com.registrygateway.gateway.provider.CostTable;
import com.registrygateway.gateway.provider.ProviderDescriptor;
import com.registrygateway.gateway.provider.sandbox.BloombergProvider;
import com.registrygateway.gateway.provider.sandbox.DunBradstreetProvider;
import com.registrygateway.gateway.provider.sandbox.ExperianProvider;
import com.registrygateway.gateway.provider.sandbox.FactivaProvider;
import com.registrygateway.gateway.provider.sec.SecEdgarProvider;
import com.registrygateway.gateway.service.BusinessDataGatewayService;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Registers every enabled entry of {@code gateway.providers} with the gateway at startup.
 * An unknown {@code type} or feature code fails startup.
 */
@Component
public class ProviderBootstrap {

    private static final Logger log = LoggerFactory.getLogger(ProviderBootstrap.class);

    static final String SEC_BASE_URL = "https://data.sec.gov";

    private final ProviderProperties properties;
    private final BusinessDataGatewayService gateway;
    private final ProviderWebClientFactory webClients;
    private final GatewaySettings settings;
    private final Clock clock;

    public ProviderBootstrap(ProviderProperties properties,
                             BusinessDataGatewayService gateway,
                             ProviderWebClientFactory webClients,
                             GatewaySettings settings,
                             Clock clock) {
        this.properties = properties;
        this.gateway    = gateway;
        this.webClients = webClients;
        this.settings   = settings;
        this.clock      = clock;
    }

    @PostConstruct
    public void registerConfiguredProviders() {
        int registered = 0;
        for (ProviderProperties.ProviderEntry entry : properties.providers()) {
            if (!entry.enabled()) {
                log.info("PROVIDER_DISABLED provider={}", entry.name());
                continue;
            }
            gateway.registerProvider(createProvider(entry));
            registered++;
        }
        log.info("PROVIDER_BOOTSTRAP_COMPLETE registered={} defaultProvider={} fallbackProvider={}",
            registered, settings.defaultProvider(), settings.fallbackProvider());
    }

    BusinessDataProvider createProvider(ProviderProperties.ProviderEntry entry) {
        ProviderDescriptor descriptor = toDescriptor(entry);
        return switch (descriptor.type().toLowerCase(Locale.ROOT)) {
            case DunBradstreetProvider.TYPE -> new DunBradstreetProvider(descriptor, clock);
            case ExperianProvider.TYPE      -> new ExperianProvider(descriptor, clock);
            case BloombergProvider.TYPE     -> new BloombergProvider(descriptor, clock);
            case FactivaProvider.TYPE       -> new FactivaProvider(descriptor, clock);
            case SecEdgarProvider.TYPE      -> new SecEdgarProvider(descriptor,
                webClients.create(entry.name(),
                    entry.baseUrl() == null || entry.baseUrl().isBlank() ? SEC_BASE_URL : entry.baseUrl(),
                    entry.userAgent(), entry.timeout()),
                clock);
            default -> throw new IllegalStateException(
                "unknown provider type '" + descriptor.type() + "' for provider " + entry.name());
        };
    }

    ProviderDescriptor toDescriptor(ProviderProperties.ProviderEntry entry) {
        int rate  = entry.rateLimitPerMinute() > 0 ? entry.rateLimitPerMinute() : settings.providerRateLimitPerMinute();
        int burst = entry.burstLimit() > 0 ? entry.burstLimit() : Math.max(1, rate / 10);
        return new ProviderDescriptor(
            entry.name(),
            entry.type(),
            capabilities(entry.features()),
            entry.qualityScore(),
            entry.coverage(),
            costs(entry.cost()),
            rate,
            burst);
    }

    private static Set<OperationKind> capabilities(Set<String> features) {
        Set<OperationKind> kinds = EnumSet.noneOf(OperationKind.class);
        for (String code : features) {
            kinds.add(OperationKind.fromCode(code));
        }
        return kinds;
    }

    private static CostTable costs(ProviderProperties.Cost cost) {
        if (cost == null) {
            return CostTable.flat(0.0);
        }
        return new CostTable(cost.perRequest(), cost.perSearch(), cost.perDetail(),
            cost.perFinancial(), cost.perCompliance(), cost.perNews());
    }
}
