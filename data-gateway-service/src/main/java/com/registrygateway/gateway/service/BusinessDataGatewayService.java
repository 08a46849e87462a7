package com.registrygateway.gateway.service;

import com.registrygateway.common.exception.NoProviderAvailableException;
import com.registrygateway.common.exception.ProviderCallFailedException;
import com.registrygateway.common.exception.ProviderException;
import com.registrygateway.common.exception.ProviderNotFoundException;
import com.registrygateway.common.exception.QualityBelowThresholdException;
import com.registrygateway.common.exception.RateLimitedException;
import com.registrygateway.common.model.BusinessData;
import com.registrygateway.common.model.BusinessSearchQuery;
import com.registrygateway.common.model.ComplianceData;
import com.registrygateway.common.model.FinancialData;
import com.registrygateway.common.model.NewsItem;
import com.registrygateway.common.model.OperationKind;
import com.registrygateway.common.model.ValidationResult;
import com.registrygateway.common.trace.TraceContextUtil;
import com.registrygateway.gateway.cache.CacheKeyGenerator;
import com.registrygateway.gateway.cache.TtlCache;
import com.registrygateway.gateway.config.GatewaySettings;
import com.registrygateway.gateway.cost.CostTracker;
import com.registrygateway.gateway.provider.BusinessDataProvider;
import com.registrygateway.gateway.ratelimit.TokenBucketRateLimiter;
import com.registrygateway.gateway.registry.ProviderRegistry;
import com.registrygateway.gateway.selection.ProviderSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Single entry point for business-data lookups across all registered providers.
 *
 * <p><strong>Flow</strong> (identical for every operation; validation runs for search only):
 * <ol>
 *   <li>Cache lookup: a hit returns the stored instance with no rate-limit charge and no cost.</li>
 *   <li>Provider resolution: {@link ProviderSelector} for search, registry lookup by name otherwise.</li>
 *   <li>Rate-limit check on the provider's bucket, then the global bucket. A denial ends the
 *       request; fallback is not attempted for rate limits.</li>
 *   <li>Primary call.</li>
 *   <li>On a {@link ProviderException}: one call to the configured fallback provider. If it fails
 *       too the result is a {@link ProviderCallFailedException}; without a usable fallback the
 *       primary's error is returned as-is.</li>
 *   <li>Validation by the selected provider against the quality threshold.</li>
 *   <li>Cache store, then cost tracking for the provider that served the result.</li>
 * </ol>
 *
 * <p>Every operation is a lazy {@link Mono}. Cancelling the subscription abandons the provider
 * call; tokens already taken are not refunded. Errors other than {@link ProviderException}
 * raised by an adapter are not handled here and reach the caller unchanged.
 */
@Service
public class BusinessDataGatewayService {

    private static final Logger log = LoggerFactory.getLogger(BusinessDataGatewayService.class);

    static final String GLOBAL_LIMITER = "global";

    private static final BiConsumer<BusinessDataProvider, Object> NO_VERIFICATION = (p, v) -> { };

    private final ProviderRegistry registry;
    private final ProviderSelector selector;
    private final TtlCache<Object> cache;
    private final CacheKeyGenerator cacheKeys;
    private final CostTracker costTracker;
    private final GatewaySettings settings;
    private final TokenBucketRateLimiter globalLimiter;

    public BusinessDataGatewayService(ProviderRegistry registry,
                                      ProviderSelector selector,
                                      TtlCache<Object> responseCache,
                                      CacheKeyGenerator cacheKeys,
                                      CostTracker costTracker,
                                      GatewaySettings settings,
                                      Clock clock) {
        this.registry      = registry;
        this.selector      = selector;
        this.cache         = responseCache;
        this.cacheKeys     = cacheKeys;
        this.costTracker   = costTracker;
        this.settings      = settings;
        this.globalLimiter = new TokenBucketRateLimiter(
            settings.globalRateLimitPerMinute(), settings.globalRateLimitPerMinute(), clock);
    }

    public void registerProvider(BusinessDataProvider provider) {
        registry.register(provider);
    }

    /** Removes a provider and its rate limiter; cached responses it served stay until they expire. */
    public BusinessDataProvider unregisterProvider(String providerName) {
        return registry.unregister(providerName)
            .orElseThrow(() -> new ProviderNotFoundException(providerName));
    }

    public List<BusinessDataProvider> providers() {
        return registry.providers();
    }

    /** Flips a provider's health flag, which the selector reads on every search. */
    public BusinessDataProvider setProviderHealth(String providerName, boolean healthy) {
        BusinessDataProvider provider = registry.lookup(providerName)
            .orElseThrow(() -> new ProviderNotFoundException(providerName));
        provider.setHealthy(healthy);
        log.info("PROVIDER_HEALTH_SET provider={} healthy={}", providerName, healthy);
        return provider;
    }

    // ── public operations ─────────────────────────────────────────────────────

    public Mono<BusinessData> searchBusiness(BusinessSearchQuery query) {
        BusinessSearchQuery q = query == null ? BusinessSearchQuery.empty() : query;
        return execute(
            OperationKind.SEARCH,
            cacheKeys.generate(OperationKind.SEARCH.code(), q),
            () -> Mono.justOrEmpty(selector.selectBest(q))
                .switchIfEmpty(Mono.error(NoProviderAvailableException::new)),
            provider -> provider.searchBusiness(q),
            this::verifyQuality);
    }

    public Mono<BusinessData> getBusinessDetails(String businessId, String providerName) {
        String name = resolveProviderName(providerName);
        return execute(
            OperationKind.DETAILS,
            cacheKeys.generate(OperationKind.DETAILS.code(), businessId, name),
            () -> lookupNamed(name),
            provider -> provider.getBusinessDetails(businessId),
            NO_VERIFICATION);
    }

    public Mono<FinancialData> getFinancialData(String businessId, String providerName) {
        String name = resolveProviderName(providerName);
        return execute(
            OperationKind.FINANCIAL,
            cacheKeys.generate(OperationKind.FINANCIAL.code(), businessId, name),
            () -> lookupNamed(name),
            provider -> provider.getFinancialData(businessId),
            NO_VERIFICATION);
    }

    public Mono<ComplianceData> getComplianceData(String businessId, String providerName) {
        String name = resolveProviderName(providerName);
        return execute(
            OperationKind.COMPLIANCE,
            cacheKeys.generate(OperationKind.COMPLIANCE.code(), businessId, name),
            () -> lookupNamed(name),
            provider -> provider.getComplianceData(businessId),
            NO_VERIFICATION);
    }

    public Mono<List<NewsItem>> getNewsData(String businessId, String providerName) {
        String name = resolveProviderName(providerName);
        return execute(
            OperationKind.NEWS,
            cacheKeys.generate(OperationKind.NEWS.code(), businessId, name),
            () -> lookupNamed(name),
            provider -> provider.getNewsData(businessId),
            NO_VERIFICATION);
    }

    // ── pipeline ──────────────────────────────────────────────────────────────

    private <T> Mono<T> execute(OperationKind operation,
                                String cacheKey,
                                Supplier<Mono<BusinessDataProvider>> resolver,
                                Function<BusinessDataProvider, Mono<T>> call,
                                BiConsumer<BusinessDataProvider, ? super T> verifier) {
        return Mono.deferContextual(ctx -> {
            String traceId = TraceContextUtil.getTraceId(ctx);

            Optional<T> cached = cachedValue(cacheKey);
            if (cached.isPresent()) {
                TraceContextUtil.withMdc(traceId, () ->
                    log.info("CACHE_HIT operation={} key={}", operation.code(), cacheKey));
                return Mono.just(cached.get());
            }

            return resolver.get()
                .flatMap(this::acquirePermit)
                .flatMap(selected -> invokeWithFallback(operation, selected, call, traceId)
                    .map(result -> {
                        verifier.accept(selected, result.value());
                        return result;
                    }))
                .doOnNext(result -> {
                    store(cacheKey, result.value());
                    trackCost(result.provider(), operation);
                    TraceContextUtil.withMdc(traceId, () ->
                        log.info("REQUEST_SERVED operation={} provider={}", operation.code(), result.provider().name()));
                })
                .map(ProviderResult::value);
        });
    }

    private Mono<BusinessDataProvider> acquirePermit(BusinessDataProvider provider) {
        if (!settings.rateLimitingEnabled()) {
            return Mono.just(provider);
        }
        if (!registry.allow(provider.name())) {
            log.warn("RATE_LIMITED provider={}", provider.name());
            return Mono.error(new RateLimitedException(provider.name()));
        }
        if (!globalLimiter.tryAcquire()) {
            log.warn("RATE_LIMITED provider={} scope=global", provider.name());
            return Mono.error(new RateLimitedException(GLOBAL_LIMITER));
        }
        return Mono.just(provider);
    }

    private <T> Mono<ProviderResult<T>> invokeWithFallback(OperationKind operation,
                                                           BusinessDataProvider primary,
                                                           Function<BusinessDataProvider, Mono<T>> call,
                                                           String traceId) {
        return invoke(operation, primary, call)
            .onErrorResume(ProviderException.class, primaryError -> {
                Optional<BusinessDataProvider> fallback = fallbackFor(primary);
                if (fallback.isEmpty()) {
                    TraceContextUtil.withMdc(traceId, () ->
                        log.warn("PROVIDER_CALL_FAILED operation={} provider={} fallback=none reason={}",
                            operation.code(), primary.name(), primaryError.getMessage()));
                    return Mono.error(primaryError);
                }
                BusinessDataProvider secondary = fallback.get();
                TraceContextUtil.withMdc(traceId, () ->
                    log.warn("FALLBACK_INVOKED operation={} primary={} fallback={} reason={}",
                        operation.code(), primary.name(), secondary.name(), primaryError.getMessage()));
                return invoke(operation, secondary, call)
                    .onErrorMap(ProviderException.class, fallbackError -> {
                        ProviderCallFailedException failed = new ProviderCallFailedException(
                            operation, primary.name(), secondary.name(), fallbackError);
                        failed.addSuppressed(primaryError);
                        return failed;
                    });
            });
    }

    private <T> Mono<ProviderResult<T>> invoke(OperationKind operation,
                                               BusinessDataProvider provider,
                                               Function<BusinessDataProvider, Mono<T>> call) {
        return Mono.defer(() -> call.apply(provider))
            .switchIfEmpty(Mono.error(() -> new ProviderException(provider.name(),
                operation.description() + " returned no data from provider " + provider.name())))
            .map(value -> new ProviderResult<>(provider, value));
    }

    private Optional<BusinessDataProvider> fallbackFor(BusinessDataProvider primary) {
        String fallbackName = settings.fallbackProvider();
        if (fallbackName == null || fallbackName.equals(primary.name())) {
            return Optional.empty();
        }
        return registry.lookup(fallbackName);
    }

    private void verifyQuality(BusinessDataProvider selected, BusinessData record) {
        if (!settings.validationEnabled()) {
            return;
        }
        ValidationResult validation = selected.validateData(record);
        if (validation.qualityScore() < settings.qualityThreshold()) {
            log.warn("QUALITY_BELOW_THRESHOLD provider={} score={} threshold={} issues={}",
                selected.name(), validation.qualityScore(), settings.qualityThreshold(), validation.issues().size());
            throw new QualityBelowThresholdException(selected.name(), validation.qualityScore(),
                settings.qualityThreshold(), validation.issues());
        }
    }

    // ── cache / cost helpers ──────────────────────────────────────────────────

    @SuppressWarnings("unchecked")
    private <T> Optional<T> cachedValue(String cacheKey) {
        if (!settings.cachingEnabled()) {
            return Optional.empty();
        }
        return cache.get(cacheKey).map(value -> (T) value);
    }

    private void store(String cacheKey, Object value) {
        if (settings.cachingEnabled()) {
            cache.put(cacheKey, value, settings.cacheTtl());
        }
    }

    private void trackCost(BusinessDataProvider provider, OperationKind operation) {
        if (!settings.costTrackingEnabled()) {
            return;
        }
        double cost = provider.costPerOperation(operation);
        try {
            costTracker.record(provider.name(), operation, cost);
        } catch (RuntimeException e) {
            log.warn("COST_TRACKING_FAILED provider={} operation={} cost={}", provider.name(), operation.code(), cost, e);
        }
    }

    private Mono<BusinessDataProvider> lookupNamed(String name) {
        return Mono.justOrEmpty(registry.lookup(name))
            .switchIfEmpty(Mono.error(() -> new ProviderNotFoundException(name)));
    }

    private String resolveProviderName(String providerName) {
        return providerName == null || providerName.isBlank() ? settings.defaultProvider() : providerName;
    }

    private record ProviderResult<T>(BusinessDataProvider provider, T value) {}
}
