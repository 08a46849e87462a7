package com.registrygateway.gateway.registry;

import com.registrygateway.gateway.provider.BusinessDataProvider;
import com.registrygateway.gateway.provider.ProviderDescriptor;
import com.registrygateway.gateway.ratelimit.TokenBucketRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns the registered providers and one token bucket per provider.
 *
 * <p>Providers and limiters live in two maps, each behind its own read/write lock, so
 * lookups from concurrent requests never block each other. Writers take the providers
 * lock first and the limiters lock inside it; a provider and its bucket are therefore
 * always replaced or removed together.
 *
 * <p>{@link #providers()} returns providers in registration order, which the selector
 * relies on for tie-breaking. Re-registering a name replaces the provider and its
 * limiter (no state is carried over) and moves it to the end of that order.
 */
@Component
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Clock clock;

    private final Map<String, BusinessDataProvider> providers = new LinkedHashMap<>();
    private final ReentrantReadWriteLock providersLock = new ReentrantReadWriteLock();

    private final Map<String, TokenBucketRateLimiter> limiters = new HashMap<>();
    private final ReentrantReadWriteLock limitersLock = new ReentrantReadWriteLock();

    public ProviderRegistry(Clock clock) {
        this.clock = clock;
    }

    public void register(BusinessDataProvider provider) {
        Objects.requireNonNull(provider, "provider");
        ProviderDescriptor descriptor = provider.descriptor();
        String name = descriptor.name();

        TokenBucketRateLimiter limiter =
            new TokenBucketRateLimiter(descriptor.rateLimitPerMinute(), descriptor.burstLimit(), clock);

        boolean replaced;
        providersLock.writeLock().lock();
        try {
            // limiter first, so a visible provider always has its current bucket
            limitersLock.writeLock().lock();
            try {
                limiters.put(name, limiter);
            } finally {
                limitersLock.writeLock().unlock();
            }
            replaced = providers.remove(name) != null;
            providers.put(name, provider);
        } finally {
            providersLock.writeLock().unlock();
        }

        log.info("PROVIDER_REGISTERED name={} type={} ratePerMinute={} burst={} replaced={}",
            name, descriptor.type(), limiter.ratePerMinute(), limiter.burst(), replaced);
    }

    /** Removes a provider and its limiter, returning the provider that was registered under {@code name}. */
    public Optional<BusinessDataProvider> unregister(String name) {
        BusinessDataProvider removed;
        providersLock.writeLock().lock();
        try {
            removed = providers.remove(name);
            limitersLock.writeLock().lock();
            try {
                limiters.remove(name);
            } finally {
                limitersLock.writeLock().unlock();
            }
        } finally {
            providersLock.writeLock().unlock();
        }
        if (removed != null) {
            log.info("PROVIDER_UNREGISTERED name={}", name);
        }
        return Optional.ofNullable(removed);
    }

    public Optional<BusinessDataProvider> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        providersLock.readLock().lock();
        try {
            return Optional.ofNullable(providers.get(name));
        } finally {
            providersLock.readLock().unlock();
        }
    }

    /** Snapshot of all providers in registration order. */
    public List<BusinessDataProvider> providers() {
        providersLock.readLock().lock();
        try {
            return List.copyOf(providers.values());
        } finally {
            providersLock.readLock().unlock();
        }
    }

    /**
     * Takes one token from {@code providerName}'s bucket. A name with no bucket is
     * allowed: limiting only applies to registered providers.
     */
    public boolean allow(String providerName) {
        TokenBucketRateLimiter limiter = limiterFor(providerName);
        return limiter == null || limiter.tryAcquire();
    }

    public OptionalDouble availableTokens(String providerName) {
        TokenBucketRateLimiter limiter = limiterFor(providerName);
        return limiter == null ? OptionalDouble.empty() : OptionalDouble.of(limiter.availableTokens());
    }

    public int size() {
        providersLock.readLock().lock();
        try {
            return providers.size();
        } finally {
            providersLock.readLock().unlock();
        }
    }

    private TokenBucketRateLimiter limiterFor(String providerName) {
        limitersLock.readLock().lock();
        try {
            return limiters.get(providerName);
        } finally {
            limitersLock.readLock().unlock();
        }
    }
}
