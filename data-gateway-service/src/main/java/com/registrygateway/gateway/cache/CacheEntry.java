package com.registrygateway.gateway.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * One cached value with its insertion time and time-to-live. {@code sequence} orders
 * entries inserted at the same instant.
 */
record CacheEntry<V>(V value, Instant insertedAt, Duration ttl, long sequence) {

    boolean isExpired(Instant now) {
        return Duration.between(insertedAt, now).compareTo(ttl) > 0;
    }

    boolean isOlderThan(CacheEntry<?> other) {
        int cmp = insertedAt.compareTo(other.insertedAt);
        return cmp < 0 || (cmp == 0 && sequence < other.sequence);
    }
}
