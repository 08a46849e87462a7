package com.registrygateway.gateway.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded in-memory cache with per-entry time-to-live.
 *
 * <p><strong>Expiry</strong> is lazy: {@link #get} checks the entry's age on every read and
 * evicts it when {@code now - insertedAt > ttl}. {@link #evictExpired()} is an optional sweep
 * and is never required for correctness.
 *
 * <p><strong>Capacity</strong>: inserting a new key into a full cache first evicts the entry
 * with the oldest insertion time (not the least recently read). Finding it is a linear scan,
 * O(n) per eviction. That is acceptable for the few-thousand-entry caches this gateway runs
 * with; a larger cache would want an insertion-ordered index instead.
 *
 * <p>Reads share a read lock; inserts, evictions and sweeps take the write lock. No
 * operation throws for absent or expired keys.
 *
 * @param <V> cached value type
 */
public class TtlCache<V> {

    private static final Logger log = LoggerFactory.getLogger(TtlCache.class);

    private final int maxEntries;
    private final Clock clock;
    private final Map<String, CacheEntry<V>> entries = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private long sequence;

    public TtlCache(int maxEntries, Clock clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive, got: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.clock      = clock;
    }

    /** Returns the live value for {@code key}, evicting it first if it has expired. */
    public Optional<V> get(String key) {
        CacheEntry<V> entry;
        lock.readLock().lock();
        try {
            entry = entries.get(key);
        } finally {
            lock.readLock().unlock();
        }
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            lock.writeLock().lock();
            try {
                // only drop the entry we saw; a concurrent put may already have replaced it
                entries.remove(key, entry);
            } finally {
                lock.writeLock().unlock();
            }
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    /** Stores {@code value} under {@code key}, evicting the oldest entry if a new key would exceed capacity. */
    public void put(String key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(ttl, "ttl");
        lock.writeLock().lock();
        try {
            if (!entries.containsKey(key) && entries.size() >= maxEntries) {
                evictOldest();
            }
            entries.put(key, new CacheEntry<>(value, clock.instant(), ttl, sequence++));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Drops every expired entry and returns how many were removed. */
    public int evictExpired() {
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            int before = entries.size();
            entries.values().removeIf(e -> e.isExpired(now));
            return before - entries.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Number of stored entries, expired ones included until they are read or swept. */
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // caller holds the write lock
    private void evictOldest() {
        String oldestKey = null;
        CacheEntry<V> oldest = null;
        for (Map.Entry<String, CacheEntry<V>> e : entries.entrySet()) {
            if (oldest == null || e.getValue().isOlderThan(oldest)) {
                oldestKey = e.getKey();
                oldest = e.getValue();
            }
        }
        if (oldestKey != null) {
            entries.remove(oldestKey);
            log.debug("CACHE_EVICT key={} insertedAt={}", oldestKey, oldest.insertedAt());
        }
    }
}
