package com.registrygateway.gateway.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Drops expired response-cache entries in the background so memory does not wait for reads. */
@Component
public class CacheSweeper {

    private static final Logger log = LoggerFactory.getLogger(CacheSweeper.class);

    private final TtlCache<Object> responseCache;

    public CacheSweeper(TtlCache<Object> responseCache) {
        this.responseCache = responseCache;
    }

    @Scheduled(fixedDelayString = "${gateway.cache.sweep-interval-ms:60000}")
    public int sweep() {
        int removed = responseCache.evictExpired();
        if (removed > 0) {
            log.info("CACHE_SWEEP removed={} remaining={}", removed, responseCache.size());
        }
        return removed;
    }
}
