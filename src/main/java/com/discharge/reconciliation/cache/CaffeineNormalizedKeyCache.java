package com.discharge.reconciliation.cache;

import com.discharge.reconciliation.rules.KeyKind;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed normalized key cache.
 */
public class CaffeineNormalizedKeyCache implements NormalizedKeyCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineNormalizedKeyCache.class);

    private final Cache<CacheKey, String> cache;

    public CaffeineNormalizedKeyCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CaffeineNormalizedKeyCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<String> get(String rawValue, KeyKind kind) {
        return Optional.ofNullable(cache.getIfPresent(new CacheKey(rawValue, kind)));
    }

    @Override
    public void put(String rawValue, KeyKind kind, String normalized) {
        cache.put(new CacheKey(rawValue, kind), normalized);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all normalized keys");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    record CacheKey(String rawValue, KeyKind kind) {}
}
