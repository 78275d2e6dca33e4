package com.discharge.reconciliation.cache;

import com.discharge.reconciliation.rules.KeyKind;

import java.util.Optional;

/**
 * Cache of normalized keys, keyed by raw value + key kind.
 * Document labels repeat heavily across a run, so each distinct label is normalized once.
 */
public interface NormalizedKeyCache {

    Optional<String> get(String rawValue, KeyKind kind);

    void put(String rawValue, KeyKind kind, String normalized);

    void invalidateAll();

    CacheStats getStats();

    /**
     * Creates the cache matching the given configuration.
     */
    static NormalizedKeyCache create(CacheConfig config) {
        return config.enabled() ? new CaffeineNormalizedKeyCache(config) : new NoOpNormalizedKeyCache();
    }
}
