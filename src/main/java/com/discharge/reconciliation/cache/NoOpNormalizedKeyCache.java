package com.discharge.reconciliation.cache;

import com.discharge.reconciliation.rules.KeyKind;

import java.util.Optional;

/**
 * No-op cache implementation. Used when caching is disabled.
 */
public class NoOpNormalizedKeyCache implements NormalizedKeyCache {

    @Override
    public Optional<String> get(String rawValue, KeyKind kind) {
        return Optional.empty();
    }

    @Override
    public void put(String rawValue, KeyKind kind, String normalized) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
