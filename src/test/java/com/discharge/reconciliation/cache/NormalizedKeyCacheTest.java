package com.discharge.reconciliation.cache;

import com.discharge.reconciliation.rules.KeyKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NormalizedKeyCacheTest {

    @Nested
    @DisplayName("NoOpNormalizedKeyCache")
    class NoOpTests {

        @Test
        @DisplayName("Should always return empty on get")
        void getAlwaysEmpty() {
            NoOpNormalizedKeyCache cache = new NoOpNormalizedKeyCache();
            cache.put("Cardiologie", KeyKind.DOCUMENT_LABEL, "CARDIOLOGIE");
            assertTrue(cache.get("Cardiologie", KeyKind.DOCUMENT_LABEL).isEmpty());
            assertEquals(CacheStats.empty(), cache.getStats());
        }
    }

    @Nested
    @DisplayName("CaffeineNormalizedKeyCache")
    class CaffeineTests {

        private final CaffeineNormalizedKeyCache cache = new CaffeineNormalizedKeyCache(new CacheConfig(100, 60, true));

        @Test
        @DisplayName("Should return cached key")
        void putAndGet() {
            cache.put("Cardiologie", KeyKind.DOCUMENT_LABEL, "CARDIOLOGIE");
            assertEquals("CARDIOLOGIE", cache.get("Cardiologie", KeyKind.DOCUMENT_LABEL).orElseThrow());
        }

        @Test
        @DisplayName("Entries are scoped by key kind")
        void scopedByKind() {
            cache.put("101.0", KeyKind.IDENTIFIER, "101");
            assertTrue(cache.get("101.0", KeyKind.UNIT_CODE).isEmpty());
        }

        @Test
        @DisplayName("invalidateAll clears entries")
        void invalidateAll() {
            cache.put("Cardiologie", KeyKind.DOCUMENT_LABEL, "CARDIOLOGIE");
            cache.invalidateAll();
            assertTrue(cache.get("Cardiologie", KeyKind.DOCUMENT_LABEL).isEmpty());
        }

        @Test
        @DisplayName("Stats track hits and misses")
        void stats() {
            cache.put("a", KeyKind.DOCUMENT_LABEL, "A");
            cache.get("a", KeyKind.DOCUMENT_LABEL);
            cache.get("b", KeyKind.DOCUMENT_LABEL);

            CacheStats stats = cache.getStats();
            assertEquals(1, stats.hitCount());
            assertEquals(1, stats.missCount());
            assertEquals(0.5, stats.hitRate(), 0.0001);
        }
    }

    @Nested
    @DisplayName("CacheConfig")
    class ConfigTests {

        @Test
        @DisplayName("Invalid sizes are rejected")
        void rejectsInvalid() {
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 60, true));
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, true));
        }

        @Test
        @DisplayName("create() picks the implementation from the enabled flag")
        void factory() {
            assertInstanceOf(CaffeineNormalizedKeyCache.class, NormalizedKeyCache.create(CacheConfig.defaults()));
            assertInstanceOf(NoOpNormalizedKeyCache.class, NormalizedKeyCache.create(CacheConfig.disabled()));
        }
    }
}
