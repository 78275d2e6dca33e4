package com.discharge.reconciliation.rules;

import com.discharge.reconciliation.cache.NoOpNormalizedKeyCache;
import com.discharge.reconciliation.cache.NormalizedKeyCache;

/**
 * Canonicalizes document labels, unit codes and identifiers into exact-match keys.
 * The same function is applied to document labels and to reference mapping labels,
 * so specialty lookups are plain string equality.
 */
public class KeyNormalizer {

    private final NormalizationEngine engine;
    private final NormalizedKeyCache cache;

    public KeyNormalizer() {
        this(DocumentKeyRules.createDefaultEngine(), new NoOpNormalizedKeyCache());
    }

    public KeyNormalizer(NormalizationEngine engine, NormalizedKeyCache cache) {
        this.engine = engine;
        this.cache = cache;
    }

    public String documentKey(String label) {
        return normalize(label, KeyKind.DOCUMENT_LABEL);
    }

    public String mappingKey(String label) {
        return documentKey(label);
    }

    public String unitCode(String code) {
        return normalize(code, KeyKind.UNIT_CODE);
    }

    public String identifier(String id) {
        return normalize(id, KeyKind.IDENTIFIER);
    }

    public NormalizedKeyCache getCache() {
        return cache;
    }

    private String normalize(String value, KeyKind kind) {
        if (value == null || value.isBlank()) {
            return "";
        }
        return cache.get(value, kind).orElseGet(() -> {
            String normalized = engine.normalize(value, kind);
            cache.put(value, kind, normalized);
            return normalized;
        });
    }
}
