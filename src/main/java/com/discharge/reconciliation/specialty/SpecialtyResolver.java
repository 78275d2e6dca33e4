package com.discharge.reconciliation.specialty;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Assigns a clinical specialty to a (unit code, document key) pair.
 *
 * <p>If the reference mapping cannot be loaded the resolver degrades globally to
 * "no specialty for anyone": the failure is logged, never raised, and every stay of
 * the run ends up {@code unmatched}.</p>
 */
public class SpecialtyResolver {
    private static final Logger log = LoggerFactory.getLogger(SpecialtyResolver.class);

    private final SpecialtyReferenceTable table;

    public SpecialtyResolver(SpecialtyReferenceTable table) {
        this.table = table;
    }

    /**
     * Loads the mapping through the given loader, degrading on failure.
     */
    public static SpecialtyResolver load(SpecialtyMappingLoader loader) {
        try {
            List<SpecialtyMapping> rows = loader.load();
            SpecialtyReferenceTable table = SpecialtyReferenceTable.of(rows);
            log.info("specialty.mapping.loaded rows={} keys={} duplicatesIgnored={}",
                    rows.size(), table.size(), table.getDuplicatesIgnored());
            return new SpecialtyResolver(table);
        } catch (RuntimeException e) {
            log.warn("specialty.mapping.unavailable error={} - no specialty will be resolved for this run",
                    e.getMessage(), e);
            return degraded();
        }
    }

    public static SpecialtyResolver degraded() {
        return new SpecialtyResolver(SpecialtyReferenceTable.degraded());
    }

    /**
     * Returns the specialty for a normalized unit code and document key, or null.
     */
    public String resolve(String unitCode, String documentKey) {
        return table.lookup(unitCode, documentKey);
    }

    public boolean isDegraded() {
        return table.isDegraded();
    }

    public SpecialtyReferenceTable getTable() {
        return table;
    }
}
