package com.discharge.reconciliation.specialty;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable (unit code, normalized label) to specialty lookup.
 * When the source holds duplicate keys, the first row wins.
 */
public final class SpecialtyReferenceTable {
    private static final Logger log = LoggerFactory.getLogger(SpecialtyReferenceTable.class);

    private static final SpecialtyReferenceTable DEGRADED = new SpecialtyReferenceTable(Map.of(), 0, true);

    private final Map<Key, String> specialties;
    private final int duplicatesIgnored;
    private final boolean degraded;

    private SpecialtyReferenceTable(Map<Key, String> specialties, int duplicatesIgnored, boolean degraded) {
        this.specialties = specialties;
        this.duplicatesIgnored = duplicatesIgnored;
        this.degraded = degraded;
    }

    public static SpecialtyReferenceTable of(List<SpecialtyMapping> rows) {
        Map<Key, String> specialties = new HashMap<>();
        int duplicates = 0;
        for (SpecialtyMapping row : rows) {
            Key key = new Key(row.unitCode(), row.normalizedLabel());
            if (specialties.putIfAbsent(key, row.specialty()) != null) {
                duplicates++;
                log.debug("Duplicate mapping ignored unit='{}' label='{}' specialty='{}'",
                        row.unitCode(), row.normalizedLabel(), row.specialty());
            }
        }
        return new SpecialtyReferenceTable(Map.copyOf(specialties), duplicates, false);
    }

    /**
     * Table used when the mapping could not be loaded: resolves nothing.
     */
    public static SpecialtyReferenceTable degraded() {
        return DEGRADED;
    }

    /**
     * Returns the specialty for the pair, or null if no row matches.
     */
    public String lookup(String unitCode, String normalizedLabel) {
        if (unitCode == null || normalizedLabel == null) {
            return null;
        }
        return specialties.get(new Key(unitCode, normalizedLabel));
    }

    public int size() {
        return specialties.size();
    }

    public int getDuplicatesIgnored() {
        return duplicatesIgnored;
    }

    public boolean isDegraded() {
        return degraded;
    }

    private record Key(String unitCode, String normalizedLabel) {}
}
