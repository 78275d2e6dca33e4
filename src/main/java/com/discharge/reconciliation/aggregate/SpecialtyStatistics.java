package com.discharge.reconciliation.aggregate;

/**
 * Validation statistics of the stays attributed to one specialty.
 */
public record SpecialtyStatistics(String specialty, ValidationStatistics statistics) {

    public long total() {
        return statistics.total();
    }
}
