package com.discharge.reconciliation.aggregate;

import java.util.List;
import java.util.Optional;

/**
 * Aggregated view of a reconciliation run.
 *
 * @param global       statistics over every stay
 * @param bySpecialty  one row per resolved specialty, by descending total then name
 * @param diffusion    dispatch statistics
 */
public record ValidationReport(
        ValidationStatistics global,
        List<SpecialtyStatistics> bySpecialty,
        DiffusionStatistics diffusion
) {
    public ValidationReport {
        bySpecialty = bySpecialty != null ? List.copyOf(bySpecialty) : List.of();
    }

    public Optional<SpecialtyStatistics> forSpecialty(String specialty) {
        return bySpecialty.stream()
                .filter(s -> s.specialty().equals(specialty))
                .findFirst();
    }
}
