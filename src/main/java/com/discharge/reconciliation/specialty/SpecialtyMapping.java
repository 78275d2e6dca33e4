package com.discharge.reconciliation.specialty;

import java.util.Objects;

/**
 * One row of the specialty reference mapping. Unit code and label are already normalized.
 */
public record SpecialtyMapping(String unitCode, String normalizedLabel, String specialty) {

    public SpecialtyMapping {
        unitCode = unitCode != null ? unitCode : "";
        normalizedLabel = normalizedLabel != null ? normalizedLabel : "";
        Objects.requireNonNull(specialty, "specialty is required");
    }
}
