package com.discharge.reconciliation.specialty;

import java.util.List;

/**
 * Source of the specialty reference mapping, loaded once per run.
 */
@FunctionalInterface
public interface SpecialtyMappingLoader {

    /**
     * Loads all mapping rows in source order.
     *
     * @throws ReferenceDataException if the mapping cannot be read
     */
    List<SpecialtyMapping> load();
}
