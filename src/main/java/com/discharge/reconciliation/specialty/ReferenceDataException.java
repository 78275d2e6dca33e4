package com.discharge.reconciliation.specialty;

/**
 * Runtime exception thrown when the specialty reference mapping cannot be loaded.
 * Always recovered by {@link SpecialtyResolver}, which degrades instead of failing the run.
 */
public class ReferenceDataException extends RuntimeException {

    public ReferenceDataException(String message) {
        super(message);
    }

    public ReferenceDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
