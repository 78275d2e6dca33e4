package com.discharge.reconciliation.api;

/**
 * Runtime exception thrown when an input table violates its shape contract
 * (missing table, missing required identity column or value, discharge before admission).
 * This is the only failure a reconciliation run reports to its caller.
 */
public class StructuralInputException extends RuntimeException {

    public StructuralInputException(String message) {
        super(message);
    }

    public StructuralInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
