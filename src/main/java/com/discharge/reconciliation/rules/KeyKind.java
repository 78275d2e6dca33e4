package com.discharge.reconciliation.rules;

/**
 * Kind of value being normalized into a matching key.
 * Normalization rules can be scoped to one or more kinds.
 */
public enum KeyKind {
    /**
     * Free-text document label (also used for reference mapping labels).
     */
    DOCUMENT_LABEL,

    /**
     * Organizational unit code.
     */
    UNIT_CODE,

    /**
     * Patient, stay or venue identifier.
     */
    IDENTIFIER
}
