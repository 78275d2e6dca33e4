package com.discharge.reconciliation.core.model;

import java.util.Objects;

/**
 * The top-ranked candidate of a stay, before and after conflict resolution.
 *
 * @param stay         the stay
 * @param selected     the rank-1 candidate, or null when the stay has no candidate
 * @param rawDelay     raw delay carried forward; nulled when the stay loses a contested document
 * @param documentFree false when another stay holds the selected document
 */
public record ProvisionalMatch(
        Stay stay,
        CandidatePair selected,
        Long rawDelay,
        boolean documentFree
) {
    public ProvisionalMatch {
        Objects.requireNonNull(stay, "stay is required");
    }

    public static ProvisionalMatch empty(Stay stay) {
        return new ProvisionalMatch(stay, null, null, true);
    }

    public static ProvisionalMatch of(CandidatePair selected) {
        return new ProvisionalMatch(selected.stay(), selected, selected.rawDelay(), true);
    }

    /**
     * Returns a copy that no longer holds its document: raw delay nulled, document not free.
     */
    public ProvisionalMatch demoted() {
        return new ProvisionalMatch(stay, selected, null, false);
    }

    public boolean hasSelection() {
        return selected != null;
    }

    public String selectedDocumentId() {
        return selected != null ? selected.documentId() : null;
    }

    public String specialty() {
        return selected != null ? selected.specialty() : null;
    }
}
