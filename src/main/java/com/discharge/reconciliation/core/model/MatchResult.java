package com.discharge.reconciliation.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Per-stay outcome of a reconciliation run. One result exists for every input stay.
 *
 * @param patientId         patient identity
 * @param stayId            stay identity
 * @param unitCode          discharge unit of the stay
 * @param dischargeDate     calendar day of discharge
 * @param specialty         resolved specialty, or null
 * @param documentId        selected document, or null
 * @param delayDays         final clamped delay, or null
 * @param classification    outcome derived from the delay and the specialty
 * @param dispatchDelayDays days between validation and dispatch of the held document, or null
 */
public record MatchResult(
        String patientId,
        String stayId,
        String unitCode,
        LocalDate dischargeDate,
        String specialty,
        String documentId,
        Long delayDays,
        Classification classification,
        Long dispatchDelayDays
) {
    public MatchResult {
        Objects.requireNonNull(stayId, "stayId is required");
        Objects.requireNonNull(classification, "classification is required");
        if (delayDays != null && delayDays < 0) {
            throw new IllegalArgumentException("delayDays must be >= 0, got " + delayDays);
        }
        if (dispatchDelayDays != null && dispatchDelayDays < 0) {
            throw new IllegalArgumentException("dispatchDelayDays must be >= 0, got " + dispatchDelayDays);
        }
        Classification expected = specialty == null ? Classification.UNMATCHED : Classification.fromDelay(delayDays);
        if (classification != expected) {
            throw new IllegalArgumentException("classification " + classification
                    + " is inconsistent with delay=" + delayDays + " specialty=" + specialty);
        }
    }

    /**
     * Creates the result of a stay for which no document was attributed.
     */
    public static MatchResult unmatched(Stay stay, String specialty, String documentId) {
        return new MatchResult(stay.patientId(), stay.stayId(), stay.unitCode(), stay.dischargeDate(),
                specialty, documentId, null, Classification.UNMATCHED, null);
    }

    public boolean isMatched() {
        return classification.isMatched();
    }

    public boolean hasDocument() {
        return documentId != null;
    }
}
