package com.discharge.reconciliation.core.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One hospitalization episode, as delivered by the stay source.
 * Immutable input of a reconciliation run.
 *
 * @param patientId patient identity shared with the document source
 * @param stayId    stay identity, also compared against a document's venue number
 * @param admission admission timestamp
 * @param discharge discharge timestamp
 * @param unitCode  organizational unit the patient was discharged from (may be blank)
 */
public record Stay(
        String patientId,
        String stayId,
        LocalDateTime admission,
        LocalDateTime discharge,
        String unitCode
) {
    public Stay {
        Objects.requireNonNull(patientId, "patientId is required");
        Objects.requireNonNull(stayId, "stayId is required");
        Objects.requireNonNull(admission, "admission is required");
        Objects.requireNonNull(discharge, "discharge is required");
        unitCode = unitCode != null ? unitCode : "";
    }

    public LocalDate admissionDate() {
        return admission.toLocalDate();
    }

    public LocalDate dischargeDate() {
        return discharge.toLocalDate();
    }
}
