package com.discharge.reconciliation.api;

import com.discharge.reconciliation.core.model.ClinicalDocument;
import com.discharge.reconciliation.core.model.Stay;

import java.util.List;

/**
 * Structural checks on the input tables of a run.
 * Any violation is fatal and reported as a {@link StructuralInputException}.
 */
final class InputValidator {

    private InputValidator() {
    }

    static void validate(List<Stay> stays, List<ClinicalDocument> documents) {
        if (stays == null) {
            throw new StructuralInputException("stay table is missing");
        }
        if (documents == null) {
            throw new StructuralInputException("document table is missing");
        }
        for (int i = 0; i < stays.size(); i++) {
            validateStay(stays.get(i), i);
        }
        for (int i = 0; i < documents.size(); i++) {
            validateDocument(documents.get(i), i);
        }
    }

    private static void validateStay(Stay stay, int index) {
        if (stay == null) {
            throw new StructuralInputException("stay row " + index + " is null");
        }
        if (stay.stayId().isBlank()) {
            throw new StructuralInputException("stay row " + index + " has no stay id");
        }
        if (stay.patientId().isBlank()) {
            throw new StructuralInputException("stay " + stay.stayId() + " has no patient id");
        }
        if (stay.discharge().isBefore(stay.admission())) {
            throw new StructuralInputException("stay " + stay.stayId() + " is discharged before admission: "
                    + stay.admission() + " > " + stay.discharge());
        }
    }

    private static void validateDocument(ClinicalDocument document, int index) {
        if (document == null) {
            throw new StructuralInputException("document row " + index + " is null");
        }
        if (document.getDocumentId().isBlank()) {
            throw new StructuralInputException("document row " + index + " has no document id");
        }
        if (document.getPatientId().isBlank()) {
            throw new StructuralInputException("document " + document.getDocumentId() + " has no patient id");
        }
    }
}
