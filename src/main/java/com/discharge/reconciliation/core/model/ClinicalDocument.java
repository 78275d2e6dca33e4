package com.discharge.reconciliation.core.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A clinical discharge-letter record as delivered by the document source.
 * A document may be a revision of an earlier "parent" document, in which case
 * the parent's creation and modification timestamps are carried along.
 */
public final class ClinicalDocument {
    private final String documentId;
    private final String patientId;
    private final String label;
    private final LocalDateTime createdAt;
    private final LocalDateTime validatedAt;
    private final String venueNumber;
    private final LocalDateTime parentCreatedAt;
    private final LocalDateTime parentModifiedAt;
    private final LocalDateTime dispatchedAt;

    private ClinicalDocument(Builder builder) {
        this.documentId = builder.documentId;
        this.patientId = builder.patientId;
        this.label = builder.label != null ? builder.label : "";
        this.createdAt = builder.createdAt;
        this.validatedAt = builder.validatedAt;
        this.venueNumber = builder.venueNumber;
        this.parentCreatedAt = builder.parentCreatedAt;
        this.parentModifiedAt = builder.parentModifiedAt;
        this.dispatchedAt = builder.dispatchedAt;
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getPatientId() {
        return patientId;
    }

    public String getLabel() {
        return label;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    /**
     * Validation timestamp, or null if the document was never validated.
     */
    public LocalDateTime getValidatedAt() {
        return validatedAt;
    }

    public String getVenueNumber() {
        return venueNumber;
    }

    public LocalDateTime getParentCreatedAt() {
        return parentCreatedAt;
    }

    public LocalDateTime getParentModifiedAt() {
        return parentModifiedAt;
    }

    public LocalDateTime getDispatchedAt() {
        return dispatchedAt;
    }

    public boolean isValidated() {
        return validatedAt != null;
    }

    public boolean hasParent() {
        return parentCreatedAt != null || parentModifiedAt != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ClinicalDocument that = (ClinicalDocument) o;
        return Objects.equals(documentId, that.documentId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(documentId);
    }

    @Override
    public String toString() {
        return "ClinicalDocument{" +
                "documentId='" + documentId + '\'' +
                ", patientId='" + patientId + '\'' +
                ", label='" + label + '\'' +
                ", createdAt=" + createdAt +
                ", validatedAt=" + validatedAt +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String documentId;
        private String patientId;
        private String label;
        private LocalDateTime createdAt;
        private LocalDateTime validatedAt;
        private String venueNumber;
        private LocalDateTime parentCreatedAt;
        private LocalDateTime parentModifiedAt;
        private LocalDateTime dispatchedAt;

        public Builder documentId(String documentId) {
            this.documentId = documentId;
            return this;
        }

        public Builder patientId(String patientId) {
            this.patientId = patientId;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder createdAt(LocalDateTime createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder validatedAt(LocalDateTime validatedAt) {
            this.validatedAt = validatedAt;
            return this;
        }

        public Builder venueNumber(String venueNumber) {
            this.venueNumber = venueNumber;
            return this;
        }

        public Builder parentCreatedAt(LocalDateTime parentCreatedAt) {
            this.parentCreatedAt = parentCreatedAt;
            return this;
        }

        public Builder parentModifiedAt(LocalDateTime parentModifiedAt) {
            this.parentModifiedAt = parentModifiedAt;
            return this;
        }

        public Builder dispatchedAt(LocalDateTime dispatchedAt) {
            this.dispatchedAt = dispatchedAt;
            return this;
        }

        public ClinicalDocument build() {
            Objects.requireNonNull(documentId, "documentId is required");
            Objects.requireNonNull(patientId, "patientId is required");
            Objects.requireNonNull(createdAt, "createdAt is required");
            return new ClinicalDocument(this);
        }
    }
}
