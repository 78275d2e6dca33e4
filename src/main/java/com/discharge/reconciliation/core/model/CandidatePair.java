package com.discharge.reconciliation.core.model;

import java.util.Objects;

/**
 * A (stay, document) pair sharing a patient identity, decorated as it moves
 * through criteria evaluation, specialty resolution and ranking.
 * Instances are immutable; every decoration step returns a copy.
 *
 * @param stay          the stay side of the pair
 * @param document      the candidate document
 * @param documentKey   normalized document label used for specialty lookup
 * @param specialty     resolved specialty, or null
 * @param criteria      eligibility signals, or null before evaluation
 * @param rawDelay      validation date minus discharge date in days, null unless eligible
 * @param closenessRank rank in the coarse closeness ordering (0 until ranked)
 * @param selectionRank rank in the final selection ordering (0 until ranked)
 */
public record CandidatePair(
        Stay stay,
        ClinicalDocument document,
        String documentKey,
        String specialty,
        EligibilityCriteria criteria,
        Long rawDelay,
        int closenessRank,
        int selectionRank
) {
    public CandidatePair {
        Objects.requireNonNull(stay, "stay is required");
        Objects.requireNonNull(document, "document is required");
        documentKey = documentKey != null ? documentKey : "";
    }

    /**
     * Creates an undecorated pair.
     */
    public static CandidatePair of(Stay stay, ClinicalDocument document, String documentKey) {
        return new CandidatePair(stay, document, documentKey, null, null, null, 0, 0);
    }

    public CandidatePair withEvaluation(EligibilityCriteria criteria, Long rawDelay) {
        return new CandidatePair(stay, document, documentKey, specialty, criteria, rawDelay,
                closenessRank, selectionRank);
    }

    public CandidatePair withSpecialty(String specialty) {
        return new CandidatePair(stay, document, documentKey, specialty, criteria, rawDelay,
                closenessRank, selectionRank);
    }

    public CandidatePair withClosenessRank(int rank) {
        return new CandidatePair(stay, document, documentKey, specialty, criteria, rawDelay,
                rank, selectionRank);
    }

    public CandidatePair withSelectionRank(int rank) {
        return new CandidatePair(stay, document, documentKey, specialty, criteria, rawDelay,
                closenessRank, rank);
    }

    public String stayId() {
        return stay.stayId();
    }

    public String documentId() {
        return document.getDocumentId();
    }

    public boolean hasSpecialty() {
        return specialty != null;
    }

    public boolean isEligible() {
        return criteria != null && criteria.eligible();
    }
}
