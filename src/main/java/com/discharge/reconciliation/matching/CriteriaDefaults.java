package com.discharge.reconciliation.matching;

/**
 * Values taken by the eligibility criteria whose input columns are absent for a document.
 * Absent venue data is "not yet proven"; absent parent-document data does not penalize.
 *
 * @param venueMatchWhenAbsent      venue match when the document has no venue number
 * @param parentTimingWhenAbsent    parent timing when the document has no parent timestamps
 * @param parentFreshnessWhenAbsent parent freshness when the document has no parent timestamps
 */
public record CriteriaDefaults(
        boolean venueMatchWhenAbsent,
        boolean parentTimingWhenAbsent,
        boolean parentFreshnessWhenAbsent
) {

    public static CriteriaDefaults standard() {
        return new CriteriaDefaults(false, true, true);
    }
}
