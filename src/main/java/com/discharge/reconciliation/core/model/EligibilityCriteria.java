package com.discharge.reconciliation.core.model;

/**
 * The eligibility signals computed for one (stay, document) pair.
 *
 * @param venueMatch          the stay id equals the document's venue number
 * @param validationWindow    validated on/after admission and on/after the look-back before discharge
 * @param parentTiming        the parent document was created or modified on/before discharge
 * @param creationLowerBound  created on/after the look-back before admission
 * @param creationDuringStay  created between admission and discharge, inclusive
 * @param parentFreshness     the parent document was created or modified on/after the look-back before admission
 * @param compositeMembersMet how many of {validationWindow, parentTiming, creationLowerBound} hold
 * @param eligible            composite eligibility
 */
public record EligibilityCriteria(
        boolean venueMatch,
        boolean validationWindow,
        boolean parentTiming,
        boolean creationLowerBound,
        boolean creationDuringStay,
        boolean parentFreshness,
        int compositeMembersMet,
        boolean eligible
) {
    public EligibilityCriteria {
        if (compositeMembersMet < 0 || compositeMembersMet > 3) {
            throw new IllegalArgumentException("compositeMembersMet must be between 0 and 3");
        }
    }
}
