package com.discharge.reconciliation.matching;

import com.discharge.reconciliation.api.ReconciliationOptions;
import com.discharge.reconciliation.core.model.CandidatePair;
import com.discharge.reconciliation.core.model.ClinicalDocument;
import com.discharge.reconciliation.core.model.EligibilityCriteria;
import com.discharge.reconciliation.core.model.Stay;
import com.discharge.reconciliation.rules.KeyNormalizer;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes the six eligibility signals of a candidate pair, its composite eligibility
 * and, for eligible pairs only, the raw delay between discharge and validation.
 *
 * <p>All comparisons are made on calendar days; the time of day is ignored.</p>
 */
public class CriteriaEvaluator {

    private final KeyNormalizer normalizer;
    private final int validationLookbackDays;
    private final int creationLookbackDays;
    private final int parentFreshnessLookbackDays;
    private final int compositeThreshold;
    private final CriteriaDefaults defaults;

    public CriteriaEvaluator(KeyNormalizer normalizer, ReconciliationOptions options) {
        this.normalizer = normalizer;
        this.validationLookbackDays = options.getValidationLookbackDays();
        this.creationLookbackDays = options.getCreationLookbackDays();
        this.parentFreshnessLookbackDays = options.getParentFreshnessLookbackDays();
        this.compositeThreshold = options.getCompositeThreshold();
        this.defaults = options.getCriteriaDefaults();
    }

    public List<CandidatePair> evaluateAll(List<CandidatePair> pairs) {
        List<CandidatePair> evaluated = new ArrayList<>(pairs.size());
        for (CandidatePair pair : pairs) {
            evaluated.add(evaluate(pair));
        }
        return evaluated;
    }

    public CandidatePair evaluate(CandidatePair pair) {
        EligibilityCriteria criteria = criteria(pair.stay(), pair.document());
        Long rawDelay = criteria.eligible() ? rawDelay(pair.stay(), pair.document()) : null;
        return pair.withEvaluation(criteria, rawDelay);
    }

    EligibilityCriteria criteria(Stay stay, ClinicalDocument document) {
        LocalDate admission = stay.admissionDate();
        LocalDate discharge = stay.dischargeDate();
        LocalDate created = dateOf(document.getCreatedAt());
        LocalDate validated = dateOf(document.getValidatedAt());
        LocalDate parentCreated = dateOf(document.getParentCreatedAt());
        LocalDate parentModified = dateOf(document.getParentModifiedAt());

        boolean venueMatch = venueMatch(stay, document);

        boolean validationWindow = validated != null
                && !validated.isBefore(admission)
                && !validated.isBefore(discharge.minusDays(validationLookbackDays));

        boolean parentTiming = document.hasParent()
                ? onOrBefore(parentCreated, discharge) || onOrBefore(parentModified, discharge)
                : defaults.parentTimingWhenAbsent();

        boolean creationLowerBound = created != null
                && !created.isBefore(admission.minusDays(creationLookbackDays));

        boolean creationDuringStay = created != null
                && !created.isBefore(admission)
                && !created.isAfter(discharge);

        LocalDate freshnessBound = admission.minusDays(parentFreshnessLookbackDays);
        boolean parentFreshness = document.hasParent()
                ? onOrAfter(parentCreated, freshnessBound) || onOrAfter(parentModified, freshnessBound)
                : defaults.parentFreshnessWhenAbsent();

        int membersMet = count(validationWindow, parentTiming, creationLowerBound);
        boolean eligible = membersMet > compositeThreshold;

        return new EligibilityCriteria(venueMatch, validationWindow, parentTiming, creationLowerBound,
                creationDuringStay, parentFreshness, membersMet, eligible);
    }

    /**
     * Whole days from the discharge day to the validation day; negative when validated before discharge.
     */
    static Long rawDelay(Stay stay, ClinicalDocument document) {
        LocalDate validated = dateOf(document.getValidatedAt());
        if (validated == null) {
            return null;
        }
        return ChronoUnit.DAYS.between(stay.dischargeDate(), validated);
    }

    private boolean venueMatch(Stay stay, ClinicalDocument document) {
        String venue = normalizer.identifier(document.getVenueNumber());
        if (venue.isEmpty()) {
            return defaults.venueMatchWhenAbsent();
        }
        return venue.equals(normalizer.identifier(stay.stayId()));
    }

    private static LocalDate dateOf(LocalDateTime timestamp) {
        return timestamp != null ? timestamp.toLocalDate() : null;
    }

    private static boolean onOrBefore(LocalDate date, LocalDate bound) {
        return date != null && !date.isAfter(bound);
    }

    private static boolean onOrAfter(LocalDate date, LocalDate bound) {
        return date != null && !date.isBefore(bound);
    }

    private static int count(boolean... flags) {
        int n = 0;
        for (boolean flag : flags) {
            if (flag) {
                n++;
            }
        }
        return n;
    }
}
