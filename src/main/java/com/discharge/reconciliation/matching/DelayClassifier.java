package com.discharge.reconciliation.matching;

import com.discharge.reconciliation.core.model.CandidatePair;
import com.discharge.reconciliation.core.model.Classification;
import com.discharge.reconciliation.core.model.ClinicalDocument;
import com.discharge.reconciliation.core.model.MatchResult;
import com.discharge.reconciliation.core.model.ProvisionalMatch;
import com.discharge.reconciliation.core.model.Stay;

import java.time.temporal.ChronoUnit;

/**
 * Turns resolved provisional matches into final per-stay results.
 * A delay is only kept when a specialty was resolved; negative delays are clamped to zero.
 */
public class DelayClassifier {

    public static Long finalDelay(Long rawDelay, String specialty) {
        if (rawDelay == null || specialty == null) {
            return null;
        }
        return Math.max(0L, rawDelay);
    }

    public MatchResult toResult(ProvisionalMatch match) {
        Stay stay = match.stay();
        if (!match.hasSelection()) {
            return MatchResult.unmatched(stay, null, null);
        }

        CandidatePair selected = match.selected();
        String specialty = selected.specialty();
        Long delay = finalDelay(match.rawDelay(), specialty);
        Classification classification = specialty == null ? Classification.UNMATCHED : Classification.fromDelay(delay);
        Long dispatchDelay = classification.isMatched() && match.documentFree()
                ? dispatchDelay(selected.document())
                : null;

        return new MatchResult(stay.patientId(), stay.stayId(), stay.unitCode(), stay.dischargeDate(),
                specialty, selected.documentId(), delay, classification, dispatchDelay);
    }

    /**
     * Whole days between validation and dispatch of a document, clamped to zero; null when either is missing.
     */
    static Long dispatchDelay(ClinicalDocument document) {
        if (document.getValidatedAt() == null || document.getDispatchedAt() == null) {
            return null;
        }
        long days = ChronoUnit.DAYS.between(document.getValidatedAt().toLocalDate(),
                document.getDispatchedAt().toLocalDate());
        return Math.max(0L, days);
    }
}
