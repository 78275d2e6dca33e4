package com.discharge.reconciliation.api;

import com.discharge.reconciliation.core.model.Classification;
import com.discharge.reconciliation.core.model.MatchResult;
import com.discharge.reconciliation.matching.ConflictReport;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Result of a reconciliation run: one {@link MatchResult} per input stay, in stay input order,
 * plus run-level counters.
 */
public record ReconciliationResult(
        String runId,
        List<MatchResult> results,
        int candidateCount,
        int eligibleCount,
        ConflictReport conflicts,
        boolean specialtyDegraded,
        Duration duration
) {
    public ReconciliationResult {
        results = results != null ? List.copyOf(results) : List.of();
        conflicts = conflicts != null ? conflicts : ConflictReport.none();
        duration = duration != null ? duration : Duration.ZERO;
    }

    public long countBy(Classification classification) {
        return results.stream()
                .filter(r -> r.classification() == classification)
                .count();
    }

    public Optional<MatchResult> findByStayId(String stayId) {
        return results.stream()
                .filter(r -> r.stayId().equals(stayId))
                .findFirst();
    }

    public int size() {
        return results.size();
    }

    @Override
    public String toString() {
        return "ReconciliationResult{" +
                "runId='" + runId + '\'' +
                ", stays=" + results.size() +
                ", onTime=" + countBy(Classification.ON_TIME) +
                ", late=" + countBy(Classification.LATE) +
                ", unmatched=" + countBy(Classification.UNMATCHED) +
                ", candidates=" + candidateCount +
                ", conflicts=" + conflicts.contestedDocuments() +
                ", degraded=" + specialtyDegraded +
                '}';
    }
}
