package com.discharge.reconciliation.metrics;

import com.discharge.reconciliation.core.model.Classification;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordRunDuration(Duration duration) {
    }

    @Override
    public void incrementClassification(Classification classification, long count) {
    }

    @Override
    public void recordCandidatePairs(int count) {
    }

    @Override
    public void recordConflicts(int contestedDocuments) {
    }

    @Override
    public void incrementDegradedReference() {
    }
}
