package com.discharge.reconciliation.metrics;

import com.discharge.reconciliation.core.model.Classification;

import java.time.Duration;

/**
 * Interface for recording reconciliation metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine works
 * without a metrics backend.
 */
public interface MetricsService {

    void recordRunDuration(Duration duration);

    void incrementClassification(Classification classification, long count);

    void recordCandidatePairs(int count);

    void recordConflicts(int contestedDocuments);

    void incrementDegradedReference();
}
