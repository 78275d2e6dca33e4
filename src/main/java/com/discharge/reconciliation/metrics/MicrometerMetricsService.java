package com.discharge.reconciliation.metrics;

import com.discharge.reconciliation.core.model.Classification;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code reconciliation.run.duration} - Timer</li>
 *   <li>{@code reconciliation.stays} - Counter (tag: classification)</li>
 *   <li>{@code reconciliation.candidate.pairs} - DistributionSummary</li>
 *   <li>{@code reconciliation.conflicts} - Counter of contested documents</li>
 *   <li>{@code reconciliation.reference.degraded} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Timer runTimer;
    private final Map<Classification, Counter> classificationCounters = new EnumMap<>(Classification.class);
    private final DistributionSummary candidatePairsSummary;
    private final Counter conflictCounter;
    private final Counter degradedReferenceCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.runTimer = Timer.builder("reconciliation.run.duration")
                .description("Duration of reconciliation runs")
                .register(registry);
        for (Classification classification : Classification.values()) {
            classificationCounters.put(classification, Counter.builder("reconciliation.stays")
                    .description("Number of stays per classification")
                    .tag("classification", classification.label())
                    .register(registry));
        }
        this.candidatePairsSummary = DistributionSummary.builder("reconciliation.candidate.pairs")
                .description("Number of candidate pairs per run")
                .register(registry);
        this.conflictCounter = Counter.builder("reconciliation.conflicts")
                .description("Number of documents selected by more than one stay")
                .register(registry);
        this.degradedReferenceCounter = Counter.builder("reconciliation.reference.degraded")
                .description("Number of runs without a specialty reference mapping")
                .register(registry);
    }

    @Override
    public void recordRunDuration(Duration duration) {
        runTimer.record(duration);
    }

    @Override
    public void incrementClassification(Classification classification, long count) {
        classificationCounters.get(classification).increment(count);
    }

    @Override
    public void recordCandidatePairs(int count) {
        candidatePairsSummary.record(count);
    }

    @Override
    public void recordConflicts(int contestedDocuments) {
        conflictCounter.increment(contestedDocuments);
    }

    @Override
    public void incrementDegradedReference() {
        degradedReferenceCounter.increment();
    }
}
