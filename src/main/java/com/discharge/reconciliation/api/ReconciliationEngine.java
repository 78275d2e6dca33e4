package com.discharge.reconciliation.api;

import com.discharge.reconciliation.cache.NormalizedKeyCache;
import com.discharge.reconciliation.core.model.CandidatePair;
import com.discharge.reconciliation.core.model.Classification;
import com.discharge.reconciliation.core.model.ClinicalDocument;
import com.discharge.reconciliation.core.model.MatchResult;
import com.discharge.reconciliation.core.model.ProvisionalMatch;
import com.discharge.reconciliation.core.model.Stay;
import com.discharge.reconciliation.logging.LogContext;
import com.discharge.reconciliation.matching.CandidateJoin;
import com.discharge.reconciliation.matching.CandidateRanker;
import com.discharge.reconciliation.matching.ConflictResolver;
import com.discharge.reconciliation.matching.CriteriaEvaluator;
import com.discharge.reconciliation.matching.DelayClassifier;
import com.discharge.reconciliation.metrics.MetricsService;
import com.discharge.reconciliation.metrics.NoOpMetricsService;
import com.discharge.reconciliation.rules.DocumentKeyRules;
import com.discharge.reconciliation.rules.KeyNormalizer;
import com.discharge.reconciliation.specialty.SpecialtyMappingLoader;
import com.discharge.reconciliation.specialty.SpecialtyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Main entry point: reconciles a stay table with a document table.
 *
 * <p>A run validates the input, joins stays and documents on patient identity, evaluates
 * the eligibility criteria of each pair, resolves specialties, ranks and selects one
 * candidate per stay, enforces document exclusivity and finally classifies every stay.
 * The run is synchronous and deterministic: the same input always yields the same output.</p>
 *
 * <pre>
 * ReconciliationEngine engine = ReconciliationEngine.builder()
 *     .options(ReconciliationOptions.defaults())
 *     .metricsService(new MicrometerMetricsService(registry))
 *     .build();
 *
 * ReconciliationResult result = engine.reconcile(stays, documents, mappingLoader);
 * </pre>
 *
 * <p>The only failure surfaced to callers is {@link StructuralInputException}. An unavailable
 * specialty mapping degrades the run (every stay becomes {@code unmatched}) without raising.</p>
 */
public class ReconciliationEngine {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final ReconciliationOptions options;
    private final MetricsService metricsService;
    private final KeyNormalizer normalizer;
    private final CandidateJoin join;
    private final CriteriaEvaluator evaluator;
    private final CandidateRanker ranker;
    private final ConflictResolver conflictResolver;
    private final DelayClassifier classifier;

    private ReconciliationEngine(Builder builder) {
        this.options = builder.options;
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.normalizer = builder.keyNormalizer != null
                ? builder.keyNormalizer
                : new KeyNormalizer(DocumentKeyRules.createDefaultEngine(),
                        NormalizedKeyCache.create(options.getCacheConfig()));
        this.join = new CandidateJoin(normalizer);
        this.evaluator = new CriteriaEvaluator(normalizer, options);
        this.ranker = new CandidateRanker(options.isParallelRanking());
        this.conflictResolver = new ConflictResolver();
        this.classifier = new DelayClassifier();
    }

    /**
     * Loads the specialty mapping through the given loader and reconciles.
     * A failing loader degrades the run instead of failing it.
     */
    public ReconciliationResult reconcile(List<Stay> stays, List<ClinicalDocument> documents,
                                          SpecialtyMappingLoader mappingLoader) {
        InputValidator.validate(stays, documents);
        return reconcile(stays, documents, SpecialtyResolver.load(mappingLoader));
    }

    public ReconciliationResult reconcile(List<Stay> stays, List<ClinicalDocument> documents,
                                          SpecialtyResolver specialtyResolver) {
        InputValidator.validate(stays, documents);
        String runId = LogContext.generateRunId();

        try (LogContext ctx = LogContext.forRun(runId)) {
            long start = System.nanoTime();
            log.info("reconciliation.started runId={} stays={} documents={}", runId, stays.size(), documents.size());

            if (specialtyResolver.isDegraded()) {
                log.warn("reconciliation.degraded runId={} reason=specialty-mapping-unavailable", runId);
                metricsService.incrementDegradedReference();
            }

            List<CandidatePair> pairs = join.join(stays, documents);
            List<CandidatePair> evaluated = resolveSpecialties(evaluator.evaluateAll(pairs), specialtyResolver);
            int eligible = (int) evaluated.stream().filter(CandidatePair::isEligible).count();

            List<ProvisionalMatch> provisional = ranker.select(stays, evaluated);
            ConflictResolver.Resolution resolution = conflictResolver.resolve(provisional);

            List<MatchResult> results = new ArrayList<>(resolution.matches().size());
            for (ProvisionalMatch match : resolution.matches()) {
                results.add(classifier.toResult(match));
            }

            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            ReconciliationResult result = new ReconciliationResult(runId, results, pairs.size(), eligible,
                    resolution.report(), specialtyResolver.isDegraded(), duration);

            recordMetrics(result);
            log.info("reconciliation.completed runId={} stays={} onTime={} late={} unmatched={} candidates={} "
                            + "eligible={} contestedDocuments={} durationMs={}",
                    runId, result.size(), result.countBy(Classification.ON_TIME),
                    result.countBy(Classification.LATE), result.countBy(Classification.UNMATCHED),
                    pairs.size(), eligible, resolution.report().contestedDocuments(), duration.toMillis());
            return result;
        }
    }

    private List<CandidatePair> resolveSpecialties(List<CandidatePair> pairs, SpecialtyResolver resolver) {
        List<CandidatePair> resolved = new ArrayList<>(pairs.size());
        for (CandidatePair pair : pairs) {
            String unitCode = normalizer.unitCode(pair.stay().unitCode());
            resolved.add(pair.withSpecialty(resolver.resolve(unitCode, pair.documentKey())));
        }
        return resolved;
    }

    private void recordMetrics(ReconciliationResult result) {
        metricsService.recordRunDuration(result.duration());
        metricsService.recordCandidatePairs(result.candidateCount());
        metricsService.recordConflicts(result.conflicts().contestedDocuments());
        for (Classification classification : Classification.values()) {
            metricsService.incrementClassification(classification, result.countBy(classification));
        }
    }

    public ReconciliationOptions getOptions() {
        return options;
    }

    public KeyNormalizer getKeyNormalizer() {
        return normalizer;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ReconciliationOptions options = ReconciliationOptions.defaults();
        private MetricsService metricsService;
        private KeyNormalizer keyNormalizer;

        public Builder options(ReconciliationOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Sets the metrics service. Defaults to a no-op implementation.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Sets the key normalizer. Defaults to the standard document-key rules backed by
         * a cache built from {@link ReconciliationOptions#getCacheConfig()}.
         */
        public Builder keyNormalizer(KeyNormalizer keyNormalizer) {
            this.keyNormalizer = keyNormalizer;
            return this;
        }

        public ReconciliationEngine build() {
            if (options == null) {
                throw new IllegalStateException("options are required");
            }
            return new ReconciliationEngine(this);
        }
    }
}
