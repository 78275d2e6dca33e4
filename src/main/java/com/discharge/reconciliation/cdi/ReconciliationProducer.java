package com.discharge.reconciliation.cdi;

import com.discharge.reconciliation.api.ReconciliationEngine;
import com.discharge.reconciliation.api.ReconciliationOptions;
import com.discharge.reconciliation.bulk.CsvDocumentSource;
import com.discharge.reconciliation.bulk.CsvStaySource;
import com.discharge.reconciliation.cache.CacheConfig;
import com.discharge.reconciliation.matching.CriteriaDefaults;
import com.discharge.reconciliation.report.ReconciliationJob;
import com.discharge.reconciliation.specialty.CsvSpecialtyMappingLoader;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;

/**
 * CDI producer that wires the reconciliation engine and the monthly job from MicroProfile Config properties.
 *
 * <h2>Configuration</h2>
 * <pre>
 * discharge-reconciliation:
 *   criteria:
 *     validation-lookback-days: 3
 *     composite-threshold: 2
 *   input:
 *     stays-file: /data/stays.csv
 *     documents-file: /data/documents.csv
 *     specialty-mapping-file: /data/mapping_uf_spe.csv
 * </pre>
 */
@ApplicationScoped
public class ReconciliationProducer {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationProducer.class);

    // ── Criteria ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "discharge-reconciliation.criteria.validation-lookback-days", defaultValue = "3")
    int validationLookbackDays;

    @Inject
    @ConfigProperty(name = "discharge-reconciliation.criteria.creation-lookback-days", defaultValue = "5")
    int creationLookbackDays;

    @Inject
    @ConfigProperty(name = "discharge-reconciliation.criteria.parent-freshness-lookback-days", defaultValue = "5")
    int parentFreshnessLookbackDays;

    @Inject
    @ConfigProperty(name = "discharge-reconciliation.criteria.composite-threshold", defaultValue = "2")
    int compositeThreshold;

    @Inject
    @ConfigProperty(name = "discharge-reconciliation.criteria.venue-match-when-absent", defaultValue = "false")
    boolean venueMatchWhenAbsent;

    @Inject
    @ConfigProperty(name = "discharge-reconciliation.criteria.parent-timing-when-absent", defaultValue = "true")
    boolean parentTimingWhenAbsent;

    @Inject
    @ConfigProperty(name = "discharge-reconciliation.criteria.parent-freshness-when-absent", defaultValue = "true")
    boolean parentFreshnessWhenAbsent;

    @Inject
    @ConfigProperty(name = "discharge-reconciliation.ranking.parallel", defaultValue = "false")
    boolean parallelRanking;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "discharge-reconciliation.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "discharge-reconciliation.cache.max-size", defaultValue = "50000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "discharge-reconciliation.cache.ttl-seconds", defaultValue = "3600")
    int cacheTtlSeconds;

    // ── Input files ───────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "discharge-reconciliation.input.stays-file")
    Optional<String> staysFile;

    @Inject
    @ConfigProperty(name = "discharge-reconciliation.input.documents-file")
    Optional<String> documentsFile;

    @Inject
    @ConfigProperty(name = "discharge-reconciliation.input.specialty-mapping-file")
    Optional<String> specialtyMappingFile;

    @Inject
    @ConfigProperty(name = "discharge-reconciliation.input.minimum-nights", defaultValue = "1")
    int minimumNights;

    @Inject
    @ConfigProperty(name = "discharge-reconciliation.input.unit-prefix-length", defaultValue = "3")
    int unitPrefixLength;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public ReconciliationOptions reconciliationOptions() {
        ReconciliationOptions options = ReconciliationOptions.builder()
                .validationLookbackDays(validationLookbackDays)
                .creationLookbackDays(creationLookbackDays)
                .parentFreshnessLookbackDays(parentFreshnessLookbackDays)
                .compositeThreshold(compositeThreshold)
                .criteriaDefaults(new CriteriaDefaults(venueMatchWhenAbsent, parentTimingWhenAbsent,
                        parentFreshnessWhenAbsent))
                .parallelRanking(parallelRanking)
                .cacheConfig(cacheEnabled ? new CacheConfig(cacheMaxSize, cacheTtlSeconds, true) : CacheConfig.disabled())
                .build();
        log.info("Producing ReconciliationOptions: {}", options);
        return options;
    }

    @Produces
    @ApplicationScoped
    public ReconciliationEngine reconciliationEngine(ReconciliationOptions options) {
        return ReconciliationEngine.builder()
                .options(options)
                .build();
    }

    /**
     * The file-based monthly job. Requires the three input file properties.
     */
    @Produces
    @ApplicationScoped
    public ReconciliationJob reconciliationJob(ReconciliationEngine engine) {
        Path stays = Path.of(required(staysFile, "discharge-reconciliation.input.stays-file"));
        Path documents = Path.of(required(documentsFile, "discharge-reconciliation.input.documents-file"));
        Path mapping = Path.of(required(specialtyMappingFile, "discharge-reconciliation.input.specialty-mapping-file"));
        log.info("Producing ReconciliationJob: stays={} documents={} mapping={}", stays, documents, mapping);

        return ReconciliationJob.builder()
                .staySource(CsvStaySource.builder(stays)
                        .minimumNights(minimumNights)
                        .unitPrefixLength(unitPrefixLength)
                        .build())
                .documentSource(new CsvDocumentSource(documents))
                .mappingLoader(new CsvSpecialtyMappingLoader(mapping, engine.getKeyNormalizer()))
                .engine(engine)
                .build();
    }

    private static String required(Optional<String> value, String property) {
        return value.filter(v -> !v.isBlank())
                .orElseThrow(() -> new IllegalStateException("Missing configuration property " + property));
    }
}
