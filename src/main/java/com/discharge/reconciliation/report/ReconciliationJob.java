package com.discharge.reconciliation.report;

import com.discharge.reconciliation.aggregate.StatisticsAggregator;
import com.discharge.reconciliation.aggregate.ValidationReport;
import com.discharge.reconciliation.api.ReconciliationEngine;
import com.discharge.reconciliation.api.ReconciliationResult;
import com.discharge.reconciliation.bulk.DocumentSource;
import com.discharge.reconciliation.bulk.StaySource;
import com.discharge.reconciliation.core.model.ClinicalDocument;
import com.discharge.reconciliation.core.model.Stay;
import com.discharge.reconciliation.specialty.SpecialtyMappingLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Produces the report of one period. Stays discharged within the period are reconciled with
 * the fetched documents, the results are aggregated and the report is handed to every
 * registered publisher.
 *
 * <p>A failing publisher is logged and skipped; the others still run and the report is
 * still returned. Structural input errors propagate.</p>
 */
public class ReconciliationJob {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationJob.class);

    private final StaySource staySource;
    private final DocumentSource documentSource;
    private final SpecialtyMappingLoader mappingLoader;
    private final ReconciliationEngine engine;
    private final StatisticsAggregator aggregator;
    private final List<ReportPublisher> publishers;
    private final Clock clock;

    private ReconciliationJob(Builder builder) {
        this.staySource = builder.staySource;
        this.documentSource = builder.documentSource;
        this.mappingLoader = builder.mappingLoader;
        this.engine = builder.engine != null ? builder.engine : ReconciliationEngine.builder().build();
        this.aggregator = new StatisticsAggregator();
        this.publishers = List.copyOf(builder.publishers);
        this.clock = builder.clock;
    }

    /**
     * Runs the job over the month preceding today.
     */
    public ReconciliationReport runMonthly() {
        return run(ReportPeriod.previousMonth(LocalDate.now(clock)));
    }

    public ReconciliationReport run(ReportPeriod period) {
        log.info("job.started period='{}'", period.label());

        List<Stay> fetched = staySource.fetch();
        List<Stay> stays = new ArrayList<>(fetched.size());
        for (Stay stay : fetched) {
            if (stay == null || period.contains(stay.dischargeDate())) {
                stays.add(stay);
            }
        }
        if (stays.size() < fetched.size()) {
            log.debug("job.stays.outOfPeriod count={}", fetched.size() - stays.size());
        }
        List<ClinicalDocument> documents = documentSource.fetch();
        ReconciliationResult result = engine.reconcile(stays, documents, mappingLoader);
        ValidationReport validation = aggregator.aggregate(result.results());
        ReconciliationReport report = new ReconciliationReport(period, result, validation);

        int published = 0;
        for (ReportPublisher publisher : publishers) {
            try {
                publisher.publish(report);
                published++;
            } catch (Exception e) {
                log.error("job.publish.failed publisher={} period='{}' error={}",
                        publisher.getName(), period.label(), e.getMessage(), e);
            }
        }

        log.info("job.completed period='{}' stays={} published={}/{}",
                period.label(), result.size(), published, publishers.size());
        return report;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private StaySource staySource;
        private DocumentSource documentSource;
        private SpecialtyMappingLoader mappingLoader;
        private ReconciliationEngine engine;
        private final List<ReportPublisher> publishers = new ArrayList<>();
        private Clock clock = Clock.systemDefaultZone();

        public Builder staySource(StaySource staySource) {
            this.staySource = staySource;
            return this;
        }

        public Builder documentSource(DocumentSource documentSource) {
            this.documentSource = documentSource;
            return this;
        }

        public Builder mappingLoader(SpecialtyMappingLoader mappingLoader) {
            this.mappingLoader = mappingLoader;
            return this;
        }

        public Builder engine(ReconciliationEngine engine) {
            this.engine = engine;
            return this;
        }

        public Builder addPublisher(ReportPublisher publisher) {
            this.publishers.add(Objects.requireNonNull(publisher, "publisher"));
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public ReconciliationJob build() {
            if (staySource == null || documentSource == null || mappingLoader == null) {
                throw new IllegalStateException("staySource, documentSource and mappingLoader are required");
            }
            return new ReconciliationJob(this);
        }
    }
}
