package com.discharge.reconciliation.cdi;

import com.discharge.reconciliation.api.ReconciliationEngine;
import com.discharge.reconciliation.api.ReconciliationOptions;
import com.discharge.reconciliation.report.ReconciliationJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ReconciliationProducerTest {

    private ReconciliationProducer producer;

    @BeforeEach
    void setUp() {
        producer = new ReconciliationProducer();
        producer.validationLookbackDays = 3;
        producer.creationLookbackDays = 5;
        producer.parentFreshnessLookbackDays = 5;
        producer.compositeThreshold = 2;
        producer.venueMatchWhenAbsent = false;
        producer.parentTimingWhenAbsent = true;
        producer.parentFreshnessWhenAbsent = true;
        producer.parallelRanking = false;
        producer.cacheEnabled = true;
        producer.cacheMaxSize = 1_000;
        producer.cacheTtlSeconds = 60;
        producer.staysFile = Optional.empty();
        producer.documentsFile = Optional.empty();
        producer.specialtyMappingFile = Optional.empty();
        producer.minimumNights = 1;
        producer.unitPrefixLength = 3;
    }

    @Test
    @DisplayName("Options reflect the configured properties")
    void options() {
        producer.validationLookbackDays = 7;
        producer.compositeThreshold = 1;
        producer.venueMatchWhenAbsent = true;
        producer.cacheEnabled = false;

        ReconciliationOptions options = producer.reconciliationOptions();

        assertEquals(7, options.getValidationLookbackDays());
        assertEquals(5, options.getCreationLookbackDays());
        assertEquals(1, options.getCompositeThreshold());
        assertTrue(options.getCriteriaDefaults().venueMatchWhenAbsent());
        assertFalse(options.getCacheConfig().enabled());
    }

    @Test
    @DisplayName("Engine uses the produced options")
    void engine() {
        ReconciliationOptions options = producer.reconciliationOptions();
        ReconciliationEngine engine = producer.reconciliationEngine(options);
        assertSame(options, engine.getOptions());
    }

    @Test
    @DisplayName("Job requires every input file property")
    void jobRequiresFiles() {
        ReconciliationEngine engine = producer.reconciliationEngine(producer.reconciliationOptions());
        producer.staysFile = Optional.of("/data/stays.csv");
        producer.documentsFile = Optional.of(" ");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> producer.reconciliationJob(engine));
        assertTrue(e.getMessage().contains("documents-file"));
    }

    @Test
    @DisplayName("Job is built from configured files without reading them")
    void job() {
        ReconciliationEngine engine = producer.reconciliationEngine(producer.reconciliationOptions());
        producer.staysFile = Optional.of("/data/stays.csv");
        producer.documentsFile = Optional.of("/data/documents.csv");
        producer.specialtyMappingFile = Optional.of("/data/mapping.csv");

        ReconciliationJob job = producer.reconciliationJob(engine);

        assertNotNull(job);
    }
}
