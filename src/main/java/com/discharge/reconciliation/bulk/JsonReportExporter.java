package com.discharge.reconciliation.bulk;

import com.discharge.reconciliation.aggregate.ValidationReport;
import com.discharge.reconciliation.report.ReconciliationReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.time.LocalDate;

/**
 * Writes the aggregated statistics of a report as JSON.
 *
 * <pre>
 * {
 *   "period" : "01/03/2025 au 31/03/2025",
 *   "start" : "2025-03-01",
 *   ...
 *   "statistics" : { "global" : {...}, "bySpecialty" : [...], "diffusion" : {...} }
 * }
 * </pre>
 */
public class JsonReportExporter {
    private static final Logger log = LoggerFactory.getLogger(JsonReportExporter.class);

    private final ObjectMapper objectMapper;

    public JsonReportExporter() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public ExportResult export(ReconciliationReport report, Writer writer) {
        JsonReport json = new JsonReport(
                report.period().label(),
                report.period().start(),
                report.period().end(),
                report.result().runId(),
                report.result().specialtyDegraded(),
                report.validation());
        try {
            objectMapper.writeValue(writer, json);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write JSON report for " + report.period().label(), e);
        }
        ExportResult result = new ExportResult(1 + report.validation().bySpecialty().size(), "json");
        log.info("export.completed result={}", result);
        return result;
    }

    ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public record JsonReport(
            String period,
            LocalDate start,
            LocalDate end,
            String runId,
            boolean specialtyDegraded,
            ValidationReport statistics
    ) {
    }
}
