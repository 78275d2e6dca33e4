package com.discharge.reconciliation.report;

import com.discharge.reconciliation.aggregate.ValidationReport;
import com.discharge.reconciliation.api.ReconciliationResult;

import java.util.Objects;

/**
 * Everything produced for one reporting period: the per-stay results and their aggregation.
 */
public record ReconciliationReport(
        ReportPeriod period,
        ReconciliationResult result,
        ValidationReport validation
) {
    public ReconciliationReport {
        Objects.requireNonNull(period, "period is required");
        Objects.requireNonNull(result, "result is required");
        Objects.requireNonNull(validation, "validation is required");
    }
}
