package com.discharge.reconciliation.report;

/**
 * Receives a finished report. Renderers, mailers and file writers plug in here.
 */
public interface ReportPublisher {

    /**
     * Short name used in logs.
     */
    String getName();

    void publish(ReconciliationReport report) throws Exception;
}
