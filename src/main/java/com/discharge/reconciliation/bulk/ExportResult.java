package com.discharge.reconciliation.bulk;

/**
 * Result of an export.
 *
 * @param rowsWritten number of data rows written
 * @param format      output format name
 */
public record ExportResult(long rowsWritten, String format) {
    @Override
    public String toString() {
        return "ExportResult{rows=" + rowsWritten + ", format=" + format + '}';
    }
}
