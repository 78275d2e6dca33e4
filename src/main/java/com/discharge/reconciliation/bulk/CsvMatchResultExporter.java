package com.discharge.reconciliation.bulk;

import com.discharge.reconciliation.core.model.MatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes the per-stay match results as CSV.
 *
 * <pre>
 * patient_id,stay_id,unit_code,discharge_date,specialty,document_id,delay_days,classification,dispatch_delay_days
 * 000123456,S1,101,2025-03-10,CARDIOLOGIE,D1,0,on-time,1
 * </pre>
 */
public class CsvMatchResultExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvMatchResultExporter.class);
    private static final int PROGRESS_INTERVAL = 1_000;

    static final String HEADER =
            "patient_id,stay_id,unit_code,discharge_date,specialty,document_id,delay_days,classification,dispatch_delay_days";

    public ExportResult export(List<MatchResult> results, Writer writer, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        PrintWriter pw = new PrintWriter(new BufferedWriter(writer));

        long written = 0;
        pw.println(HEADER);
        for (MatchResult result : results) {
            pw.println(String.join(",",
                    csvEscape(result.patientId()),
                    csvEscape(result.stayId()),
                    csvEscape(result.unitCode()),
                    result.dischargeDate() != null ? result.dischargeDate().toString() : "",
                    csvEscape(result.specialty()),
                    csvEscape(result.documentId()),
                    result.delayDays() != null ? result.delayDays().toString() : "",
                    result.classification().label(),
                    result.dispatchDelayDays() != null ? result.dispatchDelayDays().toString() : ""));
            written++;
            if (written % PROGRESS_INTERVAL == 0) {
                cb.onProgress(written, results.size(), "Exported " + written + " results");
            }
        }
        pw.flush();
        if (pw.checkError()) {
            throw new UncheckedIOException(new IOException("Failed to write match results"));
        }

        ExportResult exportResult = new ExportResult(written, "csv");
        cb.onProgress(written, results.size(), "Export completed");
        log.info("export.completed result={}", exportResult);
        return exportResult;
    }

    private static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
