package com.discharge.reconciliation.bulk;

import com.discharge.reconciliation.core.model.Stay;
import com.discharge.reconciliation.logging.LogContext;
import com.discharge.reconciliation.report.ReportPeriod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads stays from a delimited file.
 *
 * <p>Expected format:</p>
 * <pre>
 * patient_id,stay_id,admission_ts,discharge_ts,unit_code
 * 000123456,S1,2025-03-08 10:00:00,2025-03-10 14:30:00,101A
 * </pre>
 *
 * <p>Rows can be filtered on the discharge period and on a minimum number of nights,
 * and unit codes can be truncated to a fixed prefix.</p>
 */
public class CsvStaySource implements StaySource {
    private static final Logger log = LoggerFactory.getLogger(CsvStaySource.class);

    private final Path path;
    private final char separator;
    private final ReportPeriod period;
    private final int minimumNights;
    private final int unitPrefixLength;
    private final ProgressCallback callback;

    private CsvStaySource(Builder builder) {
        this.path = builder.path;
        this.separator = builder.separator;
        this.period = builder.period;
        this.minimumNights = builder.minimumNights;
        this.unitPrefixLength = builder.unitPrefixLength;
        this.callback = builder.callback;
    }

    @Override
    public List<Stay> fetch() {
        try (LogContext ctx = LogContext.forImport(path.toString());
             Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(CsvTable.read(reader, separator));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read stays from " + path, e);
        }
    }

    List<Stay> read(CsvTable table) {
        int patientIdx = CsvCells.requireColumn(table, "patient_id");
        int stayIdx = CsvCells.requireColumn(table, "stay_id");
        int admissionIdx = CsvCells.requireColumn(table, "admission_ts");
        int dischargeIdx = CsvCells.requireColumn(table, "discharge_ts");
        int unitIdx = table.columnIndex("unit_code");

        List<Stay> stays = new ArrayList<>();
        long filtered = 0;
        for (CsvTable.Row row : table.getRows()) {
            Stay stay = new Stay(
                    CsvCells.requireCell(row, patientIdx, "patient_id"),
                    CsvCells.requireCell(row, stayIdx, "stay_id"),
                    CsvCells.requireTimestamp(row, admissionIdx, "admission_ts"),
                    CsvCells.requireTimestamp(row, dischargeIdx, "discharge_ts"),
                    unitCode(row.get(unitIdx)));
            if (accept(stay)) {
                stays.add(stay);
            } else {
                filtered++;
            }
        }

        callback.onProgress(stays.size(), table.getRows().size(), "Stays loaded");
        log.info("import.completed kind=stays rows={} kept={} filtered={}",
                table.getRows().size(), stays.size(), filtered);
        return stays;
    }

    private boolean accept(Stay stay) {
        if (period != null && !period.contains(stay.dischargeDate())) {
            return false;
        }
        return ChronoUnit.DAYS.between(stay.admissionDate(), stay.dischargeDate()) >= minimumNights;
    }

    private String unitCode(String raw) {
        if (raw == null || unitPrefixLength <= 0 || raw.length() <= unitPrefixLength) {
            return raw;
        }
        return raw.substring(0, unitPrefixLength);
    }

    public static Builder builder(Path path) {
        return new Builder(path);
    }

    public static class Builder {
        private final Path path;
        private char separator = ',';
        private ReportPeriod period;
        private int minimumNights = 0;
        private int unitPrefixLength = 0;
        private ProgressCallback callback = ProgressCallback.NOOP;

        private Builder(Path path) {
            this.path = path;
        }

        public Builder separator(char separator) {
            this.separator = separator;
            return this;
        }

        /**
         * Keeps only stays discharged within the period.
         */
        public Builder period(ReportPeriod period) {
            this.period = period;
            return this;
        }

        /**
         * Keeps only stays of at least this many nights.
         */
        public Builder minimumNights(int minimumNights) {
            if (minimumNights < 0) {
                throw new IllegalArgumentException("minimumNights must be >= 0");
            }
            this.minimumNights = minimumNights;
            return this;
        }

        /**
         * Truncates unit codes to this many characters; 0 keeps them whole.
         */
        public Builder unitPrefixLength(int unitPrefixLength) {
            if (unitPrefixLength < 0) {
                throw new IllegalArgumentException("unitPrefixLength must be >= 0");
            }
            this.unitPrefixLength = unitPrefixLength;
            return this;
        }

        public Builder progressCallback(ProgressCallback callback) {
            this.callback = callback != null ? callback : ProgressCallback.NOOP;
            return this;
        }

        public CsvStaySource build() {
            if (path == null) {
                throw new IllegalStateException("path is required");
            }
            return new CsvStaySource(this);
        }
    }
}
