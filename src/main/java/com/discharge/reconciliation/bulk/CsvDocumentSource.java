package com.discharge.reconciliation.bulk;

import com.discharge.reconciliation.core.model.ClinicalDocument;
import com.discharge.reconciliation.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads clinical documents from a delimited file.
 *
 * <p>Required columns: {@code document_id, patient_id, label, created_ts}.
 * Optional columns: {@code validated_ts, venue_number, parent_created_ts, parent_modified_ts, dispatch_ts}.
 * An absent optional column yields null values, so the eligibility criteria fall back to
 * their configured defaults.</p>
 */
public class CsvDocumentSource implements DocumentSource {
    private static final Logger log = LoggerFactory.getLogger(CsvDocumentSource.class);

    private final Path path;
    private final char separator;

    public CsvDocumentSource(Path path) {
        this(path, ',');
    }

    public CsvDocumentSource(Path path, char separator) {
        this.path = path;
        this.separator = separator;
    }

    @Override
    public List<ClinicalDocument> fetch() {
        try (LogContext ctx = LogContext.forImport(path.toString());
             Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(CsvTable.read(reader, separator));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read documents from " + path, e);
        }
    }

    List<ClinicalDocument> read(CsvTable table) {
        int documentIdx = CsvCells.requireColumn(table, "document_id");
        int patientIdx = CsvCells.requireColumn(table, "patient_id");
        int labelIdx = CsvCells.requireColumn(table, "label");
        int createdIdx = CsvCells.requireColumn(table, "created_ts");
        int validatedIdx = table.columnIndex("validated_ts");
        int venueIdx = table.columnIndex("venue_number");
        int parentCreatedIdx = table.columnIndex("parent_created_ts");
        int parentModifiedIdx = table.columnIndex("parent_modified_ts");
        int dispatchIdx = table.columnIndex("dispatch_ts");

        List<String> absent = new ArrayList<>();
        if (validatedIdx < 0) absent.add("validated_ts");
        if (venueIdx < 0) absent.add("venue_number");
        if (parentCreatedIdx < 0 && parentModifiedIdx < 0) absent.add("parent timestamps");
        if (!absent.isEmpty()) {
            log.info("import.columns.absent kind=documents columns={} - criteria defaults apply", absent);
        }

        List<ClinicalDocument> documents = new ArrayList<>(table.getRows().size());
        for (CsvTable.Row row : table.getRows()) {
            documents.add(ClinicalDocument.builder()
                    .documentId(CsvCells.requireCell(row, documentIdx, "document_id"))
                    .patientId(CsvCells.requireCell(row, patientIdx, "patient_id"))
                    .label(row.get(labelIdx))
                    .createdAt(CsvCells.requireTimestamp(row, createdIdx, "created_ts"))
                    .validatedAt(CsvCells.timestamp(row, validatedIdx, "validated_ts"))
                    .venueNumber(row.get(venueIdx))
                    .parentCreatedAt(CsvCells.timestamp(row, parentCreatedIdx, "parent_created_ts"))
                    .parentModifiedAt(CsvCells.timestamp(row, parentModifiedIdx, "parent_modified_ts"))
                    .dispatchedAt(CsvCells.timestamp(row, dispatchIdx, "dispatch_ts"))
                    .build());
        }

        log.info("import.completed kind=documents rows={}", documents.size());
        return documents;
    }
}
