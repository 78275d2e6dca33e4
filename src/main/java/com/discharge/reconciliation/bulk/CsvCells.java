package com.discharge.reconciliation.bulk;

import com.discharge.reconciliation.api.StructuralInputException;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

/**
 * Column and cell accessors shared by the CSV sources. Shape violations raise {@link StructuralInputException}.
 */
final class CsvCells {

    private CsvCells() {
    }

    static int requireColumn(CsvTable table, String name) {
        int idx = table.columnIndex(name);
        if (idx < 0) {
            throw new StructuralInputException("Missing required column '" + name + "', found " + table.getHeader());
        }
        return idx;
    }

    static String requireCell(CsvTable.Row row, int idx, String name) {
        String value = row.get(idx);
        if (value == null) {
            throw new StructuralInputException("Line " + row.lineNumber() + ": " + name + " is required");
        }
        return value;
    }

    /**
     * Parses an optional timestamp cell; null when the column is absent or the cell blank.
     */
    static LocalDateTime timestamp(CsvTable.Row row, int idx, String name) {
        String value = row.get(idx);
        if (value == null) {
            return null;
        }
        try {
            return TimestampParser.parse(value);
        } catch (DateTimeParseException e) {
            throw new StructuralInputException("Line " + row.lineNumber() + ": invalid " + name + " '" + value + "'", e);
        }
    }

    static LocalDateTime requireTimestamp(CsvTable.Row row, int idx, String name) {
        requireCell(row, idx, name);
        return timestamp(row, idx, name);
    }
}
