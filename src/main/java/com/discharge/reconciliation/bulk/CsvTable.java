package com.discharge.reconciliation.bulk;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A delimited text table read fully into memory: one header line, then one record per line.
 * Fields may be quoted with {@code "}; embedded quotes are doubled.
 */
public final class CsvTable {
    private static final char QUOTE = '"';
    private static final char BOM = '\uFEFF';

    private final List<String> header;
    private final List<Row> rows;

    private CsvTable(List<String> header, List<Row> rows) {
        this.header = header;
        this.rows = rows;
    }

    /**
     * Reads a table. An empty input yields a table with no header and no rows.
     */
    public static CsvTable read(Reader reader, char separator) throws IOException {
        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String headerLine = br.readLine();
            if (headerLine == null) {
                return new CsvTable(List.of(), List.of());
            }
            if (!headerLine.isEmpty() && headerLine.charAt(0) == BOM) {
                headerLine = headerLine.substring(1);
            }
            List<String> header = new ArrayList<>();
            for (String name : parseLine(headerLine, separator)) {
                header.add(name.trim().toLowerCase(Locale.ROOT));
            }

            List<Row> rows = new ArrayList<>();
            String line;
            long lineNumber = 1;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                rows.add(new Row(lineNumber, parseLine(line, separator)));
            }
            return new CsvTable(Collections.unmodifiableList(header), Collections.unmodifiableList(rows));
        }
    }

    public List<String> getHeader() {
        return header;
    }

    public List<Row> getRows() {
        return rows;
    }

    public boolean isEmpty() {
        return header.isEmpty();
    }

    /**
     * Returns the index of the first header matching one of the names (case-insensitive), or -1.
     */
    public int columnIndex(String... names) {
        for (String name : names) {
            int idx = header.indexOf(name.toLowerCase(Locale.ROOT));
            if (idx >= 0) {
                return idx;
            }
        }
        return -1;
    }

    static List<String> parseLine(String line, char separator) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (inQuotes) {
                if (c == QUOTE) {
                    if (i + 1 < line.length() && line.charAt(i + 1) == QUOTE) {
                        current.append(QUOTE);
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == QUOTE) {
                inQuotes = true;
            } else if (c == separator) {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString());
        return fields;
    }

    /**
     * One data line.
     *
     * @param lineNumber 1-based line number in the input
     * @param fields     raw field values
     */
    public record Row(long lineNumber, List<String> fields) {

        public Row {
            fields = List.copyOf(fields);
        }

        /**
         * Returns the trimmed value at the index, or null when the column is absent or the cell is blank.
         */
        public String get(int index) {
            if (index < 0 || index >= fields.size()) {
                return null;
            }
            String value = fields.get(index).trim();
            return value.isEmpty() ? null : value;
        }
    }
}
