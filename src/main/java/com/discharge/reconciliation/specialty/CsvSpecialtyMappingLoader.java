package com.discharge.reconciliation.specialty;

import com.discharge.reconciliation.bulk.CsvTable;
import com.discharge.reconciliation.rules.KeyNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads the specialty mapping from a semicolon-separated file.
 *
 * <p>Expected format:</p>
 * <pre>
 * unit_code;label;specialty
 * 123;CR Lettre de liaison Cardiologie;CARDIOLOGIE
 * 456;Neurochirurgie;NEUROCHIRURGIE
 * </pre>
 *
 * <p>The legacy column names {@code sej_uf}, {@code doc_key} and {@code sej_spe} are accepted.
 * Unit codes and labels are normalized with the same {@link KeyNormalizer} used for documents.
 * Duplicate (unit code, label) keys collapse to their first row. When that first row has no
 * specialty the key resolves to nothing, even if a later duplicate names one.</p>
 */
public class CsvSpecialtyMappingLoader implements SpecialtyMappingLoader {
    private static final Logger log = LoggerFactory.getLogger(CsvSpecialtyMappingLoader.class);
    private static final char SEPARATOR = ';';

    private final Path path;
    private final KeyNormalizer normalizer;

    public CsvSpecialtyMappingLoader(Path path, KeyNormalizer normalizer) {
        this.path = path;
        this.normalizer = normalizer;
    }

    @Override
    public List<SpecialtyMapping> load() {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(CsvTable.read(reader, SEPARATOR));
        } catch (IOException e) {
            throw new ReferenceDataException("Cannot read specialty mapping " + path + ": " + e.getMessage(), e);
        }
    }

    List<SpecialtyMapping> parse(CsvTable table) {
        int unitIdx = table.columnIndex("unit_code", "sej_uf");
        int labelIdx = table.columnIndex("label", "doc_key");
        int specialtyIdx = table.columnIndex("specialty", "sej_spe");
        if (unitIdx < 0 || labelIdx < 0 || specialtyIdx < 0) {
            throw new ReferenceDataException("Specialty mapping " + path
                    + " must have unit_code, label and specialty columns, found " + table.getHeader());
        }

        List<SpecialtyMapping> rows = new ArrayList<>();
        Set<MappingKey> seen = new HashSet<>();
        int withoutSpecialty = 0;
        int shadowed = 0;
        for (CsvTable.Row row : table.getRows()) {
            MappingKey key = new MappingKey(normalizer.unitCode(row.get(unitIdx)), normalizer.mappingKey(row.get(labelIdx)));
            if (!seen.add(key)) {
                shadowed++;
                continue;
            }
            String specialty = row.get(specialtyIdx);
            if (specialty == null) {
                withoutSpecialty++;
                continue;
            }
            rows.add(new SpecialtyMapping(key.unitCode(), key.label(), specialty));
        }
        if (withoutSpecialty > 0 || shadowed > 0) {
            log.debug("Mapping {}: {} keys without specialty, {} duplicate rows ignored", path, withoutSpecialty, shadowed);
        }
        return rows;
    }

    private record MappingKey(String unitCode, String label) {}
}
