package com.identity.dedup.bulk;

import com.identity.dedup.core.model.RawIdentity;
import com.identity.dedup.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads manually labelled identities.
 *
 * <pre>
 * name,email,label
 * Jane Doe,jane@example.com,jane
 * J. Doe,jdoe@example.com,jane
 * </pre>
 *
 * <p>Identities that share a label belong to the same person.</p>
 */
public class GroundTruthImporter {
    private static final Logger log = LoggerFactory.getLogger(GroundTruthImporter.class);

    public ImportResult<LabelledIdentity> importLabels(Reader reader) {
        List<LabelledIdentity> records = new ArrayList<>();
        List<ImportResult.ImportError> errors = new ArrayList<>();
        long totalRecords = 0;

        try (LogContext ignored = LogContext.forImport("ground-truth");
             BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            CsvReader csv = new CsvReader(br);
            if (csv.next() == null) {
                return new ImportResult<>(0, List.of(), List.of());
            }
            List<String> row;
            while ((row = csv.next()) != null) {
                if (CsvReader.isBlank(row)) {
                    continue;
                }
                totalRecords++;
                if (row.size() < 3 || row.get(2).isBlank()) {
                    errors.add(new ImportResult.ImportError(csv.recordLine(), String.join(",", row),
                            "Expected name,email,label"));
                    log.warn("import.error line={} fields={}", csv.recordLine(), row.size());
                    continue;
                }
                records.add(new LabelledIdentity(RawIdentity.of(row.get(0), row.get(1)), row.get(2).trim()));
            }
        } catch (IOException e) {
            log.error("import.failed error={}", e.getMessage());
            errors.add(new ImportResult.ImportError(0, "", "IO error: " + e.getMessage()));
        }

        ImportResult<LabelledIdentity> result = new ImportResult<>(totalRecords, records, errors);
        log.info("import.completed format=ground-truth result={}", result);
        return result;
    }

    /**
     * Label per identity. When an identity is labelled twice the first label wins.
     */
    public static Map<RawIdentity, String> toLabels(ImportResult<LabelledIdentity> result) {
        Map<RawIdentity, String> labels = new LinkedHashMap<>();
        for (LabelledIdentity labelled : result.records()) {
            String previous = labels.putIfAbsent(labelled.identity(), labelled.label());
            if (previous != null && !previous.equals(labelled.label())) {
                log.warn("ground-truth.conflict identity='{}' kept={} ignored={}",
                        labelled.identity(), previous, labelled.label());
            }
        }
        return labels;
    }
}
