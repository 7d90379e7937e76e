package com.identity.dedup.bulk;

import com.identity.dedup.core.model.CommitRecord;
import com.identity.dedup.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.time.Instant;
import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * CSV commit log importer.
 *
 * <p>Expected CSV format (header required, column order free):</p>
 * <pre>
 * commit_id,author_name,author_email,timestamp
 * 3f2a9c1,"Doe, Jane",jane@example.com,2023-04-01T12:00:00Z
 * 8b17e02,Bob Smith,bob@example.com,1680350400
 * </pre>
 *
 * <p>Timestamps are ISO-8601 instants or epoch seconds; a blank timestamp maps to the epoch.</p>
 */
public class CsvCommitLogImporter implements CommitLogImporter {
    private static final Logger log = LoggerFactory.getLogger(CsvCommitLogImporter.class);
    private static final int PROGRESS_INTERVAL = 1_000;

    static final String COMMIT_ID = "commit_id";
    static final String AUTHOR_NAME = "author_name";
    static final String AUTHOR_EMAIL = "author_email";
    static final String TIMESTAMP = "timestamp";

    @Override
    public ImportResult<CommitRecord> importCommits(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<CommitRecord> records = new ArrayList<>();
        List<ImportResult.ImportError> errors = new ArrayList<>();
        long totalRecords = 0;

        try (LogContext ignored = LogContext.forImport(getFormat());
             BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            CsvReader csv = new CsvReader(br);
            List<String> header = csv.next();
            if (header == null) {
                return new ImportResult<>(0, List.of(), List.of());
            }
            int idColumn = column(header, COMMIT_ID);
            int nameColumn = column(header, AUTHOR_NAME);
            int emailColumn = column(header, AUTHOR_EMAIL);
            int timestampColumn = column(header, TIMESTAMP);
            if (idColumn < 0 || nameColumn < 0 || emailColumn < 0) {
                errors.add(new ImportResult.ImportError(1, String.join(",", header),
                        "Header must contain " + COMMIT_ID + ", " + AUTHOR_NAME + " and " + AUTHOR_EMAIL));
                log.warn("import.invalid.header header={}", header);
                return new ImportResult<>(0, List.of(), errors);
            }

            List<String> row;
            while ((row = csv.next()) != null) {
                if (CsvReader.isBlank(row)) {
                    continue;
                }
                totalRecords++;
                try {
                    String commitId = field(row, idColumn).trim();
                    if (commitId.isEmpty()) {
                        throw new IllegalArgumentException("Missing " + COMMIT_ID);
                    }
                    Instant timestamp = timestampColumn < 0 ? null : parseTimestamp(field(row, timestampColumn));
                    records.add(CommitRecord.of(commitId, field(row, nameColumn), field(row, emailColumn), timestamp));
                } catch (IllegalArgumentException | DateTimeException e) {
                    errors.add(new ImportResult.ImportError(csv.recordLine(), String.join(",", row), e.getMessage()));
                    log.warn("import.error line={} error={}", csv.recordLine(), e.getMessage());
                }

                if (totalRecords % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(totalRecords, -1, "Read " + totalRecords + " commits");
                }
            }
        } catch (IOException e) {
            log.error("import.failed error={}", e.getMessage());
            errors.add(new ImportResult.ImportError(0, "", "IO error: " + e.getMessage()));
        }

        ImportResult<CommitRecord> result = new ImportResult<>(totalRecords, records, errors);
        cb.onProgress(totalRecords, totalRecords, "Import completed");
        log.info("import.completed format={} result={}", getFormat(), result);
        return result;
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    /**
     * Parses an ISO-8601 instant or a number of epoch seconds. Blank input yields null.
     */
    static Instant parseTimestamp(String value) {
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (trimmed.chars().allMatch(Character::isDigit)) {
            return Instant.ofEpochSecond(Long.parseLong(trimmed));
        }
        return Instant.parse(trimmed);
    }

    private static int column(List<String> header, String name) {
        for (int i = 0; i < header.size(); i++) {
            if (header.get(i).trim().toLowerCase(Locale.ROOT).equals(name)) {
                return i;
            }
        }
        return -1;
    }

    private static String field(List<String> row, int column) {
        return column < row.size() ? row.get(column) : "";
    }
}
