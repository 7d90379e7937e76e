package com.identity.dedup.bulk;

import com.identity.dedup.core.model.CommitRecord;
import com.identity.dedup.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the output of {@code git log --format=%H%x1f%an%x1f%ae%x1f%at}:
 * one commit per line, fields separated by the ASCII unit separator.
 */
public class GitLogImporter implements CommitLogImporter {
    private static final Logger log = LoggerFactory.getLogger(GitLogImporter.class);
    private static final int PROGRESS_INTERVAL = 1_000;

    public static final String FORMAT = "%H%x1f%an%x1f%ae%x1f%at";
    static final String SEPARATOR = "\u001f";

    @Override
    public ImportResult<CommitRecord> importCommits(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<CommitRecord> records = new ArrayList<>();
        List<ImportResult.ImportError> errors = new ArrayList<>();
        long totalRecords = 0;

        try (LogContext ignored = LogContext.forImport(getFormat());
             BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String line;
            long lineNumber = 0;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                totalRecords++;
                String[] fields = line.split(SEPARATOR, -1);
                if (fields.length != 4) {
                    errors.add(new ImportResult.ImportError(lineNumber, line,
                            "Expected 4 fields, found " + fields.length));
                    log.warn("import.error line={} fields={}", lineNumber, fields.length);
                    continue;
                }
                String commitId = fields[0].trim();
                if (commitId.isEmpty()) {
                    errors.add(new ImportResult.ImportError(lineNumber, line, "Missing commit hash"));
                    continue;
                }
                try {
                    Instant timestamp = fields[3].isBlank() ? null : Instant.ofEpochSecond(Long.parseLong(fields[3].trim()));
                    records.add(CommitRecord.of(commitId, fields[1], fields[2], timestamp));
                } catch (NumberFormatException e) {
                    errors.add(new ImportResult.ImportError(lineNumber, line, "Invalid timestamp: " + fields[3]));
                    log.warn("import.error line={} timestamp='{}'", lineNumber, fields[3]);
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
        return "git-log";
    }
}
