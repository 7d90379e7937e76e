package com.identity.dedup.bulk;

import java.util.List;

/**
 * Result of an import operation.
 *
 * @param totalRecords number of data records read, including rejected ones
 * @param records      records that parsed successfully
 * @param errors       one entry per rejected record
 * @param <T>          the record type
 */
public record ImportResult<T>(
        long totalRecords,
        List<T> records,
        List<ImportResult.ImportError> errors
) {
    public ImportResult {
        records = records != null ? List.copyOf(records) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long successCount() {
        return records.size();
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Represents an error that occurred while reading one record.
     *
     * @param lineNumber the line number in the input (1-based, 0 for I/O failures)
     * @param input      the offending input text
     * @param message    the error message
     */
    public record ImportError(long lineNumber, String input, String message) {}

    @Override
    public String toString() {
        return "ImportResult{total=" + totalRecords +
                ", imported=" + records.size() +
                ", errors=" + errors.size() + '}';
    }
}
