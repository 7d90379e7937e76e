package com.identity.dedup.bulk;

import com.identity.dedup.core.model.CommitRecord;

import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * Reads commit records from an extracted commit log.
 * Malformed records are reported in the result rather than thrown.
 */
public interface CommitLogImporter {

    /**
     * Imports commits from a UTF-8 input stream.
     */
    default ImportResult<CommitRecord> importCommits(InputStream input, ProgressCallback callback) {
        return importCommits(new InputStreamReader(input, StandardCharsets.UTF_8), callback);
    }

    ImportResult<CommitRecord> importCommits(Reader reader, ProgressCallback callback);

    /**
     * Returns the format supported by this importer (e.g., "csv", "git-log").
     */
    String getFormat();
}
