package com.identity.dedup.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single commit as delivered by the extraction layer.
 *
 * @param commitId  unique commit hash
 * @param identity  the author identity recorded on the commit
 * @param timestamp author timestamp
 */
public record CommitRecord(
        String commitId,
        RawIdentity identity,
        Instant timestamp
) {
    public CommitRecord {
        Objects.requireNonNull(commitId, "commitId is required");
        Objects.requireNonNull(identity, "identity is required");
        timestamp = timestamp != null ? timestamp : Instant.EPOCH;
    }

    public static CommitRecord of(String commitId, String authorName, String authorEmail, Instant timestamp) {
        return new CommitRecord(commitId, RawIdentity.of(authorName, authorEmail), timestamp);
    }
}
