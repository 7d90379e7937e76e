package com.identity.dedup.api;

/**
 * Input statistics of an analysis.
 *
 * @param inputCommits       commit records received
 * @param analyzedCommits    commit records kept after the commit budget
 * @param distinctIdentities distinct raw identities among the analyzed commits
 * @param validIdentities    identities with a usable name and a valid email
 * @param invalidIdentities  the remaining identities
 */
public record RunStatistics(
        int inputCommits,
        int analyzedCommits,
        int distinctIdentities,
        int validIdentities,
        int invalidIdentities
) {

    public boolean commitsTruncated() {
        return analyzedCommits < inputCommits;
    }
}
