package com.identity.dedup.core.model;

import java.util.Objects;

/**
 * A scored comparison between two identities.
 *
 * @param pair      the canonical identity pair
 * @param score     similarity in [0, 1]; the baseline reports 1.0 or 0.0
 * @param duplicate whether the scorer judged the pair a duplicate
 * @param evidence  short human-readable explanation of the decision
 */
public record CandidatePair(
        IdentityPair pair,
        double score,
        boolean duplicate,
        String evidence
) {
    public CandidatePair {
        Objects.requireNonNull(pair, "pair is required");
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0, got " + score);
        }
        evidence = evidence != null ? evidence : "";
    }

    public static CandidatePair duplicate(int i, int j, double score) {
        return new CandidatePair(IdentityPair.of(i, j), score, true, "");
    }

    public static CandidatePair distinct(int i, int j, double score) {
        return new CandidatePair(IdentityPair.of(i, j), score, false, "");
    }

    public int first() {
        return pair.first();
    }

    public int second() {
        return pair.second();
    }
}
