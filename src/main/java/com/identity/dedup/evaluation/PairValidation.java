package com.identity.dedup.evaluation;

import java.util.List;

/**
 * Review aid for a reported duplicate pair.
 *
 * @param likelyDuplicate whether the collected evidence supports the match
 * @param confidence      sum of the evidence weights, capped at 1
 * @param evidence        human-readable supporting facts
 * @param warnings        facts that weaken the match or could not be checked
 */
public record PairValidation(
        boolean likelyDuplicate,
        double confidence,
        List<String> evidence,
        List<String> warnings
) {
    public PairValidation {
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
