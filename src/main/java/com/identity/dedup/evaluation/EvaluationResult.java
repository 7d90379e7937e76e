package com.identity.dedup.evaluation;

import java.util.Locale;

/**
 * Pairwise agreement between a candidate and a reference partition over the
 * "same cluster" relation.
 *
 * @param truePositives     pairs together in both partitions
 * @param falsePositives    pairs together only in the candidate
 * @param falseNegatives    pairs together only in the reference
 * @param totalPairs        n(n-1)/2 for n identities
 * @param precision         TP / (TP + FP), 1.0 when the candidate claims no pairs
 * @param recall            TP / (TP + FN), 1.0 when the reference has no pairs
 * @param f1                harmonic mean of precision and recall
 * @param randIndex         share of all pairs on which both partitions agree
 * @param candidateClusters number of clusters in the candidate
 * @param referenceClusters number of clusters in the reference
 */
public record EvaluationResult(
        long truePositives,
        long falsePositives,
        long falseNegatives,
        long totalPairs,
        double precision,
        double recall,
        double f1,
        double randIndex,
        int candidateClusters,
        int referenceClusters
) {

    public long trueNegatives() {
        return totalPairs - truePositives - falsePositives - falseNegatives;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "EvaluationResult{tp=%d, fp=%d, fn=%d, precision=%.4f, recall=%.4f, f1=%.4f, rand=%.4f}",
                truePositives, falsePositives, falseNegatives, precision, recall, f1, randIndex);
    }
}
