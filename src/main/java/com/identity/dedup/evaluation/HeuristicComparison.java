package com.identity.dedup.evaluation;

import com.identity.dedup.core.model.CandidatePair;
import com.identity.dedup.core.model.IdentityPair;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Overlap of the duplicate pairs found by the baseline and the improved heuristic.
 *
 * @param commonPairs       pairs both heuristics marked duplicate
 * @param baselineOnlyPairs pairs only the baseline marked duplicate
 * @param improvedOnlyPairs pairs only the improved heuristic marked duplicate
 */
public record HeuristicComparison(
        SortedSet<IdentityPair> commonPairs,
        SortedSet<IdentityPair> baselineOnlyPairs,
        SortedSet<IdentityPair> improvedOnlyPairs
) {
    public HeuristicComparison {
        commonPairs = Collections.unmodifiableSortedSet(new TreeSet<>(commonPairs));
        baselineOnlyPairs = Collections.unmodifiableSortedSet(new TreeSet<>(baselineOnlyPairs));
        improvedOnlyPairs = Collections.unmodifiableSortedSet(new TreeSet<>(improvedOnlyPairs));
    }

    /**
     * Compares two collections of scored pairs; only pairs flagged duplicate count.
     */
    public static HeuristicComparison compare(Collection<CandidatePair> baseline, Collection<CandidatePair> improved) {
        SortedSet<IdentityPair> baselinePairs = duplicatesOf(baseline);
        SortedSet<IdentityPair> improvedPairs = duplicatesOf(improved);

        SortedSet<IdentityPair> common = new TreeSet<>(baselinePairs);
        common.retainAll(improvedPairs);
        SortedSet<IdentityPair> baselineOnly = new TreeSet<>(baselinePairs);
        baselineOnly.removeAll(improvedPairs);
        SortedSet<IdentityPair> improvedOnly = new TreeSet<>(improvedPairs);
        improvedOnly.removeAll(baselinePairs);
        return new HeuristicComparison(common, baselineOnly, improvedOnly);
    }

    public int common() {
        return commonPairs.size();
    }

    public int baselineOnly() {
        return baselineOnlyPairs.size();
    }

    public int improvedOnly() {
        return improvedOnlyPairs.size();
    }

    private static SortedSet<IdentityPair> duplicatesOf(Collection<CandidatePair> pairs) {
        SortedSet<IdentityPair> result = new TreeSet<>();
        for (CandidatePair pair : pairs) {
            if (pair.duplicate()) {
                result.add(pair.pair());
            }
        }
        return result;
    }
}
