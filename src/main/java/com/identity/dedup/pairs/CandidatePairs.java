package com.identity.dedup.pairs;

import com.identity.dedup.core.model.IdentityPair;

import java.util.List;

/**
 * Output of candidate generation.
 *
 * @param pairs        distinct canonical pairs in generation order
 * @param truncated    true when the pair budget stopped generation before every bucket was exhausted
 * @param maxPairs     the budget that was applied
 * @param bucketsUsed  number of buckets fully or partially enumerated
 */
public record CandidatePairs(
        List<IdentityPair> pairs,
        boolean truncated,
        int maxPairs,
        int bucketsUsed
) {
    public CandidatePairs {
        pairs = pairs != null ? List.copyOf(pairs) : List.of();
    }

    public int size() {
        return pairs.size();
    }

    public boolean isEmpty() {
        return pairs.isEmpty();
    }

    @Override
    public String toString() {
        return "CandidatePairs{pairs=" + pairs.size() +
                ", truncated=" + truncated +
                ", maxPairs=" + maxPairs +
                ", buckets=" + bucketsUsed + '}';
    }
}
