package com.identity.dedup.pairs;

import com.identity.dedup.blocking.BlockingIndex;
import com.identity.dedup.core.model.IdentityPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;

/**
 * Enumerates the unordered pairs inside each blocking bucket.
 *
 * <p>Buckets are visited in {@link BlockingIndex#keysInVisitOrder()} order and pairs
 * within a bucket in ascending id order, so truncation at {@code maxPairs} selects the
 * same pairs on every run. A pair shared by several buckets is emitted once.</p>
 */
public class CandidatePairGenerator {
    private static final Logger log = LoggerFactory.getLogger(CandidatePairGenerator.class);

    /**
     * Generates at most {@code maxPairs} distinct pairs.
     *
     * @param index    the blocking index
     * @param maxPairs pair budget; 0 yields no pairs
     * @return the pairs and whether the budget cut generation short
     */
    public CandidatePairs generate(BlockingIndex index, int maxPairs) {
        if (maxPairs < 0) {
            throw new IllegalArgumentException("maxPairs must be non-negative, got " + maxPairs);
        }

        List<IdentityPair> pairs = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        boolean truncated = false;
        int bucketsUsed = 0;

        buckets:
        for (String key : index.keysInVisitOrder()) {
            int[] members = toArray(index.bucket(key));
            if (members.length < 2) {
                continue;
            }
            bucketsUsed++;
            for (int a = 0; a < members.length; a++) {
                for (int b = a + 1; b < members.length; b++) {
                    long code = ((long) members[a] << 32) | members[b];
                    if (seen.contains(code)) {
                        continue;
                    }
                    if (pairs.size() >= maxPairs) {
                        truncated = true;
                        break buckets;
                    }
                    seen.add(code);
                    pairs.add(new IdentityPair(members[a], members[b]));
                }
            }
        }

        if (truncated) {
            log.warn("pairs.truncated maxPairs={} bucketsUsed={} of {}", maxPairs, bucketsUsed, index.size());
        } else {
            log.debug("pairs.generated pairs={} buckets={}", pairs.size(), bucketsUsed);
        }
        return new CandidatePairs(pairs, truncated, maxPairs, bucketsUsed);
    }

    private static int[] toArray(SortedSet<Integer> members) {
        int[] result = new int[members.size()];
        int i = 0;
        for (int member : members) {
            result[i++] = member;
        }
        return result;
    }
}
