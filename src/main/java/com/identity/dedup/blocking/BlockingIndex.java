package com.identity.dedup.blocking;

import com.identity.dedup.core.model.NormalizedIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Buckets of identity ids that share a blocking key.
 *
 * <p>Built from the normalized identity list, where the list position is the identity
 * id. Keys and members are kept sorted, so the index depends only on the identity set.
 * Immutable after construction.</p>
 */
public final class BlockingIndex {
    private static final Logger log = LoggerFactory.getLogger(BlockingIndex.class);

    private final SortedMap<String, SortedSet<Integer>> buckets;

    private BlockingIndex(SortedMap<String, SortedSet<Integer>> buckets) {
        this.buckets = buckets;
    }

    public static BlockingIndex build(List<NormalizedIdentity> identities, BlockingStrategy strategy) {
        return build(identities, strategy.keyStrategy());
    }

    public static BlockingIndex build(List<NormalizedIdentity> identities, BlockingKeyStrategy keyStrategy) {
        Objects.requireNonNull(identities, "identities is required");
        Objects.requireNonNull(keyStrategy, "keyStrategy is required");

        SortedMap<String, SortedSet<Integer>> buckets = new TreeMap<>();
        for (int id = 0; id < identities.size(); id++) {
            for (String key : keyStrategy.generateKeys(identities.get(id))) {
                buckets.computeIfAbsent(key, k -> new TreeSet<>()).add(id);
            }
        }
        buckets.replaceAll((key, members) -> Collections.unmodifiableSortedSet(members));

        log.debug("blocking.built identities={} buckets={}", identities.size(), buckets.size());
        return new BlockingIndex(Collections.unmodifiableSortedMap(buckets));
    }

    public static BlockingIndex empty() {
        return new BlockingIndex(Collections.emptySortedMap());
    }

    /**
     * All buckets keyed by blocking key.
     */
    public SortedMap<String, SortedSet<Integer>> buckets() {
        return buckets;
    }

    public SortedSet<Integer> bucket(String key) {
        SortedSet<Integer> members = buckets.get(key);
        return members != null ? members : Collections.emptySortedSet();
    }

    public SortedSet<String> keys() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(buckets.keySet()));
    }

    public int size() {
        return buckets.size();
    }

    public boolean isEmpty() {
        return buckets.isEmpty();
    }

    /**
     * Bucket keys in visiting order: smallest bucket first, ties broken by key.
     */
    public List<String> keysInVisitOrder() {
        List<String> keys = new ArrayList<>(buckets.keySet());
        keys.sort(Comparator.<String>comparingInt(k -> buckets.get(k).size())
                .thenComparing(Comparator.naturalOrder()));
        return keys;
    }

    /**
     * Upper bound of pairs the index can produce, counting pairs that span buckets once per bucket.
     */
    public long pairUpperBound() {
        long total = 0;
        for (Map.Entry<String, SortedSet<Integer>> entry : buckets.entrySet()) {
            long n = entry.getValue().size();
            total += n * (n - 1) / 2;
        }
        return total;
    }
}
