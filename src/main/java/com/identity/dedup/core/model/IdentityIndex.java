package com.identity.dedup.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Assigns a stable integer id to each distinct {@link RawIdentity} of a run.
 *
 * <p>Ids follow the natural (name, email) order of the distinct identities, so the
 * same identity set always yields the same ids regardless of input order. The index
 * is immutable once built.</p>
 */
public final class IdentityIndex {

    private final List<RawIdentity> identities;
    private final Map<RawIdentity, Integer> ids;
    private final int[] commitCounts;

    private IdentityIndex(TreeMap<RawIdentity, Integer> countsByIdentity) {
        this.identities = List.copyOf(countsByIdentity.keySet());
        this.ids = new HashMap<>(identities.size() * 2);
        this.commitCounts = new int[identities.size()];
        int id = 0;
        for (Map.Entry<RawIdentity, Integer> entry : countsByIdentity.entrySet()) {
            ids.put(entry.getKey(), id);
            commitCounts[id] = entry.getValue();
            id++;
        }
    }

    /**
     * Builds an index over a collection of identities. Duplicates collapse into one id.
     */
    public static IdentityIndex of(Collection<RawIdentity> rawIdentities) {
        Objects.requireNonNull(rawIdentities, "rawIdentities is required");
        TreeMap<RawIdentity, Integer> counts = new TreeMap<>();
        for (RawIdentity identity : rawIdentities) {
            counts.merge(identity, 1, Integer::sum);
        }
        return new IdentityIndex(counts);
    }

    /**
     * Builds an index from commit records, counting commits per identity.
     */
    public static IdentityIndex fromCommits(Collection<CommitRecord> commits) {
        Objects.requireNonNull(commits, "commits is required");
        List<RawIdentity> rawIdentities = new ArrayList<>(commits.size());
        for (CommitRecord commit : commits) {
            rawIdentities.add(commit.identity());
        }
        return of(rawIdentities);
    }

    public int size() {
        return identities.size();
    }

    public boolean isEmpty() {
        return identities.isEmpty();
    }

    /**
     * Returns the id of an identity, or -1 when it is not part of this index.
     */
    public int idOf(RawIdentity identity) {
        Integer id = ids.get(identity);
        return id != null ? id : -1;
    }

    public boolean contains(RawIdentity identity) {
        return ids.containsKey(identity);
    }

    public RawIdentity identity(int id) {
        return identities.get(id);
    }

    /**
     * Number of commits (or occurrences) recorded for an identity.
     */
    public int commitCount(int id) {
        return commitCounts[id];
    }

    public long totalCommits() {
        long total = 0;
        for (int count : commitCounts) {
            total += count;
        }
        return total;
    }

    /**
     * All identities ordered by id.
     */
    public List<RawIdentity> identities() {
        return Collections.unmodifiableList(identities);
    }
}
