package com.identity.dedup.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Total assignment of identity ids to cluster ids.
 *
 * <p>The cluster id of a cluster is the smallest identity id it contains, so two
 * partitions describing the same grouping are always equal. Read-only once built.</p>
 */
public final class Partition {

    private final int[] clusterIds;

    private Partition(int[] clusterIds) {
        this.clusterIds = clusterIds;
    }

    /**
     * Canonicalizes an arbitrary group labelling (any int per identity, equal label =
     * same cluster) into a partition keyed by the smallest member id.
     */
    public static Partition fromGroupLabels(int[] groupLabels) {
        Objects.requireNonNull(groupLabels, "groupLabels is required");
        Map<Integer, Integer> smallestByLabel = new HashMap<>();
        for (int id = 0; id < groupLabels.length; id++) {
            smallestByLabel.putIfAbsent(groupLabels[id], id);
        }
        int[] canonical = new int[groupLabels.length];
        for (int id = 0; id < groupLabels.length; id++) {
            canonical[id] = smallestByLabel.get(groupLabels[id]);
        }
        return new Partition(canonical);
    }

    /**
     * Every identity in its own cluster.
     */
    public static Partition singletons(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must be non-negative");
        }
        int[] ids = new int[size];
        for (int i = 0; i < size; i++) {
            ids[i] = i;
        }
        return new Partition(ids);
    }

    /**
     * Builds a reference partition from externally labelled identities.
     * Identities of the index without a label become singletons.
     */
    public static Partition fromLabels(IdentityIndex index, Map<RawIdentity, String> labels) {
        Objects.requireNonNull(index, "index is required");
        Objects.requireNonNull(labels, "labels is required");
        Map<String, Integer> labelIds = new HashMap<>();
        int[] groupLabels = new int[index.size()];
        int nextUnlabelled = -1;
        for (int id = 0; id < index.size(); id++) {
            String label = labels.get(index.identity(id));
            if (label == null || label.isBlank()) {
                groupLabels[id] = nextUnlabelled--;
            } else {
                groupLabels[id] = labelIds.computeIfAbsent(label.trim(), k -> labelIds.size());
            }
        }
        return fromGroupLabels(groupLabels);
    }

    public int size() {
        return clusterIds.length;
    }

    public int clusterOf(int identityId) {
        return clusterIds[identityId];
    }

    public boolean sameCluster(int i, int j) {
        return clusterIds[i] == clusterIds[j];
    }

    public int clusterCount() {
        int count = 0;
        for (int id = 0; id < clusterIds.length; id++) {
            if (clusterIds[id] == id) {
                count++;
            }
        }
        return count;
    }

    /**
     * Clusters keyed by cluster id, members in ascending id order.
     */
    public SortedMap<Integer, List<Integer>> clusters() {
        SortedMap<Integer, List<Integer>> clusters = new TreeMap<>();
        for (int id = 0; id < clusterIds.length; id++) {
            clusters.computeIfAbsent(clusterIds[id], k -> new ArrayList<>()).add(id);
        }
        clusters.replaceAll((k, members) -> Collections.unmodifiableList(members));
        return Collections.unmodifiableSortedMap(clusters);
    }

    /**
     * Clusters with more than one member.
     */
    public List<List<Integer>> mergedClusters() {
        List<List<Integer>> merged = new ArrayList<>();
        for (List<Integer> members : clusters().values()) {
            if (members.size() > 1) {
                merged.add(members);
            }
        }
        return merged;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(clusterIds, ((Partition) o).clusterIds);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(clusterIds);
    }

    @Override
    public String toString() {
        return "Partition{identities=" + clusterIds.length + ", clusters=" + clusterCount() + '}';
    }
}
