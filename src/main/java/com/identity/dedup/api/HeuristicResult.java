package com.identity.dedup.api;

import com.identity.dedup.core.model.CandidatePair;
import com.identity.dedup.core.model.Heuristic;
import com.identity.dedup.core.model.IdentityIndex;
import com.identity.dedup.core.model.Partition;
import com.identity.dedup.core.model.RawIdentity;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Outcome of running one heuristic over an analysis context.
 *
 * @param heuristic      the heuristic that produced this result
 * @param partition      final clusters, total over all identities
 * @param scoredPairs    every scored candidate pair in generation order
 * @param truncated      true when the pair budget stopped candidate generation early
 * @param duration       wall-clock time of the run
 */
public record HeuristicResult(
        Heuristic heuristic,
        Partition partition,
        List<CandidatePair> scoredPairs,
        boolean truncated,
        Duration duration
) {
    public HeuristicResult {
        scoredPairs = scoredPairs != null ? List.copyOf(scoredPairs) : List.of();
    }

    public List<CandidatePair> duplicatePairs() {
        return scoredPairs.stream().filter(CandidatePair::duplicate).toList();
    }

    public int pairsScored() {
        return scoredPairs.size();
    }

    public int clusterCount() {
        return partition.clusterCount();
    }

    /**
     * One row per final cluster, singletons included, ordered by cluster id.
     */
    public List<ClusterRow> clusterRows(IdentityIndex index) {
        List<ClusterRow> rows = new ArrayList<>();
        for (Map.Entry<Integer, List<Integer>> cluster : partition.clusters().entrySet()) {
            List<Integer> memberIds = cluster.getValue();
            long commits = 0;
            List<RawIdentity> members = new ArrayList<>(memberIds.size());
            for (int id : memberIds) {
                members.add(index.identity(id));
                commits += index.commitCount(id);
            }
            rows.add(new ClusterRow(cluster.getKey(), members, commits));
        }
        return rows;
    }

    @Override
    public String toString() {
        return "HeuristicResult{" +
                "heuristic=" + heuristic +
                ", pairsScored=" + scoredPairs.size() +
                ", duplicates=" + duplicatePairs().size() +
                ", clusters=" + partition.clusterCount() +
                ", truncated=" + truncated +
                '}';
    }
}
