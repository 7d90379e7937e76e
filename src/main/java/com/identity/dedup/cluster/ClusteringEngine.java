package com.identity.dedup.cluster;

import com.identity.dedup.core.model.CandidatePair;
import com.identity.dedup.core.model.Partition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns duplicate decisions into a partition by transitive closure.
 * Non-duplicate pairs are ignored; the result does not depend on pair order.
 */
public class ClusteringEngine {
    private static final Logger log = LoggerFactory.getLogger(ClusteringEngine.class);

    public Partition cluster(int identityCount, Iterable<CandidatePair> pairs) {
        UnionFind unionFind = new UnionFind(identityCount);
        int merges = 0;
        for (CandidatePair pair : pairs) {
            if (pair.duplicate() && unionFind.union(pair.first(), pair.second())) {
                merges++;
            }
        }
        Partition partition = Partition.fromGroupLabels(unionFind.roots());
        log.debug("clustering.completed identities={} merges={} clusters={}",
                identityCount, merges, partition.clusterCount());
        return partition;
    }
}
