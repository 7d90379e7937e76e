package com.identity.dedup.cluster;

import com.identity.dedup.core.model.CandidatePair;
import com.identity.dedup.core.model.Partition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ClusteringEngine Tests")
class ClusteringEngineTest {

    private final ClusteringEngine engine = new ClusteringEngine();

    @Test
    @DisplayName("A-B and B-C put A, B and C in one cluster")
    void transitiveClosure() {
        Partition partition = engine.cluster(4, List.of(
                CandidatePair.duplicate(0, 1, 0.9),
                CandidatePair.duplicate(1, 2, 0.9)));

        assertTrue(partition.sameCluster(0, 2));
        assertFalse(partition.sameCluster(0, 3));
        assertEquals(2, partition.clusterCount());
        assertEquals(0, partition.clusterOf(2));
        assertEquals(3, partition.clusterOf(3));
    }

    @Test
    @DisplayName("Non-duplicate pairs never merge")
    void ignoresDistinctPairs() {
        Partition partition = engine.cluster(3, List.of(
                CandidatePair.distinct(0, 1, 0.84),
                CandidatePair.duplicate(1, 2, 0.86)));

        assertFalse(partition.sameCluster(0, 1));
        assertTrue(partition.sameCluster(1, 2));
        assertEquals(1, partition.clusterOf(2));
    }

    @Test
    @DisplayName("No pairs means all singletons")
    void noPairs() {
        assertEquals(Partition.singletons(5), engine.cluster(5, List.of()));
    }

    @Test
    @DisplayName("Pair order does not change the partition")
    void orderIndependent() {
        List<CandidatePair> pairs = new ArrayList<>(List.of(
                CandidatePair.duplicate(4, 7, 1.0),
                CandidatePair.duplicate(0, 9, 1.0),
                CandidatePair.duplicate(7, 2, 1.0),
                CandidatePair.distinct(1, 3, 0.2),
                CandidatePair.duplicate(5, 6, 1.0),
                CandidatePair.duplicate(6, 9, 1.0)));
        Partition expected = engine.cluster(10, pairs);

        Random random = new Random(42);
        for (int i = 0; i < 20; i++) {
            Collections.shuffle(pairs, random);
            assertEquals(expected, engine.cluster(10, pairs));
        }
        assertEquals(List.of(List.of(0, 5, 6, 9), List.of(2, 4, 7)), expected.mergedClusters());
    }
}
