package com.identity.dedup.evaluation;

import com.identity.dedup.core.model.Partition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PartitionEvaluator Tests")
class PartitionEvaluatorTest {

    private static final double TOLERANCE = 1e-9;

    private final PartitionEvaluator evaluator = new PartitionEvaluator();

    @Test
    @DisplayName("Counts agree with pairwise enumeration")
    void contingencyCounts() {
        // candidate {0,1,2} {3} {4}; reference {0,1} {2} {3,4}
        Partition candidate = Partition.fromGroupLabels(new int[]{7, 7, 7, 3, 4});
        Partition reference = Partition.fromGroupLabels(new int[]{0, 0, 2, 3, 3});

        EvaluationResult result = evaluator.evaluate(candidate, reference);

        assertEquals(1, result.truePositives());
        assertEquals(2, result.falsePositives());
        assertEquals(1, result.falseNegatives());
        assertEquals(6, result.trueNegatives());
        assertEquals(10, result.totalPairs());
        assertEquals(1.0 / 3, result.precision(), TOLERANCE);
        assertEquals(0.5, result.recall(), TOLERANCE);
        assertEquals(0.4, result.f1(), TOLERANCE);
        assertEquals(0.7, result.randIndex(), TOLERANCE);
        assertEquals(3, result.candidateClusters());
        assertEquals(3, result.referenceClusters());
    }

    @Test
    @DisplayName("Identical partitions score 1.0 everywhere")
    void identicalPartitions() {
        Partition partition = Partition.fromGroupLabels(new int[]{0, 0, 1, 1, 1, 2});

        EvaluationResult result = evaluator.evaluate(partition, partition);

        assertEquals(1.0, result.precision());
        assertEquals(1.0, result.recall());
        assertEquals(1.0, result.f1(), TOLERANCE);
        assertEquals(1.0, result.randIndex());
    }

    @Test
    @DisplayName("Two all-singleton partitions have precision and recall 1.0")
    void allSingletons() {
        EvaluationResult result = evaluator.evaluate(Partition.singletons(4), Partition.singletons(4));

        assertEquals(0, result.truePositives());
        assertEquals(1.0, result.precision());
        assertEquals(1.0, result.recall());
        assertEquals(1.0, result.randIndex());
    }

    @Test
    @DisplayName("Claiming nothing against a merged reference gives recall 0 and F1 0")
    void noCandidatePairs() {
        EvaluationResult result = evaluator.evaluate(Partition.singletons(3),
                Partition.fromGroupLabels(new int[]{0, 0, 0}));

        assertEquals(1.0, result.precision());
        assertEquals(0.0, result.recall());
        assertEquals(0.0, result.f1());
        assertEquals(0.0, result.randIndex());
    }

    @Test
    @DisplayName("Empty partitions evaluate without dividing by zero")
    void emptyPartitions() {
        EvaluationResult result = evaluator.evaluate(Partition.singletons(0), Partition.singletons(0));

        assertEquals(0, result.totalPairs());
        assertEquals(1.0, result.randIndex());
    }

    @Test
    @DisplayName("Partitions of different sizes are rejected")
    void sizeMismatch() {
        assertThrows(IllegalArgumentException.class,
                () -> evaluator.evaluate(Partition.singletons(3), Partition.singletons(4)));
    }
}
