package com.identity.dedup.evaluation;

import com.identity.dedup.core.model.Partition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Computes pairwise precision, recall, F1 and Rand index between two partitions.
 *
 * <p>Counts come from the cluster contingency table rather than from enumerating
 * identity pairs, so evaluation is linear in the number of identities.</p>
 */
public class PartitionEvaluator {
    private static final Logger log = LoggerFactory.getLogger(PartitionEvaluator.class);

    public EvaluationResult evaluate(Partition candidate, Partition reference) {
        Objects.requireNonNull(candidate, "candidate is required");
        Objects.requireNonNull(reference, "reference is required");
        if (candidate.size() != reference.size()) {
            throw new IllegalArgumentException("Partitions cover different identity sets: "
                    + candidate.size() + " vs " + reference.size());
        }

        int n = candidate.size();
        Map<Integer, Integer> candidateSizes = new HashMap<>();
        Map<Integer, Integer> referenceSizes = new HashMap<>();
        Map<Long, Integer> overlap = new HashMap<>();
        for (int id = 0; id < n; id++) {
            int c = candidate.clusterOf(id);
            int r = reference.clusterOf(id);
            candidateSizes.merge(c, 1, Integer::sum);
            referenceSizes.merge(r, 1, Integer::sum);
            overlap.merge(((long) c << 32) | (r & 0xffffffffL), 1, Integer::sum);
        }

        long truePositives = sumOfPairs(overlap);
        long candidatePositives = sumOfPairs(candidateSizes);
        long referencePositives = sumOfPairs(referenceSizes);
        long falsePositives = candidatePositives - truePositives;
        long falseNegatives = referencePositives - truePositives;
        long totalPairs = choose2(n);

        double precision = candidatePositives == 0 ? 1.0 : (double) truePositives / candidatePositives;
        double recall = referencePositives == 0 ? 1.0 : (double) truePositives / referencePositives;
        double f1 = precision + recall == 0.0 ? 0.0 : 2 * precision * recall / (precision + recall);
        double randIndex = totalPairs == 0
                ? 1.0
                : (double) (totalPairs - falsePositives - falseNegatives) / totalPairs;

        EvaluationResult result = new EvaluationResult(truePositives, falsePositives, falseNegatives, totalPairs,
                precision, recall, f1, randIndex, candidateSizes.size(), referenceSizes.size());
        log.debug("evaluation.completed {}", result);
        return result;
    }

    private static long sumOfPairs(Map<?, Integer> sizes) {
        long sum = 0;
        for (int size : sizes.values()) {
            sum += choose2(size);
        }
        return sum;
    }

    private static long choose2(long k) {
        return k * (k - 1) / 2;
    }
}
