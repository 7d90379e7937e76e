package com.identity.dedup.metrics;

import com.identity.dedup.core.model.Heuristic;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordRunDuration(Heuristic heuristic, Duration duration) {
    }

    @Override
    public void recordPairsScored(Heuristic heuristic, long count) {
    }

    @Override
    public void recordDuplicatePairs(Heuristic heuristic, long count) {
    }

    @Override
    public void recordClusters(Heuristic heuristic, int merged) {
    }

    @Override
    public void incrementTruncatedRun(Heuristic heuristic) {
    }

    @Override
    public void recordSimilarityScore(Heuristic heuristic, double score) {
    }

    @Override
    public void recordIdentityCount(int size) {
    }
}
