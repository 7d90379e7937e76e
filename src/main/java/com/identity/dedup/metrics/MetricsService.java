package com.identity.dedup.metrics;

import com.identity.dedup.core.model.Heuristic;

import java.time.Duration;

/**
 * Interface for recording deduplication metrics.
 * Implementations can integrate with Micrometer or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the engine runs
 * without a registry.
 */
public interface MetricsService {

    void recordRunDuration(Heuristic heuristic, Duration duration);

    void recordPairsScored(Heuristic heuristic, long count);

    void recordDuplicatePairs(Heuristic heuristic, long count);

    void recordClusters(Heuristic heuristic, int merged);

    void incrementTruncatedRun(Heuristic heuristic);

    void recordSimilarityScore(Heuristic heuristic, double score);

    void recordIdentityCount(int size);
}
