package com.identity.dedup.metrics;

import com.identity.dedup.core.model.Heuristic;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics (all tagged with {@code heuristic} except the identity count):</p>
 * <ul>
 *   <li>{@code dedup.run.duration}: Timer</li>
 *   <li>{@code dedup.pairs.scored}: Counter</li>
 *   <li>{@code dedup.pairs.duplicate}: Counter</li>
 *   <li>{@code dedup.clusters.merged}: Counter</li>
 *   <li>{@code dedup.run.truncated}: Counter</li>
 *   <li>{@code dedup.similarity.score}: DistributionSummary</li>
 *   <li>{@code dedup.identities}: DistributionSummary (untagged)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<Heuristic, DistributionSummary> scoreSummaries = new ConcurrentHashMap<>();
    private final DistributionSummary identitySummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.identitySummary = DistributionSummary.builder("dedup.identities")
                .description("Distinct identities per analysis")
                .register(registry);
    }

    @Override
    public void recordRunDuration(Heuristic heuristic, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(heuristic.name(), k ->
                Timer.builder("dedup.run.duration")
                        .description("Duration of one heuristic run")
                        .tag("heuristic", heuristic.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordPairsScored(Heuristic heuristic, long count) {
        counter("dedup.pairs.scored", "Candidate pairs scored", heuristic).increment(count);
    }

    @Override
    public void recordDuplicatePairs(Heuristic heuristic, long count) {
        counter("dedup.pairs.duplicate", "Pairs judged duplicate", heuristic).increment(count);
    }

    @Override
    public void recordClusters(Heuristic heuristic, int merged) {
        counter("dedup.clusters.merged", "Clusters with more than one identity", heuristic).increment(merged);
    }

    @Override
    public void incrementTruncatedRun(Heuristic heuristic) {
        counter("dedup.run.truncated", "Runs cut short by the pair budget", heuristic).increment();
    }

    @Override
    public void recordSimilarityScore(Heuristic heuristic, double score) {
        scoreSummaries.computeIfAbsent(heuristic, h ->
                DistributionSummary.builder("dedup.similarity.score")
                        .description("Distribution of pair similarity scores")
                        .tag("heuristic", h.name())
                        .register(registry))
                .record(score);
    }

    @Override
    public void recordIdentityCount(int size) {
        identitySummary.record(size);
    }

    private Counter counter(String name, String description, Heuristic heuristic) {
        return counterCache.computeIfAbsent(name + ":" + heuristic.name(), k ->
                Counter.builder(name)
                        .description(description)
                        .tag("heuristic", heuristic.name())
                        .register(registry));
    }
}
