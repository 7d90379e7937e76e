package com.identity.dedup.api;

import com.identity.dedup.blocking.BlockingIndex;
import com.identity.dedup.cluster.ClusteringEngine;
import com.identity.dedup.core.model.CandidatePair;
import com.identity.dedup.core.model.CommitRecord;
import com.identity.dedup.core.model.Heuristic;
import com.identity.dedup.core.model.Partition;
import com.identity.dedup.core.model.RawIdentity;
import com.identity.dedup.evaluation.EvaluationResult;
import com.identity.dedup.evaluation.HeuristicComparison;
import com.identity.dedup.evaluation.PartitionEvaluator;
import com.identity.dedup.logging.LogContext;
import com.identity.dedup.metrics.MetricsService;
import com.identity.dedup.metrics.NoOpMetricsService;
import com.identity.dedup.pairs.CandidatePairGenerator;
import com.identity.dedup.pairs.CandidatePairs;
import com.identity.dedup.pairs.PairScorer;
import com.identity.dedup.rules.IdentityNormalizer;
import com.identity.dedup.rules.NicknameDictionary;
import com.identity.dedup.similarity.BirdScorer;
import com.identity.dedup.similarity.IdentityScorer;
import com.identity.dedup.similarity.ImprovedScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Main entry point of the engine. Runs normalization, blocking, candidate generation,
 * scoring and clustering for one heuristic, or both heuristics side by side.
 *
 * <pre>
 * IdentityDeduplicator deduplicator = IdentityDeduplicator.builder()
 *         .options(DeduplicationOptions.builder().threshold(0.9).build())
 *         .build();
 * DeduplicationReport report = deduplicator.analyze(commits);
 * </pre>
 */
public class IdentityDeduplicator {
    private static final Logger log = LoggerFactory.getLogger(IdentityDeduplicator.class);

    private final DeduplicationOptions options;
    private final IdentityNormalizer normalizer;
    private final NicknameDictionary nicknames;
    private final MetricsService metricsService;
    private final CandidatePairGenerator pairGenerator = new CandidatePairGenerator();
    private final ClusteringEngine clusteringEngine = new ClusteringEngine();
    private final PartitionEvaluator evaluator = new PartitionEvaluator();

    private IdentityDeduplicator(Builder builder) {
        this.options = builder.options;
        this.normalizer = builder.normalizer != null ? builder.normalizer : new IdentityNormalizer();
        this.nicknames = builder.nicknames != null ? builder.nicknames : NicknameDictionary.defaultDictionary();
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
    }

    public static IdentityDeduplicator withDefaults() {
        return builder().build();
    }

    /**
     * Builds the analysis context for a batch of commits under this deduplicator's options.
     */
    public AnalysisContext prepare(Collection<CommitRecord> commits) {
        AnalysisContext context = AnalysisContext.of(commits, options, normalizer);
        metricsService.recordIdentityCount(context.size());
        log.info("dedup.prepared runId={} commits={} identities={} invalid={}",
                context.runId(), context.statistics().analyzedCommits(), context.size(),
                context.statistics().invalidIdentities());
        return context;
    }

    /**
     * Runs both heuristics over the commits and compares them.
     */
    public DeduplicationReport analyze(Collection<CommitRecord> commits) {
        return analyze(commits, Map.of());
    }

    /**
     * Runs both heuristics and, when labels are given, evaluates each against them.
     *
     * @param labels ground-truth cluster label per raw identity; may be empty
     */
    public DeduplicationReport analyze(Collection<CommitRecord> commits, Map<RawIdentity, String> labels) {
        Objects.requireNonNull(labels, "labels is required");
        AnalysisContext context = prepare(commits);

        HeuristicResult baseline = run(context, Heuristic.BASELINE);
        HeuristicResult improved = run(context, Heuristic.IMPROVED);
        HeuristicComparison comparison = HeuristicComparison.compare(baseline.scoredPairs(), improved.scoredPairs());
        EvaluationResult agreement = evaluator.evaluate(improved.partition(), baseline.partition());

        Map<Heuristic, EvaluationResult> groundTruth = new EnumMap<>(Heuristic.class);
        if (!labels.isEmpty()) {
            Partition reference = Partition.fromLabels(context.index(), labels);
            groundTruth.put(Heuristic.BASELINE, evaluator.evaluate(baseline.partition(), reference));
            groundTruth.put(Heuristic.IMPROVED, evaluator.evaluate(improved.partition(), reference));
        }

        log.info("dedup.analysis.completed runId={} common={} baselineOnly={} improvedOnly={} agreementF1={}",
                context.runId(), comparison.common(), comparison.baselineOnly(), comparison.improvedOnly(),
                agreement.f1());
        return new DeduplicationReport(context, baseline, improved, comparison, agreement, groundTruth);
    }

    /**
     * Runs a single heuristic over a prepared context.
     */
    public HeuristicResult run(AnalysisContext context, Heuristic heuristic) {
        Objects.requireNonNull(context, "context is required");
        Objects.requireNonNull(heuristic, "heuristic is required");
        DeduplicationOptions runOptions = context.options();

        try (LogContext ignored = LogContext.forRun(context.runId(), heuristic.name())) {
            long start = System.nanoTime();

            BlockingIndex blockingIndex = BlockingIndex.build(context.scoringInput(), runOptions.getBlockingStrategy());
            CandidatePairs candidates = pairGenerator.generate(blockingIndex, runOptions.getMaxPairs());

            IdentityScorer scorer = scorerFor(heuristic, runOptions);
            List<CandidatePair> scored;
            try (PairScorer pairScorer = new PairScorer(runOptions.getParallelism())) {
                scored = pairScorer.score(candidates.pairs(), context.scoringInput(), scorer,
                        runOptions.getThreshold());
            }

            Partition partition = clusteringEngine.cluster(context.size(), scored);
            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            HeuristicResult result = new HeuristicResult(heuristic, partition, scored, candidates.truncated(), duration);

            recordMetrics(result);
            log.info("dedup.run.completed heuristic={} identities={} pairs={} duplicates={} clusters={} truncated={} durationMs={}",
                    heuristic, context.size(), result.pairsScored(), result.duplicatePairs().size(),
                    partition.clusterCount(), candidates.truncated(), duration.toMillis());
            return result;
        }
    }

    IdentityScorer scorerFor(Heuristic heuristic, DeduplicationOptions runOptions) {
        return switch (heuristic) {
            case BASELINE -> new BirdScorer();
            case IMPROVED -> new ImprovedScorer(runOptions.getImprovedWeights(), nicknames);
        };
    }

    private void recordMetrics(HeuristicResult result) {
        Heuristic heuristic = result.heuristic();
        metricsService.recordRunDuration(heuristic, result.duration());
        metricsService.recordPairsScored(heuristic, result.pairsScored());
        metricsService.recordDuplicatePairs(heuristic, result.duplicatePairs().size());
        metricsService.recordClusters(heuristic, result.partition().mergedClusters().size());
        if (result.truncated()) {
            metricsService.incrementTruncatedRun(heuristic);
        }
        for (CandidatePair pair : result.scoredPairs()) {
            metricsService.recordSimilarityScore(heuristic, pair.score());
        }
    }

    public DeduplicationOptions getOptions() {
        return options;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private DeduplicationOptions options = DeduplicationOptions.defaults();
        private IdentityNormalizer normalizer;
        private NicknameDictionary nicknames;
        private MetricsService metricsService;

        public Builder options(DeduplicationOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        /**
         * Sets a custom normalizer, for example one built on an engine with extra rules.
         */
        public Builder normalizer(IdentityNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder nicknames(NicknameDictionary nicknames) {
            this.nicknames = nicknames;
            return this;
        }

        /**
         * Sets a custom metrics service. Defaults to {@link NoOpMetricsService}.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public IdentityDeduplicator build() {
            return new IdentityDeduplicator(this);
        }
    }
}
