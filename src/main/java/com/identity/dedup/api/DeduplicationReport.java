package com.identity.dedup.api;

import com.identity.dedup.core.model.Heuristic;
import com.identity.dedup.evaluation.EvaluationResult;
import com.identity.dedup.evaluation.HeuristicComparison;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything an analysis produces: both heuristic results, how they compare, and
 * optionally how each scores against labelled ground truth.
 *
 * @param context     the analysis context both runs shared
 * @param baseline    result of the baseline heuristic
 * @param improved    result of the improved heuristic
 * @param comparison  overlap of the duplicate pairs the two heuristics reported
 * @param agreement   improved partition evaluated against the baseline partition
 * @param groundTruth per-heuristic evaluation against labels; empty without labels
 */
public record DeduplicationReport(
        AnalysisContext context,
        HeuristicResult baseline,
        HeuristicResult improved,
        HeuristicComparison comparison,
        EvaluationResult agreement,
        Map<Heuristic, EvaluationResult> groundTruth
) {
    public DeduplicationReport {
        Objects.requireNonNull(context, "context is required");
        Objects.requireNonNull(baseline, "baseline is required");
        Objects.requireNonNull(improved, "improved is required");
        groundTruth = groundTruth == null || groundTruth.isEmpty()
                ? Map.of()
                : Map.copyOf(new EnumMap<>(groundTruth));
    }

    public HeuristicResult result(Heuristic heuristic) {
        return heuristic == Heuristic.BASELINE ? baseline : improved;
    }

    public Optional<EvaluationResult> groundTruthEvaluation(Heuristic heuristic) {
        return Optional.ofNullable(groundTruth.get(heuristic));
    }

    public RunStatistics statistics() {
        return context.statistics();
    }

    public DeduplicationOptions options() {
        return context.options();
    }
}
