package com.identity.dedup.bulk;

import com.identity.dedup.api.ClusterRow;
import com.identity.dedup.api.DeduplicationOptions;
import com.identity.dedup.api.DeduplicationReport;
import com.identity.dedup.api.HeuristicResult;
import com.identity.dedup.api.RunStatistics;
import com.identity.dedup.core.model.Heuristic;
import com.identity.dedup.core.model.RawIdentity;
import com.identity.dedup.evaluation.EvaluationResult;
import com.identity.dedup.evaluation.HeuristicComparison;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Writes the narrative Markdown summary of an analysis.
 */
public class MarkdownReportWriter {

    static final int TOP_CLUSTERS = 10;

    public void write(String name, DeduplicationReport report, Writer writer) throws IOException {
        PrintWriter out = new PrintWriter(writer);
        RunStatistics statistics = report.statistics();
        DeduplicationOptions options = report.options();
        HeuristicResult baseline = report.baseline();
        HeuristicResult improved = report.improved();
        HeuristicComparison comparison = report.comparison();

        out.println("# Developer Identity Deduplication Report: " + name);
        out.println();
        out.println("## Input");
        out.println();
        out.println("- **Commits analyzed**: " + statistics.analyzedCommits() + " of " + statistics.inputCommits());
        out.println("- **Distinct identities**: " + statistics.distinctIdentities());
        out.println("- **Valid identities**: " + statistics.validIdentities());
        out.println("- **Invalid identities**: " + statistics.invalidIdentities());
        out.println();
        out.println("## Parameters");
        out.println();
        out.println("- **Similarity threshold**: " + format(options.getThreshold()));
        out.println("- **Max pairs**: " + options.getMaxPairs());
        out.println("- **Max commits**: " + (options.getMaxCommits().isPresent()
                ? Integer.toString(options.getMaxCommits().getAsInt()) : "all"));
        out.println("- **Blocking**: " + options.getBlockingStrategy().name().toLowerCase(Locale.ROOT));
        out.println("- **Improved weights**: name " + format(options.getImprovedWeights().name())
                + ", email local part " + format(options.getImprovedWeights().emailLocal())
                + ", domain " + format(options.getImprovedWeights().domain())
                + ", initials " + format(options.getImprovedWeights().initials()));
        out.println();
        out.println("## Results");
        out.println();
        out.println("| Metric | Baseline | Improved | Difference |");
        out.println("|--------|----------|----------|------------|");
        row(out, "Pairs scored", baseline.pairsScored(), improved.pairsScored());
        row(out, "Duplicate pairs", baseline.duplicatePairs().size(), improved.duplicatePairs().size());
        row(out, "Clusters", baseline.clusterCount(), improved.clusterCount());
        row(out, "Merged clusters", baseline.partition().mergedClusters().size(),
                improved.partition().mergedClusters().size());
        Optional<EvaluationResult> baselineTruth = report.groundTruthEvaluation(Heuristic.BASELINE);
        Optional<EvaluationResult> improvedTruth = report.groundTruthEvaluation(Heuristic.IMPROVED);
        if (baselineTruth.isPresent() && improvedTruth.isPresent()) {
            row(out, "Precision", baselineTruth.get().precision(), improvedTruth.get().precision());
            row(out, "Recall", baselineTruth.get().recall(), improvedTruth.get().recall());
            row(out, "F1", baselineTruth.get().f1(), improvedTruth.get().f1());
        }
        out.println();
        if (baseline.truncated() || improved.truncated()) {
            out.println("> Candidate generation stopped at the pair budget of " + options.getMaxPairs()
                    + "; some plausible pairs were not compared.");
            out.println();
        }
        if (baselineTruth.isEmpty()) {
            out.println("No ground truth was supplied; precision and recall against labels are not available.");
            out.println();
        }

        out.println("## Comparison");
        out.println();
        out.println("- **Common duplicate pairs**: " + comparison.common());
        out.println("- **Baseline only**: " + comparison.baselineOnly());
        out.println("- **Improved only**: " + comparison.improvedOnly());
        EvaluationResult agreement = report.agreement();
        out.println("- **Partition agreement** (improved against baseline): precision "
                + format(agreement.precision()) + ", recall " + format(agreement.recall())
                + ", F1 " + format(agreement.f1()) + ", Rand index " + format(agreement.randIndex()));
        out.println();

        out.println("## Largest Improved Clusters");
        out.println();
        List<ClusterRow> largest = improved.clusterRows(report.context().index()).stream()
                .filter(cluster -> cluster.size() > 1)
                .sorted(Comparator.comparingInt(ClusterRow::size).reversed()
                        .thenComparing(Comparator.comparingLong(ClusterRow::commitCount).reversed())
                        .thenComparingInt(ClusterRow::clusterId))
                .limit(TOP_CLUSTERS)
                .toList();
        if (largest.isEmpty()) {
            out.println("No identities were merged.");
        } else {
            out.println("| Cluster | Identities | Commits | Members |");
            out.println("|---------|------------|---------|---------|");
            for (ClusterRow cluster : largest) {
                out.println("| " + cluster.clusterId() + " | " + cluster.size() + " | " + cluster.commitCount()
                        + " | " + members(cluster.members()) + " |");
            }
        }
        out.println();
        out.println("## Method");
        out.println();
        out.println("The baseline applies three ordered rules and stops at the first that fires: identical email"
                + " address, identical canonical email local part with a shared name token, identical name token set.");
        out.println("The improved heuristic scores name similarity (nickname aware), email local part similarity,"
                + " domain equality and initials overlap, and marks a pair duplicate when the weighted score"
                + " reaches the threshold.");
        out.println("Duplicate decisions of either heuristic are closed transitively into clusters.");
        out.flush();
        if (out.checkError()) {
            throw new IOException("Failed to write Markdown report");
        }
    }

    private static void row(PrintWriter out, String metric, long baseline, long improved) {
        out.printf(Locale.ROOT, "| %s | %d | %d | %+d |%n", metric, baseline, improved, improved - baseline);
    }

    private static void row(PrintWriter out, String metric, double baseline, double improved) {
        out.printf(Locale.ROOT, "| %s | %.3f | %.3f | %+.3f |%n", metric, baseline, improved, improved - baseline);
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private static String members(List<RawIdentity> members) {
        return members.stream()
                .map(member -> member.toString().replace("|", "\\|").replace("<", "&lt;").replace(">", "&gt;"))
                .collect(Collectors.joining(", "));
    }
}
