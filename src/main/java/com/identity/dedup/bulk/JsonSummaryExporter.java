package com.identity.dedup.bulk;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.identity.dedup.api.DeduplicationOptions;
import com.identity.dedup.api.DeduplicationReport;
import com.identity.dedup.api.HeuristicResult;
import com.identity.dedup.api.RunStatistics;
import com.identity.dedup.core.model.Heuristic;
import com.identity.dedup.evaluation.EvaluationResult;
import com.identity.dedup.evaluation.HeuristicComparison;
import com.identity.dedup.similarity.ImprovedWeights;

import java.io.IOException;
import java.io.Writer;
import java.util.Locale;
import java.util.Map;

/**
 * Writes the aggregate metrics object of an analysis as JSON:
 * parameters, input statistics, per-heuristic counts, the comparison of the two
 * heuristics and, when labels were supplied, the ground-truth evaluation.
 */
public class JsonSummaryExporter {

    private final ObjectMapper objectMapper;

    public JsonSummaryExporter() {
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void export(String name, DeduplicationReport report, Writer writer) throws IOException {
        objectMapper.writeValue(writer, toJson(name, report));
    }

    public String toJsonString(String name, DeduplicationReport report) throws IOException {
        return objectMapper.writeValueAsString(toJson(name, report));
    }

    ObjectNode toJson(String name, DeduplicationReport report) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("name", name);
        root.put("runId", report.context().runId());
        root.set("parameters", parameters(report.options()));
        root.set("statistics", statistics(report.statistics()));

        ObjectNode heuristics = root.putObject("heuristics");
        heuristics.set(key(Heuristic.BASELINE), heuristic(report.baseline()));
        heuristics.set(key(Heuristic.IMPROVED), heuristic(report.improved()));

        HeuristicComparison comparison = report.comparison();
        ObjectNode comparisonNode = root.putObject("comparison");
        comparisonNode.put("common", comparison.common());
        comparisonNode.put("baselineOnly", comparison.baselineOnly());
        comparisonNode.put("improvedOnly", comparison.improvedOnly());
        comparisonNode.set("agreement", evaluation(report.agreement()));

        if (!report.groundTruth().isEmpty()) {
            ObjectNode groundTruth = root.putObject("groundTruth");
            for (Map.Entry<Heuristic, EvaluationResult> entry : report.groundTruth().entrySet()) {
                groundTruth.set(key(entry.getKey()), evaluation(entry.getValue()));
            }
        }
        return root;
    }

    private ObjectNode parameters(DeduplicationOptions options) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("threshold", options.getThreshold());
        node.put("maxPairs", options.getMaxPairs());
        if (options.getMaxCommits().isPresent()) {
            node.put("maxCommits", options.getMaxCommits().getAsInt());
        } else {
            node.putNull("maxCommits");
        }
        node.put("blocking", options.getBlockingStrategy().name().toLowerCase(Locale.ROOT));
        node.put("parallelism", options.getParallelism());
        node.put("excludeInvalidIdentities", options.isExcludeInvalidIdentities());
        ImprovedWeights weights = options.getImprovedWeights();
        ObjectNode weightsNode = node.putObject("weights");
        weightsNode.put("name", weights.name());
        weightsNode.put("emailLocal", weights.emailLocal());
        weightsNode.put("domain", weights.domain());
        weightsNode.put("initials", weights.initials());
        return node;
    }

    private ObjectNode statistics(RunStatistics statistics) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("inputCommits", statistics.inputCommits());
        node.put("analyzedCommits", statistics.analyzedCommits());
        node.put("distinctIdentities", statistics.distinctIdentities());
        node.put("validIdentities", statistics.validIdentities());
        node.put("invalidIdentities", statistics.invalidIdentities());
        return node;
    }

    private ObjectNode heuristic(HeuristicResult result) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("pairsScored", result.pairsScored());
        node.put("duplicatePairs", result.duplicatePairs().size());
        node.put("clusters", result.clusterCount());
        node.put("mergedClusters", result.partition().mergedClusters().size());
        node.put("truncated", result.truncated());
        node.put("durationMs", result.duration().toMillis());
        return node;
    }

    private ObjectNode evaluation(EvaluationResult result) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("truePositives", result.truePositives());
        node.put("falsePositives", result.falsePositives());
        node.put("falseNegatives", result.falseNegatives());
        node.put("precision", result.precision());
        node.put("recall", result.recall());
        node.put("f1", result.f1());
        node.put("randIndex", result.randIndex());
        return node;
    }

    private static String key(Heuristic heuristic) {
        return heuristic.name().toLowerCase(Locale.ROOT);
    }
}
