package com.identity.dedup.bulk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.identity.dedup.api.ClusterRow;
import com.identity.dedup.api.DeduplicationReport;
import com.identity.dedup.api.IdentityDeduplicator;
import com.identity.dedup.core.model.CommitRecord;
import com.identity.dedup.core.model.RawIdentity;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Report exporter Tests")
class ReportExportersTest {

    private static DeduplicationReport report;
    private static DeduplicationReport labelledReport;

    @BeforeAll
    static void analyze() {
        List<CommitRecord> commits = List.of(
                CommitRecord.of("c1", "Jane Doe", "jane.doe@co.com", Instant.ofEpochSecond(10)),
                CommitRecord.of("c2", "Jane Doe", "jane.doe@co.com", Instant.ofEpochSecond(20)),
                CommitRecord.of("c3", "J. Doe", "jane.doe@co.com", Instant.ofEpochSecond(30)),
                CommitRecord.of("c4", "Bob Smith", "bob@home.com", Instant.ofEpochSecond(40)),
                CommitRecord.of("c5", "Bob Smith", "bsmith@work.com", Instant.ofEpochSecond(50)));
        IdentityDeduplicator deduplicator = IdentityDeduplicator.withDefaults();
        report = deduplicator.analyze(commits);
        labelledReport = deduplicator.analyze(commits, Map.of(
                RawIdentity.of("Jane Doe", "jane.doe@co.com"), "jane",
                RawIdentity.of("J. Doe", "jane.doe@co.com"), "jane"));
    }

    private static String[] lines(StringWriter writer) {
        return writer.toString().split("\\R");
    }

    @Nested
    @DisplayName("Duplicate pairs CSV")
    class DuplicatePairs {

        @Test
        @DisplayName("Writes one quoted-evidence row per improved duplicate")
        void improvedPairs() throws IOException {
            StringWriter writer = new StringWriter();

            long rows = new DuplicatePairCsvExporter().export(report.context(), report.improved(), writer);

            String[] lines = lines(writer);
            assertEquals(1, rows);
            assertEquals(DuplicatePairCsvExporter.HEADER, lines[0]);
            // ids: 0 Bob home, 1 Bob work, 2 J. Doe, 3 Jane Doe
            assertTrue(lines[1].startsWith("2,J. Doe,jane.doe@co.com,3,Jane Doe,jane.doe@co.com,0.90"));
            assertTrue(lines[1].contains(",\"name=0.3750"));
            assertTrue(lines[1].endsWith(",0.60,true,Same email domain: co.com; Identical email prefixes"));
        }

        @Test
        @DisplayName("Baseline rows carry the rule that fired")
        void baselinePairs() throws IOException {
            StringWriter writer = new StringWriter();

            long rows = new DuplicatePairCsvExporter().export(report.context(), report.baseline(), writer);

            String[] lines = lines(writer);
            assertEquals(2, rows);
            // dom:co.com is visited before ini:b|smith
            assertTrue(lines[1].contains(",1.0000,EMAIL_EQUAL,"));
            assertEquals("0,Bob Smith,bob@home.com,1,Bob Smith,bsmith@work.com,1.0000,NAME_TOKENS_EQUAL,0.50,false,"
                    + "High name similarity: 1.00; Email prefix contains first initial + last name: bsmith", lines[2]);
        }
    }

    @Nested
    @DisplayName("Cluster CSV")
    class Clusters {

        @Test
        @DisplayName("Writes every cluster, singletons included")
        void allClusters() throws IOException {
            List<ClusterRow> rows = report.improved().clusterRows(report.context().index());
            StringWriter writer = new StringWriter();

            assertEquals(3, new ClusterCsvExporter().export(rows, writer));

            String[] lines = lines(writer);
            assertEquals(ClusterCsvExporter.HEADER, lines[0]);
            assertEquals("0,1,1,Bob Smith,bob@home.com", lines[1]);
            assertEquals("2,2,3,J. Doe; Jane Doe,jane.doe@co.com; jane.doe@co.com", lines[3]);
        }

        @Test
        @DisplayName("Merged-only mode skips singletons")
        void mergedOnly() throws IOException {
            List<ClusterRow> rows = report.baseline().clusterRows(report.context().index());
            StringWriter writer = new StringWriter();

            assertEquals(2, new ClusterCsvExporter(true).export(rows, writer));
        }
    }

    @Nested
    @DisplayName("JSON summary")
    class JsonSummary {

        private final ObjectMapper mapper = new ObjectMapper();

        @Test
        @DisplayName("Contains parameters, statistics, heuristics and comparison")
        void summary() throws IOException {
            JsonNode json = mapper.readTree(new JsonSummaryExporter().toJsonString("sample", report));

            assertEquals("sample", json.get("name").asText());
            assertEquals(0.85, json.at("/parameters/threshold").asDouble());
            assertTrue(json.at("/parameters/maxCommits").isNull());
            assertEquals("both", json.at("/parameters/blocking").asText());
            assertEquals(0.40, json.at("/parameters/weights/emailLocal").asDouble());
            assertEquals(5, json.at("/statistics/inputCommits").asInt());
            assertEquals(4, json.at("/statistics/distinctIdentities").asInt());
            assertEquals(2, json.at("/heuristics/baseline/duplicatePairs").asInt());
            assertEquals(1, json.at("/heuristics/improved/duplicatePairs").asInt());
            assertEquals(1, json.at("/comparison/baselineOnly").asInt());
            assertEquals(0.5, json.at("/comparison/agreement/recall").asDouble());
            assertFalse(json.has("groundTruth"));
        }

        @Test
        @DisplayName("Includes the ground-truth evaluation when labels were given")
        void groundTruth() throws IOException {
            StringWriter writer = new StringWriter();
            new JsonSummaryExporter().export("labelled", labelledReport, writer);

            JsonNode json = mapper.readTree(writer.toString());

            assertEquals(1.0, json.at("/groundTruth/improved/precision").asDouble());
            assertEquals(0.5, json.at("/groundTruth/baseline/precision").asDouble());
        }
    }

    @Nested
    @DisplayName("Markdown report")
    class Markdown {

        @Test
        @DisplayName("Has every section and the results table")
        void sections() throws IOException {
            StringWriter writer = new StringWriter();

            new MarkdownReportWriter().write("sample", report, writer);

            String markdown = writer.toString();
            assertTrue(markdown.startsWith("# Developer Identity Deduplication Report: sample"));
            for (String section : List.of("## Input", "## Parameters", "## Results", "## Comparison",
                    "## Largest Improved Clusters", "## Method")) {
                assertTrue(markdown.contains(section), section);
            }
            assertTrue(markdown.contains("| Duplicate pairs | 2 | 1 | -1 |"));
            assertTrue(markdown.contains("No ground truth was supplied"));
            assertTrue(markdown.contains("J. Doe &lt;jane.doe@co.com&gt;, Jane Doe &lt;jane.doe@co.com&gt;"));
        }

        @Test
        @DisplayName("Adds precision, recall and F1 rows with labels")
        void groundTruthRows() throws IOException {
            StringWriter writer = new StringWriter();

            new MarkdownReportWriter().write("labelled", labelledReport, writer);

            String markdown = writer.toString();
            assertTrue(markdown.contains("| Precision | 0.500 | 1.000 | +0.500 |"));
            assertFalse(markdown.contains("No ground truth was supplied"));
        }
    }
}
