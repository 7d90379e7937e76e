package com.identity.dedup.cli;

import com.identity.dedup.api.DeduplicationOptions;
import com.identity.dedup.api.DeduplicationReport;
import com.identity.dedup.api.HeuristicResult;
import com.identity.dedup.api.IdentityDeduplicator;
import com.identity.dedup.blocking.BlockingStrategy;
import com.identity.dedup.bulk.ClusterCsvExporter;
import com.identity.dedup.bulk.CommitLogImporter;
import com.identity.dedup.bulk.CsvCommitLogImporter;
import com.identity.dedup.bulk.DuplicatePairCsvExporter;
import com.identity.dedup.bulk.GitLogImporter;
import com.identity.dedup.bulk.GroundTruthImporter;
import com.identity.dedup.bulk.ImportResult;
import com.identity.dedup.bulk.JsonSummaryExporter;
import com.identity.dedup.bulk.LabelledIdentity;
import com.identity.dedup.bulk.MarkdownReportWriter;
import com.identity.dedup.core.model.CommitRecord;
import com.identity.dedup.core.model.Heuristic;
import com.identity.dedup.core.model.RawIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.Callable;

/**
 * Command-line interface: reads an extracted commit log, runs both heuristics and
 * writes duplicate pairs, clusters, a JSON summary and a Markdown report.
 *
 * <p>Configuration priority: command-line options, then {@code --config} properties, then defaults.</p>
 *
 * <p>Exit codes: 0 success, 1 I/O or unexpected failure, 2 invalid configuration or arguments
 * ({@link com.identity.dedup.api.ConfigurationException} included).</p>
 */
@Command(name = "identity-dedup", mixinStandardHelpOptions = true, version = "identity-dedup 1.0.0",
        description = "Finds commit author identities that belong to the same developer")
public class IdentityDedupCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(IdentityDedupCommand.class);

    static final int EXIT_IO_ERROR = 1;
    static final int EXIT_CONFIGURATION_ERROR = 2;

    enum InputFormat {
        CSV, GIT_LOG;

        CommitLogImporter importer() {
            return this == CSV ? new CsvCommitLogImporter() : new GitLogImporter();
        }
    }

    @Spec
    CommandSpec spec;

    @Option(names = {"-i", "--input"}, required = true, paramLabel = "<file>",
            description = "Commit log to analyze")
    private Path input;

    @Option(names = "--format", paramLabel = "<format>", converter = InputFormatConverter.class,
            description = "Input format: csv or git-log (default: csv)")
    private InputFormat format = InputFormat.CSV;

    @Option(names = "--config", paramLabel = "<file>", description = "Properties file with dedup.* settings")
    private Path configFile;

    @Option(names = "--threshold", paramLabel = "<0..1>", description = "Duplicate threshold (default: 0.85)")
    private Double threshold;

    @Option(names = "--max-pairs", paramLabel = "<n>", description = "Candidate pair budget (default: 100000)")
    private Integer maxPairs;

    @Option(names = "--max-commits", paramLabel = "<n>", description = "Analyze only the n most recent commits")
    private Integer maxCommits;

    @Option(names = "--blocking", paramLabel = "<strategy>", converter = BlockingStrategyConverter.class,
            description = "Blocking: domain, initials or both (default: both)")
    private BlockingStrategy blocking;

    @Option(names = "--parallelism", paramLabel = "<threads>", description = "Scoring threads (default: 1)")
    private Integer parallelism;

    @Option(names = "--exclude-invalid", description = "Keep identities without a usable name or email as singletons")
    private boolean excludeInvalid;

    @Option(names = "--ground-truth", paramLabel = "<file>", description = "Labelled identities (name,email,label)")
    private Path groundTruth;

    @Option(names = {"-o", "--output-dir"}, paramLabel = "<dir>", description = "Output directory (default: results)")
    private Path outputDir = Path.of("results");

    @Option(names = "--name", paramLabel = "<name>", description = "Prefix of the output files (default: input file name)")
    private String name;

    @Override
    public Integer call() throws Exception {
        DeduplicationOptions options = buildOptions();
        String reportName = name != null && !name.isBlank() ? name : baseName(input);
        log.info("cli.started input={} format={} options={}", input, format, options);

        List<CommitRecord> commits = readCommits();
        Map<RawIdentity, String> labels = readLabels();

        IdentityDeduplicator deduplicator = IdentityDeduplicator.builder().options(options).build();
        DeduplicationReport report = deduplicator.analyze(commits, labels);

        writeOutputs(reportName, report);
        printSummary(reportName, report);
        return 0;
    }

    DeduplicationOptions buildOptions() throws IOException {
        DeduplicationOptions.Builder builder;
        if (configFile != null) {
            Properties properties = new Properties();
            try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
                properties.load(reader);
            }
            builder = DeduplicationOptions.fromProperties(properties).toBuilder();
        } else {
            builder = DeduplicationOptions.builder();
        }
        if (threshold != null) {
            builder.threshold(threshold);
        }
        if (maxPairs != null) {
            builder.maxPairs(maxPairs);
        }
        if (maxCommits != null) {
            builder.maxCommits(maxCommits);
        }
        if (blocking != null) {
            builder.blockingStrategy(blocking);
        }
        if (parallelism != null) {
            builder.parallelism(parallelism);
        }
        if (excludeInvalid) {
            builder.excludeInvalidIdentities(true);
        }
        return builder.build();
    }

    private List<CommitRecord> readCommits() throws IOException {
        ImportResult<CommitRecord> result;
        try (Reader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
            result = format.importer().importCommits(reader, null);
        }
        if (result.hasErrors()) {
            spec.commandLine().getErr().println("Skipped " + result.errorCount() + " malformed record(s) in " + input);
        }
        return result.records();
    }

    private Map<RawIdentity, String> readLabels() throws IOException {
        if (groundTruth == null) {
            return Map.of();
        }
        ImportResult<LabelledIdentity> result;
        try (Reader reader = Files.newBufferedReader(groundTruth, StandardCharsets.UTF_8)) {
            result = new GroundTruthImporter().importLabels(reader);
        }
        if (result.hasErrors()) {
            spec.commandLine().getErr().println("Skipped " + result.errorCount() + " malformed label(s) in " + groundTruth);
        }
        return GroundTruthImporter.toLabels(result);
    }

    private void writeOutputs(String reportName, DeduplicationReport report) throws IOException {
        Files.createDirectories(outputDir);
        DuplicatePairCsvExporter pairExporter = new DuplicatePairCsvExporter();
        ClusterCsvExporter clusterExporter = new ClusterCsvExporter();
        for (Heuristic heuristic : Heuristic.values()) {
            HeuristicResult result = report.result(heuristic);
            String prefix = reportName + "_" + heuristic.name().toLowerCase(Locale.ROOT);
            try (Writer writer = Files.newBufferedWriter(outputDir.resolve(prefix + "_duplicates.csv"), StandardCharsets.UTF_8)) {
                pairExporter.export(report.context(), result, writer);
            }
            try (Writer writer = Files.newBufferedWriter(outputDir.resolve(prefix + "_clusters.csv"), StandardCharsets.UTF_8)) {
                clusterExporter.export(result.clusterRows(report.context().index()), writer);
            }
        }
        try (Writer writer = Files.newBufferedWriter(outputDir.resolve(reportName + "_summary.json"), StandardCharsets.UTF_8)) {
            new JsonSummaryExporter().export(reportName, report, writer);
        }
        try (Writer writer = Files.newBufferedWriter(outputDir.resolve(reportName + "_report.md"), StandardCharsets.UTF_8)) {
            new MarkdownReportWriter().write(reportName, report, writer);
        }
        log.info("cli.outputs.written dir={} name={}", outputDir, reportName);
    }

    private void printSummary(String reportName, DeduplicationReport report) {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Analysis of " + reportName);
        out.println("  identities:        " + report.statistics().distinctIdentities()
                + " (" + report.statistics().analyzedCommits() + " commits)");
        out.println("  baseline:          " + report.baseline().duplicatePairs().size() + " duplicate pairs, "
                + report.baseline().clusterCount() + " clusters");
        out.println("  improved:          " + report.improved().duplicatePairs().size() + " duplicate pairs, "
                + report.improved().clusterCount() + " clusters");
        out.println("  common pairs:      " + report.comparison().common());
        out.println("  baseline only:     " + report.comparison().baselineOnly());
        out.println("  improved only:     " + report.comparison().improvedOnly());
        if (report.baseline().truncated() || report.improved().truncated()) {
            out.println("  warning: pair budget reached, rerun with a larger --max-pairs for full coverage");
        }
        out.println("  results written to " + outputDir.toAbsolutePath());
        out.flush();
    }

    static String baseName(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    static class InputFormatConverter implements ITypeConverter<InputFormat> {
        @Override
        public InputFormat convert(String value) {
            String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
            try {
                return InputFormat.valueOf(normalized);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException("Unknown format '" + value + "' (expected csv or git-log)");
            }
        }
    }

    static class BlockingStrategyConverter implements ITypeConverter<BlockingStrategy> {
        @Override
        public BlockingStrategy convert(String value) {
            try {
                return BlockingStrategy.fromString(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    /**
     * Command line with the exit-code mapping applied, without calling {@link System#exit}.
     */
    public static CommandLine newCommandLine() {
        CommandLine cmd = new CommandLine(new IdentityDedupCommand());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return EXIT_CONFIGURATION_ERROR;
            } else if (ex instanceof IOException || ex instanceof UncheckedIOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return EXIT_IO_ERROR;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return EXIT_IO_ERROR;
            }
        });
        return cmd;
    }

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }
}
