package com.raditha.neardup.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.neardup.bench.BenchmarkHarness;
import com.raditha.neardup.bench.BenchmarkResult;
import com.raditha.neardup.bench.BenchmarkRun;
import com.raditha.neardup.bench.SyntheticCorpus;
import com.raditha.neardup.config.ConfigurationException;
import com.raditha.neardup.config.NearDupConfig;
import com.raditha.neardup.config.NearDupSettings;
import com.raditha.neardup.hash.HashStrategy;
import com.raditha.neardup.io.CorpusFileSource;
import com.raditha.neardup.io.JsonlSequenceReader;
import com.raditha.neardup.io.LoadedSequences;
import com.raditha.neardup.io.ResourceException;
import com.raditha.neardup.io.SkippedInput;
import com.raditha.neardup.metrics.MetricsExporter;
import com.raditha.neardup.scan.CorpusScanner;
import com.raditha.neardup.scan.LoggingScanObserver;
import com.raditha.neardup.scan.QueryResult;
import com.raditha.neardup.scan.ScanReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the near-duplicate span matcher.
 * <p>
 * Usage:
 * java -jar neardup.jar --search-dir <dir> --query-path <file.jsonl> [options]
 * java -jar neardup.jar bench [options]
 * <p>
 * Configuration priority: CLI arguments > neardup.yml > defaults
 */
@Command(name = "neardup", mixinStandardHelpOptions = true, version = "neardup v1.0.0", description = "Near-duplicate span matcher for token corpora")
@SuppressWarnings("java:S106")
public class NearDupCLI implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(NearDupCLI.class);

    private static final String VERSION = "1.0.0";

    // Global Options
    @Option(names = "--config-file", description = "Use custom configuration file (default: neardup.yml)", paramLabel = "<path>")
    private String configFile;

    @Option(names = "--search-dir", description = "Corpus directory, searched recursively", paramLabel = "<path>")
    private String searchDir;

    @Option(names = "--query-path", description = "JSONL file with one query per line", paramLabel = "<path>")
    private String queryPath;

    @Option(names = "--output", description = "Directory for exported metrics", paramLabel = "<path>")
    private String outputPath;

    @Option(names = { "-n", "--ngram-size" }, description = "N-gram size (default: 10)", paramLabel = "<n>")
    private int ngramSize = 0; // 0 = use YAML/default

    @Option(names = { "-t", "--threshold" }, description = "Similarity threshold, 0-1 or a percentage (default: 0.6)", paramLabel = "<value>")
    private Double threshold; // null = use YAML/default

    @Option(names = "--hash", description = "Hash strategy: content, rolling or auto (default: auto)", paramLabel = "<strategy>", converter = HashStrategyConverter.class)
    private HashStrategy hashStrategy;

    @Option(names = "--workers", description = "Worker threads (default: available processors)", paramLabel = "<n>")
    private int workers = 0; // 0 = use YAML/default

    @Option(names = "--start-file-idx", description = "First corpus shard index, in thousands", paramLabel = "<n>")
    private int startFileIdx = -1;

    @Option(names = "--end-file-idx", description = "Last corpus shard index, in thousands", paramLabel = "<n>")
    private int endFileIdx = -1;

    @Option(names = "--count-spans", description = "Count matching spans instead of matching documents")
    private boolean countSpans = false;

    @Option(names = "--list-matches", description = "List the matching document ids per query")
    private boolean listMatches = false;

    @Option(names = "--strict", description = "Strict preset (80%% threshold)")
    private boolean strict = false;

    @Option(names = "--lenient", description = "Lenient preset (50%% threshold)")
    private boolean lenient = false;

    @Option(names = "--json", description = "Output results in JSON format")
    private boolean jsonOutput = false;

    @Option(names = "--export", description = "Export metrics (csv, json, or both)", paramLabel = "<format>")
    private String exportFormat;

    // Command selection
    @Option(names = "bench", description = "Benchmark the hash strategies on synthetic data")
    private boolean benchCommand = false;

    // Bench Options
    @Option(names = "--bench-queries", description = "Random queries in the benchmark (default: 1000)", paramLabel = "<n>")
    private int benchQueries = 1000;

    @Option(names = "--bench-docs", description = "Documents of 2048 tokens in the benchmark (default: 1)", paramLabel = "<n>")
    private int benchDocs = 1;

    @Option(names = "--bench-ngrams", description = "Comma separated n values to sweep (default: 5,10,20)", paramLabel = "<list>", split = ",")
    private int[] benchNgrams = { 5, 10, 20 };

    @Option(names = "--bench-seed", description = "Random seed of the benchmark workload", paramLabel = "<n>")
    private long benchSeed = 42L;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws Exception {
        // Validate configuration before proceeding
        validateConfiguration();

        Path settingsPath = Paths.get(configFile != null ? configFile : NearDupSettings.DEFAULT_CONFIG_FILE);
        Map<String, Object> settings = NearDupSettings.loadSettings(settingsPath);
        NearDupConfig config = loadConfig(settings);

        if (benchCommand) {
            runBenchmark(config);
        } else {
            runScan(config, settings);
        }
        return 0; // Success
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Command line with the exit-code mapping used by {@link #main}.
     */
    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new NearDupCLI());

        // Configure error handling
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            // Handle execution exceptions with appropriate exit codes
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException || ex instanceof ResourceException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else if (ex instanceof InterruptedException) {
                commandLine.getErr().println("Process interrupted: " + ex.getMessage());
                return 4;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        // Configure parameter exception handler for better error messages
        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2; // Invalid command line arguments
        });
        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        // Validate threshold range
        if (threshold != null) {
            NearDupSettings.normalizeThreshold(threshold);
        }

        if (ngramSize != 0 && ngramSize < 1) {
            throw new ConfigurationException("N-gram size must be positive, got: " + ngramSize);
        }

        if (workers != 0 && workers < 1) {
            throw new ConfigurationException("Workers must be positive, got: " + workers);
        }

        // Validate export format
        if (exportFormat != null && !exportFormat.isEmpty()) {
            String format = exportFormat.toLowerCase(Locale.ROOT);
            if (!format.equals("csv") && !format.equals("json") && !format.equals("both")) {
                throw new ConfigurationException(
                        "Export format must be 'csv', 'json', or 'both', got: " + exportFormat);
            }
        }

        // Validate mutually exclusive presets
        if (strict && lenient) {
            throw new ConfigurationException("Cannot use both --strict and --lenient presets simultaneously");
        }

        // Validate config file exists if specified
        if (configFile != null && !new File(configFile).exists()) {
            throw new ConfigurationException("Config file not found: " + configFile);
        }

        if (benchCommand) {
            if (benchQueries < 0 || benchDocs < 1) {
                throw new ConfigurationException("Benchmark needs --bench-queries >= 0 and --bench-docs >= 1");
            }
            if (benchNgrams.length == 0 || Arrays.stream(benchNgrams).anyMatch(n -> n < 1)) {
                throw new ConfigurationException("--bench-ngrams values must be positive");
            }
        }

        // Validate output path is writable if specified
        if (outputPath != null) {
            File outputDir = new File(outputPath);
            if (outputDir.exists() && !outputDir.isDirectory()) {
                throw new ConfigurationException("Output path exists but is not a directory: " + outputPath);
            }
            if (!outputDir.exists() && !outputDir.mkdirs()) {
                throw new ConfigurationException("Cannot create output directory: " + outputPath);
            }
        }
    }

    private NearDupConfig loadConfig(Map<String, Object> settings) {
        String preset = null;
        if (strict) {
            preset = "strict";
        } else if (lenient) {
            preset = "lenient";
        }

        NearDupConfig config = NearDupSettings.loadConfig(settings, new NearDupSettings.CliOverrides(
                ngramSize,
                threshold,
                preset,
                hashStrategy,
                workers,
                countSpans));
        return listMatches ? config.withCollectMatches(true) : config;
    }

    private void runScan(NearDupConfig config, Map<String, Object> settings) throws IOException, InterruptedException {
        String corpus = searchDir != null ? searchDir : NearDupSettings.getSearchDir(settings);
        String queries = queryPath != null ? queryPath : NearDupSettings.getQueryPath(settings);
        if (corpus == null) {
            throw new ConfigurationException("No corpus specified: use --search-dir or near_duplicate.search_dir");
        }
        if (queries == null) {
            throw new ConfigurationException("No queries specified: use --query-path or near_duplicate.query_path");
        }
        int start = startFileIdx >= 0 ? startFileIdx : NearDupSettings.getStartFileIdx(settings);
        int end = endFileIdx >= 0 ? endFileIdx : NearDupSettings.getEndFileIdx(settings);

        LoadedSequences loadedQueries = new JsonlSequenceReader().read(Paths.get(queries));
        logger.info("Loaded {} queries from {}", loadedQueries.size(), queries);

        CorpusFileSource source = CorpusFileSource.of(Paths.get(corpus), start, end);
        logger.info("Scanning {} corpus files with n={}, threshold={}, hash={}",
                source.files().size(), config.ngramSize(), config.threshold(), config.resolvedStrategy().toCliString());

        CorpusScanner scanner = new CorpusScanner(config, new LoggingScanObserver());
        ScanReport report = scanner.scan(loadedQueries, source);

        // Print the report
        if (jsonOutput) {
            printJsonReport(report);
        } else {
            System.out.println(report.getDetailedReport());
        }

        // Export metrics if requested
        if (exportFormat != null && !exportFormat.isEmpty()) {
            exportMetrics(report, Paths.get(corpus));
        }
    }

    private void runBenchmark(NearDupConfig config) {
        SyntheticCorpus corpus = SyntheticCorpus.generate(benchQueries, benchDocs, benchSeed);
        BenchmarkHarness harness = new BenchmarkHarness(config.threshold());

        System.out.printf("Benchmark: %d queries x %d documents, threshold %.0f%%%n",
                corpus.queries().size(), corpus.documents().size(), config.threshold() * 100);
        List<BenchmarkRun> runs = harness.sweep(benchNgrams, corpus.queries(), corpus.documents());
        for (BenchmarkRun run : runs) {
            for (BenchmarkResult result : run.results()) {
                System.out.println(result.toLine());
            }
            if (!run.agreed()) {
                System.out.printf("n=%d: strategies disagree on match count%n", run.ngramSize());
            }
        }
    }

    /**
     * JSON view of a scan report.
     */
    public record JsonReport(
            String version,
            int ngramSize,
            double threshold,
            String hash,
            String aggregation,
            long documentsScanned,
            long elapsedMillis,
            List<QueryResult> queries,
            List<SkippedInput> skippedQueries,
            List<SkippedInput> skippedDocuments) {

        static JsonReport of(ScanReport report) {
            NearDupConfig config = report.config();
            return new JsonReport(
                    VERSION,
                    config.ngramSize(),
                    config.threshold(),
                    config.resolvedStrategy().toCliString(),
                    config.aggregation().name().toLowerCase(Locale.ROOT),
                    report.documentsScanned(),
                    report.elapsed().toMillis(),
                    report.results(),
                    report.skippedQueries(),
                    report.skippedDocuments());
        }
    }

    private static void printJsonReport(ScanReport report) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(JsonReport.of(report)));
    }

    /**
     * Export metrics to files.
     */
    private void exportMetrics(ScanReport report, Path corpus) throws IOException {
        MetricsExporter exporter = new MetricsExporter();
        Path name = corpus.getFileName();
        String runName = name != null ? name.toString() : "corpus";

        MetricsExporter.ScanMetrics metrics = exporter.buildMetrics(report, runName);

        Path outputDir = outputPath != null
                ? Paths.get(outputPath)
                : Paths.get(".");

        String format = exportFormat.toLowerCase(Locale.ROOT);
        if ("csv".equals(format) || "both".equals(format)) {
            Path csvPath = outputDir.resolve("neardup-metrics.csv");
            exporter.exportToCsv(metrics, csvPath);
            System.out.println("\n✓ Metrics exported to: " + csvPath.toAbsolutePath());
        }

        if ("json".equals(format) || "both".equals(format)) {
            Path jsonPath = outputDir.resolve("neardup-metrics.json");
            exporter.exportToJson(metrics, jsonPath);
            System.out.println("✓ Metrics exported to: " + jsonPath.toAbsolutePath());
        }
    }
}
