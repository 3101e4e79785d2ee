package com.raditha.neardup.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.neardup.scan.QueryResult;
import com.raditha.neardup.scan.ScanReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Exports scan metrics to CSV and JSON formats for dashboard integration
 * and historical tracking.
 */
public class MetricsExporter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * Run-level metrics.
     */
    public record ScanMetrics(
            String runName,
            LocalDateTime timestamp,
            int ngramSize,
            double threshold,
            String hashStrategy,
            String aggregation,
            long documentsScanned,
            int skippedQueries,
            int skippedDocuments,
            long totalCount,
            long elapsedMillis,
            List<QueryMetrics> queries) {
    }

    /**
     * Per-query counts.
     */
    public record QueryMetrics(
            String queryId,
            long count,
            long documentsScanned,
            double matchRate) {
    }

    /**
     * Build metrics from a scan report.
     */
    public ScanMetrics buildMetrics(ScanReport report, String runName) {
        List<QueryMetrics> queries = report.results().stream()
                .map(this::buildQueryMetrics)
                .toList();

        return new ScanMetrics(
                runName,
                LocalDateTime.now(),
                report.config().ngramSize(),
                report.config().threshold(),
                report.config().resolvedStrategy().toCliString(),
                report.config().aggregation().name().toLowerCase(Locale.ROOT),
                report.documentsScanned(),
                report.skippedQueries().size(),
                report.skippedDocuments().size(),
                report.totalCount(),
                report.elapsed().toMillis(),
                queries);
    }

    private QueryMetrics buildQueryMetrics(QueryResult result) {
        double rate = result.documentsScanned() == 0
                ? 0.0
                : (double) result.count() / result.documentsScanned();
        return new QueryMetrics(result.queryId(), result.count(), result.documentsScanned(), rate);
    }

    /**
     * Export metrics to CSV format.
     */
    public void exportToCsv(ScanMetrics metrics, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();

        // Header - Summary
        csv.append("# Run Summary\n");
        csv.append("timestamp,run,ngram_size,threshold,hash,aggregation,documents_scanned,"
                + "skipped_queries,skipped_documents,total_count,elapsed_ms\n");
        csv.append(String.format(Locale.ROOT, "%s,%s,%d,%.2f,%s,%s,%d,%d,%d,%d,%d\n",
                metrics.timestamp().format(TIMESTAMP_FORMAT),
                metrics.runName(),
                metrics.ngramSize(),
                metrics.threshold(),
                metrics.hashStrategy(),
                metrics.aggregation(),
                metrics.documentsScanned(),
                metrics.skippedQueries(),
                metrics.skippedDocuments(),
                metrics.totalCount(),
                metrics.elapsedMillis()));

        csv.append("\n");

        // Header - Per-query counts
        csv.append("# Per-Query Counts\n");
        csv.append("query,count,documents_scanned,match_rate\n");

        for (QueryMetrics query : metrics.queries()) {
            csv.append(String.format(Locale.ROOT, "%s,%d,%d,%.4f\n",
                    csvField(query.queryId()),
                    query.count(),
                    query.documentsScanned(),
                    query.matchRate()));
        }

        Files.writeString(outputPath, csv.toString());
    }

    /**
     * Export metrics to JSON format.
     */
    public void exportToJson(ScanMetrics metrics, Path outputPath) throws IOException {
        mapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), metrics);
    }

    /**
     * Read metrics previously written by {@link #exportToJson}.
     */
    public ScanMetrics readJson(Path inputPath) throws IOException {
        return mapper.readValue(inputPath.toFile(), ScanMetrics.class);
    }

    private static String csvField(String value) {
        if (value.contains(",") || value.contains("\"")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
