package com.raditha.neardup.scan;

import com.raditha.neardup.config.AggregationMode;
import com.raditha.neardup.config.NearDupConfig;
import com.raditha.neardup.io.SkippedInput;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Result of scanning a corpus with a set of queries.
 * Queries appear in input order. Skipped inputs are listed separately, so a query with a
 * zero count was scanned and found nothing.
 */
public record ScanReport(
        List<QueryResult> results,
        List<SkippedInput> skippedQueries,
        List<SkippedInput> skippedDocuments,
        long documentsScanned,
        Duration elapsed,
        NearDupConfig config) {

    public ScanReport {
        results = List.copyOf(results);
        skippedQueries = List.copyOf(skippedQueries);
        skippedDocuments = List.copyOf(skippedDocuments);
    }

    public Optional<QueryResult> result(String queryId) {
        return results.stream()
                .filter(r -> r.queryId().equals(queryId))
                .findFirst();
    }

    /**
     * Count for a query.
     *
     * @throws IllegalArgumentException if the query was not part of the scan
     */
    public long count(String queryId) {
        return require(queryId).count();
    }

    /**
     * Sorted matching document identifiers (empty unless collection was enabled).
     */
    public List<String> matchingDocuments(String queryId) {
        return require(queryId).matchingDocumentIds();
    }

    public long totalCount() {
        return results.stream().mapToLong(QueryResult::count).sum();
    }

    public long queriesWithMatches() {
        return results.stream().filter(QueryResult::found).count();
    }

    /**
     * Get summary statistics.
     */
    public String getSummary() {
        String unit = config.aggregation() == AggregationMode.SPANS ? "matching spans" : "matching documents";
        return String.format(
                "%d of %d queries found, %d %s across %d documents (n=%d, threshold: %.0f%%, %d ms)",
                queriesWithMatches(),
                results.size(),
                totalCount(),
                unit,
                documentsScanned,
                config.ngramSize(),
                config.threshold() * 100,
                elapsed.toMillis());
    }

    /**
     * Get detailed report string.
     */
    public String getDetailedReport() {
        StringBuilder sb = new StringBuilder();
        sb.append("=".repeat(80)).append("\n");
        sb.append("NEAR-DUPLICATE SCAN REPORT\n");
        sb.append("=".repeat(80)).append("\n\n");

        sb.append("N-gram size: ").append(config.ngramSize()).append("\n");
        sb.append("Threshold: ").append(String.format("%.0f%%", config.threshold() * 100)).append("\n");
        sb.append("Hash: ").append(config.resolvedStrategy().toCliString()).append("\n");
        sb.append("Aggregation: ").append(config.aggregation().name().toLowerCase(Locale.ROOT)).append("\n");
        sb.append("\n");

        sb.append(getSummary()).append("\n\n");

        if (results.isEmpty()) {
            sb.append("No queries scanned.\n");
        } else {
            sb.append("Per-query counts:\n");
            sb.append("-".repeat(80)).append("\n");
            for (QueryResult result : results) {
                sb.append(String.format("  %-40s %d\n", result.queryId(), result.count()));
                for (String documentId : result.matchingDocumentIds()) {
                    sb.append("      ").append(documentId).append("\n");
                }
            }
        }

        appendSkipped(sb, "Skipped queries", skippedQueries);
        appendSkipped(sb, "Skipped documents", skippedDocuments);
        return sb.toString();
    }

    private QueryResult require(String queryId) {
        return result(queryId).orElseThrow(
                () -> new IllegalArgumentException("Unknown query: " + queryId));
    }

    private static void appendSkipped(StringBuilder sb, String title, List<SkippedInput> skipped) {
        if (skipped.isEmpty()) {
            return;
        }
        sb.append("\n").append(title).append(" (").append(skipped.size()).append("):\n");
        for (SkippedInput input : skipped) {
            sb.append("  ").append(input.id()).append(": ").append(input.reason()).append("\n");
        }
    }
}
