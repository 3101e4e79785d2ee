package com.raditha.neardup.scan;

import com.raditha.neardup.config.AggregationMode;
import com.raditha.neardup.config.ConfigurationException;
import com.raditha.neardup.config.NearDupConfig;
import com.raditha.neardup.hash.NgramHasher;
import com.raditha.neardup.index.QueryIndex;
import com.raditha.neardup.io.LoadedSequences;
import com.raditha.neardup.io.SkippedInput;
import com.raditha.neardup.matcher.MatchEngine;
import com.raditha.neardup.matcher.MatchResult;
import com.raditha.neardup.matcher.SpanMatcher;
import com.raditha.neardup.model.SequenceRecord;
import com.raditha.neardup.similarity.SimilarityVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs every query against every corpus document and aggregates per-query counts.
 * <p>
 * Each query is indexed once. Documents are processed batch by batch; every batch is
 * split into chunks that run on a fixed worker pool. A chunk keeps its own partial
 * counts, which are merged after its future completes, so the result does not depend on
 * the number of workers or on document order.
 */
public class CorpusScanner {

    private final NearDupConfig config;
    private final ScanObserver observer;
    private final NgramHasher hasher;
    private final SpanMatcher matcher;

    public CorpusScanner(NearDupConfig config, ScanObserver observer) {
        if (config == null) {
            throw new ConfigurationException("configuration is required");
        }
        this.config = config;
        this.observer = observer != null ? observer : ScanObserver.NONE;
        this.hasher = config.createHasher();
        this.matcher = new MatchEngine(hasher, new SimilarityVerifier(config.threshold()));
    }

    public NearDupConfig config() {
        return config;
    }

    public SpanMatcher matcher() {
        return matcher;
    }

    /**
     * Scan an in-memory corpus.
     *
     * @throws ConfigurationException if no corpus is given
     */
    public ScanReport scan(List<SequenceRecord> queries, List<SequenceRecord> documents)
            throws InterruptedException {
        if (documents == null) {
            throw new ConfigurationException("No corpus specified");
        }
        return scan(queries, DocumentSource.of(documents));
    }

    public ScanReport scan(List<SequenceRecord> queries, DocumentSource documents) throws InterruptedException {
        return run(queries, List.of(), documents);
    }

    /**
     * Scan with queries produced by a loader, carrying its skipped records into the report.
     */
    public ScanReport scan(LoadedSequences queries, DocumentSource documents) throws InterruptedException {
        if (queries == null) {
            throw new ConfigurationException("No queries specified");
        }
        return run(queries.records(), queries.skipped(), documents);
    }

    private ScanReport run(List<SequenceRecord> queries, List<SkippedInput> skippedQueries,
            DocumentSource source) throws InterruptedException {
        if (queries == null) {
            throw new ConfigurationException("No queries specified");
        }
        if (source == null) {
            throw new ConfigurationException("No corpus specified");
        }
        long started = System.nanoTime();

        List<QueryIndex> indexes = new ArrayList<>(queries.size());
        for (SequenceRecord query : queries) {
            indexes.add(QueryIndex.build(query.tokens(), hasher));
            observer.onQueryIndexed(query.id());
        }

        PartialCounts totals = new PartialCounts(queries.size(), config.collectMatches());
        List<SkippedInput> skippedDocuments = new ArrayList<>();
        long documentsScanned = 0;

        ExecutorService executor = Executors.newFixedThreadPool(config.workers());
        try {
            int batchIndex = 0;
            LoadedSequences batch;
            while ((batch = source.nextBatch()) != null) {
                skippedDocuments.addAll(batch.skipped());
                if (!batch.isEmpty()) {
                    scanBatch(executor, queries, indexes, batch.records(), totals);
                    documentsScanned += batch.size();
                }
                observer.onBatchComplete(batch.source(), batchIndex++);
            }
        } finally {
            shutdown(executor);
        }

        List<QueryResult> results = new ArrayList<>(queries.size());
        for (int q = 0; q < queries.size(); q++) {
            String queryId = queries.get(q).id();
            observer.onCorpusComplete(queryId, totals.counts[q]);
            results.add(new QueryResult(queryId, totals.counts[q], totals.sortedMatches(q), documentsScanned));
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        return new ScanReport(results, skippedQueries, skippedDocuments, documentsScanned, elapsed, config);
    }

    private void scanBatch(ExecutorService executor, List<SequenceRecord> queries, List<QueryIndex> indexes,
            List<SequenceRecord> documents, PartialCounts totals) throws InterruptedException {
        List<Future<PartialCounts>> futures = new ArrayList<>();
        for (List<SequenceRecord> chunk : partition(documents, chunkSize(documents.size()))) {
            futures.add(executor.submit(() -> scanChunk(queries, indexes, chunk)));
        }

        for (Future<PartialCounts> future : futures) {
            try {
                totals.merge(future.get());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw ie;
            } catch (ExecutionException ee) {
                throw new IllegalStateException("Corpus scan failed: " + ee.getCause().getMessage(), ee.getCause());
            }
        }
    }

    private PartialCounts scanChunk(List<SequenceRecord> queries, List<QueryIndex> indexes,
            List<SequenceRecord> chunk) {
        PartialCounts partial = new PartialCounts(queries.size(), config.collectMatches());
        boolean countSpans = config.aggregation() == AggregationMode.SPANS;

        for (SequenceRecord document : chunk) {
            for (int q = 0; q < indexes.size(); q++) {
                QueryIndex index = indexes.get(q);
                MatchResult result = countSpans
                        ? matcher.countMatchingSpans(index, document.tokens())
                        : matcher.match(index, document.tokens());
                if (result.matched()) {
                    partial.counts[q] += countSpans ? result.matchingSpans() : 1;
                    partial.addMatch(q, document.id());
                }
                observer.onDocumentScanned(queries.get(q).id(), document.id(), result.matched());
            }
        }
        return partial;
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdownNow();
        try {
            executor.awaitTermination(1, TimeUnit.MINUTES);
        } catch (InterruptedException ie) {
            // keep whatever exception is already propagating
            Thread.currentThread().interrupt();
        }
    }

    private int chunkSize(int documents) {
        return Math.max(1, (documents + config.workers() * 2 - 1) / (config.workers() * 2));
    }

    private static <T> List<List<T>> partition(List<T> list, int batchSize) {
        List<List<T>> batches = new ArrayList<>();
        for (int i = 0; i < list.size(); i += batchSize) {
            batches.add(list.subList(i, Math.min(i + batchSize, list.size())));
        }
        return batches;
    }

    /**
     * Per-task counts, merged into the run totals on the calling thread.
     */
    private static final class PartialCounts {
        private final long[] counts;
        private final List<List<String>> matches;

        PartialCounts(int queries, boolean collectMatches) {
            this.counts = new long[queries];
            this.matches = collectMatches ? new ArrayList<>(queries) : null;
            if (collectMatches) {
                for (int q = 0; q < queries; q++) {
                    matches.add(new ArrayList<>());
                }
            }
        }

        void addMatch(int query, String documentId) {
            if (matches != null) {
                matches.get(query).add(documentId);
            }
        }

        void merge(PartialCounts other) {
            for (int q = 0; q < counts.length; q++) {
                counts[q] += other.counts[q];
                if (matches != null) {
                    matches.get(q).addAll(other.matches.get(q));
                }
            }
        }

        List<String> sortedMatches(int query) {
            if (matches == null) {
                return List.of();
            }
            List<String> sorted = new ArrayList<>(matches.get(query));
            Collections.sort(sorted);
            return sorted;
        }
    }
}
