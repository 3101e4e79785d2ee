package com.raditha.neardup.bench;

import com.raditha.neardup.hash.HashStrategy;
import com.raditha.neardup.index.QueryIndex;
import com.raditha.neardup.matcher.AbstractSpanMatcher;
import com.raditha.neardup.matcher.MatchEngine;
import com.raditha.neardup.matcher.MatchResult;
import com.raditha.neardup.matcher.NaiveMatcher;
import com.raditha.neardup.model.SequenceRecord;
import com.raditha.neardup.similarity.SimilarityVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Compares candidate generators on identical inputs: the content-hash engine, the
 * rolling-hash engine and the unfiltered naive matcher. All three share one verifier,
 * threshold and n, so any difference in speed comes from candidate generation and
 * n-gram hashing.
 * <p>
 * Query indexing is part of the measured time.
 */
public class BenchmarkHarness {

    private static final Logger logger = LoggerFactory.getLogger(BenchmarkHarness.class);

    private final SimilarityVerifier verifier;
    private final int warmupRounds;
    private final boolean includeNaive;

    public BenchmarkHarness(double threshold, int warmupRounds, boolean includeNaive) {
        if (warmupRounds < 0) {
            throw new IllegalArgumentException("warmupRounds must be >= 0, got " + warmupRounds);
        }
        this.verifier = new SimilarityVerifier(threshold);
        this.warmupRounds = warmupRounds;
        this.includeNaive = includeNaive;
    }

    public BenchmarkHarness(double threshold) {
        this(threshold, 1, true);
    }

    /**
     * Matchers compared at a given n, in reporting order.
     */
    public List<AbstractSpanMatcher> matchersFor(int n) {
        List<AbstractSpanMatcher> matchers = new ArrayList<>();
        matchers.add(new MatchEngine(HashStrategy.CONTENT.createHasher(n), verifier));
        matchers.add(new MatchEngine(HashStrategy.ROLLING.createHasher(n), verifier));
        if (includeNaive) {
            // Naive scores every start; the hash family only shapes the multisets.
            matchers.add(new NaiveMatcher(HashStrategy.CONTENT.createHasher(n), verifier));
        }
        return matchers;
    }

    /**
     * Measure every strategy at one n.
     */
    public BenchmarkRun run(int n, List<SequenceRecord> queries, List<SequenceRecord> documents) {
        List<BenchmarkResult> results = new ArrayList<>();
        for (AbstractSpanMatcher matcher : matchersFor(n)) {
            for (int round = 0; round < warmupRounds; round++) {
                measure(matcher, n, queries, documents);
            }
            BenchmarkResult result = measure(matcher, n, queries, documents);
            logger.debug("{}", result.toLine());
            results.add(result);
        }

        BenchmarkRun run = new BenchmarkRun(n, results);
        if (!run.agreed()) {
            logger.warn("Strategies disagree on match count at n={}", n);
        }
        return run;
    }

    /**
     * Repeat {@link #run} for several n.
     */
    public List<BenchmarkRun> sweep(int[] ngramSizes, List<SequenceRecord> queries, List<SequenceRecord> documents) {
        List<BenchmarkRun> runs = new ArrayList<>(ngramSizes.length);
        for (int n : ngramSizes) {
            runs.add(run(n, queries, documents));
        }
        return runs;
    }

    private BenchmarkResult measure(AbstractSpanMatcher matcher, int n, List<SequenceRecord> queries,
            List<SequenceRecord> documents) {
        long matches = 0;
        long verifications = 0;

        long started = System.nanoTime();
        for (SequenceRecord query : queries) {
            QueryIndex index = QueryIndex.build(query.tokens(), matcher.hasher());
            for (SequenceRecord document : documents) {
                MatchResult result = matcher.match(index, document.tokens());
                verifications += result.verifications();
                if (result.matched()) {
                    matches++;
                }
            }
        }
        long elapsed = Math.max(System.nanoTime() - started, 1L);

        long pairs = (long) queries.size() * documents.size();
        double perSecond = pairs / (elapsed / 1_000_000_000.0);
        return new BenchmarkResult(matcher.name(), n, queries.size(), documents.size(),
                elapsed, perSecond, matches, verifications);
    }
}
