package com.raditha.neardup.bench;

import java.util.Locale;

/**
 * Timing of one candidate generator at one n.
 *
 * @param strategy      Matcher name, e.g. {@code rabin-karp/rolling} or {@code naive}
 * @param ngramSize     n
 * @param queries       Queries run
 * @param documents     Documents each query was run against
 * @param elapsedNanos  Wall time of the measured round
 * @param docsPerSecond (query, document) pairs decided per second
 * @param matches       Pairs found to contain a near-duplicate span
 * @param verifications Candidate spans scored
 */
public record BenchmarkResult(
        String strategy,
        int ngramSize,
        int queries,
        int documents,
        long elapsedNanos,
        double docsPerSecond,
        long matches,
        long verifications) {

    public double elapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }

    public String toLine() {
        return String.format(Locale.ROOT,
                "n=%-3d %-22s %10.2f ms %14.1f docs/s  matches=%d  verifications=%d",
                ngramSize, strategy, elapsedMillis(), docsPerSecond, matches, verifications);
    }
}
