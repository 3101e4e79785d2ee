package com.raditha.neardup.bench;

import com.raditha.neardup.matcher.NaiveMatcher;

import java.util.List;

/**
 * All strategies measured at one n on the same workload.
 */
public record BenchmarkRun(int ngramSize, List<BenchmarkResult> results) {

    public BenchmarkRun {
        results = List.copyOf(results);
    }

    /**
     * True when the hash engines report the same number of matches and the naive
     * matcher finds at least as many.
     * <p>
     * The engines only verify starts that end before a hash hit, so the naive matcher may
     * legitimately find more.
     */
    public boolean agreed() {
        long[] engineMatches = results.stream()
                .filter(r -> !isNaive(r))
                .mapToLong(BenchmarkResult::matches)
                .distinct()
                .toArray();
        if (engineMatches.length > 1) {
            return false;
        }
        long engine = engineMatches.length == 0 ? 0L : engineMatches[0];
        return results.stream()
                .filter(BenchmarkRun::isNaive)
                .allMatch(r -> r.matches() >= engine);
    }

    private static boolean isNaive(BenchmarkResult result) {
        return NaiveMatcher.NAME.equals(result.strategy());
    }
}
