package com.raditha.neardup.config;

import com.raditha.neardup.hash.HashStrategy;
import com.raditha.neardup.hash.NgramHasher;

import java.util.Locale;

/**
 * Configuration for near-duplicate matching.
 *
 * @param ngramSize        n of the n-grams used for hashing and similarity (>= 1)
 * @param threshold        Minimum weighted Jaccard score of a near-duplicate span (0.0-1.0)
 * @param hashStrategy     Fingerprint family, or AUTO to choose by n
 * @param rollingBreakEven Smallest n for which AUTO picks the rolling hash
 * @param workers          Worker threads used by the corpus scanner
 * @param aggregation      Count matching documents or matching spans
 * @param collectMatches   Keep the identifiers of matching documents in the report
 */
public record NearDupConfig(
        int ngramSize,
        double threshold,
        HashStrategy hashStrategy,
        int rollingBreakEven,
        int workers,
        AggregationMode aggregation,
        boolean collectMatches) {

    /**
     * Validate configuration.
     */
    public NearDupConfig {
        if (ngramSize < 1) {
            throw new ConfigurationException("ngramSize must be >= 1, got " + ngramSize);
        }
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new ConfigurationException("threshold must be between 0.0 and 1.0, got " + threshold);
        }
        if (hashStrategy == null) {
            throw new ConfigurationException("hashStrategy cannot be null");
        }
        if (rollingBreakEven < 1) {
            throw new ConfigurationException("rollingBreakEven must be >= 1");
        }
        if (workers < 1) {
            throw new ConfigurationException("workers must be >= 1, got " + workers);
        }
        if (aggregation == null) {
            aggregation = AggregationMode.DOCUMENTS;
        }
    }

    /**
     * Default preset: 10-grams, 60% threshold, hash chosen by n.
     */
    public static NearDupConfig defaults() {
        return new NearDupConfig(
                10, // ngramSize
                0.60, // threshold
                HashStrategy.AUTO,
                HashStrategy.DEFAULT_BREAK_EVEN,
                defaultWorkers(),
                AggregationMode.DOCUMENTS,
                false); // collectMatches
    }

    /**
     * Strict preset: only spans that are 80%+ similar.
     */
    public static NearDupConfig strict() {
        return defaults().withThreshold(0.80);
    }

    /**
     * Lenient preset: 50% threshold, catches looser paraphrase-level overlap.
     */
    public static NearDupConfig lenient() {
        return defaults().withThreshold(0.50);
    }

    public static NearDupConfig forPreset(String preset) {
        if (preset == null) {
            return defaults();
        }
        return switch (preset.toLowerCase(Locale.ROOT)) {
            case "strict" -> strict();
            case "lenient" -> lenient();
            default -> defaults();
        };
    }

    /**
     * Concrete hash family for the configured n.
     */
    public HashStrategy resolvedStrategy() {
        return hashStrategy.resolve(ngramSize, rollingBreakEven);
    }

    public NgramHasher createHasher() {
        return hashStrategy.createHasher(ngramSize, rollingBreakEven);
    }

    public NearDupConfig withNgramSize(int n) {
        return new NearDupConfig(n, threshold, hashStrategy, rollingBreakEven, workers, aggregation, collectMatches);
    }

    public NearDupConfig withThreshold(double delta) {
        return new NearDupConfig(ngramSize, delta, hashStrategy, rollingBreakEven, workers, aggregation, collectMatches);
    }

    public NearDupConfig withHashStrategy(HashStrategy strategy) {
        return new NearDupConfig(ngramSize, threshold, strategy, rollingBreakEven, workers, aggregation, collectMatches);
    }

    public NearDupConfig withWorkers(int count) {
        return new NearDupConfig(ngramSize, threshold, hashStrategy, rollingBreakEven, count, aggregation, collectMatches);
    }

    public NearDupConfig withAggregation(AggregationMode mode) {
        return new NearDupConfig(ngramSize, threshold, hashStrategy, rollingBreakEven, workers, mode, collectMatches);
    }

    public NearDupConfig withCollectMatches(boolean collect) {
        return new NearDupConfig(ngramSize, threshold, hashStrategy, rollingBreakEven, workers, aggregation, collect);
    }

    private static int defaultWorkers() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }
}
