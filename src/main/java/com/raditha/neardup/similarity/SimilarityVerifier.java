package com.raditha.neardup.similarity;

import com.raditha.neardup.hash.DocumentNgrams;
import com.raditha.neardup.hash.NgramHasher;
import com.raditha.neardup.index.NgramMultiset;
import com.raditha.neardup.index.QueryIndex;
import com.raditha.neardup.model.TokenSequence;
import it.unimi.dsi.fastutil.longs.Long2IntMap;

/**
 * Weighted Jaccard similarity between n-gram multisets.
 * <p>
 * {@code score(A, B) = sum(min(a_h, b_h)) / sum(max(a_h, b_h))} over the union of hashes.
 * Since {@code min + max = a_h + b_h}, the denominator is {@code |A| + |B| - intersection},
 * so only the smaller side needs to be walked.
 * Two empty multisets score 0.
 */
public class SimilarityVerifier {

    private final double threshold;

    /**
     * @param threshold Minimum score for a confirmed near-duplicate (0.0-1.0)
     */
    public SimilarityVerifier(double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
        }
        this.threshold = threshold;
    }

    public double threshold() {
        return threshold;
    }

    /**
     * Check if a score confirms a near-duplicate.
     */
    public boolean meetsThreshold(double score) {
        return score >= threshold;
    }

    /**
     * Score a candidate span against the query.
     */
    public double score(QueryIndex query, NgramMultiset span) {
        long intersection = 0;
        for (Long2IntMap.Entry entry : span.entries()) {
            intersection += Math.min(query.multiplicity(entry.getLongKey()), entry.getIntValue());
        }
        return ratio(intersection, query.totalCount(), span.total());
    }

    /**
     * Score two arbitrary multisets.
     */
    public double score(NgramMultiset a, NgramMultiset b) {
        NgramMultiset smaller = a.distinct() <= b.distinct() ? a : b;
        NgramMultiset other = smaller == a ? b : a;

        long intersection = 0;
        for (Long2IntMap.Entry entry : smaller.entries()) {
            intersection += Math.min(other.count(entry.getLongKey()), entry.getIntValue());
        }
        return ratio(intersection, a.total(), b.total());
    }

    /**
     * Score two token sequences by their n-grams under the given hasher.
     */
    public double score(TokenSequence a, TokenSequence b, NgramHasher hasher) {
        return score(multisetOf(a, hasher), multisetOf(b, hasher));
    }

    /**
     * Weighted Jaccard from the intersection mass and the two totals.
     */
    public static double ratio(long intersection, long totalA, long totalB) {
        long union = totalA + totalB - intersection;
        if (union <= 0) {
            return 0.0;
        }
        return (double) intersection / union;
    }

    private static NgramMultiset multisetOf(TokenSequence sequence, NgramHasher hasher) {
        DocumentNgrams ngrams = new DocumentNgrams(sequence, hasher);
        return NgramMultiset.ofWindows(ngrams, 0, ngrams.windowCount());
    }
}
