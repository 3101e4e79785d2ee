package com.raditha.neardup.matcher;

import com.raditha.neardup.hash.DocumentNgrams;
import com.raditha.neardup.hash.NgramHasher;
import com.raditha.neardup.index.NgramMultiset;
import com.raditha.neardup.index.QueryIndex;
import com.raditha.neardup.model.TokenSequence;
import com.raditha.neardup.similarity.SimilarityVerifier;

/**
 * Baseline without candidate filtering: every start in {@code [0, |d| - |s|)} is scored,
 * and each span multiset is built from scratch. O(|d| * |s|); used for benchmarking.
 */
public class NaiveMatcher extends AbstractSpanMatcher {

    public static final String NAME = "naive";

    public NaiveMatcher(NgramHasher hasher, SimilarityVerifier verifier) {
        super(hasher, verifier);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected MatchResult scan(QueryIndex query, TokenSequence document, int spanLimit,
            boolean stopAtFirst) {
        int windowsPerSpan = query.queryLength() - hasher.n() + 1;
        DocumentNgrams ngrams = new DocumentNgrams(document, hasher);

        int verifications = 0;
        int matchingSpans = 0;
        int firstMatch = -1;
        double bestScore = 0.0;

        for (int j = 0; j < spanLimit; j++) {
            NgramMultiset span = NgramMultiset.ofWindows(ngrams, j, windowsPerSpan);
            double score = verifier.score(query, span);
            verifications++;
            bestScore = Math.max(bestScore, score);
            if (verifier.meetsThreshold(score)) {
                matchingSpans++;
                if (firstMatch < 0) {
                    firstMatch = j;
                }
                if (stopAtFirst) {
                    break;
                }
            }
        }

        MatchState terminal = matchingSpans > 0 ? MatchState.MATCHED : MatchState.EXHAUSTED;
        return new MatchResult(terminal, firstMatch, bestScore, 0, verifications, matchingSpans);
    }
}
