package com.raditha.neardup.matcher;

import com.raditha.neardup.hash.DocumentNgrams;
import com.raditha.neardup.hash.NgramHasher;
import com.raditha.neardup.index.QueryIndex;
import com.raditha.neardup.model.TokenSequence;
import com.raditha.neardup.similarity.SimilarityVerifier;
import com.raditha.neardup.similarity.SpanWindow;

/**
 * Rabin-Karp style near-duplicate matcher.
 * <p>
 * Slides over the document and looks up each window hash in the query index. A hit at
 * position {@code i} makes every start {@code j} in {@code [max(i - |s| + n, 0), i)} a
 * candidate span {@code d[j, j + |s|)}, which is scored with weighted Jaccard.
 * The first span reaching the threshold ends the scan.
 * <p>
 * The candidate range is half-open and excludes {@code i} itself. Starts already scored
 * for an earlier hit are not scored again; candidate starts therefore only move right
 * and the span multiset is updated incrementally.
 */
public class MatchEngine extends AbstractSpanMatcher {

    public MatchEngine(NgramHasher hasher, SimilarityVerifier verifier) {
        super(hasher, verifier);
    }

    @Override
    public String name() {
        return "rabin-karp/" + hasher.family().toCliString();
    }

    @Override
    protected MatchResult scan(QueryIndex query, TokenSequence document, int spanLimit,
            boolean stopAtFirst) {
        int queryLength = query.queryLength();
        int n = hasher.n();

        DocumentNgrams ngrams = new DocumentNgrams(document, hasher);
        SpanWindow window = new SpanWindow(query, ngrams);

        MatchState state = MatchState.SCANNING;
        int hashHits = 0;
        int verifications = 0;
        int matchingSpans = 0;
        int firstMatch = -1;
        double bestScore = 0.0;
        int nextUnverified = 0;

        for (int i = 0; i < spanLimit && state != MatchState.MATCHED; i++) {
            if (!query.contains(ngrams.hashAt(i))) {
                continue;
            }
            hashHits++;
            state = MatchState.VERIFYING;

            int from = Math.max(Math.max(i - queryLength + n, 0), nextUnverified);
            for (int j = from; j < i; j++) {
                window.moveTo(j);
                double score = window.score();
                verifications++;
                bestScore = Math.max(bestScore, score);
                if (verifier.meetsThreshold(score)) {
                    matchingSpans++;
                    if (firstMatch < 0) {
                        firstMatch = j;
                    }
                    if (stopAtFirst) {
                        state = MatchState.MATCHED;
                        break;
                    }
                }
            }
            nextUnverified = Math.max(nextUnverified, i);
            if (state == MatchState.VERIFYING) {
                state = MatchState.SCANNING;
            }
        }

        MatchState terminal = matchingSpans > 0 ? MatchState.MATCHED : MatchState.EXHAUSTED;
        return new MatchResult(terminal, firstMatch, bestScore, hashHits, verifications, matchingSpans);
    }
}
