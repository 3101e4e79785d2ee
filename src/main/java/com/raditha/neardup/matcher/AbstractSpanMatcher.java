package com.raditha.neardup.matcher;

import com.raditha.neardup.hash.NgramHasher;
import com.raditha.neardup.index.QueryIndex;
import com.raditha.neardup.model.TokenSequence;
import com.raditha.neardup.similarity.SimilarityVerifier;

/**
 * Base class for span matchers. Handles the hasher/index pairing check and the
 * cases where no full-length span exists, so subclasses only generate and verify
 * candidates.
 */
public abstract class AbstractSpanMatcher implements SpanMatcher {

    protected final NgramHasher hasher;
    protected final SimilarityVerifier verifier;

    protected AbstractSpanMatcher(NgramHasher hasher, SimilarityVerifier verifier) {
        if (hasher == null || verifier == null) {
            throw new IllegalArgumentException("hasher and verifier are required");
        }
        this.hasher = hasher;
        this.verifier = verifier;
    }

    @Override
    public MatchResult match(QueryIndex query, TokenSequence document) {
        return run(query, document, true);
    }

    @Override
    public MatchResult countMatchingSpans(QueryIndex query, TokenSequence document) {
        return run(query, document, false);
    }

    public NgramHasher hasher() {
        return hasher;
    }

    public SimilarityVerifier verifier() {
        return verifier;
    }

    /**
     * Scan candidate starts {@code [0, spanLimit)}; called only when at least one exists
     * and the query has n-grams.
     *
     * @param spanLimit   {@code |d| - |s|}, exclusive upper bound for the outer sweep
     * @param stopAtFirst Stop at the first confirmed span
     */
    protected abstract MatchResult scan(QueryIndex query, TokenSequence document, int spanLimit,
            boolean stopAtFirst);

    private MatchResult run(QueryIndex query, TokenSequence document, boolean stopAtFirst) {
        if (!query.isCompatibleWith(hasher)) {
            throw new IllegalArgumentException(String.format(
                    "Query index built with %s/n=%d cannot be scanned with %s/n=%d",
                    query.family(), query.n(), hasher.family(), hasher.n()));
        }

        // A query shorter than n has no n-grams; a document shorter than the query has no span.
        int spanLimit = Math.max(document.length() - query.queryLength(), 0);
        if (query.isEmpty() || spanLimit == 0) {
            return MatchResult.exhausted();
        }
        return scan(query, document, spanLimit, stopAtFirst);
    }
}
