package com.raditha.neardup.similarity;

import com.raditha.neardup.hash.DocumentNgrams;
import com.raditha.neardup.index.NgramMultiset;
import com.raditha.neardup.index.QueryIndex;

/**
 * N-gram multiset of the candidate span {@code d[start, start + |s|)} together with its
 * running intersection mass against the query.
 * <p>
 * Moving the span one token to the right drops the first window hash and adds the one
 * after the last, so consecutive candidates cost O(1) each instead of O(|s|).
 * Larger jumps rebuild the multiset. One instance per (query, document) scan.
 */
public class SpanWindow {

    private final QueryIndex query;
    private final DocumentNgrams ngrams;
    private final int windowsPerSpan;
    private final NgramMultiset span;

    private int start = -1;
    private long intersection;

    public SpanWindow(QueryIndex query, DocumentNgrams ngrams) {
        this.query = query;
        this.ngrams = ngrams;
        this.windowsPerSpan = Math.max(query.queryLength() - query.n() + 1, 0);
        this.span = new NgramMultiset(windowsPerSpan);
    }

    /**
     * Position the window at {@code newStart}, sliding when that is cheaper than rebuilding.
     */
    public void moveTo(int newStart) {
        if (start >= 0 && newStart > start && newStart - start < windowsPerSpan) {
            while (start < newStart) {
                slide();
            }
        } else if (newStart != start) {
            rebuild(newStart);
        }
    }

    /**
     * Weighted Jaccard of the current span against the query.
     */
    public double score() {
        return SimilarityVerifier.ratio(intersection, query.totalCount(), span.total());
    }

    public int start() {
        return start;
    }

    /**
     * Current span multiset. Read-only for callers.
     */
    public NgramMultiset multiset() {
        return span;
    }

    private void rebuild(int newStart) {
        span.clear();
        intersection = 0;
        start = newStart;
        for (int k = newStart; k < newStart + windowsPerSpan; k++) {
            addWindow(ngrams.hashAt(k));
        }
    }

    private void slide() {
        removeWindow(ngrams.hashAt(start));
        addWindow(ngrams.hashAt(start + windowsPerSpan));
        start++;
    }

    private void addWindow(long hash) {
        int after = span.add(hash);
        if (after <= query.multiplicity(hash)) {
            intersection++;
        }
    }

    private void removeWindow(long hash) {
        int after = span.remove(hash);
        if (after < query.multiplicity(hash)) {
            intersection--;
        }
    }
}
