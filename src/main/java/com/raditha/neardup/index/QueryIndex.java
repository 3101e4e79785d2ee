package com.raditha.neardup.index;

import com.raditha.neardup.hash.HashStrategy;
import com.raditha.neardup.hash.NgramHasher;
import com.raditha.neardup.model.TokenSequence;

/**
 * Multiset of a query's n-gram hashes with O(1) membership and multiplicity lookup.
 * <p>
 * Built once per query and never modified afterwards, so one instance is shared by
 * every document scan and every worker thread. Remembers the hash family and n it was
 * built with; scanning it with a different hasher is rejected by the matchers.
 */
public final class QueryIndex {

    private final NgramMultiset ngrams;
    private final HashStrategy family;
    private final int n;
    private final int queryLength;

    private QueryIndex(NgramMultiset ngrams, HashStrategy family, int n, int queryLength) {
        this.ngrams = ngrams;
        this.family = family;
        this.n = n;
        this.queryLength = queryLength;
    }

    /**
     * Index every n-gram of the query.
     * A query shorter than n yields an empty index that never matches anything.
     *
     * @param query  Query tokens
     * @param hasher Hasher whose family must also be used for scanning
     * @throws IndexInvariantException if the multiplicities do not add up to the window count
     */
    public static QueryIndex build(TokenSequence query, NgramHasher hasher) {
        int n = hasher.n();
        int windows = Math.max(query.length() - n + 1, 0);
        NgramMultiset ngrams = new NgramMultiset(windows);

        long hash = 0L;
        for (int i = 0; i < windows; i++) {
            hash = i == 0
                    ? query.firstWindowHash(hasher, 0)
                    : query.nextWindowHash(hasher, i, hash);
            ngrams.add(hash);
        }

        if (ngrams.total() != windows) {
            throw new IndexInvariantException(String.format(
                    "Query index holds %d n-grams, expected %d (|s|=%d, n=%d)",
                    ngrams.total(), windows, query.length(), n));
        }
        return new QueryIndex(ngrams, hasher.family(), n, query.length());
    }

    public boolean contains(long hash) {
        return ngrams.contains(hash);
    }

    /**
     * Occurrences of the hash in the query, 0 when absent.
     */
    public int multiplicity(long hash) {
        return ngrams.count(hash);
    }

    /**
     * Sum of multiplicities, always {@code max(|s| - n + 1, 0)}.
     */
    public long totalCount() {
        return ngrams.total();
    }

    public int distinctCount() {
        return ngrams.distinct();
    }

    public boolean isEmpty() {
        return ngrams.isEmpty();
    }

    public int queryLength() {
        return queryLength;
    }

    public int n() {
        return n;
    }

    public HashStrategy family() {
        return family;
    }

    /**
     * True if documents hashed by this hasher can be matched against this index.
     */
    public boolean isCompatibleWith(NgramHasher hasher) {
        return hasher.family() == family && hasher.n() == n;
    }

    @Override
    public String toString() {
        return String.format("QueryIndex{family=%s, n=%d, |s|=%d, distinct=%d}",
                family, n, queryLength, ngrams.distinct());
    }
}
