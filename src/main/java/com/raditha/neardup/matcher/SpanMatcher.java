package com.raditha.neardup.matcher;

import com.raditha.neardup.index.QueryIndex;
import com.raditha.neardup.model.TokenSequence;

/**
 * Decides whether a document contains a span near-duplicate to an indexed query.
 * Implementations keep per-call state on the stack and are safe to share across threads.
 */
public interface SpanMatcher {

    /**
     * Stop at the first span scoring at or above the threshold.
     */
    MatchResult match(QueryIndex query, TokenSequence document);

    /**
     * Scan the whole document and count distinct span starts at or above the threshold.
     */
    MatchResult countMatchingSpans(QueryIndex query, TokenSequence document);

    /**
     * Short name used in benchmark output.
     */
    String name();
}
