package com.raditha.neardup.matcher;

/**
 * Outcome of matching one query against one document.
 *
 * @param state         Terminal state, MATCHED or EXHAUSTED
 * @param spanStart     Start of the first confirmed span, -1 if none
 * @param bestScore     Highest similarity among verified spans
 * @param hashHits      Windows whose hash was found in the query index
 * @param verifications Candidate spans scored
 * @param matchingSpans Spans at or above the threshold (counting mode scans the whole document)
 */
public record MatchResult(
        MatchState state,
        int spanStart,
        double bestScore,
        int hashHits,
        int verifications,
        int matchingSpans) {

    public MatchResult {
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("MatchResult requires a terminal state, got " + state);
        }
    }

    /**
     * Result for a document that could not contain a span at all.
     */
    public static MatchResult exhausted() {
        return new MatchResult(MatchState.EXHAUSTED, -1, 0.0, 0, 0, 0);
    }

    public boolean matched() {
        return state == MatchState.MATCHED;
    }
}
