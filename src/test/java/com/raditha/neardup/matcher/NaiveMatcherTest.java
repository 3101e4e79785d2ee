package com.raditha.neardup.matcher;

import com.raditha.neardup.hash.RollingHasher;
import com.raditha.neardup.index.QueryIndex;
import com.raditha.neardup.model.TokenSequence;
import com.raditha.neardup.similarity.SimilarityVerifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NaiveMatcherTest {

    private NaiveMatcher naive;
    private QueryIndex query;

    @BeforeEach
    void setUp() {
        naive = new NaiveMatcher(new RollingHasher(3), new SimilarityVerifier(0.6));
        query = QueryIndex.build(TokenSequence.of(1, 2, 3, 4, 5), naive.hasher());
    }

    @Test
    void testScoresEveryStartUntilMatch() {
        MatchResult result = naive.match(query, TokenSequence.of(9, 9, 1, 2, 3, 4, 5, 9, 9));

        assertTrue(result.matched());
        assertEquals(2, result.spanStart());
        assertEquals(3, result.verifications());
        assertEquals(0, result.hashHits());
    }

    @Test
    void testReachesStartBeforeLastCandidate() {
        // unlike the filtered engine, start |d| - |s| - 1 is always scored
        MatchResult result = naive.match(query, TokenSequence.of(9, 9, 1, 2, 3, 4, 5, 9));
        assertTrue(result.matched());
        assertEquals(2, result.spanStart());
    }

    @Test
    void testLastStartExcluded() {
        assertFalse(naive.match(query, TokenSequence.of(9, 9, 1, 2, 3, 4, 5)).matched());
    }

    @Test
    void testCountsAllStarts() {
        MatchResult result = naive.countMatchingSpans(query, TokenSequence.of(1, 2, 3, 4, 5, 1, 2, 3, 4, 5, 9, 9));
        assertEquals(2, result.matchingSpans());
        assertEquals(7, result.verifications());
    }

    @Test
    void testName() {
        assertEquals("naive", naive.name());
    }
}
