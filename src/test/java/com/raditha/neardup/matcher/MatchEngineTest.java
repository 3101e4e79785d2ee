package com.raditha.neardup.matcher;

import com.raditha.neardup.hash.ContentHasher;
import com.raditha.neardup.hash.HashStrategy;
import com.raditha.neardup.hash.NgramHasher;
import com.raditha.neardup.hash.RollingHasher;
import com.raditha.neardup.index.QueryIndex;
import com.raditha.neardup.model.TokenSequence;
import com.raditha.neardup.similarity.SimilarityVerifier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class MatchEngineTest {

    private static final TokenSequence QUERY = TokenSequence.of(1, 2, 3, 4, 5);

    private static MatchEngine engine(HashStrategy family, int n, double threshold) {
        return new MatchEngine(family.createHasher(n), new SimilarityVerifier(threshold));
    }

    private static MatchResult match(MatchEngine engine, TokenSequence query, TokenSequence doc) {
        return engine.match(QueryIndex.build(query, engine.hasher()), doc);
    }

    @ParameterizedTest
    @EnumSource(value = HashStrategy.class, names = { "CONTENT", "ROLLING" })
    void testExactSubstringWithContext(HashStrategy family) {
        MatchEngine engine = engine(family, 3, 0.6);
        MatchResult result = match(engine, QUERY, TokenSequence.of(9, 9, 1, 2, 3, 4, 5, 9, 9));

        assertTrue(result.matched());
        assertEquals(MatchState.MATCHED, result.state());
        assertEquals(2, result.spanStart());
        assertEquals(1.0, result.bestScore(), 1e-9);
        // hits at 2 and 3; starts 0, 1 (from the first hit) and 2 (from the second)
        assertEquals(2, result.hashHits());
        assertEquals(3, result.verifications());
    }

    @ParameterizedTest
    @EnumSource(value = HashStrategy.class, names = { "CONTENT", "ROLLING" })
    void testPartialOverlapBelowThreshold(HashStrategy family) {
        MatchEngine engine = engine(family, 3, 0.6);
        MatchResult result = match(engine, TokenSequence.of(1, 2, 9, 9, 9), TokenSequence.of(9, 9, 1, 2, 3, 4, 5, 9, 9));

        assertFalse(result.matched());
        assertEquals(MatchState.EXHAUSTED, result.state());
        assertEquals(-1, result.spanStart());
    }

    @Test
    void testDocumentShorterThanQuery() {
        MatchResult result = match(engine(HashStrategy.ROLLING, 3, 0.6), QUERY, TokenSequence.of(1, 2, 3, 4));
        assertFalse(result.matched());
        assertEquals(0, result.verifications());
    }

    @Test
    void testQueryShorterThanN() {
        MatchResult result = match(engine(HashStrategy.CONTENT, 4, 0.0), TokenSequence.of(1, 2, 3),
                TokenSequence.of(1, 2, 3, 1, 2, 3, 1, 2, 3));
        assertFalse(result.matched());
    }

    @Test
    void testDocumentEqualToQueryHasNoCandidateStart() {
        MatchResult result = match(engine(HashStrategy.ROLLING, 3, 0.6), QUERY, QUERY);
        assertFalse(result.matched());
    }

    @Test
    void testOccurrenceAtDocumentStart() {
        MatchResult result = match(engine(HashStrategy.ROLLING, 3, 0.6), QUERY, TokenSequence.of(1, 2, 3, 4, 5, 9, 9));
        assertTrue(result.matched());
        assertEquals(0, result.spanStart());
    }

    @Test
    void testOccurrenceWithOneTrailingTokenIsNotReached() {
        // The hit at i = 2 only proposes starts 0 and 1; start 2 would need a hit at i = 3 = |d| - |s|.
        MatchEngine engine = engine(HashStrategy.ROLLING, 3, 0.6);
        MatchResult result = match(engine, QUERY, TokenSequence.of(9, 9, 1, 2, 3, 4, 5, 9));

        assertFalse(result.matched());
        assertEquals(0.5, result.bestScore(), 1e-9);
    }

    @Test
    void testOccurrenceAtDocumentEndIsNotReached() {
        MatchResult result = match(engine(HashStrategy.CONTENT, 3, 0.6), QUERY, TokenSequence.of(9, 9, 1, 2, 3, 4, 5));
        assertFalse(result.matched());
    }

    @Test
    void testDisjointVocabularies() {
        MatchResult result = match(engine(HashStrategy.ROLLING, 2, 0.0), QUERY,
                TokenSequence.of(6, 7, 8, 9, 6, 7, 8, 9, 6, 7));
        assertFalse(result.matched());
        assertEquals(0, result.hashHits());
    }

    @Test
    void testIdempotent() {
        MatchEngine engine = engine(HashStrategy.CONTENT, 3, 0.6);
        QueryIndex index = QueryIndex.build(QUERY, engine.hasher());
        TokenSequence doc = TokenSequence.of(9, 9, 1, 2, 3, 4, 5, 9, 9);

        assertEquals(engine.match(index, doc), engine.match(index, doc));
    }

    @Test
    void testCountMatchingSpans() {
        MatchEngine engine = engine(HashStrategy.ROLLING, 3, 1.0);
        QueryIndex index = QueryIndex.build(QUERY, engine.hasher());
        TokenSequence doc = TokenSequence.of(1, 2, 3, 4, 5, 9, 1, 2, 3, 4, 5, 9, 9);

        MatchResult counted = engine.countMatchingSpans(index, doc);
        assertEquals(2, counted.matchingSpans());
        assertEquals(0, counted.spanStart());
        assertTrue(counted.matched());

        MatchResult first = engine.match(index, doc);
        assertEquals(1, first.matchingSpans());
        assertTrue(first.verifications() < counted.verifications());
    }

    @Test
    void testNoStartVerifiedTwice() {
        // every window is a hit; each start must still be scored only once
        MatchEngine engine = engine(HashStrategy.ROLLING, 1, 1.0);
        QueryIndex index = QueryIndex.build(TokenSequence.of(1, 1, 1), engine.hasher());
        TokenSequence doc = TokenSequence.of(1, 1, 2, 1, 1, 2, 1, 1, 2, 1);

        MatchResult result = engine.countMatchingSpans(index, doc);
        assertEquals(0, result.matchingSpans());
        assertTrue(result.verifications() <= doc.length() - 3);
    }

    @Test
    void testMismatchedFamilyRejected() {
        NgramHasher rolling = new RollingHasher(3);
        MatchEngine contentEngine = new MatchEngine(new ContentHasher(3), new SimilarityVerifier(0.6));
        QueryIndex index = QueryIndex.build(QUERY, rolling);

        assertThrows(IllegalArgumentException.class,
                () -> contentEngine.match(index, TokenSequence.of(9, 9, 1, 2, 3, 4, 5, 9, 9)));
    }

    @Test
    void testMismatchedNRejected() {
        MatchEngine engine = engine(HashStrategy.ROLLING, 3, 0.6);
        QueryIndex index = QueryIndex.build(QUERY, new RollingHasher(2));
        assertThrows(IllegalArgumentException.class, () -> engine.match(index, QUERY));
    }

    @Test
    void testName() {
        assertEquals("rabin-karp/rolling", engine(HashStrategy.ROLLING, 3, 0.6).name());
        assertEquals("rabin-karp/content", engine(HashStrategy.CONTENT, 3, 0.6).name());
    }
}
