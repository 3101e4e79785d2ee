package com.raditha.neardup.matcher;

import com.raditha.neardup.hash.ContentHasher;
import com.raditha.neardup.hash.RollingHasher;
import com.raditha.neardup.index.QueryIndex;
import com.raditha.neardup.model.TokenSequence;
import com.raditha.neardup.similarity.SimilarityVerifier;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Randomized checks over small alphabets. With tokens below 31 and n <= 5 the rolling
 * hash is injective, so both hash families see the same n-gram structure.
 */
class MatchEnginePropertiesTest {

    @Property(tries = 300)
    void contentAndRollingAgree(
            @ForAll @Size(min = 1, max = 10) List<@IntRange(min = 0, max = 5) Integer> query,
            @ForAll @Size(max = 60) List<@IntRange(min = 0, max = 5) Integer> doc,
            @ForAll @IntRange(min = 1, max = 5) int n,
            @ForAll @DoubleRange(min = 0.0, max = 1.0) double threshold) {
        SimilarityVerifier verifier = new SimilarityVerifier(threshold);
        MatchEngine content = new MatchEngine(new ContentHasher(n), verifier);
        MatchEngine rolling = new MatchEngine(new RollingHasher(n), verifier);
        TokenSequence s = TokenSequence.of(query);
        TokenSequence d = TokenSequence.of(doc);

        MatchResult a = content.match(QueryIndex.build(s, content.hasher()), d);
        MatchResult b = rolling.match(QueryIndex.build(s, rolling.hasher()), d);
        assertEquals(a.matched(), b.matched());
        assertEquals(a.spanStart(), b.spanStart());

        assertEquals(content.countMatchingSpans(QueryIndex.build(s, content.hasher()), d).matchingSpans(),
                rolling.countMatchingSpans(QueryIndex.build(s, rolling.hasher()), d).matchingSpans());
    }

    @Property(tries = 300)
    void exactOccurrenceWithTwoTrailingTokensIsFound(
            @ForAll @Size(min = 2, max = 10) List<@IntRange(min = 0, max = 5) Integer> query,
            @ForAll @Size(max = 20) List<@IntRange(min = 0, max = 5) Integer> prefix,
            @ForAll @Size(min = 2, max = 20) List<@IntRange(min = 0, max = 5) Integer> suffix,
            @ForAll @IntRange(min = 1, max = 5) int n,
            @ForAll @DoubleRange(min = 0.0, max = 1.0) double threshold) {
        if (query.size() <= n) {
            return;
        }
        List<Integer> doc = new ArrayList<>(prefix);
        doc.addAll(query);
        doc.addAll(suffix);

        MatchEngine engine = new MatchEngine(new RollingHasher(n), new SimilarityVerifier(threshold));
        MatchResult result = engine.match(QueryIndex.build(TokenSequence.of(query), engine.hasher()),
                TokenSequence.of(doc));

        assertTrue(result.matched());
    }

    @Property(tries = 300)
    void disjointVocabulariesNeverMatch(
            @ForAll @Size(min = 1, max = 10) List<@IntRange(min = 0, max = 4) Integer> query,
            @ForAll @Size(max = 60) List<@IntRange(min = 5, max = 9) Integer> doc,
            @ForAll @IntRange(min = 1, max = 5) int n,
            @ForAll @DoubleRange(min = 0.0, max = 1.0) double threshold) {
        MatchEngine engine = new MatchEngine(new ContentHasher(n), new SimilarityVerifier(threshold));
        MatchResult result = engine.match(QueryIndex.build(TokenSequence.of(query), engine.hasher()),
                TokenSequence.of(doc));

        assertFalse(result.matched());
        assertEquals(0, result.hashHits());
    }

    @Property(tries = 300)
    void engineFindingsAreSubsetOfNaive(
            @ForAll @Size(min = 1, max = 8) List<@IntRange(min = 0, max = 3) Integer> query,
            @ForAll @Size(max = 40) List<@IntRange(min = 0, max = 3) Integer> doc,
            @ForAll @IntRange(min = 1, max = 4) int n,
            @ForAll @DoubleRange(min = 0.0, max = 1.0) double threshold) {
        SimilarityVerifier verifier = new SimilarityVerifier(threshold);
        MatchEngine engine = new MatchEngine(new RollingHasher(n), verifier);
        NaiveMatcher naive = new NaiveMatcher(new RollingHasher(n), verifier);
        QueryIndex index = QueryIndex.build(TokenSequence.of(query), engine.hasher());
        TokenSequence d = TokenSequence.of(doc);

        MatchResult fast = engine.countMatchingSpans(index, d);
        MatchResult slow = naive.countMatchingSpans(index, d);

        assertTrue(fast.matchingSpans() <= slow.matchingSpans());
        if (fast.matched()) {
            assertTrue(slow.matched());
        }
        assertTrue(fast.bestScore() >= 0.0 && fast.bestScore() <= 1.0);
        assertTrue(slow.bestScore() <= 1.0);
    }
}
