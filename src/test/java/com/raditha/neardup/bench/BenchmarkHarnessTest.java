package com.raditha.neardup.bench;

import com.raditha.neardup.model.SequenceRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BenchmarkHarnessTest {

    @Test
    void testSyntheticCorpusShape() {
        SyntheticCorpus corpus = SyntheticCorpus.generate(5, 2, 7L);

        assertEquals(7, corpus.queries().size());
        assertEquals(2, corpus.documents().size());
        SequenceRecord planted = corpus.queries().get(5);
        assertEquals(SyntheticCorpus.PLANTED_ID, planted.id());
        assertEquals(SyntheticCorpus.QUERY_LENGTH, planted.length());
        assertEquals(SyntheticCorpus.PLANT_OFFSET, corpus.documents().get(0).tokens().indexOf(planted.tokens()));
        assertEquals(SyntheticCorpus.PERTURBED_ID, corpus.queries().get(6).id());
        assertEquals(SyntheticCorpus.DOCUMENT_LENGTH, corpus.documents().get(1).length());
    }

    @Test
    void testSyntheticCorpusIsSeeded() {
        SyntheticCorpus a = SyntheticCorpus.generate(3, 1, 11L);
        SyntheticCorpus b = SyntheticCorpus.generate(3, 1, 11L);
        assertEquals(a.queries(), b.queries());
        assertEquals(a.documents(), b.documents());
    }

    @Test
    void testInvalidWorkload() {
        assertThrows(IllegalArgumentException.class, () -> SyntheticCorpus.generate(1, 0, 1L));
    }

    @Test
    void testAllStrategiesFindPlantedQuery() {
        SyntheticCorpus corpus = SyntheticCorpus.generate(0, 1, 3L);
        List<SequenceRecord> planted = List.of(corpus.queries().get(0));
        BenchmarkHarness harness = new BenchmarkHarness(0.8, 0, true);

        BenchmarkRun run = harness.run(10, planted, corpus.documents());

        assertEquals(3, run.results().size());
        assertTrue(run.agreed());
        for (BenchmarkResult result : run.results()) {
            assertEquals(1, result.matches(), result.strategy());
            assertTrue(result.docsPerSecond() > 0);
            assertEquals(10, result.ngramSize());
        }
        assertEquals("rabin-karp/content", run.results().get(0).strategy());
        assertEquals("rabin-karp/rolling", run.results().get(1).strategy());
        assertEquals("naive", run.results().get(2).strategy());
    }

    @Test
    void testSweep() {
        SyntheticCorpus corpus = SyntheticCorpus.generate(4, 1, 5L);
        BenchmarkHarness harness = new BenchmarkHarness(0.8, 1, false);

        List<BenchmarkRun> runs = harness.sweep(new int[] { 5, 13 }, corpus.queries(), corpus.documents());

        assertEquals(2, runs.size());
        assertEquals(5, runs.get(0).ngramSize());
        assertEquals(13, runs.get(1).ngramSize());
        for (BenchmarkRun run : runs) {
            assertEquals(2, run.results().size());
            assertTrue(run.agreed());
            assertTrue(run.results().get(0).matches() >= 1);
        }
    }

    @Test
    void testAgreementFlag() {
        BenchmarkRun disagreeing = new BenchmarkRun(5, List.of(
                new BenchmarkResult("a", 5, 1, 1, 10, 1.0, 1, 0),
                new BenchmarkResult("b", 5, 1, 1, 10, 1.0, 0, 0)));
        assertFalse(disagreeing.agreed());
    }

    @Test
    void testNaiveMayFindMoreThanEngines() {
        BenchmarkRun naiveAhead = new BenchmarkRun(5, List.of(
                new BenchmarkResult("rabin-karp/content", 5, 1, 1, 10, 1.0, 1, 0),
                new BenchmarkResult("rabin-karp/rolling", 5, 1, 1, 10, 1.0, 1, 0),
                new BenchmarkResult("naive", 5, 1, 1, 10, 1.0, 2, 0)));
        assertTrue(naiveAhead.agreed());

        BenchmarkRun naiveBehind = new BenchmarkRun(5, List.of(
                new BenchmarkResult("rabin-karp/content", 5, 1, 1, 10, 1.0, 2, 0),
                new BenchmarkResult("rabin-karp/rolling", 5, 1, 1, 10, 1.0, 2, 0),
                new BenchmarkResult("naive", 5, 1, 1, 10, 1.0, 1, 0)));
        assertFalse(naiveBehind.agreed());

        BenchmarkRun enginesSplit = new BenchmarkRun(5, List.of(
                new BenchmarkResult("rabin-karp/content", 5, 1, 1, 10, 1.0, 1, 0),
                new BenchmarkResult("rabin-karp/rolling", 5, 1, 1, 10, 1.0, 2, 0),
                new BenchmarkResult("naive", 5, 1, 1, 10, 1.0, 2, 0)));
        assertFalse(enginesSplit.agreed());
    }
}
