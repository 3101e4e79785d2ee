package com.raditha.neardup.bench;

import com.raditha.neardup.model.SequenceRecord;
import com.raditha.neardup.model.TokenSequence;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Seeded benchmark workload: random queries over a GPT-NeoX sized vocabulary, random
 * documents, and two planted queries taken from the first document, one verbatim and one
 * with a few tokens overwritten with 0.
 */
public final class SyntheticCorpus {

    public static final int VOCABULARY_SIZE = 50254;
    public static final int QUERY_LENGTH = 50;
    public static final int DOCUMENT_LENGTH = 2048;
    public static final int PLANT_OFFSET = 24;
    public static final int PERTURBED_TOKENS = 5;

    public static final String PLANTED_ID = "planted";
    public static final String PERTURBED_ID = "perturbed";

    private final List<SequenceRecord> queries;
    private final List<SequenceRecord> documents;

    private SyntheticCorpus(List<SequenceRecord> queries, List<SequenceRecord> documents) {
        this.queries = List.copyOf(queries);
        this.documents = List.copyOf(documents);
    }

    /**
     * Generate a workload.
     *
     * @param randomQueries Random queries before the two planted ones
     * @param documentCount Documents of {@link #DOCUMENT_LENGTH} tokens (at least 1)
     * @param seed          Random seed
     */
    public static SyntheticCorpus generate(int randomQueries, int documentCount, long seed) {
        if (randomQueries < 0 || documentCount < 1) {
            throw new IllegalArgumentException(
                    "need randomQueries >= 0 and documentCount >= 1, got " + randomQueries + ", " + documentCount);
        }
        Random random = new Random(seed);

        List<SequenceRecord> queries = new ArrayList<>(randomQueries + 2);
        for (int q = 0; q < randomQueries; q++) {
            queries.add(new SequenceRecord(String.format("random-%05d", q), randomTokens(random, QUERY_LENGTH)));
        }

        List<SequenceRecord> documents = new ArrayList<>(documentCount);
        for (int d = 0; d < documentCount; d++) {
            documents.add(new SequenceRecord(String.format("doc-%05d", d), randomTokens(random, DOCUMENT_LENGTH)));
        }

        TokenSequence planted = documents.get(0).tokens().slice(PLANT_OFFSET, PLANT_OFFSET + QUERY_LENGTH);
        queries.add(new SequenceRecord(PLANTED_ID, planted));

        int[] perturbed = planted.toArray();
        for (int k = 0; k < PERTURBED_TOKENS; k++) {
            perturbed[random.nextInt(QUERY_LENGTH)] = 0;
        }
        queries.add(new SequenceRecord(PERTURBED_ID, TokenSequence.of(perturbed)));

        return new SyntheticCorpus(queries, documents);
    }

    public List<SequenceRecord> queries() {
        return queries;
    }

    public List<SequenceRecord> documents() {
        return documents;
    }

    private static TokenSequence randomTokens(Random random, int length) {
        int[] tokens = new int[length];
        for (int i = 0; i < length; i++) {
            tokens[i] = random.nextInt(VOCABULARY_SIZE);
        }
        return TokenSequence.of(tokens);
    }
}
