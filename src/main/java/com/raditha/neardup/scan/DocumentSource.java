package com.raditha.neardup.scan;

import com.raditha.neardup.io.LoadedSequences;
import com.raditha.neardup.model.SequenceRecord;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Supplies corpus documents to the scanner one batch at a time, typically one batch per
 * corpus file. Only the current batch needs to be held in memory.
 */
public interface DocumentSource {

    /**
     * Next batch of documents.
     *
     * @return the batch, or null once the corpus is exhausted
     */
    @Nullable
    LoadedSequences nextBatch();

    /**
     * A source that yields the given documents as a single in-memory batch.
     */
    static DocumentSource of(List<SequenceRecord> documents) {
        return new DocumentSource() {
            private boolean consumed;

            @Override
            public @Nullable LoadedSequences nextBatch() {
                if (consumed) {
                    return null;
                }
                consumed = true;
                return LoadedSequences.of("memory", documents);
            }
        };
    }
}
