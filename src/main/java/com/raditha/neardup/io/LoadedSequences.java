package com.raditha.neardup.io;

import com.raditha.neardup.model.SequenceRecord;

import java.util.List;

/**
 * Sequences read from one source together with the records that had to be skipped.
 *
 * @param source  Name of the source, usually a file path
 * @param records Usable sequences in input order
 * @param skipped Records dropped as malformed
 */
public record LoadedSequences(String source, List<SequenceRecord> records, List<SkippedInput> skipped) {

    public LoadedSequences {
        records = List.copyOf(records);
        skipped = List.copyOf(skipped);
    }

    public static LoadedSequences of(String source, List<SequenceRecord> records) {
        return new LoadedSequences(source, records, List.of());
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
