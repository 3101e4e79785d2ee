package com.raditha.neardup.model;

/**
 * A query or document together with the stable identifier assigned by its loader.
 *
 * @param id     Identifier used in reports and observer callbacks
 * @param tokens Token content
 */
public record SequenceRecord(String id, TokenSequence tokens) {

    public SequenceRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be blank");
        }
        if (tokens == null) {
            throw new IllegalArgumentException("tokens cannot be null");
        }
    }

    public static SequenceRecord of(String id, int... tokens) {
        return new SequenceRecord(id, TokenSequence.of(tokens));
    }

    public int length() {
        return tokens.length();
    }
}
