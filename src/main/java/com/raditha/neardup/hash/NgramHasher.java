package com.raditha.neardup.hash;

/**
 * Computes a 64-bit fingerprint for every window of {@link #n()} consecutive tokens.
 * <p>
 * Windows are visited left to right: the first with {@link #computeFirstWindow},
 * every following one with {@link #advanceToNext}. Implementations hold no mutable
 * state and can be shared between threads.
 * <p>
 * Identical windows always hash identically within one family. Different windows may
 * collide; a hash hit is only ever a candidate and is re-verified by the caller.
 */
public interface NgramHasher {

    /**
     * Window length.
     */
    int n();

    /**
     * The concrete family (never {@link HashStrategy#AUTO}).
     * A query index must be scanned with a hasher of the same family and n.
     */
    HashStrategy family();

    /**
     * Hash of {@code tokens[offset, offset + n)} computed from scratch.
     */
    long computeFirstWindow(int[] tokens, int offset);

    /**
     * Hash of {@code tokens[offset, offset + n)} given the hash of the window starting at
     * {@code offset - 1}.
     */
    long advanceToNext(int[] tokens, int offset, long previousHash);
}
