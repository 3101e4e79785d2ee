package com.raditha.neardup.hash;

import com.raditha.neardup.model.TokenSequence;

/**
 * Window hashes of one document, computed lazily and strictly left to right.
 * <p>
 * A scan that stops early never pays for windows it did not reach. Not thread-safe:
 * each worker creates its own instance per document.
 */
public class DocumentNgrams {

    private final NgramHasher hasher;
    private final TokenSequence document;
    private final long[] hashes;
    private int computed;

    public DocumentNgrams(TokenSequence document, NgramHasher hasher) {
        this.hasher = hasher;
        this.document = document;
        this.hashes = new long[Math.max(document.length() - hasher.n() + 1, 0)];
        this.computed = 0;
    }

    /**
     * Number of complete windows in the document.
     */
    public int windowCount() {
        return hashes.length;
    }

    /**
     * Hash of the window starting at {@code position}.
     */
    public long hashAt(int position) {
        if (position < 0 || position >= hashes.length) {
            throw new IndexOutOfBoundsException(
                    "Window " + position + " outside [0, " + hashes.length + ")");
        }
        while (computed <= position) {
            hashes[computed] = computed == 0
                    ? document.firstWindowHash(hasher, 0)
                    : document.nextWindowHash(hasher, computed, hashes[computed - 1]);
            computed++;
        }
        return hashes[position];
    }

    /**
     * Windows hashed so far.
     */
    public int computedCount() {
        return computed;
    }

    public NgramHasher hasher() {
        return hasher;
    }
}
