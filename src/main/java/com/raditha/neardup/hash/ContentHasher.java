package com.raditha.neardup.hash;

/**
 * FxHash-style content hash. Each window is mixed token by token, so moving to the
 * next window costs O(n).
 */
public class ContentHasher implements NgramHasher {

    private static final long SEED = 0x517cc1b727220a95L;

    private final int n;

    /**
     * @param n Window length (n-gram size)
     */
    public ContentHasher(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("n must be >= 1");
        }
        this.n = n;
    }

    @Override
    public int n() {
        return n;
    }

    @Override
    public HashStrategy family() {
        return HashStrategy.CONTENT;
    }

    @Override
    public long computeFirstWindow(int[] tokens, int offset) {
        // length first, like hashing a slice
        long hash = mix(0L, n);
        for (int k = offset; k < offset + n; k++) {
            hash = mix(hash, tokens[k]);
        }
        return hash;
    }

    @Override
    public long advanceToNext(int[] tokens, int offset, long previousHash) {
        return computeFirstWindow(tokens, offset);
    }

    private static long mix(long hash, long value) {
        return (Long.rotateLeft(hash, 5) ^ value) * SEED;
    }
}
