package com.raditha.neardup.hash;

/**
 * Polynomial rolling hash {@code h = sum(t[k] * BASE^(n-1-k)) mod MODULUS}.
 * <p>
 * Sliding the window by one token subtracts the leaving token's term and appends the
 * entering token, so the cost per window is O(1) regardless of n. All intermediate
 * values stay below {@code MODULUS^2 < 2^63}.
 */
public class RollingHasher implements NgramHasher {

    public static final long BASE = 31L;
    public static final long MODULUS = 1_000_000_007L;

    private final int n;
    // BASE^(n-1) mod MODULUS, the weight of the leaving token
    private final long leadingPower;

    /**
     * @param n Window length (n-gram size)
     */
    public RollingHasher(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("n must be >= 1");
        }
        this.n = n;
        long power = 1L;
        for (int k = 1; k < n; k++) {
            power = (power * BASE) % MODULUS;
        }
        this.leadingPower = power;
    }

    @Override
    public int n() {
        return n;
    }

    @Override
    public HashStrategy family() {
        return HashStrategy.ROLLING;
    }

    @Override
    public long computeFirstWindow(int[] tokens, int offset) {
        long hash = 0L;
        for (int k = offset; k < offset + n; k++) {
            hash = append(hash, tokens[k]);
        }
        return hash;
    }

    @Override
    public long advanceToNext(int[] tokens, int offset, long previousHash) {
        long leaving = reduce(tokens[offset - 1]);
        long hash = (previousHash + MODULUS - (leaving * leadingPower) % MODULUS) % MODULUS;
        return append(hash, tokens[offset + n - 1]);
    }

    /**
     * Extend a window hash by one token on the right.
     */
    public static long append(long hash, int token) {
        return (hash * BASE + reduce(token)) % MODULUS;
    }

    private static long reduce(int token) {
        return token % MODULUS;
    }
}
