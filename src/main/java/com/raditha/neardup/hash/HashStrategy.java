package com.raditha.neardup.hash;

import java.util.Locale;

/**
 * N-gram fingerprint family used to build query indexes and scan documents.
 */
public enum HashStrategy {
    /**
     * Content hash - every window is hashed from scratch, O(n) per window.
     * Fastest for small n.
     */
    CONTENT,

    /**
     * Rolling hash - the next window is derived from the previous one in O(1).
     * Pays off once n is large.
     */
    ROLLING,

    /**
     * Pick CONTENT or ROLLING from the configured n and the break-even point.
     */
    AUTO;

    /**
     * Break-even n measured with the bench command: from here on rolling is faster.
     */
    public static final int DEFAULT_BREAK_EVEN = 8;

    /**
     * Convert a string value to HashStrategy.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding strategy
     * @throws IllegalArgumentException if the value is not a valid strategy
     */
    public static HashStrategy fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("HashStrategy value cannot be null");
        }

        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "content", "fx", "fxhash" -> CONTENT;
            case "rolling" -> ROLLING;
            case "auto" -> AUTO;
            default -> throw new IllegalArgumentException(
                    "Invalid hash strategy: " + value + ". Must be: content, rolling, or auto");
        };
    }

    public String toCliString() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve AUTO to a concrete family for the given n.
     */
    public HashStrategy resolve(int n, int breakEven) {
        if (this != AUTO) {
            return this;
        }
        return n >= breakEven ? ROLLING : CONTENT;
    }

    /**
     * Create the hasher for windows of length n.
     */
    public NgramHasher createHasher(int n, int breakEven) {
        return switch (resolve(n, breakEven)) {
            case ROLLING -> new RollingHasher(n);
            default -> new ContentHasher(n);
        };
    }

    public NgramHasher createHasher(int n) {
        return createHasher(n, DEFAULT_BREAK_EVEN);
    }
}
