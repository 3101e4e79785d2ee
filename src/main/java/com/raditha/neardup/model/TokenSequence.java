package com.raditha.neardup.model;

import com.raditha.neardup.hash.NgramHasher;

import java.util.Arrays;
import java.util.List;

/**
 * Immutable ordered sequence of non-negative token ids.
 * Used for both queries and corpus documents.
 */
public final class TokenSequence {

    private static final TokenSequence EMPTY = new TokenSequence(new int[0]);

    private final int[] tokens;

    private TokenSequence(int[] tokens) {
        this.tokens = tokens;
    }

    /**
     * Create a sequence from token ids. The array is copied.
     *
     * @throws MalformedInputException if any token id is negative
     */
    public static TokenSequence of(int... tokens) {
        if (tokens == null) {
            throw new MalformedInputException("Token array cannot be null");
        }
        for (int i = 0; i < tokens.length; i++) {
            if (tokens[i] < 0) {
                throw new MalformedInputException(
                        String.format("Invalid token id %d at position %d", tokens[i], i));
            }
        }
        return tokens.length == 0 ? EMPTY : new TokenSequence(tokens.clone());
    }

    /**
     * Create a sequence from a list of token ids.
     */
    public static TokenSequence of(List<Integer> tokens) {
        if (tokens == null) {
            throw new MalformedInputException("Token list cannot be null");
        }
        int[] array = new int[tokens.size()];
        for (int i = 0; i < array.length; i++) {
            Integer token = tokens.get(i);
            if (token == null) {
                throw new MalformedInputException("Null token id at position " + i);
            }
            array[i] = token;
        }
        return of(array);
    }

    public static TokenSequence empty() {
        return EMPTY;
    }

    public int length() {
        return tokens.length;
    }

    public boolean isEmpty() {
        return tokens.length == 0;
    }

    public int tokenAt(int index) {
        return tokens[index];
    }

    /**
     * Sub-sequence {@code [from, to)}.
     */
    public TokenSequence slice(int from, int to) {
        return new TokenSequence(Arrays.copyOfRange(tokens, from, to));
    }

    /**
     * Offset of the first verbatim occurrence of {@code other}, or -1.
     */
    public int indexOf(TokenSequence other) {
        int m = other.tokens.length;
        for (int i = 0; i + m <= tokens.length; i++) {
            if (Arrays.equals(tokens, i, i + m, other.tokens, 0, m)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Hash of the window starting at {@code offset}, computed from scratch.
     */
    public long firstWindowHash(NgramHasher hasher, int offset) {
        return hasher.computeFirstWindow(tokens, offset);
    }

    /**
     * Hash of the window starting at {@code offset}, given the hash of the window at {@code offset - 1}.
     */
    public long nextWindowHash(NgramHasher hasher, int offset, long previousHash) {
        return hasher.advanceToNext(tokens, offset, previousHash);
    }

    /**
     * Copy of the token ids.
     */
    public int[] toArray() {
        return tokens.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof TokenSequence other && Arrays.equals(tokens, other.tokens);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(tokens);
    }

    @Override
    public String toString() {
        if (tokens.length <= 16) {
            return Arrays.toString(tokens);
        }
        return Arrays.toString(Arrays.copyOf(tokens, 16)).replace("]", ", ...] (" + tokens.length + " tokens)");
    }
}
