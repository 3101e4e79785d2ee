package com.raditha.neardup.hash;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ContentHasherTest {

    private final ContentHasher hasher = new ContentHasher(3);

    @Test
    void testEqualWindowsHashEqual() {
        int[] tokens = { 4, 5, 6, 1, 4, 5, 6 };
        assertEquals(hasher.computeFirstWindow(tokens, 0), hasher.computeFirstWindow(tokens, 4));
    }

    @Test
    void testOrderMatters() {
        int[] tokens = { 4, 5, 6, 6, 5, 4 };
        assertNotEquals(hasher.computeFirstWindow(tokens, 0), hasher.computeFirstWindow(tokens, 3));
    }

    @Test
    void testAdvanceRehashesWindow() {
        int[] tokens = { 1, 2, 3, 4 };
        long first = hasher.computeFirstWindow(tokens, 0);
        assertEquals(hasher.computeFirstWindow(tokens, 1), hasher.advanceToNext(tokens, 1, first));
        assertEquals(hasher.computeFirstWindow(tokens, 1), hasher.advanceToNext(tokens, 1, 12345L));
    }

    @Test
    void testDifferentNDifferentHash() {
        int[] tokens = { 7, 7, 7 };
        assertNotEquals(new ContentHasher(2).computeFirstWindow(tokens, 0),
                new ContentHasher(3).computeFirstWindow(tokens, 0));
    }

    @Test
    void testInvalidN() {
        assertThrows(IllegalArgumentException.class, () -> new ContentHasher(0));
    }

    @Test
    void testFamily() {
        assertEquals(HashStrategy.CONTENT, hasher.family());
    }
}
