package com.raditha.neardup.index;

import com.raditha.neardup.hash.DocumentNgrams;
import it.unimi.dsi.fastutil.longs.Long2IntMap;
import it.unimi.dsi.fastutil.longs.Long2IntMaps;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectIterable;

/**
 * Counting multiset of n-gram hashes.
 * Uses a primitive long-to-int map so the hot path never boxes.
 */
public class NgramMultiset {

    private final Long2IntOpenHashMap counts;
    private long total;

    public NgramMultiset() {
        this(16);
    }

    public NgramMultiset(int expectedDistinct) {
        this.counts = new Long2IntOpenHashMap(Math.max(16, expectedDistinct));
        this.counts.defaultReturnValue(0);
    }

    /**
     * Multiset of the windows {@code [from, from + count)} of a document.
     */
    public static NgramMultiset ofWindows(DocumentNgrams ngrams, int from, int count) {
        NgramMultiset multiset = new NgramMultiset(count);
        for (int k = from; k < from + count; k++) {
            multiset.add(ngrams.hashAt(k));
        }
        return multiset;
    }

    /**
     * Add one occurrence.
     *
     * @return the count after adding
     */
    public int add(long hash) {
        total++;
        return counts.addTo(hash, 1) + 1;
    }

    /**
     * Remove one occurrence.
     *
     * @return the count after removing
     * @throws IllegalStateException if the hash is not present
     */
    public int remove(long hash) {
        int current = counts.get(hash);
        if (current == 0) {
            throw new IllegalStateException("Cannot remove absent n-gram hash " + hash);
        }
        total--;
        if (current == 1) {
            counts.remove(hash);
            return 0;
        }
        counts.put(hash, current - 1);
        return current - 1;
    }

    public int count(long hash) {
        return counts.get(hash);
    }

    public boolean contains(long hash) {
        return counts.containsKey(hash);
    }

    /**
     * Sum of all multiplicities.
     */
    public long total() {
        return total;
    }

    public int distinct() {
        return counts.size();
    }

    public boolean isEmpty() {
        return total == 0;
    }

    public void clear() {
        counts.clear();
        total = 0;
    }

    /**
     * Entries without allocation per element. Do not modify the multiset while iterating.
     */
    public ObjectIterable<Long2IntMap.Entry> entries() {
        return Long2IntMaps.fastIterable(counts);
    }

    @Override
    public String toString() {
        return "NgramMultiset{distinct=" + counts.size() + ", total=" + total + "}";
    }
}
