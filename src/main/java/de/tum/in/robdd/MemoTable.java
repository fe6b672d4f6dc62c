/*
 * This file is part of JBDD (https://github.com/incaseoftrouble/jbdd).
 * Copyright (c) 2023 Tobias Meggendorfer.
 *
 * JBDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JBDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JBDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.robdd;

/**
 * Exact memo table for a single operation, mapping one to three node keys to a result node. Unlike
 * a global operation cache, entries are never evicted; the table lives exactly as long as the
 * operation which allocated it.
 *
 * <p>Keys are stored with open addressing and linear probing. Since {@link NodeTable#NOT_A_NODE}
 * is never a valid result, it marks empty slots.</p>
 */
final class MemoTable {
    private static final int EMPTY = NodeTable.NOT_A_NODE;
    private static final double LOAD_FACTOR = 0.75d;

    private final int arity;
    private int[] keys;
    private int[] results;
    private int size = 0;
    private int threshold;

    private int lookupResult = EMPTY;

    MemoTable(int arity, int initialCapacity) {
        assert 1 <= arity && arity <= 3;
        this.arity = arity;
        allocate(HashUtil.tableSizeFor(initialCapacity));
    }

    private void allocate(int capacity) {
        keys = new int[capacity * arity];
        results = new int[capacity];
        threshold = (int) (capacity * LOAD_FACTOR);
    }

    boolean lookup(int key) {
        assert arity == 1;
        return lookup(HashUtil.hash(key), key, 0, 0);
    }

    boolean lookup(int firstKey, int secondKey) {
        assert arity == 2;
        return lookup(HashUtil.hash(firstKey, secondKey), firstKey, secondKey, 0);
    }

    boolean lookup(int firstKey, int secondKey, int thirdKey) {
        assert arity == 3;
        return lookup(HashUtil.hash(firstKey, secondKey, thirdKey), firstKey, secondKey, thirdKey);
    }

    /**
     * Returns the result found by the last successful lookup.
     */
    int lookupResult() {
        assert lookupResult != EMPTY;
        return lookupResult;
    }

    void put(int key, int result) {
        assert arity == 1;
        put(HashUtil.hash(key), key, 0, 0, result);
    }

    void put(int firstKey, int secondKey, int result) {
        assert arity == 2;
        put(HashUtil.hash(firstKey, secondKey), firstKey, secondKey, 0, result);
    }

    void put(int firstKey, int secondKey, int thirdKey, int result) {
        assert arity == 3;
        put(HashUtil.hash(firstKey, secondKey, thirdKey), firstKey, secondKey, thirdKey, result);
    }

    int size() {
        return size;
    }

    private boolean lookup(int hash, int firstKey, int secondKey, int thirdKey) {
        int slot = findSlot(hash, firstKey, secondKey, thirdKey);
        lookupResult = results[slot];
        return lookupResult != EMPTY;
    }

    private void put(int hash, int firstKey, int secondKey, int thirdKey, int result) {
        assert result != EMPTY;
        int slot = findSlot(hash, firstKey, secondKey, thirdKey);
        if (results[slot] == EMPTY) {
            size += 1;
            store(slot, firstKey, secondKey, thirdKey);
        }
        results[slot] = result;
        if (size > threshold) {
            grow();
        }
    }

    private int findSlot(int hash, int firstKey, int secondKey, int thirdKey) {
        int mask = results.length - 1;
        int slot = hash & mask;
        while (results[slot] != EMPTY && !matches(slot, firstKey, secondKey, thirdKey)) {
            slot = (slot + 1) & mask;
        }
        return slot;
    }

    private boolean matches(int slot, int firstKey, int secondKey, int thirdKey) {
        int offset = slot * arity;
        int[] keys = this.keys;
        switch (arity) {
            case 1:
                return keys[offset] == firstKey;
            case 2:
                return keys[offset] == firstKey && keys[offset + 1] == secondKey;
            case 3:
                return keys[offset] == firstKey && keys[offset + 1] == secondKey && keys[offset + 2] == thirdKey;
            default:
                throw new AssertionError();
        }
    }

    private void store(int slot, int firstKey, int secondKey, int thirdKey) {
        int offset = slot * arity;
        keys[offset] = firstKey;
        if (arity > 1) {
            keys[offset + 1] = secondKey;
        }
        if (arity > 2) {
            keys[offset + 2] = thirdKey;
        }
    }

    private void grow() {
        int[] oldKeys = keys;
        int[] oldResults = results;
        allocate(oldResults.length * 2);

        for (int slot = 0; slot < oldResults.length; slot++) {
            if (oldResults[slot] == EMPTY) {
                continue;
            }
            int offset = slot * arity;
            int firstKey = oldKeys[offset];
            int secondKey = arity > 1 ? oldKeys[offset + 1] : 0;
            int thirdKey = arity > 2 ? oldKeys[offset + 2] : 0;
            int hash;
            switch (arity) {
                case 1:
                    hash = HashUtil.hash(firstKey);
                    break;
                case 2:
                    hash = HashUtil.hash(firstKey, secondKey);
                    break;
                default:
                    hash = HashUtil.hash(firstKey, secondKey, thirdKey);
                    break;
            }
            int newSlot = findSlot(hash, firstKey, secondKey, thirdKey);
            store(newSlot, firstKey, secondKey, thirdKey);
            results[newSlot] = oldResults[slot];
        }
    }

    @Override
    public String toString() {
        return String.format("MemoTable{arity=%d, size=%d, capacity=%d}", arity, size, results.length);
    }
}
