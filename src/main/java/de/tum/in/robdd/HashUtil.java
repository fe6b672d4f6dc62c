/*
 * This file is part of JBDD (https://github.com/incaseoftrouble/jbdd).
 * Copyright (c) 2018-2023 Tobias Meggendorfer.
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

final class HashUtil {
    // Tables are sized as powers of two and indexed by masking, so the low bits have to be well
    // distributed. FNV-1a over the keys followed by the murmur3 finalizer achieves that.

    static final int PRIME = 0x1000193;
    private static final int OFFSET_BASIS = 0x811c9dc5;

    private HashUtil() {}

    static int hash(int key) {
        return mix((OFFSET_BASIS ^ key) * PRIME);
    }

    static int hash(int firstKey, int secondKey) {
        int hash = (OFFSET_BASIS ^ firstKey) * PRIME;
        hash = (hash ^ secondKey) * PRIME;
        return mix(hash);
    }

    static int hash(int firstKey, int secondKey, int thirdKey) {
        int hash = (OFFSET_BASIS ^ firstKey) * PRIME;
        hash = (hash ^ secondKey) * PRIME;
        hash = (hash ^ thirdKey) * PRIME;
        return mix(hash);
    }

    static int mix(int hash) {
        int mixed = hash;
        mixed ^= mixed >>> 16;
        mixed *= 0x85ebca6b;
        mixed ^= mixed >>> 13;
        mixed *= 0xc2b2ae35;
        mixed ^= mixed >>> 16;
        return mixed;
    }

    static int tableSizeFor(int capacity) {
        int size = Integer.highestOneBit(Math.max(capacity, 2) - 1) << 1;
        return size <= 0 ? 1 << 30 : size;
    }
}
