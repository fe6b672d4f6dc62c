/*
 * This file is part of JBDD (https://github.com/incaseoftrouble/jbdd).
 * Copyright (c) 2017-2023 Tobias Meggendorfer.
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

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class BddConfiguration {
    public static final int DEFAULT_INITIAL_SIZE = 1024;
    public static final int DEFAULT_MEMO_TABLE_SIZE = 256;
    public static final double DEFAULT_NODE_TABLE_GROWTH_FACTOR = 1.5d;

    /**
     * Initial number of nodes the node table can hold before growing.
     */
    @Value.Default
    public int initialSize() {
        return DEFAULT_INITIAL_SIZE;
    }

    @Value.Default
    public double growthFactor() {
        return DEFAULT_NODE_TABLE_GROWTH_FACTOR;
    }

    /**
     * Initial capacity of the memo tables allocated by each operation.
     */
    @Value.Default
    public int memoTableSize() {
        return DEFAULT_MEMO_TABLE_SIZE;
    }

    /**
     * Whether to fail fast if the constructed instance is accessed concurrently.
     */
    @Value.Default
    public boolean threadSafetyCheck() {
        return false;
    }

    @Value.Check
    protected void check() {
        Util.checkArgument(initialSize() > 0, "Initial size %d is not positive", initialSize());
        Util.checkArgument(growthFactor() > 1.0, "Growth factor %f has to be larger than 1", growthFactor());
        Util.checkArgument(memoTableSize() > 0, "Memo table size %d is not positive", memoTableSize());
    }
}
