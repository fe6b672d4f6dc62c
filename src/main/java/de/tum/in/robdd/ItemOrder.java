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

import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * A total order on variables. Along every path of a decision diagram, variables appear in strictly
 * increasing order with respect to the item order of the diagram.
 *
 * <p>Item orders are compared by identity: each call to {@link #of(Comparator)} yields a new order
 * which is never interchangeable with any other order, even if the comparators agree. All diagrams
 * participating in a single operation have to be built under the same order. This is a
 * precondition and only checked through assertions.</p>
 */
public final class ItemOrder {
    /**
     * The level of leaves, which follows every variable.
     */
    public static final int TERMINAL_LEVEL = -1;

    private static final ItemOrder NATURAL = new ItemOrder(null, "natural");

    @Nullable
    private final Comparator<Integer> comparator;
    private final String name;

    private ItemOrder(@Nullable Comparator<Integer> comparator, String name) {
        this.comparator = comparator;
        this.name = name;
    }

    /**
     * Returns the default order, i.e. ascending variable numbers.
     */
    public static ItemOrder natural() {
        return NATURAL;
    }

    /**
     * Creates a new custom order. The comparator has to be a strict total order on the non-negative
     * integers and has to stay fixed while diagrams built under this order are in use.
     */
    public static ItemOrder of(Comparator<Integer> comparator) {
        return new ItemOrder(Objects.requireNonNull(comparator), "custom@" + Integer.toHexString(comparator.hashCode()));
    }

    /**
     * Returns a new custom order which is the reverse of this order.
     */
    public ItemOrder reversed() {
        Comparator<Integer> reversed =
                comparator == null ? Comparator.<Integer>reverseOrder() : comparator.reversed();
        return new ItemOrder(reversed, "reversed(" + name + ")");
    }

    public boolean isNatural() {
        return comparator == null;
    }

    /**
     * Compares the two variables.
     *
     * @return A negative value if {@code first} precedes {@code second}, zero if they are the same
     *     and a positive value otherwise.
     */
    public int compareItem(int first, int second) {
        return comparator == null ? Integer.compare(first, second) : comparator.compare(first, second);
    }

    /**
     * Compares two levels, where a level is either a variable or {@link #TERMINAL_LEVEL}. The
     * terminal level follows every variable.
     */
    public int compareLevels(int first, int second) {
        if (first == TERMINAL_LEVEL) {
            return second == TERMINAL_LEVEL ? 0 : 1;
        }
        if (second == TERMINAL_LEVEL) {
            return -1;
        }
        return compareItem(first, second);
    }

    /**
     * Returns the earlier of the two levels.
     */
    public int earlierLevel(int first, int second) {
        return compareLevels(first, second) <= 0 ? first : second;
    }

    /**
     * Sorts the given variables in place along this order.
     */
    public int[] sort(int[] variables) {
        if (comparator == null) {
            Arrays.sort(variables);
            return variables;
        }
        Integer[] boxed = new Integer[variables.length];
        for (int i = 0; i < variables.length; i++) {
            boxed[i] = variables[i];
        }
        Arrays.sort(boxed, comparator);
        for (int i = 0; i < variables.length; i++) {
            variables[i] = boxed[i];
        }
        return variables;
    }

    @Override
    public String toString() {
        return name;
    }
}
