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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Intermediate state of a simultaneous substitution. It consists of
 *
 * <ul>
 *   <li>the <i>conditions</i>, mapping each substituted variable which has already been
 *       encountered to the (partially cofactored) replacement function deciding it,</li>
 *   <li>the <i>fragments</i>, pieces of the substituted function each guarded by a partial
 *       assignment of the substituted variables, and</li>
 *   <li>the <i>remaining</i> replacements, which have not yet been encountered.</li>
 * </ul>
 *
 * <p>States are immutable and compared by value, so that they can serve as memo keys.</p>
 */
final class SubstitutionState {
    private final SortedMap<Integer, Integer> conditions;
    private final List<Fragment> fragments;
    private final SortedMap<Integer, Integer> remaining;
    private final int[] key;

    SubstitutionState(
            SortedMap<Integer, Integer> conditions, List<Fragment> fragments, SortedMap<Integer, Integer> remaining) {
        this.conditions = Collections.unmodifiableSortedMap(conditions);
        this.fragments = Collections.unmodifiableList(fragments);
        this.remaining = Collections.unmodifiableSortedMap(remaining);
        this.key = encode();
    }

    SortedMap<Integer, Integer> conditions() {
        return conditions;
    }

    List<Fragment> fragments() {
        return fragments;
    }

    SortedMap<Integer, Integer> remaining() {
        return remaining;
    }

    /**
     * Drops all conditions which have been decided to a constant. Fragments whose guard contradicts
     * such a decision are removed, the decided variable is removed from the guards of the others.
     */
    SubstitutionState withoutFixedConditions() {
        SortedMap<Integer, Boolean> fixed = new TreeMap<>();
        for (Map.Entry<Integer, Integer> entry : conditions.entrySet()) {
            int decision = entry.getValue();
            if (decision == NodeTable.TRUE_NODE || decision == NodeTable.FALSE_NODE) {
                fixed.put(entry.getKey(), decision == NodeTable.TRUE_NODE);
            }
        }
        if (fixed.isEmpty()) {
            return this;
        }

        SortedMap<Integer, Integer> undecided = new TreeMap<>(conditions);
        undecided.keySet().removeAll(fixed.keySet());

        List<Fragment> consistent = new ArrayList<>(fragments.size());
        for (Fragment fragment : fragments) {
            if (fragment.agreesWith(fixed)) {
                SortedMap<Integer, Boolean> guard = new TreeMap<>(fragment.guard());
                guard.keySet().removeAll(fixed.keySet());
                consistent.add(new Fragment(guard, fragment.node()));
            }
        }
        return new SubstitutionState(undecided, consistent, remaining);
    }

    private int[] encode() {
        int length = 3 + 2 * conditions.size() + 2 * remaining.size();
        for (Fragment fragment : fragments) {
            length += 2 + 2 * fragment.guard().size();
        }
        int[] key = new int[length];
        int position = 0;

        key[position++] = conditions.size();
        for (Map.Entry<Integer, Integer> entry : conditions.entrySet()) {
            key[position++] = entry.getKey();
            key[position++] = entry.getValue();
        }
        key[position++] = fragments.size();
        for (Fragment fragment : fragments) {
            key[position++] = fragment.guard().size();
            for (Map.Entry<Integer, Boolean> entry : fragment.guard().entrySet()) {
                key[position++] = entry.getKey();
                key[position++] = entry.getValue() ? 1 : 0;
            }
            key[position++] = fragment.node();
        }
        key[position++] = remaining.size();
        for (Map.Entry<Integer, Integer> entry : remaining.entrySet()) {
            key[position++] = entry.getKey();
            key[position++] = entry.getValue();
        }
        assert position == length;
        return key;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SubstitutionState)) {
            return false;
        }
        return Arrays.equals(key, ((SubstitutionState) o).key);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(key);
    }

    @Override
    public String toString() {
        return String.format("{conditions=%s, fragments=%s, remaining=%s}", conditions, fragments, remaining);
    }

    /**
     * A node of the substituted function, valid under the given partial assignment of substituted
     * variables.
     */
    static final class Fragment {
        private final SortedMap<Integer, Boolean> guard;
        private final int node;

        Fragment(SortedMap<Integer, Boolean> guard, int node) {
            this.guard = Collections.unmodifiableSortedMap(guard);
            this.node = node;
        }

        SortedMap<Integer, Boolean> guard() {
            return guard;
        }

        int node() {
            return node;
        }

        Fragment withNode(int node) {
            return node == this.node ? this : new Fragment(guard, node);
        }

        Fragment withDecision(int variable, boolean value, int node) {
            SortedMap<Integer, Boolean> extended = new TreeMap<>(guard);
            extended.put(variable, value);
            return new Fragment(extended, node);
        }

        boolean agreesWith(Map<Integer, Boolean> assignment) {
            for (Map.Entry<Integer, Boolean> entry : guard.entrySet()) {
                Boolean value = assignment.get(entry.getKey());
                if (value != null && !value.equals(entry.getValue())) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public String toString() {
            return guard + "->" + node;
        }
    }
}
