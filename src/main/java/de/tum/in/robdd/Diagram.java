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

import java.util.BitSet;
import java.util.Map;
import java.util.function.IntPredicate;
import javax.annotation.Nullable;

/**
 * Object handle of a boolean function. Handles are canonical within their {@link DiagramFactory},
 * hence two handles represent the same function if and only if they are identical.
 */
public interface Diagram {
    DiagramFactory factory();

    int node();

    boolean isTrue();

    boolean isFalse();

    boolean isLeaf();

    /**
     * The variable this diagram branches on, {@link ItemOrder#TERMINAL_LEVEL} for leaves.
     */
    int variable();

    Diagram low();

    Diagram high();

    Diagram not();

    Diagram and(Diagram other);

    Diagram or(Diagram other);

    BitSet support();

    boolean evaluate(IntPredicate assignment);

    default boolean evaluate(BitSet assignment) {
        return evaluate(assignment::get);
    }

    Diagram restrict(int variable, boolean value);

    Diagram restrictSet(Map<Integer, Boolean> assignment);

    Diagram restrictLaw(Diagram law);

    Diagram subst(int variable, Diagram replacement);

    Diagram substSet(Map<Integer, Diagram> replacements);

    @Nullable
    <R> R fold(@Nullable R forFalse, @Nullable R forTrue, BranchFunction<R> combine);

    <R> R foldStrict(R forFalse, R forTrue, BranchFunction<R> combine);

    int nodeCount();
}
