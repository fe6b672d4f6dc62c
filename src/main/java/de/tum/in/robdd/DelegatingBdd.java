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
import java.util.function.BooleanSupplier;
import java.util.function.IntPredicate;
import java.util.function.IntSupplier;
import java.util.function.Supplier;
import javax.annotation.Nullable;

/**
 * Forwards all calls to a delegate, surrounding each with {@link #onEnter(String)} and {@link
 * #onExit(String)}.
 */
public class DelegatingBdd implements Bdd {
    private final Bdd delegate;

    public DelegatingBdd(Bdd delegate) {
        this.delegate = delegate;
    }

    /**
     * Called before the delegate is entered. If this throws, the delegate is not called and {@link
     * #onExit(String)} is not invoked.
     */
    protected void onEnter(String name) {
        // Empty
    }

    /** Called after the delegate returned, also when it threw an exception. */
    protected void onExit(String name) {
        // Empty
    }

    private int guarded(String name, IntSupplier call) {
        onEnter(name);
        try {
            return call.getAsInt();
        } finally {
            onExit(name);
        }
    }

    private boolean guardedCheck(String name, BooleanSupplier call) {
        onEnter(name);
        try {
            return call.getAsBoolean();
        } finally {
            onExit(name);
        }
    }

    private <V> V guardedValue(String name, Supplier<V> call) {
        onEnter(name);
        try {
            return call.get();
        } finally {
            onExit(name);
        }
    }

    @Override
    public int placeholder() {
        return guarded("placeholder", () -> delegate.placeholder());
    }

    @Override
    public ItemOrder order() {
        return guardedValue("order", () -> delegate.order());
    }

    @Override
    public int trueNode() {
        return guarded("trueNode", () -> delegate.trueNode());
    }

    @Override
    public int falseNode() {
        return guarded("falseNode", () -> delegate.falseNode());
    }

    @Override
    public boolean isLeaf(int node) {
        return guardedCheck("isLeaf", () -> delegate.isLeaf(node));
    }

    @Override
    public int variableOf(int node) {
        return guarded("variableOf", () -> delegate.variableOf(node));
    }

    @Override
    public int high(int node) {
        return guarded("high", () -> delegate.high(node));
    }

    @Override
    public int low(int node) {
        return guarded("low", () -> delegate.low(node));
    }

    @Override
    public boolean isVariable(int node) {
        return guardedCheck("isVariable", () -> delegate.isVariable(node));
    }

    @Override
    public boolean isVariableNegated(int node) {
        return guardedCheck("isVariableNegated", () -> delegate.isVariableNegated(node));
    }

    @Override
    public int variableNode(int variable) {
        return guarded("variableNode", () -> delegate.variableNode(variable));
    }

    @Override
    public int makeNode(int variable, int low, int high) {
        return guarded("makeNode", () -> delegate.makeNode(variable, low, high));
    }

    @Override
    public int not(int node) {
        return guarded("not", () -> delegate.not(node));
    }

    @Override
    public int and(int node1, int node2) {
        return guarded("and", () -> delegate.and(node1, node2));
    }

    @Override
    public int or(int node1, int node2) {
        return guarded("or", () -> delegate.or(node1, node2));
    }

    @Override
    public int andAll(int... nodes) {
        return guarded("andAll", () -> delegate.andAll(nodes));
    }

    @Override
    public int orAll(int... nodes) {
        return guarded("orAll", () -> delegate.orAll(nodes));
    }

    @Override
    public BitSet support(int node) {
        return guardedValue("support", () -> delegate.support(node));
    }

    @Override
    public boolean evaluate(int node, IntPredicate assignment) {
        return guardedCheck("evaluate", () -> delegate.evaluate(node, assignment));
    }

    @Override
    public boolean evaluate(int node, BitSet assignment) {
        return guardedCheck("evaluate", () -> delegate.evaluate(node, assignment));
    }

    @Override
    public boolean evaluate(int node, boolean[] assignment) {
        return guardedCheck("evaluate", () -> delegate.evaluate(node, assignment));
    }

    @Override
    public int restrict(int node, int variable, boolean value) {
        return guarded("restrict", () -> delegate.restrict(node, variable, value));
    }

    @Override
    public int restrictSet(int node, Map<Integer, Boolean> assignment) {
        return guarded("restrictSet", () -> delegate.restrictSet(node, assignment));
    }

    @Override
    public int restrictSet(int node, BitSet restrictedVariables, BitSet restrictedVariableValues) {
        return guarded(
                "restrictSet", () -> delegate.restrictSet(node, restrictedVariables, restrictedVariableValues));
    }

    @Override
    public int restrictLaw(int node, int law) {
        return guarded("restrictLaw", () -> delegate.restrictLaw(node, law));
    }

    @Override
    public int subst(int node, int variable, int replacement) {
        return guarded("subst", () -> delegate.subst(node, variable, replacement));
    }

    @Override
    public int substSet(int node, Map<Integer, Integer> replacements) {
        return guarded("substSet", () -> delegate.substSet(node, replacements));
    }

    @Override
    public int compose(int node, int[] variableMapping) {
        return guarded("compose", () -> delegate.compose(node, variableMapping));
    }

    @Nullable
    @Override
    public <R> R fold(int node, @Nullable R forFalse, @Nullable R forTrue, BranchFunction<R> combine) {
        return guardedValue("fold", () -> delegate.fold(node, forFalse, forTrue, combine));
    }

    @Override
    public <R> R foldStrict(int node, R forFalse, R forTrue, BranchFunction<R> combine) {
        return guardedValue("foldStrict", () -> delegate.foldStrict(node, forFalse, forTrue, combine));
    }

    @Override
    public int nodeCount(int node) {
        return guarded("nodeCount", () -> delegate.nodeCount(node));
    }

    @Override
    public String treeToString(int node) {
        return guardedValue("treeToString", () -> delegate.treeToString(node));
    }

    @Override
    public String statistics() {
        return guardedValue("statistics", () -> delegate.statistics());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + '{' + delegate + '}';
    }
}
