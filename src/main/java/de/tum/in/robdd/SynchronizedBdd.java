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
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.IntPredicate;
import java.util.function.Supplier;
import javax.annotation.Nullable;

/**
 * Makes a diagram usable from multiple threads. Operations which may create nodes acquire the write
 * lock, pure queries the read lock.
 */
public final class SynchronizedBdd implements Bdd {
    private final Bdd delegate;
    private final Lock readLock;
    private final Lock writeLock;

    private SynchronizedBdd(Bdd delegate, ReadWriteLock lock) {
        this.delegate = delegate;
        writeLock = lock.writeLock();
        readLock = lock.readLock();
    }

    public static SynchronizedBdd create(Bdd bdd) {
        if (bdd instanceof SynchronizedBdd) {
            return (SynchronizedBdd) bdd;
        }
        return new SynchronizedBdd(bdd, new ReentrantReadWriteLock());
    }

    private static <V> V locked(Lock lock, Supplier<V> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private int write(Supplier<Integer> action) {
        return locked(writeLock, action);
    }

    private <V> V read(Supplier<V> action) {
        return locked(readLock, action);
    }

    @Override
    public int placeholder() {
        return delegate.placeholder();
    }

    @Override
    public ItemOrder order() {
        return delegate.order();
    }

    @Override
    public int trueNode() {
        return delegate.trueNode();
    }

    @Override
    public int falseNode() {
        return delegate.falseNode();
    }

    @Override
    public boolean isLeaf(int node) {
        return delegate.isLeaf(node);
    }

    @Override
    public int variableOf(int node) {
        return read(() -> delegate.variableOf(node));
    }

    @Override
    public int high(int node) {
        return read(() -> delegate.high(node));
    }

    @Override
    public int low(int node) {
        return read(() -> delegate.low(node));
    }

    @Override
    public boolean isVariable(int node) {
        return read(() -> delegate.isVariable(node));
    }

    @Override
    public boolean isVariableNegated(int node) {
        return read(() -> delegate.isVariableNegated(node));
    }

    @Override
    public int variableNode(int variable) {
        return write(() -> delegate.variableNode(variable));
    }

    @Override
    public int makeNode(int variable, int low, int high) {
        return write(() -> delegate.makeNode(variable, low, high));
    }

    @Override
    public int not(int node) {
        return write(() -> delegate.not(node));
    }

    @Override
    public int and(int node1, int node2) {
        return write(() -> delegate.and(node1, node2));
    }

    @Override
    public int or(int node1, int node2) {
        return write(() -> delegate.or(node1, node2));
    }

    @Override
    public int andAll(int... nodes) {
        return write(() -> delegate.andAll(nodes));
    }

    @Override
    public int orAll(int... nodes) {
        return write(() -> delegate.orAll(nodes));
    }

    @Override
    public BitSet support(int node) {
        return read(() -> delegate.support(node));
    }

    @Override
    public boolean evaluate(int node, IntPredicate assignment) {
        return read(() -> delegate.evaluate(node, assignment));
    }

    @Override
    public boolean evaluate(int node, BitSet assignment) {
        return read(() -> delegate.evaluate(node, assignment));
    }

    @Override
    public boolean evaluate(int node, boolean[] assignment) {
        return read(() -> delegate.evaluate(node, assignment));
    }

    @Override
    public int restrict(int node, int variable, boolean value) {
        return write(() -> delegate.restrict(node, variable, value));
    }

    @Override
    public int restrictSet(int node, Map<Integer, Boolean> assignment) {
        return write(() -> delegate.restrictSet(node, assignment));
    }

    @Override
    public int restrictSet(int node, BitSet restrictedVariables, BitSet restrictedVariableValues) {
        return write(() -> delegate.restrictSet(node, restrictedVariables, restrictedVariableValues));
    }

    @Override
    public int restrictLaw(int node, int law) {
        return write(() -> delegate.restrictLaw(node, law));
    }

    @Override
    public int subst(int node, int variable, int replacement) {
        return write(() -> delegate.subst(node, variable, replacement));
    }

    @Override
    public int substSet(int node, Map<Integer, Integer> replacements) {
        return write(() -> delegate.substSet(node, replacements));
    }

    @Override
    public int compose(int node, int[] variableMapping) {
        return write(() -> delegate.compose(node, variableMapping));
    }

    // The combine function may call back into this instance, so folds exclude all other access
    @Nullable
    @Override
    public <R> R fold(int node, @Nullable R forFalse, @Nullable R forTrue, BranchFunction<R> combine) {
        return locked(writeLock, () -> delegate.fold(node, forFalse, forTrue, combine));
    }

    @Override
    public <R> R foldStrict(int node, R forFalse, R forTrue, BranchFunction<R> combine) {
        return locked(writeLock, () -> delegate.foldStrict(node, forFalse, forTrue, combine));
    }

    @Override
    public int nodeCount(int node) {
        return read(() -> delegate.nodeCount(node));
    }

    @Override
    public String treeToString(int node) {
        return read(() -> delegate.treeToString(node));
    }

    @Override
    public String statistics() {
        return read(delegate::statistics);
    }

    @Override
    public String toString() {
        return "SynchronizedBdd{" + delegate + '}';
    }
}
