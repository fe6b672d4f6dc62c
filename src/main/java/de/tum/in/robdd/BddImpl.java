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

import static de.tum.in.robdd.Util.checkArgument;
import static de.tum.in.robdd.Util.checkState;
import static de.tum.in.robdd.Util.checkVariable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.IntConsumer;
import java.util.function.IntPredicate;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

@SuppressWarnings({
    "PMD.AvoidReassigningParameters",
    "PMD.TooManyMethods",
    "ReassignedVariable",
    "AssignmentToMethodParameter"
})
final class BddImpl extends NodeTable implements Bdd {
    private static final Logger logger = Logger.getLogger(BddImpl.class.getName());

    private final ItemOrder order;
    private final int memoTableSize;

    /* Low and high successors of each node */
    private int[] tree;

    private int hashLookupLow = NOT_A_NODE;
    private int hashLookupHigh = NOT_A_NODE;

    BddImpl(ItemOrder order, BddConfiguration configuration) {
        super(configuration.initialSize(), configuration.growthFactor());
        this.order = Objects.requireNonNull(order);
        this.memoTableSize = configuration.memoTableSize();
        tree = new int[2 * tableSize()];
    }

    // Nodes

    @Override
    protected boolean checkLookupChildrenMatch(int lookup) {
        int[] tree = this.tree;
        return tree[lookup * 2] == hashLookupLow && tree[lookup * 2 + 1] == hashLookupHigh;
    }

    @Override
    public int makeNode(int variable, int low, int high) {
        checkVariable(variable);
        assert isNodeValidOrLeaf(low) && isNodeValidOrLeaf(high);
        return branch(variable, low, high);
    }

    private int branch(int variable, int low, int high) {
        if (low == high) {
            return low;
        }
        assert order.compareLevels(variable, variableOf(low)) < 0 : "Ordering violated by low " + low;
        assert order.compareLevels(variable, variableOf(high)) < 0 : "Ordering violated by high " + high;

        hashLookupLow = low;
        hashLookupHigh = high;
        int node = findOrCreateNode(variable, hashCode(variable, low, high));

        this.tree[2 * node] = low;
        this.tree[2 * node + 1] = high;
        assert hashCode(variable, low, high) == hashCode(node, variable);
        return node;
    }

    @Override
    public ItemOrder order() {
        return order;
    }

    @Override
    public int low(int node) {
        assert isNodeValid(node);
        return tree[2 * node];
    }

    @Override
    public int high(int node) {
        assert isNodeValid(node);
        return tree[2 * node + 1];
    }

    @Override
    public int trueNode() {
        return TRUE_NODE;
    }

    @Override
    public int falseNode() {
        return FALSE_NODE;
    }

    @Override
    public int variableNode(int variable) {
        return makeNode(variable, FALSE_NODE, TRUE_NODE);
    }

    private MemoTable memo(int arity) {
        return new MemoTable(arity, memoTableSize);
    }

    /* Cofactor of node on the given variable, where the variable does not occur below node */
    private int lowOn(int node, int variable) {
        return !isLeaf(node) && variableOf(node) == variable ? tree[2 * node] : node;
    }

    private int highOn(int node, int variable) {
        return !isLeaf(node) && variableOf(node) == variable ? tree[2 * node + 1] : node;
    }

    // Boolean operations

    @Override
    public int not(int node) {
        assert isNodeValidOrLeaf(node);
        return notRecursive(node, memo(1));
    }

    private int notRecursive(int node, MemoTable memo) {
        if (node == FALSE_NODE) {
            return TRUE_NODE;
        }
        if (node == TRUE_NODE) {
            return FALSE_NODE;
        }
        if (memo.lookup(node)) {
            return memo.lookupResult();
        }
        int lowNode = notRecursive(low(node), memo);
        int highNode = notRecursive(high(node), memo);
        int resultNode = branch(variableOf(node), lowNode, highNode);
        memo.put(node, resultNode);
        return resultNode;
    }

    @Override
    public int and(int node1, int node2) {
        assert isNodeValidOrLeaf(node1) && isNodeValidOrLeaf(node2);
        return andRecursive(node1, node2, memo(2));
    }

    private int andRecursive(int node1, int node2, MemoTable memo) {
        if (node1 == node2 || node2 == TRUE_NODE) {
            return node1;
        }
        if (node1 == FALSE_NODE || node2 == FALSE_NODE) {
            return FALSE_NODE;
        }
        if (node1 == TRUE_NODE) {
            return node2;
        }

        if (node2 < node1) {
            int nodeSwap = node1;
            node1 = node2;
            node2 = nodeSwap;
        }
        if (memo.lookup(node1, node2)) {
            return memo.lookupResult();
        }

        int node1var = variableOf(node1);
        int node2var = variableOf(node2);
        int comparison = order.compareItem(node1var, node2var);

        int resultNode;
        if (comparison == 0) {
            int lowNode = andRecursive(low(node1), low(node2), memo);
            int highNode = andRecursive(high(node1), high(node2), memo);
            resultNode = branch(node1var, lowNode, highNode);
        } else if (comparison < 0) {
            int lowNode = andRecursive(low(node1), node2, memo);
            int highNode = andRecursive(high(node1), node2, memo);
            resultNode = branch(node1var, lowNode, highNode);
        } else {
            int lowNode = andRecursive(node1, low(node2), memo);
            int highNode = andRecursive(node1, high(node2), memo);
            resultNode = branch(node2var, lowNode, highNode);
        }
        memo.put(node1, node2, resultNode);
        return resultNode;
    }

    @Override
    public int or(int node1, int node2) {
        assert isNodeValidOrLeaf(node1) && isNodeValidOrLeaf(node2);
        return orRecursive(node1, node2, memo(2));
    }

    private int orRecursive(int node1, int node2, MemoTable memo) {
        if (node1 == node2 || node2 == FALSE_NODE) {
            return node1;
        }
        if (node1 == TRUE_NODE || node2 == TRUE_NODE) {
            return TRUE_NODE;
        }
        if (node1 == FALSE_NODE) {
            return node2;
        }

        if (node2 < node1) {
            int nodeSwap = node1;
            node1 = node2;
            node2 = nodeSwap;
        }
        if (memo.lookup(node1, node2)) {
            return memo.lookupResult();
        }

        int node1var = variableOf(node1);
        int node2var = variableOf(node2);
        int comparison = order.compareItem(node1var, node2var);

        int resultNode;
        if (comparison == 0) {
            int lowNode = orRecursive(low(node1), low(node2), memo);
            int highNode = orRecursive(high(node1), high(node2), memo);
            resultNode = branch(node1var, lowNode, highNode);
        } else if (comparison < 0) {
            int lowNode = orRecursive(low(node1), node2, memo);
            int highNode = orRecursive(high(node1), node2, memo);
            resultNode = branch(node1var, lowNode, highNode);
        } else {
            int lowNode = orRecursive(node1, low(node2), memo);
            int highNode = orRecursive(node1, high(node2), memo);
            resultNode = branch(node2var, lowNode, highNode);
        }
        memo.put(node1, node2, resultNode);
        return resultNode;
    }

    // Support and evaluation

    @Override
    public BitSet support(int node) {
        return foldStrict(node, new BitSet(), new BitSet(), (variable, low, high) -> {
            BitSet support = (BitSet) low.clone();
            support.or(high);
            support.set(variable);
            return support;
        });
    }

    @Override
    public boolean evaluate(int node, IntPredicate assignment) {
        assert isNodeValidOrLeaf(node);
        int current = node;
        while (!isLeaf(current)) {
            current = assignment.test(variableOf(current)) ? high(current) : low(current);
        }
        return current == TRUE_NODE;
    }

    // Cofactors

    @Override
    public int restrict(int node, int variable, boolean value) {
        assert isNodeValidOrLeaf(node);
        checkVariable(variable);
        return restrictRecursive(node, variable, value, memo(1));
    }

    private int restrictRecursive(int node, int variable, boolean value, MemoTable memo) {
        if (isLeaf(node)) {
            return node;
        }
        int nodeVariable = variableOf(node);
        int comparison = order.compareItem(nodeVariable, variable);
        if (comparison > 0) {
            return node;
        }
        if (comparison == 0) {
            return value ? high(node) : low(node);
        }
        if (memo.lookup(node)) {
            return memo.lookupResult();
        }
        int lowNode = restrictRecursive(low(node), variable, value, memo);
        int highNode = restrictRecursive(high(node), variable, value, memo);
        int resultNode = branch(nodeVariable, lowNode, highNode);
        memo.put(node, resultNode);
        return resultNode;
    }

    @Override
    public int restrictSet(int node, Map<Integer, Boolean> assignment) {
        assert isNodeValidOrLeaf(node);
        int[] variables = new int[assignment.size()];
        int index = 0;
        for (Map.Entry<Integer, Boolean> entry : assignment.entrySet()) {
            checkArgument(entry.getKey() != null, "Null variable in assignment");
            checkArgument(entry.getValue() != null, "No value for variable %d", entry.getKey());
            variables[index++] = checkVariable(entry.getKey());
        }
        order.sort(variables);
        boolean[] values = new boolean[variables.length];
        for (int i = 0; i < variables.length; i++) {
            values[i] = assignment.get(variables[i]);
        }
        return restrictSetRecursive(node, variables, values, 0, memo(1));
    }

    private int restrictSetRecursive(int node, int[] variables, boolean[] values, int position, MemoTable memo) {
        if (isLeaf(node)) {
            return node;
        }
        int nodeVariable = variableOf(node);
        // Entries preceding this node's variable do not occur below it
        while (position < variables.length && order.compareItem(variables[position], nodeVariable) < 0) {
            position += 1;
        }
        if (position == variables.length) {
            return node;
        }
        // After skipping, the position only depends on the node, so the node suffices as key
        if (memo.lookup(node)) {
            return memo.lookupResult();
        }

        int resultNode;
        if (variables[position] == nodeVariable) {
            int child = values[position] ? high(node) : low(node);
            resultNode = restrictSetRecursive(child, variables, values, position + 1, memo);
        } else {
            int lowNode = restrictSetRecursive(low(node), variables, values, position, memo);
            int highNode = restrictSetRecursive(high(node), variables, values, position, memo);
            resultNode = branch(nodeVariable, lowNode, highNode);
        }
        memo.put(node, resultNode);
        return resultNode;
    }

    @Override
    public int restrictLaw(int node, int law) {
        assert isNodeValidOrLeaf(node) && isNodeValidOrLeaf(law);
        if (law == FALSE_NODE) {
            // Every function agrees with any other on the empty set of assignments
            return FALSE_NODE;
        }
        return restrictLawRecursive(law, node, memo(2));
    }

    private int restrictLawRecursive(int law, int node, MemoTable memo) {
        assert law != FALSE_NODE;
        if (law == TRUE_NODE) {
            return node;
        }
        if (isLeaf(node)) {
            return node;
        }
        if (law == node) {
            return TRUE_NODE;
        }
        if (memo.lookup(law, node)) {
            return memo.lookupResult();
        }

        int lawVariable = variableOf(law);
        int nodeVariable = variableOf(node);
        int comparison = order.compareItem(lawVariable, nodeVariable);

        int resultNode;
        if (comparison > 0) {
            int lowNode = restrictLawRecursive(law, low(node), memo);
            int highNode = restrictLawRecursive(law, high(node), memo);
            resultNode = branch(nodeVariable, lowNode, highNode);
        } else {
            int lawLow = low(law);
            int lawHigh = high(law);
            int nodeLow = comparison == 0 ? low(node) : node;
            int nodeHigh = comparison == 0 ? high(node) : node;
            if (lawLow == FALSE_NODE) {
                resultNode = restrictLawRecursive(lawHigh, nodeHigh, memo);
            } else if (lawHigh == FALSE_NODE) {
                resultNode = restrictLawRecursive(lawLow, nodeLow, memo);
            } else {
                int lowNode = restrictLawRecursive(lawLow, nodeLow, memo);
                int highNode = restrictLawRecursive(lawHigh, nodeHigh, memo);
                resultNode = branch(lawVariable, lowNode, highNode);
            }
        }
        memo.put(law, node, resultNode);
        return resultNode;
    }

    // Substitution

    @Override
    public int subst(int node, int variable, int replacement) {
        assert isNodeValidOrLeaf(node) && isNodeValidOrLeaf(replacement);
        checkVariable(variable);
        return new Substitution(variable).apply(node, node, replacement);
    }

    /**
     * State of a single substitution call. The result is computed by a simultaneous descent into the
     * function with the variable fixed to false, the function with the variable fixed to true and
     * the replacement, branching on the earliest variable among the three.
     */
    private final class Substitution {
        private final int variable;
        private final MemoTable memo = memo(3);
        private final MemoTable restrictFalse = memo(1);
        private final MemoTable restrictTrue = memo(1);

        Substitution(int variable) {
            this.variable = variable;
        }

        int apply(int falseView, int trueView, int replacement) {
            falseView = lowOn(falseView, variable);
            trueView = highOn(trueView, variable);

            if (replacement == FALSE_NODE) {
                return restrictRecursive(falseView, variable, false, restrictFalse);
            }
            if (replacement == TRUE_NODE) {
                return restrictRecursive(trueView, variable, true, restrictTrue);
            }
            if (memo.lookup(falseView, trueView, replacement)) {
                return memo.lookupResult();
            }

            int level = order.earlierLevel(
                    order.earlierLevel(variableOf(falseView), variableOf(trueView)), variableOf(replacement));
            checkState(level != ItemOrder.TERMINAL_LEVEL, "No branching variable in substitution");

            int lowNode = apply(lowOn(falseView, level), lowOn(trueView, level), lowOn(replacement, level));
            int highNode = apply(highOn(falseView, level), highOn(trueView, level), highOn(replacement, level));
            int resultNode = branch(level, lowNode, highNode);
            memo.put(falseView, trueView, replacement, resultNode);
            return resultNode;
        }
    }

    @Override
    public int substSet(int node, Map<Integer, Integer> replacements) {
        assert isNodeValidOrLeaf(node);
        SortedMap<Integer, Integer> remaining = new TreeMap<>();
        for (Map.Entry<Integer, Integer> entry : replacements.entrySet()) {
            checkArgument(entry.getKey() != null, "Null variable in replacements");
            checkArgument(entry.getValue() != null, "No replacement for variable %d", entry.getKey());
            int replacement = entry.getValue();
            assert isNodeValidOrLeaf(replacement);
            remaining.put(checkVariable(entry.getKey()), replacement);
        }
        if (remaining.isEmpty()) {
            return node;
        }

        SimultaneousSubstitution substitution = new SimultaneousSubstitution();
        List<SubstitutionState.Fragment> fragments = new ArrayList<>(1);
        fragments.add(new SubstitutionState.Fragment(new TreeMap<>(), node));
        int result = substitution.apply(new TreeMap<>(), fragments, remaining);
        logger.log(Level.FINEST, "Simultaneous substitution explored {0} states", substitution.memo.size());
        return result;
    }

    /**
     * State of a single simultaneous substitution call, see {@link SubstitutionState}.
     */
    private final class SimultaneousSubstitution {
        private final Map<SubstitutionState, Integer> memo = new HashMap<>();
        private final Map<Integer, BitSet> supports = new HashMap<>();

        private BitSet supportOf(int node) {
            return supports.computeIfAbsent(node, BddImpl.this::support);
        }

        int apply(
                SortedMap<Integer, Integer> conditions,
                List<SubstitutionState.Fragment> fragments,
                SortedMap<Integer, Integer> remaining) {
            checkState(!fragments.isEmpty(), "No fragments left in substitution");

            int fragmentLevel = ItemOrder.TERMINAL_LEVEL;
            BitSet fragmentSupport = new BitSet();
            for (SubstitutionState.Fragment fragment : fragments) {
                fragmentLevel = order.earlierLevel(fragmentLevel, variableOf(fragment.node()));
                fragmentSupport.or(supportOf(fragment.node()));
            }

            // Replacements of variables which do not occur any more are irrelevant
            SortedMap<Integer, Integer> relevant = new TreeMap<>();
            for (Map.Entry<Integer, Integer> entry : remaining.entrySet()) {
                if (fragmentSupport.get(entry.getKey())) {
                    relevant.put(entry.getKey(), entry.getValue());
                }
            }

            int level = fragmentLevel;
            for (int replacement : relevant.values()) {
                level = order.earlierLevel(level, variableOf(replacement));
            }
            for (int condition : conditions.values()) {
                level = order.earlierLevel(level, variableOf(condition));
            }

            if (level == ItemOrder.TERMINAL_LEVEL) {
                SubstitutionState state =
                        new SubstitutionState(conditions, fragments, relevant).withoutFixedConditions();
                checkState(
                        state.conditions().isEmpty() && state.fragments().size() == 1,
                        "Inconsistent final substitution state %s",
                        state);
                return state.fragments().get(0).node();
            }

            if (level == fragmentLevel && relevant.containsKey(level)) {
                // Substituted variable encountered: it is now decided by its replacement
                SortedMap<Integer, Integer> extendedConditions = new TreeMap<>(conditions);
                extendedConditions.put(level, relevant.remove(level));
                List<SubstitutionState.Fragment> split = new ArrayList<>(fragments.size() + 1);
                for (SubstitutionState.Fragment fragment : fragments) {
                    int fragmentNode = fragment.node();
                    if (!isLeaf(fragmentNode) && variableOf(fragmentNode) == level) {
                        split.add(fragment.withDecision(level, false, low(fragmentNode)));
                        split.add(fragment.withDecision(level, true, high(fragmentNode)));
                    } else {
                        split.add(fragment);
                    }
                }
                return apply(extendedConditions, split, relevant);
            }

            SubstitutionState state = new SubstitutionState(conditions, fragments, relevant).withoutFixedConditions();
            Integer cached = memo.get(state);
            if (cached != null) {
                return cached;
            }

            int lowNode = cofactor(state, level, false);
            int highNode = cofactor(state, level, true);
            int resultNode = branch(level, lowNode, highNode);
            memo.put(state, resultNode);
            return resultNode;
        }

        private int cofactor(SubstitutionState state, int variable, boolean value) {
            SortedMap<Integer, Integer> conditions = new TreeMap<>();
            state.conditions().forEach((key, node) -> conditions.put(key, cofactorOn(node, variable, value)));
            List<SubstitutionState.Fragment> fragments = new ArrayList<>(state.fragments().size());
            for (SubstitutionState.Fragment fragment : state.fragments()) {
                fragments.add(fragment.withNode(cofactorOn(fragment.node(), variable, value)));
            }
            SortedMap<Integer, Integer> remaining = new TreeMap<>();
            state.remaining().forEach((key, node) -> remaining.put(key, cofactorOn(node, variable, value)));
            return apply(conditions, fragments, remaining);
        }

        private int cofactorOn(int node, int variable, boolean value) {
            return value ? highOn(node, variable) : lowOn(node, variable);
        }
    }

    // Folds

    @Nullable
    @Override
    public <R> R fold(int node, @Nullable R forFalse, @Nullable R forTrue, BranchFunction<R> combine) {
        assert isNodeValidOrLeaf(node);
        return foldRecursive(node, forFalse, forTrue, combine, new HashMap<>(), false);
    }

    @Override
    public <R> R foldStrict(int node, R forFalse, R forTrue, BranchFunction<R> combine) {
        assert isNodeValidOrLeaf(node);
        Objects.requireNonNull(forFalse, "forFalse");
        Objects.requireNonNull(forTrue, "forTrue");
        return foldRecursive(node, forFalse, forTrue, combine, new HashMap<>(), true);
    }

    @Nullable
    private <R> R foldRecursive(
            int node, @Nullable R forFalse, @Nullable R forTrue, BranchFunction<R> combine, Map<Integer, R> memo,
            boolean strict) {
        if (node == FALSE_NODE) {
            return forFalse;
        }
        if (node == TRUE_NODE) {
            return forTrue;
        }
        if (memo.containsKey(node)) {
            return memo.get(node);
        }
        R lowResult = foldRecursive(low(node), forFalse, forTrue, combine, memo, strict);
        R highResult = foldRecursive(high(node), forFalse, forTrue, combine, memo, strict);
        R result = combine.apply(variableOf(node), lowResult, highResult);
        if (strict) {
            Objects.requireNonNull(result, () -> "Fold yielded null for node " + node);
        }
        memo.put(node, result);
        return result;
    }

    // Diagnostics

    @Override
    public String statistics() {
        return getStatistics();
    }

    @Override
    public String toString() {
        return "Bdd{" + order + ", " + nodeCount() + " nodes}";
    }

    // Node table hooks

    @Override
    protected void onTableResize(int newSize) {
        tree = Arrays.copyOf(tree, newSize * 2);
    }

    @Override
    protected int hashCode(int node, int variable) {
        return hashCode(variable, tree[2 * node], tree[2 * node + 1]);
    }

    private static int hashCode(int variable, int low, int high) {
        return HashUtil.hash(variable, low, high);
    }

    @Override
    protected int compareVariables(int first, int second) {
        return order.compareItem(first, second);
    }

    @Override
    protected boolean isRedundant(int node) {
        return tree[2 * node] == tree[2 * node + 1];
    }

    @Override
    protected void forEachChild(int node, IntConsumer action) {
        action.accept(tree[2 * node]);
        action.accept(tree[2 * node + 1]);
    }

    @Override
    protected Node node(int node) {
        return new BinaryNode(variableOf(node), tree[2 * node], tree[2 * node + 1]);
    }

    private static final class BinaryNode implements NodeTable.Node {
        final int var;
        final int low;
        final int high;

        BinaryNode(int var, int low, int high) {
            this.var = var;
            this.low = low;
            this.high = high;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof BinaryNode)) {
                return false;
            }
            BinaryNode node = (BinaryNode) o;
            return var == node.var && low == node.low && high == node.high;
        }

        @Override
        public int hashCode() {
            return HashUtil.hash(var, low, high);
        }

        @Override
        public String childrenString() {
            return String.format("%5d %5d", low, high);
        }

        @Override
        public String toString() {
            return String.format("%d: %d %d", var, low, high);
        }
    }
}
