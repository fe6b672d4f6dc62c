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
import java.util.HashMap;
import java.util.Map;
import java.util.function.IntPredicate;
import javax.annotation.Nullable;

/**
 * This interface contains the operations on reduced ordered binary decision diagrams. Nodes are
 * represented by {@code int} handles which are canonical, i.e. two nodes of the same instance
 * represent the same function if and only if they are equal.
 *
 * <p>Each instance is bound to exactly one {@link ItemOrder}. Nodes of different instances must
 * never be mixed.</p>
 *
 * <p>Note that for the sake of performance, most required properties of the arguments are only
 * checked though {@code assert} statements. With disabled assertions, undefined behaviour might
 * occur with invalid arguments. Especially, the BDD may appear to be in a working state for a long
 * time after an invalid call.</p>
 */
public interface Bdd {
    /**
     * A special reserved placeholder distinct from any possible node value, which may be used as a
     * placeholder in some operations. Stays constant throughout the life of the diagram.
     *
     * @return A placeholder value
     */
    int placeholder();

    /**
     * The order of variables along every path of this diagram.
     */
    ItemOrder order();

    int trueNode();

    int falseNode();

    /**
     * Determines whether the given {@code node} represents a constant.
     *
     * @param node The node to be checked.
     * @return If the {@code node} represents a constant.
     */
    boolean isLeaf(int node);

    /**
     * Gets the variable of the given {@code node} or {@link ItemOrder#TERMINAL_LEVEL} for a leaf.
     */
    int variableOf(int node);

    int high(int node);

    int low(int node);

    /**
     * Determines whether the given {@code node} represents a variable.
     *
     * @param node The node to be checked.
     * @return If the {@code node} represents a variable.
     */
    default boolean isVariable(int node) {
        return !isLeaf(node) && low(node) == falseNode() && high(node) == trueNode();
    }

    /**
     * Determines whether the given {@code node} represents a negated variable.
     *
     * @param node The node to be checked.
     * @return If the {@code node} represents a negated variable.
     */
    default boolean isVariableNegated(int node) {
        return !isLeaf(node) && low(node) == trueNode() && high(node) == falseNode();
    }

    /**
     * Returns the node which represents the given {@code variable}, creating it if necessary.
     *
     * @throws IllegalArgumentException if the variable is negative.
     */
    int variableNode(int variable);

    /**
     * Returns the canonical node branching on {@code variable} with the given children. If both
     * children are equal, the child itself is returned. The variable has to precede the variables of
     * both children in the order of this diagram.
     *
     * @throws IllegalArgumentException if the variable is negative.
     */
    int makeNode(int variable, int low, int high);

    // Boolean operations

    int not(int node);

    int and(int node1, int node2);

    int or(int node1, int node2);

    /**
     * Computes the conjunction of all given nodes, {@code true} for no nodes.
     */
    default int andAll(int... nodes) {
        int result = trueNode();
        for (int node : nodes) {
            result = and(result, node);
        }
        return result;
    }

    /**
     * Computes the disjunction of all given nodes, {@code false} for no nodes.
     */
    default int orAll(int... nodes) {
        int result = falseNode();
        for (int node : nodes) {
            result = or(result, node);
        }
        return result;
    }

    /**
     * Computes the <b>support</b> of the function represented by the given {@code node}. The support
     * of a reduced diagram are all variables which occur on some path, which are exactly those
     * having an influence on its value.
     *
     * @param node The node whose support should be computed.
     * @return A bit set with bit {@code i} is set iff the {@code i}-th variable is in the support.
     */
    BitSet support(int node);

    /**
     * Checks whether the given {@code node} evaluates to {@code true} under the given variable
     * assignment.
     *
     * @param node The node to evaluate.
     * @param assignment The variable assignment.
     * @return The truth value of the node under the given assignment.
     */
    boolean evaluate(int node, IntPredicate assignment);

    default boolean evaluate(int node, BitSet assignment) {
        return evaluate(node, assignment::get);
    }

    /**
     * Evaluates the given {@code node}, treating variables beyond the array as {@code false}.
     */
    default boolean evaluate(int node, boolean[] assignment) {
        return evaluate(node, variable -> variable < assignment.length && assignment[variable]);
    }

    // Cofactors

    /**
     * Computes the cofactor of {@code node} with respect to {@code variable} being fixed to {@code
     * value}.
     */
    int restrict(int node, int variable, boolean value);

    /**
     * Simultaneously fixes all variables of the given map. The result is the same as restricting the
     * variables one after another.
     */
    int restrictSet(int node, Map<Integer, Boolean> assignment);

    /**
     * Simultaneously fixes all variables in {@code restrictedVariables} to their value in {@code
     * restrictedVariableValues}.
     *
     * @param node The node to be restricted.
     * @param restrictedVariables The variables used in the restriction.
     * @param restrictedVariableValues The values of the restricted variables.
     * @return The restricted node.
     */
    default int restrictSet(int node, BitSet restrictedVariables, BitSet restrictedVariableValues) {
        Map<Integer, Boolean> assignment = new HashMap<>();
        restrictedVariables.stream().forEach(variable -> assignment.put(variable, restrictedVariableValues.get(variable)));
        return restrictSet(node, assignment);
    }

    /**
     * Computes the generalized cofactor of {@code node} with respect to {@code law}, i.e. a function
     * which agrees with {@code node} on all assignments satisfying {@code law} and is usually
     * smaller. If {@code law} is unsatisfiable, the result is {@code false}.
     */
    int restrictLaw(int node, int law);

    // Substitution

    /**
     * Replaces {@code variable} in {@code node} by the function {@code replacement}.
     */
    int subst(int node, int variable, int replacement);

    /**
     * Simultaneously replaces each variable of the given map by the respective function. Variables
     * mentioned by the replacements are not substituted again.
     */
    int substSet(int node, Map<Integer, Integer> replacements);

    /**
     * Simultaneously replaces variable {@code i} by {@code variableMapping[i]} for each index. Entries
     * equal to {@link #placeholder()} keep the respective variable.
     *
     * @param node The node to be composed.
     * @param variableMapping The replacement of each variable.
     * @return The composed node.
     */
    default int compose(int node, int[] variableMapping) {
        Map<Integer, Integer> replacements = new HashMap<>();
        for (int variable = 0; variable < variableMapping.length; variable++) {
            if (variableMapping[variable] != placeholder()) {
                replacements.put(variable, variableMapping[variable]);
            }
        }
        return substSet(node, replacements);
    }

    // Folds

    /**
     * Computes a value bottom-up over the structure of {@code node}. The {@code combine} function is
     * invoked exactly once for each distinct branch node below {@code node}. Results may be {@code
     * null}.
     */
    @Nullable
    <R> R fold(int node, @Nullable R forFalse, @Nullable R forTrue, BranchFunction<R> combine);

    /**
     * Like {@link #fold(int, Object, Object, BranchFunction)}, but all intermediate results have to
     * be non-null.
     *
     * @throws NullPointerException if a terminal value or a result of {@code combine} is null.
     */
    <R> R foldStrict(int node, R forFalse, R forTrue, BranchFunction<R> combine);

    // Diagnostics

    /**
     * Counts the number of distinct branch nodes below {@code node}, including itself.
     */
    int nodeCount(int node);

    String treeToString(int node);

    String statistics();
}
