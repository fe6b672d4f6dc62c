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

import static de.tum.in.robdd.Util.checkState;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import java.util.function.IntConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The unique table of a decision diagram. Every distinct node is stored exactly once and identified
 * by its index in the table. Indices are handed out in creation order and nodes are never removed,
 * hence equality of nodes is equality of their indices.
 */
public abstract class NodeTable {
    private static final Logger logger = Logger.getLogger(NodeTable.class.getName());

    // Use 0 as "not a node" so that freshly allocated arrays are empty
    protected static final int NOT_A_NODE = 0;
    protected static final int FIRST_NODE = 1;
    protected static final int TRUE_NODE = -1;
    protected static final int FALSE_NODE = -2;

    private static final int MINIMUM_NODE_TABLE_SIZE = 16;
    private static final int MAXIMAL_NODE_COUNT = Integer.MAX_VALUE / 2 - 8;

    private final double growthFactor;

    /* Index of the next node to be created. All nodes below are valid, all nodes above invalid. */
    private int nextFreeNode = FIRST_NODE;

    /* Variable of each node. */
    private int[] variables;

    /* Hash map for existing nodes. hashToChainStart maps a hash bucket to the most recently created
     * node of that bucket, hashChain links each node to the next node in the same bucket. The bucket
     * array is a power of two and is rebuilt whenever the number of nodes exceeds it. */
    private int[] hashToChainStart;
    private int[] hashChain;

    // Statistics
    private long createdNodes = 0;
    private long hashChainLookups = 0;
    private long hashChainLookupLength = 0;
    private long hashChainLookupHit = 0;
    private long growCount = 0;
    private long rehashCount = 0;

    protected NodeTable(int initialSize, double growthFactor) {
        this.growthFactor = growthFactor;
        int tableSize = Math.max(initialSize, MINIMUM_NODE_TABLE_SIZE);

        variables = new int[tableSize];
        hashChain = new int[tableSize];
        hashToChainStart = new int[HashUtil.tableSizeFor(tableSize)];

        // Just to ensure a fail-fast
        Arrays.fill(hashChain, 0, FIRST_NODE, Integer.MIN_VALUE);
        Arrays.fill(variables, 0, FIRST_NODE, Integer.MIN_VALUE);
    }

    public final int placeholder() {
        return NOT_A_NODE;
    }

    public final boolean isLeaf(int node) {
        return node == TRUE_NODE || node == FALSE_NODE;
    }

    /**
     * Gets the variable of the given {@code node} or {@link ItemOrder#TERMINAL_LEVEL} for a leaf.
     */
    public int variableOf(int node) {
        assert isNodeValidOrLeaf(node) : "Invalid node " + node;
        return isLeaf(node) ? ItemOrder.TERMINAL_LEVEL : variables[node];
    }

    public boolean isNodeValid(int node) {
        return FIRST_NODE <= node && node < nextFreeNode;
    }

    /**
     * Determines if the given {@code node} is either a leaf or valid. For most operations it is
     * required that this is the case.
     *
     * @param node The node to be checked.
     * @return If {@code} is valid or a leaf.
     */
    public boolean isNodeValidOrLeaf(int node) {
        return isLeaf(node) || isNodeValid(node);
    }

    protected abstract boolean checkLookupChildrenMatch(int lookup);

    /**
     * Returns the node with the given variable whose children match the current lookup (see {@link
     * #checkLookupChildrenMatch(int)}), allocating a fresh index if there is none. The caller is
     * responsible for storing the children of a fresh node.
     */
    protected int findOrCreateNode(int variable, int hashCode) {
        createdNodes += 1;

        int[] variables = this.variables;
        int[] hashChain = this.hashChain;

        int currentLookupNode = hashToChainStart[hashToTable(hashCode)];

        // Search for the node in the hash chain
        int chainLookups = 1;
        this.hashChainLookups += 1;
        while (currentLookupNode != NOT_A_NODE) {
            if (variables[currentLookupNode] == variable && checkLookupChildrenMatch(currentLookupNode)) {
                this.hashChainLookupLength += chainLookups;
                this.hashChainLookupHit += 1;
                return currentLookupNode;
            }
            int next = hashChain[currentLookupNode];
            assert next != currentLookupNode;
            currentLookupNode = next;
            chainLookups += 1;
        }
        this.hashChainLookupLength += chainLookups;

        ensureCapacity();

        int freeNode = nextFreeNode;
        nextFreeNode += 1;
        this.variables[freeNode] = variable;
        connectHashList(freeNode, hashCode);
        return freeNode;
    }

    /**
     * Grows the node arrays if they are full and rebuilds the hash buckets if there are more nodes
     * than buckets.
     */
    private void ensureCapacity() {
        int oldSize = tableSize();
        if (nextFreeNode == oldSize) {
            checkState(oldSize < MAXIMAL_NODE_COUNT, "Node table is full (%d nodes)", oldSize);

            growCount += 1;
            @SuppressWarnings("NumericCastThatLosesPrecision")
            int newSize = (int) Math.min(MAXIMAL_NODE_COUNT, Math.ceil(oldSize * growthFactor));
            assert oldSize < newSize : "Got new size " + newSize + " with old size " + oldSize;

            logger.log(Level.FINE, "Growing the table of {0} from {1} to {2}", new Object[] {this, oldSize, newSize});
            onTableResize(newSize);
            variables = Arrays.copyOf(this.variables, newSize); // NOPMD
            hashChain = Arrays.copyOf(this.hashChain, newSize); // NOPMD
        }

        if (nextFreeNode >= hashToChainStart.length) {
            rehash(hashToChainStart.length * 2);
        }
    }

    private void rehash(int bucketCount) {
        logger.log(Level.FINER, "Rebuilding hash buckets of {0} with {1} buckets", new Object[] {this, bucketCount});
        rehashCount += 1;
        hashToChainStart = new int[bucketCount];
        for (int node = FIRST_NODE; node < nextFreeNode; node++) {
            connectHashList(node, hashCode(node, variables[node]));
        }
        assert check();
    }

    private void connectHashList(int node, int hashCode) {
        int position = hashToTable(hashCode);
        hashChain[node] = hashToChainStart[position];
        hashToChainStart[position] = node;
    }

    private int hashToTable(int hashCode) {
        return hashCode & (hashToChainStart.length - 1);
    }

    protected abstract int hashCode(int node, int variable);

    protected abstract void onTableResize(int newSize);

    public int tableSize() {
        return variables.length;
    }

    /**
     * Number of branch nodes created so far, which are all still present.
     */
    public int nodeCount() {
        return nextFreeNode - FIRST_NODE;
    }

    /**
     * Counts the number of distinct branch nodes below the specified {@code node}.
     *
     * @param node The node to be counted.
     * @return The number of non-leaf nodes below {@code node}, including itself.
     */
    public int nodeCount(int node) {
        assert isNodeValidOrLeaf(node);
        int[] count = {0};
        forEachNodeBelowOnce(node, (child, variable) -> count[0] += 1);
        return count[0];
    }

    // Traversal

    protected void forEachNodeBelowOnce(int node, NodeVisitor action) {
        BitSet visited = new BitSet(nextFreeNode);
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            int current = stack.pop();
            if (isLeaf(current) || visited.get(current)) {
                continue;
            }
            visited.set(current);
            action.visit(current, variables[current]);
            forEachChild(current, stack::push);
        }
    }

    // Integrity checks and utility

    /**
     * Performs some integrity / invariant checks.
     *
     * @return True. This way, check can easily be called by an {@code assert} statement.
     */
    boolean check() {
        logger.log(Level.FINER, "Running integrity check");
        checkState(nextFreeNode <= tableSize(), "Next free node %d beyond table size %d", nextFreeNode, tableSize());

        // Check each node's children
        for (int node = FIRST_NODE; node < nextFreeNode; node++) {
            int current = node;
            int variable = variables[node];
            checkState(variable >= 0, "Node (%s) has negative variable", string(current));
            forEachChild(node, child -> {
                checkState(isNodeValidOrLeaf(child), "Invalid child entry (%s) -> (%s)", string(current), string(child));
                checkState(child < current, "(%s) -> (%s) refers to a younger node", string(current), string(child));
                if (!isLeaf(child)) {
                    checkState(
                            compareVariables(variable, variables[child]) < 0,
                            "(%s) -> (%s) does not descend the order",
                            string(current),
                            string(child));
                }
            });
            checkState(!isRedundant(node), "Node (%s) is redundant", string(current));
        }

        // Check if there are duplicate nodes
        Set<Node> nodes = new HashSet<>();
        for (int node = FIRST_NODE; node < nextFreeNode; node++) {
            Node nodeObject = node(node);
            checkState(nodes.add(nodeObject), "Duplicate entry (%s)", nodeObject);
        }

        // Check the integrity of the hash chain
        for (int node = FIRST_NODE; node < nextFreeNode; node++) {
            int chainPosition = hashToChainStart[hashToTable(hashCode(node, variables[node]))];
            boolean found = false;
            StringBuilder hashChain = new StringBuilder(32);
            while (chainPosition != NOT_A_NODE) {
                hashChain.append(' ').append(chainPosition);
                if (chainPosition == node) {
                    found = true;
                    break;
                }
                chainPosition = this.hashChain[chainPosition];
            }
            checkState(found, "(%s) is not contained in it's hash list: %s", string(node), hashChain);
        }

        return true;
    }

    protected abstract int compareVariables(int first, int second);

    protected abstract boolean isRedundant(int node);

    public String getStatistics() {
        int[] chainLength = new int[hashToChainStart.length];
        int distinctChains = 0;
        int max = 0;
        for (int bucket = 0; bucket < hashToChainStart.length; bucket++) {
            int length = 0;
            for (int chainPosition = hashToChainStart[bucket];
                    chainPosition != NOT_A_NODE;
                    chainPosition = hashChain[chainPosition]) {
                length += 1;
            }
            chainLength[bucket] = length;
            if (length > 0) {
                distinctChains += 1;
            }
            max = Math.max(max, length);
        }

        return String.format(
                "Node table statistics:%n"
                        + "Table Size: %1$d, %2$d nodes, %3$d lookups%n"
                        + "Hash table: %4$d buckets, %5$d chains %6$.2f load, %7$.2f avg, %8$d max; "
                        + "%9$d hits, %10$.2f avg. len%n"
                        + "%11$d grows, %12$d rehashes",
                tableSize(),
                nodeCount(),
                createdNodes,
                hashToChainStart.length,
                distinctChains,
                distinctChains * 1.0 / hashToChainStart.length,
                distinctChains == 0 ? 0.0 : nodeCount() * 1.0 / distinctChains,
                max,
                hashChainLookupHit,
                hashChainLookups == 0 ? 0.0 : hashChainLookupLength * 1.0 / hashChainLookups,
                growCount,
                rehashCount);
    }

    public String nodeToString(int node) {
        if (!isNodeValid(node)) {
            return String.format("%5d| == INVALID ==", node);
        }
        return String.format("%5d|%3d|%s", node, variables[node], node(node).childrenString());
    }

    /**
     * Generates a string representation of the given {@code node}.
     *
     * @param node The node to be printed.
     * @return A string representing the given node.
     */
    public String treeToString(int node) {
        assert isNodeValidOrLeaf(node);
        if (isLeaf(node)) {
            return String.format("Node %s%n", node == TRUE_NODE ? "TRUE" : "FALSE");
        }
        StringBuilder builder =
                new StringBuilder(50).append("Node ").append(node).append('\n').append("  NODE|VAR|DATA\n");
        forEachNodeBelowOnce(node, (child, var) -> builder.append(' ').append(nodeToString(child)).append('\n'));
        return builder.toString();
    }

    private Object string(int node) {
        return new Object() {
            @Override
            public String toString() {
                return isLeaf(node) ? String.valueOf(node) : node(node).toString();
            }
        };
    }

    protected abstract Node node(int node);

    public interface Node {
        String childrenString();
    }

    @FunctionalInterface
    protected interface NodeVisitor {
        void visit(int node, int variable);
    }

    // Tree structure abstraction

    protected abstract void forEachChild(int node, IntConsumer action);
}
