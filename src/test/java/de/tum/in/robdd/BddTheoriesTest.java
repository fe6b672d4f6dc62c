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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Tests the logical operations against their semantics on all valuations, under the natural and a
 * custom order.
 */
@SuppressWarnings({"checkstyle:javadoc", "NewClassNamingConvention", "PMD.ClassNamingConventions"})
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class BddTheoriesTest {
    private static final Logger logger = Logger.getLogger(BddTheoriesTest.class.getName());

    private static final int variableCount = 6;
    private static final int maximalSize = 40;
    private static final int unaryCount = 300;
    private static final int binaryCount = 300;
    private static final int ternaryCount = 150;

    private static final List<BddImpl> bdds;
    private static final Map<Bdd, List<Integer>> nodes = new HashMap<>();
    private static final List<boolean[]> valuations;
    private static final Collection<DiagramGenerator.UnaryDataPoint> unary;
    private static final Collection<DiagramGenerator.BinaryDataPoint> binary;
    private static final Collection<DiagramGenerator.TernaryDataPoint> ternary;

    static {
        BddConfiguration config = ImmutableBddConfiguration.builder().build();
        bdds = List.of(
                new BddImpl(ItemOrder.natural(), config), new BddImpl(ItemOrder.natural().reversed(), config));

        List<DiagramGenerator.UnaryDataPoint> unaryPoints = new ArrayList<>();
        List<DiagramGenerator.BinaryDataPoint> binaryPoints = new ArrayList<>();
        List<DiagramGenerator.TernaryDataPoint> ternaryPoints = new ArrayList<>();
        for (BddImpl bdd : bdds) {
            DiagramGenerator.Info info =
                    DiagramGenerator.fill(bdd, 0L, variableCount, maximalSize, unaryCount, binaryCount, ternaryCount);
            unaryPoints.addAll(info.unaryDataPoints);
            binaryPoints.addAll(info.binaryDataPoints);
            ternaryPoints.addAll(info.ternaryDataPoints);
            nodes.put(bdd, info.unaryDataPoints.stream().map(point -> point.node).collect(Collectors.toList()));

            logger.log(Level.INFO, "Filled BDD {0}: {1} unary, {2} binary and {3} ternary data points",
                    new Object[] {
                        bdd,
                        info.unaryDataPoints.size(),
                        info.binaryDataPoints.size(),
                        info.ternaryDataPoints.size()
                    });
        }
        unary = ImmutableList.copyOf(unaryPoints);
        binary = ImmutableList.copyOf(binaryPoints);
        ternary = ImmutableList.copyOf(ternaryPoints);

        List<boolean[]> allValuations = new ArrayList<>(1 << variableCount);
        for (int bits = 0; bits < 1 << variableCount; bits++) {
            boolean[] valuation = new boolean[variableCount];
            for (int variable = 0; variable < variableCount; variable++) {
                valuation[variable] = (bits & (1 << variable)) != 0;
            }
            allValuations.add(valuation);
        }
        valuations = ImmutableList.copyOf(allValuations);
    }

    public static Stream<DiagramGenerator.UnaryDataPoint> unary() {
        return unary.stream();
    }

    public static Stream<DiagramGenerator.BinaryDataPoint> binary() {
        return binary.stream();
    }

    public static Stream<DiagramGenerator.TernaryDataPoint> ternary() {
        return ternary.stream();
    }

    @BeforeAll
    public static void dummy() {
        // Dummy method to separate static initialization from actual test running times
        logger.log(Level.FINE, "Before class");
    }

    @AfterAll
    public static void check() {
        bdds.forEach(BddImpl::check);
    }

    @AfterAll
    public static void statistics() {
        for (BddImpl bdd : bdds) {
            logger.log(Level.INFO, bdd.statistics());
        }
    }

    private static boolean[] with(boolean[] valuation, int variable, boolean value) {
        boolean[] copy = valuation.clone();
        copy[variable] = value;
        return copy;
    }

    private static int literal(Bdd bdd, int variable, boolean value) {
        int node = bdd.variableNode(variable);
        return value ? node : bdd.not(node);
    }

    private static Map<Integer, Boolean> randomAssignment(Random random) {
        Map<Integer, Boolean> assignment = new HashMap<>();
        for (int variable = 0; variable < variableCount; variable++) {
            if (random.nextInt(3) == 0) {
                assignment.put(variable, random.nextBoolean());
            }
        }
        return assignment;
    }

    private static int randomNode(Bdd bdd, Random random) {
        List<Integer> pool = nodes.get(bdd);
        return pool.get(random.nextInt(pool.size()));
    }

    // Boolean algebra

    @ParameterizedTest(name = "{index}")
    @MethodSource("unary")
    public void testNot(DiagramGenerator.UnaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        int node = dataPoint.node;
        int not = bdd.not(node);

        for (boolean[] valuation : valuations) {
            assertThat(bdd.evaluate(not, valuation), is(!bdd.evaluate(node, valuation)));
        }
        assertThat(bdd.not(not), is(node));
        assertThat(bdd.and(node, not), is(bdd.falseNode()));
        assertThat(bdd.or(node, not), is(bdd.trueNode()));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("binary")
    public void testAnd(DiagramGenerator.BinaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        int node1 = dataPoint.left;
        int node2 = dataPoint.right;
        int and = bdd.and(node1, node2);

        for (boolean[] valuation : valuations) {
            assertThat(bdd.evaluate(and, valuation),
                    is(bdd.evaluate(node1, valuation) && bdd.evaluate(node2, valuation)));
        }
        assertThat(bdd.and(node2, node1), is(and));
        assertThat(bdd.and(bdd.trueNode(), node1), is(node1));
        assertThat(bdd.and(node1, bdd.trueNode()), is(node1));
        assertThat(bdd.and(bdd.falseNode(), node1), is(bdd.falseNode()));
        assertThat(bdd.and(node1, bdd.falseNode()), is(bdd.falseNode()));
        assertThat(bdd.and(node1, node1), is(node1));
        assertThat(bdd.not(bdd.or(bdd.not(node1), bdd.not(node2))), is(and));
        assertThat(bdd.and(node1, bdd.or(node1, node2)), is(node1));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("binary")
    public void testOr(DiagramGenerator.BinaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        int node1 = dataPoint.left;
        int node2 = dataPoint.right;
        int or = bdd.or(node1, node2);

        for (boolean[] valuation : valuations) {
            assertThat(bdd.evaluate(or, valuation),
                    is(bdd.evaluate(node1, valuation) || bdd.evaluate(node2, valuation)));
        }
        assertThat(bdd.or(node2, node1), is(or));
        assertThat(bdd.or(bdd.falseNode(), node1), is(node1));
        assertThat(bdd.or(node1, bdd.falseNode()), is(node1));
        assertThat(bdd.or(bdd.trueNode(), node1), is(bdd.trueNode()));
        assertThat(bdd.or(node1, bdd.trueNode()), is(bdd.trueNode()));
        assertThat(bdd.or(node1, node1), is(node1));
        assertThat(bdd.not(bdd.and(bdd.not(node1), bdd.not(node2))), is(or));
        assertThat(bdd.or(node1, bdd.and(node1, node2)), is(node1));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("ternary")
    public void testAssociativityAndDistributivity(DiagramGenerator.TernaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        int a = dataPoint.first;
        int b = dataPoint.second;
        int c = dataPoint.third;

        assertThat(bdd.and(a, bdd.and(b, c)), is(bdd.and(bdd.and(a, b), c)));
        assertThat(bdd.or(a, bdd.or(b, c)), is(bdd.or(bdd.or(a, b), c)));
        assertThat(bdd.and(a, bdd.or(b, c)), is(bdd.or(bdd.and(a, b), bdd.and(a, c))));
        assertThat(bdd.or(a, bdd.and(b, c)), is(bdd.and(bdd.or(a, b), bdd.or(a, c))));

        assertThat(bdd.andAll(a, b, c), is(bdd.and(bdd.and(a, b), c)));
        assertThat(bdd.orAll(a, b, c), is(bdd.or(bdd.or(a, b), c)));
        assertThat(bdd.andAll(), is(bdd.trueNode()));
        assertThat(bdd.orAll(), is(bdd.falseNode()));
        assertThat(bdd.andAll(a), is(a));
    }

    // Support and evaluation

    @ParameterizedTest(name = "{index}")
    @MethodSource("binary")
    public void testSupport(DiagramGenerator.BinaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        int node1 = dataPoint.left;
        int node2 = dataPoint.right;
        BitSet support = bdd.support(node1);

        for (int variable = 0; variable < variableCount; variable++) {
            boolean essential = bdd.restrict(node1, variable, true) != bdd.restrict(node1, variable, false);
            assertThat(support.get(variable), is(essential));
        }
        assertThat(bdd.support(bdd.not(node1)), is(support));

        BitSet union = bdd.support(node1);
        union.or(bdd.support(node2));
        for (int operation : new int[] {bdd.and(node1, node2), bdd.or(node1, node2)}) {
            BitSet operationSupport = bdd.support(operation);
            operationSupport.andNot(union);
            assertThat(operationSupport.isEmpty(), is(true));
        }
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("unary")
    public void testShannonExpansion(DiagramGenerator.UnaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        int node = dataPoint.node;

        for (int variable = 0; variable < variableCount; variable++) {
            int variableNode = bdd.variableNode(variable);
            int expansion = bdd.or(
                    bdd.and(variableNode, bdd.restrict(node, variable, true)),
                    bdd.and(bdd.not(variableNode), bdd.restrict(node, variable, false)));
            assertThat(expansion, is(node));
        }
        if (!bdd.isLeaf(node)) {
            assertThat(bdd.makeNode(bdd.variableOf(node), bdd.low(node), bdd.high(node)), is(node));
        }
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("unary")
    public void testFold(DiagramGenerator.UnaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        int node = dataPoint.node;

        int[] invocations = {0};
        Integer count = bdd.foldStrict(node, 0, 0, (variable, low, high) -> {
            invocations[0] += 1;
            return low + high + 1;
        });
        assertThat(invocations[0], is(bdd.nodeCount(node)));
        assertThat(count >= invocations[0], is(true));

        for (boolean[] valuation : valuations) {
            Boolean folded = bdd.foldStrict(node, Boolean.FALSE, Boolean.TRUE,
                    (variable, low, high) -> valuation[variable] ? high : low);
            assertThat(folded, is(bdd.evaluate(node, valuation)));
        }

        Object nothing = bdd.fold(node, null, null, (variable, low, high) -> null);
        assertThat(nothing, is(nullValue()));
    }

    // Cofactors

    @ParameterizedTest(name = "{index}")
    @MethodSource("binary")
    public void testRestrict(DiagramGenerator.BinaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        int node1 = dataPoint.left;
        int node2 = dataPoint.right;
        Random random = new Random(dataPoint.hashCode());
        int variable = random.nextInt(variableCount);
        boolean value = random.nextBoolean();

        int restricted = bdd.restrict(node1, variable, value);
        for (boolean[] valuation : valuations) {
            assertThat(bdd.evaluate(restricted, valuation), is(bdd.evaluate(node1, with(valuation, variable, value))));
        }
        assertThat(bdd.restrict(restricted, variable, value), is(restricted));
        assertThat(bdd.restrict(bdd.not(node1), variable, value), is(bdd.not(restricted)));
        assertThat(bdd.restrict(bdd.and(node1, node2), variable, value),
                is(bdd.and(restricted, bdd.restrict(node2, variable, value))));
        assertThat(bdd.restrict(bdd.or(node1, node2), variable, value),
                is(bdd.or(restricted, bdd.restrict(node2, variable, value))));
        assertThat(bdd.restrict(bdd.variableNode(variable), variable, value),
                is(value ? bdd.trueNode() : bdd.falseNode()));

        BitSet support = bdd.support(restricted);
        assertThat(support.get(variable), is(false));
        support.andNot(bdd.support(node1));
        assertThat(support.isEmpty(), is(true));
        if (!bdd.support(node1).get(variable)) {
            assertThat(restricted, is(node1));
        }
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("binary")
    public void testRestrictSet(DiagramGenerator.BinaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        int node1 = dataPoint.left;
        int node2 = dataPoint.right;
        Random random = new Random(dataPoint.hashCode());
        Map<Integer, Boolean> assignment = randomAssignment(random);

        int iterated = node1;
        for (Map.Entry<Integer, Boolean> entry : assignment.entrySet()) {
            iterated = bdd.restrict(iterated, entry.getKey(), entry.getValue());
        }
        int restricted = bdd.restrictSet(node1, assignment);
        assertThat(restricted, is(iterated));

        BitSet variables = new BitSet();
        BitSet values = new BitSet();
        assignment.forEach((variable, value) -> {
            variables.set(variable);
            values.set(variable, value);
        });
        assertThat(bdd.restrictSet(node1, variables, values), is(restricted));

        assertThat(bdd.restrictSet(node1, Map.of()), is(node1));
        assertThat(bdd.restrictSet(restricted, assignment), is(restricted));
        assertThat(bdd.restrictSet(bdd.not(node1), assignment), is(bdd.not(restricted)));
        assertThat(bdd.restrictSet(bdd.and(node1, node2), assignment),
                is(bdd.and(restricted, bdd.restrictSet(node2, assignment))));
        assertThat(bdd.restrictSet(bdd.or(node1, node2), assignment),
                is(bdd.or(restricted, bdd.restrictSet(node2, assignment))));

        // Splitting the assignment into two disjoint parts
        Map<Integer, Boolean> first = new HashMap<>();
        Map<Integer, Boolean> second = new HashMap<>();
        assignment.forEach((variable, value) -> (variable % 2 == 0 ? first : second).put(variable, value));
        assertThat(bdd.restrictSet(bdd.restrictSet(node1, first), second), is(restricted));

        for (Map.Entry<Integer, Boolean> entry : assignment.entrySet()) {
            assertThat(bdd.restrictSet(node1, Map.of(entry.getKey(), entry.getValue())),
                    is(bdd.restrict(node1, entry.getKey(), entry.getValue())));
        }
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("binary")
    public void testRestrictLaw(DiagramGenerator.BinaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        int node = dataPoint.left;
        int law = dataPoint.right;

        assertThat(bdd.restrictLaw(node, bdd.trueNode()), is(node));
        if (node != bdd.falseNode()) {
            assertThat(bdd.restrictLaw(node, node), is(bdd.trueNode()));
        }
        if (node != bdd.trueNode()) {
            assertThat(bdd.restrictLaw(node, bdd.not(node)), is(bdd.falseNode()));
        }

        int restricted = bdd.restrictLaw(node, law);
        assertThat(bdd.restrictLaw(restricted, law), is(restricted));

        assumeTrue(law != bdd.falseNode());
        assertThat(bdd.and(law, restricted), is(bdd.and(law, node)));
        assertThat(bdd.restrictLaw(bdd.not(node), law), is(bdd.not(restricted)));
        for (boolean[] valuation : valuations) {
            if (bdd.evaluate(law, valuation)) {
                assertThat(bdd.evaluate(restricted, valuation), is(bdd.evaluate(node, valuation)));
            }
        }
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("unary")
    public void testRestrictLawOfCube(DiagramGenerator.UnaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        int node = dataPoint.node;
        Random random = new Random(dataPoint.hashCode());
        Map<Integer, Boolean> assignment = randomAssignment(random);

        int cube = bdd.trueNode();
        for (Map.Entry<Integer, Boolean> entry : assignment.entrySet()) {
            cube = bdd.and(cube, literal(bdd, entry.getKey(), entry.getValue()));
        }
        assertThat(bdd.restrictLaw(node, cube), is(bdd.restrictSet(node, assignment)));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("ternary")
    public void testRestrictLawDistributes(DiagramGenerator.TernaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        int a = dataPoint.first;
        int b = dataPoint.second;
        int law = dataPoint.third;
        assumeTrue(law != bdd.falseNode());

        assertThat(bdd.restrictLaw(bdd.and(a, b), law), is(bdd.and(bdd.restrictLaw(a, law), bdd.restrictLaw(b, law))));
        assertThat(bdd.restrictLaw(bdd.or(a, b), law), is(bdd.or(bdd.restrictLaw(a, law), bdd.restrictLaw(b, law))));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("ternary")
    public void testRestrictLawOfDisjunction(DiagramGenerator.TernaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        int node = dataPoint.first;
        int law1 = dataPoint.second;
        int law2 = dataPoint.third;
        int law = bdd.or(law1, law2);

        int restricted = bdd.and(law, bdd.restrictLaw(node, law));
        int combined = bdd.or(
                bdd.and(law1, bdd.restrictLaw(node, law1)), bdd.and(law2, bdd.restrictLaw(node, law2)));
        assertThat(restricted, is(combined));
    }

    // Substitution

    @ParameterizedTest(name = "{index}")
    @MethodSource("binary")
    public void testSubst(DiagramGenerator.BinaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        int node = dataPoint.left;
        int replacement = dataPoint.right;
        Random random = new Random(dataPoint.hashCode());
        int variable = random.nextInt(variableCount);

        int substituted = bdd.subst(node, variable, replacement);
        int expected = bdd.or(
                bdd.and(replacement, bdd.restrict(node, variable, true)),
                bdd.and(bdd.not(replacement), bdd.restrict(node, variable, false)));
        assertThat(substituted, is(expected));

        for (boolean[] valuation : valuations) {
            boolean replacementValue = bdd.evaluate(replacement, valuation);
            assertThat(bdd.evaluate(substituted, valuation),
                    is(bdd.evaluate(node, with(valuation, variable, replacementValue))));
        }

        assertThat(bdd.subst(node, variable, bdd.trueNode()), is(bdd.restrict(node, variable, true)));
        assertThat(bdd.subst(node, variable, bdd.falseNode()), is(bdd.restrict(node, variable, false)));
        assertThat(bdd.subst(node, variable, bdd.variableNode(variable)), is(node));
        if (!bdd.support(node).get(variable)) {
            assertThat(substituted, is(node));
        }
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("ternary")
    public void testSubstDistribution(DiagramGenerator.TernaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        int node = dataPoint.first;
        int replacement1 = dataPoint.second;
        int replacement2 = dataPoint.third;
        Random random = new Random(dataPoint.hashCode());

        BitSet candidates = new BitSet();
        candidates.set(0, variableCount);
        candidates.andNot(bdd.support(replacement2));
        assumeTrue(!candidates.isEmpty());
        int[] candidateArray = candidates.stream().toArray();
        int variable1 = candidateArray[random.nextInt(candidateArray.length)];
        int variable2 = (variable1 + 1 + random.nextInt(variableCount - 1)) % variableCount;
        assertThat(variable1, not(variable2));

        int left = bdd.subst(bdd.subst(node, variable1, replacement1), variable2, replacement2);
        int right = bdd.subst(
                bdd.subst(node, variable2, replacement2), variable1, bdd.subst(replacement1, variable2, replacement2));
        assertThat(left, is(right));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("unary")
    public void testSubstSet(DiagramGenerator.UnaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        int node = dataPoint.node;
        Random random = new Random(dataPoint.hashCode());

        Map<Integer, Integer> replacements = new HashMap<>();
        for (int variable = 0; variable < variableCount; variable++) {
            if (random.nextInt(3) == 0) {
                replacements.put(variable, randomNode(bdd, random));
            }
        }

        int substituted = bdd.substSet(node, replacements);
        for (boolean[] valuation : valuations) {
            boolean[] replaced = valuation.clone();
            replacements.forEach((variable, replacement) ->
                    replaced[variable] = bdd.evaluate(replacement, valuation));
            assertThat(bdd.evaluate(substituted, valuation), is(bdd.evaluate(node, replaced)));
        }

        int[] mapping = new int[variableCount];
        for (int variable = 0; variable < variableCount; variable++) {
            mapping[variable] = replacements.getOrDefault(variable, bdd.placeholder());
        }
        assertThat(bdd.compose(node, mapping), is(substituted));

        assertThat(bdd.substSet(node, Map.of()), is(node));
        Map<Integer, Integer> identity = new HashMap<>();
        for (int variable = 0; variable < variableCount; variable++) {
            identity.put(variable, bdd.variableNode(variable));
        }
        assertThat(bdd.substSet(node, identity), is(node));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("unary")
    public void testSubstSetMatchesSequentialSubst(DiagramGenerator.UnaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        int node = dataPoint.node;
        Random random = new Random(dataPoint.hashCode());

        // Replace the lower half of the variables by functions over the upper half
        Map<Integer, Integer> replacements = new HashMap<>();
        int half = variableCount / 2;
        for (int variable = 0; variable < half; variable++) {
            if (random.nextBoolean()) {
                int replacement = randomNode(bdd, random);
                Map<Integer, Boolean> eliminate = new HashMap<>();
                for (int other = 0; other < half; other++) {
                    eliminate.put(other, random.nextBoolean());
                }
                replacements.put(variable, bdd.restrictSet(replacement, eliminate));
            }
        }

        int sequential = node;
        for (Map.Entry<Integer, Integer> entry : replacements.entrySet()) {
            sequential = bdd.subst(sequential, entry.getKey(), entry.getValue());
        }
        assertThat(bdd.substSet(node, replacements), is(sequential));

        for (Map.Entry<Integer, Integer> entry : replacements.entrySet()) {
            assertThat(bdd.substSet(node, Map.of(entry.getKey(), entry.getValue())),
                    is(bdd.subst(node, entry.getKey(), entry.getValue())));
        }
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("unary")
    public void testShrink(DiagramGenerator.UnaryDataPoint dataPoint) {
        Bdd bdd = dataPoint.bdd;
        int node = dataPoint.node;

        for (int shrunk : DiagramGenerator.shrink(bdd, node)) {
            assertThat(treeSize(bdd, shrunk) < treeSize(bdd, node), is(true));
        }
    }

    private static long treeSize(Bdd bdd, int node) {
        return bdd.foldStrict(node, 0L, 0L, (variable, low, high) -> low + high + 1L);
    }
}
