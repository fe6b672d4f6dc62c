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
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

public class RandomBenchmark extends BaseBddBenchmark {
    private static final int VARIABLES = 32;

    @SuppressWarnings("StaticCollection")
    private static final List<BddOperation> OPERATION_LIST = List.of(
            n -> n.add(n.bdd.variableNode(n.random.nextInt(VARIABLES))),
            n -> n.add(n.bdd.not(n.get())),
            n -> n.add(n.bdd.and(n.get(), n.get())),
            n -> n.add(n.bdd.or(n.get(), n.get())),
            n -> {
                Map<Integer, Boolean> assignment = new HashMap<>();
                for (int i = 0; i < 10; i++) {
                    assignment.put(n.random.nextInt(VARIABLES), n.random.nextBoolean());
                }
                n.add(n.bdd.restrictSet(n.get(), assignment));
            },
            n -> n.add(n.bdd.restrictLaw(n.get(), n.get())),
            n -> n.add(n.bdd.subst(n.get(), n.random.nextInt(VARIABLES), n.get())),
            n -> {
                Map<Integer, Integer> replacements = new HashMap<>();
                for (int i = 0; i < 3; i++) {
                    replacements.put(n.random.nextInt(VARIABLES), n.get());
                }
                n.add(n.bdd.substSet(n.get(), replacements));
            },
            n -> n.bdd.support(n.get()));

    @FunctionalInterface
    private interface BddOperation {
        void run(BddNodes ops);
    }

    public static class BddNodes {
        public final Bdd bdd;
        public final Random random;
        private final Set<Integer> nodeSet = new HashSet<>();
        private final List<Integer> nodes = new ArrayList<>();

        public BddNodes(Bdd bdd, Random random) {
            this.bdd = bdd;
            this.random = random;
            for (int i = 0; i < VARIABLES; i++) {
                int variable = bdd.variableNode(i);
                add(variable);
                add(bdd.not(variable));
            }
        }

        public void add(int node) {
            if (nodeSet.add(node)) {
                nodes.add(node);
                if (nodes.size() > 200) {
                    int removed = nodes.remove(random.nextInt(nodes.size()));
                    nodeSet.remove(removed);
                }
            }
        }

        public int get() {
            return nodes.get(random.nextInt(nodes.size()));
        }
    }

    private static List<BddOperation> makeOperations(int count, Random random) {
        List<BddOperation> bddOperations = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            bddOperations.add(OPERATION_LIST.get(random.nextInt(OPERATION_LIST.size())));
        }
        return bddOperations;
    }

    @State(Scope.Benchmark)
    public static class RandomState extends BddState {
        private static final int SEED = 1234;
        private static final int OPERATION_COUNT = 5_000;

        public BddNodes nodes;
        public List<BddOperation> bddOperations;

        @Setup(Level.Trial)
        public void setUpOperations() {
            bddOperations = makeOperations(OPERATION_COUNT, new Random(SEED));
        }

        @Override
        @Setup(Level.Iteration)
        public void setUpBdd() {
            super.setUpBdd();
            nodes = new BddNodes(bdd(), new Random(SEED));
        }
    }

    @Benchmark
    public static void benchmarkRandom(RandomState state) {
        for (BddOperation operation : state.bddOperations) {
            operation.run(state.nodes);
        }
    }
}
