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

import java.util.Arrays;
import java.util.BitSet;
import java.util.HashMap;
import java.util.Map;
import java.util.function.IntPredicate;
import javax.annotation.Nullable;

final class DiagramFactoryImpl implements DiagramFactory {
    private final Bdd bdd;
    private final DiagramImpl trueDiagram;
    private final DiagramImpl falseDiagram;

    /* Canonical handle of each branch node, indexed by node */
    private DiagramImpl[] diagrams = new DiagramImpl[64];

    DiagramFactoryImpl(Bdd bdd) {
        this.bdd = bdd;
        trueDiagram = new DiagramImpl(this, bdd.trueNode());
        falseDiagram = new DiagramImpl(this, bdd.falseNode());
    }

    DiagramImpl make(int node) {
        if (node == bdd.trueNode()) {
            return trueDiagram;
        }
        if (node == bdd.falseNode()) {
            return falseDiagram;
        }
        assert node > 0 : "Invalid node " + node;
        if (node >= diagrams.length) {
            diagrams = Arrays.copyOf(diagrams, Math.max(node + 1, diagrams.length * 2));
        }
        DiagramImpl diagram = diagrams[node];
        if (diagram == null) {
            diagram = new DiagramImpl(this, node);
            diagrams[node] = diagram;
        }
        return diagram;
    }

    private int node(Diagram diagram) {
        assert (diagram instanceof DiagramImpl) && (this == ((DiagramImpl) diagram).factory)
                : "Diagram " + diagram + " belongs to a different factory";
        return ((DiagramImpl) diagram).node;
    }

    @Override
    public Bdd bdd() {
        return bdd;
    }

    @Override
    public Diagram trueDiagram() {
        return trueDiagram;
    }

    @Override
    public Diagram falseDiagram() {
        return falseDiagram;
    }

    @Override
    public Diagram of(boolean booleanConstant) {
        return booleanConstant ? trueDiagram : falseDiagram;
    }

    @Override
    public Diagram var(int variable) {
        return make(bdd.variableNode(variable));
    }

    @Override
    public Diagram notVar(int variable) {
        return make(bdd.makeNode(variable, bdd.trueNode(), bdd.falseNode()));
    }

    @Override
    public Diagram of(int node) {
        return make(node);
    }

    @Override
    public Diagram branch(int variable, Diagram low, Diagram high) {
        return make(bdd.makeNode(variable, node(low), node(high)));
    }

    @Override
    public String statistics() {
        return bdd.statistics();
    }

    @Override
    public String toString() {
        return String.format("F{%s}", bdd);
    }

    static final class DiagramImpl implements Diagram {
        private final DiagramFactoryImpl factory;
        private final int node;

        @Nullable
        private BitSet supportCache;

        DiagramImpl(DiagramFactoryImpl factory, int node) {
            this.factory = factory;
            this.node = node;
        }

        private Diagram make(int node) {
            return node == this.node ? this : factory.make(node);
        }

        @Override
        public DiagramFactory factory() {
            return factory;
        }

        @Override
        public int node() {
            return node;
        }

        @Override
        public boolean isTrue() {
            return this == factory.trueDiagram;
        }

        @Override
        public boolean isFalse() {
            return this == factory.falseDiagram;
        }

        @Override
        public boolean isLeaf() {
            return isTrue() || isFalse();
        }

        @Override
        public int variable() {
            return factory.bdd.variableOf(node);
        }

        @Override
        public Diagram low() {
            return isLeaf() ? this : make(factory.bdd.low(node));
        }

        @Override
        public Diagram high() {
            return isLeaf() ? this : make(factory.bdd.high(node));
        }

        @Override
        public Diagram not() {
            return make(factory.bdd.not(node));
        }

        @Override
        public Diagram and(Diagram other) {
            return make(factory.bdd.and(node, factory.node(other)));
        }

        @Override
        public Diagram or(Diagram other) {
            return make(factory.bdd.or(node, factory.node(other)));
        }

        private BitSet getSupport() {
            if (supportCache == null) {
                supportCache = factory.bdd.support(node);
            }
            return supportCache;
        }

        @Override
        public BitSet support() {
            return (BitSet) getSupport().clone();
        }

        @Override
        public boolean evaluate(IntPredicate assignment) {
            return factory.bdd.evaluate(node, assignment);
        }

        @Override
        public Diagram restrict(int variable, boolean value) {
            return make(factory.bdd.restrict(node, variable, value));
        }

        @Override
        public Diagram restrictSet(Map<Integer, Boolean> assignment) {
            return make(factory.bdd.restrictSet(node, assignment));
        }

        @Override
        public Diagram restrictLaw(Diagram law) {
            return make(factory.bdd.restrictLaw(node, factory.node(law)));
        }

        @Override
        public Diagram subst(int variable, Diagram replacement) {
            return make(factory.bdd.subst(node, variable, factory.node(replacement)));
        }

        @Override
        public Diagram substSet(Map<Integer, Diagram> replacements) {
            Map<Integer, Integer> nodes = new HashMap<>();
            replacements.forEach((variable, replacement) -> nodes.put(variable, factory.node(replacement)));
            return make(factory.bdd.substSet(node, nodes));
        }

        @Nullable
        @Override
        public <R> R fold(@Nullable R forFalse, @Nullable R forTrue, BranchFunction<R> combine) {
            return factory.bdd.fold(node, forFalse, forTrue, combine);
        }

        @Override
        public <R> R foldStrict(R forFalse, R forTrue, BranchFunction<R> combine) {
            return factory.bdd.foldStrict(node, forFalse, forTrue, combine);
        }

        @Override
        public int nodeCount() {
            return factory.bdd.nodeCount(node);
        }

        @Override
        public boolean equals(Object o) {
            assert (this == o) == (o instanceof DiagramImpl && this.node == ((DiagramImpl) o).node)
                    || (o instanceof DiagramImpl && this.factory != ((DiagramImpl) o).factory);
            return this == o;
        }

        @Override
        public int hashCode() {
            return HashUtil.hash(node);
        }

        @Override
        public String toString() {
            return String.format("%d@[%s]", node, factory);
        }
    }
}
