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

public interface DiagramFactory {
    static DiagramFactory create() {
        return create(ItemOrder.natural());
    }

    static DiagramFactory create(ItemOrder order) {
        return create(BddFactory.buildBdd(order));
    }

    static DiagramFactory create(Bdd bdd) {
        return new DiagramFactoryImpl(bdd);
    }

    Bdd bdd();

    default ItemOrder order() {
        return bdd().order();
    }

    Diagram trueDiagram();

    Diagram falseDiagram();

    Diagram of(boolean booleanConstant);

    Diagram var(int variable);

    Diagram notVar(int variable);

    /**
     * Returns the diagram for the given node of {@link #bdd()}.
     */
    Diagram of(int node);

    Diagram branch(int variable, Diagram low, Diagram high);

    default Diagram andAll(Diagram... diagrams) {
        Diagram result = trueDiagram();
        for (Diagram diagram : diagrams) {
            result = result.and(diagram);
        }
        return result;
    }

    default Diagram orAll(Diagram... diagrams) {
        Diagram result = falseDiagram();
        for (Diagram diagram : diagrams) {
            result = result.or(diagram);
        }
        return result;
    }

    String statistics();
}
