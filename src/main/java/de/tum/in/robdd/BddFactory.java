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

import java.util.Comparator;
import java.util.function.Function;

public final class BddFactory {
    private BddFactory() {}

    public static Bdd buildBdd() {
        return buildBdd(ItemOrder.natural());
    }

    public static Bdd buildBdd(ItemOrder order) {
        return buildBdd(order, ImmutableBddConfiguration.builder().build());
    }

    public static Bdd buildBdd(BddConfiguration configuration) {
        return buildBdd(ItemOrder.natural(), configuration);
    }

    public static Bdd buildBdd(ItemOrder order, BddConfiguration configuration) {
        BddImpl bdd = new BddImpl(order, configuration);
        return configuration.threadSafetyCheck() ? new CheckedBdd(bdd) : bdd;
    }

    /**
     * Runs the given computation on a fresh diagram under the given order. Nodes of the diagram must
     * not escape the computation.
     */
    public static <R> R withOrder(ItemOrder order, Function<? super Bdd, R> computation) {
        return computation.apply(buildBdd(order));
    }

    public static <R> R withDefaultOrder(Function<? super Bdd, R> computation) {
        return withOrder(ItemOrder.natural(), computation);
    }

    public static <R> R withCustomOrder(Comparator<Integer> comparator, Function<? super Bdd, R> computation) {
        return withOrder(ItemOrder.of(comparator), computation);
    }
}
