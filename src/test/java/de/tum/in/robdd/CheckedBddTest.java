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
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

public class CheckedBddTest {
    @Test
    public void testSequentialAccess() {
        Bdd bdd = BddFactory.buildBdd(ItemOrder.natural(),
                ImmutableBddConfiguration.builder().threadSafetyCheck(true).build());
        assertThat(bdd, instanceOf(CheckedBdd.class));

        int x0 = bdd.variableNode(0);
        int x1 = bdd.variableNode(1);
        assertThat(bdd.andAll(x0, x1), is(bdd.and(x0, x1)));
        assertThat(bdd.compose(bdd.and(x0, x1), new int[] {x1}), is(x1));
    }

    @Test
    public void testConcurrentAccess() throws InterruptedException {
        Bdd bdd = BddFactory.buildBdd(ItemOrder.natural(),
                ImmutableBddConfiguration.builder().threadSafetyCheck(true).build());
        int node = bdd.or(bdd.variableNode(0), bdd.variableNode(1));

        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread folding = new Thread(() -> {
            try {
                bdd.fold(node, null, null, (variable, low, high) -> {
                    entered.countDown();
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IllegalStateException(e);
                    }
                    return null;
                });
            } catch (RuntimeException e) {
                failure.set(e);
            }
        });
        folding.start();

        assertThat(entered.await(10, TimeUnit.SECONDS), is(true));
        assertThat(((CheckedBdd) bdd).runningOperation(), is("fold"));
        IllegalStateException exception = assertThrows(IllegalStateException.class, () -> bdd.not(node));
        assertThat(exception.getMessage(), containsString("not"));
        assertThat(exception.getMessage(), containsString("fold is running"));
        release.countDown();
        folding.join();
        assertThat(failure.get() == null, is(true));

        // Access is possible again once the fold has finished
        assertThat(bdd.not(bdd.not(node)), is(node));
    }

    @Test
    public void testAccessAfterArgumentError() {
        Bdd bdd = BddFactory.buildBdd(ItemOrder.natural(),
                ImmutableBddConfiguration.builder().threadSafetyCheck(true).build());

        assertThrows(IllegalArgumentException.class, () -> bdd.variableNode(-1));
        assertThat(((CheckedBdd) bdd).runningOperation(), nullValue());
        int x3 = bdd.variableNode(3);
        assertThat(bdd.variableOf(x3), is(3));
    }

    @Test
    public void testAccessAfterFailedFold() {
        Bdd bdd = BddFactory.buildBdd(ItemOrder.natural(),
                ImmutableBddConfiguration.builder().threadSafetyCheck(true).build());
        int node = bdd.and(bdd.variableNode(0), bdd.variableNode(1));

        assertThrows(NullPointerException.class,
                () -> bdd.foldStrict(node, 0, 1, (variable, low, high) -> null));
        assertThat(((CheckedBdd) bdd).runningOperation(), nullValue());
        assertThat(bdd.not(bdd.not(node)), is(node));
    }
}
