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

import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;

/**
 * Fails fast with an {@link IllegalStateException} when a second thread enters the instance while
 * another operation is still running. The offending call is rejected before it reaches the
 * delegate; the running operation is not affected.
 */
public final class CheckedBdd extends DelegatingBdd {
    private final AtomicReference<Access> current = new AtomicReference<>();

    public CheckedBdd(Bdd delegate) {
        super(delegate);
    }

    @Override
    protected void onEnter(String name) {
        Access access = new Access(name, Thread.currentThread());
        if (!current.compareAndSet(null, access)) {
            throw new IllegalStateException(String.format(
                    "Concurrent access to %s from %s while %s", name, access.thread.getName(), current.get()));
        }
    }

    @Override
    protected void onExit(String name) {
        Access access = current.getAndSet(null);
        if (access == null || access.thread != Thread.currentThread()) {
            throw new IllegalStateException(String.format("Concurrently accessed during %s", name));
        }
    }

    /** The operation currently holding the instance, if any. */
    @Nullable
    String runningOperation() {
        Access access = current.get();
        return access == null ? null : access.name;
    }

    private static final class Access {
        final String name;
        final Thread thread;

        Access(String name, Thread thread) {
            this.name = name;
            this.thread = thread;
        }

        @Override
        public String toString() {
            return name + " is running on " + thread.getName();
        }
    }
}
