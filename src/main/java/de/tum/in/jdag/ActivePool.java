/*
 * This file is part of JDAG.
 * Copyright (c) 2023 Tobias Meggendorfer.
 *
 * JDAG is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JDAG is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JDAG. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jdag;

import static de.tum.in.jdag.Util.checkState;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Process-wide register of the pool which receives the nodes created through {@link Dags}.
 *
 * <p>The register is a single mutable cell without any synchronization. Bindings are expected to
 * be strictly nested, and the register must not be used from more than one thread.</p>
 */
public final class ActivePool {
    private static final Logger logger = Logger.getLogger(ActivePool.class.getName());
    private static final NodeSink sink = ActivePool::intern;

    @Nullable
    private static NodePool current = null;

    private ActivePool() {}

    /**
     * Registers {@code pool} as the active pool.
     *
     * @param pool The pool to be bound, or {@code null} to unbind.
     * @return The pool which was bound before this call.
     */
    @Nullable
    public static NodePool bind(@Nullable NodePool pool) {
        NodePool previous = current;
        current = pool;
        return previous;
    }

    /**
     * Binds {@code pool} until the returned binding is closed, which restores the previously bound
     * pool. Intended for try-with-resources.
     */
    public static Binding scoped(NodePool pool) {
        Objects.requireNonNull(pool);
        return new Binding(pool, bind(pool));
    }

    /**
     * Returns a sink which interns into the pool that is bound at the time of each call.
     */
    public static NodeSink sink() {
        return sink;
    }

    private static DagNode intern(int depth, DagNode negative, DagNode positive) {
        NodePool pool = current;
        checkState(pool != null, "No node pool is bound");
        return pool.intern(depth, negative, positive);
    }

    public static final class Binding implements AutoCloseable {
        private final NodePool pool;
        @Nullable
        private final NodePool previous;
        private boolean closed = false;

        private Binding(NodePool pool, @Nullable NodePool previous) {
            this.pool = pool;
            this.previous = previous;
        }

        public NodePool pool() {
            return pool;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            if (current != pool) {
                logger.log(Level.WARNING, "Restoring {0} while {1} is bound instead of {2}", new Object[] {
                    previous, current, pool
                });
            }
            current = previous;
        }
    }
}
