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

import javax.annotation.Nullable;

/**
 * Operations which intern their results into the pool currently bound to {@link ActivePool}.
 *
 * <p>Typical usage binds one pool for the operands and another one for the results:</p>
 *
 * <pre>{@code
 * try (NodePool input = NodePools.create(); NodePool result = NodePools.create()) {
 *     Dags.bind(input);
 *     DagNode a = Dags.literal(0, true);
 *     DagNode b = Dags.literal(1, false);
 *     Dags.bind(result);
 *     DagNode aOrB = Dags.disjoin(a, b);
 *     Dags.bind(null);
 * }
 * }</pre>
 *
 * @see DagEngine
 */
public final class Dags {
    private static final DagEngine engine = new DagEngine(ActivePool.sink());

    private Dags() {}

    /**
     * Shorthand for {@link ActivePool#bind(NodePool)}.
     */
    @Nullable
    public static NodePool bind(@Nullable NodePool pool) {
        return ActivePool.bind(pool);
    }

    public static DagNode literal(int variable, boolean polarity) {
        return engine.literal(variable, polarity);
    }

    public static DagNode invert(DagNode node) {
        return engine.invert(node);
    }

    public static DagNode disjoin(DagNode x, DagNode y, DagNode... more) {
        return engine.disjoin(x, y, more);
    }

    public static DagNode conjoin(DagNode x, DagNode y, DagNode... more) {
        return engine.conjoin(x, y, more);
    }

    public static DagNode join(DagNode identity, DagNode annihilator, DagNode x, DagNode y, DagNode... more) {
        return engine.join(identity, annihilator, x, y, more);
    }

    public static DagNode join(Connective connective, Iterable<DagNode> operands) {
        return engine.join(connective, operands);
    }
}
