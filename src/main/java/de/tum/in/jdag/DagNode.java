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

import java.util.HashSet;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * A decision node "test the variable at {@link #depth()}; if it is false continue with {@link
 * #negative()}, otherwise with {@link #positive()}", or one of the two terminals {@link #ZERO} and
 * {@link #ONE}.
 *
 * <p>Nodes are only created through {@link NodePool#intern(int, DagNode, DagNode)}. Since a pool
 * stores at most one node per {@code (depth, negative, positive)} triple, two nodes of the same pool
 * lineage represent the same function if and only if they are the same object. Hence, all
 * operations compare nodes with {@code ==}. {@link #equals(Object)} and {@link #hashCode()} are
 * structural and can be used to compare nodes which live in different pools.</p>
 */
public final class DagNode {
    /** The constant {@code false}. Not owned by any pool. */
    public static final DagNode ZERO = new DagNode(-2);
    /** The constant {@code true}. Not owned by any pool. */
    public static final DagNode ONE = new DagNode(-1);

    static final int TERMINAL_DEPTH = Integer.MAX_VALUE;

    private final int id;
    private final int depth;
    @Nullable
    private final DagNode negative;
    @Nullable
    private final DagNode positive;
    private final int hash;

    private DagNode(int id) {
        this.id = id;
        this.depth = TERMINAL_DEPTH;
        this.negative = null;
        this.positive = null;
        this.hash = id;
    }

    DagNode(int id, int depth, DagNode negative, DagNode positive) {
        assert id >= 0 && depth >= 0;
        this.id = id;
        this.depth = depth;
        this.negative = negative;
        this.positive = positive;
        this.hash = HashUtil.hash(depth, negative.hash, positive.hash);
    }

    /**
     * Index of this node inside its owning pool, negative for terminals.
     */
    int id() {
        return id;
    }

    public boolean isTerminal() {
        return negative == null;
    }

    /**
     * Returns the position of the tested variable in the global variable order. Terminals report
     * {@link Integer#MAX_VALUE}, i.e. they are deeper than any variable.
     */
    public int depth() {
        return depth;
    }

    public DagNode negative() {
        checkState(negative != null, "Terminals have no children");
        return negative;
    }

    public DagNode positive() {
        checkState(positive != null, "Terminals have no children");
        return positive;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DagNode)) {
            return false;
        }
        return structurallyEqual(this, (DagNode) o, new HashSet<>());
    }

    /* Pairs proven equal are remembered, so shared sub-graphs are compared once. A pair found
     * unequal ends the whole comparison, hence those need no memo. */
    private static boolean structurallyEqual(DagNode first, DagNode second, Set<DagEngine.NodePair> equalPairs) {
        if (first == second) {
            return true;
        }
        if (first.isTerminal() || second.isTerminal() || first.hash != second.hash || first.depth != second.depth) {
            return false;
        }
        DagEngine.NodePair pair = new DagEngine.NodePair(first, second);
        if (equalPairs.contains(pair)) {
            return true;
        }
        if (structurallyEqual(first.negative, second.negative, equalPairs)
                && structurallyEqual(first.positive, second.positive, equalPairs)) {
            equalPairs.add(pair);
            return true;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        if (this == ZERO) {
            return "0";
        }
        if (this == ONE) {
            return "1";
        }
        return String.format("#%d@%d[%s,%s]", id, depth, reference(negative), reference(positive));
    }

    private static String reference(DagNode node) {
        return node.isTerminal() ? node.toString() : "#" + node.id;
    }
}
