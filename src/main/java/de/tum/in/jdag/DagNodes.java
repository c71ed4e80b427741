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

import static de.tum.in.jdag.Util.checkArgument;

import java.util.BitSet;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Read-only queries on decision diagrams. None of these create nodes.
 */
public final class DagNodes {
    private DagNodes() {}

    /**
     * Checks whether the given {@code node} evaluates to {@code true} under {@code assignment},
     * where {@code assignment[i]} is the value of the variable at depth {@code i}.
     *
     * @throws IllegalArgumentException if a tested variable is not covered by the assignment.
     */
    public static boolean evaluate(DagNode node, boolean[] assignment) {
        DagNode current = node;
        while (!current.isTerminal()) {
            int depth = current.depth();
            checkArgument(depth < assignment.length, "No value for variable %d in assignment", depth);
            current = assignment[depth] ? current.positive() : current.negative();
        }
        return current == DagNode.ONE;
    }

    /**
     * Counts the distinct non-terminal nodes reachable from {@code node}, including itself.
     */
    public static int nodeCount(DagNode node) {
        int[] count = {0};
        forEachNodeBelowOnce(node, n -> count[0]++);
        return count[0];
    }

    /**
     * Returns the depths of all variables tested by {@code node}.
     */
    public static BitSet support(DagNode node) {
        BitSet support = new BitSet();
        forEachNodeBelowOnce(node, n -> support.set(n.depth()));
        return support;
    }

    public static boolean isLiteral(DagNode node) {
        return !node.isTerminal() && node.negative() == DagNode.ZERO && node.positive() == DagNode.ONE;
    }

    public static boolean isNegatedLiteral(DagNode node) {
        return !node.isTerminal() && node.negative() == DagNode.ONE && node.positive() == DagNode.ZERO;
    }

    /**
     * Generates a table of all nodes below the given {@code node}, one line per node.
     */
    public static String treeToString(DagNode node) {
        if (node.isTerminal()) {
            return String.format("Node %s%n", node);
        }
        StringBuilder builder = new StringBuilder(50)
                .append("Node ")
                .append(node)
                .append('\n')
                .append("     ID|DEPTH|NEGATIVE|POSITIVE\n");
        forEachNodeBelowOnce(
                node,
                child -> builder.append(String.format(
                                "  %5d|%5d|%8s|%8s",
                                child.id(),
                                child.depth(),
                                reference(child.negative()),
                                reference(child.positive())))
                        .append('\n'));
        return builder.toString();
    }

    private static String reference(DagNode node) {
        return node.isTerminal() ? node.toString() : "#" + node.id();
    }

    static void forEachNodeBelowOnce(DagNode node, Consumer<DagNode> action) {
        doForEachNodeBelowOnce(node, action, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static void doForEachNodeBelowOnce(DagNode node, Consumer<DagNode> action, Set<DagNode> visited) {
        if (node.isTerminal() || !visited.add(node)) {
            return;
        }
        action.accept(node);
        doForEachNodeBelowOnce(node.negative(), action, visited);
        doForEachNodeBelowOnce(node.positive(), action, visited);
    }
}
