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

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Builds some well-known constraint problems, used for regression tests and benchmarks.
 */
@SuppressWarnings("checkstyle:javadoc")
public final class DagBuilder {
    private DagBuilder() {}

    /* Object-Oriented version of the N-Queens problem, variable r * n + c denotes a queen at (r, c) */
    public static DagNode makeQueens(DagEngine engine, int n) {
        DagNode queen = DagNode.ONE;

        DagNode[][] x = new DagNode[n][n];
        DagNode[][] notX = new DagNode[n][n];
        int var = 0;
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                x[r][c] = engine.literal(var, true);
                notX[r][c] = engine.invert(x[r][c]);
                var += 1;
            }
        }

        // Queen in each row
        for (int r = 0; r < n; r++) {
            DagNode cond = DagNode.ZERO;
            for (int c = 0; c < n; c++) {
                cond = engine.disjoin(cond, x[r][c]);
            }
            queen = engine.conjoin(queen, cond);
        }

        // Constraints
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                DagNode cond = DagNode.ONE;

                // No two in same row
                for (int oc = 0; oc < n; oc++) {
                    if (oc != c) {
                        cond = engine.conjoin(cond, engine.disjoin(notX[r][c], notX[r][oc]));
                    }
                }

                // Diagonal
                for (int or = 0; or < n; or++) {
                    int drc = c + or - r;
                    if (or != r && 0 <= drc && drc < n) {
                        cond = engine.conjoin(cond, engine.disjoin(notX[r][c], notX[or][drc]));
                    }
                    int ulc = c + r - or;
                    if (or != r && 0 <= ulc && ulc < n) {
                        cond = engine.conjoin(cond, engine.disjoin(notX[r][c], notX[or][ulc]));
                    }
                }

                // No two in same column
                for (int or = 0; or < n; or++) {
                    if (or != r) {
                        cond = engine.conjoin(cond, engine.disjoin(notX[r][c], notX[or][c]));
                    }
                }

                queen = engine.conjoin(queen, cond);
            }
        }
        return queen;
    }

    /**
     * Counts the assignments to the variables {@code 0, ..., variableCount - 1} under which
     * {@code node} evaluates to {@code true}.
     */
    public static BigInteger countSolutions(DagNode node, int variableCount) {
        return countSolutions(node, variableCount, new HashMap<>()).shiftLeft(Math.min(node.depth(), variableCount));
    }

    private static BigInteger countSolutions(DagNode node, int variableCount, Map<DagNode, BigInteger> cache) {
        if (node == DagNode.ZERO) {
            return BigInteger.ZERO;
        }
        if (node == DagNode.ONE) {
            return BigInteger.ONE;
        }
        BigInteger cached = cache.get(node);
        if (cached != null) {
            return cached;
        }
        BigInteger count = BigInteger.ZERO;
        for (DagNode child : new DagNode[] {node.negative(), node.positive()}) {
            int skipped = Math.min(child.depth(), variableCount) - node.depth() - 1;
            count = count.add(countSolutions(child, variableCount, cache).shiftLeft(skipped));
        }
        cache.put(node, count);
        return count;
    }
}
