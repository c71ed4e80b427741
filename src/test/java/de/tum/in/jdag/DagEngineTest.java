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

import static de.tum.in.jdag.DagNode.ONE;
import static de.tum.in.jdag.DagNode.ZERO;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;

public class DagEngineTest {
    private final NodePool input = NodePools.create();
    private final DagEngine inputEngine = new DagEngine(input);

    @Test
    public void testLiteralShape() {
        DagNode positive = inputEngine.literal(3, true);
        assertThat(positive.depth(), is(3));
        assertThat(positive.negative(), sameInstance(ZERO));
        assertThat(positive.positive(), sameInstance(ONE));
        assertThat(DagNodes.isLiteral(positive), is(true));

        DagNode negative = inputEngine.literal(3, false);
        assertThat(negative.depth(), is(3));
        assertThat(negative.negative(), sameInstance(ONE));
        assertThat(negative.positive(), sameInstance(ZERO));
        assertThat(DagNodes.isNegatedLiteral(negative), is(true));

        assertThat(inputEngine.literal(3, true), sameInstance(positive));
        assertThat(input.size(), is(2));
    }

    @Test
    public void testLiteralNegativeIndex() {
        assertThrows(IllegalArgumentException.class, () -> inputEngine.literal(-1, true));
    }

    @Test
    public void testInvertIntoResultPool() {
        DagNode a = inputEngine.literal(0, true);
        DagNode bBar = inputEngine.literal(1, false);

        try (NodePool result = NodePools.create()) {
            DagEngine resultEngine = new DagEngine(result);

            DagNode aBar = resultEngine.invert(a);
            assertThat(aBar.negative(), sameInstance(ONE));
            assertThat(aBar.positive(), sameInstance(ZERO));

            DagNode b = resultEngine.invert(bBar);
            assertThat(b.depth(), is(1));
            assertThat(b.negative(), sameInstance(ZERO));
            assertThat(b.positive(), sameInstance(ONE));

            assertThat(result.size(), is(2));
            assertThat(result.contains(aBar), is(true));
            assertThat(input.contains(aBar), is(false));
            assertThat(input.size(), is(2));
        }
    }

    @Test
    public void testInvertTerminals() {
        assertThat(inputEngine.invert(ZERO), sameInstance(ONE));
        assertThat(inputEngine.invert(ONE), sameInstance(ZERO));
        assertThat(input.size(), is(0));
    }

    @Test
    public void testInvertSharedNodeOnce() {
        // Both branches of the root lead to the same node at depth 2
        DagNode shared = inputEngine.literal(2, true);
        DagNode inner = input.intern(1, shared, ONE);
        DagNode root = input.intern(0, inner, shared);

        try (NodePool result = NodePools.create()) {
            DagNode inverted = new DagEngine(result).invert(root);
            assertThat(result.size(), is(3));
            assertThat(inverted.positive(), sameInstance(inverted.negative().negative()));
        }
    }

    @Test
    public void testDisjoinComplementaryLiterals() {
        DagNode aBar = inputEngine.literal(0, false);
        DagNode a = inputEngine.literal(0, true);

        try (NodePool result = NodePools.create()) {
            DagNode disjunction = new DagEngine(result).disjoin(aBar, a);

            assertThat(disjunction, sameInstance(ONE));
            // Both cofactors collapse to ONE, the redundant test is never stored
            assertThat(result.size(), is(0));
        }
    }

    @Test
    public void testDisjoinIndependentLiterals() {
        DagNode aBar = inputEngine.literal(0, false);
        DagNode bBar = inputEngine.literal(1, false);
        DagNode b = inputEngine.literal(1, true);

        try (NodePool result = NodePools.create()) {
            DagNode disjunction = new DagEngine(result).disjoin(aBar, bBar);

            assertThat(result.size(), is(1));
            assertThat(disjunction.depth(), is(0));
            assertThat(disjunction.negative(), sameInstance(ONE));
            assertThat(disjunction.positive(), sameInstance(bBar));
            assertThat(disjunction.positive().negative(), sameInstance(ONE));
            assertThat(disjunction.positive().positive(), sameInstance(ZERO));
        }

        try (NodePool result = NodePools.create()) {
            DagNode disjunction = new DagEngine(result).disjoin(aBar, b);

            assertThat(result.size(), is(1));
            assertThat(disjunction.negative(), sameInstance(ONE));
            assertThat(disjunction.positive().negative(), sameInstance(ZERO));
            assertThat(disjunction.positive().positive(), sameInstance(ONE));
        }
    }

    @Test
    public void testDepthMismatch() {
        DagNode shallow = inputEngine.literal(0, true);
        DagNode deep = inputEngine.literal(5, true);

        DagNode or = inputEngine.disjoin(shallow, deep);
        assertThat(or.depth(), is(0));
        assertThat(or.negative(), sameInstance(deep));
        assertThat(or.positive(), sameInstance(ONE));
        assertThat(inputEngine.disjoin(deep, shallow), sameInstance(or));

        DagNode and = inputEngine.conjoin(deep, shallow);
        assertThat(and.depth(), is(0));
        assertThat(and.negative(), sameInstance(ZERO));
        assertThat(and.positive(), sameInstance(deep));

        boolean[] assignment = new boolean[6];
        for (int bits = 0; bits < (1 << 6); bits++) {
            for (int variable = 0; variable < 6; variable++) {
                assignment[variable] = (bits & (1 << variable)) != 0;
            }
            assertThat(DagNodes.evaluate(or, assignment), is(assignment[0] || assignment[5]));
            assertThat(DagNodes.evaluate(and, assignment), is(assignment[0] && assignment[5]));
        }
    }

    @Test
    public void testDepthMismatchBelowRoot() {
        // (x0 & x3) | x1: the join has to descend into x0 & x3 while pinning x1
        DagNode x0x3 = inputEngine.conjoin(inputEngine.literal(0, true), inputEngine.literal(3, true));
        DagNode x1 = inputEngine.literal(1, true);
        DagNode or = inputEngine.disjoin(x0x3, x1);

        assertThat(or.depth(), is(0));
        assertThat(or.negative(), sameInstance(x1));
        DagNode positive = or.positive();
        assertThat(positive.depth(), is(1));
        assertThat(positive.negative().depth(), is(3));
        assertThat(positive.positive(), sameInstance(ONE));
        assertThat(DagNodes.support(or).cardinality(), is(3));
        assertThat(input.check(), is(true));
    }

    @Test
    public void testJoinRawConnective() {
        DagNode a = inputEngine.literal(0, true);
        DagNode b = inputEngine.literal(1, true);

        assertThat(inputEngine.join(ZERO, ONE, a, b), sameInstance(inputEngine.disjoin(a, b)));
        assertThat(inputEngine.join(ONE, ZERO, a, b), sameInstance(inputEngine.conjoin(a, b)));
        assertThrows(IllegalArgumentException.class, () -> inputEngine.join(ONE, ONE, a, b));
        assertThrows(IllegalArgumentException.class, () -> inputEngine.join(a, ONE, a, b));
    }

    @Test
    public void testJoinIterable() {
        DagNode a = inputEngine.literal(0, true);
        DagNode b = inputEngine.literal(1, true);
        DagNode c = inputEngine.literal(2, true);

        assertThat(inputEngine.join(Connective.OR, List.of(a, b, c)), sameInstance(inputEngine.disjoin(a, b, c)));
        assertThat(inputEngine.join(Connective.AND, List.of(c, a)), sameInstance(inputEngine.conjoin(a, c)));
        assertThrows(IllegalArgumentException.class, () -> inputEngine.join(Connective.OR, List.of(a)));
        assertThrows(IllegalArgumentException.class, () -> inputEngine.join(Connective.AND, List.of()));
    }

    @Test
    public void testDisjoinManyLiterals() {
        DagNode[] literals = new DagNode[10];
        for (int i = 0; i < literals.length; i++) {
            literals[i] = inputEngine.literal(i, i % 2 == 0);
        }
        DagNode or = inputEngine.disjoin(literals[0], literals[1], literals);
        assertThat(DagNodes.nodeCount(or), is(10));
        assertThat(DagNodes.evaluate(or, new boolean[] {false, true, false, true, false, true, false, true, false, true}),
                is(false));
        assertThat(inputEngine.invert(or), sameInstance(inputEngine.conjoin(
                inputEngine.invert(literals[0]), inputEngine.invert(literals[1]), invertAll(literals))));
    }

    private DagNode[] invertAll(DagNode[] nodes) {
        DagNode[] inverted = new DagNode[nodes.length];
        for (int i = 0; i < nodes.length; i++) {
            inverted[i] = inputEngine.invert(nodes[i]);
        }
        return inverted;
    }

    @Test
    public void testQueens() {
        assertThat(DagBuilder.countSolutions(DagBuilder.makeQueens(inputEngine, 4), 16), is(BigInteger.valueOf(2)));
        assertThat(DagBuilder.countSolutions(DagBuilder.makeQueens(inputEngine, 5), 25), is(BigInteger.valueOf(10)));
        assertThat(DagBuilder.countSolutions(DagBuilder.makeQueens(inputEngine, 6), 36), is(BigInteger.valueOf(4)));
        assertThat(input.check(), is(true));
    }

    @Test
    public void testTerminalsAreDistinct() {
        assertThat(ZERO, not(ONE));
        assertThat(ZERO.isTerminal(), is(true));
        assertThat(ONE.isTerminal(), is(true));
        assertThrows(IllegalStateException.class, ZERO::negative);
        assertThrows(IllegalStateException.class, ONE::positive);
    }
}
