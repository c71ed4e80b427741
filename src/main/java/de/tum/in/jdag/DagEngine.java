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
import static de.tum.in.jdag.Util.checkArgument;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/* Implementation notes:
 * - Each top-level call uses its own cache, which is discarded afterwards. Nothing is shared
 *   between calls, so the memory of an operation is bounded by the size of its operands.
 * - Cache keys compare nodes by identity. This is sound since nodes of one pool lineage are
 *   canonical.
 */
/**
 * Boolean operations on decision diagrams. All created nodes are interned into the sink given at
 * construction, while the operands may live in any pool.
 *
 * <p>All operands of one call have to share one variable order, i.e. along every edge the depth
 * strictly increases. This is only checked by assertions.</p>
 */
public final class DagEngine {
    private final NodeSink sink;

    public DagEngine(NodeSink sink) {
        this.sink = Objects.requireNonNull(sink);
    }

    public NodeSink sink() {
        return sink;
    }

    /**
     * Constructs the node representing the variable {@code variable} (if {@code polarity} is true)
     * or its negation.
     */
    public DagNode literal(int variable, boolean polarity) {
        checkArgument(variable >= 0, "Negative variable index %d", variable);
        return polarity ? sink.intern(variable, ZERO, ONE) : sink.intern(variable, ONE, ZERO);
    }

    // Negation

    /**
     * Constructs the node representing {@code NOT node}.
     */
    public DagNode invert(DagNode node) {
        return invertRecursive(node, new IdentityHashMap<>());
    }

    private DagNode invertRecursive(DagNode node, Map<DagNode, DagNode> cache) {
        if (node == ZERO) {
            return ONE;
        }
        if (node == ONE) {
            return ZERO;
        }

        DagNode cached = cache.get(node);
        if (cached != null) {
            return cached;
        }

        DagNode negative = invertRecursive(node.negative(), cache);
        DagNode positive = invertRecursive(node.positive(), cache);
        DagNode result = sink.intern(node.depth(), negative, positive);
        cache.put(node, result);
        return result;
    }

    // Join

    /**
     * Constructs the node representing {@code x OR y OR ...}.
     */
    public DagNode disjoin(DagNode x, DagNode y, DagNode... more) {
        return join(Connective.OR, x, y, more);
    }

    /**
     * Constructs the node representing {@code x AND y AND ...}.
     */
    public DagNode conjoin(DagNode x, DagNode y, DagNode... more) {
        return join(Connective.AND, x, y, more);
    }

    /**
     * Combines the operands under the connective given by its {@code identity} and {@code
     * annihilator}, which have to be the two distinct terminals.
     */
    public DagNode join(DagNode identity, DagNode annihilator, DagNode x, DagNode y, DagNode... more) {
        return join(Connective.of(identity, annihilator), x, y, more);
    }

    /**
     * Combines the operands under {@code connective}, folding from left to right. Each step of the
     * fold uses a fresh cache.
     */
    public DagNode join(Connective connective, DagNode x, DagNode y, DagNode... more) {
        DagNode result = joinPair(connective, x, y);
        for (DagNode operand : more) {
            result = joinPair(connective, result, operand);
        }
        return result;
    }

    /**
     * Combines the given operands under {@code connective}, folding from left to right.
     *
     * @throws IllegalArgumentException if less than two operands are given.
     */
    public DagNode join(Connective connective, Iterable<DagNode> operands) {
        Iterator<DagNode> iterator = operands.iterator();
        checkArgument(iterator.hasNext(), "Join needs at least two operands, got none");
        DagNode result = iterator.next();
        checkArgument(iterator.hasNext(), "Join needs at least two operands, got only %s", result);
        while (iterator.hasNext()) {
            result = joinPair(connective, result, iterator.next());
        }
        return result;
    }

    private DagNode joinPair(Connective connective, DagNode x, DagNode y) {
        Objects.requireNonNull(x);
        Objects.requireNonNull(y);
        return joinRecursive(connective.identity(), connective.annihilator(), x, y, new HashMap<>());
    }

    private DagNode joinRecursive(
            DagNode identity, DagNode annihilator, DagNode x, DagNode y, Map<NodePair, DagNode> cache) {
        if (x == identity) {
            return y;
        }
        if (y == identity) {
            return x;
        }
        if (x == annihilator || y == annihilator) {
            return annihilator;
        }

        NodePair key = new NodePair(x, y);
        DagNode cached = cache.get(key);
        if (cached != null) {
            return cached;
        }

        int xDepth = x.depth();
        int yDepth = y.depth();

        // The deeper operand does not test the variable at this level, it is pinned as both of its
        // cofactors.
        DagNode xNegative;
        DagNode xPositive;
        if (xDepth > yDepth) {
            xNegative = x;
            xPositive = x;
        } else {
            xNegative = x.negative();
            xPositive = x.positive();
        }
        DagNode yNegative;
        DagNode yPositive;
        if (yDepth > xDepth) {
            yNegative = y;
            yPositive = y;
        } else {
            yNegative = y.negative();
            yPositive = y.positive();
        }

        DagNode negative = joinRecursive(identity, annihilator, xNegative, yNegative, cache);
        DagNode positive = joinRecursive(identity, annihilator, xPositive, yPositive, cache);
        DagNode result = sink.intern(Math.min(xDepth, yDepth), negative, positive);
        cache.put(key, result);
        return result;
    }

    /**
     * Unordered pair of nodes, compared by identity.
     */
    static final class NodePair {
        private final DagNode first;
        private final DagNode second;

        NodePair(DagNode first, DagNode second) {
            this.first = first;
            this.second = second;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof NodePair)) {
                return false;
            }
            NodePair other = (NodePair) o;
            return (first == other.first && second == other.second)
                    || (first == other.second && second == other.first);
        }

        @Override
        public int hashCode() {
            return HashUtil.symmetricHash(first.hashCode(), second.hashCode());
        }

        @Override
        public String toString() {
            return "{" + first + ", " + second + "}";
        }
    }
}
