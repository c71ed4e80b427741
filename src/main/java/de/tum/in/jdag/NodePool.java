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
import static de.tum.in.jdag.Util.checkState;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owning, canonicalizing store of {@link DagNode}s for one construction session.
 *
 * <p>The pool is append-only: nodes are never removed or modified, and every node returned by
 * {@link #intern(int, DagNode, DagNode)} stays valid until the pool is discarded. Within one pool
 * there is at most one node for each {@code (depth, negative, positive)} triple, where the children
 * are compared by identity. Children may live in other pools, which allows to keep intermediate
 * results and final results in separate pools.</p>
 *
 * <p>Pools are not thread safe.</p>
 */
public final class NodePool implements NodeSink, AutoCloseable {
    private static final Logger logger = Logger.getLogger(NodePool.class.getName());

    private static final int NOT_A_NODE = -1;
    private static final int MINIMUM_TABLE_SIZE = 11;
    private static final int MAXIMAL_NODE_COUNT = Integer.MAX_VALUE / 2 - 8;

    private final double growthFactor;
    private final boolean logStatisticsOnClose;
    private boolean closed = false;

    /* Stored nodes in creation order. The id of each node is its index in this array, all entries
     * from size on are null. */
    private DagNode[] nodes;
    private int size = 0;

    /* Hash map of the stored nodes. hashToChainStart maps each bucket to the first node of its
     * chain (or NOT_A_NODE), hashChain maps each node to the next node of the same chain. As nodes
     * are never removed, there is no free list. */
    private int[] hashToChainStart;
    private int[] hashChain;

    // Statistics
    private long internCalls = 0;
    private long reducedNodes = 0;
    private long hashChainLookups = 0;
    private long hashChainLookupLength = 0;
    private long hashChainLookupHit = 0;
    private long growCount = 0;

    NodePool(PoolConfiguration configuration) {
        this.growthFactor = configuration.growthFactor();
        this.logStatisticsOnClose = configuration.logStatisticsOnClose();
        int tableSize = Math.max(Primes.nextPrime(configuration.initialSize()), MINIMUM_TABLE_SIZE);

        nodes = new DagNode[tableSize];
        hashToChainStart = new int[tableSize];
        hashChain = new int[tableSize];
        Arrays.fill(hashToChainStart, NOT_A_NODE);
    }

    @Override
    public DagNode intern(int depth, DagNode negative, DagNode positive) {
        // Called for every node of every operation, the checks must not allocate
        checkState(!closed, "Node pool is closed");
        checkArgument(depth >= 0);
        Objects.requireNonNull(negative);
        Objects.requireNonNull(positive);
        assert negative.isTerminal() || depth < negative.depth() : "Child " + negative + " not below depth " + depth;
        assert positive.isTerminal() || depth < positive.depth() : "Child " + positive + " not below depth " + depth;

        internCalls += 1;
        if (negative == positive) {
            reducedNodes += 1;
            return negative;
        }

        int hashCode = HashUtil.hash(depth, negative.hashCode(), positive.hashCode());
        int bucket = hashToTable(hashCode);

        // Search for the node in the hash chain
        int chainLookups = 1;
        hashChainLookups += 1;
        int currentLookupNode = hashToChainStart[bucket];
        while (currentLookupNode != NOT_A_NODE) {
            DagNode candidate = nodes[currentLookupNode];
            if (matches(candidate, depth, negative, positive)) {
                hashChainLookupLength += chainLookups;
                hashChainLookupHit += 1;
                return candidate;
            }
            int next = hashChain[currentLookupNode];
            assert next != currentLookupNode;
            currentLookupNode = next;
            chainLookups += 1;
        }
        hashChainLookupLength += chainLookups;

        if (size == nodes.length) {
            grow();
            bucket = hashToTable(hashCode);
        }

        int id = size;
        DagNode node = new DagNode(id, depth, negative, positive);
        assert node.hashCode() == hashCode;
        nodes[id] = node;
        connectHashList(id, bucket);
        size += 1;
        return node;
    }

    private static boolean matches(DagNode node, int depth, DagNode negative, DagNode positive) {
        return node.depth() == depth && node.negative() == negative && node.positive() == positive;
    }

    private void connectHashList(int node, int bucket) {
        hashChain[node] = hashToChainStart[bucket];
        hashToChainStart[bucket] = node;
    }

    private int hashToTable(int hashCode) {
        return HashUtil.mod(hashCode, hashToChainStart.length);
    }

    /**
     * Enlarges the table by the configured growth factor and re-builds the hash chains.
     */
    private void grow() {
        checkState(size < MAXIMAL_NODE_COUNT, "Node pool %s exceeds the maximal node count", this);

        growCount += 1;
        int oldSize = nodes.length;
        @SuppressWarnings("NumericCastThatLosesPrecision")
        int target = (int) Math.min(MAXIMAL_NODE_COUNT, (long) Math.ceil(oldSize * growthFactor));
        int newSize = Math.min(MAXIMAL_NODE_COUNT, Primes.nextPrime(Math.max(target, oldSize + 1)));
        assert oldSize < newSize : "Got new size " + newSize + " with old size " + oldSize;

        logger.log(Level.FINE, "Growing the node pool {0} from {1} to {2}", new Object[] {this, oldSize, newSize});

        nodes = Arrays.copyOf(nodes, newSize);
        hashChain = new int[newSize];
        hashToChainStart = new int[newSize];
        Arrays.fill(hashToChainStart, NOT_A_NODE);
        for (int node = 0; node < size; node++) {
            connectHashList(node, hashToTable(nodes[node].hashCode()));
        }

        assert check();
        logger.log(Level.FINE, "Finished growing the node pool");
    }

    /**
     * Returns the number of nodes stored in this pool. Terminals are not counted.
     */
    public int size() {
        return size;
    }

    /**
     * Determines whether the given {@code node} is stored in this pool.
     */
    public boolean contains(DagNode node) {
        int id = node.id();
        return !node.isTerminal() && id < size && nodes[id] == node;
    }

    /**
     * Returns a snapshot of all stored nodes in creation order.
     */
    public List<DagNode> nodes() {
        return List.of(Arrays.copyOf(nodes, size));
    }

    public void forEach(Consumer<DagNode> action) {
        for (int node = 0; node < size; node++) {
            action.accept(nodes[node]);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Discards this pool. Afterwards, no further nodes can be interned and nodes obtained from this
     * pool must not be used for new operations anymore.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        logger.log(Level.FINE, "Closing node pool {0}", this);
        if (logStatisticsOnClose && logger.isLoggable(Level.INFO)) {
            logger.log(Level.INFO, statistics());
        }
    }

    // Integrity checks and utility

    /**
     * Performs some integrity / invariant checks.
     *
     * @return True. This way, check can easily be called by an {@code assert} statement.
     */
    boolean check() {
        logger.log(Level.FINER, "Running integrity check on {0}", this);

        for (int id = 0; id < size; id++) {
            DagNode node = nodes[id];
            checkState(node != null && node.id() == id, "Invalid entry at %d: %s", id, node);
            checkState(node.negative() != node.positive(), "Node (%s) has a redundant test", node);
            checkDescends(node, node.negative());
            checkDescends(node, node.positive());

            // Each node is contained in its own chain and has no duplicate there
            int chainPosition = hashToChainStart[hashToTable(node.hashCode())];
            boolean found = false;
            while (chainPosition != NOT_A_NODE) {
                DagNode other = nodes[chainPosition];
                if (chainPosition == id) {
                    found = true;
                } else {
                    checkState(
                            !matches(other, node.depth(), node.negative(), node.positive()),
                            "Duplicate entries (%s) and (%s)",
                            node,
                            other);
                }
                chainPosition = hashChain[chainPosition];
            }
            checkState(found, "(%s) is not contained in its hash chain", node);
        }
        for (int id = size; id < nodes.length; id++) {
            checkState(nodes[id] == null, "Unused entry %d is occupied by %s", id, nodes[id]);
        }
        return true;
    }

    private static void checkDescends(DagNode node, DagNode child) {
        if (!child.isTerminal()) {
            checkState(node.depth() < child.depth(), "(%s) -> (%s) does not descend", node, child);
        }
    }

    public String statistics() {
        int distinctChains = 0;
        int maximalChainLength = 0;
        for (int chainStart : hashToChainStart) {
            if (chainStart == NOT_A_NODE) {
                continue;
            }
            distinctChains += 1;
            int length = 0;
            for (int node = chainStart; node != NOT_A_NODE; node = hashChain[node]) {
                length += 1;
            }
            maximalChainLength = Math.max(maximalChainLength, length);
        }

        return String.format(
                "Node pool statistics:%n"
                        + "Table size: %1$d, %2$d nodes, %3$d intern calls (%4$d reduced)%n"
                        + "Hash table: %5$d chains %6$.2f load, %7$.2f avg, %8$d max; "
                        + "%9$d lookups, %10$.2f avg. len, %11$d hits%n"
                        + "%12$d grows",
                nodes.length,
                size,
                internCalls,
                reducedNodes,
                distinctChains,
                size * 1.0 / nodes.length,
                distinctChains == 0 ? 0.0 : size * 1.0 / distinctChains,
                maximalChainLength,
                hashChainLookups,
                hashChainLookups == 0 ? 0.0 : hashChainLookupLength * 1.0 / hashChainLookups,
                hashChainLookupHit,
                growCount);
    }

    @Override
    public String toString() {
        return "NodePool@" + Integer.toHexString(System.identityHashCode(this)) + "(" + size + " nodes)";
    }
}
