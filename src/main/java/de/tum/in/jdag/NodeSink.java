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

/**
 * Receives the nodes created by {@link DagEngine} operations.
 */
@FunctionalInterface
public interface NodeSink {
    /**
     * Returns the canonical node {@code (depth, negative, positive)}. If {@code negative ==
     * positive}, the test is redundant and that child is returned directly.
     *
     * <p>The children must be terminals or nodes with a depth strictly greater than {@code depth}.
     * This is only checked by assertions.</p>
     */
    DagNode intern(int depth, DagNode negative, DagNode positive);
}
