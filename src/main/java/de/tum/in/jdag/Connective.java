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

/**
 * A commutative, associative and idempotent binary connective, characterized by its identity
 * element and its annihilator.
 */
public enum Connective {
    OR(DagNode.ZERO, DagNode.ONE),
    AND(DagNode.ONE, DagNode.ZERO);

    private final DagNode identity;
    private final DagNode annihilator;

    Connective(DagNode identity, DagNode annihilator) {
        this.identity = identity;
        this.annihilator = annihilator;
    }

    /**
     * The operand value which leaves the other operand unchanged.
     */
    public DagNode identity() {
        return identity;
    }

    /**
     * The operand value which determines the result regardless of the other operand.
     */
    public DagNode annihilator() {
        return annihilator;
    }

    public static Connective of(DagNode identity, DagNode annihilator) {
        checkArgument(
                identity.isTerminal() && annihilator.isTerminal() && identity != annihilator,
                "No connective with identity %s and annihilator %s",
                identity,
                annihilator);
        return identity == OR.identity ? OR : AND;
    }
}
