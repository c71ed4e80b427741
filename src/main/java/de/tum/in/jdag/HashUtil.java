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

final class HashUtil {
    // Note: These are cheap hash functions on purpose, they are evaluated for every node creation
    // and every cache lookup.

    static final int PRIME = 0x1000193;

    private HashUtil() {}

    /**
     * Hash of a node triple. Not symmetric in the children, {@code (d, a, b)} and {@code (d, b, a)}
     * are different functions.
     */
    static int hash(int depth, int negativeHash, int positiveHash) {
        return (PRIME * depth + negativeHash) * PRIME + positiveHash;
    }

    /**
     * Hash of an unordered pair, i.e. {@code symmetricHash(a, b) == symmetricHash(b, a)}.
     */
    static int symmetricHash(int firstHash, int secondHash) {
        return firstHash + secondHash;
    }

    static int mod(int value, int modulus) {
        int val = value % modulus;
        return val < 0 ? val + modulus : val;
    }
}
