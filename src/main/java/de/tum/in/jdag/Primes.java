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

final class Primes {
    // Bit i is set iff i is not coprime to 30, i.e. n % 30 == i rules out a prime
    private static final int SIEVE_30 = ~((1 << 1) | (1 << 7) | (1 << 11) | (1 << 13)
            | (1 << 17) | (1 << 19) | (1 << 23) | (1 << 29));
    // Deterministic Miller-Rabin witnesses for all n < 4,759,123,141
    private static final long[] WITNESSES = {2L, 7L, 61L};

    private Primes() {}

    static int nextPrime(int value) {
        int nextPrime = Math.max(3, value | 1);
        while (!isPrime(nextPrime)) {
            nextPrime += 2;
        }
        return nextPrime;
    }

    static boolean isPrime(int n) {
        if (n < 2) {
            return false;
        }
        if (n == 2 || n == 3 || n == 5 || n == 7 || n == 11 || n == 13) {
            return true;
        }
        if ((SIEVE_30 & (1 << (n % 30))) != 0) {
            return false;
        }
        if (n % 7 == 0 || n % 11 == 0 || n % 13 == 0) {
            return false;
        }
        if (n < 17 * 17) {
            return true;
        }
        for (long witness : WITNESSES) {
            if (!testWitness(witness, n)) {
                return false;
            }
        }
        return true;
    }

    /* All operands are below 2^31, so products fit into a long. */
    private static boolean testWitness(long base, long n) {
        int r = Long.numberOfTrailingZeros(n - 1L);
        long d = (n - 1L) >> r;
        long reducedBase = base % n;
        if (reducedBase == 0L) {
            return true;
        }
        long a = powMod(reducedBase, d, n);
        if (a == 1L) {
            return true;
        }
        int j = 0;
        while (a != n - 1L) {
            j += 1;
            if (j == r) {
                return false;
            }
            a = (a * a) % n;
        }
        return true;
    }

    private static long powMod(long base, long exponent, long m) {
        long result = 1L;
        long square = base;
        for (long p = exponent; p != 0L; p >>= 1L) {
            if ((p & 1L) != 0L) {
                result = (result * square) % m;
            }
            square = (square * square) % m;
        }
        return result;
    }
}
