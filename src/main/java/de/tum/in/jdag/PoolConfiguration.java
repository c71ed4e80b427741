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

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class PoolConfiguration {
    public static final int DEFAULT_INITIAL_SIZE = 1024;
    public static final double DEFAULT_GROWTH_FACTOR = 1.5d;

    @Value.Default
    public int initialSize() {
        return DEFAULT_INITIAL_SIZE;
    }

    @Value.Default
    public double growthFactor() {
        return DEFAULT_GROWTH_FACTOR;
    }

    @Value.Default
    public boolean logStatisticsOnClose() {
        return false;
    }

    @Value.Check
    protected void check() {
        checkArgument(initialSize() > 0, "Initial size must be positive, got %d", initialSize());
        checkArgument(growthFactor() > 1.0, "Growth factor must exceed 1, got %f", growthFactor());
    }
}
