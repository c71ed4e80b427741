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

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Small set-theoretic helpers, used to group sample vectors by the literals they satisfy. All
 * results are fresh, mutable collections which keep the iteration order of the input.
 */
public final class SetCombinators {
    private SetCombinators() {}

    public static <V> Set<V> filter(Collection<V> values, Predicate<? super V> predicate) {
        return values.stream().filter(predicate).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Returns a cover of {@code values}: each value is listed under every key returned by {@code
     * keysOf}. Values without any key do not appear in the result.
     */
    public static <K, V> Map<K, Set<V>> cover(
            Collection<V> values, Function<? super V, ? extends Collection<? extends K>> keysOf) {
        Map<K, Set<V>> cover = new LinkedHashMap<>();
        for (V value : values) {
            for (K key : keysOf.apply(value)) {
                cover.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(value);
            }
        }
        return cover;
    }

    /**
     * Returns the partition of {@code values} into the classes of equal {@code keyOf} values.
     */
    public static <K, V> Map<K, Set<V>> partition(Collection<V> values, Function<? super V, ? extends K> keyOf) {
        return cover(values, value -> Set.of(keyOf.apply(value)));
    }
}
