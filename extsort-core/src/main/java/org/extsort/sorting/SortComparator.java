/*
 * SortComparator.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2015-2026 Apple Inc. and the FoundationDB project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.extsort.sorting;

import org.extsort.annotation.API;

import javax.annotation.Nonnull;
import java.util.Comparator;

/**
 * Orders pairs for a {@link Sorter} and for {@link SortIterator#merge}.
 *
 * Pairs that compare {@link Ordering#EQUAL} keep their insertion order, so a comparator only needs to
 * look at as much of the pair as defines the desired order.
 * @param <K> type of key
 * @param <V> type of value
 */
@API(API.Status.EXPERIMENTAL)
@FunctionalInterface
public interface SortComparator<K, V> {
    @Nonnull
    Ordering compare(@Nonnull SortPair<K, V> left, @Nonnull SortPair<K, V> right);

    @Nonnull
    default SortComparator<K, V> reversed() {
        return (left, right) -> compare(right, left);
    }

    /**
     * Get a {@link Comparator} with the same order, for use with the collections framework.
     * @return an equivalent comparator
     */
    @Nonnull
    default Comparator<SortPair<K, V>> asComparator() {
        return (left, right) -> compare(left, right).toInt();
    }

    @Nonnull
    static <K, V> SortComparator<K, V> byKey(@Nonnull Comparator<? super K> keyComparator) {
        return (left, right) -> Ordering.of(keyComparator.compare(left.getKey(), right.getKey()));
    }

    @Nonnull
    static <K, V> SortComparator<K, V> byKeyThenValue(@Nonnull Comparator<? super K> keyComparator,
                                                      @Nonnull Comparator<? super V> valueComparator) {
        return (left, right) -> {
            final int keyComparison = keyComparator.compare(left.getKey(), right.getKey());
            if (keyComparison != 0) {
                return Ordering.of(keyComparison);
            }
            return Ordering.of(valueComparator.compare(left.getValue(), right.getValue()));
        };
    }
}
