/*
 * Sorter.java
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
import org.extsort.common.SortTimer;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Sort key/value pairs within a memory budget, spilling sorted runs to disk when the budget is exceeded.
 *
 * <p>
 * A sorter accepts pairs with {@link #add} until {@link #done} is called, which returns the pairs in order.
 * After that no more pairs can be added and {@code done} cannot be called again.
 * </p>
 *
 * <p>
 * Pairs that compare equal come out in the order they were added. If the options have a limit, only that many of
 * the smallest pairs come out.
 * </p>
 *
 * <p>
 * A sorter is driven by one thread at a time and does no locking. Closing it before {@code done} deletes any spill
 * files. After {@code done} the returned iterator owns the spill files instead.
 * </p>
 * @param <K> type of key
 * @param <V> type of value
 */
@API(API.Status.EXPERIMENTAL)
public interface Sorter<K, V> extends AutoCloseable {
    /**
     * Add a pair. The sorter keeps an {@linkplain SortSerializer#toOwned owned} copy.
     * @param key the key
     * @param value the value
     * @throws org.extsort.SortContractException if {@link #done} has been called or the sorter is closed
     * @throws org.extsort.SortResourceExhaustedException if the memory budget is exceeded and spilling is not allowed
     * @throws org.extsort.SortStorageException if spilling fails
     */
    void add(@Nonnull K key, @Nonnull V value);

    /**
     * Finish adding and get the pairs in order.
     * @return an iterator over the sorted pairs
     * @throws org.extsort.SortContractException if called more than once or after the sorter is closed
     */
    @Nonnull
    SortIterator<K, V> done();

    /**
     * Get the number of runs spilled to disk so far. For tests and diagnostics.
     * @return the number of spills
     */
    int getNumSpilledRuns();

    /**
     * Get the estimated memory used by buffered pairs. For tests and diagnostics.
     * @return approximate bytes buffered
     */
    long getMemUsed();

    /**
     * Release everything the sorter still owns. Safe to call in any state.
     */
    @Override
    void close();

    /**
     * Make a sorter suited to the given options.
     * @param options limit and memory budget
     * @param comparator the order of the output
     * @param adapter element contract and spill file options
     * @param timer optional instrumentation
     * @param <K> type of key
     * @param <V> type of value
     * @return a new sorter
     */
    @Nonnull
    static <K, V> Sorter<K, V> make(@Nonnull SortOptions options, @Nonnull SortComparator<K, V> comparator,
                                    @Nonnull SortAdapter<K, V> adapter, @Nullable SortTimer timer) {
        if (options.hasLimit()) {
            return new TopKSorter<>(options, comparator, adapter, timer);
        } else {
            return new NoLimitSorter<>(options, comparator, adapter, timer);
        }
    }

    @Nonnull
    static <K, V> Sorter<K, V> make(@Nonnull SortOptions options, @Nonnull SortComparator<K, V> comparator,
                                    @Nonnull SortAdapter<K, V> adapter) {
        return make(options, comparator, adapter, null);
    }
}
