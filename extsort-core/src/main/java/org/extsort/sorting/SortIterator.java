/*
 * SortIterator.java
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
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Sorted output of a {@link Sorter}, a spilled run, or a merge of other iterators.
 *
 * An iterator may own spill files. They are deleted once it has returned its last pair or is {@linkplain #close closed},
 * whichever comes first. Iterators are not thread-safe.
 * @param <K> type of key
 * @param <V> type of value
 */
@API(API.Status.EXPERIMENTAL)
public interface SortIterator<K, V> extends Iterator<SortPair<K, V>>, AutoCloseable {
    /**
     * Get whether there are more pairs.
     * @return {@code true} if {@link #next} will return a pair
     * @throws org.extsort.SortStorageException if reading a spill file fails
     * @throws org.extsort.SortCorruptionException if a spill file is corrupt
     */
    @Override
    boolean hasNext();

    /**
     * Get the next pair.
     * @return the next pair in order
     * @throws java.util.NoSuchElementException if there are no more pairs
     * @throws org.extsort.SortStorageException if reading a spill file fails
     * @throws org.extsort.SortCorruptionException if a spill file is corrupt
     */
    @Nonnull
    @Override
    SortPair<K, V> next();

    /**
     * Release any spill files still held. Safe to call more than once and at any point.
     */
    @Override
    void close();

    /**
     * Merge already sorted iterators into one.
     *
     * Pairs that compare equal are returned in the order of their sources in {@code sources}, so the list should be
     * given in the order the sources were created. If {@code options} has a limit, at most that many pairs are returned
     * and no source is read past the last of them. The merge owns the sources and closes them.
     * @param sources sorted iterators in creation order
     * @param options supplies the limit
     * @param comparator the order of each source
     * @param <K> type of key
     * @param <V> type of value
     * @return an iterator over all pairs in order
     */
    @Nonnull
    static <K, V> SortIterator<K, V> merge(@Nonnull List<? extends SortIterator<K, V>> sources,
                                           @Nonnull SortOptions options,
                                           @Nonnull SortComparator<K, V> comparator) {
        return new MergeIterator<>(sources, options.getLimit(), comparator);
    }

    @Nonnull
    static <K, V> SortIterator<K, V> empty() {
        return new InMemoryIterator<>(Collections.emptyList());
    }
}
