/*
 * NoLimitSorter.java
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
import java.util.ArrayList;
import java.util.List;

/**
 * A {@link Sorter} that returns every pair added.
 *
 * Pairs are appended to a buffer. When the buffer goes over budget it is sorted and spilled as a run. If nothing was
 * ever spilled, {@link #done} returns the sorted buffer directly.
 * @param <K> type of key
 * @param <V> type of value
 */
@API(API.Status.INTERNAL)
class NoLimitSorter<K, V> extends AbstractSorter<K, V> {
    @Nonnull
    private List<SortPair<K, V>> buffer = new ArrayList<>();

    NoLimitSorter(@Nonnull SortOptions options, @Nonnull SortComparator<K, V> comparator,
                  @Nonnull SortAdapter<K, V> adapter, @Nullable SortTimer timer) {
        super(options, comparator, adapter, timer);
    }

    @Override
    protected void addOwned(@Nonnull SortPair<K, V> pair, long footprint) {
        buffer.add(pair);
        memUsed += footprint;
    }

    @Nonnull
    @Override
    protected List<SortPair<K, V>> sortBuffer() {
        final long startTime = System.nanoTime();
        final List<SortPair<K, V>> sorted = buffer;
        // List.sort is stable, which keeps equal pairs in insertion order.
        sorted.sort(comparator.asComparator());
        buffer = new ArrayList<>();
        memUsed = 0;
        if (timer != null) {
            timer.recordSinceNanoTime(SortEvents.Events.MEMORY_SORT_SORT_BUFFER, startTime);
        }
        return sorted;
    }

    @Override
    protected void clearBuffer() {
        buffer = new ArrayList<>();
    }

    int getBufferedCount() {
        return buffer.size();
    }
}
