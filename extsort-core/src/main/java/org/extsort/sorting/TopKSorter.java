/*
 * TopKSorter.java
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
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * A {@link Sorter} that only keeps the first {@code limit} pairs of the sorted order.
 *
 * Buffered pairs are held in a heap with the worst one on top, so a new pair either replaces it or is discarded.
 * Pairs are ordered by the comparator and then by when they were added, so of two equal pairs the earlier one is kept.
 *
 * If even {@code limit} pairs do not fit in the budget, the heap is spilled. Once a full run has been spilled, its
 * last pair is a cutoff: any later pair that is not less than it can never make the output.
 * @param <K> type of key
 * @param <V> type of value
 */
@API(API.Status.INTERNAL)
class TopKSorter<K, V> extends AbstractSorter<K, V> {
    @Nonnull
    private final Comparator<Entry<K, V>> entryOrder;
    @Nonnull
    private PriorityQueue<Entry<K, V>> heap;
    @Nullable
    private SortPair<K, V> cutoff;
    private long sequence;

    TopKSorter(@Nonnull SortOptions options, @Nonnull SortComparator<K, V> comparator,
               @Nonnull SortAdapter<K, V> adapter, @Nullable SortTimer timer) {
        super(options, comparator, adapter, timer);
        final Comparator<SortPair<K, V>> pairOrder = comparator.asComparator();
        this.entryOrder = Comparator.<Entry<K, V>, SortPair<K, V>>comparing(entry -> entry.pair, pairOrder)
                .thenComparingLong(entry -> entry.sequence);
        this.heap = newHeap();
    }

    @Nonnull
    private PriorityQueue<Entry<K, V>> newHeap() {
        return new PriorityQueue<>(entryOrder.reversed());
    }

    @Override
    protected void addOwned(@Nonnull SortPair<K, V> pair, long footprint) {
        if (cutoff != null && comparator.compare(pair, cutoff) != Ordering.LESS) {
            discarded();
            return;
        }
        if (heap.size() < options.getLimit()) {
            heap.add(new Entry<>(pair, sequence++, footprint));
            memUsed += footprint;
            return;
        }
        final Entry<K, V> worst = heap.peek();
        if (worst != null && comparator.compare(pair, worst.pair) == Ordering.LESS) {
            heap.poll();
            memUsed -= worst.footprint;
            heap.add(new Entry<>(pair, sequence++, footprint));
            memUsed += footprint;
        }
        discarded();
    }

    private void discarded() {
        if (timer != null) {
            timer.increment(SortEvents.Counts.MEMORY_SORT_DISCARDED_RECORDS);
        }
    }

    @Nonnull
    @Override
    protected List<SortPair<K, V>> sortBuffer() {
        final long startTime = System.nanoTime();
        final List<Entry<K, V>> entries = new ArrayList<>(heap);
        entries.sort(entryOrder);
        final List<SortPair<K, V>> sorted = new ArrayList<>(entries.size());
        for (Entry<K, V> entry : entries) {
            sorted.add(entry.pair);
        }
        heap = newHeap();
        memUsed = 0;
        if (timer != null) {
            timer.recordSinceNanoTime(SortEvents.Events.MEMORY_SORT_SORT_BUFFER, startTime);
        }
        return sorted;
    }

    @Override
    protected void spilled(@Nonnull List<SortPair<K, V>> run) {
        if (run.size() < options.getLimit()) {
            return;
        }
        final SortPair<K, V> last = run.get(run.size() - 1);
        if (cutoff == null || comparator.compare(last, cutoff) == Ordering.LESS) {
            cutoff = last;
        }
    }

    @Override
    protected void clearBuffer() {
        heap = newHeap();
    }

    @Nullable
    SortPair<K, V> getCutoff() {
        return cutoff;
    }

    private static final class Entry<K, V> {
        @Nonnull
        private final SortPair<K, V> pair;
        private final long sequence;
        private final long footprint;

        private Entry(@Nonnull SortPair<K, V> pair, long sequence, long footprint) {
            this.pair = pair;
            this.sequence = sequence;
            this.footprint = footprint;
        }
    }
}
