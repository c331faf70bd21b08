/*
 * MergeIterator.java
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
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.PriorityQueue;

/**
 * Merge any number of sorted {@link SortIterator}s into one.
 *
 * The heap holds the current head pair of each source that is not exhausted, along with the index of that source.
 * Heads that compare equal come out in index order. The source of the pair just returned is not advanced until another
 * pair is asked for, so once the limit is reached no source is read again.
 * @param <K> type of key
 * @param <V> type of value
 */
@API(API.Status.EXPERIMENTAL)
public class MergeIterator<K, V> implements SortIterator<K, V> {
    @Nonnull
    private final List<SortIterator<K, V>> sources;
    @Nonnull
    private final SortComparator<K, V> comparator;
    @Nonnull
    private final PriorityQueue<Head<K, V>> heap;
    private final long limit;

    private long returned;
    private int pendingSource = -1;
    private boolean primed;
    private boolean closed;

    /**
     * Create a merge.
     * @param sources sorted sources, in the order used to break ties
     * @param limit maximum number of pairs to return, or {@code 0} for all of them
     * @param comparator the order of every source
     */
    public MergeIterator(@Nonnull List<? extends SortIterator<K, V>> sources, long limit,
                         @Nonnull SortComparator<K, V> comparator) {
        this.sources = new ArrayList<>(sources);
        this.comparator = comparator;
        this.limit = limit;
        this.heap = new PriorityQueue<>(Math.max(1, sources.size()), this::compareHeads);
    }

    private int compareHeads(@Nonnull Head<K, V> left, @Nonnull Head<K, V> right) {
        final Ordering ordering = comparator.compare(left.pair, right.pair);
        if (ordering != Ordering.EQUAL) {
            return ordering.toInt();
        }
        return Integer.compare(left.source, right.source);
    }

    @Override
    public boolean hasNext() {
        if (closed) {
            return false;
        }
        if (limit > 0 && returned >= limit) {
            close();
            return false;
        }
        try {
            if (primed) {
                advancePending();
            } else {
                for (int i = 0; i < sources.size(); i++) {
                    pushHead(i);
                }
                primed = true;
            }
        } catch (RuntimeException ex) {
            close();
            throw ex;
        }
        if (heap.isEmpty()) {
            close();
            return false;
        }
        return true;
    }

    @Nonnull
    @Override
    public SortPair<K, V> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        final Head<K, V> head = heap.poll();
        pendingSource = head.source;
        returned++;
        return head.pair;
    }

    private void advancePending() {
        if (pendingSource >= 0) {
            final int source = pendingSource;
            pendingSource = -1;
            pushHead(source);
        }
    }

    private void pushHead(int source) {
        final SortIterator<K, V> iterator = sources.get(source);
        if (iterator.hasNext()) {
            heap.add(new Head<>(iterator.next(), source));
        }
    }

    public int getSourceCount() {
        return sources.size();
    }

    /**
     * Close every source, even if closing one of them fails.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        heap.clear();
        RuntimeException failure = null;
        for (SortIterator<K, V> source : sources) {
            try {
                source.close();
            } catch (RuntimeException ex) {
                if (failure == null) {
                    failure = ex;
                } else {
                    failure.addSuppressed(ex);
                }
            }
        }
        sources.clear();
        if (failure != null) {
            throw failure;
        }
    }

    // A source's current pair. The source itself stays in the sources list; the heap only refers to it by index.
    private static final class Head<K, V> {
        @Nonnull
        private final SortPair<K, V> pair;
        private final int source;

        private Head(@Nonnull SortPair<K, V> pair, int source) {
            this.pair = pair;
            this.source = source;
        }
    }
}
