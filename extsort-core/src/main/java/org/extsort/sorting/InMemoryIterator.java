/*
 * InMemoryIterator.java
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
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Iterate over pairs that are already sorted in memory.
 * @param <K> type of key
 * @param <V> type of value
 */
@API(API.Status.EXPERIMENTAL)
public class InMemoryIterator<K, V> implements SortIterator<K, V> {
    @Nonnull
    private List<SortPair<K, V>> pairs;
    private int position;

    public InMemoryIterator(@Nonnull List<SortPair<K, V>> pairs) {
        this.pairs = pairs;
    }

    @Override
    public boolean hasNext() {
        return position < pairs.size();
    }

    @Nonnull
    @Override
    public SortPair<K, V> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return pairs.get(position++);
    }

    @Override
    public void close() {
        pairs = Collections.emptyList();
        position = 0;
    }
}
