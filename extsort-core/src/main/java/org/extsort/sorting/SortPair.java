/*
 * SortPair.java
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

import com.google.common.base.MoreObjects;
import org.extsort.annotation.API;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.Objects;

/**
 * A key and its value, the unit that is sorted.
 * @param <K> type of key
 * @param <V> type of value
 */
@API(API.Status.EXPERIMENTAL)
public final class SortPair<K, V> {
    @Nonnull
    private final K key;
    @Nonnull
    private final V value;

    private SortPair(@Nonnull K key, @Nonnull V value) {
        this.key = key;
        this.value = value;
    }

    @Nonnull
    public static <K, V> SortPair<K, V> of(@Nonnull K key, @Nonnull V value) {
        return new SortPair<>(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    }

    @Nonnull
    public K getKey() {
        return key;
    }

    @Nonnull
    public V getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final SortPair<?, ?> that = (SortPair<?, ?>)o;
        return Objects.deepEquals(key, that.key) && Objects.deepEquals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(new Object[] {key, value});
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("key", key)
                .add("value", value)
                .toString();
    }
}
