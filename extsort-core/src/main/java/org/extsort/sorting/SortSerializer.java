/*
 * SortSerializer.java
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

/**
 * What the sorter needs to know about a key or value type.
 *
 * Any settings needed to deserialize (such as a schema) belong to the serializer instance.
 * @param <T> type of key or value
 */
@API(API.Status.EXPERIMENTAL)
public interface SortSerializer<T> {
    /**
     * Convert an element into a byte array for a spill file.
     * @param element the key or value
     * @return a byte array encoding {@code element}
     */
    @Nonnull
    byte[] serialize(@Nonnull T element);

    /**
     * Convert bytes from {@link #serialize} back into an element.
     * @param bytes the serialized form
     * @return the original element
     * @throws org.extsort.SortCorruptionException if the bytes are not a valid encoding
     */
    @Nonnull
    T deserialize(@Nonnull byte[] bytes);

    /**
     * Estimate the heap used by an element, including anything it references.
     * @param element the key or value
     * @return an approximate number of bytes
     */
    long memoryFootprint(@Nonnull T element);

    /**
     * Get a version of the element that does not depend on any caller buffer.
     * The sorter calls this before holding on to an added element.
     * @param element the key or value as passed to {@link Sorter#add}
     * @return {@code element} itself if it is already owned, otherwise a copy
     */
    @Nonnull
    default T toOwned(@Nonnull T element) {
        return element;
    }
}
