/*
 * SortAdapter.java
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
import java.io.File;
import java.io.IOException;

/**
 * Provide the element contract and spill file options for a {@link Sorter} and {@link SortedFileWriter}.
 * @param <K> type of key
 * @param <V> type of value
 */
@API(API.Status.EXPERIMENTAL)
public interface SortAdapter<K, V> {
    @Nonnull
    SortSerializer<K> getKeySerializer();

    @Nonnull
    SortSerializer<V> getValueSerializer();

    /**
     * Create a new, empty file to hold one sorted run.
     * The name must not collide with a file created for any other sorter, including ones running concurrently.
     * The sorter owns the file from then on and deletes it.
     * @return a newly created file
     * @throws IOException if something fails creating the file
     */
    @Nonnull
    File generateFilename() throws IOException;

    /**
     * Get whether spill files should be compressed.
     * @return {@code true} if files are compressed
     */
    boolean isCompressed();

    /**
     * Get the maximum number of spill files to keep before merging them into one.
     * @return the maximum number of files kept by a single sorter, or {@code 0} for no maximum
     */
    int getMaxNumFiles();
}
