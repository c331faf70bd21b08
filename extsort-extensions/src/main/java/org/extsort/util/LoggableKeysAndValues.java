/*
 * LoggableKeysAndValues.java
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

package org.extsort.util;

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Something that carries a set of keys and values to be included when it is logged.
 * Log lines stay searchable by their static title while the keys and values give the details,
 * such as {@code file_name="..."} and {@code record_count="..."} for a failed spill.
 *
 * @param <T> type returned from the fluent {@code addLogInfo} methods
 */
interface LoggableKeysAndValues<T extends LoggableKeysAndValues<T>> {

    /**
     * Get the log information as a map.
     * @return an unmodifiable view of the log information
     */
    @Nonnull
    Map<String, Object> getLogInfo();

    /**
     * Add a single key and value.
     * @param description the key
     * @param object the value
     * @return this object
     */
    @Nonnull
    T addLogInfo(@Nonnull String description, Object object);

    /**
     * Add alternating keys and values, as in {@code ["k0", "v0", "k1", "v1"]}.
     * @param keyValue flattened keys and values
     * @return this object
     * @throws IllegalArgumentException if {@code keyValue} has an odd length
     */
    @Nonnull
    T addLogInfo(@Nonnull Object... keyValue);

    /**
     * Flatten the log information into alternating keys and values, the format accepted by {@link #addLogInfo(Object...)}.
     * @return flattened keys and values
     */
    @Nonnull
    Object[] exportLogInfo();
}
