/*
 * LogMessageKeys.java
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

package org.extsort.logging;

import org.extsort.annotation.API;

import javax.annotation.Nonnull;

/**
 * Common keys used in {@link KeyValueLogMessage}s and exception log info.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    FILE_NAME("file_name"),
    FILE_BYTES("file_bytes"),
    RECORD_COUNT("record_count"),
    EXPECTED_RECORD_COUNT("expected_record_count"),
    RECORD_POSITION("record_position"),
    ELEMENT_LENGTH("element_length"),
    EXPECTED_LENGTH("expected_length"),
    MAGIC("magic"),
    VERSION("version"),
    MEMORY_USAGE("memory_usage"),
    MEMORY_LIMIT("memory_limit"),
    SPILL_COUNT("spill_count"),
    RUN_COUNT("run_count"),
    LIMIT("limit"),
    OPERATION("operation"),
    STATE("state"),
    COMPRESSED("compressed"),
    FILE_PREFIX("file_prefix"),
    MAX_NUM_FILES("max_num_files"),
    TIME_NANOS("time_nanos");

    @Nonnull
    private final String logKey;

    LogMessageKeys(@Nonnull String key) {
        this.logKey = key;
    }

    @Override
    public String toString() {
        return logKey;
    }
}
