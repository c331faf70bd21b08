/*
 * SortEvents.java
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

/**
 * {@link SortTimer} events related to sorting.
 */
@API(API.Status.EXPERIMENTAL)
@SuppressWarnings("PMD.MissingStaticMethodInNonInstantiatableClass")
public class SortEvents {
    private SortEvents() {
    }

    /**
     * Timed events.
     */
    public enum Events implements SortTimer.Event {
        MEMORY_SORT_STORE_RECORD("memory sort store record"),
        MEMORY_SORT_SORT_BUFFER("memory sort sort buffer"),
        FILE_SORT_OPEN_FILE("file sort open file"),
        FILE_SORT_SAVE_RECORD("file sort save record"),
        FILE_SORT_SPILL("file sort spill"),
        FILE_SORT_MERGE_FILES("file sort merge files"),
        FILE_SORT_LOAD_RECORD("file sort load record");

        @Nonnull
        private final String title;

        Events(@Nonnull String title) {
            this.title = title;
        }

        @Override
        public String title() {
            return title;
        }
    }

    /**
     * Counted events.
     */
    public enum Counts implements SortTimer.Count {
        FILE_SORT_SPILLED_RUNS("file sort spilled runs", false),
        FILE_SORT_FILE_BYTES("file sort file bytes", true),
        FILE_SORT_INTERMEDIATE_MERGES("file sort intermediate merges", false),
        MEMORY_SORT_DISCARDED_RECORDS("memory sort discarded records", false);

        @Nonnull
        private final String title;
        private final boolean isSize;

        Counts(@Nonnull String title, boolean isSize) {
            this.title = title;
            this.isSize = isSize;
        }

        @Override
        public String title() {
            return title;
        }

        @Override
        public boolean isSize() {
            return isSize;
        }
    }
}
