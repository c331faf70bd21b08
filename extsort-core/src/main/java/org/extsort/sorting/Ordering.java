/*
 * Ordering.java
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
 * Result of comparing two sorted pairs.
 */
@API(API.Status.EXPERIMENTAL)
public enum Ordering {
    LESS,
    EQUAL,
    GREATER;

    /**
     * Convert a {@link java.util.Comparator}-style result.
     * @param comparison negative, zero or positive
     * @return the matching ordering
     */
    @Nonnull
    public static Ordering of(int comparison) {
        if (comparison < 0) {
            return LESS;
        } else if (comparison > 0) {
            return GREATER;
        } else {
            return EQUAL;
        }
    }

    @Nonnull
    public Ordering reverse() {
        switch (this) {
            case LESS:
                return GREATER;
            case GREATER:
                return LESS;
            default:
                return EQUAL;
        }
    }

    /**
     * Convert back to a {@link java.util.Comparator}-style result.
     * @return {@code -1}, {@code 0} or {@code 1}
     */
    public int toInt() {
        switch (this) {
            case LESS:
                return -1;
            case GREATER:
                return 1;
            default:
                return 0;
        }
    }
}
