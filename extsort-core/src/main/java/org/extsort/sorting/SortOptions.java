/*
 * SortOptions.java
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
import org.extsort.SortContractException;
import org.extsort.annotation.API;
import org.extsort.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Options that control a {@link Sorter} or a {@linkplain SortIterator#merge merge}. Fixed once the sorter is made.
 */
@API(API.Status.EXPERIMENTAL)
public final class SortOptions {
    public static final long DEFAULT_MAX_MEMORY_USAGE_BYTES = 64L * 1024 * 1024;

    public static final SortOptions DEFAULT = newBuilder().build();

    private final long limit;
    private final long maxMemoryUsageBytes;
    private final boolean extSortAllowed;

    private SortOptions(long limit, long maxMemoryUsageBytes, boolean extSortAllowed) {
        this.limit = limit;
        this.maxMemoryUsageBytes = maxMemoryUsageBytes;
        this.extSortAllowed = extSortAllowed;
    }

    /**
     * Get the number of pairs to return, or {@code 0} to return all of them.
     * @return the limit
     */
    public long getLimit() {
        return limit;
    }

    public boolean hasLimit() {
        return limit > 0;
    }

    /**
     * Get the approximate number of bytes that buffered pairs may use before they must be spilled.
     * @return the memory budget
     */
    public long getMaxMemoryUsageBytes() {
        return maxMemoryUsageBytes;
    }

    /**
     * Get whether buffered pairs may be spilled to disk. If not, exceeding the memory budget is an error.
     * @return {@code true} if spilling is allowed
     */
    public boolean isExtSortAllowed() {
        return extSortAllowed;
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder()
                .setLimit(limit)
                .setMaxMemoryUsageBytes(maxMemoryUsageBytes)
                .setExtSortAllowed(extSortAllowed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final SortOptions that = (SortOptions)o;
        return limit == that.limit && maxMemoryUsageBytes == that.maxMemoryUsageBytes && extSortAllowed == that.extSortAllowed;
    }

    @Override
    public int hashCode() {
        return Objects.hash(limit, maxMemoryUsageBytes, extSortAllowed);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("limit", limit)
                .add("maxMemoryUsageBytes", maxMemoryUsageBytes)
                .add("extSortAllowed", extSortAllowed)
                .toString();
    }

    /**
     * Builder for {@link SortOptions}.
     */
    public static class Builder {
        private long limit = 0;
        private long maxMemoryUsageBytes = DEFAULT_MAX_MEMORY_USAGE_BYTES;
        private boolean extSortAllowed = false;

        private Builder() {
        }

        @Nonnull
        public Builder setLimit(long limit) {
            this.limit = limit;
            return this;
        }

        @Nonnull
        public Builder setMaxMemoryUsageBytes(long maxMemoryUsageBytes) {
            this.maxMemoryUsageBytes = maxMemoryUsageBytes;
            return this;
        }

        @Nonnull
        public Builder setExtSortAllowed(boolean extSortAllowed) {
            this.extSortAllowed = extSortAllowed;
            return this;
        }

        @Nonnull
        public SortOptions build() {
            if (limit < 0) {
                throw new SortContractException("sort limit must not be negative", LogMessageKeys.LIMIT, limit);
            }
            if (maxMemoryUsageBytes <= 0) {
                throw new SortContractException("sort memory limit must be positive", LogMessageKeys.MEMORY_LIMIT, maxMemoryUsageBytes);
            }
            return new SortOptions(limit, maxMemoryUsageBytes, extSortAllowed);
        }
    }
}
