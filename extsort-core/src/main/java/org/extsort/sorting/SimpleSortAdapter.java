/*
 * SimpleSortAdapter.java
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

import org.extsort.SortContractException;
import org.extsort.annotation.API;
import org.extsort.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.File;
import java.io.IOException;
import java.util.UUID;

/**
 * A {@link SortAdapter} that creates spill files with {@link File#createTempFile} in a given directory.
 *
 * Each adapter puts a random token into its file names, so files from different sorters are easy to tell apart.
 * @param <K> type of key
 * @param <V> type of value
 */
@API(API.Status.EXPERIMENTAL)
public class SimpleSortAdapter<K, V> implements SortAdapter<K, V> {
    public static final String FILE_SUFFIX = ".sort";

    @Nonnull
    private final SortSerializer<K> keySerializer;
    @Nonnull
    private final SortSerializer<V> valueSerializer;
    @Nullable
    private final File directory;
    @Nonnull
    private final String filePrefix;
    private final boolean compressed;
    private final int maxNumFiles;

    private SimpleSortAdapter(@Nonnull Builder<K, V> builder) {
        this.keySerializer = builder.keySerializer;
        this.valueSerializer = builder.valueSerializer;
        this.directory = builder.directory;
        this.filePrefix = builder.filePrefix + "-" + UUID.randomUUID().toString().substring(0, 8) + "-";
        this.compressed = builder.compressed;
        this.maxNumFiles = builder.maxNumFiles;
    }

    @Nonnull
    public static <K, V> Builder<K, V> newBuilder(@Nonnull SortSerializer<K> keySerializer,
                                                  @Nonnull SortSerializer<V> valueSerializer) {
        return new Builder<>(keySerializer, valueSerializer);
    }

    @Nonnull
    @Override
    public SortSerializer<K> getKeySerializer() {
        return keySerializer;
    }

    @Nonnull
    @Override
    public SortSerializer<V> getValueSerializer() {
        return valueSerializer;
    }

    @Nonnull
    @Override
    public File generateFilename() throws IOException {
        return File.createTempFile(filePrefix, FILE_SUFFIX, directory);
    }

    @Nullable
    public File getDirectory() {
        return directory;
    }

    @Nonnull
    public String getFilePrefix() {
        return filePrefix;
    }

    @Override
    public boolean isCompressed() {
        return compressed;
    }

    @Override
    public int getMaxNumFiles() {
        return maxNumFiles;
    }

    /**
     * Builder for {@link SimpleSortAdapter}.
     * @param <K> type of key
     * @param <V> type of value
     */
    public static class Builder<K, V> {
        @Nonnull
        private final SortSerializer<K> keySerializer;
        @Nonnull
        private final SortSerializer<V> valueSerializer;
        @Nullable
        private File directory;
        @Nonnull
        private String filePrefix = "extsort";
        private boolean compressed;
        private int maxNumFiles;

        private Builder(@Nonnull SortSerializer<K> keySerializer, @Nonnull SortSerializer<V> valueSerializer) {
            this.keySerializer = keySerializer;
            this.valueSerializer = valueSerializer;
        }

        /**
         * Set the directory for spill files. The default is the system temporary directory.
         * @param directory an existing directory
         * @return this builder
         */
        @Nonnull
        public Builder<K, V> setDirectory(@Nullable File directory) {
            this.directory = directory;
            return this;
        }

        @Nonnull
        public Builder<K, V> setFilePrefix(@Nonnull String filePrefix) {
            this.filePrefix = filePrefix;
            return this;
        }

        @Nonnull
        public Builder<K, V> setCompressed(boolean compressed) {
            this.compressed = compressed;
            return this;
        }

        @Nonnull
        public Builder<K, V> setMaxNumFiles(int maxNumFiles) {
            this.maxNumFiles = maxNumFiles;
            return this;
        }

        @Nonnull
        public SimpleSortAdapter<K, V> build() {
            if (maxNumFiles < 0 || maxNumFiles == 1) {
                throw new SortContractException("maximum number of spill files must be 0 or at least 2",
                        LogMessageKeys.MAX_NUM_FILES, maxNumFiles);
            }
            if (filePrefix.length() < 3) {
                throw new SortContractException("spill file prefix must be at least three characters",
                        LogMessageKeys.FILE_PREFIX, filePrefix);
            }
            return new SimpleSortAdapter<>(this);
        }
    }
}
