/*
 * SpillFile.java
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
import org.extsort.logging.KeyValueLogMessage;
import org.extsort.logging.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.File;
import java.io.IOException;
import java.lang.ref.Cleaner;
import java.nio.file.Files;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A spill file shared by the {@link SortedFileWriter} that wrote it and any {@link SortedFileIterator}s reading it.
 *
 * Each holder takes a reference with {@link #retain} and gives it back with {@link #release}. The file is deleted
 * exactly once, when the last reference is released. If every holder becomes unreachable without releasing, the file
 * is deleted when this object is collected.
 */
@API(API.Status.INTERNAL)
public final class SpillFile {
    private static final Logger LOGGER = LoggerFactory.getLogger(SpillFile.class);
    private static final Cleaner CLEANER = Cleaner.create();

    @Nonnull
    private final File file;
    @Nonnull
    private final AtomicInteger references = new AtomicInteger(1);
    @Nonnull
    private final Deleter deleter;
    @Nonnull
    private final Cleaner.Cleanable cleanable;

    /**
     * Take ownership of a file. The caller holds the first reference.
     * @param file an existing file
     */
    public SpillFile(@Nonnull File file) {
        this.file = file;
        this.deleter = new Deleter(file);
        this.cleanable = CLEANER.register(this, deleter);
    }

    @Nonnull
    public File getFile() {
        return file;
    }

    /**
     * Take another reference.
     * @return this spill file
     * @throws SortContractException if the file has already been deleted
     */
    @Nonnull
    public SpillFile retain() {
        while (true) {
            final int current = references.get();
            if (current <= 0) {
                throw new SortContractException("spill file already released", LogMessageKeys.FILE_NAME, file);
            }
            if (references.compareAndSet(current, current + 1)) {
                return this;
            }
        }
    }

    /**
     * Give back a reference, deleting the file if it was the last one.
     */
    public void release() {
        final int remaining = references.decrementAndGet();
        if (remaining == 0) {
            cleanable.clean();
        } else if (remaining < 0) {
            throw new SortContractException("spill file released too many times", LogMessageKeys.FILE_NAME, file);
        }
    }

    public int getReferenceCount() {
        return Math.max(references.get(), 0);
    }

    public boolean isDeleted() {
        return deleter.deleted.get();
    }

    @Override
    public String toString() {
        return "SpillFile{" + file + ", references=" + getReferenceCount() + "}";
    }

    // Must not refer to the SpillFile, or the cleaner would never run.
    private static final class Deleter implements Runnable {
        @Nonnull
        private final File file;
        @Nonnull
        private final AtomicBoolean deleted = new AtomicBoolean();

        Deleter(@Nonnull File file) {
            this.file = file;
        }

        @Override
        public void run() {
            if (!deleted.compareAndSet(false, true)) {
                return;
            }
            try {
                // file.delete() doesn't have real error handling.
                Files.deleteIfExists(file.toPath());
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug(KeyValueLogMessage.of("deleted spill file", LogMessageKeys.FILE_NAME, file));
                }
            } catch (IOException ex) {
                LOGGER.warn(KeyValueLogMessage.of("could not delete spill file", LogMessageKeys.FILE_NAME, file), ex);
            }
        }
    }
}
