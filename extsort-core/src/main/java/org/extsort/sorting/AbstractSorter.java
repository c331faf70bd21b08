/*
 * AbstractSorter.java
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
import org.extsort.SortResourceExhaustedException;
import org.extsort.annotation.API;
import org.extsort.common.SortTimer;
import org.extsort.logging.KeyValueLogMessage;
import org.extsort.logging.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * State and spilling shared by the {@link Sorter} implementations.
 *
 * Spilled runs are kept in creation order, which is also the order used to break ties when they are merged.
 * @param <K> type of key
 * @param <V> type of value
 */
@API(API.Status.INTERNAL)
abstract class AbstractSorter<K, V> implements Sorter<K, V> {
    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractSorter.class);

    /** Lifecycle of a sorter. */
    enum State {
        OPEN,
        DONE,
        FAILED,
        CLOSED
    }

    @Nonnull
    protected final SortOptions options;
    @Nonnull
    protected final SortComparator<K, V> comparator;
    @Nonnull
    protected final SortAdapter<K, V> adapter;
    @Nullable
    protected final SortTimer timer;

    @Nonnull
    private final List<SortIterator<K, V>> spilledRuns = new ArrayList<>();
    @Nonnull
    private State state = State.OPEN;
    private int numSpills;
    protected long memUsed;

    protected AbstractSorter(@Nonnull SortOptions options, @Nonnull SortComparator<K, V> comparator,
                             @Nonnull SortAdapter<K, V> adapter, @Nullable SortTimer timer) {
        this.options = options;
        this.comparator = comparator;
        this.adapter = adapter;
        this.timer = timer;
    }

    @Override
    public void add(@Nonnull K key, @Nonnull V value) {
        checkOpen("add");
        final long startTime = System.nanoTime();
        try {
            final K ownedKey = adapter.getKeySerializer().toOwned(key);
            final V ownedValue = adapter.getValueSerializer().toOwned(value);
            final long footprint = adapter.getKeySerializer().memoryFootprint(ownedKey)
                    + adapter.getValueSerializer().memoryFootprint(ownedValue);
            addOwned(SortPair.of(ownedKey, ownedValue), footprint);
            if (memUsed > options.getMaxMemoryUsageBytes()) {
                if (!options.isExtSortAllowed()) {
                    throw new SortResourceExhaustedException("sort exceeded memory limit but did not opt in to external sorting",
                            LogMessageKeys.MEMORY_USAGE, memUsed,
                            LogMessageKeys.MEMORY_LIMIT, options.getMaxMemoryUsageBytes());
                }
                spill();
            }
        } catch (RuntimeException ex) {
            fail();
            throw ex;
        }
        if (timer != null) {
            timer.recordSinceNanoTime(SortEvents.Events.MEMORY_SORT_STORE_RECORD, startTime);
        }
    }

    @Nonnull
    @Override
    public SortIterator<K, V> done() {
        checkOpen("done");
        state = State.DONE;
        try {
            final List<SortPair<K, V>> remaining = sortBuffer();
            if (spilledRuns.isEmpty()) {
                return new InMemoryIterator<>(remaining);
            }
            final List<SortIterator<K, V>> runs = new ArrayList<>(spilledRuns.size() + 1);
            runs.addAll(spilledRuns);
            runs.add(new InMemoryIterator<>(remaining));
            spilledRuns.clear();
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug(mergeLogMessage(runs.size()).toString());
            }
            return new MergeIterator<>(runs, options.getLimit(), comparator);
        } catch (RuntimeException ex) {
            fail();
            throw ex;
        }
    }

    // Spilling is over at this point, so the timer holds the totals for the whole sort.
    @Nonnull
    KeyValueLogMessage mergeLogMessage(int runCount) {
        final KeyValueLogMessage message = KeyValueLogMessage.build("merging sorted runs",
                LogMessageKeys.RUN_COUNT, runCount,
                LogMessageKeys.SPILL_COUNT, numSpills,
                LogMessageKeys.LIMIT, options.getLimit());
        if (timer != null) {
            message.addKeysAndValues(timer.getKeysAndValues());
        }
        return message;
    }

    /**
     * Take a pair that the sorter now owns.
     * @param pair the pair to add
     * @param footprint estimated memory used by {@code pair}
     */
    protected abstract void addOwned(@Nonnull SortPair<K, V> pair, long footprint);

    /**
     * Sort the buffered pairs, removing them from the buffer and resetting {@link #memUsed}.
     * @return the buffered pairs in order
     */
    @Nonnull
    protected abstract List<SortPair<K, V>> sortBuffer();

    /**
     * Called with each run as it is spilled.
     * @param run the pairs just spilled, in order
     */
    protected void spilled(@Nonnull List<SortPair<K, V>> run) {
    }

    private void spill() {
        final long startTime = System.nanoTime();
        final long spilledMemory = memUsed;
        final List<SortPair<K, V>> run = sortBuffer();
        if (run.isEmpty()) {
            return;
        }
        final SortedFileWriter<K, V> writer = new SortedFileWriter<>(adapter, timer);
        try {
            for (SortPair<K, V> pair : run) {
                writer.addAlreadySorted(pair);
            }
            spilledRuns.add(writer.done());
        } finally {
            writer.close();
        }
        numSpills++;
        spilled(run);
        if (timer != null) {
            timer.increment(SortEvents.Counts.FILE_SORT_SPILLED_RUNS);
            timer.recordSinceNanoTime(SortEvents.Events.FILE_SORT_SPILL, startTime);
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("spilled sorted run",
                    LogMessageKeys.FILE_NAME, writer.getFile(),
                    LogMessageKeys.RECORD_COUNT, run.size(),
                    LogMessageKeys.MEMORY_USAGE, spilledMemory,
                    LogMessageKeys.MEMORY_LIMIT, options.getMaxMemoryUsageBytes(),
                    LogMessageKeys.SPILL_COUNT, numSpills,
                    LogMessageKeys.TIME_NANOS, System.nanoTime() - startTime));
        }
        final int maxNumFiles = adapter.getMaxNumFiles();
        if (maxNumFiles > 0 && spilledRuns.size() > maxNumFiles) {
            mergeSpilledRuns();
        }
    }

    // Every pending run is older than anything spilled later, so the merged run can take their place at the front.
    private void mergeSpilledRuns() {
        final long startTime = System.nanoTime();
        final int runCount = spilledRuns.size();
        final SortedFileWriter<K, V> writer = new SortedFileWriter<>(adapter, timer);
        try (MergeIterator<K, V> merge = new MergeIterator<>(spilledRuns, options.getLimit(), comparator)) {
            spilledRuns.clear();
            while (merge.hasNext()) {
                writer.addAlreadySorted(merge.next());
            }
            spilledRuns.add(writer.done());
        } finally {
            writer.close();
        }
        if (timer != null) {
            timer.increment(SortEvents.Counts.FILE_SORT_INTERMEDIATE_MERGES);
            timer.recordSinceNanoTime(SortEvents.Events.FILE_SORT_MERGE_FILES, startTime);
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("merged spill files",
                    LogMessageKeys.RUN_COUNT, runCount,
                    LogMessageKeys.FILE_NAME, writer.getFile(),
                    LogMessageKeys.RECORD_COUNT, writer.getRecordCount(),
                    LogMessageKeys.TIME_NANOS, System.nanoTime() - startTime));
        }
    }

    private void checkOpen(@Nonnull String operation) {
        if (state != State.OPEN) {
            throw new SortContractException("sorter is not open", LogMessageKeys.OPERATION, operation, LogMessageKeys.STATE, state);
        }
    }

    private void fail() {
        releaseAll();
        state = State.FAILED;
    }

    private void releaseSpilledRuns() {
        for (SortIterator<K, V> run : spilledRuns) {
            run.close();
        }
        spilledRuns.clear();
    }

    private void releaseAll() {
        releaseSpilledRuns();
        clearBuffer();
        memUsed = 0;
    }

    @Override
    public void close() {
        if (state != State.CLOSED) {
            releaseAll();
            state = State.CLOSED;
        }
    }

    /**
     * Drop the buffered pairs without sorting them. Lists already returned by {@link #sortBuffer} must not be touched.
     */
    protected abstract void clearBuffer();

    @Nonnull
    State getState() {
        return state;
    }

    @Override
    public int getNumSpilledRuns() {
        return numSpills;
    }

    @Override
    public long getMemUsed() {
        return memUsed;
    }

    int getPendingRunCount() {
        return spilledRuns.size();
    }
}
