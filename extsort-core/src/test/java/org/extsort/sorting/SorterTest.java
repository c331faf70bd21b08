/*
 * SorterTest.java
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
import org.extsort.SortStorageException;
import org.extsort.common.SortTimer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import javax.annotation.Nonnull;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.extsort.sorting.SortTestUtils.ASCENDING;
import static org.extsort.sorting.SortTestUtils.drain;
import static org.extsort.sorting.SortTestUtils.filesIn;
import static org.extsort.sorting.SortTestUtils.keys;
import static org.extsort.sorting.SortTestUtils.longAdapter;
import static org.extsort.sorting.SortTestUtils.longAdapterBuilder;
import static org.extsort.sorting.SortTestUtils.referenceSort;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link Sorter}.
 */
public class SorterTest {
    @TempDir
    Path tempDir;

    @Nonnull
    private static List<SortPair<Long, Long>> shuffledKeys(int count, long seed) {
        final List<Long> keys = LongStream.range(0, count).boxed().collect(Collectors.toList());
        Collections.shuffle(keys, new Random(seed));
        final List<SortPair<Long, Long>> pairs = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            pairs.add(SortPair.of(keys.get(i), (long)i));
        }
        return pairs;
    }

    @Nonnull
    private static List<SortPair<Long, Long>> duplicateKeys(int count, int distinct, long seed) {
        final Random random = new Random(seed);
        final List<SortPair<Long, Long>> pairs = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            pairs.add(SortPair.of((long)random.nextInt(distinct), (long)i));
        }
        return pairs;
    }

    private static void addAll(@Nonnull Sorter<Long, Long> sorter, @Nonnull List<SortPair<Long, Long>> pairs) {
        for (SortPair<Long, Long> pair : pairs) {
            sorter.add(pair.getKey(), pair.getValue());
        }
    }

    @Test
    public void manySpillsMatchReferenceSort() throws Exception {
        final SortOptions options = SortOptions.newBuilder()
                .setMaxMemoryUsageBytes(1024)
                .setExtSortAllowed(true)
                .build();
        final List<SortPair<Long, Long>> input = shuffledKeys(10_000, 1066);
        final SortTimer timer = new SortTimer();
        final List<SortPair<Long, Long>> output;
        try (Sorter<Long, Long> sorter = Sorter.make(options, ASCENDING, longAdapter(tempDir), timer)) {
            addAll(sorter, input);
            assertThat(sorter.getNumSpilledRuns(), greaterThan(1));
            assertEquals(sorter.getNumSpilledRuns(), timer.getCount(SortEvents.Counts.FILE_SORT_SPILLED_RUNS));
            try (SortIterator<Long, Long> iterator = sorter.done()) {
                output = drain(iterator);
            }
        }
        assertThat(output, hasSize(10_000));
        for (int i = 0; i < output.size(); i++) {
            assertEquals(i, output.get(i).getKey().longValue());
        }
        assertEquals(referenceSort(input), output);
        assertThat(filesIn(tempDir), empty());
    }

    @Test
    public void limitWithoutSpill() throws Exception {
        final SortOptions options = SortOptions.newBuilder()
                .setLimit(5)
                .setMaxMemoryUsageBytes(Long.MAX_VALUE)
                .setExtSortAllowed(false)
                .build();
        final Random random = new Random(2024);
        final List<Long> keys = new ArrayList<>();
        try (Sorter<Long, Long> sorter = Sorter.make(options, ASCENDING, longAdapter(tempDir))) {
            for (int i = 0; i < 100; i++) {
                long key = random.nextInt(1_000_000);
                keys.add(key);
                sorter.add(key, (long)i);
            }
            final List<SortPair<Long, Long>> output = drain(sorter.done());
            assertEquals(0, sorter.getNumSpilledRuns());
            Collections.sort(keys);
            assertEquals(keys.subList(0, 5), keys(output));
        }
        assertThat(filesIn(tempDir), empty());
    }

    @Test
    public void inMemoryPathWritesNothing() throws Exception {
        final List<SortPair<Long, Long>> input = duplicateKeys(500, 20, 7);
        try (Sorter<Long, Long> sorter = Sorter.make(SortOptions.DEFAULT, ASCENDING, longAdapter(tempDir))) {
            addAll(sorter, input);
            assertEquals(500 * 16L, sorter.getMemUsed());
            final SortIterator<Long, Long> iterator = sorter.done();
            assertThat(iterator, instanceOf(InMemoryIterator.class));
            assertEquals(referenceSort(input), drain(iterator));
            assertEquals(0, sorter.getNumSpilledRuns());
        }
        assertThat(filesIn(tempDir), empty());
    }

    @ParameterizedTest(name = "equalKeysKeepInsertionOrder [maxMemory = {0}]")
    @ValueSource(longs = {64, 200, 1000, 100_000})
    public void equalKeysKeepInsertionOrder(long maxMemory) throws Exception {
        final SortOptions options = SortOptions.newBuilder()
                .setMaxMemoryUsageBytes(maxMemory)
                .setExtSortAllowed(true)
                .build();
        final List<SortPair<Long, Long>> input = duplicateKeys(2000, 7, maxMemory);
        try (Sorter<Long, Long> sorter = Sorter.make(options, ASCENDING, longAdapter(tempDir))) {
            addAll(sorter, input);
            final List<SortPair<Long, Long>> output = drain(sorter.done());
            assertEquals(referenceSort(input), output);
            for (int i = 1; i < output.size(); i++) {
                if (output.get(i - 1).getKey().equals(output.get(i).getKey())) {
                    assertTrue(output.get(i - 1).getValue() < output.get(i).getValue());
                }
            }
        }
        assertThat(filesIn(tempDir), empty());
    }

    @ParameterizedTest(name = "limitMatchesPrefix [limit = {0}]")
    @ValueSource(longs = {1, 3, 50, 999, 1000, 5000})
    public void limitMatchesPrefix(long limit) throws Exception {
        final SortOptions options = SortOptions.newBuilder()
                .setLimit(limit)
                .setMaxMemoryUsageBytes(256)
                .setExtSortAllowed(true)
                .build();
        final List<SortPair<Long, Long>> input = duplicateKeys(1000, 37, limit);
        final List<SortPair<Long, Long>> expected = referenceSort(input).subList(0, (int)Math.min(limit, input.size()));
        try (Sorter<Long, Long> sorter = Sorter.make(options, ASCENDING, longAdapter(tempDir))) {
            addAll(sorter, input);
            assertEquals(expected, drain(sorter.done()));
        }
        assertThat(filesIn(tempDir), empty());
    }

    @Test
    public void descendingOrder() {
        final SortOptions options = SortOptions.newBuilder()
                .setMaxMemoryUsageBytes(128)
                .setExtSortAllowed(true)
                .build();
        final List<SortPair<Long, Long>> input = shuffledKeys(300, 99);
        try (Sorter<Long, Long> sorter = Sorter.make(options, ASCENDING.reversed(), longAdapter(tempDir))) {
            addAll(sorter, input);
            final List<Long> output = keys(drain(sorter.done()));
            final List<Long> expected = LongStream.range(0, 300).boxed().sorted(Comparator.reverseOrder()).collect(Collectors.toList());
            assertEquals(expected, output);
        }
    }

    @Test
    public void memoryLimitWithoutExternalSort() throws Exception {
        final SortOptions options = SortOptions.newBuilder()
                .setMaxMemoryUsageBytes(100)
                .setExtSortAllowed(false)
                .build();
        final Sorter<Long, Long> sorter = Sorter.make(options, ASCENDING, longAdapter(tempDir));
        for (long i = 0; i < 6; i++) {
            sorter.add(i, i);
        }
        assertEquals(96L, sorter.getMemUsed());
        SortResourceExhaustedException ex = assertThrows(SortResourceExhaustedException.class, () -> sorter.add(6L, 6L));
        assertEquals(112L, ex.getLogInfo().get("memory_usage"));
        assertThrows(SortContractException.class, sorter::done);
        sorter.close();
        assertThat(filesIn(tempDir), empty());
    }

    @Test
    public void topKMemoryLimitWithoutExternalSort() {
        final SortOptions options = SortOptions.newBuilder()
                .setLimit(10)
                .setMaxMemoryUsageBytes(100)
                .setExtSortAllowed(false)
                .build();
        try (Sorter<Long, Long> sorter = Sorter.make(options, ASCENDING, longAdapter(tempDir))) {
            for (long i = 0; i < 6; i++) {
                sorter.add(i, i);
            }
            assertThrows(SortResourceExhaustedException.class, () -> sorter.add(6L, 6L));
        }
    }

    @Test
    public void addAfterDone() {
        try (Sorter<Long, Long> sorter = Sorter.make(SortOptions.DEFAULT, ASCENDING, longAdapter(tempDir))) {
            sorter.add(1L, 1L);
            sorter.done().close();
            assertThrows(SortContractException.class, () -> sorter.add(2L, 2L));
            assertThrows(SortContractException.class, sorter::done);
        }
    }

    @Test
    public void addAfterClose() {
        final Sorter<Long, Long> sorter = Sorter.make(SortOptions.DEFAULT, ASCENDING, longAdapter(tempDir));
        sorter.close();
        assertThrows(SortContractException.class, () -> sorter.add(1L, 1L));
        assertThrows(SortContractException.class, sorter::done);
        sorter.close();
    }

    @Test
    public void emptyInput() {
        try (Sorter<Long, Long> sorter = Sorter.make(SortOptions.DEFAULT, ASCENDING, longAdapter(tempDir))) {
            final SortIterator<Long, Long> iterator = sorter.done();
            assertFalse(iterator.hasNext());
        }
    }

    @Test
    public void closeBeforeDoneDeletesSpills() throws Exception {
        final SortOptions options = SortOptions.newBuilder()
                .setMaxMemoryUsageBytes(160)
                .setExtSortAllowed(true)
                .build();
        final Sorter<Long, Long> sorter = Sorter.make(options, ASCENDING, longAdapter(tempDir));
        addAll(sorter, shuffledKeys(200, 3));
        assertThat(sorter.getNumSpilledRuns(), greaterThan(0));
        assertThat(filesIn(tempDir), hasSize(sorter.getNumSpilledRuns()));
        sorter.close();
        assertThat(filesIn(tempDir), empty());
        assertEquals(0L, sorter.getMemUsed());
    }

    @Test
    public void closeIteratorMidMergeDeletesSpills() throws Exception {
        final SortOptions options = SortOptions.newBuilder()
                .setMaxMemoryUsageBytes(160)
                .setExtSortAllowed(true)
                .build();
        try (Sorter<Long, Long> sorter = Sorter.make(options, ASCENDING, longAdapter(tempDir))) {
            addAll(sorter, shuffledKeys(500, 4));
            final SortIterator<Long, Long> iterator = sorter.done();
            for (int i = 0; i < 10; i++) {
                assertEquals(i, iterator.next().getKey().longValue());
            }
            assertThat(filesIn(tempDir), hasSize(sorter.getNumSpilledRuns()));
            iterator.close();
            assertThat(filesIn(tempDir), empty());
            assertFalse(iterator.hasNext());
        }
    }

    @Test
    public void spillFilesReleasedWhenLimitReached() throws Exception {
        final SortOptions options = SortOptions.newBuilder()
                .setLimit(20)
                .setMaxMemoryUsageBytes(160)
                .setExtSortAllowed(true)
                .build();
        try (Sorter<Long, Long> sorter = Sorter.make(options, ASCENDING, longAdapter(tempDir))) {
            addAll(sorter, shuffledKeys(500, 5));
            assertThat(sorter.getNumSpilledRuns(), greaterThan(0));
            final SortIterator<Long, Long> iterator = sorter.done();
            assertEquals(LongStream.range(0, 20).boxed().collect(Collectors.toList()), keys(drain(iterator)));
            assertThat(filesIn(tempDir), empty());
        }
    }

    @Test
    public void intermediateMerges() throws Exception {
        final SortOptions options = SortOptions.newBuilder()
                .setMaxMemoryUsageBytes(160)
                .setExtSortAllowed(true)
                .build();
        final SimpleSortAdapter<Long, Long> adapter = longAdapterBuilder(tempDir).setMaxNumFiles(3).build();
        final SortTimer timer = new SortTimer();
        final List<SortPair<Long, Long>> input = duplicateKeys(1000, 50, 11);
        try (Sorter<Long, Long> sorter = Sorter.make(options, ASCENDING, adapter, timer)) {
            addAll(sorter, input);
            assertThat(sorter.getNumSpilledRuns(), greaterThan(3));
            assertThat(timer.getCount(SortEvents.Counts.FILE_SORT_INTERMEDIATE_MERGES), greaterThan(0));
            assertTrue(filesIn(tempDir).size() <= 3);
            assertEquals(referenceSort(input), drain(sorter.done()));
        }
        assertThat(filesIn(tempDir), empty());
    }

    @Test
    public void compressedSpills() throws Exception {
        final SortOptions options = SortOptions.newBuilder()
                .setMaxMemoryUsageBytes(512)
                .setExtSortAllowed(true)
                .build();
        final SimpleSortAdapter<Long, Long> adapter = longAdapterBuilder(tempDir).setCompressed(true).build();
        final List<SortPair<Long, Long>> input = duplicateKeys(3000, 100, 12);
        try (Sorter<Long, Long> sorter = Sorter.make(options, ASCENDING, adapter)) {
            addAll(sorter, input);
            assertThat(sorter.getNumSpilledRuns(), greaterThan(1));
            assertEquals(referenceSort(input), drain(sorter.done()));
        }
        assertThat(filesIn(tempDir), empty());
    }

    @Test
    public void addedElementsAreOwned() {
        final SimpleSortAdapter<byte[], String> adapter = SimpleSortAdapter.newBuilder(SortSerializers.bytes(), SortSerializers.strings())
                .setDirectory(tempDir.toFile())
                .build();
        final SortComparator<byte[], String> byBytes = SortComparator.byKey(Comparator.comparing((byte[] bytes) -> new String(bytes, StandardCharsets.UTF_8)));
        final SortOptions options = SortOptions.newBuilder()
                .setMaxMemoryUsageBytes(64)
                .setExtSortAllowed(true)
                .build();
        final byte[] buffer = new byte[1];
        try (Sorter<byte[], String> sorter = Sorter.make(options, byBytes, adapter)) {
            for (char c : "dbeac".toCharArray()) {
                buffer[0] = (byte)c;
                sorter.add(buffer, String.valueOf(c));
            }
            buffer[0] = 'z';
            final List<SortPair<byte[], String>> output = drain(sorter.done());
            assertThat(output.stream().map(SortPair::getValue).collect(Collectors.toList()), contains("a", "b", "c", "d", "e"));
            for (SortPair<byte[], String> pair : output) {
                assertEquals(pair.getValue(), new String(pair.getKey(), StandardCharsets.UTF_8));
            }
        }
    }

    @Test
    public void spillFailureIsFatal() throws Exception {
        final SortAdapter<Long, Long> failing = new SortAdapter<>() {
            @Nonnull
            @Override
            public SortSerializer<Long> getKeySerializer() {
                return SortSerializers.longs();
            }

            @Nonnull
            @Override
            public SortSerializer<Long> getValueSerializer() {
                return SortSerializers.longs();
            }

            @Nonnull
            @Override
            public File generateFilename() throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public boolean isCompressed() {
                return false;
            }

            @Override
            public int getMaxNumFiles() {
                return 0;
            }
        };
        final SortOptions options = SortOptions.newBuilder()
                .setMaxMemoryUsageBytes(32)
                .setExtSortAllowed(true)
                .build();
        try (Sorter<Long, Long> sorter = Sorter.make(options, ASCENDING, failing)) {
            sorter.add(1L, 1L);
            sorter.add(2L, 2L);
            SortStorageException ex = assertThrows(SortStorageException.class, () -> sorter.add(3L, 3L));
            assertThat(ex.getCause(), instanceOf(IOException.class));
            assertThrows(SortContractException.class, () -> sorter.add(4L, 4L));
        }
    }

    @Nonnull
    private static SortSerializer<Long> footprintFailsAt(long badKey) {
        final SortSerializer<Long> longs = SortSerializers.longs();
        return new SortSerializer<>() {
            @Nonnull
            @Override
            public byte[] serialize(@Nonnull Long element) {
                return longs.serialize(element);
            }

            @Nonnull
            @Override
            public Long deserialize(@Nonnull byte[] bytes) {
                return longs.deserialize(bytes);
            }

            @Override
            public long memoryFootprint(@Nonnull Long element) {
                if (element == badKey) {
                    throw new IllegalStateException("cannot size element");
                }
                return longs.memoryFootprint(element);
            }
        };
    }

    @Test
    public void elementFailureIsFatal() throws Exception {
        final SortAdapter<Long, Long> adapter = SimpleSortAdapter.newBuilder(footprintFailsAt(13L), SortSerializers.longs())
                .setDirectory(tempDir.toFile())
                .build();
        final SortOptions options = SortOptions.newBuilder()
                .setMaxMemoryUsageBytes(64)
                .setExtSortAllowed(true)
                .build();
        try (Sorter<Long, Long> sorter = Sorter.make(options, ASCENDING, adapter)) {
            for (long i = 0; i < 13; i++) {
                sorter.add(i, i);
            }
            assertThat(sorter.getNumSpilledRuns(), greaterThan(0));
            assertThrows(IllegalStateException.class, () -> sorter.add(13L, 13L));
            assertEquals(AbstractSorter.State.FAILED, ((AbstractSorter<Long, Long>)sorter).getState());
            assertEquals(0L, sorter.getMemUsed());
            assertThat(filesIn(tempDir), empty());
            assertThrows(SortContractException.class, () -> sorter.add(14L, 14L));
            assertThrows(SortContractException.class, sorter::done);
        }
    }

    @Test
    public void invalidStringIsRejectedOnAdd() throws Exception {
        final SortAdapter<String, String> adapter = SimpleSortAdapter.newBuilder(SortSerializers.strings(), SortSerializers.strings())
                .setDirectory(tempDir.toFile())
                .build();
        final SortOptions options = SortOptions.newBuilder()
                .setMaxMemoryUsageBytes(1)
                .setExtSortAllowed(true)
                .build();
        try (Sorter<String, String> sorter = Sorter.make(options, SortComparator.byKey(Comparator.<String>naturalOrder()), adapter)) {
            assertThrows(SortContractException.class, () -> sorter.add("a", "x\uD800y"));
            assertEquals(AbstractSorter.State.FAILED, ((AbstractSorter<String, String>)sorter).getState());
            assertThat(filesIn(tempDir), empty());
        }
    }

    @Test
    public void mergeMessageIncludesTimerTotals() throws Exception {
        final SortOptions options = SortOptions.newBuilder()
                .setMaxMemoryUsageBytes(32)
                .setExtSortAllowed(true)
                .build();
        final SortTimer timer = new SortTimer();
        try (Sorter<Long, Long> sorter = Sorter.make(options, ASCENDING, longAdapter(tempDir), timer)) {
            addAll(sorter, shuffledKeys(10, 7L));
            final Map<String, String> logged = ((AbstractSorter<Long, Long>)sorter).mergeLogMessage(sorter.getNumSpilledRuns())
                    .getKeyValueMap();
            assertEquals(Integer.toString(sorter.getNumSpilledRuns()), logged.get("file_sort_spilled_runs_count"));
            assertEquals(Integer.toString(sorter.getNumSpilledRuns()), logged.get("run_count"));
            assertTrue(logged.containsKey("file_sort_spill_micros"));
        }
    }
}
