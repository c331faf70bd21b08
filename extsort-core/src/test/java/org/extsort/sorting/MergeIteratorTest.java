/*
 * MergeIteratorTest.java
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

import org.extsort.SortCorruptionException;
import org.extsort.sorting.SortTestUtils.CountingIterator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.annotation.Nonnull;
import java.io.RandomAccessFile;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static org.extsort.sorting.SortTestUtils.ASCENDING;
import static org.extsort.sorting.SortTestUtils.drain;
import static org.extsort.sorting.SortTestUtils.filesIn;
import static org.extsort.sorting.SortTestUtils.longAdapter;
import static org.extsort.sorting.SortTestUtils.writeRun;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link MergeIterator}.
 */
public class MergeIteratorTest {
    @TempDir
    Path tempDir;

    @Nonnull
    private static List<SortPair<Long, Long>> run(long source, long... keys) {
        final List<SortPair<Long, Long>> pairs = new ArrayList<>(keys.length);
        for (long key : keys) {
            pairs.add(SortPair.of(key, source));
        }
        return pairs;
    }

    @Test
    public void equalKeysInSourceOrder() {
        final List<SortIterator<Long, Long>> sources = List.of(
                new InMemoryIterator<>(run(0, 1, 4, 7)),
                new InMemoryIterator<>(run(1)),
                new InMemoryIterator<>(run(2, 1, 2, 4, 8, 9)));
        final List<SortPair<Long, Long>> output = drain(SortIterator.merge(sources, SortOptions.DEFAULT, ASCENDING));
        assertThat(output, contains(
                SortPair.of(1L, 0L),
                SortPair.of(1L, 2L),
                SortPair.of(2L, 2L),
                SortPair.of(4L, 0L),
                SortPair.of(4L, 2L),
                SortPair.of(7L, 0L),
                SortPair.of(8L, 2L),
                SortPair.of(9L, 2L)));
    }

    @Test
    public void laterSourceWinsOnlyWhenStrictlyLess() {
        // The same key everywhere: output follows source order exactly.
        final List<SortIterator<Long, Long>> sources = List.of(
                new InMemoryIterator<>(run(0, 5, 5)),
                new InMemoryIterator<>(run(1, 5)),
                new InMemoryIterator<>(run(2, 5, 5, 5)));
        final List<SortPair<Long, Long>> output = drain(new MergeIterator<>(sources, 0, ASCENDING));
        final List<Long> order = new ArrayList<>();
        for (SortPair<Long, Long> pair : output) {
            order.add(pair.getValue());
        }
        assertEquals(List.of(0L, 0L, 1L, 2L, 2L, 2L), order);
    }

    @Test
    public void fileSources() throws Exception {
        final List<SortIterator<Long, Long>> sources = List.of(
                writeRun(longAdapter(tempDir), run(0, 1, 4, 7)),
                writeRun(longAdapter(tempDir), run(1)),
                writeRun(longAdapter(tempDir), run(2, 1, 2, 4, 8, 9)));
        final MergeIterator<Long, Long> merge = new MergeIterator<>(sources, 0, ASCENDING);
        assertEquals(3, merge.getSourceCount());
        final List<SortPair<Long, Long>> output = drain(merge);
        assertEquals(8, output.size());
        assertEquals(SortPair.of(1L, 0L), output.get(0));
        assertEquals(SortPair.of(1L, 2L), output.get(1));
        assertThat(filesIn(tempDir), empty());
    }

    @Test
    public void noSources() {
        final MergeIterator<Long, Long> merge = new MergeIterator<>(List.of(), 0, ASCENDING);
        assertFalse(merge.hasNext());
        assertThrows(NoSuchElementException.class, merge::next);
    }

    @Test
    public void allSourcesEmpty() {
        final CountingIterator first = new CountingIterator(List.of());
        final CountingIterator second = new CountingIterator(List.of());
        final MergeIterator<Long, Long> merge = new MergeIterator<>(List.of(first, second), 0, ASCENDING);
        assertFalse(merge.hasNext());
        assertTrue(first.isClosed());
        assertTrue(second.isClosed());
    }

    @Test
    public void limitStopsReading() {
        final CountingIterator first = new CountingIterator(run(0, 1, 2, 3));
        final CountingIterator second = new CountingIterator(run(1, 4, 5, 6));
        final MergeIterator<Long, Long> merge = new MergeIterator<>(List.of(first, second), 2, ASCENDING);
        assertEquals(SortPair.of(1L, 0L), merge.next());
        assertEquals(SortPair.of(2L, 0L), merge.next());
        assertFalse(merge.hasNext());
        // Only the heads and the one advance needed for the second pair.
        assertEquals(2, first.getReads());
        assertEquals(1, second.getReads());
        assertTrue(first.isClosed());
        assertTrue(second.isClosed());
        assertFalse(merge.hasNext());
        assertEquals(2, first.getReads());
    }

    @Test
    public void advancesOnlyWhenAsked() {
        final CountingIterator first = new CountingIterator(run(0, 1, 2, 3));
        final CountingIterator second = new CountingIterator(run(1, 4, 5, 6));
        final MergeIterator<Long, Long> merge = new MergeIterator<>(List.of(first, second), 0, ASCENDING);
        merge.next();
        assertEquals(1, first.getReads());
        assertTrue(merge.hasNext());
        assertTrue(merge.hasNext());
        assertEquals(2, first.getReads());
        merge.close();
        assertTrue(first.isClosed());
        assertTrue(second.isClosed());
        assertFalse(merge.hasNext());
    }

    @Test
    public void limitLargerThanInput() {
        final MergeIterator<Long, Long> merge = new MergeIterator<>(List.of(
                new InMemoryIterator<>(run(0, 3)), new InMemoryIterator<>(run(1, 1, 2))), 10, ASCENDING);
        assertThat(SortTestUtils.keys(drain(merge)), contains(1L, 2L, 3L));
    }

    @Test
    public void descendingSources() {
        final SortComparator<Long, Long> descending = ASCENDING.reversed();
        final MergeIterator<Long, Long> merge = new MergeIterator<>(List.of(
                new InMemoryIterator<>(run(0, 9, 5, 5)), new InMemoryIterator<>(run(1, 8, 5))), 0, descending);
        final List<SortPair<Long, Long>> output = drain(merge);
        assertThat(output, contains(
                SortPair.of(9L, 0L),
                SortPair.of(8L, 1L),
                SortPair.of(5L, 0L),
                SortPair.of(5L, 0L),
                SortPair.of(5L, 1L)));
    }

    @Test
    public void corruptSourceClosesAll() throws Exception {
        final SortedFileIterator<Long, Long> good = writeRun(longAdapter(tempDir), run(0, 1, 2, 3));
        final SortedFileIterator<Long, Long> bad = writeRun(longAdapter(tempDir), run(1, 1, 2, 3));
        try (RandomAccessFile file = new RandomAccessFile(bad.getSpillFile().getFile(), "rw")) {
            file.setLength(SortedFileWriter.HEADER_SIZE + 3);
        }
        final MergeIterator<Long, Long> merge = new MergeIterator<>(List.of(good, bad), 0, ASCENDING);
        assertThrows(SortCorruptionException.class, merge::hasNext);
        assertFalse(merge.hasNext());
        assertThat(filesIn(tempDir), empty());
    }
}
