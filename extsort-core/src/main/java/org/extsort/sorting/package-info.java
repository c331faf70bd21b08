/*
 * package-info.java
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

/**
 * Sort key/value pairs that may not fit in memory.
 *
 * <ul>
 * <li>{@code Sorter}: buffer pairs in memory up to a budget, spill sorted runs to files when over it, then
 *     merge the runs. {@code Sorter.make} picks {@code NoLimitSorter} or, when only the first few pairs are
 *     wanted, {@code TopKSorter}.</li>
 *
 * <li>{@code SortedFileWriter} and {@code SortedFileIterator}: write a sorted run to a file and read it back.
 *     The file is shared through a reference counted {@code SpillFile} and deleted when the last holder lets go.</li>
 *
 * <li>{@code MergeIterator}: k-way merge of sorted iterators with ties broken by source order and an optional
 *     limit. Also usable directly through {@code SortIterator.merge}.</li>
 * </ul>
 */
package org.extsort.sorting;
