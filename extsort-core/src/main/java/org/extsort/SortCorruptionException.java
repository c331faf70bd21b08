/*
 * SortCorruptionException.java
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

package org.extsort;

import org.extsort.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A spill file does not hold what was written to it: bad header, bad length prefix, truncated record
 * or a record count that does not match its contents.
 */
@API(API.Status.UNSTABLE)
@SuppressWarnings("serial")
public class SortCorruptionException extends SortException {
    public SortCorruptionException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    public SortCorruptionException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg, keyValues);
    }
}
