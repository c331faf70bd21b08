/*
 * LoggableException.java
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

package org.extsort.util;

import org.extsort.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unchecked exception that carries keys and values for structured logging.
 */
@SuppressWarnings("serial")
@API(API.Status.UNSTABLE)
public class LoggableException extends RuntimeException implements LoggableKeysAndValues<LoggableException> {
    private static final Object[] EMPTY_LOG_INFO = new Object[0];

    @Nullable
    private Map<String, Object> logInfo;

    /**
     * Create an exception with a message and alternating keys and values.
     * @param msg error message
     * @param keyValues flattened keys and values
     * @throws IllegalArgumentException if {@code keyValues} has an odd length
     */
    public LoggableException(@Nonnull String msg, @Nullable Object... keyValues) {
        super(msg);
        if (keyValues != null) {
            addLogInfo(keyValues);
        }
    }

    public LoggableException(Throwable cause) {
        super(cause);
    }

    public LoggableException(@Nonnull String msg, @Nullable Throwable cause) {
        super(msg, cause);
    }

    public LoggableException(@Nonnull String msg) {
        super(msg);
    }

    @Nonnull
    @Override
    public Map<String, Object> getLogInfo() {
        if (logInfo == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(logInfo);
    }

    @Nonnull
    @Override
    public LoggableException addLogInfo(@Nonnull String description, Object object) {
        if (logInfo == null) {
            logInfo = new LinkedHashMap<>();
        }
        logInfo.put(description, object);
        return this;
    }

    @Nonnull
    @Override
    public LoggableException addLogInfo(@Nonnull Object... keyValue) {
        if ((keyValue.length % 2) != 0) {
            throw new IllegalArgumentException("Unbalanced key/value logging info");
        }
        for (int i = 0; i < keyValue.length; i += 2) {
            addLogInfo(String.valueOf(keyValue[i]), keyValue[i + 1]);
        }
        return this;
    }

    @Nonnull
    @Override
    public Object[] exportLogInfo() {
        if (logInfo == null) {
            return EMPTY_LOG_INFO;
        }
        final Object[] exported = new Object[2 * logInfo.size()];
        int i = 0;
        for (Map.Entry<String, Object> entry : logInfo.entrySet()) {
            exported[i++] = entry.getKey();
            exported[i++] = entry.getValue();
        }
        return exported;
    }

    @Override
    public String getMessage() {
        final String message = super.getMessage();
        if (logInfo == null || logInfo.isEmpty()) {
            return message;
        }
        final StringBuilder sb = new StringBuilder(message == null ? "" : message);
        for (Map.Entry<String, Object> entry : logInfo.entrySet()) {
            sb.append(' ').append(entry.getKey()).append("=\"").append(entry.getValue()).append('"');
        }
        return sb.toString();
    }
}
