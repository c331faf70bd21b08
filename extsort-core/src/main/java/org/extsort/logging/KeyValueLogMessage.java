/*
 * KeyValueLogMessage.java
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

package org.extsort.logging;

import org.extsort.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A formatter for log messages.
 *
 * A {@code KeyValueLogMessage} has a static title followed by keys and values in {@code key="value"} form,
 * sorted by key.
 */
@API(API.Status.UNSTABLE)
public class KeyValueLogMessage {
    @Nonnull
    private final String staticMessage;
    @Nonnull
    private final Map<String, String> keyValueMap;

    private KeyValueLogMessage(@Nonnull String staticMessage, @Nonnull Map<String, String> keyValueMap) {
        this.staticMessage = staticMessage;
        this.keyValueMap = keyValueMap;
    }

    public static String of(@Nonnull String staticMessage, @Nullable Object... keysAndValues) {
        return build(staticMessage, keysAndValues).toString();
    }

    public static KeyValueLogMessage build(@Nonnull String staticMessage, @Nullable Object... keysAndValues) {
        final KeyValueLogMessage message = new KeyValueLogMessage(staticMessage, new TreeMap<>());
        if (keysAndValues != null) {
            if (keysAndValues.length % 2 == 1) {
                throw new IllegalArgumentException("keys and values don't match");
            }
            for (int i = 0; i < keysAndValues.length; i += 2) {
                message.addKeyAndValue(keysAndValues[i], keysAndValues[i + 1]);
            }
        }
        return message;
    }

    public KeyValueLogMessage addKeyAndValue(@Nullable Object key, @Nullable Object value) {
        if (key == null) {
            throw new IllegalArgumentException("null key passed to KeyValueLogMessage");
        }
        keyValueMap.put(key.toString().replace("=", ""), Objects.toString(value).replace("\"", "'"));
        return this;
    }

    public KeyValueLogMessage addKeysAndValues(@Nonnull Map<?, ?> map) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            addKeyAndValue(entry.getKey(), entry.getValue());
        }
        return this;
    }

    @Nonnull
    public Map<String, String> getKeyValueMap() {
        return Collections.unmodifiableMap(keyValueMap);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder(staticMessage.length() + keyValueMap.size() * 30);
        sb.append(staticMessage);
        for (Map.Entry<String, String> entry : keyValueMap.entrySet()) {
            sb.append(' ').append(entry.getKey()).append("=\"").append(entry.getValue()).append('"');
        }
        return sb.toString();
    }
}
