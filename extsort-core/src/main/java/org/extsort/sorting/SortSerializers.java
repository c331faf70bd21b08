/*
 * SortSerializers.java
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

import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import org.extsort.SortContractException;
import org.extsort.SortCorruptionException;
import org.extsort.annotation.API;
import org.extsort.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * {@link SortSerializer}s for common element types.
 */
@API(API.Status.EXPERIMENTAL)
public final class SortSerializers {
    // Object header plus array header, roughly.
    private static final long ARRAY_OVERHEAD = 16L;
    private static final long STRING_OVERHEAD = 40L;

    private SortSerializers() {
    }

    /**
     * Longs as 8 big-endian bytes, counted as 8 bytes of memory each.
     * @return serializer for {@code Long}
     */
    @Nonnull
    public static SortSerializer<Long> longs() {
        return LongSerializer.INSTANCE;
    }

    /**
     * Integers as 4 big-endian bytes, counted as 4 bytes of memory each.
     * @return serializer for {@code Integer}
     */
    @Nonnull
    public static SortSerializer<Integer> ints() {
        return IntSerializer.INSTANCE;
    }

    /**
     * Strings as UTF-8. A string that is not valid UTF-16, such as one with an unpaired surrogate, is rejected when it
     * is added, and bytes that are not valid UTF-8 are reported as corrupt.
     * @return serializer for {@code String}
     */
    @Nonnull
    public static SortSerializer<String> strings() {
        return StringSerializer.INSTANCE;
    }

    /**
     * Byte arrays as themselves. Added arrays are copied, so callers may reuse their buffers.
     * @return serializer for {@code byte[]}
     */
    @Nonnull
    public static SortSerializer<byte[]> bytes() {
        return BytesSerializer.INSTANCE;
    }

    private static void checkLength(@Nonnull byte[] bytes, int expected) {
        if (bytes.length != expected) {
            throw new SortCorruptionException("serialized element has wrong length",
                    LogMessageKeys.ELEMENT_LENGTH, bytes.length,
                    LogMessageKeys.EXPECTED_LENGTH, expected);
        }
    }

    private enum LongSerializer implements SortSerializer<Long> {
        INSTANCE;

        @Nonnull
        @Override
        public byte[] serialize(@Nonnull Long element) {
            return Longs.toByteArray(element);
        }

        @Nonnull
        @Override
        public Long deserialize(@Nonnull byte[] bytes) {
            checkLength(bytes, Long.BYTES);
            return Longs.fromByteArray(bytes);
        }

        @Override
        public long memoryFootprint(@Nonnull Long element) {
            return Long.BYTES;
        }
    }

    private enum IntSerializer implements SortSerializer<Integer> {
        INSTANCE;

        @Nonnull
        @Override
        public byte[] serialize(@Nonnull Integer element) {
            return Ints.toByteArray(element);
        }

        @Nonnull
        @Override
        public Integer deserialize(@Nonnull byte[] bytes) {
            checkLength(bytes, Integer.BYTES);
            return Ints.fromByteArray(bytes);
        }

        @Override
        public long memoryFootprint(@Nonnull Integer element) {
            return Integer.BYTES;
        }
    }

    private enum StringSerializer implements SortSerializer<String> {
        INSTANCE;

        // Coders are stateful, so each call gets its own.
        @Nonnull
        private static CharsetEncoder encoder() {
            return StandardCharsets.UTF_8.newEncoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT);
        }

        @Nonnull
        private static CharsetDecoder decoder() {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT);
        }

        @Nonnull
        @Override
        public byte[] serialize(@Nonnull String element) {
            final ByteBuffer encoded;
            try {
                encoded = encoder().encode(CharBuffer.wrap(element));
            } catch (CharacterCodingException ex) {
                throw new SortContractException("string element cannot be encoded as UTF-8", ex)
                        .addLogInfo(LogMessageKeys.ELEMENT_LENGTH.toString(), element.length());
            }
            final byte[] bytes = new byte[encoded.remaining()];
            encoded.get(bytes);
            return bytes;
        }

        @Nonnull
        @Override
        public String deserialize(@Nonnull byte[] bytes) {
            try {
                return decoder().decode(ByteBuffer.wrap(bytes)).toString();
            } catch (CharacterCodingException ex) {
                throw new SortCorruptionException("serialized string is not valid UTF-8", ex)
                        .addLogInfo(LogMessageKeys.ELEMENT_LENGTH.toString(), bytes.length);
            }
        }

        @Override
        public long memoryFootprint(@Nonnull String element) {
            return STRING_OVERHEAD + 2L * element.length();
        }

        @Nonnull
        @Override
        public String toOwned(@Nonnull String element) {
            if (!encoder().canEncode(element)) {
                throw new SortContractException("string element cannot be encoded as UTF-8",
                        LogMessageKeys.ELEMENT_LENGTH, element.length());
            }
            return element;
        }
    }

    private enum BytesSerializer implements SortSerializer<byte[]> {
        INSTANCE;

        @Nonnull
        @Override
        public byte[] serialize(@Nonnull byte[] element) {
            return element;
        }

        @Nonnull
        @Override
        public byte[] deserialize(@Nonnull byte[] bytes) {
            return bytes;
        }

        @Override
        public long memoryFootprint(@Nonnull byte[] element) {
            return ARRAY_OVERHEAD + element.length;
        }

        @Nonnull
        @Override
        public byte[] toOwned(@Nonnull byte[] element) {
            return element.clone();
        }
    }
}
