/*
 * SortedFileIterator.java
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

import com.google.common.io.ByteStreams;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.InvalidProtocolBufferException;
import org.extsort.SortCorruptionException;
import org.extsort.SortException;
import org.extsort.SortStorageException;
import org.extsort.annotation.API;
import org.extsort.common.SortTimer;
import org.extsort.logging.KeyValueLogMessage;
import org.extsort.logging.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.EOFException;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.NoSuchElementException;
import java.util.zip.InflaterInputStream;
import java.util.zip.ZipException;

/**
 * Read pairs back from a file written by {@link SortedFileWriter}, one at a time.
 *
 * The file is not opened until the first pair is needed. It is closed and released as soon as the last pair has been
 * read. Anything unexpected in the file is reported as {@link SortCorruptionException}: the file was written by this
 * process moments ago, so there is nothing to recover.
 * @param <K> type of key
 * @param <V> type of value
 */
@API(API.Status.EXPERIMENTAL)
public class SortedFileIterator<K, V> implements SortIterator<K, V> {
    private static final Logger LOGGER = LoggerFactory.getLogger(SortedFileIterator.class);

    @Nonnull
    private final SpillFile spillFile;
    private final long recordCount;
    @Nonnull
    private final SortSerializer<K> keySerializer;
    @Nonnull
    private final SortSerializer<V> valueSerializer;
    @Nullable
    private final SortTimer timer;

    @Nullable
    private InputStream inputStream;
    @Nullable
    private CodedInputStream entryStream;
    private long recordPosition;
    private boolean released;

    SortedFileIterator(@Nonnull SpillFile spillFile, long recordCount,
                       @Nonnull SortSerializer<K> keySerializer, @Nonnull SortSerializer<V> valueSerializer,
                       @Nullable SortTimer timer) {
        this.spillFile = spillFile.retain();
        this.recordCount = recordCount;
        this.keySerializer = keySerializer;
        this.valueSerializer = valueSerializer;
        this.timer = timer;
    }

    @Nonnull
    public SpillFile getSpillFile() {
        return spillFile;
    }

    public long getRecordCount() {
        return recordCount;
    }

    public long getRecordPosition() {
        return recordPosition;
    }

    @Override
    public boolean hasNext() {
        if (released) {
            return false;
        }
        if (recordPosition >= recordCount) {
            close();
            return false;
        }
        return true;
    }

    @Nonnull
    @Override
    public SortPair<K, V> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        final long startTime = System.nanoTime();
        final SortPair<K, V> pair;
        try {
            if (entryStream == null) {
                open();
            }
            final byte[] key = entryStream.readByteArray();
            final byte[] value = entryStream.readByteArray();
            entryStream.resetSizeCounter();
            pair = SortPair.of(keySerializer.deserialize(key), valueSerializer.deserialize(value));
            recordPosition++;
            if (recordPosition == recordCount && !entryStream.isAtEnd()) {
                throw corrupt("spill file has data after its last record", null);
            }
        } catch (InvalidProtocolBufferException | EOFException | ZipException ex) {
            throw corrupt("spill file record is truncated or malformed", ex);
        } catch (IOException ex) {
            close();
            throw new SortStorageException("could not read spill file", ex)
                    .addLogInfo(LogMessageKeys.FILE_NAME.toString(), spillFile.getFile(),
                            LogMessageKeys.RECORD_POSITION.toString(), recordPosition);
        } catch (SortException ex) {
            close();
            throw ex;
        }
        if (timer != null) {
            timer.recordSinceNanoTime(SortEvents.Events.FILE_SORT_LOAD_RECORD, startTime);
        }
        if (recordPosition == recordCount) {
            close();
        }
        return pair;
    }

    private void open() throws IOException {
        inputStream = new FileInputStream(spillFile.getFile());
        final byte[] header = new byte[SortedFileWriter.HEADER_SIZE];
        ByteStreams.readFully(inputStream, header);
        final CodedInputStream headerStream = CodedInputStream.newInstance(header);
        final int magic = headerStream.readFixed32();
        final int version = headerStream.readFixed32();
        final int flags = headerStream.readFixed32();
        final long headerRecordCount = headerStream.readFixed64();
        if (magic != SortedFileWriter.MAGIC) {
            throw corrupt("spill file has wrong magic number", null).addLogInfo(LogMessageKeys.MAGIC.toString(), Integer.toHexString(magic));
        }
        if (version != SortedFileWriter.FORMAT_VERSION) {
            throw corrupt("spill file has unknown format version", null).addLogInfo(LogMessageKeys.VERSION.toString(), version);
        }
        if (headerRecordCount != recordCount) {
            throw corrupt("spill file has wrong record count", null).addLogInfo(LogMessageKeys.EXPECTED_RECORD_COUNT.toString(), headerRecordCount);
        }
        InputStream bodyStream = inputStream;
        if ((flags & SortedFileWriter.FLAG_COMPRESSED) != 0) {
            bodyStream = new InflaterInputStream(bodyStream);
        }
        entryStream = CodedInputStream.newInstance(bodyStream, SortedFileWriter.BUFFER_SIZE);
        entryStream.setSizeLimit(Integer.MAX_VALUE);
    }

    @Nonnull
    private SortCorruptionException corrupt(@Nonnull String message, @Nullable Throwable cause) {
        close();
        final SortCorruptionException ex = new SortCorruptionException(message, cause);
        ex.addLogInfo(LogMessageKeys.FILE_NAME.toString(), spillFile.getFile(),
                LogMessageKeys.RECORD_POSITION.toString(), recordPosition,
                LogMessageKeys.RECORD_COUNT.toString(), recordCount);
        return ex;
    }

    /**
     * Stop reading and release the file.
     */
    @Override
    public void close() {
        if (released) {
            return;
        }
        released = true;
        entryStream = null;
        if (inputStream != null) {
            try {
                inputStream.close();
            } catch (IOException ex) {
                LOGGER.warn(KeyValueLogMessage.of("could not close spill file", LogMessageKeys.FILE_NAME, spillFile.getFile()), ex);
            }
            inputStream = null;
        }
        spillFile.release();
    }
}
