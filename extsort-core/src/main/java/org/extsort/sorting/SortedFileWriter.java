/*
 * SortedFileWriter.java
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

import com.google.protobuf.CodedOutputStream;
import org.extsort.SortContractException;
import org.extsort.SortStorageException;
import org.extsort.annotation.API;
import org.extsort.common.SortTimer;
import org.extsort.logging.KeyValueLogMessage;
import org.extsort.logging.LogMessageKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.File;
import java.io.FileOutputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.util.zip.DeflaterOutputStream;

/**
 * Write already sorted pairs into a spill file and hand back an iterator over them.
 *
 * The file starts with a fixed size header: magic number, format version, flags and number of records, all fixed-width.
 * The header is written with a record count of zero and rewritten in place by {@link #done}.
 * After the header, each record is the key bytes and then the value bytes, each prefixed by its length as a varint.
 * If the file is compressed, everything after the header is deflated.
 *
 * Any write failure abandons the file, since a partial run cannot be trusted.
 * @param <K> type of key
 * @param <V> type of value
 */
@API(API.Status.EXPERIMENTAL)
public class SortedFileWriter<K, V> implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(SortedFileWriter.class);

    static final int MAGIC = 0x78736f72;
    static final int FORMAT_VERSION = 1;
    static final int FLAG_COMPRESSED = 0x1;
    static final int HEADER_SIZE = 3 * Integer.BYTES + Long.BYTES;
    static final int BUFFER_SIZE = 64 * 1024;

    @Nonnull
    private final SortSerializer<K> keySerializer;
    @Nonnull
    private final SortSerializer<V> valueSerializer;
    @Nullable
    private final SortTimer timer;
    private final boolean compressed;

    @Nonnull
    private final SpillFile spillFile;
    @Nullable
    private FileOutputStream fileStream;
    @Nullable
    private OutputStream outputStream;
    @Nullable
    private CodedOutputStream entryStream;

    private long recordCount;
    private boolean finished;

    public SortedFileWriter(@Nonnull SortAdapter<K, V> adapter, @Nullable SortTimer timer) {
        final long startTime = System.nanoTime();
        this.keySerializer = adapter.getKeySerializer();
        this.valueSerializer = adapter.getValueSerializer();
        this.timer = timer;
        this.compressed = adapter.isCompressed();
        final File file;
        try {
            file = adapter.generateFilename();
        } catch (IOException ex) {
            throw new SortStorageException("could not create spill file", ex);
        }
        spillFile = new SpillFile(file);
        try {
            fileStream = new FileOutputStream(file);
            fileStream.write(header(0, compressed));
            if (compressed) {
                outputStream = new DeflaterOutputStream(new NoCloseFilterStream(fileStream), true);
            } else {
                outputStream = fileStream;
            }
            entryStream = CodedOutputStream.newInstance(outputStream, BUFFER_SIZE);
        } catch (IOException ex) {
            throw abandon("could not open spill file", ex);
        }
        if (timer != null) {
            timer.recordSinceNanoTime(SortEvents.Events.FILE_SORT_OPEN_FILE, startTime);
        }
    }

    @Nonnull
    public File getFile() {
        return spillFile.getFile();
    }

    public long getRecordCount() {
        return recordCount;
    }

    /**
     * Append the next pair. Pairs must be given in sorted order.
     * @param key the key
     * @param value the value
     */
    public void addAlreadySorted(@Nonnull K key, @Nonnull V value) {
        checkWritable();
        final long startTime = System.nanoTime();
        try {
            entryStream.writeByteArrayNoTag(keySerializer.serialize(key));
            entryStream.writeByteArrayNoTag(valueSerializer.serialize(value));
        } catch (IOException ex) {
            throw abandon("could not write to spill file", ex);
        }
        recordCount++;
        if (timer != null) {
            timer.recordSinceNanoTime(SortEvents.Events.FILE_SORT_SAVE_RECORD, startTime);
        }
    }

    public void addAlreadySorted(@Nonnull SortPair<K, V> pair) {
        addAlreadySorted(pair.getKey(), pair.getValue());
    }

    /**
     * Finish the file and get an iterator over its pairs. No more pairs can be added.
     * The iterator takes over the file: it is deleted once the iterator is exhausted or closed.
     * @return an iterator over the pairs written
     */
    @Nonnull
    @SuppressWarnings("PMD.CompareObjectsWithEquals")
    public SortedFileIterator<K, V> done() {
        checkWritable();
        final long fileLength;
        try {
            entryStream.flush();
            if (outputStream != fileStream) {
                // Finishes the deflater while keeping the file open.
                outputStream.close();
            }
            final FileChannel fileChannel = fileStream.getChannel();
            fileLength = fileChannel.position();
            final ByteBuffer header = ByteBuffer.wrap(header(recordCount, compressed));
            while (header.hasRemaining()) {
                fileChannel.write(header, header.position());
            }
            fileStream.close();
            fileStream = null;
        } catch (IOException ex) {
            throw abandon("could not finish spill file", ex);
        }
        finished = true;
        if (timer != null) {
            timer.increment(SortEvents.Counts.FILE_SORT_FILE_BYTES, (int)Math.min(fileLength, Integer.MAX_VALUE));
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("wrote spill file",
                    LogMessageKeys.FILE_NAME, spillFile.getFile(),
                    LogMessageKeys.RECORD_COUNT, recordCount,
                    LogMessageKeys.FILE_BYTES, fileLength,
                    LogMessageKeys.COMPRESSED, compressed));
        }
        try {
            return new SortedFileIterator<>(spillFile, recordCount, keySerializer, valueSerializer, timer);
        } finally {
            // The iterator holds its own reference now.
            spillFile.release();
        }
    }

    /**
     * Abandon the file if {@link #done} has not been called. The file is deleted.
     */
    @Override
    public void close() {
        if (!finished) {
            finished = true;
            closeStream();
            spillFile.release();
        }
    }

    private void checkWritable() {
        if (finished) {
            throw new SortContractException("spill file writer already finished", LogMessageKeys.FILE_NAME, spillFile.getFile());
        }
    }

    @Nonnull
    private SortStorageException abandon(@Nonnull String message, @Nonnull IOException cause) {
        final SortStorageException ex = new SortStorageException(message, cause);
        ex.addLogInfo(LogMessageKeys.FILE_NAME.toString(), spillFile.getFile(),
                LogMessageKeys.RECORD_COUNT.toString(), recordCount);
        close();
        return ex;
    }

    private void closeStream() {
        if (fileStream != null) {
            try {
                fileStream.close();
            } catch (IOException ex) {
                LOGGER.warn(KeyValueLogMessage.of("could not close spill file", LogMessageKeys.FILE_NAME, spillFile.getFile()), ex);
            }
            fileStream = null;
        }
        outputStream = null;
        entryStream = null;
    }

    @Nonnull
    static byte[] header(long recordCount, boolean compressed) throws IOException {
        final byte[] bytes = new byte[HEADER_SIZE];
        final CodedOutputStream headerStream = CodedOutputStream.newInstance(bytes);
        headerStream.writeFixed32NoTag(MAGIC);
        headerStream.writeFixed32NoTag(FORMAT_VERSION);
        headerStream.writeFixed32NoTag(compressed ? FLAG_COMPRESSED : 0);
        headerStream.writeFixed64NoTag(recordCount);
        headerStream.checkNoSpaceLeft();
        return bytes;
    }

    // DeflaterOutputStream only finishes on close(), so close it down while keeping the actual FileOutputStream open.
    private static class NoCloseFilterStream extends FilterOutputStream {
        NoCloseFilterStream(@Nonnull OutputStream stream) {
            super(stream);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            out.write(b, off, len);
        }

        @Override
        public void close() throws IOException {
            flush();
        }
    }
}
