/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
package dev.mars.redislite.aof;

import dev.mars.redislite.ServerConfig;
import dev.mars.redislite.resp.ProtocolException;
import dev.mars.redislite.resp.RespCodec;
import dev.mars.redislite.resp.RespValue;
import dev.mars.redislite.store.CommandDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.EOFException;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * File-based implementation of {@link AppendOnlyLog}.
 * <p>
 * <b>Files:</b>
 * <pre>
 * aof.log        // back-to-back RESP request frames, no header or separators
 * aof.log.lock   // held exclusively while the log is open
 * </pre>
 * <p>
 * <b>Thread Safety:</b>
 * All operations are serialized through a single {@link ReentrantLock}, acquired for the
 * full duration of replay, append, flush and close.
 * <p>
 * <b>Durability:</b>
 * Appends go to an in-process buffer on the calling thread. {@link #flush()} drains the
 * buffer and, when sync is enabled, fsyncs. An acknowledged write is therefore on disk
 * once the next flush completes.
 * <p>
 * <b>Protection Mechanisms:</b>
 * <ul>
 *   <li><b>File Locking:</b> Exclusive lock on a sibling lock file prevents two processes
 *       from appending to the same log.</li>
 *   <li><b>Strict Replay:</b> A record that does not decode aborts replay with
 *       {@link AofCorruptedException} instead of being skipped.</li>
 *   <li><b>Fail-Stop Writes:</b> After a failed write or flush the file is truncated back
 *       to the size of the last successful flush, and every later append or flush throws
 *       {@link AofException}. A partially written buffer is never written again.</li>
 * </ul>
 *
 * @see AppendOnlyLog
 */
public final class FileAppendOnlyLog implements AppendOnlyLog {

    private static final Logger LOG = LoggerFactory.getLogger(FileAppendOnlyLog.class);

    private static final String LOCK_SUFFIX = ".lock";
    private static final int BUFFER_SIZE = 64 * 1024;

    private final Path path;
    private final RespCodec codec;
    private final boolean syncEnabled;
    private final UnaryOperator<OutputStream> sinkDecorator;

    /**
     * Guards every field below. Held for the whole of each operation.
     */
    private final ReentrantLock lock = new ReentrantLock();

    private FileChannel channel;
    private OutputStream out;
    private FileChannel lockChannel;
    private FileLock exclusiveLock;
    private boolean replayed;
    private long appendCount;
    private long flushedSize;
    private IOException writeFailure;
    private volatile boolean closed;

    /**
     * Creates a log at {@link ServerConfig#aofPath()}.
     *
     * @param config the server configuration
     */
    public FileAppendOnlyLog(ServerConfig config) {
        this(config.aofPath(), config.syncEnabled(), new RespCodec(config.maxBulkSizeBytes()));
    }

    /**
     * @param path        the log file
     * @param syncEnabled if false, flush skips fsync (ONLY for testing!)
     */
    public FileAppendOnlyLog(Path path, boolean syncEnabled) {
        this(path, syncEnabled, new RespCodec());
    }

    public FileAppendOnlyLog(Path path, boolean syncEnabled, RespCodec codec) {
        this(path, syncEnabled, codec, UnaryOperator.identity());
    }

    /**
     * @param sinkDecorator wraps the stream that writes to the file channel (for fault injection in tests)
     */
    FileAppendOnlyLog(Path path, boolean syncEnabled, RespCodec codec, UnaryOperator<OutputStream> sinkDecorator) {
        this.path = path;
        this.syncEnabled = syncEnabled;
        this.codec = codec;
        this.sinkDecorator = sinkDecorator;

        if (!syncEnabled) {
            LOG.warn("AOF created with fsync DISABLED. Do NOT use in production!");
        }
    }

    // ========================================================================
    // Open / Close
    // ========================================================================

    @Override
    public void open() {
        lock.lock();
        try {
            ensureNotClosed();
            if (channel != null) {
                LOG.debug("AOF already open, ignoring duplicate open()");
                return;
            }
            LOG.info("Opening AOF at: {}", path);
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            acquireExclusiveLock();

            channel = FileChannel.open(path,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.READ,
                    StandardOpenOption.WRITE);
            long size = channel.size();
            channel.position(size);
            flushedSize = size;
            out = new BufferedOutputStream(sinkDecorator.apply(Channels.newOutputStream(channel)), BUFFER_SIZE);
            LOG.info("AOF opened: path={}, size={} bytes", path, size);

        } catch (IOException e) {
            LOG.error("Failed to open AOF at {}: {}", path, e.getMessage(), e);
            closeQuietly();
            channel = null;
            out = null;
            throw new AofException("Failed to open AOF at " + path, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                LOG.debug("AOF already closed, ignoring duplicate close()");
                return;
            }
            closed = true;
            if (out != null && writeFailure == null) {
                try {
                    out.flush();
                    if (syncEnabled) {
                        channel.force(true);
                    }
                } catch (IOException e) {
                    writeFailed("flush on close", e);
                }
            }
            closeQuietly();
            LOG.info("AOF closed: {} records appended this session", appendCount);
        } finally {
            lock.unlock();
        }
    }

    // ========================================================================
    // Log Operations
    // ========================================================================

    @Override
    public ReplayResult replay(CommandDispatcher dispatcher) {
        lock.lock();
        try {
            ensureOpen();
            if (replayed) {
                throw new IllegalStateException("AOF has already been replayed");
            }
            if (appendCount > 0) {
                throw new IllegalStateException("AOF replay must run before the first append");
            }

            LOG.info("Replaying AOF from: {}", path);
            long startTime = System.currentTimeMillis();
            long records = 0;
            long errorRecords = 0;

            // separate read cursor; the append position is untouched
            try (CountingInputStream in = new CountingInputStream(
                    new BufferedInputStream(Files.newInputStream(path), BUFFER_SIZE))) {
                while (true) {
                    long recordStart = in.count();
                    RespValue.Array request;
                    try {
                        request = codec.decode(in);
                    } catch (EOFException e) {
                        break;
                    } catch (ProtocolException e) {
                        AofCorruptedException corrupt = new AofCorruptedException(records + 1, recordStart, e);
                        LOG.error("{}", corrupt.getMessage());
                        throw corrupt;
                    }

                    records++;
                    RespValue response = dispatcher.dispatch(request);
                    if (response instanceof RespValue.Error error) {
                        errorRecords++;
                        LOG.warn("Replayed AOF record #{} at offset {} returned error: {}",
                                records, recordStart, error.text());
                    } else {
                        LOG.trace("Replayed AOF record #{}: {}", records, request);
                    }
                }

                replayed = true;
                long elapsed = System.currentTimeMillis() - startTime;
                LOG.info("AOF replay complete: {} records, {} errors, {} bytes, {} keys, {} ms",
                        records, errorRecords, in.count(), dispatcher.store().size(), elapsed);
                return new ReplayResult(records, errorRecords, in.count());
            }

        } catch (IOException e) {
            LOG.error("Failed to replay AOF: {}", e.getMessage(), e);
            throw new AofException("Failed to replay AOF at " + path, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void append(RespValue.Array request) {
        byte[] record = codec.encode(request);

        lock.lock();
        try {
            ensureWritable();
            if (!replayed) {
                throw new IllegalStateException("AOF must be replayed before the first append");
            }
            out.write(record);
            appendCount++;
            LOG.trace("Appended AOF record: {} bytes", record.length);

        } catch (IOException e) {
            throw writeFailed("append to", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void flush() {
        lock.lock();
        try {
            ensureWritable();
            long startNanos = System.nanoTime();
            out.flush();
            if (syncEnabled) {
                channel.force(true);
            }
            flushedSize = channel.position();
            long elapsedMicros = (System.nanoTime() - startNanos) / 1000;
            LOG.debug("AOF flushed in {} us (fsync={})", elapsedMicros, syncEnabled);

        } catch (IOException e) {
            throw writeFailed("flush", e);
        } finally {
            lock.unlock();
        }
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private void ensureNotClosed() {
        if (closed) {
            throw new IllegalStateException("AOF is closed: " + path);
        }
    }

    private void ensureOpen() {
        ensureNotClosed();
        if (channel == null) {
            throw new IllegalStateException("AOF is not open: " + path);
        }
    }

    private void ensureWritable() {
        ensureOpen();
        if (writeFailure != null) {
            throw new AofException("AOF stopped accepting records after a failed write: " + path, writeFailure);
        }
    }

    /**
     * Puts the log in the failed state and cuts the file back to the last flushed size,
     * dropping any fragment of the buffer that reached the disk. Caller holds the lock.
     */
    private AofException writeFailed(String operation, IOException cause) {
        writeFailure = cause;
        LOG.error("Failed to {} AOF, no further records will be accepted: {}", operation, cause.getMessage(), cause);
        try {
            if (channel.size() > flushedSize) {
                channel.truncate(flushedSize);
                LOG.warn("Truncated AOF to last flushed size: {} bytes", flushedSize);
            }
            channel.position(flushedSize);
        } catch (IOException e) {
            LOG.error("Could not truncate AOF to {} bytes, the tail may be torn: {}", flushedSize, e.getMessage());
        }
        return new AofException("Failed to " + operation + " AOF at " + path, cause);
    }

    /**
     * Acquires an exclusive lock on a sibling lock file so that a second process
     * (or a second instance in this JVM) cannot append to the same log.
     *
     * @throws AofException if the lock is held elsewhere
     */
    private void acquireExclusiveLock() throws IOException {
        Path lockPath = path.resolveSibling(path.getFileName() + LOCK_SUFFIX);
        LOG.debug("Acquiring exclusive lock: {}", lockPath);

        lockChannel = FileChannel.open(lockPath,
                StandardOpenOption.CREATE,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE);

        try {
            exclusiveLock = lockChannel.tryLock();
        } catch (OverlappingFileLockException e) {
            lockChannel.close();
            lockChannel = null;
            throw new AofException("Cannot acquire exclusive lock: AOF already open in this JVM: " + path, e);
        }
        if (exclusiveLock == null) {
            lockChannel.close();
            lockChannel = null;
            throw new AofException("Cannot acquire exclusive lock on " + lockPath +
                    ". Another process may be using this AOF.");
        }
        LOG.debug("Exclusive lock acquired: {}", lockPath);
    }

    /**
     * Releases the file, the lock and the lock channel, logging failures.
     */
    private void closeQuietly() {
        try {
            if (channel != null && channel.isOpen()) {
                channel.close();
            }
        } catch (IOException e) {
            LOG.warn("Error closing AOF channel: {}", e.getMessage());
        }
        try {
            if (exclusiveLock != null && exclusiveLock.isValid()) {
                exclusiveLock.release();
            }
        } catch (IOException e) {
            LOG.warn("Could not release AOF lock: {}", e.getMessage());
        }
        try {
            if (lockChannel != null && lockChannel.isOpen()) {
                lockChannel.close();
            }
        } catch (IOException e) {
            LOG.warn("Could not close AOF lock channel: {}", e.getMessage());
        }
    }

    /**
     * Tracks how many bytes have been consumed, for record offsets in error reports.
     */
    private static final class CountingInputStream extends FilterInputStream {
        private long count;

        CountingInputStream(InputStream in) {
            super(in);
        }

        long count() {
            return count;
        }

        @Override
        public int read() throws IOException {
            int b = super.read();
            if (b != -1) {
                count++;
            }
            return b;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            int n = super.read(b, off, len);
            if (n > 0) {
                count += n;
            }
            return n;
        }

        @Override
        public long skip(long n) throws IOException {
            long skipped = super.skip(n);
            count += skipped;
            return skipped;
        }
    }
}
