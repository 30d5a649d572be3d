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

import dev.mars.redislite.resp.RespValue;
import dev.mars.redislite.store.CommandDispatcher;

import java.io.Closeable;

/**
 * Durability log for the key-value store.
 * <p>
 * The log is a flat sequence of encoded request frames. Its only operations are
 * "append one record" and "scan records from the beginning"; nothing is rewritten.
 * <p>
 * <b>Lifecycle:</b>
 * <pre>{@code
 * log.open();
 * log.replay(dispatcher);   // exactly once, before any client is served
 * log.append(request);      // per successful command, before the reply is sent
 * log.flush();              // periodically, from a scheduler
 * log.close();
 * }</pre>
 * <p>
 * <b>Thread Safety:</b> every operation (replay, append, flush, close) holds one
 * exclusive lock, so records never interleave byte-for-byte. The store's lock is never
 * held while this lock is taken.
 *
 * @see FileAppendOnlyLog
 */
public interface AppendOnlyLog extends Closeable {

    /**
     * Opens the log, creating it if absent. Idempotent.
     *
     * @throws AofException if the file cannot be opened or is locked by another process
     */
    void open();

    /**
     * Re-executes every logged request through {@code dispatcher}, discarding responses.
     * <p>
     * Must be called once, after {@link #open()} and before the first {@link #append}.
     * Stops at a clean end of file. A malformed or truncated record is fatal.
     *
     * @return counts describing the replay
     * @throws AofException          if the log is corrupt or cannot be read
     * @throws IllegalStateException if called twice, after an append, or on a closed log
     */
    ReplayResult replay(CommandDispatcher dispatcher);

    /**
     * Writes one request to the tail of the log.
     * <p>
     * NOT required to reach the disk immediately - {@link #flush()} does that.
     *
     * @throws AofException          if the write fails, or an earlier write or flush failed
     * @throws IllegalStateException if replay has not run or the log is closed
     */
    void append(RespValue.Array request);

    /**
     * Durability barrier: pushes buffered appends to the file and, when sync is
     * enabled, forces the file to the storage device.
     *
     * @throws AofException if the flush fails, or an earlier write or flush failed. A log
     *                      that failed once rejects every later append and flush.
     */
    void flush();

    /**
     * Flushes and releases the file. Idempotent; after close no other method may be called.
     */
    @Override
    void close();

    /**
     * Outcome of a replay.
     *
     * @param records       requests re-executed
     * @param errorRecords  requests among them whose response was an error
     * @param bytesRead     size of the scanned log
     */
    record ReplayResult(long records, long errorRecords, long bytesRead) {
        public static final ReplayResult EMPTY = new ReplayResult(0L, 0L, 0L);
    }
}
