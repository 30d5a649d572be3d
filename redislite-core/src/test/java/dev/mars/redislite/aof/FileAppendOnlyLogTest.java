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

import dev.mars.redislite.aof.AppendOnlyLog.ReplayResult;
import dev.mars.redislite.resp.RespCodec;
import dev.mars.redislite.resp.RespValue;
import dev.mars.redislite.store.CommandDispatcher;
import dev.mars.redislite.store.KeyValueStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FileAppendOnlyLog}.
 * <p>
 * These tests verify:
 * <ul>
 *   <li>Append, flush and replay</li>
 *   <li>Crash recovery from records written directly to the file</li>
 *   <li>Replay idempotence across restarts</li>
 *   <li>Corrupt and truncated logs abort replay</li>
 *   <li>Lifecycle rules and the exclusive file lock</li>
 * </ul>
 */
class FileAppendOnlyLogTest {

    @TempDir
    Path tempDir;

    private final RespCodec codec = new RespCodec();

    private Path aofPath;
    private FileAppendOnlyLog log;

    @BeforeEach
    void setUp() {
        aofPath = tempDir.resolve("aof.log");
    }

    @AfterEach
    void tearDown() {
        if (log != null) {
            log.close();
        }
    }

    /** Simulates a process start: new store, new log, open, replay. */
    private CommandDispatcher restart() {
        if (log != null) {
            log.close();
        }
        CommandDispatcher dispatcher = new CommandDispatcher(new KeyValueStore());
        log = new FileAppendOnlyLog(aofPath, false);
        log.open();
        log.replay(dispatcher);
        return dispatcher;
    }

    private void writeRecords(RespValue... requests) throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        for (RespValue request : requests) {
            codec.encode(request, bytes);
        }
        Files.write(aofPath, bytes.toByteArray(), StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    private String fileContent() throws Exception {
        return Files.readString(aofPath, StandardCharsets.UTF_8);
    }

    // ========================================================================
    // Append / Flush
    // ========================================================================

    @Nested
    @DisplayName("Append and Flush")
    class AppendTests {

        @Test
        void openCreatesMissingFileAndDirectories() {
            aofPath = tempDir.resolve("nested/dir/aof.log");
            restart();

            assertTrue(Files.exists(aofPath));
            assertTrue(Files.exists(tempDir.resolve("nested/dir/aof.log.lock")));
        }

        @Test
        @DisplayName("A record is the exact wire encoding of the request")
        void recordIsWireEncoding() throws Exception {
            restart();
            log.append(RespValue.command("set", "k", "v"));
            log.flush();

            assertEquals("*3\r\n$3\r\nset\r\n$1\r\nk\r\n$1\r\nv\r\n", fileContent());
        }

        @Test
        void recordsAreWrittenBackToBack() throws Exception {
            restart();
            log.append(RespValue.command("set", "a", "1"));
            log.append(RespValue.command("del", "a"));
            log.flush();

            assertEquals("*3\r\n$3\r\nset\r\n$1\r\na\r\n$1\r\n1\r\n*2\r\n$3\r\ndel\r\n$1\r\na\r\n", fileContent());
        }

        @Test
        @DisplayName("Appends land after existing content")
        void appendsAfterExistingRecords() throws Exception {
            writeRecords(RespValue.command("set", "a", "1"));
            restart();
            log.append(RespValue.command("set", "b", "2"));
            log.flush();

            CommandDispatcher dispatcher = restart();
            assertEquals(RespValue.bulkString("1"), dispatcher.dispatch(RespValue.command("get", "a")));
            assertEquals(RespValue.bulkString("2"), dispatcher.dispatch(RespValue.command("get", "b")));
        }

        @Test
        @DisplayName("Close flushes buffered appends")
        void closeFlushes() throws Exception {
            restart();
            log.append(RespValue.command("set", "k", "v"));
            log.close();

            assertEquals("*3\r\n$3\r\nset\r\n$1\r\nk\r\n$1\r\nv\r\n", fileContent());
        }

        @Test
        void flushWithSyncEnabled() throws Exception {
            log = new FileAppendOnlyLog(aofPath, true);
            log.open();
            log.replay(new CommandDispatcher(new KeyValueStore()));
            log.append(RespValue.command("ping"));
            log.flush();

            assertEquals("*1\r\n$4\r\nping\r\n", fileContent());
        }

        @Test
        @DisplayName("Concurrent appends never interleave")
        void concurrentAppendsDoNotInterleave() throws Exception {
            restart();
            int numThreads = 8;
            int recordsPerThread = 200;
            ExecutorService executor = Executors.newFixedThreadPool(numThreads);
            CountDownLatch startLatch = new CountDownLatch(1);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int t = 0; t < numThreads; t++) {
                    int thread = t;
                    futures.add(executor.submit(() -> {
                        startLatch.await();
                        for (int i = 0; i < recordsPerThread; i++) {
                            log.append(RespValue.command("set", "t" + thread, "value-" + i + "-" + "x".repeat(i % 50)));
                            if (i % 50 == 0) {
                                log.flush();
                            }
                        }
                        return null;
                    }));
                }
                startLatch.countDown();
                for (Future<?> f : futures) {
                    f.get(30, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }
            log.flush();

            CommandDispatcher dispatcher = restart();
            for (int t = 0; t < numThreads; t++) {
                int last = recordsPerThread - 1;
                assertEquals(RespValue.bulkString("value-" + last + "-" + "x".repeat(last % 50)),
                        dispatcher.dispatch(RespValue.command("get", "t" + t)));
            }
        }
    }

    // ========================================================================
    // Replay
    // ========================================================================

    @Nested
    @DisplayName("Replay")
    class ReplayTests {

        @Test
        void emptyLog() {
            CommandDispatcher dispatcher = new CommandDispatcher(new KeyValueStore());
            log = new FileAppendOnlyLog(aofPath, false);
            log.open();

            assertEquals(ReplayResult.EMPTY, log.replay(dispatcher));
            assertEquals(0, dispatcher.store().size());
        }

        @Test
        @DisplayName("Crash and restart: directly written SETs are restored, later SETs win")
        void crashRecoveryRestoresFinalValues() throws Exception {
            Map<String, String> expected = new HashMap<>();
            List<RespValue> records = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                String key = "key" + (i % 30);
                String value = "value" + i;
                records.add(RespValue.command("set", key, value));
                expected.put(key, value);
            }
            writeRecords(records.toArray(new RespValue[0]));

            CommandDispatcher dispatcher = new CommandDispatcher(new KeyValueStore());
            log = new FileAppendOnlyLog(aofPath, false);
            log.open();
            ReplayResult result = log.replay(dispatcher);

            assertEquals(100, result.records());
            assertEquals(0, result.errorRecords());
            assertEquals(Files.size(aofPath), result.bytesRead());

            Map<String, RespValue> snapshot = dispatcher.store().snapshot();
            assertEquals(expected.size(), snapshot.size());
            expected.forEach((k, v) -> assertEquals(RespValue.bulkString(v), snapshot.get(k)));
        }

        @Test
        void replayAppliesDeletes() throws Exception {
            writeRecords(
                    RespValue.command("set", "a", "1"),
                    RespValue.command("set", "b", "2"),
                    RespValue.command("del", "a"),
                    RespValue.command("get", "b"),
                    RespValue.command("ping"));

            CommandDispatcher dispatcher = restart();

            assertEquals(Map.of("b", RespValue.bulkString("2")), dispatcher.store().snapshot());
        }

        @Test
        @DisplayName("Two consecutive restarts without writes rebuild the same state")
        void replayIsIdempotentAcrossRestarts() throws Exception {
            writeRecords(
                    RespValue.command("set", "a", "1"),
                    RespValue.command("set", "b", "2"),
                    RespValue.command("set", "a", "3"),
                    RespValue.command("del", "b"),
                    RespValue.command("set", "c", "4"));

            Map<String, RespValue> first = restart().store().snapshot();
            long sizeAfterFirst = Files.size(aofPath);
            Map<String, RespValue> second = restart().store().snapshot();

            assertEquals(first, second);
            assertEquals(Map.of("a", RespValue.bulkString("3"), "c", RespValue.bulkString("4")), second);
            assertEquals(sizeAfterFirst, Files.size(aofPath), "replay must not write to the log");
        }

        @Test
        void blankLinesBetweenRecordsAreTolerated() throws Exception {
            Files.writeString(aofPath, "*3\r\n$3\r\nset\r\n$1\r\na\r\n$1\r\n1\r\n\r\n\r\n*3\r\n$3\r\nset\r\n$1\r\nb\r\n$1\r\n2\r\n\r\n");

            CommandDispatcher dispatcher = restart();

            assertEquals(2, dispatcher.store().size());
        }

        @Test
        @DisplayName("Records that produce an error are counted, not fatal")
        void errorRecordsAreCounted() throws Exception {
            writeRecords(RespValue.command("set", "a", "1"), RespValue.command("bogus"), RespValue.command("set", "b", "2"));

            CommandDispatcher dispatcher = new CommandDispatcher(new KeyValueStore());
            log = new FileAppendOnlyLog(aofPath, false);
            log.open();
            ReplayResult result = log.replay(dispatcher);

            assertEquals(3, result.records());
            assertEquals(1, result.errorRecords());
            assertEquals(2, dispatcher.store().size());
        }
    }

    // ========================================================================
    // Corruption
    // ========================================================================

    @Nested
    @DisplayName("Corruption")
    class CorruptionTests {

        private AofCorruptedException replayExpectingCorruption() {
            log = new FileAppendOnlyLog(aofPath, false);
            log.open();
            return assertThrows(AofCorruptedException.class,
                    () -> log.replay(new CommandDispatcher(new KeyValueStore())));
        }

        @Test
        @DisplayName("A torn tail record is fatal")
        void truncatedTailIsFatal() throws Exception {
            writeRecords(RespValue.command("set", "a", "1"));
            long validSize = Files.size(aofPath);
            Files.writeString(aofPath, "*3\r\n$3\r\nset\r\n$1\r\nb\r\n$5\r\nab", StandardOpenOption.APPEND);

            AofCorruptedException e = replayExpectingCorruption();

            assertEquals(2, e.recordNumber());
            assertEquals(validSize, e.offset());
        }

        @Test
        void garbageIsFatal() throws Exception {
            Files.writeString(aofPath, "this is not resp\r\n");

            AofCorruptedException e = replayExpectingCorruption();

            assertEquals(1, e.recordNumber());
            assertEquals(0, e.offset());
        }

        @Test
        @DisplayName("Corruption in the middle of the log is fatal")
        void middleCorruptionIsFatal() throws Exception {
            writeRecords(RespValue.command("set", "a", "1"));
            Files.writeString(aofPath, "*1\r\n+oops\r\n", StandardOpenOption.APPEND);
            writeRecords(RespValue.command("set", "b", "2"));

            assertEquals(2, replayExpectingCorruption().recordNumber());
        }

        @Test
        @DisplayName("The corrupt file is left untouched")
        void corruptFileNotModified() throws Exception {
            Files.writeString(aofPath, "*2\r\n$3\r\nget");
            byte[] before = Files.readAllBytes(aofPath);

            replayExpectingCorruption();
            log.close();

            assertArrayEquals(before, Files.readAllBytes(aofPath));
        }
    }

    // ========================================================================
    // Write Failures
    // ========================================================================

    @Nested
    @DisplayName("Write Failures")
    class WriteFailureTests {

        private DiskFullSink sink;

        private void openWithFaultySink() {
            log = new FileAppendOnlyLog(aofPath, false, codec, target -> sink = new DiskFullSink(target));
            log.open();
            log.replay(new CommandDispatcher(new KeyValueStore()));
        }

        @Test
        @DisplayName("A torn flush is cut back to the last flushed record and the log stops")
        void partialFlushTruncatedAndLogStops() throws Exception {
            openWithFaultySink();
            log.append(RespValue.command("set", "a", "1"));
            log.flush();
            String flushed = fileContent();

            log.append(RespValue.command("set", "b", "2"));
            sink.failNextWrite = true;
            assertThrows(AofException.class, () -> log.flush());

            assertEquals(flushed, fileContent());
            assertThrows(AofException.class, () -> log.append(RespValue.command("set", "c", "3")));
            assertThrows(AofException.class, () -> log.flush());
            assertDoesNotThrow(() -> log.close());
            assertEquals(flushed, fileContent());

            CommandDispatcher dispatcher = restart();
            assertEquals(1, dispatcher.store().size());
            assertEquals(RespValue.bulkString("1"), dispatcher.store().get("a").orElseThrow());
        }

        @Test
        @DisplayName("An append that spills the buffer to disk and fails leaves a readable file")
        void failedSpillingAppendLeavesReadableFile() throws Exception {
            openWithFaultySink();
            log.append(RespValue.command("set", "a", "1"));
            log.flush();

            sink.failNextWrite = true;
            String large = "x".repeat(100_000);
            assertThrows(AofException.class, () -> log.append(RespValue.command("set", "big", large)));
            assertThrows(AofException.class, () -> log.flush());
            log.close();

            CommandDispatcher dispatcher = restart();
            assertEquals(1, dispatcher.store().size());
            assertTrue(dispatcher.store().get("big").isEmpty());
        }
    }

    /**
     * Writes half of the next chunk through to the file, then fails as a full disk would.
     */
    private static final class DiskFullSink extends FilterOutputStream {
        volatile boolean failNextWrite;

        DiskFullSink(OutputStream out) {
            super(out);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            if (failNextWrite) {
                failNextWrite = false;
                out.write(b, off, len / 2);
                throw new IOException("No space left on device");
            }
            out.write(b, off, len);
        }
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        void appendBeforeReplayRejected() {
            log = new FileAppendOnlyLog(aofPath, false);
            log.open();

            assertThrows(IllegalStateException.class, () -> log.append(RespValue.command("ping")));
        }

        @Test
        void secondReplayRejected() {
            restart();

            assertThrows(IllegalStateException.class,
                    () -> log.replay(new CommandDispatcher(new KeyValueStore())));
        }

        @Test
        void operationsBeforeOpenRejected() {
            log = new FileAppendOnlyLog(aofPath, false);

            assertThrows(IllegalStateException.class, () -> log.flush());
            assertThrows(IllegalStateException.class,
                    () -> log.replay(new CommandDispatcher(new KeyValueStore())));
        }

        @Test
        void operationsAfterCloseRejected() {
            restart();
            log.close();

            assertThrows(IllegalStateException.class, () -> log.append(RespValue.command("ping")));
            assertThrows(IllegalStateException.class, () -> log.flush());
            assertThrows(IllegalStateException.class, () -> log.open());
        }

        @Test
        void closeIsIdempotent() {
            restart();
            log.close();
            assertDoesNotThrow(() -> log.close());
        }

        @Test
        void openIsIdempotent() {
            restart();
            assertDoesNotThrow(() -> log.open());
        }

        @Test
        @DisplayName("A second instance cannot open a log that is already open")
        void exclusiveLockPreventsSecondInstance() {
            restart();

            FileAppendOnlyLog second = new FileAppendOnlyLog(aofPath, false);
            assertThrows(AofException.class, second::open);
            second.close();
        }

        @Test
        @DisplayName("The lock is released on close")
        void lockReleasedOnClose() {
            restart();
            log.close();

            FileAppendOnlyLog second = new FileAppendOnlyLog(aofPath, false);
            try {
                assertDoesNotThrow(second::open);
            } finally {
                second.close();
            }
        }
    }
}
