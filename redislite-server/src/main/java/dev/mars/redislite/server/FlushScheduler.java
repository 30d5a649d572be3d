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
package dev.mars.redislite.server;

import dev.mars.redislite.aof.AppendOnlyLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Calls {@link AppendOnlyLog#flush()} at a fixed interval.
 * <p>
 * A failed flush is logged and the schedule continues; it never reaches a client
 * connection. Appends in the meantime stay buffered and are retried by the next run.
 */
public final class FlushScheduler implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(FlushScheduler.class);

    private final AppendOnlyLog log;
    private final long intervalMs;
    private final ScheduledExecutorService executor;

    public FlushScheduler(AppendOnlyLog log, long intervalMs) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be > 0: " + intervalMs);
        }
        this.log = log;
        this.intervalMs = intervalMs;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "aof-flush");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        executor.scheduleWithFixedDelay(this::flushOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        LOG.info("AOF flush scheduled every {} ms", intervalMs);
    }

    /**
     * One scheduled run. Package-private for tests.
     *
     * @return true if the flush succeeded
     */
    boolean flushOnce() {
        try {
            log.flush();
            return true;
        } catch (RuntimeException e) {
            LOG.warn("Unable to flush AOF to disk: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Stops the schedule, waiting briefly for a running flush to finish.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(Math.max(intervalMs, 1000L), TimeUnit.MILLISECONDS)) {
                LOG.warn("AOF flush task did not stop in time");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
