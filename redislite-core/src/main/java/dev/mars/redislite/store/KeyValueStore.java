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
package dev.mars.redislite.store;

import dev.mars.redislite.resp.RespValue;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * The in-memory keyspace shared by every connection.
 * <p>
 * <b>Thread Safety:</b> guarded by a read/write lock. Reads run concurrently; a write
 * excludes every other reader and writer. Stored values are immutable, so a value
 * handed out by {@link #get} can never be observed half-built.
 * <p>
 * Created once at startup and passed to the components that need it; it is never
 * cleared.
 */
public final class KeyValueStore {

    private final Map<String, RespValue> entries = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public Optional<RespValue> get(String key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Stores {@code value} under {@code key}, replacing any previous value.
     */
    public void set(String key, RespValue value) {
        lock.writeLock().lock();
        try {
            entries.put(key, value);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes every listed key under a single write lock.
     *
     * @return the number of keys that existed and were removed
     */
    public int delete(Collection<String> keys) {
        lock.writeLock().lock();
        try {
            int removed = 0;
            for (String key : keys) {
                if (entries.remove(key) != null) {
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Point-in-time copy of the keyspace. */
    public Map<String, RespValue> snapshot() {
        lock.readLock().lock();
        try {
            return Map.copyOf(entries);
        } finally {
            lock.readLock().unlock();
        }
    }
}
