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

/**
 * The log holds a record that cannot be decoded. Recovery is not attempted: dropping
 * the record would silently lose state that was acknowledged to a client.
 */
public class AofCorruptedException extends AofException {

    private final long recordNumber;
    private final long offset;

    public AofCorruptedException(long recordNumber, long offset, Throwable cause) {
        super("Corrupt AOF record #" + recordNumber + " at offset " + offset + ": " + cause.getMessage(), cause);
        this.recordNumber = recordNumber;
        this.offset = offset;
    }

    /** 1-based number of the offending record. */
    public long recordNumber() {
        return recordNumber;
    }

    /** Byte offset where the offending record starts. */
    public long offset() {
        return offset;
    }
}
