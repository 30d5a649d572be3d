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
package dev.mars.redislite.resp;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A RESP value: the unit exchanged with clients and recorded in the append-only log.
 * <p>
 * Values are immutable. A decoded client request is always an {@link Array} of
 * {@link BulkString} elements; the other variants only appear in responses and as
 * values stored by {@code SET}.
 *
 * @see RespCodec
 */
public sealed interface RespValue {

    /** {@code +text\r\n} */
    record SimpleString(String text) implements RespValue {
        public SimpleString {
            Objects.requireNonNull(text, "text");
        }
    }

    /** {@code -text\r\n} */
    record Error(String text) implements RespValue {
        public Error {
            Objects.requireNonNull(text, "text");
        }
    }

    /** {@code :value\r\n} */
    record Integer(int value) implements RespValue {
    }

    /**
     * Length-prefixed text. An empty {@code text} is the null bulk string {@code $-1\r\n}.
     */
    record BulkString(Optional<String> text) implements RespValue {
        public BulkString {
            Objects.requireNonNull(text, "text");
        }
    }

    /** {@code *n\r\n} followed by each item. */
    record Array(List<RespValue> items) implements RespValue {
        public Array {
            items = List.copyOf(items);
        }
    }

    /** Absent value, written as {@code $-1\r\n}. */
    record Null() implements RespValue {
    }

    // ========================================================================
    // Factories
    // ========================================================================

    Null NULL = new Null();

    static SimpleString simpleString(String text) {
        return new SimpleString(text);
    }

    static Error error(String text) {
        return new Error(text);
    }

    static Integer integer(int value) {
        return new Integer(value);
    }

    static BulkString bulkString(String text) {
        return new BulkString(Optional.of(text));
    }

    static BulkString nullBulkString() {
        return new BulkString(Optional.empty());
    }

    static Array array(List<RespValue> items) {
        return new Array(items);
    }

    /**
     * Builds a request frame from command words, e.g. {@code command("set", "k", "v")}.
     */
    static Array command(String... words) {
        RespValue[] items = new RespValue[words.length];
        for (int i = 0; i < words.length; i++) {
            items[i] = bulkString(words[i]);
        }
        return new Array(List.of(items));
    }

    /**
     * Returns the text of a present bulk string, or empty for any other value.
     */
    static Optional<String> textOf(RespValue value) {
        if (value instanceof BulkString bulk) {
            return bulk.text();
        }
        return Optional.empty();
    }
}
