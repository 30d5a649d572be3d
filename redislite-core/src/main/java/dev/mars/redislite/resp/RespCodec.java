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

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts between byte streams and {@link RespValue}s.
 * <p>
 * <b>Decoding</b> accepts request frames only: an array of bulk strings.
 * <pre>
 * *2\r\n
 * $3\r\nget\r\n
 * $1\r\nk\r\n
 * </pre>
 * Blank lines between frames are skipped. The two bytes following each bulk payload are
 * consumed without being checked. Payloads are decoded as UTF-8 with malformed
 * sequences replaced, so decoding never fails on content, only on framing.
 * <p>
 * <b>Encoding</b> covers every variant and cannot fail. Length fields count UTF-8
 * bytes, not characters.
 * <p>
 * <b>Thread Safety:</b> stateless apart from its configuration; one instance can be
 * shared by every connection.
 */
public final class RespCodec {

    /** Default upper bound for a declared bulk length: 512 MB. */
    public static final int DEFAULT_MAX_BULK_LENGTH = 512 * 1024 * 1024;

    /** Upper bound for a header line ({@code *n} or {@code $n}), blank lines included. */
    private static final int MAX_LINE_LENGTH = 64 * 1024;

    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] NULL_BULK = {'$', '-', '1', '\r', '\n'};

    private final int maxBulkLength;

    public RespCodec() {
        this(DEFAULT_MAX_BULK_LENGTH);
    }

    /**
     * @param maxBulkLength largest bulk length a frame may declare; guards the
     *                      payload allocation against untrusted length fields
     */
    public RespCodec(int maxBulkLength) {
        if (maxBulkLength < 0 || maxBulkLength > Integer.MAX_VALUE - 2) {
            throw new IllegalArgumentException("maxBulkLength out of range: " + maxBulkLength);
        }
        this.maxBulkLength = maxBulkLength;
    }

    // ========================================================================
    // Decode
    // ========================================================================

    /**
     * Reads exactly one request frame.
     * <p>
     * Lines are read a byte at a time, so {@code in} should be buffered.
     *
     * @param in the source stream
     * @return the request, an array whose items are all present bulk strings
     * @throws EOFException      if the stream ends before the first byte of a frame
     * @throws ProtocolException if the frame is malformed or the stream ends inside it
     * @throws IOException       if reading fails
     */
    public RespValue.Array decode(InputStream in) throws IOException {
        String header = readFirstLine(in);
        if (header.charAt(0) != '*') {
            throw new ProtocolException("not an array");
        }
        int count = parseLength(header);
        if (count < 0) {
            throw new ProtocolException("not an array");
        }

        List<RespValue> items = new ArrayList<>(Math.min(count, 1024));
        for (int i = 0; i < count; i++) {
            String line = readLine(in);
            if (line == null) {
                throw new ProtocolException("truncated frame");
            }
            if (line.isEmpty() || line.charAt(0) != '$') {
                throw new ProtocolException("expected bulk string");
            }
            int length = parseLength(line);
            if (length < 0) {
                throw new ProtocolException("invalid bulk length");
            }
            if (length > maxBulkLength) {
                throw new ProtocolException("bulk string too large");
            }

            // payload + terminator; the terminator is dropped unchecked
            byte[] payload = in.readNBytes(length + 2);
            if (payload.length < length + 2) {
                throw new ProtocolException("truncated frame");
            }
            items.add(RespValue.bulkString(new String(payload, 0, length, StandardCharsets.UTF_8)));
        }
        return RespValue.array(items);
    }

    /**
     * Skips blank lines and returns the first non-blank one.
     */
    private String readFirstLine(InputStream in) throws IOException {
        while (true) {
            String line = readLine(in);
            if (line == null) {
                throw new EOFException("end of stream");
            }
            if (!line.isEmpty()) {
                return line;
            }
        }
    }

    /**
     * Reads up to and including {@code \n} and strips the trailing {@code \r\n}.
     *
     * @return the line, or null if the stream was already exhausted
     */
    private static String readLine(InputStream in) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream(16);
        int b;
        while ((b = in.read()) != -1) {
            if (b == '\n') {
                return stripCr(line);
            }
            if (line.size() >= MAX_LINE_LENGTH) {
                throw new ProtocolException("line too long");
            }
            line.write(b);
        }
        if (line.size() == 0) {
            return null;
        }
        // unterminated last line
        return stripCr(line);
    }

    private static String stripCr(ByteArrayOutputStream line) {
        String s = line.toString(StandardCharsets.UTF_8);
        return s.endsWith("\r") ? s.substring(0, s.length() - 1) : s;
    }

    /**
     * Parses the decimal after the type marker.
     *
     * @return the value, or -1 if it is not a non-negative int
     */
    private static int parseLength(String line) {
        int len = line.length();
        if (len < 2 || len > 11) {
            return -1;
        }
        long value = 0;
        for (int i = 1; i < len; i++) {
            char c = line.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
            value = value * 10 + (c - '0');
        }
        return value > Integer.MAX_VALUE ? -1 : (int) value;
    }

    // ========================================================================
    // Encode
    // ========================================================================

    /**
     * Encodes a value into a new byte array.
     */
    public byte[] encode(RespValue value) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            encode(value, out);
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw
            throw new IllegalStateException(e);
        }
        return out.toByteArray();
    }

    /**
     * Writes the encoding of {@code value} to {@code out}.
     */
    public void encode(RespValue value, OutputStream out) throws IOException {
        if (value instanceof RespValue.SimpleString s) {
            writeLine(out, '+', s.text());
        } else if (value instanceof RespValue.Error e) {
            writeLine(out, '-', e.text());
        } else if (value instanceof RespValue.Integer i) {
            writeLine(out, ':', Integer.toString(i.value()));
        } else if (value instanceof RespValue.BulkString bulk) {
            if (bulk.text().isEmpty()) {
                out.write(NULL_BULK);
            } else {
                byte[] data = bulk.text().get().getBytes(StandardCharsets.UTF_8);
                writeLine(out, '$', Integer.toString(data.length));
                out.write(data);
                out.write(CRLF);
            }
        } else if (value instanceof RespValue.Array array) {
            writeLine(out, '*', Integer.toString(array.items().size()));
            for (RespValue item : array.items()) {
                encode(item, out);
            }
        } else if (value instanceof RespValue.Null) {
            out.write(NULL_BULK);
        } else {
            throw new IllegalArgumentException("Unknown RESP value: " + value);
        }
    }

    private static void writeLine(OutputStream out, char marker, String text) throws IOException {
        out.write(marker);
        out.write(text.getBytes(StandardCharsets.UTF_8));
        out.write(CRLF);
    }
}
