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
package dev.mars.redislite.connection;

import dev.mars.redislite.aof.AofException;
import dev.mars.redislite.aof.AppendOnlyLog;
import dev.mars.redislite.resp.ProtocolException;
import dev.mars.redislite.resp.RespCodec;
import dev.mars.redislite.resp.RespValue;
import dev.mars.redislite.store.CommandDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Serves one client over a byte stream.
 * <p>
 * Each iteration reads one request, dispatches it, appends it to the log if the response
 * is not an error, and only then writes and flushes the response. Requests on one
 * connection are handled strictly in arrival order.
 * <p>
 * <b>Failure handling:</b>
 * <ul>
 *   <li>End of stream between frames - the client hung up; {@link #serve()} returns.</li>
 *   <li>Malformed frame - the stream cannot be resynchronised; {@link #serve()} returns
 *       and the caller closes the connection.</li>
 *   <li>Log failure - the command may already be applied but is not recorded, so the
 *       {@link AofException} propagates and the connection is dropped without a reply.</li>
 * </ul>
 */
public final class ConnectionHandler implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectionHandler.class);

    private final String clientName;
    private final InputStream in;
    private final OutputStream out;
    private final RespCodec codec;
    private final CommandDispatcher dispatcher;
    private final AppendOnlyLog log;

    public ConnectionHandler(String clientName, InputStream in, OutputStream out,
                             RespCodec codec, CommandDispatcher dispatcher, AppendOnlyLog log) {
        this.clientName = clientName;
        this.in = new BufferedInputStream(in);
        this.out = new BufferedOutputStream(out);
        this.codec = codec;
        this.dispatcher = dispatcher;
        this.log = log;
    }

    /**
     * Runs the request loop until the client disconnects or sends a malformed frame.
     *
     * @return the number of requests answered
     * @throws IOException  if reading from or writing to the client fails
     * @throws AofException if a request cannot be recorded in the log
     */
    public long serve() throws IOException {
        long served = 0;
        while (true) {
            RespValue.Array request;
            try {
                request = codec.decode(in);
            } catch (EOFException e) {
                LOG.debug("Client {} disconnected after {} requests", clientName, served);
                return served;
            } catch (ProtocolException e) {
                LOG.warn("Protocol error from {}: {}. Closing connection", clientName, e.getMessage());
                return served;
            }

            RespValue response = dispatcher.dispatch(request);
            if (!(response instanceof RespValue.Error)) {
                log.append(request);
            }

            codec.encode(response, out);
            out.flush();
            served++;
        }
    }

    /**
     * {@link #serve()} with every failure logged and none rethrown. A log that was closed
     * under a live connection ends it here too. The caller owns and closes the streams.
     */
    @Override
    public void run() {
        try {
            serve();
        } catch (AofException e) {
            LOG.error("Dropping client {}: request could not be logged: {}", clientName, e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Dropping client {}: {}", clientName, e.getMessage(), e);
        } catch (IOException e) {
            LOG.debug("I/O error on client {}: {}", clientName, e.getMessage());
        }
    }
}
