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

import dev.mars.redislite.ServerConfig;
import dev.mars.redislite.aof.AppendOnlyLog;
import dev.mars.redislite.aof.AppendOnlyLog.ReplayResult;
import dev.mars.redislite.aof.FileAppendOnlyLog;
import dev.mars.redislite.connection.ConnectionHandler;
import dev.mars.redislite.resp.RespCodec;
import dev.mars.redislite.resp.RespValue;
import dev.mars.redislite.store.CommandDispatcher;
import dev.mars.redislite.store.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * TCP front end: replays the log, then accepts clients, one thread per connection.
 * <p>
 * <b>Startup order:</b>
 * <ol>
 *   <li>open the log and replay it into the store (a corrupt log fails {@link #start()})</li>
 *   <li>bind the listening socket</li>
 *   <li>start the periodic flush and the accept loop</li>
 * </ol>
 * No connection is accepted before replay has completed.
 */
public final class RedisLiteServer implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(RedisLiteServer.class);

    private static final long WORKER_JOIN_TIMEOUT_MS = 2000;

    private static final RespValue MAX_CLIENTS_REACHED = RespValue.error("ERR max number of clients reached");

    private final ServerConfig config;
    private final RespCodec codec;
    private final KeyValueStore store;
    private final CommandDispatcher dispatcher;
    private final AppendOnlyLog log;
    private final FlushScheduler flushScheduler;

    private final Set<Socket> clients = ConcurrentHashMap.newKeySet();
    private final Set<Thread> workers = ConcurrentHashMap.newKeySet();
    private final AtomicLong connectionIds = new AtomicLong();

    private ServerSocket serverSocket;
    private Thread acceptThread;
    private volatile boolean closed;

    public RedisLiteServer(ServerConfig config) {
        this(config, new FileAppendOnlyLog(config));
    }

    public RedisLiteServer(ServerConfig config, AppendOnlyLog log) {
        this.config = config;
        this.codec = new RespCodec(config.maxBulkSizeBytes());
        this.store = new KeyValueStore();
        this.dispatcher = new CommandDispatcher(store);
        this.log = log;
        this.flushScheduler = new FlushScheduler(log, config.flushIntervalMs());
    }

    /**
     * Replays the log and starts accepting connections.
     *
     * @throws IOException if the listening socket cannot be bound
     * @throws dev.mars.redislite.aof.AofException if the log cannot be opened or replayed
     */
    public void start() throws IOException {
        LOG.info("Starting server: {}", config);
        try {
            log.open();
            ReplayResult replay = log.replay(dispatcher);
            LOG.info("Restored {} keys from {} AOF records", store.size(), replay.records());

            serverSocket = new ServerSocket();
            serverSocket.bind(new InetSocketAddress(config.bindAddress(), config.port()));
        } catch (IOException | RuntimeException e) {
            closeServerSocket();
            log.close();
            throw e;
        }

        flushScheduler.start();
        acceptThread = new Thread(this::acceptLoop, "redislite-acceptor");
        acceptThread.start();
        LOG.info("Server listening on {}:{}", config.bindAddress(), port());
    }

    /** The bound port, useful when configured with port 0. */
    public int port() {
        return serverSocket.getLocalPort();
    }

    public KeyValueStore store() {
        return store;
    }

    /** Number of connected clients. */
    public int connectionCount() {
        return clients.size();
    }

    private void acceptLoop() {
        while (!closed) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (IOException e) {
                if (closed) {
                    break;
                }
                LOG.warn("Couldn't accept connection: {}", e.getMessage());
                continue;
            }

            int maxConnections = config.maxConnections();
            if (maxConnections > 0 && clients.size() >= maxConnections) {
                reject(socket);
                continue;
            }

            clients.add(socket);
            String clientName = String.valueOf(socket.getRemoteSocketAddress());
            Thread worker = new Thread(() -> handle(socket, clientName),
                    "redislite-client-" + connectionIds.incrementAndGet());
            worker.setDaemon(true);
            workers.add(worker);
            worker.start();
            LOG.debug("Accepted client {} ({} connected)", clientName, clients.size());
        }
        LOG.debug("Accept loop stopped");
    }

    private void handle(Socket socket, String clientName) {
        try (socket) {
            new ConnectionHandler(clientName, socket.getInputStream(), socket.getOutputStream(),
                    codec, dispatcher, log).run();
        } catch (IOException e) {
            LOG.debug("Error closing client {}: {}", clientName, e.getMessage());
        } finally {
            clients.remove(socket);
            workers.remove(Thread.currentThread());
        }
    }

    private void reject(Socket socket) {
        LOG.warn("Rejecting client {}: max connections ({}) reached",
                socket.getRemoteSocketAddress(), config.maxConnections());
        try (socket; OutputStream out = socket.getOutputStream()) {
            codec.encode(MAX_CLIENTS_REACHED, out);
            out.flush();
        } catch (IOException e) {
            LOG.debug("Error rejecting client: {}", e.getMessage());
        }
    }

    /**
     * Stops accepting, disconnects clients, stops the flush task and closes the log.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        LOG.info("Shutting down server");

        closeServerSocket();
        if (acceptThread != null) {
            try {
                acceptThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        for (Socket client : clients) {
            try {
                client.close();
            } catch (IOException e) {
                LOG.debug("Error closing client socket: {}", e.getMessage());
            }
        }
        awaitWorkers();

        flushScheduler.close();
        log.close();
        LOG.info("Server stopped");
    }

    private void closeServerSocket() {
        try {
            if (serverSocket != null) {
                serverSocket.close();
            }
        } catch (IOException e) {
            LOG.warn("Error closing listening socket: {}", e.getMessage());
        }
    }

    /**
     * Lets workers finish the request in hand so their appends land before the log closes.
     */
    private void awaitWorkers() {
        long deadline = System.currentTimeMillis() + WORKER_JOIN_TIMEOUT_MS;
        for (Thread worker : workers) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                break;
            }
            try {
                worker.join(remaining);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        if (!workers.isEmpty()) {
            LOG.warn("{} client threads still running at shutdown", workers.size());
        }
    }
}
