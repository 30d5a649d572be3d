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
import dev.mars.redislite.aof.AofException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process entry point.
 *
 * <h2>Usage</h2>
 * <pre>
 * java -jar redislite-server/target/redislite-server-1.0-SNAPSHOT.jar [addr] [aofPath]
 *
 * # defaults: 0.0.0.0:6379 and /tmp/aof.log, or whatever ServerConfig resolves
 * java -jar redislite-server.jar 127.0.0.1:6380 /var/lib/redislite/appendonly.aof
 * java -Dredislite.flushIntervalMs=500 -jar redislite-server.jar
 * </pre>
 *
 * @see ServerConfig
 */
public final class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    private Main() {
    }

    public static void main(String[] args) {
        ServerConfig config;
        try {
            config = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("Usage: redislite-server [host:port] [aofPath]");
            System.exit(2);
            return;
        }

        RedisLiteServer server = new RedisLiteServer(config);
        try {
            server.start();
        } catch (AofException e) {
            LOG.error("Failed to restore AOF, refusing to start: {}", e.getMessage(), e);
            System.exit(1);
            return;
        } catch (Exception e) {
            LOG.error("Failed to start server: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "redislite-shutdown"));
    }

    /**
     * Applies the optional positional arguments {@code [host:port] [aofPath]} on top of
     * the resolved configuration.
     */
    static ServerConfig parseArgs(String[] args) {
        ServerConfig.Builder builder = ServerConfig.builder();
        if (args.length > 2) {
            throw new IllegalArgumentException("Too many arguments");
        }
        if (args.length > 0 && !args[0].isBlank()) {
            String addr = args[0].trim();
            int colon = addr.lastIndexOf(':');
            if (colon < 0) {
                throw new IllegalArgumentException("Address must be host:port, got: " + addr);
            }
            String host = addr.substring(0, colon);
            if (!host.isEmpty()) {
                builder.bindAddress(host);
            }
            try {
                builder.port(Integer.parseInt(addr.substring(colon + 1)));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port in address: " + addr, e);
            }
        }
        if (args.length > 1 && !args[1].isBlank()) {
            builder.aofPath(args[1].trim());
        }
        return builder.build();
    }
}
