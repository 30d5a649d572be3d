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
package dev.mars.redislite;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.function.Function;

/**
 * Configuration for the server and its append-only log.
 * <p>
 * Each value is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dredislite.port=6380})</li>
 *   <li>Environment variables (e.g., {@code REDISLITE_PORT})</li>
 *   <li>Properties file ({@code redislite.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>bindAddress</td><td>redislite.bindAddress</td><td>REDISLITE_BIND_ADDRESS</td><td>0.0.0.0</td></tr>
 *   <tr><td>port</td><td>redislite.port</td><td>REDISLITE_PORT</td><td>6379</td></tr>
 *   <tr><td>aofPath</td><td>redislite.aofPath</td><td>REDISLITE_AOF_PATH</td><td>/tmp/aof.log</td></tr>
 *   <tr><td>syncEnabled</td><td>redislite.syncEnabled</td><td>REDISLITE_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>flushIntervalMs</td><td>redislite.flushIntervalMs</td><td>REDISLITE_FLUSH_INTERVAL_MS</td><td>1000</td></tr>
 *   <tr><td>maxBulkSizeMb</td><td>redislite.maxBulkSizeMb</td><td>REDISLITE_MAX_BULK_SIZE_MB</td><td>512</td></tr>
 *   <tr><td>maxConnections</td><td>redislite.maxConnections</td><td>REDISLITE_MAX_CONNECTIONS</td><td>0 (unbounded)</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # redislite.properties
 * redislite.port=6379
 * redislite.aofPath=/var/lib/redislite/appendonly.aof
 * redislite.flushIntervalMs=1000
 * </pre>
 */
public final class ServerConfig {

    private static final Logger LOG = LoggerFactory.getLogger(ServerConfig.class);

    private static final String PROPERTIES_FILE = "redislite.properties";

    // Property keys
    private static final String PROP_BIND_ADDRESS = "redislite.bindAddress";
    private static final String PROP_PORT = "redislite.port";
    private static final String PROP_AOF_PATH = "redislite.aofPath";
    private static final String PROP_SYNC_ENABLED = "redislite.syncEnabled";
    private static final String PROP_FLUSH_INTERVAL_MS = "redislite.flushIntervalMs";
    private static final String PROP_MAX_BULK_SIZE_MB = "redislite.maxBulkSizeMb";
    private static final String PROP_MAX_CONNECTIONS = "redislite.maxConnections";

    // Environment variable keys
    private static final String ENV_BIND_ADDRESS = "REDISLITE_BIND_ADDRESS";
    private static final String ENV_PORT = "REDISLITE_PORT";
    private static final String ENV_AOF_PATH = "REDISLITE_AOF_PATH";
    private static final String ENV_SYNC_ENABLED = "REDISLITE_SYNC_ENABLED";
    private static final String ENV_FLUSH_INTERVAL_MS = "REDISLITE_FLUSH_INTERVAL_MS";
    private static final String ENV_MAX_BULK_SIZE_MB = "REDISLITE_MAX_BULK_SIZE_MB";
    private static final String ENV_MAX_CONNECTIONS = "REDISLITE_MAX_CONNECTIONS";

    // Defaults
    private static final String DEFAULT_BIND_ADDRESS = "0.0.0.0";
    private static final int DEFAULT_PORT = 6379;
    private static final Path DEFAULT_AOF_PATH = Path.of("/tmp", "aof.log");
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final long DEFAULT_FLUSH_INTERVAL_MS = 1000L;
    private static final int DEFAULT_MAX_BULK_SIZE_MB = 512;
    private static final int DEFAULT_MAX_CONNECTIONS = 0;

    private final String bindAddress;
    private final int port;
    private final Path aofPath;
    private final boolean syncEnabled;
    private final long flushIntervalMs;
    private final int maxBulkSizeMb;
    private final int maxConnections;

    private ServerConfig(Builder builder) {
        this.bindAddress = builder.bindAddress;
        this.port = builder.port;
        this.aofPath = builder.aofPath;
        this.syncEnabled = builder.syncEnabled;
        this.flushIntervalMs = builder.flushIntervalMs;
        this.maxBulkSizeMb = builder.maxBulkSizeMb;
        this.maxConnections = builder.maxConnections;
    }

    /** Address the listener binds to. */
    public String bindAddress() {
        return bindAddress;
    }

    /** Listening port; 0 picks a free one. */
    public int port() {
        return port;
    }

    /** Location of the append-only log. */
    public Path aofPath() {
        return aofPath;
    }

    /** Whether flush also fsyncs the log (should be true in production). */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Period of the background flush task. */
    public long flushIntervalMs() {
        return flushIntervalMs;
    }

    /** Largest bulk string a request may declare, in MB. */
    public int maxBulkSizeMb() {
        return maxBulkSizeMb;
    }

    /** Largest bulk string a request may declare, in bytes. */
    public int maxBulkSizeBytes() {
        return (int) Math.min(Integer.MAX_VALUE - 2L, (long) maxBulkSizeMb * 1024 * 1024);
    }

    /** Cap on concurrent client connections; 0 means unbounded. */
    public int maxConnections() {
        return maxConnections;
    }

    @Override
    public String toString() {
        return "ServerConfig{" +
                "bindAddress=" + bindAddress +
                ", port=" + port +
                ", aofPath=" + aofPath +
                ", syncEnabled=" + syncEnabled +
                ", flushIntervalMs=" + flushIntervalMs +
                ", maxBulkSizeMb=" + maxBulkSizeMb +
                ", maxConnections=" + maxConnections +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code ServerConfig.builder().build()}.
     */
    public static ServerConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link ServerConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private String bindAddress;
        private Integer port;
        private Path aofPath;
        private Boolean syncEnabled;
        private Long flushIntervalMs;
        private Integer maxBulkSizeMb;
        private Integer maxConnections;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        public Builder bindAddress(String bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder aofPath(Path aofPath) {
            this.aofPath = aofPath;
            return this;
        }

        public Builder aofPath(String aofPath) {
            this.aofPath = Path.of(aofPath);
            return this;
        }

        /** Enables or disables fsync on flush (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        public Builder flushIntervalMs(long flushIntervalMs) {
            this.flushIntervalMs = flushIntervalMs;
            return this;
        }

        public Builder maxBulkSizeMb(int maxBulkSizeMb) {
            this.maxBulkSizeMb = maxBulkSizeMb;
            return this;
        }

        /** Sets the connection cap; 0 disables it. */
        public Builder maxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         *
         * @throws IllegalArgumentException if a resolved value is out of range
         */
        public ServerConfig build() {
            if (bindAddress == null) {
                bindAddress = resolve(PROP_BIND_ADDRESS, ENV_BIND_ADDRESS, Function.identity(), DEFAULT_BIND_ADDRESS);
            }
            if (port == null) {
                port = resolve(PROP_PORT, ENV_PORT, Integer::valueOf, DEFAULT_PORT);
            }
            if (aofPath == null) {
                aofPath = resolve(PROP_AOF_PATH, ENV_AOF_PATH, Path::of, DEFAULT_AOF_PATH);
            }
            if (syncEnabled == null) {
                syncEnabled = resolve(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED, Boolean::valueOf, DEFAULT_SYNC_ENABLED);
            }
            if (flushIntervalMs == null) {
                flushIntervalMs = resolve(PROP_FLUSH_INTERVAL_MS, ENV_FLUSH_INTERVAL_MS, Long::valueOf, DEFAULT_FLUSH_INTERVAL_MS);
            }
            if (maxBulkSizeMb == null) {
                maxBulkSizeMb = resolve(PROP_MAX_BULK_SIZE_MB, ENV_MAX_BULK_SIZE_MB, Integer::valueOf, DEFAULT_MAX_BULK_SIZE_MB);
            }
            if (maxConnections == null) {
                maxConnections = resolve(PROP_MAX_CONNECTIONS, ENV_MAX_CONNECTIONS, Integer::valueOf, DEFAULT_MAX_CONNECTIONS);
            }

            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("port out of range: " + port);
            }
            if (flushIntervalMs <= 0) {
                throw new IllegalArgumentException("flushIntervalMs must be > 0: " + flushIntervalMs);
            }
            if (maxBulkSizeMb < 0) {
                throw new IllegalArgumentException("maxBulkSizeMb must be >= 0: " + maxBulkSizeMb);
            }
            if (maxConnections < 0) {
                throw new IllegalArgumentException("maxConnections must be >= 0: " + maxConnections);
            }
            return new ServerConfig(this);
        }

        /**
         * Resolves one value: system property, then environment variable, then
         * properties file, then default. An unparsable value is skipped with a warning.
         */
        private <T> T resolve(String sysProp, String envVar, Function<String, T> parser, T defaultValue) {
            String[][] sources = {
                    {"system property", sysProp, System.getProperty(sysProp)},
                    {"environment variable", envVar, System.getenv(envVar)},
                    {PROPERTIES_FILE, sysProp, fileProperties.getProperty(sysProp)}
            };
            for (String[] source : sources) {
                String value = source[2];
                if (value == null || value.isBlank()) {
                    continue;
                }
                try {
                    return parser.apply(value.trim());
                } catch (RuntimeException e) {
                    LOG.warn("Ignoring invalid {} {}={}: {}", source[0], source[1], value, e.getMessage());
                }
            }
            return defaultValue;
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = ServerConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}
