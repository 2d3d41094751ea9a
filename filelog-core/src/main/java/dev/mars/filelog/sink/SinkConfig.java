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
package dev.mars.filelog.sink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Immutable configuration for a {@link FileLogSink}.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dfilelog.filename=/var/log/app.log})</li>
 *   <li>Environment variables (e.g., {@code FILELOG_FILENAME})</li>
 *   <li>Properties file ({@code filelog.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>filename</td><td>filelog.filename</td><td>FILELOG_FILENAME</td><td>(required)</td></tr>
 *   <tr><td>mode</td><td>filelog.mode</td><td>FILELOG_MODE</td><td>write</td></tr>
 *   <tr><td>autoflush</td><td>filelog.autoflush</td><td>FILELOG_AUTOFLUSH</td><td>true</td></tr>
 *   <tr><td>closeAfterWrite</td><td>filelog.closeAfterWrite</td><td>FILELOG_CLOSE_AFTER_WRITE</td><td>false</td></tr>
 *   <tr><td>syncOnWrite</td><td>filelog.syncOnWrite</td><td>FILELOG_SYNC_ON_WRITE</td><td>false</td></tr>
 *   <tr><td>closeOnShutdown</td><td>filelog.closeOnShutdown</td><td>FILELOG_CLOSE_ON_SHUTDOWN</td><td>false</td></tr>
 *   <tr><td>name</td><td>filelog.name</td><td>FILELOG_NAME</td><td>file name of filename</td></tr>
 * </table>
 * <p>
 * The effective {@link #mode()} is derived at build time by {@link ModeResolver}: a sink that
 * closes after every write always appends, whatever mode was requested.
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * SinkConfig config = SinkConfig.builder()
 *     .filename(Path.of("/var/log/app.log"))
 *     .mode("append")
 *     .build();
 *
 * try (LogSink sink = new FileLogSink(config)) {
 *     sink.logMessage("started\n");
 * }
 * </pre>
 */
public final class SinkConfig {

    private static final Logger LOG = LoggerFactory.getLogger(SinkConfig.class);

    private static final String PROPERTIES_FILE = "filelog.properties";

    // Property keys
    private static final String PROP_FILENAME = "filelog.filename";
    private static final String PROP_NAME = "filelog.name";
    private static final String PROP_MODE = "filelog.mode";
    private static final String PROP_AUTOFLUSH = "filelog.autoflush";
    private static final String PROP_CLOSE_AFTER_WRITE = "filelog.closeAfterWrite";
    private static final String PROP_SYNC_ON_WRITE = "filelog.syncOnWrite";
    private static final String PROP_CLOSE_ON_SHUTDOWN = "filelog.closeOnShutdown";

    // Environment variable keys
    private static final String ENV_FILENAME = "FILELOG_FILENAME";
    private static final String ENV_NAME = "FILELOG_NAME";
    private static final String ENV_MODE = "FILELOG_MODE";
    private static final String ENV_AUTOFLUSH = "FILELOG_AUTOFLUSH";
    private static final String ENV_CLOSE_AFTER_WRITE = "FILELOG_CLOSE_AFTER_WRITE";
    private static final String ENV_SYNC_ON_WRITE = "FILELOG_SYNC_ON_WRITE";
    private static final String ENV_CLOSE_ON_SHUTDOWN = "FILELOG_CLOSE_ON_SHUTDOWN";

    // Option-map keys used by dispatch frameworks
    public static final String OPT_NAME = "name";
    public static final String OPT_FILENAME = "filename";
    public static final String OPT_MODE = "mode";
    public static final String OPT_AUTOFLUSH = "autoflush";
    public static final String OPT_CLOSE_AFTER_WRITE = "close_after_write";
    public static final String OPT_SYNC_ON_WRITE = "sync_on_write";
    public static final String OPT_CLOSE_ON_SHUTDOWN = "close_on_shutdown";

    // Defaults
    private static final String DEFAULT_MODE = ModeResolver.WRITE;
    private static final boolean DEFAULT_AUTOFLUSH = true;
    private static final boolean DEFAULT_CLOSE_AFTER_WRITE = false;
    private static final boolean DEFAULT_SYNC_ON_WRITE = false;
    private static final boolean DEFAULT_CLOSE_ON_SHUTDOWN = false;

    private final String name;
    private final Path filename;
    private final String requestedMode;
    private final OpenMode mode;
    private final boolean autoflush;
    private final boolean closeAfterWrite;
    private final boolean syncOnWrite;
    private final boolean closeOnShutdown;

    private SinkConfig(Builder builder) {
        this.name = builder.name;
        this.filename = builder.filename;
        this.requestedMode = builder.mode;
        this.autoflush = builder.autoflush;
        this.closeAfterWrite = builder.closeAfterWrite;
        this.syncOnWrite = builder.syncOnWrite;
        this.closeOnShutdown = builder.closeOnShutdown;
        this.mode = ModeResolver.resolve(closeAfterWrite, requestedMode);
    }

    /** Name of the sink (not the file name). */
    public String name() {
        return name;
    }

    /** Target file path. */
    public Path filename() {
        return filename;
    }

    /** The mode as configured, before resolution. */
    public String requestedMode() {
        return requestedMode;
    }

    /** The effective open mode. */
    public OpenMode mode() {
        return mode;
    }

    /** Whether every message is flushed to the OS before {@code logMessage} returns. */
    public boolean autoflush() {
        return autoflush;
    }

    /** Whether the file is opened and closed around every message. */
    public boolean closeAfterWrite() {
        return closeAfterWrite;
    }

    /** Whether every message is forced to the storage device. */
    public boolean syncOnWrite() {
        return syncOnWrite;
    }

    /** Whether a JVM shutdown hook closes the sink. */
    public boolean closeOnShutdown() {
        return closeOnShutdown;
    }

    @Override
    public String toString() {
        return "SinkConfig{" +
                "name='" + name + '\'' +
                ", filename=" + filename +
                ", requestedMode='" + requestedMode + '\'' +
                ", mode=" + mode +
                ", autoflush=" + autoflush +
                ", closeAfterWrite=" + closeAfterWrite +
                ", syncOnWrite=" + syncOnWrite +
                ", closeOnShutdown=" + closeOnShutdown +
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
     * Shorthand for {@code SinkConfig.builder().build()}.
     *
     * @throws IllegalStateException if no filename is configured anywhere
     */
    public static SinkConfig load() {
        return builder().build();
    }

    /**
     * Builds a configuration from a dispatch framework's option map.
     * <p>
     * Recognized keys are {@value #OPT_NAME}, {@value #OPT_FILENAME}, {@value #OPT_MODE},
     * {@value #OPT_AUTOFLUSH}, {@value #OPT_CLOSE_AFTER_WRITE}, {@value #OPT_SYNC_ON_WRITE} and
     * {@value #OPT_CLOSE_ON_SHUTDOWN}. Other keys (levels, callbacks and the like belong to the
     * framework) are ignored. Options that are absent fall back to the usual resolution chain.
     *
     * @param options option map; values may be strings, numbers or booleans
     * @return the configuration
     * @throws IllegalArgumentException if an option has a value of the wrong type
     * @throws IllegalStateException    if no filename is configured anywhere
     */
    public static SinkConfig fromOptions(Map<String, ?> options) {
        Objects.requireNonNull(options, "options");
        Builder builder = builder();
        for (Map.Entry<String, ?> option : options.entrySet()) {
            String key = option.getKey();
            Object value = option.getValue();
            if (value == null) {
                continue;
            }
            switch (key) {
                case OPT_NAME -> builder.name(scalar(key, value));
                case OPT_FILENAME -> builder.filename(scalar(key, value));
                case OPT_MODE -> builder.mode(scalar(key, value));
                case OPT_AUTOFLUSH -> builder.autoflush(toBoolean(key, value));
                case OPT_CLOSE_AFTER_WRITE -> builder.closeAfterWrite(toBoolean(key, value));
                case OPT_SYNC_ON_WRITE -> builder.syncOnWrite(toBoolean(key, value));
                case OPT_CLOSE_ON_SHUTDOWN -> builder.closeOnShutdown(toBoolean(key, value));
                default -> LOG.debug("Ignoring unrecognized sink option '{}'", key);
            }
        }
        return builder.build();
    }

    private static String scalar(String key, Object value) {
        if (value instanceof CharSequence || value instanceof Number || value instanceof Path) {
            return value.toString();
        }
        throw new IllegalArgumentException(
                "Option '" + key + "' must be a scalar, got " + value.getClass().getName());
    }

    static boolean toBoolean(String key, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0;
        }
        if (value instanceof CharSequence cs) {
            switch (cs.toString().trim().toLowerCase(Locale.ROOT)) {
                case "true", "yes", "on", "1":
                    return true;
                case "false", "no", "off", "0", "":
                    return false;
                default:
                    break;
            }
        }
        throw new IllegalArgumentException("Option '" + key + "' is not a boolean: " + value);
    }

    /**
     * Builder for {@link SinkConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private String name;
        private Path filename;
        private String mode;
        private Boolean autoflush;
        private Boolean closeAfterWrite;
        private Boolean syncOnWrite;
        private Boolean closeOnShutdown;
        private Path fallbackFilename;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the sink name. */
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /** Sets the target file. */
        public Builder filename(Path filename) {
            this.filename = filename;
            return this;
        }

        /** Sets the target file from a string path. */
        public Builder filename(String filename) {
            this.filename = Path.of(filename);
            return this;
        }

        /**
         * Sets the requested mode: {@code write}, {@code >}, {@code append}, {@code >>}
         * or the numeric {@code O_APPEND} flag (default: write).
         */
        public Builder mode(String mode) {
            this.mode = mode;
            return this;
        }

        /** Sets the requested mode from a resolved {@link OpenMode}. */
        public Builder mode(OpenMode mode) {
            this.mode = mode.appends() ? ModeResolver.APPEND : ModeResolver.WRITE;
            return this;
        }

        /** Enables or disables flushing after every message (default: true). */
        public Builder autoflush(boolean autoflush) {
            this.autoflush = autoflush;
            return this;
        }

        /** Enables or disables the open/write/close cycle per message (default: false). */
        public Builder closeAfterWrite(boolean closeAfterWrite) {
            this.closeAfterWrite = closeAfterWrite;
            return this;
        }

        /** Enables or disables forcing every message to disk (default: false). */
        public Builder syncOnWrite(boolean syncOnWrite) {
            this.syncOnWrite = syncOnWrite;
            return this;
        }

        /** Enables or disables closing the sink from a JVM shutdown hook (default: false). */
        public Builder closeOnShutdown(boolean closeOnShutdown) {
            this.closeOnShutdown = closeOnShutdown;
            return this;
        }

        /**
         * Sets the file used only when neither the builder, system properties, environment
         * variables nor the properties file name one. Unlike {@link #filename(Path)}, this
         * does not override the other sources.
         */
        public Builder defaultFilename(Path fallbackFilename) {
            this.fallbackFilename = fallbackFilename;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         *
         * @throws IllegalStateException    if no filename is configured anywhere
         * @throws IllegalArgumentException if a flag is not a recognized boolean spelling
         */
        public SinkConfig build() {
            if (filename == null) {
                String value = resolveString(PROP_FILENAME, ENV_FILENAME, null);
                if (value != null) {
                    filename = Path.of(value);
                } else if (fallbackFilename != null) {
                    filename = fallbackFilename;
                } else {
                    throw new IllegalStateException("filename is required (set it on the builder, "
                            + PROP_FILENAME + " or " + ENV_FILENAME + ")");
                }
            }
            if (name == null) {
                Path fileName = filename.getFileName();
                name = resolveString(PROP_NAME, ENV_NAME,
                        fileName != null ? fileName.toString() : filename.toString());
            }
            if (mode == null) {
                mode = resolveString(PROP_MODE, ENV_MODE, DEFAULT_MODE);
            }
            if (autoflush == null) {
                autoflush = resolveBoolean(PROP_AUTOFLUSH, ENV_AUTOFLUSH, DEFAULT_AUTOFLUSH);
            }
            if (closeAfterWrite == null) {
                closeAfterWrite = resolveBoolean(PROP_CLOSE_AFTER_WRITE, ENV_CLOSE_AFTER_WRITE,
                        DEFAULT_CLOSE_AFTER_WRITE);
            }
            if (syncOnWrite == null) {
                syncOnWrite = resolveBoolean(PROP_SYNC_ON_WRITE, ENV_SYNC_ON_WRITE, DEFAULT_SYNC_ON_WRITE);
            }
            if (closeOnShutdown == null) {
                closeOnShutdown = resolveBoolean(PROP_CLOSE_ON_SHUTDOWN, ENV_CLOSE_ON_SHUTDOWN,
                        DEFAULT_CLOSE_ON_SHUTDOWN);
            }

            return new SinkConfig(this);
        }

        private String resolveString(String sysProp, String envVar, String defaultValue) {
            // 1. System property
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value;
            }

            // 2. Environment variable
            value = System.getenv(envVar);
            if (value != null && !value.isBlank()) {
                return value;
            }

            // 3. Properties file
            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value;
            }

            // 4. Default
            return defaultValue;
        }

        private boolean resolveBoolean(String sysProp, String envVar, boolean defaultValue) {
            String value = resolveString(sysProp, envVar, null);
            return value != null ? toBoolean(sysProp, value) : defaultValue;
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = SinkConfig.class.getClassLoader()
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
