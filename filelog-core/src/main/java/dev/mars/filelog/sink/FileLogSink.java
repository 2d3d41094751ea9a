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

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * {@link LogSink} that persists messages to a file.
 * <p>
 * All file handling is delegated to {@link FileHandleManager}; this class only encodes
 * messages as UTF-8 and manages the optional shutdown hook.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * try (LogSink sink = new FileLogSink(SinkConfig.builder()
 *         .filename("app.log")
 *         .mode("append")
 *         .build())) {
 *     sink.logMessage("service started\n");
 * }
 * }</pre>
 *
 * @see SinkConfig
 */
public final class FileLogSink implements LogSink {

    private static final Logger LOG = LoggerFactory.getLogger(FileLogSink.class);

    private final SinkConfig config;
    private final FileHandleManager handles;
    private final Thread shutdownHook;

    /**
     * Creates a sink with configuration loaded from system properties, environment
     * variables, properties file, or defaults.
     *
     * @throws IllegalStateException if no filename is configured
     * @throws SinkException         if the file cannot be opened (persistent mode)
     */
    public FileLogSink() {
        this(SinkConfig.load());
    }

    /**
     * Creates a sink from a dispatch framework's option map.
     *
     * @param options option map, see {@link SinkConfig#fromOptions(Map)}
     * @throws SinkException if the file cannot be opened (persistent mode)
     */
    public FileLogSink(Map<String, ?> options) {
        this(SinkConfig.fromOptions(options));
    }

    /**
     * Creates a sink with the specified configuration.
     *
     * @param config the sink configuration
     * @throws SinkException if the file cannot be opened (persistent mode)
     */
    public FileLogSink(SinkConfig config) {
        this(config, new FileHandleManager(config));
    }

    FileLogSink(SinkConfig config, FileHandleManager handles) {
        this.config = Objects.requireNonNull(config, "config");
        this.handles = Objects.requireNonNull(handles, "handles");

        if (config.syncOnWrite() && config.closeAfterWrite()) {
            LOG.debug("Sink '{}' syncs and reopens on every write; expect slow logging", config.name());
        }

        if (config.closeOnShutdown()) {
            this.shutdownHook = new Thread(this::close, "filelog-shutdown-" + config.name());
            Runtime.getRuntime().addShutdownHook(shutdownHook);
        } else {
            this.shutdownHook = null;
        }

        LOG.info("FileLogSink '{}' initialized: file={}, mode={}, autoflush={}, closeAfterWrite={}",
                config.name(), config.filename(), config.mode(), config.autoflush(), config.closeAfterWrite());
    }

    @Override
    public void logMessage(String message) {
        Objects.requireNonNull(message, "message");
        handles.write(message.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String name() {
        return config.name();
    }

    /** Returns the configuration used by this sink. */
    public SinkConfig config() {
        return config;
    }

    /** Whether this sink is currently holding an OS file handle. */
    public boolean isHandleOpen() {
        return handles.isHandleOpen();
    }

    /** Whether this sink has been closed. */
    public boolean isClosed() {
        return handles.isClosed();
    }

    @Override
    public void close() {
        if (handles.isClosed()) {
            return;
        }
        handles.close();
        if (shutdownHook != null && Thread.currentThread() != shutdownHook) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                // JVM is already shutting down; the hook will find the sink closed
                LOG.trace("Shutdown in progress, leaving hook for sink '{}'", config.name());
            }
        }
    }

    @Override
    public String toString() {
        return "FileLogSink{" + config.name() + " -> " + config.filename() + '}';
    }
}
