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

import java.io.BufferedOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Owns the OS file handle of a single sink.
 * <p>
 * Two operating modes, fixed at construction by {@link SinkConfig#closeAfterWrite()}:
 * <ul>
 *   <li><b>Persistent:</b> the file is opened once in the constructor, every {@link #write(byte[])}
 *       reuses that handle, and {@link #close()} releases it exactly once.</li>
 *   <li><b>Ephemeral:</b> every {@link #write(byte[])} opens, writes and closes the file.
 *       No handle is held between calls.</li>
 * </ul>
 * <p>
 * <b>INVARIANT:</b> at most one handle is open at any instant, and only this class opens
 * or closes it.
 * <p>
 * <b>Thread Safety:</b> {@link #write(byte[])} and {@link #close()} run under one monitor,
 * so a close from another thread (a JVM shutdown hook, for instance) waits for an in-flight
 * write to finish and later writes fail with {@link IllegalStateException}. Message ordering
 * across threads is still the caller's concern (see {@link SynchronizedLogSink}).
 *
 * <h2>Flush policy</h2>
 * <ul>
 *   <li>{@code autoflush}: bytes are handed to the OS before {@code write} returns, so an
 *       independent reader sees them immediately. Otherwise they stay in an in-process buffer
 *       until it fills or the handle is closed.</li>
 *   <li>{@code syncOnWrite}: bytes are additionally forced to the storage device.</li>
 * </ul>
 */
public final class FileHandleManager implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(FileHandleManager.class);

    /** In-process buffer size used when autoflush is off. */
    static final int BUFFER_SIZE = 8192;

    /**
     * Opens the raw OS handle. Package-private seam for tests.
     */
    @FunctionalInterface
    interface HandleOpener {
        FileOutputStream open(Path file, OpenMode mode) throws IOException;
    }

    private static final HandleOpener DEFAULT_OPENER =
            (file, mode) -> new FileOutputStream(file.toFile(), mode.appends());

    private final Path file;
    private final OpenMode mode;
    private final boolean autoflush;
    private final boolean syncOnWrite;
    private final boolean closeAfterWrite;
    private final HandleOpener opener;
    private final Object lock = new Object();

    private FileOutputStream handle;
    private OutputStream out;
    private volatile boolean closed = false;

    /**
     * Creates a manager for the given configuration. In persistent mode the file is
     * opened immediately.
     *
     * @param config the sink configuration
     * @throws SinkException if persistent mode cannot open the file
     */
    public FileHandleManager(SinkConfig config) {
        this(config, DEFAULT_OPENER);
    }

    FileHandleManager(SinkConfig config, HandleOpener opener) {
        Objects.requireNonNull(config, "config");
        this.file = config.filename();
        this.mode = config.mode();
        this.autoflush = config.autoflush();
        this.syncOnWrite = config.syncOnWrite();
        this.closeAfterWrite = config.closeAfterWrite();
        this.opener = Objects.requireNonNull(opener, "opener");

        if (!closeAfterWrite) {
            open();
            LOG.info("Opened {} in {} mode (persistent handle, autoflush={})", file, mode, autoflush);
        } else {
            LOG.debug("Using close-after-write for {}; no handle held between writes", file);
        }
    }

    /**
     * Writes the bytes exactly as given: no separator is added and nothing is re-encoded.
     *
     * @param bytes the bytes to write
     * @throws SinkException         if the file cannot be opened (ephemeral mode) or written
     * @throws IllegalStateException if the manager has been closed
     */
    public void write(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("Sink for " + file + " is closed");
            }

            if (closeAfterWrite) {
                open();
                try {
                    writeToHandle(bytes);
                } finally {
                    closeHandle();
                }
            } else {
                writeToHandle(bytes);
            }
        }
    }

    /** Whether an OS handle is currently held. */
    public boolean isHandleOpen() {
        synchronized (lock) {
            return handle != null;
        }
    }

    /** Whether {@link #close()} has been called. */
    public boolean isClosed() {
        return closed;
    }

    /** The resolved mode the file is opened with. */
    public OpenMode mode() {
        return mode;
    }

    /** The target file. */
    public Path file() {
        return file;
    }

    /**
     * Releases the handle, if any. Idempotent; failures while closing are not reported.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (closed) {
                LOG.debug("Handle manager for {} already closed, ignoring duplicate close()", file);
                return;
            }
            closed = true;
            closeHandle();
        }
        LOG.info("Closed sink file {}", file);
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private void open() {
        try {
            handle = opener.open(file, mode);
        } catch (IOException e) {
            LOG.error("Cannot write to '{}': {}", file, e.getMessage());
            throw new SinkException("Cannot write to '" + file + "': " + e.getMessage(), file, e);
        }
        out = autoflush ? handle : new BufferedOutputStream(handle, BUFFER_SIZE);
        LOG.trace("Opened handle for {} (mode={})", file, mode);
    }

    private void writeToHandle(byte[] bytes) {
        try {
            out.write(bytes);
            if (autoflush) {
                out.flush();
            }
            if (syncOnWrite) {
                out.flush();
                handle.getFD().sync();
            }
            LOG.trace("Wrote {} bytes to {}", bytes.length, file);
        } catch (IOException e) {
            LOG.error("Failed to write {} bytes to {}: {}", bytes.length, file, e.getMessage());
            throw new SinkException("Failed to write to '" + file + "': " + e.getMessage(), file, e);
        }
    }

    /**
     * Closes the current handle. A failure here must never mask a write that already
     * succeeded, so it is dropped after tracing.
     */
    private void closeHandle() {
        if (handle == null) {
            return;
        }
        OutputStream toClose = out;
        out = null;
        handle = null;
        try {
            // Closing the buffer flushes it and always closes the underlying stream
            toClose.close();
            LOG.trace("Closed handle for {}", file);
        } catch (IOException e) {
            LOG.trace("Ignoring close failure for {}: {}", file, e.getMessage());
        }
    }
}
