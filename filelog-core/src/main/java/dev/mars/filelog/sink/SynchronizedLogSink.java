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

import java.util.Objects;

/**
 * Serializes access to a {@link LogSink} shared between threads.
 * <p>
 * Sinks hold no locks of their own; concurrent unserialized writes to one handle may
 * interleave arbitrarily. Wrapping the sink guarantees that each message is written
 * whole and that {@link #close()} never races a write.
 */
public final class SynchronizedLogSink implements LogSink {

    private final LogSink delegate;
    private final Object lock = new Object();

    public SynchronizedLogSink(LogSink delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public void logMessage(String message) {
        synchronized (lock) {
            delegate.logMessage(message);
        }
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public void close() {
        synchronized (lock) {
            delegate.close();
        }
    }

    /** The wrapped sink. */
    public LogSink delegate() {
        return delegate;
    }
}
