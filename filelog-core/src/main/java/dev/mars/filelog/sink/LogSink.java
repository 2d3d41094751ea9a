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

import java.io.Closeable;

/**
 * Output sink consumed by a log dispatch framework.
 * <p>
 * The framework owns level filtering, the message-shaping callback chain and the registry
 * of named sinks. It calls {@link #logMessage(String)} exactly once per accepted record,
 * with the message already fully formatted. A sink never filters, reformats or re-runs
 * the callback chain.
 * <p>
 * <b>Lifecycle:</b> {@code Constructed -> [Opened] -> (writing)* -> Closed}. Sinks must be
 * closed explicitly, preferably with try-with-resources; nothing relies on finalization.
 */
public interface LogSink extends Closeable {

    /**
     * Persists an already-formatted message.
     *
     * @param message the message, written as-is with no separator added
     * @throws SinkException         if the destination cannot be opened or written
     * @throws IllegalStateException if the sink has been closed
     */
    void logMessage(String message);

    /** The sink's name, as registered with the dispatch framework. */
    String name();

    /**
     * Releases the destination. Idempotent. Never throws.
     */
    @Override
    void close();
}
