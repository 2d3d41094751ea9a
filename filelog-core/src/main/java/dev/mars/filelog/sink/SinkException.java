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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Thrown when a sink cannot open or write its file.
 * <p>
 * Raised from the {@link FileLogSink} constructor in persistent mode and from
 * {@link LogSink#logMessage(String)} in close-after-write mode. The sink never retries;
 * the caller decides whether to disable the sink or abort.
 */
public class SinkException extends UncheckedIOException {

    private final Path file;

    public SinkException(String message, Path file, IOException cause) {
        super(message, cause);
        this.file = file;
    }

    /** The file the failed operation targeted. */
    public Path file() {
        return file;
    }
}
