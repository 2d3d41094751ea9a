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

/**
 * Resolved file-open policy of a sink.
 */
public enum OpenMode {

    /** Discard any existing content when the file is opened. */
    TRUNCATE,

    /** Keep existing content and write after it. */
    APPEND;

    /** Whether the underlying stream should be opened in append mode. */
    public boolean appends() {
        return this == APPEND;
    }
}
