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
/**
 * File-backed output sink for log dispatch frameworks.
 * <p>
 * This package persists already-formatted log messages to a file:
 * <ul>
 *   <li>{@link dev.mars.filelog.sink.LogSink} - The sink interface seen by the dispatch framework</li>
 *   <li>{@link dev.mars.filelog.sink.FileLogSink} - File-backed implementation</li>
 *   <li>{@link dev.mars.filelog.sink.FileHandleManager} - Owns the OS file handle</li>
 *   <li>{@link dev.mars.filelog.sink.ModeResolver} - Truncate vs. append resolution</li>
 *   <li>{@link dev.mars.filelog.sink.SinkConfig} - Layered configuration</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Close-after-write never truncates:</b> reopening per message always appends</li>
 *   <li><b>Lenient mode parsing:</b> unknown modes degrade to truncate instead of failing</li>
 *   <li><b>Deterministic teardown:</b> handles are released by {@code close()}, never by the GC</li>
 *   <li><b>Open failures are fatal:</b> a sink that cannot open its file fails loudly</li>
 * </ul>
 *
 * @see dev.mars.filelog.sink.LogSink
 */
package dev.mars.filelog.sink;
