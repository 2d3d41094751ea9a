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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Behavioral tests for {@link FileLogSink}.
 * <p>
 * These tests verify the observable contract seen by a dispatch framework:
 * <ul>
 *   <li>Truncate and append semantics over existing content</li>
 *   <li>Close-after-write growth and handle release</li>
 *   <li>Immediate visibility with autoflush</li>
 *   <li>Open failures at construction or first write</li>
 * </ul>
 */
class FileLogSinkTest {

    private static final List<String> MESSAGES = List.of("first\n", "second\n", "third without newline");

    @TempDir
    Path tempDir;

    private FileLogSink sink;

    @AfterEach
    void tearDown() {
        if (sink != null) {
            sink.close();
        }
    }

    private Path existingFile(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content, StandardCharsets.UTF_8);
    }

    // ========================================================================
    // Persistent Handle
    // ========================================================================

    @Nested
    @DisplayName("Persistent handle")
    class PersistentTests {

        @Test
        @DisplayName("Truncate discards existing content and concatenates messages")
        void truncateConcatenates() throws IOException {
            Path file = existingFile("t.log", "stale content\n");

            sink = new FileLogSink(SinkConfig.builder().filename(file).build());
            assertEquals(0, Files.size(file), "Existing content is discarded at open time");

            MESSAGES.forEach(sink::logMessage);
            sink.close();

            assertEquals(String.join("", MESSAGES), Files.readString(file));
        }

        @Test
        @DisplayName("Append keeps existing content and adds messages after it")
        void appendKeepsExisting() throws IOException {
            Path file = existingFile("a.log", "existing\n");

            sink = new FileLogSink(SinkConfig.builder().filename(file).mode("append").build());
            MESSAGES.forEach(sink::logMessage);
            sink.close();

            assertEquals("existing\n" + String.join("", MESSAGES), Files.readString(file));
        }

        @Test
        @DisplayName("Append creates a missing file")
        void appendCreatesFile() throws IOException {
            Path file = tempDir.resolve("new.log");

            sink = new FileLogSink(SinkConfig.builder().filename(file).mode(">>").build());
            sink.logMessage("hello");

            assertEquals("hello", Files.readString(file));
        }

        @Test
        @DisplayName("Unrecognized mode behaves as truncate")
        void unrecognizedModeTruncates() throws IOException {
            Path file = existingFile("u.log", "old");

            sink = new FileLogSink(SinkConfig.builder().filename(file).mode("not-a-real-mode").build());
            sink.logMessage("new");

            assertEquals(OpenMode.TRUNCATE, sink.config().mode());
            assertEquals("new", Files.readString(file));
        }

        @Test
        @DisplayName("Handle stays open until close")
        void handleLifetime() {
            sink = new FileLogSink(SinkConfig.builder().filename(tempDir.resolve("h.log")).build());

            assertTrue(sink.isHandleOpen());
            sink.logMessage("x");
            assertTrue(sink.isHandleOpen());

            sink.close();
            assertFalse(sink.isHandleOpen());
            assertTrue(sink.isClosed());
        }
    }

    // ========================================================================
    // Close After Write
    // ========================================================================

    @Nested
    @DisplayName("Close after write")
    class CloseAfterWriteTests {

        @Test
        @DisplayName("Each write grows the file by exactly the message length and releases the handle")
        void growsByMessageLength() throws IOException {
            Path file = existingFile("c.log", "seed;");
            sink = new FileLogSink(SinkConfig.builder().filename(file).closeAfterWrite(true).build());

            long expectedSize = Files.size(file);
            for (String message : List.of("ascii;", "café;", "日本;", "")) {
                sink.logMessage(message);
                expectedSize += message.getBytes(StandardCharsets.UTF_8).length;

                assertFalse(sink.isHandleOpen(), "No handle may remain open after logMessage returns");
                assertEquals(expectedSize, Files.size(file));
            }
        }

        @Test
        @DisplayName("Mode 'write' is overridden so both messages survive")
        void writeModeOverridden() throws IOException {
            Path file = tempDir.resolve("w.log");
            sink = new FileLogSink(SinkConfig.builder()
                    .filename(file)
                    .mode("write")
                    .closeAfterWrite(true)
                    .build());

            sink.logMessage("one\n");
            sink.logMessage("two\n");

            assertEquals(OpenMode.APPEND, sink.config().mode());
            assertEquals("one\ntwo\n", Files.readString(file));
        }

        @Test
        @DisplayName("File deleted between writes is recreated")
        void fileRecreated() throws IOException {
            Path file = tempDir.resolve("r.log");
            sink = new FileLogSink(SinkConfig.builder().filename(file).closeAfterWrite(true).build());

            sink.logMessage("before");
            Files.delete(file);
            sink.logMessage("after");

            assertEquals("after", Files.readString(file));
        }
    }

    // ========================================================================
    // Visibility
    // ========================================================================

    @ParameterizedTest
    @ValueSource(booleans = {false, true})
    @DisplayName("Autoflush makes each message visible to an independent reader")
    void autoflushVisibility(boolean closeAfterWrite) throws IOException {
        Path file = tempDir.resolve("v.log");
        sink = new FileLogSink(SinkConfig.builder()
                .filename(file)
                .autoflush(true)
                .closeAfterWrite(closeAfterWrite)
                .build());

        StringBuilder expected = new StringBuilder();
        for (String message : MESSAGES) {
            sink.logMessage(message);
            expected.append(message);
            assertEquals(expected.toString(), Files.readString(file));
        }
    }

    // ========================================================================
    // Failures
    // ========================================================================

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Unwritable path fails construction in persistent mode")
        void persistentOpenFailure() {
            Path file = tempDir.resolve("no-such-dir").resolve("x.log");

            assertThrows(SinkException.class,
                    () -> new FileLogSink(SinkConfig.builder().filename(file).build()));
            assertFalse(Files.exists(file.getParent()));
        }

        @Test
        @DisplayName("Unwritable path fails the first write in close-after-write mode")
        void ephemeralOpenFailure() {
            Path file = tempDir.resolve("no-such-dir").resolve("x.log");
            sink = new FileLogSink(SinkConfig.builder().filename(file).closeAfterWrite(true).build());

            assertThrows(SinkException.class, () -> sink.logMessage("lost"));
            assertFalse(Files.exists(file));
            assertFalse(sink.isHandleOpen());
        }

        @ParameterizedTest
        @ValueSource(booleans = {false, true})
        @DisplayName("Read-only file fails to open and keeps its content")
        void readOnlyFile(boolean closeAfterWrite) throws IOException {
            assumeTrue(Files.getFileStore(tempDir).supportsFileAttributeView(PosixFileAttributeView.class),
                    "POSIX permissions not supported");
            Path file = existingFile("ro.log", "protected;");
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("r--r--r--"));
            try {
                assumeFalse(Files.isWritable(file), "Permissions are not enforced for this user");

                SinkConfig config = SinkConfig.builder().filename(file).closeAfterWrite(closeAfterWrite).build();
                if (closeAfterWrite) {
                    sink = new FileLogSink(config);
                    assertThrows(SinkException.class, () -> sink.logMessage("lost;"));
                    assertFalse(sink.isHandleOpen());
                } else {
                    assertThrows(SinkException.class, () -> new FileLogSink(config));
                }

                assertEquals("protected;", Files.readString(file));
            } finally {
                Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-r--r--"));
            }
        }

        @Test
        @DisplayName("Null message is rejected")
        void nullMessage() {
            sink = new FileLogSink(SinkConfig.builder().filename(tempDir.resolve("n.log")).build());

            assertThrows(NullPointerException.class, () -> sink.logMessage(null));
        }

        @Test
        @DisplayName("Write after close is rejected")
        void writeAfterClose() {
            sink = new FileLogSink(SinkConfig.builder().filename(tempDir.resolve("n.log")).build());
            sink.close();

            assertThrows(IllegalStateException.class, () -> sink.logMessage("late"));
        }
    }

    // ========================================================================
    // Construction
    // ========================================================================

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("Option map constructor applies framework options")
        void optionMapConstructor() throws IOException {
            Path file = existingFile("m.log", "keep;");
            sink = new FileLogSink(Map.of(
                    "name", "file1",
                    "filename", file.toString(),
                    "mode", "append",
                    "min_level", "info"));

            sink.logMessage("added;");

            assertEquals("file1", sink.name());
            assertEquals("keep;added;", Files.readString(file));
        }

        @Test
        @DisplayName("Sink name defaults to the file name")
        void defaultName() {
            sink = new FileLogSink(SinkConfig.builder().filename(tempDir.resolve("service.log")).build());

            assertEquals("service.log", sink.name());
            assertTrue(sink.toString().contains("service.log"));
        }

        @Test
        @DisplayName("Shutdown-hook sink closes normally and repeatedly")
        void closeOnShutdown() throws IOException {
            Path file = tempDir.resolve("s.log");
            sink = new FileLogSink(SinkConfig.builder().filename(file).closeOnShutdown(true).build());

            sink.logMessage("bye");
            sink.close();

            assertTrue(sink.isClosed());
            assertDoesNotThrow(() -> sink.close());
            assertEquals("bye", Files.readString(file));
        }

        @Test
        @DisplayName("try-with-resources releases the handle")
        void tryWithResources() throws IOException {
            Path file = tempDir.resolve("twr.log");
            FileLogSink scoped;
            try (FileLogSink s = new FileLogSink(SinkConfig.builder().filename(file).autoflush(false).build())) {
                scoped = s;
                s.logMessage("scoped");
            }

            assertTrue(scoped.isClosed());
            assertFalse(scoped.isHandleOpen());
            assertEquals("scoped", Files.readString(file));
        }
    }
}
