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
package dev.mars.filelog.demo;

import dev.mars.filelog.sink.FileLogSink;
import dev.mars.filelog.sink.LogSink;
import dev.mars.filelog.sink.SinkConfig;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Demo entry point for the file sink.
 * <p>
 * Writes a few pre-formatted messages and prints the resulting file:
 * <ul>
 *   <li>Building a configuration</li>
 *   <li>Writing through the sink</li>
 *   <li>Reading the file back while the sink is still open</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link SinkConfig} with the following priority:
 * <ol>
 *   <li>Command-line arguments: {@code <filename> [mode]}</li>
 *   <li>System properties: {@code -Dfilelog.filename=/path -Dfilelog.mode=append ...}</li>
 *   <li>Environment variables: {@code FILELOG_FILENAME, FILELOG_MODE, ...}</li>
 *   <li>Properties file: {@code filelog.properties} on classpath or working directory</li>
 *   <li>Defaults ({@code logs/demo.log} when nothing names a file)</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl filelog-demo -am
 *
 * # Truncate logs/demo.log and write to it
 * java -cp "filelog-demo/target/*:..." dev.mars.filelog.demo.FileSinkDemo
 *
 * # Append to a file, reopening it for every message
 * java -Dfilelog.closeAfterWrite=true -cp ... dev.mars.filelog.demo.FileSinkDemo /tmp/app.log append
 * </pre>
 *
 * @see SinkConfig
 */
public class FileSinkDemo {

    private static final Path DEFAULT_FILE = Path.of("logs", "demo.log");

    public static void main(String[] args) throws Exception {
        System.out.println("+---------------------------------------+");
        System.out.println("|          File Sink Demo               |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        SinkConfig config = buildConfig(args);
        System.out.println("Configuration: " + config);
        System.out.println();

        Path parent = config.filename().toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        List<String> messages = List.of(
                Instant.now() + " [info] demo started\n",
                Instant.now() + " [warning] disk usage at 81%\n",
                Instant.now() + " [info] demo finished\n");

        try (LogSink sink = new FileLogSink(config)) {
            System.out.println("[OK] Sink '" + sink.name() + "' ready, mode=" + config.mode());

            for (String message : messages) {
                sink.logMessage(message);
            }
            System.out.println("[OK] Wrote " + messages.size() + " messages");

            if (config.autoflush()) {
                // Autoflush makes the bytes visible before the sink is closed
                long size = Files.size(config.filename());
                System.out.println("[OK] File size while sink is open: " + size + " bytes");
            }
        }

        System.out.println("\n  Contents of " + config.filename().toAbsolutePath() + ":");
        String contents = Files.readString(config.filename(), StandardCharsets.UTF_8);
        for (String line : contents.split("\n")) {
            System.out.println("    " + line);
        }

        System.out.println("\n+---------------------------------------+");
        System.out.println("|  File sink demo complete!             |");
        System.out.println("|  Run with 'append' to keep history.   |");
        System.out.println("+---------------------------------------+");
    }

    static SinkConfig buildConfig(String[] args) {
        SinkConfig.Builder builder = SinkConfig.builder().defaultFilename(DEFAULT_FILE);
        if (args.length > 0 && !args[0].isBlank()) {
            builder.filename(args[0]);
        }
        if (args.length > 1 && !args[1].isBlank()) {
            builder.mode(args[1]);
        }
        return builder.build();
    }
}
