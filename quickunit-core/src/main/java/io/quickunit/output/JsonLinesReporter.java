/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.quickunit.output;

import io.quickunit.common.Json;
import io.quickunit.core.RunEvent;
import io.quickunit.core.RunEventType;
import io.quickunit.core.RunListener;
import org.slf4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A {@link RunListener} that streams every run event to a JSON Lines (.jsonl) file as it happens,
 * so the file can be tailed during a run.
 * <pre>
 * {"t":"run_enter","time":"2025-12-16T10:30:00Z","suites":2,"cases":5}
 * {"t":"suite_enter","time":"...","name":"StackTest"}
 * {"t":"case_exit","time":"...","suite":"StackTest","name":"testPush","status":"passed",...}
 * {"t":"run_exit","time":"...","suites":[...],"entries":[...],"summary":{...}}
 * </pre>
 * The file is truncated when the run starts and closed when it ends.
 */
public class JsonLinesReporter implements RunListener {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private static final DateTimeFormatter ISO_FORMAT = DateTimeFormatter.ISO_INSTANT;

    private final Path jsonlPath;
    private BufferedWriter writer;

    public JsonLinesReporter(Path jsonlPath) {
        this.jsonlPath = jsonlPath;
    }

    @Override
    public void onEvent(RunEvent event) {
        if (event.getType() == RunEventType.RUN_ENTER) {
            open();
        }
        if (writer == null) {
            return;
        }
        try {
            Map<String, Object> line = new LinkedHashMap<>();
            line.put("t", event.getType().name().toLowerCase());
            line.put("time", ISO_FORMAT.format(Instant.now()));
            line.putAll(event.toJson());
            writeLine(Json.stringifyStrict(line));
        } catch (IOException e) {
            logger.warn("failed to write json lines report: {}", e.getMessage());
        } finally {
            if (event.getType() == RunEventType.RUN_EXIT) {
                close();
            }
        }
    }

    private void open() {
        try {
            Path parent = jsonlPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            writer = Files.newBufferedWriter(jsonlPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);
            logger.debug("json lines report started: {}", jsonlPath);
        } catch (IOException e) {
            logger.warn("failed to start json lines report: {}", e.getMessage());
        }
    }

    private void writeLine(String json) throws IOException {
        writer.write(json);
        writer.newLine();
        writer.flush();
    }

    private void close() {
        try {
            writer.close();
            logger.info("json lines report written to: {}", jsonlPath);
        } catch (IOException e) {
            logger.warn("failed to close json lines report: {}", e.getMessage());
        } finally {
            writer = null;
        }
    }

    boolean isOpen() {
        return writer != null;
    }

    public Path getJsonlPath() {
        return jsonlPath;
    }

}
