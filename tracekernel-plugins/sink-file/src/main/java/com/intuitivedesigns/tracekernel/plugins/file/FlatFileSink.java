/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.plugins.file;

import com.intuitivedesigns.tracekernel.core.EventFormatter;
import com.intuitivedesigns.tracekernel.core.SinkDiagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Appends one formatted line per event to a file. The file and its parent directories are created
 * if missing.
 */
public final class FlatFileSink extends FormattedLineWriter {

    private static final Logger log = LoggerFactory.getLogger(FlatFileSink.class);

    private final Path path;
    private final BufferedWriter writer;

    public FlatFileSink(String id, Path path, EventFormatter formatter, SinkDiagnostics diagnostics) throws IOException {
        super(id, formatter, diagnostics);
        this.path = Objects.requireNonNull(path, "path").toAbsolutePath();
        final Path parent = this.path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.writer = Files.newBufferedWriter(this.path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        log.info("FlatFileSink [{}] writing to {}", id, this.path);
    }

    @Override
    protected Writer writer() {
        return writer;
    }

    public Path path() {
        return path;
    }

    @Override
    public void close() throws IOException {
        writer.close();
        log.info("FlatFileSink [{}] closed.", id());
    }
}
