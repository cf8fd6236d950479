/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.plugins.file;

import com.intuitivedesigns.tracekernel.core.EventFormatter;
import com.intuitivedesigns.tracekernel.core.SinkDiagnostics;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Writes one formatted line per event to stdout (or stderr). Closing flushes but leaves the stream open.
 */
public final class ConsoleSink extends FormattedLineWriter {

    private final Writer writer;

    public ConsoleSink(String id, OutputStream out, EventFormatter formatter, SinkDiagnostics diagnostics) {
        super(id, formatter, diagnostics);
        this.writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
    }

    @Override
    protected Writer writer() {
        return writer;
    }

    @Override
    public void close() throws IOException {
        writer.flush();
    }
}
