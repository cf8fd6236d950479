/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.plugins.file;

import com.intuitivedesigns.tracekernel.core.EventSink;
import com.intuitivedesigns.tracekernel.spi.SinkContext;
import com.intuitivedesigns.tracekernel.spi.SinkPlugin;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * ID: FLAT_FILE. Keys: {@code file.path} (required), {@code formatter}.
 */
public final class FlatFileSinkPlugin implements SinkPlugin {

    public static final String ID = "FLAT_FILE";
    public static final String KEY_PATH = "file.path";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean buffered() {
        return false;
    }

    @Override
    public EventSink create(SinkContext context) throws IOException {
        Objects.requireNonNull(context, "context");
        final String path = context.config().getString(KEY_PATH, null);
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Missing config: sink." + context.name() + "." + KEY_PATH);
        }
        return new FlatFileSink(context.name(), Path.of(path), FormattedLineWriter.formatterFor(context), context.diagnostics());
    }
}
