/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.plugins.file;

import com.intuitivedesigns.tracekernel.core.EventSink;
import com.intuitivedesigns.tracekernel.spi.SinkContext;
import com.intuitivedesigns.tracekernel.spi.SinkPlugin;

import java.util.Locale;
import java.util.Objects;

/**
 * ID: CONSOLE. Keys: {@code console.stream} (stdout|stderr), {@code formatter}.
 */
public final class ConsoleSinkPlugin implements SinkPlugin {

    public static final String ID = "CONSOLE";
    public static final String KEY_STREAM = "console.stream";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean buffered() {
        return false;
    }

    @Override
    public EventSink create(SinkContext context) {
        Objects.requireNonNull(context, "context");
        final String stream = context.config().getString(KEY_STREAM, "stdout").toLowerCase(Locale.ROOT);
        switch (stream) {
            case "stdout":
                return new ConsoleSink(context.name(), System.out, FormattedLineWriter.formatterFor(context), context.diagnostics());
            case "stderr":
                return new ConsoleSink(context.name(), System.err, FormattedLineWriter.formatterFor(context), context.diagnostics());
            default:
                throw new IllegalArgumentException("Invalid sink." + context.name() + "." + KEY_STREAM + ": '" + stream + "'");
        }
    }
}
