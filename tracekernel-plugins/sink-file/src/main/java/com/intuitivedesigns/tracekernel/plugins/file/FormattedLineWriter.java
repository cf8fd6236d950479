/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.plugins.file;

import com.intuitivedesigns.tracekernel.core.CancellationSignal;
import com.intuitivedesigns.tracekernel.core.EventFormatter;
import com.intuitivedesigns.tracekernel.core.EventSink;
import com.intuitivedesigns.tracekernel.core.SinkDiagnostics;
import com.intuitivedesigns.tracekernel.core.TraceEvent;
import com.intuitivedesigns.tracekernel.spi.FormatterPlugin;
import com.intuitivedesigns.tracekernel.spi.SinkContext;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Objects;

/**
 * Base for sinks that write one formatted line per event. An event that fails to format is reported
 * and skipped; the rest of the batch is still written.
 */
abstract class FormattedLineWriter implements EventSink {

    static final String KEY_FORMATTER = "formatter";
    static final String DEFAULT_FORMATTER = "TEXT";

    private final String id;
    private final EventFormatter formatter;
    private final SinkDiagnostics diagnostics;

    FormattedLineWriter(String id, EventFormatter formatter, SinkDiagnostics diagnostics) {
        this.id = Objects.requireNonNull(id, "id");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.diagnostics = (diagnostics == null) ? SinkDiagnostics.NONE : diagnostics;
    }

    /**
     * Resolves {@code sink.<name>.formatter} (default TEXT) against the formatter registry.
     */
    static EventFormatter formatterFor(SinkContext context) {
        final String formatterId = context.config().getString(KEY_FORMATTER, DEFAULT_FORMATTER);
        final FormatterPlugin plugin = context.formatters()
                .require(formatterId, "sink." + context.name() + "." + KEY_FORMATTER);
        return plugin.create(context.config());
    }

    protected abstract Writer writer();

    /**
     * Writes one formatted line. Subclasses may roll the underlying file first.
     */
    protected void writeLine(String line) throws IOException {
        final Writer out = writer();
        out.write(line);
        out.write(System.lineSeparator());
    }

    @Override
    public int publish(List<TraceEvent> batch, CancellationSignal cancellation) throws IOException {
        int written = 0;
        for (TraceEvent event : batch) {
            final String line;
            try {
                line = formatter.format(event);
            } catch (RuntimeException e) {
                diagnostics.formattingFailed(id, event, e);
                continue;
            }
            writeLine(line);
            written++;
        }
        writer().flush();
        return written;
    }

    @Override
    public String id() {
        return id;
    }
}
