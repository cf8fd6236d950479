/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.spi;

import com.intuitivedesigns.tracekernel.config.PipelineConfig;
import com.intuitivedesigns.tracekernel.core.SinkDiagnostics;
import com.intuitivedesigns.tracekernel.metrics.MetricsRuntime;

import java.util.Objects;

/**
 * Everything a {@link SinkPlugin} needs to build one named sink instance.
 *
 * @param name        the configured sink name (e.g. "db" for {@code sink.db.*})
 * @param config      the sink's own keys, prefix stripped ({@code table}, {@code jdbc.url}, ...)
 * @param metrics     metrics runtime
 * @param diagnostics fault reporting channel
 * @param formatters  formatter registry for text based sinks
 */
public record SinkContext(
        String name,
        PipelineConfig config,
        MetricsRuntime metrics,
        SinkDiagnostics diagnostics,
        ServicePluginRegistry<FormatterPlugin> formatters
) {

    public SinkContext {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(config, "config");
        metrics = (metrics == null) ? MetricsRuntime.NOOP : metrics;
        diagnostics = (diagnostics == null) ? SinkDiagnostics.NONE : diagnostics;
        formatters = (formatters == null) ? ServicePluginRegistry.empty(FormatterPlugin.class) : formatters;
    }
}
