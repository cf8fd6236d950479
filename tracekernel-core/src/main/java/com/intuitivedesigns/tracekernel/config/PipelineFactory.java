/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.config;

import com.intuitivedesigns.tracekernel.core.EventPipeline;
import com.intuitivedesigns.tracekernel.core.EventSink;
import com.intuitivedesigns.tracekernel.diagnostics.PipelineDiagnostics;
import com.intuitivedesigns.tracekernel.metrics.MetricsRuntime;
import com.intuitivedesigns.tracekernel.spi.PluginCatalog;
import com.intuitivedesigns.tracekernel.spi.SinkContext;
import com.intuitivedesigns.tracekernel.spi.SinkPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Builds an {@link EventPipeline} from configuration and the plugin catalog.
 *
 * <pre>
 * pipeline.sinks=db,file
 * sink.db.type=DATABASE
 * sink.db.buffering.count=500
 * sink.file.type=FLAT_FILE
 * </pre>
 */
public final class PipelineFactory {

    private static final Logger log = LoggerFactory.getLogger(PipelineFactory.class);

    // Config keys
    public static final String KEY_SINKS = "pipeline.sinks";

    private final PluginCatalog catalog;

    public PipelineFactory(PluginCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public static PipelineFactory discover() {
        return new PipelineFactory(PluginCatalog.discover());
    }

    public PluginCatalog catalog() {
        return catalog;
    }

    /**
     * Creates every configured sink and attaches it. If any sink fails, the sinks created so far are
     * closed and the failure is rethrown.
     */
    public EventPipeline build(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        final MetricsRuntime m = (metrics == null) ? MetricsRuntime.NOOP : metrics;

        final PipelineDiagnostics diagnostics = new PipelineDiagnostics(m);
        final EventPipeline pipeline = new EventPipeline(diagnostics, m);

        try {
            for (String name : sinkNames(config)) {
                final SinkSettings settings = SinkSettings.from(config, name);
                final String typeKey = SinkSettings.prefix(name) + SinkSettings.KEY_TYPE;
                final SinkPlugin plugin = catalog.sinks().require(settings.type(), typeKey);

                final SinkContext context = new SinkContext(name, settings.config(), m, diagnostics, catalog.formatters());
                final EventSink sink = createSafe(plugin, context);

                if (plugin.buffered()) {
                    pipeline.attach(name, sink, settings.buffering(), settings.filter());
                } else {
                    pipeline.attachDirect(name, sink, settings.filter());
                }
            }
        } catch (RuntimeException e) {
            pipeline.close();
            throw e;
        }

        if (pipeline.sinks().isEmpty()) {
            log.warn("No sinks configured ({} is empty). Events will be discarded.", KEY_SINKS);
        }
        return pipeline;
    }

    public static List<String> sinkNames(PipelineConfig config) {
        final String raw = config.getString(KEY_SINKS, "");
        final Set<String> names = new LinkedHashSet<>();
        for (String part : raw.split(",")) {
            final String s = part.trim();
            if (!s.isEmpty() && !names.add(s)) {
                throw new IllegalArgumentException("Duplicate sink name '" + s + "' in " + KEY_SINKS);
            }
        }
        return new ArrayList<>(names);
    }

    public void logAvailablePlugins() {
        log.info("Plugin Catalog Loaded:");
        log.info("  Sinks:      {}", catalog.sinks().availableIds());
        log.info("  Formatters: {}", catalog.formatters().availableIds());
    }

    private static EventSink createSafe(SinkPlugin plugin, SinkContext context) {
        Objects.requireNonNull(plugin, "plugin");
        try {
            return plugin.create(context);
        } catch (Throwable t) {
            final String pluginId;
            try {
                pluginId = String.valueOf(plugin.id());
            } catch (Throwable ignored) {
                throw new RuntimeException("Failed creating Sink (plugin id unavailable)", t);
            }
            throw new RuntimeException("Failed creating Sink [" + pluginId + "] for '" + context.name() + "'", t);
        }
    }
}
