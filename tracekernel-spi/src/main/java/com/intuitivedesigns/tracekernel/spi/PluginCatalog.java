/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.spi;

/**
 * Holds the typed registries for every plugin kind.
 */
public final class PluginCatalog {

    private final ServicePluginRegistry<SinkPlugin> sinks;
    private final ServicePluginRegistry<FormatterPlugin> formatters;

    public PluginCatalog(ClassLoader cl) {
        this(new ServicePluginRegistry<>(SinkPlugin.class, cl),
                new ServicePluginRegistry<>(FormatterPlugin.class, cl));
    }

    public PluginCatalog(ServicePluginRegistry<SinkPlugin> sinks, ServicePluginRegistry<FormatterPlugin> formatters) {
        this.sinks = sinks;
        this.formatters = formatters;
    }

    public static PluginCatalog discover() {
        final ClassLoader threadCl = Thread.currentThread().getContextClassLoader();
        return new PluginCatalog(threadCl != null ? threadCl : PluginCatalog.class.getClassLoader());
    }

    public ServicePluginRegistry<SinkPlugin> sinks() {
        return sinks;
    }

    public ServicePluginRegistry<FormatterPlugin> formatters() {
        return formatters;
    }
}
