/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.spi;

/**
 * Common shape of every plugin discovered through {@link ServicePluginRegistry}.
 *
 * @param <T> the component type the plugin creates
 */
public interface PipelinePlugin<T> {

    /**
     * @return The unique ID of this plugin implementation (e.g., 'DATABASE', 'JSON').
     */
    String id();

    PluginKind kind();
}
