/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.spi;

import com.intuitivedesigns.tracekernel.core.EventSink;

/**
 * SPI definition for event sinks (destinations).
 */
public interface SinkPlugin extends PipelinePlugin<EventSink> {

    @Override
    String id(); // e.g. "DATABASE", "ELASTICSEARCH", "FLAT_FILE"

    @Override
    default PluginKind kind() {
        return PluginKind.SINK;
    }

    /**
     * Whether the sink is fed through a buffered publisher (batches, retries, background flush).
     * Cheap local sinks return false and receive one event per call on the emitting thread.
     */
    default boolean buffered() {
        return true;
    }

    EventSink create(SinkContext context) throws Exception;
}
