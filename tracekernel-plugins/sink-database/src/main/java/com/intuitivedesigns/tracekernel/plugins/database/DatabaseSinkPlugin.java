/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.plugins.database;

import com.intuitivedesigns.tracekernel.core.EventSink;
import com.intuitivedesigns.tracekernel.spi.SinkContext;
import com.intuitivedesigns.tracekernel.spi.SinkPlugin;

import java.util.Objects;

/**
 * Relational table sink.
 * <p>
 * ID: DATABASE
 */
public final class DatabaseSinkPlugin implements SinkPlugin {

    public static final String ID = "DATABASE";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public EventSink create(SinkContext context) {
        Objects.requireNonNull(context, "context");
        return DatabaseSink.fromConfig(context.name(), context.config(), context.metrics());
    }
}
