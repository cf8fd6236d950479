/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.plugins.elasticsearch;

import com.intuitivedesigns.tracekernel.core.EventSink;
import com.intuitivedesigns.tracekernel.spi.SinkContext;
import com.intuitivedesigns.tracekernel.spi.SinkPlugin;

import java.util.Objects;

/**
 * ID: ELASTICSEARCH
 */
public final class ElasticsearchSinkPlugin implements SinkPlugin {

    public static final String ID = "ELASTICSEARCH";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public EventSink create(SinkContext context) {
        Objects.requireNonNull(context, "context");
        return ElasticsearchSink.fromConfig(context.name(), context.config(), context.metrics());
    }
}
