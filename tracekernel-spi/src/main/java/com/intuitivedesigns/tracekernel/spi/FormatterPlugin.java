/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.spi;

import com.intuitivedesigns.tracekernel.config.PipelineConfig;
import com.intuitivedesigns.tracekernel.core.EventFormatter;

/**
 * SPI definition for text formatters used by file and console sinks.
 */
public interface FormatterPlugin extends PipelinePlugin<EventFormatter> {

    @Override
    default PluginKind kind() {
        return PluginKind.FORMATTER;
    }

    EventFormatter create(PipelineConfig config);
}
