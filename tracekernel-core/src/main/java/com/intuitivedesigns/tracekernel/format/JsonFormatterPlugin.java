/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.format;

import com.intuitivedesigns.tracekernel.config.PipelineConfig;
import com.intuitivedesigns.tracekernel.core.EventFormatter;
import com.intuitivedesigns.tracekernel.spi.FormatterPlugin;

public final class JsonFormatterPlugin implements FormatterPlugin {

    @Override
    public String id() {
        return "JSON";
    }

    @Override
    public EventFormatter create(PipelineConfig config) {
        return new JsonEventFormatter();
    }
}
