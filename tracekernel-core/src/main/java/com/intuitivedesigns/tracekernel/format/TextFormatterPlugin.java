/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.format;

import com.intuitivedesigns.tracekernel.config.PipelineConfig;
import com.intuitivedesigns.tracekernel.core.EventFormatter;
import com.intuitivedesigns.tracekernel.spi.FormatterPlugin;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * {@code formatter=TEXT}. Optional {@code formatter.datetime} takes a {@link DateTimeFormatter} pattern (UTC).
 */
public final class TextFormatterPlugin implements FormatterPlugin {

    @Override
    public String id() {
        return "TEXT";
    }

    @Override
    public EventFormatter create(PipelineConfig config) {
        final String pattern = config.getString("formatter.datetime", null);
        if (pattern == null || pattern.isBlank()) {
            return new TextEventFormatter();
        }
        return new TextEventFormatter(DateTimeFormatter.ofPattern(pattern).withZone(ZoneOffset.UTC));
    }
}
