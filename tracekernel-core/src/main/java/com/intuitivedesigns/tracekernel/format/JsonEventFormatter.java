/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.format;

import com.intuitivedesigns.tracekernel.core.EventFormatter;
import com.intuitivedesigns.tracekernel.core.TraceEvent;

/**
 * One JSON object per line.
 */
public final class JsonEventFormatter implements EventFormatter {

    @Override
    public String format(TraceEvent event) {
        return EventJson.toJson(event);
    }
}
