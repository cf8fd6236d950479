/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.core;

/**
 * Renders a trace event as a single line of text for file and console sinks.
 */
@FunctionalInterface
public interface EventFormatter {

    /**
     * @throws RuntimeException if the event cannot be rendered; the caller skips the event
     */
    String format(TraceEvent event);
}
