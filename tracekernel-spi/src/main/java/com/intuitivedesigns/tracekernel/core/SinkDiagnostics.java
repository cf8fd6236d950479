/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.core;

/**
 * Callbacks a sink uses to report problems it handled itself.
 */
public interface SinkDiagnostics {

    SinkDiagnostics NONE = new SinkDiagnostics() { };

    /**
     * An event could not be rendered and was skipped.
     */
    default void formattingFailed(String sinkId, TraceEvent event, Throwable error) {}

    /**
     * Any other fault the sink recovered from.
     */
    default void sinkFault(String sinkId, String message, Throwable error) {}
}
