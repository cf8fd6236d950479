/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.publish;

/**
 * Completes a pending flush when the publish cycle serving it ended in failure.
 */
public class FlushFailedException extends RuntimeException {

    private final String sinkId;

    public FlushFailedException(String sinkId, Throwable cause) {
        super("Flush of sink [" + sinkId + "] failed: " + (cause == null ? "unknown" : cause.getMessage()), cause);
        this.sinkId = sinkId;
    }

    public String sinkId() {
        return sinkId;
    }
}
