/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.core;

/**
 * Failure expected to clear on its own (timeouts, throttling, failover). The batch is retried with backoff.
 */
public class TransientPublishException extends PublishException {

    public TransientPublishException(String message) {
        super(message);
    }

    public TransientPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
