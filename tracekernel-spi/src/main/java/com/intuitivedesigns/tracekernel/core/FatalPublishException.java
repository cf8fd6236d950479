/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.core;

/**
 * Failure that retrying cannot fix (bad credentials, schema mismatch). The batch is discarded.
 */
public class FatalPublishException extends PublishException {

    public FatalPublishException(String message) {
        super(message);
    }

    public FatalPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
