/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.core;

/**
 * A single record rejected the whole batch. The record at {@link #offendingIndex()} is dropped and
 * the remainder retried.
 */
public class PartialPublishException extends PublishException {

    private final int offendingIndex;

    public PartialPublishException(int offendingIndex, String message) {
        this(offendingIndex, message, null);
    }

    public PartialPublishException(int offendingIndex, String message, Throwable cause) {
        super(message, cause);
        if (offendingIndex < 0) {
            throw new IllegalArgumentException("offendingIndex must be >= 0, got " + offendingIndex);
        }
        this.offendingIndex = offendingIndex;
    }

    public int offendingIndex() {
        return offendingIndex;
    }
}
