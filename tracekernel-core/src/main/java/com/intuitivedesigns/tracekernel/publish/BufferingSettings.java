/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.publish;

import java.time.Duration;

/**
 * Flush triggers, capacity and shutdown bound of one buffered sink.
 *
 * @param interval           timer period, null for no timer
 * @param bufferingCount     size that triggers a flush, 0 disables the count trigger
 * @param maxBufferSize      buffer capacity
 * @param onCompletedTimeout bound on the final flush at dispose, null waits indefinitely
 * @param retryPolicy        backoff for transient failures
 */
public record BufferingSettings(
        Duration interval,
        int bufferingCount,
        int maxBufferSize,
        Duration onCompletedTimeout,
        RetryPolicy retryPolicy
) {

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);
    public static final int DEFAULT_BUFFERING_COUNT = 1000;
    public static final int DEFAULT_MAX_BUFFER_SIZE = 30_000;
    public static final Duration MINIMUM_INTERVAL = Duration.ofMillis(500);

    public static final BufferingSettings DEFAULTS = new BufferingSettings(
            DEFAULT_INTERVAL, DEFAULT_BUFFERING_COUNT, DEFAULT_MAX_BUFFER_SIZE, null, RetryPolicy.DEFAULT);

    public BufferingSettings {
        if (bufferingCount < 0) {
            throw new IllegalArgumentException("bufferingCount must be >= 0, got " + bufferingCount);
        }
        if (maxBufferSize <= 0) {
            throw new IllegalArgumentException("maxBufferSize must be > 0, got " + maxBufferSize);
        }
        if (interval != null && interval.isNegative()) {
            throw new IllegalArgumentException("interval must not be negative: " + interval);
        }
        if (onCompletedTimeout != null && onCompletedTimeout.isNegative()) {
            throw new IllegalArgumentException("onCompletedTimeout must not be negative: " + onCompletedTimeout);
        }
        if (interval == null && bufferingCount == 0) {
            throw new IllegalArgumentException("Either a buffering interval or a buffering count is required");
        }
        if (bufferingCount != Integer.MAX_VALUE && maxBufferSize < bufferingCount * 3L) {
            throw new IllegalArgumentException("maxBufferSize " + maxBufferSize
                    + " must be at least three times bufferingCount " + bufferingCount);
        }
        retryPolicy = (retryPolicy == null) ? RetryPolicy.DEFAULT : retryPolicy;
    }

    /**
     * Timer period actually used: never below {@link #MINIMUM_INTERVAL}; null when disabled.
     */
    public Duration effectiveInterval() {
        if (interval == null) return null;
        return (interval.compareTo(MINIMUM_INTERVAL) < 0) ? MINIMUM_INTERVAL : interval;
    }

    public int maxBatchSize() {
        return (bufferingCount == 0) ? maxBufferSize : bufferingCount;
    }
}
