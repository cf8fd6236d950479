/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.publish;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded exponential backoff for transient sink failures.
 * <p>
 * The delay before retry {@code n} (1-based) is
 * {@code min + (2^(n-1) - 1) * random(0.8 * delta, 1.2 * delta)}, capped at {@code max}.
 *
 * @param maxAttempts  total publish attempts per batch, including the first
 * @param minBackoff   delay before the first retry
 * @param maxBackoff   ceiling for any delay
 * @param deltaBackoff growth step, jittered by 20 percent
 */
public record RetryPolicy(int maxAttempts, Duration minBackoff, Duration maxBackoff, Duration deltaBackoff) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(5, Duration.ofSeconds(1), Duration.ofMinutes(1), Duration.ofSeconds(5));

    public static final RetryPolicy NO_RETRY = new RetryPolicy(1, Duration.ZERO, Duration.ZERO, Duration.ZERO);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        Objects.requireNonNull(minBackoff, "minBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        Objects.requireNonNull(deltaBackoff, "deltaBackoff");
        if (minBackoff.isNegative() || maxBackoff.isNegative() || deltaBackoff.isNegative()) {
            throw new IllegalArgumentException("Backoff durations must not be negative");
        }
        if (maxBackoff.compareTo(minBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff " + maxBackoff + " is below minBackoff " + minBackoff);
        }
    }

    /**
     * @param failures number of failed attempts so far
     * @return true if another attempt is allowed
     */
    public boolean canRetry(int failures) {
        return failures < maxAttempts;
    }

    /**
     * @param retry 1-based retry number
     */
    public Duration delayBefore(int retry) {
        if (retry < 1) {
            throw new IllegalArgumentException("retry must be >= 1, got " + retry);
        }
        final long minMs = minBackoff.toMillis();
        final long maxMs = maxBackoff.toMillis();
        final long deltaMs = deltaBackoff.toMillis();

        long jittered = 0L;
        if (deltaMs > 0) {
            final long low = (long) (deltaMs * 0.8);
            final long high = (long) (deltaMs * 1.2);
            jittered = ThreadLocalRandom.current().nextLong(low, high + 1);
        }

        final double growth = Math.pow(2.0, Math.min(retry - 1, 30)) - 1.0;
        final double delayMs = Math.min(minMs + growth * jittered, (double) maxMs);
        return Duration.ofMillis((long) delayMs);
    }
}
