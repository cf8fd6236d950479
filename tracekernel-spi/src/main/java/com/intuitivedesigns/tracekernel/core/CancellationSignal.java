/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.core;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation flag shared between a publisher and its sink.
 * Sinks may poll {@link #isCancelled()} between I/O steps; retry loops sleep through {@link #await(Duration)}.
 */
public final class CancellationSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    public void cancel() {
        latch.countDown();
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    /**
     * Sleeps for up to {@code timeout}, waking early on cancellation.
     *
     * @return true if cancelled (before or during the wait)
     */
    public boolean await(Duration timeout) {
        if (timeout == null) {
            try {
                latch.await();
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return isCancelled();
            }
        }
        if (timeout.isZero() || timeout.isNegative()) {
            return isCancelled();
        }
        try {
            return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return isCancelled();
        }
    }
}
