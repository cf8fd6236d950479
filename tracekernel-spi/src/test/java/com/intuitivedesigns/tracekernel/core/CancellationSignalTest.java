/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CancellationSignalTest {

    @Test
    void testAwaitTimesOutWhenNotCancelled() {
        CancellationSignal signal = new CancellationSignal();

        assertFalse(signal.await(Duration.ofMillis(20)));
        assertFalse(signal.isCancelled());
    }

    @Test
    void testCancelWakesWaiter() throws Exception {
        CancellationSignal signal = new CancellationSignal();
        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            signal.cancel();
        });
        canceller.start();

        long start = System.nanoTime();
        boolean cancelled = signal.await(Duration.ofSeconds(10));
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(cancelled);
        assertTrue(elapsedMs < 5_000, "await should return early, took " + elapsedMs + "ms");
        canceller.join();
    }

    @Test
    void testZeroWaitReportsCurrentState() {
        CancellationSignal signal = new CancellationSignal();
        assertFalse(signal.await(Duration.ZERO));
        signal.cancel();
        signal.cancel();
        assertTrue(signal.await(Duration.ZERO));
    }
}
