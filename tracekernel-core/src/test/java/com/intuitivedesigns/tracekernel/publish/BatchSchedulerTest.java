/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.publish;

import com.intuitivedesigns.tracekernel.core.TestEvents;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BatchSchedulerTest {

    private BatchScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.close();
        }
    }

    @Test
    void testTimerFiresRepeatedly() {
        AtomicInteger cycles = new AtomicInteger();
        scheduler = new BatchScheduler("timer", Duration.ofMillis(50), cycles::incrementAndGet, t -> {});

        scheduler.start();

        assertTrue(TestEvents.await(() -> cycles.get() >= 3, Duration.ofSeconds(5)));
    }

    @Test
    void testNoTimerWithoutInterval() throws Exception {
        AtomicInteger cycles = new AtomicInteger();
        scheduler = new BatchScheduler("manual", null, cycles::incrementAndGet, t -> {});

        scheduler.start();
        Thread.sleep(200);
        assertEquals(0, cycles.get());

        scheduler.requestFlush();
        assertTrue(TestEvents.await(() -> cycles.get() == 1, Duration.ofSeconds(5)));
    }

    @Test
    void testRequestsDuringCycleAreCoalesced() throws Exception {
        // Setup
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger cycles = new AtomicInteger();
        scheduler = new BatchScheduler("coalesce", null, () -> {
            if (cycles.incrementAndGet() == 1) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }, t -> {});

        // Act
        scheduler.requestFlush();
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        for (int i = 0; i < 10; i++) {
            scheduler.requestFlush();
        }
        release.countDown();

        // Assert
        assertTrue(TestEvents.await(() -> cycles.get() == 2, Duration.ofSeconds(5)));
        Thread.sleep(200);
        assertEquals(2, cycles.get());
    }

    @Test
    void testCycleFaultIsReportedAndSchedulerSurvives() {
        List<Throwable> faults = new CopyOnWriteArrayList<>();
        AtomicInteger cycles = new AtomicInteger();
        scheduler = new BatchScheduler("faulty", null, () -> {
            if (cycles.incrementAndGet() == 1) {
                throw new IllegalStateException("boom");
            }
        }, faults::add);

        scheduler.requestFlush();
        assertTrue(TestEvents.await(() -> faults.size() == 1, Duration.ofSeconds(5)));
        scheduler.requestFlush();

        assertTrue(TestEvents.await(() -> cycles.get() == 2, Duration.ofSeconds(5)));
        assertEquals("boom", faults.get(0).getMessage());
    }

    @Test
    void testRequestsAfterCloseAreIgnored() throws Exception {
        AtomicInteger cycles = new AtomicInteger();
        scheduler = new BatchScheduler("closed", null, cycles::incrementAndGet, t -> {});

        scheduler.close();
        scheduler.requestFlush();
        Thread.sleep(100);

        assertTrue(scheduler.isClosed());
        assertEquals(0, cycles.get());
    }
}
