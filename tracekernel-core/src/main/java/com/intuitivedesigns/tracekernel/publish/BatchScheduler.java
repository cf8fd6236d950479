/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.publish;

import com.intuitivedesigns.tracekernel.util.NamedDaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Decides when the publish cycle of one sink runs.
 *
 * <p>All cycles execute on a single daemon thread, so at most one is in flight. Triggers arriving while a
 * cycle runs are coalesced into one follow-up cycle that starts as soon as the current one returns.
 * The timer is re-armed every time a cycle starts, whatever triggered it.</p>
 */
public final class BatchScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);

    private final String sinkId;
    private final Duration interval;
    private final Runnable cycle;
    private final Consumer<Throwable> faultHandler;
    private final ScheduledExecutorService executor;

    private final AtomicBoolean flushRequested = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    // touched only on the scheduler thread
    private ScheduledFuture<?> timer;

    /**
     * @param interval     timer period, null disables the timer
     * @param cycle        drains and publishes; runs on the scheduler thread
     * @param faultHandler receives anything {@code cycle} throws
     */
    public BatchScheduler(String sinkId, Duration interval, Runnable cycle, Consumer<Throwable> faultHandler) {
        this.sinkId = Objects.requireNonNull(sinkId, "sinkId");
        this.interval = interval;
        this.cycle = Objects.requireNonNull(cycle, "cycle");
        this.faultHandler = Objects.requireNonNull(faultHandler, "faultHandler");
        this.executor = Executors.newSingleThreadScheduledExecutor(new NamedDaemonThreadFactory("tk-flush-" + sinkId));
    }

    public void start() {
        submit(this::rearm);
    }

    /**
     * Requests a cycle as soon as possible. Cheap and non-blocking; safe from any thread.
     */
    public void requestFlush() {
        if (closed.get()) {
            return;
        }
        if (flushRequested.compareAndSet(false, true)) {
            submit(this::runRequested);
        }
    }

    private void runRequested() {
        flushRequested.set(false);
        runCycle();
    }

    private void runCycle() {
        rearm();
        try {
            cycle.run();
        } catch (Throwable t) {
            faultHandler.accept(t);
        }
    }

    private void rearm() {
        if (interval == null || closed.get()) {
            return;
        }
        if (timer != null) {
            timer.cancel(false);
        }
        try {
            timer = executor.schedule(this::runCycle, interval.toNanos(), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler for sink [{}] already stopped", sinkId);
        }
    }

    private void submit(Runnable task) {
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler for sink [{}] already stopped, trigger ignored", sinkId);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Stops triggers, interrupts a running cycle and waits up to {@code wait} for the thread to exit.
     *
     * @return true if no cycle is running any more
     */
    public boolean close(Duration wait) {
        if (closed.compareAndSet(false, true)) {
            executor.shutdownNow();
        }
        try {
            if (executor.awaitTermination(wait.toNanos(), TimeUnit.NANOSECONDS)) {
                return true;
            }
            log.debug("Publishing thread of sink [{}] did not stop within {}", sinkId, wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    @Override
    public void close() {
        close(Duration.ofSeconds(5));
    }
}
