/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.publish;

import com.intuitivedesigns.tracekernel.buffer.BoundedEventBuffer;
import com.intuitivedesigns.tracekernel.core.CancellationSignal;
import com.intuitivedesigns.tracekernel.core.EventSink;
import com.intuitivedesigns.tracekernel.core.TraceEvent;
import com.intuitivedesigns.tracekernel.diagnostics.PipelineDiagnostics;
import com.intuitivedesigns.tracekernel.metrics.MetricsRuntime;
import com.intuitivedesigns.tracekernel.util.Closeables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Buffers events for one sink and publishes them in the background.
 *
 * <p>Owns the sink's {@link BoundedEventBuffer}, {@link BatchScheduler} and {@link PublishCoordinator}.
 * Producers only pay for the buffer append in {@link #tryPost(TraceEvent)}; all sink I/O happens on the
 * scheduler thread.</p>
 *
 * <p><b>Dispose sequence</b> ({@link #dispose(Duration)}):</p>
 * <ol>
 * <li>stop admitting events;</li>
 * <li>request a final flush and wait for it, bounded by the timeout (a zero timeout does not flush at all);</li>
 * <li>signal cancellation and stop the scheduler;</li>
 * <li>discard whatever is still buffered and report the loss;</li>
 * <li>close the sink.</li>
 * </ol>
 * Each step runs once, no matter how many times dispose is called. The whole sequence is bounded by the
 * timeout. A publish call that is still running when the time is up keeps its thread; the sink is then
 * closed on that thread as soon as the call returns, never concurrently with it.
 */
public final class BufferedEventPublisher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BufferedEventPublisher.class);

    public static final String METRIC_DROPPED = "tracekernel.sink.dropped";

    private final String sinkId;
    private final EventSink sink;
    private final BufferingSettings settings;
    private final PipelineDiagnostics diagnostics;
    private final MetricsRuntime metrics;

    private final BoundedEventBuffer<TraceEvent> buffer;
    private final CancellationSignal cancellation = new CancellationSignal();
    private final PublishCoordinator coordinator;
    private final BatchScheduler scheduler;

    private final AtomicBoolean disposed = new AtomicBoolean(false);
    private final AtomicBoolean sinkClosed = new AtomicBoolean(false);
    private final ReentrantLock publishLock = new ReentrantLock();
    private final LongAdder lost = new LongAdder();
    private volatile boolean closeDeferred;
    private final Object flushLock = new Object();
    private CompletableFuture<Void> pendingFlush; // guarded by flushLock

    private volatile boolean countTriggerEnabled = true;
    private volatile boolean inFlight;

    private BufferedEventPublisher(String sinkId,
                                   EventSink sink,
                                   BufferingSettings settings,
                                   PipelineDiagnostics diagnostics,
                                   MetricsRuntime metrics) {
        this.sinkId = sinkId;
        this.sink = sink;
        this.settings = settings;
        this.diagnostics = diagnostics;
        this.metrics = metrics;

        this.buffer = new BoundedEventBuffer<>(settings.maxBufferSize(),
                capacity -> diagnostics.bufferOverloaded(sinkId, capacity));
        this.coordinator = new PublishCoordinator(sinkId, sink, settings.retryPolicy(), cancellation, diagnostics, metrics);
        this.scheduler = new BatchScheduler(sinkId, settings.effectiveInterval(), this::runCycle,
                t -> diagnostics.unobservedFault(sinkId, t));
    }

    /**
     * Creates the publisher and starts its timer.
     *
     * @throws IllegalArgumentException if the sink id is blank
     */
    public static BufferedEventPublisher create(String sinkId,
                                                EventSink sink,
                                                BufferingSettings settings,
                                                PipelineDiagnostics diagnostics,
                                                MetricsRuntime metrics) {
        if (sinkId == null || sinkId.isBlank()) {
            throw new IllegalArgumentException("sinkId must not be blank");
        }
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(diagnostics, "diagnostics");

        final BufferedEventPublisher publisher = new BufferedEventPublisher(
                sinkId, sink, settings, diagnostics, (metrics == null) ? MetricsRuntime.NOOP : metrics);
        publisher.scheduler.start();
        log.info("Buffered publisher started for sink [{}] (interval={}, count={}, maxBuffer={})",
                sinkId, settings.effectiveInterval(), settings.bufferingCount(), settings.maxBufferSize());
        return publisher;
    }

    /**
     * Appends an event. Never blocks on I/O and never throws for sink problems.
     *
     * @return false if the buffer is full or the publisher is disposed
     */
    public boolean tryPost(TraceEvent event) {
        if (disposed.get()) {
            return false;
        }
        if (!buffer.tryPost(event)) {
            if (!disposed.get()) {
                metrics.counter(METRIC_DROPPED, 1.0, "sink", sinkId);
            }
            return false;
        }

        final int threshold = settings.bufferingCount();
        if (countTriggerEnabled && threshold > 0 && buffer.size() >= threshold) {
            scheduler.requestFlush();
        }
        return true;
    }

    /**
     * Publishes everything buffered now.
     * <p>
     * Concurrent callers share the outcome of the same cycle. The future completes once the buffer has been
     * drained, or exceptionally with {@link FlushFailedException} if that cycle failed.
     */
    public CompletableFuture<Void> flushAsync() {
        if (disposed.get()) {
            return CompletableFuture.completedFuture(null);
        }
        return requestFlush().copy();
    }

    @Override
    public void close() {
        dispose(settings.onCompletedTimeout());
    }

    /**
     * @param timeout bound on the final flush; {@code null} waits indefinitely, zero skips it
     */
    public void dispose(Duration timeout) {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        final long startNs = System.nanoTime();
        coordinator.markDraining();
        buffer.close();

        try {
            if (timeout == null || (!timeout.isZero() && !timeout.isNegative())) {
                awaitFinalFlush(timeout);
            }
        } finally {
            cancellation.cancel();
            if (!scheduler.close(remainingOf(timeout, startNs)) && publishLock.isLocked()) {
                log.warn("Sink [{}] is still publishing, it will be closed when the call returns", sinkId);
            }

            final List<TraceEvent> left = buffer.drainAll();
            if (!left.isEmpty()) {
                lost.add(left.size());
                diagnostics.eventsLostWhileDisposing(sinkId, left.size());
                metrics.counter(PublishCoordinator.METRIC_DISCARDED, left.size(), "sink", sinkId);
                failFlush(new IllegalStateException(left.size() + " events lost while disposing"));
            } else {
                completeFlush();
            }

            coordinator.markDisposed();
            closeDeferred = true;
            closeSinkIfIdle();
            log.info("Buffered publisher for sink [{}] disposed (persisted={}, discarded={}, lost={})",
                    sinkId, coordinator.totalPersisted(), coordinator.totalDiscarded(), left.size());
        }
    }

    // --- Publish cycle (scheduler thread) ---

    private void runCycle() {
        boolean more = true;
        while (more && !cancellation.isCancelled()) {
            final PublishOutcome outcome;
            publishLock.lock();
            inFlight = true;
            try {
                if (sinkClosed.get()) {
                    break;
                }
                final List<TraceEvent> batch = buffer.drain(settings.maxBatchSize());
                if (batch.isEmpty()) {
                    break;
                }
                outcome = coordinator.publish(batch);
            } finally {
                inFlight = false;
                publishLock.unlock();
                if (closeDeferred) {
                    closeSinkIfIdle();
                }
            }

            afterPublish(outcome);
            more = !buffer.isEmpty() && (hasPendingFlush() || countThresholdReached());
        }

        if (buffer.isEmpty()) {
            completeFlush();
        }
    }

    private void afterPublish(PublishOutcome outcome) {
        if (outcome.persisted() > 0) {
            countTriggerEnabled = true;
            if (buffer.clearOverload()) {
                diagnostics.bufferRestored(sinkId);
            }
        } else if (outcome.submitted() > 0) {
            // wait for the timer or an explicit flush until the sink recovers
            countTriggerEnabled = false;
        }

        if (outcome.failure() != null) {
            failFlush(outcome.failure());
        }
    }

    private boolean countThresholdReached() {
        final int threshold = settings.bufferingCount();
        return countTriggerEnabled && threshold > 0 && buffer.size() >= threshold;
    }

    private static Duration remainingOf(Duration timeout, long startNs) {
        if (timeout == null) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        final Duration left = timeout.minusNanos(System.nanoTime() - startNs);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * Closes the sink unless a publish call holds it; in that case the publishing thread retries on its way out.
     */
    private void closeSinkIfIdle() {
        if (!publishLock.tryLock()) {
            return;
        }
        try {
            if (sinkClosed.compareAndSet(false, true)) {
                Closeables.closeQuietly(sink, "sink " + sinkId);
            }
        } finally {
            publishLock.unlock();
        }
    }

    // --- Flush bookkeeping ---

    private CompletableFuture<Void> requestFlush() {
        // read order matters: the cycle sets inFlight before draining
        if (buffer.isEmpty() && !inFlight) {
            return CompletableFuture.completedFuture(null);
        }
        final CompletableFuture<Void> future;
        synchronized (flushLock) {
            if (pendingFlush == null) {
                pendingFlush = new CompletableFuture<>();
            }
            future = pendingFlush;
        }
        scheduler.requestFlush();
        return future;
    }

    private void awaitFinalFlush(Duration timeout) {
        final CompletableFuture<Void> flush = requestFlush();
        try {
            if (timeout == null) {
                flush.get();
            } else {
                flush.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            }
        } catch (TimeoutException e) {
            log.warn("Final flush of sink [{}] did not finish within {}", sinkId, timeout);
        } catch (ExecutionException e) {
            log.warn("Final flush of sink [{}] failed: {}", sinkId, String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private boolean hasPendingFlush() {
        synchronized (flushLock) {
            return pendingFlush != null;
        }
    }

    private void completeFlush() {
        final CompletableFuture<Void> f;
        synchronized (flushLock) {
            f = pendingFlush;
            pendingFlush = null;
        }
        if (f != null) {
            f.complete(null);
        }
    }

    private void failFlush(Throwable cause) {
        final CompletableFuture<Void> f;
        synchronized (flushLock) {
            f = pendingFlush;
            pendingFlush = null;
        }
        if (f != null) {
            f.completeExceptionally(new FlushFailedException(sinkId, cause));
        }
    }

    // --- Telemetry ---

    public String sinkId() {
        return sinkId;
    }

    public PublisherState state() {
        return coordinator.state();
    }

    public int bufferedCount() {
        return buffer.size();
    }

    public long droppedCount() {
        return buffer.droppedCount();
    }

    public long persistedCount() {
        return coordinator.totalPersisted();
    }

    /**
     * Events given up by the sink plus events still buffered at dispose.
     */
    public long discardedCount() {
        return coordinator.totalDiscarded() + lost.sum();
    }

    public long lostWhileDisposingCount() {
        return lost.sum();
    }

    public boolean isSinkClosed() {
        return sinkClosed.get();
    }

    public long publishAttempts() {
        return coordinator.totalAttempts();
    }

    public boolean isDisposed() {
        return disposed.get();
    }

    public BufferingSettings settings() {
        return settings;
    }
}
