/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.publish;

import com.intuitivedesigns.tracekernel.core.CancellationSignal;
import com.intuitivedesigns.tracekernel.core.EventSink;
import com.intuitivedesigns.tracekernel.core.FatalPublishException;
import com.intuitivedesigns.tracekernel.core.PartialPublishException;
import com.intuitivedesigns.tracekernel.core.TraceEvent;
import com.intuitivedesigns.tracekernel.core.TransientPublishException;
import com.intuitivedesigns.tracekernel.diagnostics.PipelineDiagnostics;
import com.intuitivedesigns.tracekernel.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * Runs one batch against a sink: retries transient failures, isolates poisoned records and
 * accounts for every event as persisted or discarded.
 *
 * <p><b>Failure handling:</b></p>
 * <ul>
 * <li>{@link TransientPublishException} (or {@link EventSink#isTransient(Exception)}): retried with
 * {@link RetryPolicy} backoff until the attempt budget is spent.</li>
 * <li>{@link PartialPublishException}: the offending record is dropped and the remainder retried, at most
 * {@value #MAX_ISOLATION_ROUNDS} times per batch.</li>
 * <li>Anything else: fatal, the rest of the batch is discarded.</li>
 * </ul>
 *
 * Discarded events are never re-buffered.
 */
public final class PublishCoordinator {

    private static final Logger log = LoggerFactory.getLogger(PublishCoordinator.class);

    public static final int MAX_ISOLATION_ROUNDS = 3;

    public static final String METRIC_PERSISTED = "tracekernel.sink.persisted";
    public static final String METRIC_DISCARDED = "tracekernel.sink.discarded";
    public static final String METRIC_RETRIES = "tracekernel.sink.retries";
    public static final String METRIC_LATENCY = "tracekernel.sink.publish.latency";

    private final String sinkId;
    private final EventSink sink;
    private final RetryPolicy retryPolicy;
    private final CancellationSignal cancellation;
    private final PipelineDiagnostics diagnostics;
    private final MetricsRuntime metrics;

    private final Semaphore gate = new Semaphore(1);
    private final AtomicReference<PublisherState> state = new AtomicReference<>(PublisherState.IDLE);

    private final LongAdder attempts = new LongAdder();
    private final LongAdder persisted = new LongAdder();
    private final LongAdder discarded = new LongAdder();

    public PublishCoordinator(String sinkId,
                              EventSink sink,
                              RetryPolicy retryPolicy,
                              CancellationSignal cancellation,
                              PipelineDiagnostics diagnostics,
                              MetricsRuntime metrics) {
        this.sinkId = Objects.requireNonNull(sinkId, "sinkId");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.metrics = (metrics == null) ? MetricsRuntime.NOOP : metrics;
    }

    /**
     * Publishes {@code batch} in order. Never invoked concurrently for one sink.
     *
     * @throws IllegalStateException if another publish is still running
     */
    public PublishOutcome publish(List<TraceEvent> batch) {
        if (batch == null || batch.isEmpty()) {
            return PublishOutcome.EMPTY;
        }
        if (!gate.tryAcquire()) {
            throw new IllegalStateException("Publish already in progress for sink [" + sinkId + "]");
        }
        try {
            return publishGuarded(batch);
        } finally {
            enter(PublisherState.IDLE);
            gate.release();
        }
    }

    private PublishOutcome publishGuarded(List<TraceEvent> batch) {
        final List<TraceEvent> remaining = new ArrayList<>(batch);
        final long startNs = System.nanoTime();

        int confirmed = 0;
        int dropped = 0;
        int calls = 0;
        int transientFailures = 0;
        int isolationRounds = 0;
        Throwable failure = null;
        String reason = "cancelled";

        enter(PublisherState.PUBLISHING);

        while (!remaining.isEmpty() && !cancellation.isCancelled()) {
            calls++;
            attempts.increment();
            try {
                final int reported = sink.publish(Collections.unmodifiableList(new ArrayList<>(remaining)), cancellation);
                final int ok = Math.max(0, Math.min(reported, remaining.size()));
                confirmed += ok;
                if (ok < remaining.size()) {
                    final int rejected = remaining.size() - ok;
                    dropped += rejected;
                    diagnostics.entriesDiscarded(sinkId, rejected, "sink accepted " + ok + " of " + remaining.size());
                }
                remaining.clear();
            } catch (PartialPublishException e) {
                final int index = e.offendingIndex();
                if (index >= remaining.size()) {
                    failure = e;
                    reason = "offending index " + index + " out of range";
                    diagnostics.publishFailed(sinkId, e);
                    break;
                }
                remaining.remove(index);
                dropped++;
                isolationRounds++;
                diagnostics.singleEntryDiscarded(sinkId, index, e);
                if (isolationRounds >= MAX_ISOLATION_ROUNDS) {
                    reason = "still failing after " + isolationRounds + " isolation rounds";
                    break;
                }
                enter(PublisherState.RETRYING);
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                if (cancellation.isCancelled()) {
                    break;
                }
                if (!isTransient(e)) {
                    failure = e;
                    reason = "fatal error";
                    diagnostics.publishFailed(sinkId, e);
                    break;
                }
                transientFailures++;
                if (!retryPolicy.canRetry(transientFailures)) {
                    failure = e;
                    reason = "gave up after " + transientFailures + " attempts";
                    diagnostics.publishFailed(sinkId, e);
                    break;
                }
                diagnostics.transientPublishError(sinkId, transientFailures, e);
                metrics.counter(METRIC_RETRIES, 1.0, "sink", sinkId);
                enter(PublisherState.RETRYING);
                if (cancellation.await(retryPolicy.delayBefore(transientFailures))) {
                    break;
                }
            }
        }

        if (!remaining.isEmpty()) {
            dropped += remaining.size();
            diagnostics.entriesDiscarded(sinkId, remaining.size(), reason);
        }

        if (confirmed > 0) {
            diagnostics.entriesPersisted(sinkId, confirmed);
        }

        persisted.add(confirmed);
        discarded.add(dropped);
        metrics.counter(METRIC_PERSISTED, confirmed, "sink", sinkId);
        metrics.counter(METRIC_DISCARDED, dropped, "sink", sinkId);
        metrics.timer(METRIC_LATENCY, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs), "sink", sinkId);

        if (log.isDebugEnabled()) {
            log.debug("Sink [{}] batch done: submitted={} persisted={} discarded={} attempts={}",
                    sinkId, batch.size(), confirmed, dropped, calls);
        }
        return new PublishOutcome(batch.size(), confirmed, dropped, calls, failure);
    }

    private boolean isTransient(Exception e) {
        if (e instanceof TransientPublishException) return true;
        if (e instanceof FatalPublishException) return false;
        try {
            return sink.isTransient(e);
        } catch (RuntimeException classifierFailure) {
            log.warn("Sink [{}] failed to classify {}", sinkId, e.toString(), classifierFailure);
            return false;
        }
    }

    // DRAINING and DISPOSED are terminal for publish-driven transitions
    private void enter(PublisherState next) {
        state.updateAndGet(cur -> (cur == PublisherState.DRAINING || cur == PublisherState.DISPOSED) ? cur : next);
    }

    void markDraining() {
        state.updateAndGet(cur -> cur == PublisherState.DISPOSED ? cur : PublisherState.DRAINING);
    }

    void markDisposed() {
        state.set(PublisherState.DISPOSED);
    }

    // --- Telemetry ---

    public PublisherState state() {
        return state.get();
    }

    public long totalAttempts() {
        return attempts.sum();
    }

    public long totalPersisted() {
        return persisted.sum();
    }

    public long totalDiscarded() {
        return discarded.sum();
    }

    public String sinkId() {
        return sinkId;
    }
}
