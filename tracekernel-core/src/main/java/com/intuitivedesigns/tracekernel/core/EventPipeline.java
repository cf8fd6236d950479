/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.core;

import com.intuitivedesigns.tracekernel.diagnostics.PipelineDiagnostics;
import com.intuitivedesigns.tracekernel.metrics.MetricsRuntime;
import com.intuitivedesigns.tracekernel.publish.BufferedEventPublisher;
import com.intuitivedesigns.tracekernel.publish.BufferingSettings;
import com.intuitivedesigns.tracekernel.sink.BufferedSinkObserver;
import com.intuitivedesigns.tracekernel.sink.SinkObserver;
import com.intuitivedesigns.tracekernel.sink.SinkSubscription;
import com.intuitivedesigns.tracekernel.sink.SynchronousSinkObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-process event pipeline: producers push {@link TraceEvent}s in, every attached sink receives the
 * events that pass its filter.
 *
 * <p>{@link #onNext(TraceEvent)} returns after the events are appended to the sink buffers. Sink
 * failures surface only through {@link #diagnostics()}.</p>
 */
public final class EventPipeline implements EventObserver<TraceEvent>, EventObservable<TraceEvent>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventPipeline.class);

    public static final String METRIC_EMITTED = "tracekernel.events.emitted";

    private final EventSubject<TraceEvent> subject = new EventSubject<>("tk-pipeline");
    private final PipelineDiagnostics diagnostics;
    private final MetricsRuntime metrics;
    private final List<SinkSubscription> sinks = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final LongAdder emitted = new LongAdder();

    public EventPipeline() {
        this(new PipelineDiagnostics(), MetricsRuntime.NOOP);
    }

    public EventPipeline(PipelineDiagnostics diagnostics, MetricsRuntime metrics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.metrics = (metrics == null) ? MetricsRuntime.NOOP : metrics;
    }

    // --- Sinks ---

    /**
     * Attaches a sink behind a {@link BufferedEventPublisher}.
     */
    public SinkSubscription attach(String sinkId, EventSink sink, BufferingSettings settings, EventFilter filter) {
        ensureOpen();
        final BufferedEventPublisher publisher = BufferedEventPublisher.create(sinkId, sink, settings, diagnostics, metrics);
        return register(new BufferedSinkObserver(publisher, filter));
    }

    /**
     * Attaches a sink that is written synchronously on the producer's thread.
     */
    public SinkSubscription attachDirect(String sinkId, EventSink sink, EventFilter filter) {
        ensureOpen();
        return register(new SynchronousSinkObserver(sinkId, sink, filter, diagnostics));
    }

    private SinkSubscription register(SinkObserver observer) {
        final SinkSubscription subscription = new SinkSubscription(subject.subscribe(observer), observer);
        sinks.add(subscription);
        log.info("Sink [{}] attached ({})", observer.sinkId(), observer.getClass().getSimpleName());
        return subscription;
    }

    public List<SinkSubscription> sinks() {
        return List.copyOf(sinks);
    }

    // --- Producer side ---

    @Override
    public Subscription subscribe(EventObserver<? super TraceEvent> observer) {
        return subject.subscribe(observer);
    }

    @Override
    public void onNext(TraceEvent event) {
        Objects.requireNonNull(event, "event");
        emitted.increment();
        metrics.counter(METRIC_EMITTED);
        subject.onNext(event);
    }

    @Override
    public void onCompleted() {
        subject.onCompleted();
    }

    @Override
    public void onError(Throwable error) {
        log.warn("Producer signalled an error, completing sinks: {}", String.valueOf(error));
        subject.onError(error);
    }

    /**
     * Flushes every attached sink; completes when all of them are done.
     */
    public CompletableFuture<Void> flushAsync() {
        final CompletableFuture<?>[] flushes = sinks.stream()
                .filter(s -> !s.isClosed())
                .map(SinkSubscription::flushAsync)
                .toArray(CompletableFuture<?>[]::new);
        return CompletableFuture.allOf(flushes);
    }

    public PipelineDiagnostics diagnostics() {
        return diagnostics;
    }

    public long emittedCount() {
        return emitted.sum();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Completes the subject (each sink flushes within its own timeout, concurrently), releases every
     * subscription, then completes the diagnostics channel.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Closing pipeline ({} sinks, {} events emitted)", sinks.size(), emitted.sum());
        try {
            subject.onCompleted();
        } finally {
            for (SinkSubscription s : sinks) {
                s.close();
            }
            diagnostics.close();
        }
    }

    private void ensureOpen() {
        if (closed.get() || subject.isCompleted()) {
            throw new IllegalStateException("Pipeline is closed");
        }
    }
}
