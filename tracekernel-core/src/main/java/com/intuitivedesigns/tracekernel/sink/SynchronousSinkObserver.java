/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.sink;

import com.intuitivedesigns.tracekernel.core.CancellationSignal;
import com.intuitivedesigns.tracekernel.core.EventFilter;
import com.intuitivedesigns.tracekernel.core.EventSink;
import com.intuitivedesigns.tracekernel.core.SinkDiagnostics;
import com.intuitivedesigns.tracekernel.core.TraceEvent;
import com.intuitivedesigns.tracekernel.util.Closeables;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Writes each event straight through to a cheap local sink (console, flat file) on the producer's
 * thread. Calls are serialized; failures are reported and swallowed.
 */
public final class SynchronousSinkObserver extends SinkObserver {

    private final EventSink sink;
    private final SinkDiagnostics diagnostics;
    private final CancellationSignal cancellation = new CancellationSignal();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Object lock = new Object();

    public SynchronousSinkObserver(String sinkId, EventSink sink, EventFilter filter, SinkDiagnostics diagnostics) {
        super(sinkId, filter);
        this.sink = Objects.requireNonNull(sink, "sink");
        this.diagnostics = (diagnostics == null) ? SinkDiagnostics.NONE : diagnostics;
    }

    @Override
    protected void accept(TraceEvent event) {
        synchronized (lock) {
            if (closed.get()) {
                return;
            }
            try {
                sink.publish(List.of(event), cancellation);
            } catch (Exception e) {
                diagnostics.sinkFault(sinkId(), "write failed", e);
            }
        }
    }

    @Override
    public CompletableFuture<Void> flushAsync() {
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        cancellation.cancel();
        synchronized (lock) {
            Closeables.closeQuietly(sink, "sink " + sinkId());
        }
    }
}
