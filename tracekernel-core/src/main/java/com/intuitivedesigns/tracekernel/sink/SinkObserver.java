/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.sink;

import com.intuitivedesigns.tracekernel.core.EventFilter;
import com.intuitivedesigns.tracekernel.core.EventObserver;
import com.intuitivedesigns.tracekernel.core.TraceEvent;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * The observer a sink subscription attaches to the pipeline subject.
 * <p>
 * Applies the subscription filter and never lets a sink failure escape into the producer.
 */
public abstract class SinkObserver implements EventObserver<TraceEvent>, AutoCloseable {

    private final String sinkId;
    private final EventFilter filter;

    protected SinkObserver(String sinkId, EventFilter filter) {
        this.sinkId = Objects.requireNonNull(sinkId, "sinkId");
        this.filter = (filter == null) ? EventFilter.ALL : filter;
    }

    @Override
    public final void onNext(TraceEvent event) {
        if (event != null && filter.test(event)) {
            accept(event);
        }
    }

    /**
     * Completion and error both end the sink: flush what is pending, then release it.
     */
    @Override
    public void onCompleted() {
        close();
    }

    @Override
    public void onError(Throwable error) {
        close();
    }

    protected abstract void accept(TraceEvent event);

    public abstract CompletableFuture<Void> flushAsync();

    /**
     * Idempotent; never throws.
     */
    @Override
    public abstract void close();

    public String sinkId() {
        return sinkId;
    }

    public EventFilter filter() {
        return filter;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + sinkId + "]";
    }
}
