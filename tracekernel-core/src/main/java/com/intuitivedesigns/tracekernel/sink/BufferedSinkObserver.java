/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.sink;

import com.intuitivedesigns.tracekernel.core.EventFilter;
import com.intuitivedesigns.tracekernel.core.TraceEvent;
import com.intuitivedesigns.tracekernel.publish.BufferedEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Feeds a {@link BufferedEventPublisher}. Completion disposes the publisher, bounded by its
 * on-completed timeout.
 */
public final class BufferedSinkObserver extends SinkObserver {

    private static final Logger log = LoggerFactory.getLogger(BufferedSinkObserver.class);

    private final BufferedEventPublisher publisher;

    public BufferedSinkObserver(BufferedEventPublisher publisher, EventFilter filter) {
        super(Objects.requireNonNull(publisher, "publisher").sinkId(), filter);
        this.publisher = publisher;
    }

    @Override
    protected void accept(TraceEvent event) {
        publisher.tryPost(event);
    }

    @Override
    public CompletableFuture<Void> flushAsync() {
        return publisher.flushAsync();
    }

    @Override
    public void close() {
        try {
            publisher.close();
        } catch (RuntimeException e) {
            log.error("Disposing sink [{}] failed", sinkId(), e);
        }
    }

    public BufferedEventPublisher publisher() {
        return publisher;
    }
}
