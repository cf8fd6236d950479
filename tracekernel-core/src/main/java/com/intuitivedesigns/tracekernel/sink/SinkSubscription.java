/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.sink;

import com.intuitivedesigns.tracekernel.core.Subscription;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One sink attached to a pipeline. Closing detaches the sink from the subject and then disposes it,
 * exactly once.
 */
public final class SinkSubscription implements Subscription {

    private final Subscription subscription;
    private final SinkObserver observer;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public SinkSubscription(Subscription subscription, SinkObserver observer) {
        this.subscription = Objects.requireNonNull(subscription, "subscription");
        this.observer = Objects.requireNonNull(observer, "observer");
    }

    public String sinkId() {
        return observer.sinkId();
    }

    public SinkObserver observer() {
        return observer;
    }

    public CompletableFuture<Void> flushAsync() {
        return observer.flushAsync();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            subscription.close();
        } finally {
            observer.close();
        }
    }
}
