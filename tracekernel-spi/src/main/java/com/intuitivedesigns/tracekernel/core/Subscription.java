/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.core;

/**
 * Handle returned by {@link EventObservable#subscribe(EventObserver)}.
 * Closing is idempotent and never throws.
 */
public interface Subscription extends AutoCloseable {

    Subscription EMPTY = () -> { };

    @Override
    void close();
}
