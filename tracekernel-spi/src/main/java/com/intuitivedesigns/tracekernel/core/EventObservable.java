/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.core;

/**
 * Source of events that observers can attach to.
 *
 * @param <T> event type
 */
public interface EventObservable<T> {

    /**
     * Attaches {@code observer}. Closing the returned subscription detaches it.
     *
     * @throws IllegalArgumentException if observer is null
     */
    Subscription subscribe(EventObserver<? super T> observer);
}
