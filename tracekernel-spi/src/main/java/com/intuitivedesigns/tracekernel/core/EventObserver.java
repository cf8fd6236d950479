/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.core;

/**
 * Push-based receiver of events.
 * <p>
 * After {@link #onCompleted()} or {@link #onError(Throwable)} no further calls are made.
 *
 * @param <T> event type
 */
public interface EventObserver<T> {

    void onNext(T event);

    void onCompleted();

    void onError(Throwable error);
}
