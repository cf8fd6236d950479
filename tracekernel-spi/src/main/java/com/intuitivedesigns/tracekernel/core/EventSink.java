/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.core;

import java.util.List;

/**
 * A destination that persists batches of trace events.
 *
 * <p><b>Contract:</b></p>
 * <ul>
 * <li>{@link #publish(List, CancellationSignal)} is never invoked concurrently for the same sink instance.</li>
 * <li>Return the number of records durably accepted. Returning less than {@code batch.size()} means the
 * remainder was rejected and will be discarded.</li>
 * <li>Throw {@link TransientPublishException} for failures worth retrying, {@link PartialPublishException}
 * when exactly one record poisons the batch, anything else is treated as fatal for the batch.</li>
 * </ul>
 */
public interface EventSink extends AutoCloseable {

    /**
     * Persist the batch in order.
     *
     * @param batch        events to persist, never empty
     * @param cancellation cancelled when the owning publisher is disposing
     * @return number of events persisted
     * @throws Exception if the batch could not be persisted
     */
    int publish(List<TraceEvent> batch, CancellationSignal cancellation) throws Exception;

    /**
     * Extra classification hook for failures that the sink did not wrap itself.
     */
    default boolean isTransient(Exception error) {
        return error instanceof TransientPublishException;
    }

    /**
     * Identifier used for logging and metrics tagging (e.g., "db-primary").
     */
    default String id() {
        return this.getClass().getSimpleName();
    }

    @Override
    default void close() throws Exception {
        // no-op by default
    }
}
