/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.publish;

/**
 * Result of publishing one batch.
 *
 * @param submitted number of events handed to the coordinator
 * @param persisted number the sink confirmed
 * @param discarded number dropped (rejected, isolated, or abandoned after failure)
 * @param attempts  sink invocations made
 * @param failure   the error that ended the batch early, or null
 */
public record PublishOutcome(int submitted, int persisted, int discarded, int attempts, Throwable failure) {

    public static final PublishOutcome EMPTY = new PublishOutcome(0, 0, 0, 0, null);

    public boolean fullyPersisted() {
        return persisted == submitted;
    }
}
