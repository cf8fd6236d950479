/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.core;

import java.util.UUID;

/**
 * Resolves the schema of an event. Implemented outside the pipeline (manifest readers,
 * hand-written tables, generated code) and injected where events are created.
 */
@FunctionalInterface
public interface SchemaLookup {

    /**
     * @throws IllegalArgumentException if the provider does not declare {@code eventId}
     */
    EventSchema schemaFor(UUID providerId, int eventId);
}
