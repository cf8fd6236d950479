/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.core;

import java.text.MessageFormat;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Creates {@link TraceEvent}s for instrumented code.
 * <p>
 * Captures the timestamp, process id and thread id at the call site and resolves the schema through
 * the injected {@link SchemaLookup}.
 */
public final class EventFactory {

    private static final long PROCESS_ID = ProcessHandle.current().pid();

    private final SchemaLookup schemas;
    private final Clock clock;

    public EventFactory(SchemaLookup schemas) {
        this(schemas, Clock.systemUTC());
    }

    public EventFactory(SchemaLookup schemas, Clock clock) {
        this.schemas = Objects.requireNonNull(schemas, "schemas");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public TraceEvent create(UUID providerId, int eventId, Object... payload) {
        return create(providerId, eventId, null, null, null, payload == null ? List.of() : Arrays.asList(payload));
    }

    /**
     * @param messageTemplate optional {@link MessageFormat} pattern rendered against the payload ({@code "Order {0} placed"})
     */
    public TraceEvent create(UUID providerId,
                             int eventId,
                             String messageTemplate,
                             UUID activityId,
                             UUID relatedActivityId,
                             List<Object> payload) {
        final EventSchema schema = schemas.schemaFor(providerId, eventId);
        if (schema == null) {
            throw new IllegalArgumentException("No schema for provider " + providerId + " event " + eventId);
        }
        final List<Object> values = (payload == null) ? List.of() : payload;

        return TraceEvent.of(
                schema,
                clock.instant(),
                PROCESS_ID,
                Thread.currentThread().getId(),
                activityId,
                relatedActivityId,
                render(messageTemplate, values),
                values);
    }

    private static String render(String template, List<Object> values) {
        if (template == null) return null;
        try {
            return MessageFormat.format(template, values.toArray());
        } catch (IllegalArgumentException e) {
            // malformed pattern, keep the raw template
            return template;
        }
    }
}
