/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One immutable occurrence of a semantic event.
 * <p>
 * Created by instrumented code at emission time and shared read-only by every sink.
 * The payload is positional; names come from {@link #schema()}.
 *
 * @param providerId        provider identifier
 * @param eventId           event id within the provider
 * @param level             severity
 * @param keywords          keyword mask
 * @param version           event version
 * @param task              task code
 * @param opcode            opcode
 * @param timestamp         emission time (UTC)
 * @param processId         emitting process
 * @param threadId          emitting thread
 * @param activityId        correlation id, {@link #EMPTY_ID} when absent
 * @param relatedActivityId parent correlation id, {@link #EMPTY_ID} when absent
 * @param formattedMessage  pre-rendered message, may be null
 * @param payload           payload values in schema order
 * @param schema            schema of this event
 */
public record TraceEvent(
        UUID providerId,
        int eventId,
        EventLevel level,
        long keywords,
        int version,
        int task,
        int opcode,
        Instant timestamp,
        long processId,
        long threadId,
        UUID activityId,
        UUID relatedActivityId,
        String formattedMessage,
        List<Object> payload,
        EventSchema schema
) {

    public static final UUID EMPTY_ID = new UUID(0L, 0L);

    public TraceEvent {
        Objects.requireNonNull(providerId, "providerId");
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(schema, "schema");
        if (timestamp == null) timestamp = Instant.now();
        if (activityId == null) activityId = EMPTY_ID;
        if (relatedActivityId == null) relatedActivityId = EMPTY_ID;

        // List.copyOf rejects null elements, payload values may legitimately be null
        payload = (payload == null)
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(payload));

        if (payload.size() != schema.payloadSize()) {
            throw new IllegalArgumentException("Payload for event " + eventId + " has " + payload.size()
                    + " values but schema declares " + schema.payloadSize() + " " + schema.payloadNames());
        }
    }

    /**
     * Builds an event whose header fields (level, keywords, task, opcode, version) are taken from the schema.
     */
    public static TraceEvent of(EventSchema schema,
                                Instant timestamp,
                                long processId,
                                long threadId,
                                UUID activityId,
                                UUID relatedActivityId,
                                String formattedMessage,
                                List<Object> payload) {
        Objects.requireNonNull(schema, "schema");
        return new TraceEvent(
                schema.providerId(),
                schema.id(),
                schema.level(),
                schema.keywords(),
                schema.version(),
                schema.task(),
                schema.opcode(),
                timestamp,
                processId,
                threadId,
                activityId,
                relatedActivityId,
                formattedMessage,
                payload,
                schema);
    }

    public String providerName() {
        return schema.providerName();
    }

    /**
     * @return payload values keyed by schema field name, in schema order
     */
    public Map<String, Object> payloadAsMap() {
        final List<String> names = schema.payloadNames();
        final Map<String, Object> out = new LinkedHashMap<>(names.size() * 2);
        for (int i = 0; i < names.size(); i++) {
            out.put(names.get(i), payload.get(i));
        }
        return out;
    }
}
