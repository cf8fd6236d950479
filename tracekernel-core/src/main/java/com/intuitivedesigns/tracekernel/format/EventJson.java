/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.intuitivedesigns.tracekernel.core.EventKeywords;
import com.intuitivedesigns.tracekernel.core.TraceEvent;

import java.util.List;
import java.util.Map;

/**
 * Jackson mapping of a {@link TraceEvent}, shared by the JSON formatter and the store sinks.
 */
public final class EventJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private EventJson() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectNode toNode(TraceEvent event) {
        final ObjectNode node = MAPPER.createObjectNode();
        node.put("EventId", event.eventId());
        node.put("EventDate", event.timestamp().toString());
        node.put("Keywords", event.keywords());
        node.put("KeywordsHex", EventKeywords.toHex(event.keywords()));
        node.put("ProviderId", event.providerId().toString());
        node.put("ProviderName", event.providerName());
        node.put("Level", event.level().value());
        node.put("LevelName", event.level().name());
        node.put("Message", event.formattedMessage());
        node.put("Opcode", event.opcode());
        node.put("Task", event.task());
        node.put("EventName", event.schema().eventName());
        node.put("Version", event.version());
        node.put("ProcessId", event.processId());
        node.put("ThreadId", event.threadId());
        if (!TraceEvent.EMPTY_ID.equals(event.activityId())) {
            node.put("ActivityId", event.activityId().toString());
        }
        if (!TraceEvent.EMPTY_ID.equals(event.relatedActivityId())) {
            node.put("RelatedActivityId", event.relatedActivityId().toString());
        }
        node.set("Payload", payloadNode(event));
        return node;
    }

    public static ObjectNode payloadNode(TraceEvent event) {
        final ObjectNode payload = MAPPER.createObjectNode();
        final List<String> names = event.schema().payloadNames();
        for (int i = 0; i < names.size(); i++) {
            final Object value = event.payload().get(i);
            payload.set(names.get(i), (value == null) ? payload.nullNode() : MAPPER.valueToTree(value));
        }
        return payload;
    }

    /**
     * @throws IllegalStateException if a payload value cannot be serialized
     */
    public static String payloadJson(TraceEvent event) {
        return write(payloadNode(event));
    }

    public static String toJson(TraceEvent event) {
        return write(toNode(event));
    }

    public static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON serialization failed: " + e.getOriginalMessage(), e);
        }
    }

    public static Map<String, Object> toMap(String json) {
        try {
            return MAPPER.readValue(json, MAPPER.getTypeFactory().constructMapType(Map.class, String.class, Object.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
