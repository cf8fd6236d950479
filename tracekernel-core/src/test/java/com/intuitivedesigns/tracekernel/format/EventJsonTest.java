/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.format;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.tracekernel.config.PipelineConfig;
import com.intuitivedesigns.tracekernel.core.TestEvents;
import com.intuitivedesigns.tracekernel.core.TraceEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class EventJsonTest {

    @Test
    void testDocumentFields() throws Exception {
        JsonNode node = EventJson.mapper().readTree(new JsonFormatterPlugin().create(PipelineConfig.fromMap(Map.of()))
                .format(TestEvents.error(4)));

        assertEquals(2, node.get("EventId").asInt());
        assertEquals("2025-03-01T10:15:30.004Z", node.get("EventDate").asText());
        assertEquals("0x2", node.get("KeywordsHex").asText());
        assertEquals("Shop-Orders", node.get("ProviderName").asText());
        assertEquals(2, node.get("Level").asInt());
        assertEquals("ERROR", node.get("LevelName").asText());
        assertEquals("PaymentFailed", node.get("EventName").asText());
        assertEquals(4, node.get("Payload").get("seq").asInt());
        assertEquals("card declined", node.get("Payload").get("reason").asText());
        assertFalse(node.has("ActivityId"));
    }

    @Test
    void testActivityIdsAndNullPayloadValues() {
        UUID activity = UUID.fromString("00000000-0000-0000-0000-00000000000a");
        TraceEvent event = TraceEvent.of(TestEvents.ORDER_PLACED, Instant.EPOCH, 1L, 1L,
                activity, null, null, Arrays.asList(1, null));

        Map<String, Object> json = EventJson.toMap(EventJson.toJson(event));

        assertEquals(activity.toString(), json.get("ActivityId"));
        assertFalse(json.containsKey("RelatedActivityId"));
        @SuppressWarnings("unchecked")
        Map<String, Object> payload = (Map<String, Object>) json.get("Payload");
        assertTrue(payload.containsKey("orderId"));
        assertNull(payload.get("orderId"));
    }

    @Test
    void testPayloadJsonHoldsOnlyPayload() {
        assertEquals("{\"seq\":0,\"orderId\":\"o-0\"}", EventJson.payloadJson(TestEvents.info(0)));
    }
}
