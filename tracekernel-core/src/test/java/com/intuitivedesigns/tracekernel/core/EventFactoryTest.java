/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.core;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class EventFactoryTest {

    private static final Instant NOW = Instant.parse("2025-06-01T08:00:00Z");

    private final EventFactory factory = new EventFactory(TestEvents.SCHEMAS, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void testCreateFillsSchemaAndContext() {
        TraceEvent event = factory.create(TestEvents.PROVIDER, 1, 7, "o-7");

        assertEquals(1, event.eventId());
        assertEquals(EventLevel.INFORMATIONAL, event.level());
        assertEquals(0x1L, event.keywords());
        assertEquals(NOW, event.timestamp());
        assertEquals(ProcessHandle.current().pid(), event.processId());
        assertEquals(Thread.currentThread().getId(), event.threadId());
        assertEquals(TraceEvent.EMPTY_ID, event.activityId());
        assertEquals("Shop-Orders", event.providerName());
        assertEquals(Arrays.asList(7, "o-7"), event.payload());
    }

    @Test
    void testMessageTemplateIsRendered() {
        UUID activity = UUID.randomUUID();

        TraceEvent event = factory.create(TestEvents.PROVIDER, 2, "Payment {0} failed: {1}", activity, null,
                Arrays.asList(9, "card declined"));

        assertEquals("Payment 9 failed: card declined", event.formattedMessage());
        assertEquals(activity, event.activityId());
    }

    @Test
    void testMalformedTemplateIsKeptVerbatim() {
        TraceEvent event = factory.create(TestEvents.PROVIDER, 1, "Order {0 placed", null, null, Arrays.asList(1, "o-1"));

        assertEquals("Order {0 placed", event.formattedMessage());
    }

    @Test
    void testPayloadMustMatchSchema() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> factory.create(TestEvents.PROVIDER, 1, 7));

        assertTrue(e.getMessage().contains("schema declares 2"));
    }

    @Test
    void testUnknownEventIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> factory.create(TestEvents.PROVIDER, 99, 1, 2));
    }

    @Test
    void testNullPayloadValuesAreKept() {
        TraceEvent event = factory.create(TestEvents.PROVIDER, 1, 3, null);

        assertNull(event.payload().get(1));
        assertTrue(event.payloadAsMap().containsKey("orderId"));
    }
}
