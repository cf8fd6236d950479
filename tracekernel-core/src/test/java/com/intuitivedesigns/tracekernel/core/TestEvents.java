/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.core;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Shared fixtures: a small provider with two event types, and polling helpers.
 */
public final class TestEvents {

    public static final UUID PROVIDER = UUID.fromString("6f2d5e0a-1b3c-4d5e-8f90-123456789abc");

    public static final EventSchema ORDER_PLACED = new EventSchema(1, PROVIDER, "Shop-Orders", EventLevel.INFORMATIONAL,
            10, "Order", 1, "Placed", 0x1L, "Orders", 1, List.of("seq", "orderId"));

    public static final EventSchema PAYMENT_FAILED = new EventSchema(2, PROVIDER, "Shop-Orders", EventLevel.ERROR,
            20, "Payment", 2, "Failed", 0x2L, "Payments", 1, List.of("seq", "reason"));

    public static final SchemaLookup SCHEMAS = (providerId, eventId) -> {
        if (!PROVIDER.equals(providerId)) {
            throw new IllegalArgumentException("Unknown provider " + providerId);
        }
        switch (eventId) {
            case 1: return ORDER_PLACED;
            case 2: return PAYMENT_FAILED;
            default: throw new IllegalArgumentException("Unknown event " + eventId);
        }
    };

    private TestEvents() {}

    public static TraceEvent info(int seq) {
        return TraceEvent.of(ORDER_PLACED, Instant.parse("2025-03-01T10:15:30Z").plusMillis(seq), 100L, 1L,
                null, null, "Order " + seq + " placed", List.of(seq, "o-" + seq));
    }

    public static TraceEvent error(int seq) {
        return TraceEvent.of(PAYMENT_FAILED, Instant.parse("2025-03-01T10:15:30Z").plusMillis(seq), 100L, 1L,
                null, null, "Payment " + seq + " failed", List.of(seq, "card declined"));
    }

    public static List<TraceEvent> infos(int count) {
        final List<TraceEvent> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            out.add(info(i));
        }
        return out;
    }

    public static int seq(TraceEvent event) {
        return (Integer) event.payload().get(0);
    }

    /**
     * Polls until {@code condition} holds or the timeout elapses.
     */
    public static boolean await(BooleanSupplier condition, Duration timeout) {
        final long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return condition.getAsBoolean();
            }
        }
        return condition.getAsBoolean();
    }
}
