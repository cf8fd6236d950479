/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.app;

import com.intuitivedesigns.tracekernel.core.EventFactory;
import com.intuitivedesigns.tracekernel.core.EventLevel;
import com.intuitivedesigns.tracekernel.core.EventObserver;
import com.intuitivedesigns.tracekernel.core.EventSchema;
import com.intuitivedesigns.tracekernel.core.SchemaLookup;
import com.intuitivedesigns.tracekernel.core.TraceEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;
import java.util.function.BooleanSupplier;

/**
 * Emits order events at a fixed rate. Every {@value #FAILURE_EVERY}th order fails.
 */
public final class SyntheticEventSource implements SchemaLookup {

    private static final Logger log = LoggerFactory.getLogger(SyntheticEventSource.class);

    public static final String PROVIDER_NAME = "TraceKernel-Synthetic";
    public static final UUID PROVIDER_ID = UUID.nameUUIDFromBytes(PROVIDER_NAME.getBytes(StandardCharsets.UTF_8));

    public static final int ORDER_PLACED = 1;
    public static final int ORDER_FAILED = 2;
    static final int FAILURE_EVERY = 50;

    private static final long KEYWORD_ORDERS = 0x1L;
    private static final long KEYWORD_ERRORS = 0x2L;
    private static final long TICK_NANOS = TimeUnit.MILLISECONDS.toNanos(10);

    private final Map<Integer, EventSchema> schemas = Map.of(
            ORDER_PLACED, new EventSchema(ORDER_PLACED, PROVIDER_ID, PROVIDER_NAME, EventLevel.INFORMATIONAL,
                    1, "Order", 1, "Placed", KEYWORD_ORDERS, "Orders", 1, List.of("orderId", "amountCents")),
            ORDER_FAILED, new EventSchema(ORDER_FAILED, PROVIDER_ID, PROVIDER_NAME, EventLevel.WARNING,
                    1, "Order", 2, "Failed", KEYWORD_ORDERS | KEYWORD_ERRORS, "Orders Errors", 1, List.of("orderId", "reason")));

    private final EventFactory events;

    public SyntheticEventSource() {
        this(Clock.systemUTC());
    }

    public SyntheticEventSource(Clock clock) {
        this.events = new EventFactory(this, clock);
    }

    @Override
    public EventSchema schemaFor(UUID providerId, int eventId) {
        if (!PROVIDER_ID.equals(providerId)) {
            throw new IllegalArgumentException("Unknown provider: " + providerId);
        }
        final EventSchema schema = schemas.get(eventId);
        if (schema == null) {
            throw new IllegalArgumentException("Provider " + PROVIDER_NAME + " has no event " + eventId);
        }
        return schema;
    }

    public TraceEvent next(long sequence) {
        final String orderId = "o-" + sequence;
        if (sequence > 0 && sequence % FAILURE_EVERY == 0) {
            return events.create(PROVIDER_ID, ORDER_FAILED, "Order {0} failed: {1}", null, null,
                    List.of(orderId, "card declined"));
        }
        return events.create(PROVIDER_ID, ORDER_PLACED, "Order {0} placed", null, null,
                List.of(orderId, 1_000L + (sequence % 9_000L)));
    }

    /**
     * Paces {@code ratePerSecond} events into {@code target} in 10 ms ticks until {@code duration}
     * elapses (null runs forever) or {@code keepRunning} turns false.
     *
     * @return number of events emitted
     */
    public long run(EventObserver<? super TraceEvent> target, int ratePerSecond, Duration duration, BooleanSupplier keepRunning) {
        if (ratePerSecond <= 0) {
            throw new IllegalArgumentException("ratePerSecond must be > 0, was " + ratePerSecond);
        }
        final long perTick = Math.max(1L, ratePerSecond / 100L);
        final long start = System.nanoTime();
        final long deadline = (duration == null) ? 0L : start + duration.toNanos();

        log.info("Synthetic source started: {} events/s for {}", ratePerSecond, duration == null ? "ever" : duration);

        long sequence = 0;
        long nextTick = start;
        while (keepRunning.getAsBoolean() && (duration == null || System.nanoTime() - deadline < 0)) {
            for (long i = 0; i < perTick; i++) {
                target.onNext(next(++sequence));
            }
            nextTick += TICK_NANOS;
            final long sleep = nextTick - System.nanoTime();
            if (sleep > 0) {
                LockSupport.parkNanos(sleep);
            }
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
        }
        log.info("Synthetic source stopped after {} events", sequence);
        return sequence;
    }
}
