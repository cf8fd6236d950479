/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.app;

import com.intuitivedesigns.tracekernel.config.PipelineConfig;
import com.intuitivedesigns.tracekernel.config.PipelineFactory;
import com.intuitivedesigns.tracekernel.core.EventLevel;
import com.intuitivedesigns.tracekernel.core.EventObserver;
import com.intuitivedesigns.tracekernel.core.EventPipeline;
import com.intuitivedesigns.tracekernel.core.TraceEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class SyntheticEventSourceTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2025-05-05T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    @Test
    void testOrdersAndFailures() {
        SyntheticEventSource source = new SyntheticEventSource(FIXED);

        TraceEvent placed = source.next(7);
        TraceEvent failed = source.next(SyntheticEventSource.FAILURE_EVERY);

        assertEquals(SyntheticEventSource.ORDER_PLACED, placed.eventId());
        assertEquals(EventLevel.INFORMATIONAL, placed.level());
        assertEquals("Order o-7 placed", placed.formattedMessage());
        assertEquals(Instant.parse("2025-05-05T12:00:00Z"), placed.timestamp());
        assertEquals("o-7", placed.payloadAsMap().get("orderId"));

        assertEquals(SyntheticEventSource.ORDER_FAILED, failed.eventId());
        assertEquals(EventLevel.WARNING, failed.level());
        assertEquals("Order o-50 failed: card declined", failed.formattedMessage());
        assertEquals(SyntheticEventSource.PROVIDER_NAME, failed.providerName());
    }

    @Test
    void testUnknownSchemaRejected() {
        SyntheticEventSource source = new SyntheticEventSource();
        assertThrows(IllegalArgumentException.class, () -> source.schemaFor(SyntheticEventSource.PROVIDER_ID, 99));
        assertThrows(IllegalArgumentException.class, () -> source.schemaFor(UUID.randomUUID(), 1));
    }

    @Test
    void testRunStopsAtDurationAndOnFlag() {
        // Setup
        SyntheticEventSource source = new SyntheticEventSource();
        List<TraceEvent> seen = new CopyOnWriteArrayList<>();
        EventObserver<TraceEvent> sink = new EventObserver<>() {
            @Override public void onNext(TraceEvent event) { seen.add(event); }
            @Override public void onCompleted() {}
            @Override public void onError(Throwable error) {}
        };

        // Act
        long emitted = source.run(sink, 1_000, Duration.ofMillis(200), () -> true);
        AtomicBoolean running = new AtomicBoolean(true);
        long stopped = source.run(new EventObserver<TraceEvent>() {
            @Override public void onNext(TraceEvent event) { running.set(false); }
            @Override public void onCompleted() {}
            @Override public void onError(Throwable error) {}
        }, 1_000, null, running::get);

        // Assert
        assertTrue(emitted > 0);
        assertEquals(emitted, seen.size());
        assertEquals(10, stopped);
        assertThrows(IllegalArgumentException.class, () -> source.run(sink, 0, null, () -> true));
    }

    @Test
    void testDrivesConfiguredPipeline() throws Exception {
        // Setup
        Path all = dir.resolve("all.log");
        Path errors = dir.resolve("errors.log");
        PipelineConfig config = PipelineConfig.fromMap(Map.of(
                "pipeline.sinks", "all,errors",
                "sink.all.type", "FLAT_FILE",
                "sink.all.file.path", all.toString(),
                "sink.errors.type", "FLAT_FILE",
                "sink.errors.file.path", errors.toString(),
                "sink.errors.level", "WARNING"));
        SyntheticEventSource source = new SyntheticEventSource();

        // Act
        long emitted;
        try (EventPipeline pipeline = PipelineFactory.discover().build(config, null)) {
            emitted = source.run(pipeline, 5_000, Duration.ofMillis(300), () -> true);
        }

        // Assert
        assertEquals(emitted, Files.readAllLines(all, StandardCharsets.UTF_8).size());
        List<String> errorLines = Files.readAllLines(errors, StandardCharsets.UTF_8);
        assertEquals(emitted / SyntheticEventSource.FAILURE_EVERY, errorLines.size());
        assertTrue(errorLines.stream().allMatch(l -> l.contains("WARNING")), errorLines.toString());
    }
}
