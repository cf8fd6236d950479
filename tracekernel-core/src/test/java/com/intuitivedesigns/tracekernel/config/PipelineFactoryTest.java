/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.config;

import com.intuitivedesigns.tracekernel.core.EventPipeline;
import com.intuitivedesigns.tracekernel.core.EventSink;
import com.intuitivedesigns.tracekernel.core.RecordingSink;
import com.intuitivedesigns.tracekernel.core.TestEvents;
import com.intuitivedesigns.tracekernel.format.JsonFormatterPlugin;
import com.intuitivedesigns.tracekernel.format.TextFormatterPlugin;
import com.intuitivedesigns.tracekernel.sink.BufferedSinkObserver;
import com.intuitivedesigns.tracekernel.sink.SinkSubscription;
import com.intuitivedesigns.tracekernel.sink.SynchronousSinkObserver;
import com.intuitivedesigns.tracekernel.spi.FormatterPlugin;
import com.intuitivedesigns.tracekernel.spi.PluginCatalog;
import com.intuitivedesigns.tracekernel.spi.ServicePluginRegistry;
import com.intuitivedesigns.tracekernel.spi.SinkContext;
import com.intuitivedesigns.tracekernel.spi.SinkPlugin;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class PipelineFactoryTest {

    private final List<RecordingSink> created = new CopyOnWriteArrayList<>();
    private final List<SinkContext> contexts = new CopyOnWriteArrayList<>();

    private SinkPlugin plugin(String id, boolean buffered) {
        return new SinkPlugin() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public boolean buffered() {
                return buffered;
            }

            @Override
            public EventSink create(SinkContext context) {
                contexts.add(context);
                RecordingSink sink = new RecordingSink(context.name());
                created.add(sink);
                return sink;
            }
        };
    }

    private static SinkPlugin broken() {
        return new SinkPlugin() {
            @Override
            public String id() {
                return "BROKEN";
            }

            @Override
            public EventSink create(SinkContext context) throws Exception {
                throw new java.io.IOException("cannot connect");
            }
        };
    }

    private PipelineFactory factory(SinkPlugin... sinks) {
        return new PipelineFactory(new PluginCatalog(
                ServicePluginRegistry.of(SinkPlugin.class, List.of(sinks)),
                ServicePluginRegistry.of(FormatterPlugin.class, List.of(new TextFormatterPlugin(), new JsonFormatterPlugin()))));
    }

    @Test
    void testBuildsConfiguredSinksInOrder() {
        // Setup
        PipelineConfig config = PipelineConfig.fromMap(Map.of(
                "pipeline.sinks", "db, console",
                "sink.db.type", "memory",
                "sink.db.table", "events",
                "sink.console.type", "DIRECT",
                "sink.console.level", "error"));

        // Act
        try (EventPipeline pipeline = factory(plugin("MEMORY", true), plugin("DIRECT", false)).build(config, null)) {

            // Assert
            List<SinkSubscription> sinks = pipeline.sinks();
            assertEquals(2, sinks.size());
            assertEquals("db", sinks.get(0).sinkId());
            assertInstanceOf(BufferedSinkObserver.class, sinks.get(0).observer());
            assertInstanceOf(SynchronousSinkObserver.class, sinks.get(1).observer());
            assertEquals("events", contexts.get(0).config().getString("table", null));
            assertEquals(List.of("JSON", "TEXT"), List.copyOf(new java.util.TreeSet<>(contexts.get(0).formatters().availableIds())));

            pipeline.onNext(TestEvents.info(0));
            pipeline.onNext(TestEvents.error(1));
            assertEquals(1, created.get(1).persisted().size());
        }
    }

    @Test
    void testUnknownTypeListsAvailablePlugins() {
        PipelineConfig config = PipelineConfig.fromMap(Map.of(
                "pipeline.sinks", "db",
                "sink.db.type", "CASSANDRA"));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> factory(plugin("MEMORY", true)).build(config, null));

        assertTrue(e.getMessage().contains("sink.db.type=CASSANDRA"), e.getMessage());
        assertTrue(e.getMessage().contains("MEMORY"), e.getMessage());
    }

    @Test
    void testFailedSinkClosesThoseAlreadyCreated() {
        PipelineConfig config = PipelineConfig.fromMap(Map.of(
                "pipeline.sinks", "db,es",
                "sink.db.type", "MEMORY",
                "sink.es.type", "BROKEN"));

        RuntimeException e = assertThrows(RuntimeException.class,
                () -> factory(plugin("MEMORY", true), broken()).build(config, null));

        assertTrue(e.getMessage().startsWith("Failed creating Sink [BROKEN]"), e.getMessage());
        assertInstanceOf(java.io.IOException.class, e.getCause());
        assertEquals(1, created.get(0).closeCount());
    }

    @Test
    void testDuplicateSinkNamesAreRejected() {
        PipelineConfig config = PipelineConfig.fromMap(Map.of("pipeline.sinks", "db,db"));

        assertThrows(IllegalArgumentException.class, () -> PipelineFactory.sinkNames(config));
    }

    @Test
    void testEmptySinkListBuildsEmptyPipeline() {
        try (EventPipeline pipeline = factory().build(PipelineConfig.fromMap(Map.of()), null)) {
            assertTrue(pipeline.sinks().isEmpty());
            assertDoesNotThrow(() -> pipeline.onNext(TestEvents.info(0)));
        }
    }

    @Test
    void testDiscoverFindsBuiltInFormatters() {
        PipelineFactory discovered = PipelineFactory.discover();

        assertTrue(discovered.catalog().formatters().availableIds().containsAll(List.of("TEXT", "JSON")));
    }
}
