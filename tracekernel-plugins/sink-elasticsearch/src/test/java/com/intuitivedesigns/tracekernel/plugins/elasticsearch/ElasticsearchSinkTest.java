/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.plugins.elasticsearch;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.tracekernel.config.PipelineConfig;
import com.intuitivedesigns.tracekernel.core.CancellationSignal;
import com.intuitivedesigns.tracekernel.core.EventLevel;
import com.intuitivedesigns.tracekernel.core.EventSchema;
import com.intuitivedesigns.tracekernel.core.FatalPublishException;
import com.intuitivedesigns.tracekernel.core.TraceEvent;
import com.intuitivedesigns.tracekernel.core.TransientPublishException;
import com.intuitivedesigns.tracekernel.format.EventJson;
import com.intuitivedesigns.tracekernel.spi.SinkContext;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ElasticsearchSinkTest {

    private static final UUID PROVIDER = UUID.fromString("3c8f2a10-7d4e-4b6a-9f01-2e3d4c5b6a79");
    private static final EventSchema REQUEST = new EventSchema(12, PROVIDER, "Web-Gateway", EventLevel.INFORMATIONAL,
            5, "Request", 1, "Start", 0x8L, "Http", 1, List.of("path", "status"));

    private HttpServer server;
    private final List<String> bodies = new CopyOnWriteArrayList<>();
    private final List<String> contentTypes = new CopyOnWriteArrayList<>();
    private final AtomicInteger status = new AtomicInteger(200);
    private final AtomicReference<String> reply = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/_bulk", exchange -> {
            bodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            contentTypes.add(exchange.getRequestHeaders().getFirst("Content-Type"));
            byte[] out = (reply.get() == null ? "" : reply.get()).getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status.get(), out.length == 0 ? -1 : out.length);
            if (out.length > 0) {
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(out);
                }
            }
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private ElasticsearchSink sink(Map<String, String> extra) {
        Map<String, String> config = new HashMap<>();
        config.put("es.url", "http://localhost:" + server.getAddress().getPort());
        config.put("es.index", "traces");
        config.putAll(extra);
        return (ElasticsearchSink) new ElasticsearchSinkPlugin()
                .create(new SinkContext("search", PipelineConfig.fromMap(config), null, null, null));
    }

    private static TraceEvent request(int n, String day) {
        return TraceEvent.of(REQUEST, Instant.parse(day + "T23:59:59Z"), 1L, 2L, null, null,
                "GET /orders/" + n, List.of("/orders/" + n, 200));
    }

    private static String created(int... statuses) {
        StringBuilder sb = new StringBuilder("{\"took\":3,\"errors\":false,\"items\":[");
        for (int i = 0; i < statuses.length; i++) {
            if (i > 0) sb.append(',');
            sb.append("{\"create\":{\"_index\":\"traces\",\"status\":").append(statuses[i]).append("}}");
        }
        return sb.append("]}").toString();
    }

    @Test
    void testBulkBodyUsesDailyIndexPerEvent() throws Exception {
        // Setup
        reply.set(created(201, 201));
        ElasticsearchSink sink = sink(Map.of("instance", "gw-1"));

        // Act
        int persisted = sink.publish(List.of(request(1, "2025-01-31"), request(2, "2025-02-01")), new CancellationSignal());

        // Assert
        assertEquals(2, persisted);
        assertEquals("application/x-ndjson", contentTypes.get(0));
        String[] lines = bodies.get(0).split("\n");
        assertEquals(4, lines.length);
        assertTrue(bodies.get(0).endsWith("\n"));

        JsonNode firstAction = EventJson.mapper().readTree(lines[0]);
        assertEquals("traces-2025.01.31", firstAction.path("create").path("_index").asText());
        assertFalse(firstAction.path("create").has("_type"));

        JsonNode firstDoc = EventJson.mapper().readTree(lines[1]);
        assertEquals("gw-1", firstDoc.path("InstanceName").asText());
        assertEquals(12, firstDoc.path("EventId").asInt());
        assertEquals("/orders/1", firstDoc.path("Payload").path("path").asText());

        assertEquals("traces-2025.02.01", EventJson.mapper().readTree(lines[2]).path("create").path("_index").asText());
    }

    @Test
    void testDocumentTypeIsSentWhenConfigured() throws Exception {
        reply.set(created(201));
        ElasticsearchSink sink = sink(Map.of("es.type", "etw"));

        sink.publish(List.of(request(1, "2025-01-31")), new CancellationSignal());

        assertTrue(bodies.get(0).startsWith("{\"create\":{\"_index\":\"traces-2025.01.31\",\"_type\":\"etw\"}}"));
    }

    @Test
    void testOnlyCreatedItemsCount() throws Exception {
        reply.set(created(201, 409, 201));
        ElasticsearchSink sink = sink(Map.of());

        int persisted = sink.publish(List.of(request(1, "2025-01-31"), request(2, "2025-01-31"), request(3, "2025-01-31")),
                new CancellationSignal());

        assertEquals(2, persisted);
    }

    @Test
    void testThrottlingAndServerErrorsAreTransient() {
        ElasticsearchSink sink = sink(Map.of());

        status.set(429);
        assertThrows(TransientPublishException.class, () -> sink.publish(List.of(request(1, "2025-01-31")), new CancellationSignal()));

        status.set(503);
        assertThrows(TransientPublishException.class, () -> sink.publish(List.of(request(1, "2025-01-31")), new CancellationSignal()));
    }

    @Test
    void testClientErrorsAreFatal() {
        status.set(400);
        reply.set("{\"error\":\"illegal_argument_exception\"}");
        ElasticsearchSink sink = sink(Map.of());

        FatalPublishException e = assertThrows(FatalPublishException.class,
                () -> sink.publish(List.of(request(1, "2025-01-31")), new CancellationSignal()));

        assertTrue(e.getMessage().contains("illegal_argument_exception"));
    }

    @Test
    void testConnectionFailuresAreTransient() {
        assertTrue(sink(Map.of()).isTransient(new ConnectException("refused")));
        assertFalse(sink(Map.of()).isTransient(new IllegalStateException("bug")));
    }

    @Test
    void testCountCreatedToleratesMissingItems() {
        assertEquals(0, ElasticsearchSink.countCreated("{\"took\":1}"));
        assertEquals(0, ElasticsearchSink.countCreated(""));
        assertThrows(FatalPublishException.class, () -> ElasticsearchSink.countCreated("<html>"));
    }

    @Test
    void testConfigValidation() {
        assertThrows(IllegalArgumentException.class, () -> sink(Map.of("es.index", "Traces")));
        assertThrows(IllegalArgumentException.class, () -> new ElasticsearchSinkPlugin()
                .create(new SinkContext("search", PipelineConfig.fromMap(Map.of()), null, null, null)));
    }
}
