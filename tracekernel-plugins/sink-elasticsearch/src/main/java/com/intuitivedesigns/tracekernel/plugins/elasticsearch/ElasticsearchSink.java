/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.plugins.elasticsearch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.tracekernel.config.PipelineConfig;
import com.intuitivedesigns.tracekernel.core.CancellationSignal;
import com.intuitivedesigns.tracekernel.core.EventSink;
import com.intuitivedesigns.tracekernel.core.FatalPublishException;
import com.intuitivedesigns.tracekernel.core.TraceEvent;
import com.intuitivedesigns.tracekernel.core.TransientPublishException;
import com.intuitivedesigns.tracekernel.format.EventJson;
import com.intuitivedesigns.tracekernel.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Indexes events through the Elasticsearch {@code _bulk} API.
 * <p>
 * Every event becomes a {@code create} action into a daily index {@code <index>-yyyy.MM.dd} (UTC, from the
 * event timestamp). The number of persisted events is the number of items the cluster acknowledged with 201.
 */
public final class ElasticsearchSink implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(ElasticsearchSink.class);

    // Config keys (relative to sink.<name>.)
    public static final String KEY_URL = "es.url";
    public static final String KEY_INDEX = "es.index";
    public static final String KEY_TYPE = "es.type";
    public static final String KEY_USERNAME = "es.username";
    public static final String KEY_PASSWORD = "es.password";
    public static final String KEY_TIMEOUT_MS = "es.timeout.ms";
    public static final String KEY_INSTANCE = "instance";

    private static final String DEFAULT_INDEX = "tracekernel";
    private static final long DEFAULT_TIMEOUT_MS = 10_000L;

    private static final DateTimeFormatter INDEX_DATE = DateTimeFormatter.ofPattern("yyyy.MM.dd").withZone(ZoneOffset.UTC);

    private final String id;
    private final String instanceName;
    private final URI bulkUri;
    private final String index;
    private final String type;
    private final String authorization;
    private final Duration timeout;
    private final HttpClient client;
    private final MetricsRuntime metrics;

    ElasticsearchSink(String id, String instanceName, URI baseUri, String index, String type,
                      String authorization, Duration timeout, MetricsRuntime metrics) {
        this.id = Objects.requireNonNull(id, "id");
        this.instanceName = Objects.requireNonNull(instanceName, "instanceName");
        this.bulkUri = bulkUri(Objects.requireNonNull(baseUri, "baseUri"));
        this.index = requireIndex(index);
        this.type = (type == null || type.isBlank()) ? null : type.trim();
        this.authorization = authorization;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.metrics = (metrics == null) ? MetricsRuntime.NOOP : metrics;
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /**
     * @throws IllegalArgumentException if {@code es.url} is missing or the index name is not valid
     */
    public static ElasticsearchSink fromConfig(String name, PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");

        final String url = config.getString(KEY_URL, null);
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Missing config: sink." + name + "." + KEY_URL);
        }

        final String user = config.getString(KEY_USERNAME, null);
        final String authorization = (user == null || user.isBlank())
                ? null
                : "Basic " + Base64.getEncoder().encodeToString(
                        (user + ":" + config.getString(KEY_PASSWORD, "")).getBytes(StandardCharsets.UTF_8));

        final ElasticsearchSink sink = new ElasticsearchSink(
                name,
                config.getString(KEY_INSTANCE, name),
                URI.create(url.trim()),
                config.getString(KEY_INDEX, DEFAULT_INDEX),
                config.getString(KEY_TYPE, null),
                authorization,
                Duration.ofMillis(config.getLong(KEY_TIMEOUT_MS, DEFAULT_TIMEOUT_MS)),
                metrics);

        log.info("ElasticsearchSink [{}] active (endpoint={}, index={}-yyyy.MM.dd)", name, sink.bulkUri, sink.index);
        return sink;
    }

    @Override
    public int publish(List<TraceEvent> batch, CancellationSignal cancellation) throws Exception {
        if (batch.isEmpty()) return 0;
        final long start = System.nanoTime();

        final HttpRequest.Builder request = HttpRequest.newBuilder(bulkUri)
                .timeout(timeout)
                .header("Content-Type", "application/x-ndjson")
                .header("User-Agent", "TraceKernel/1.0")
                .POST(HttpRequest.BodyPublishers.ofString(bulkBody(batch), StandardCharsets.UTF_8));
        if (authorization != null) {
            request.header("Authorization", authorization);
        }

        final HttpResponse<String> response = client.send(request.build(), HttpResponse.BodyHandlers.ofString());
        final int status = response.statusCode();

        if (status == 429 || status >= 500) {
            throw new TransientPublishException("Elasticsearch responded " + status + " for sink [" + id + "]");
        }
        if (status != 200) {
            throw new FatalPublishException("Elasticsearch rejected bulk request for sink [" + id + "]: "
                    + status + " " + abbreviate(response.body()));
        }

        final int created = countCreated(response.body());
        metrics.timer("tracekernel.sink.elasticsearch.latency", (System.nanoTime() - start) / 1_000_000, "sink", id);
        if (created < batch.size()) {
            log.warn("Sink [{}]: cluster acknowledged {} of {} documents", id, created, batch.size());
        }
        return created;
    }

    @Override
    public boolean isTransient(Exception error) {
        // connect failures and timeouts (HttpTimeoutException is an IOException)
        return error instanceof IOException;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void close() {
        log.info("ElasticsearchSink [{}] closed.", id);
    }

    // --- Bulk format ---

    String bulkBody(List<TraceEvent> batch) {
        final StringBuilder sb = new StringBuilder(batch.size() * 512);
        for (TraceEvent event : batch) {
            final ObjectNode action = EventJson.mapper().createObjectNode();
            final ObjectNode create = action.putObject("create");
            create.put("_index", indexFor(event));
            if (type != null) {
                create.put("_type", type);
            }

            final ObjectNode doc = EventJson.toNode(event);
            doc.put("InstanceName", instanceName);

            sb.append(EventJson.write(action)).append('\n');
            sb.append(EventJson.write(doc)).append('\n');
        }
        return sb.toString();
    }

    String indexFor(TraceEvent event) {
        return index + "-" + INDEX_DATE.format(event.timestamp());
    }

    static int countCreated(String body) {
        if (body == null || body.isBlank()) return 0;
        final JsonNode root;
        try {
            root = EventJson.mapper().readTree(body);
        } catch (IOException e) {
            throw new FatalPublishException("Unreadable bulk response: " + abbreviate(body), e);
        }
        final JsonNode items = root.path("items");
        int created = 0;
        for (JsonNode item : items) {
            if (item.path("create").path("status").asInt() == 201) {
                created++;
            }
        }
        return created;
    }

    // --- Helpers ---

    private static URI bulkUri(URI base) {
        final String s = base.toString();
        return URI.create(s.endsWith("/") ? s + "_bulk" : s + "/_bulk");
    }

    private static String requireIndex(String index) {
        if (index == null || index.isBlank()) {
            throw new IllegalArgumentException("Elasticsearch index must not be blank");
        }
        final String trimmed = index.trim();
        if (!trimmed.equals(trimmed.toLowerCase(Locale.ROOT)) || trimmed.startsWith("_") || trimmed.startsWith("-")
                || trimmed.chars().anyMatch(c -> " \\/*?\"<>|,#:".indexOf(c) >= 0)) {
            throw new IllegalArgumentException("Invalid Elasticsearch index name: '" + index + "'");
        }
        return trimmed;
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return (s.length() <= 300) ? s : s.substring(0, 300) + "...";
    }
}
