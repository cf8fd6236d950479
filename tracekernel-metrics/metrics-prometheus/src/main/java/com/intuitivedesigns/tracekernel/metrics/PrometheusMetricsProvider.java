/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.metrics;

import com.sun.net.httpserver.HttpServer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * {@code metrics.provider=PROMETHEUS}: records into a {@link PrometheusMeterRegistry} and serves the scrape
 * text on {@code metrics.prometheus.port} / {@code metrics.prometheus.path}.
 */
public final class PrometheusMetricsProvider implements MetricsProvider {

    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsProvider.class);

    @Override
    public String id() {
        return "PROMETHEUS";
    }

    @Override
    public MetricsRuntime create(MetricsSettings s) {
        // SPI contract: return null if not applicable
        if (s == null || !matches(s.providerId)) {
            return null;
        }

        final PrometheusMeterRegistry prometheus = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        final MicrometerMetricsRuntime runtime = new MicrometerMetricsRuntime("PROMETHEUS").addRegistry(prometheus);
        s.applyTo(runtime.registry());

        final HttpServer server = start(prometheus, s.prometheusPort, s.prometheusPath);
        final int port = server.getAddress().getPort();

        log.info("Prometheus metrics active (port={}, path={})", port, s.prometheusPath);
        return new PrometheusMetricsRuntime(runtime, prometheus, server, port);
    }

    private static HttpServer start(PrometheusMeterRegistry registry, int port, String path) {
        Objects.requireNonNull(registry, "registry");

        try {
            final HttpServer server = HttpServer.create(new InetSocketAddress(port), 0);

            final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
                final Thread t = new Thread(r, "tk-metrics-http");
                t.setDaemon(true);
                return t;
            });
            server.setExecutor(executor);

            server.createContext(path, exchange -> {
                try {
                    final byte[] bytes = registry.scrape().getBytes(StandardCharsets.UTF_8);
                    exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
                    exchange.sendResponseHeaders(200, bytes.length);
                    try (OutputStream os = exchange.getResponseBody()) {
                        os.write(bytes);
                    }
                } catch (Exception e) {
                    log.warn("Prometheus scrape failed", e);
                    exchange.sendResponseHeaders(500, -1);
                } finally {
                    exchange.close();
                }
            });

            server.start();
            return server;
        } catch (Exception e) {
            throw new RuntimeException("Failed to start Prometheus metrics server on port " + port, e);
        }
    }

    /**
     * Micrometer runtime that also owns the scrape endpoint.
     */
    public static final class PrometheusMetricsRuntime implements MetricsRuntime {

        private final MicrometerMetricsRuntime delegate;
        private final PrometheusMeterRegistry prometheus;
        private final HttpServer server;
        private final int port;

        PrometheusMetricsRuntime(MicrometerMetricsRuntime delegate, PrometheusMeterRegistry prometheus, HttpServer server, int port) {
            this.delegate = delegate;
            this.prometheus = prometheus;
            this.server = server;
            this.port = port;
        }

        public int port() {
            return port;
        }

        public String scrape() {
            return prometheus.scrape();
        }

        @Override public Object registry() { return delegate.registry(); }
        @Override public boolean enabled() { return true; }
        @Override public String type() { return "PROMETHEUS"; }

        @Override public void counter(String name) { delegate.counter(name); }
        @Override public void counter(String name, double increment) { delegate.counter(name, increment); }
        @Override public void counter(String name, double increment, String... tags) { delegate.counter(name, increment, tags); }
        @Override public void timer(String name, long durationMillis) { delegate.timer(name, durationMillis); }
        @Override public void timer(String name, long durationMillis, String... tags) { delegate.timer(name, durationMillis, tags); }
        @Override public void gauge(String name, double value) { delegate.gauge(name, value); }

        @Override
        public void close() {
            server.stop(0);
            final java.util.concurrent.Executor executor = server.getExecutor();
            if (executor instanceof ExecutorService es) {
                es.shutdownNow();
            }
            delegate.close();
        }
    }
}
