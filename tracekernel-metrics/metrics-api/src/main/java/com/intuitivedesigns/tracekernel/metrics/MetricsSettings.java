/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.metrics;

import com.intuitivedesigns.tracekernel.config.PipelineConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable metrics configuration.
 *
 * <pre>
 * metrics.provider=PROMETHEUS
 * metrics.prometheus.port=9464
 * metrics.tag.env=dev
 * </pre>
 */
public final class MetricsSettings {

    // ---- Config keys ----
    public static final String KEY_PROVIDER = "metrics.provider";
    public static final String KEY_TAG_PREFIX = "metrics.tag.";
    public static final String KEY_PROM_PORT = "metrics.prometheus.port";
    public static final String KEY_PROM_PATH = "metrics.prometheus.path";

    // ---- Defaults ----
    public static final String DEFAULT_PROVIDER = "NONE";
    public static final int DEFAULT_PROM_PORT = 9464;
    public static final String DEFAULT_PROM_PATH = "/metrics";

    public final String providerId;
    public final Map<String, String> commonTags;
    public final int prometheusPort;
    public final String prometheusPath;

    private MetricsSettings(String providerId, Map<String, String> commonTags, int prometheusPort, String prometheusPath) {
        this.providerId = providerId;
        this.commonTags = commonTags;
        this.prometheusPort = prometheusPort;
        this.prometheusPath = prometheusPath;
    }

    public static MetricsSettings from(PipelineConfig config) {
        Objects.requireNonNull(config, "config");

        final String provider = normalizeUpper(config.getString(KEY_PROVIDER, DEFAULT_PROVIDER));

        final Map<String, String> tags = new TreeMap<>();
        for (Map.Entry<String, Object> entry : config.subset(KEY_TAG_PREFIX).asMap().entrySet()) {
            final String tagKey = normalize(entry.getKey());
            final String value = normalize(String.valueOf(entry.getValue()));
            if (tagKey != null && value != null) {
                tags.put(tagKey, value);
            }
        }

        // 0 binds an ephemeral port
        final int port = clampInt(config.getInt(KEY_PROM_PORT, DEFAULT_PROM_PORT), 0, 65_535);

        String path = normalize(config.getString(KEY_PROM_PATH, DEFAULT_PROM_PATH));
        if (path == null) path = DEFAULT_PROM_PATH;
        if (!path.startsWith("/")) path = "/" + path;

        return new MetricsSettings(
                provider == null ? DEFAULT_PROVIDER : provider,
                Collections.unmodifiableMap(tags),
                port,
                path);
    }

    /**
     * "NONE", "OFF" and "FALSE" switch metrics off entirely.
     */
    public boolean isDisabled() {
        return "NONE".equals(providerId) || "OFF".equals(providerId) || "FALSE".equals(providerId);
    }

    /**
     * Common tags as Micrometer tags, sorted by key.
     */
    public Tags tags() {
        final List<Tag> out = new ArrayList<>(commonTags.size());
        commonTags.forEach((k, v) -> out.add(Tag.of(k, v)));
        return Tags.of(out);
    }

    /**
     * Stamps the common tags on every meter the registry creates from now on,
     * sink meters included.
     */
    public void applyTo(MeterRegistry registry) {
        Objects.requireNonNull(registry, "registry");
        if (!commonTags.isEmpty()) {
            registry.config().commonTags(tags());
        }
    }

    @Override
    public String toString() {
        return "MetricsSettings{" +
                "providerId='" + providerId + '\'' +
                ", commonTags=" + commonTags +
                ", prometheusPort=" + prometheusPort +
                ", prometheusPath='" + prometheusPath + '\'' +
                '}';
    }

    // --- Helpers ---

    private static String normalize(String s) {
        if (s == null) return null;
        final String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    private static String normalizeUpper(String s) {
        final String n = normalize(s);
        return (n != null) ? n.toUpperCase(Locale.ROOT) : null;
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
