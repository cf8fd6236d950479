/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.config;

import com.intuitivedesigns.tracekernel.core.EventFilter;
import com.intuitivedesigns.tracekernel.core.EventKeywords;
import com.intuitivedesigns.tracekernel.core.EventLevel;
import com.intuitivedesigns.tracekernel.publish.BufferingSettings;
import com.intuitivedesigns.tracekernel.publish.RetryPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-sink configuration read from {@code sink.<name>.*}.
 *
 * @param name      sink name as listed in {@code pipeline.sinks}
 * @param type      plugin id ({@code sink.<name>.type})
 * @param buffering buffering and retry settings
 * @param filter    level and keyword filter
 * @param config    the sink's own keys, prefix stripped
 */
public record SinkSettings(String name, String type, BufferingSettings buffering, EventFilter filter, PipelineConfig config) {

    // ---- Keys relative to sink.<name>. ----
    public static final String KEY_TYPE = "type";
    public static final String KEY_INTERVAL_MS = "buffering.interval.ms";
    public static final String KEY_COUNT = "buffering.count";
    public static final String KEY_MAX_BUFFER = "buffer.max.size";
    public static final String KEY_ONCOMPLETED_TIMEOUT_MS = "oncompleted.timeout.ms";
    public static final String KEY_LEVEL = "level";
    public static final String KEY_KEYWORDS = "keywords";
    public static final String KEY_RETRY_ATTEMPTS = "retry.attempts";
    public static final String KEY_RETRY_MIN_MS = "retry.min.ms";
    public static final String KEY_RETRY_MAX_MS = "retry.max.ms";
    public static final String KEY_RETRY_DELTA_MS = "retry.delta.ms";

    public SinkSettings {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(buffering, "buffering");
        Objects.requireNonNull(filter, "filter");
        Objects.requireNonNull(config, "config");
    }

    public static String prefix(String name) {
        return "sink." + name + ".";
    }

    /**
     * @throws IllegalArgumentException if the type is missing or a value is invalid
     */
    public static SinkSettings from(PipelineConfig root, String name) {
        Objects.requireNonNull(root, "root");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Sink name must not be blank");
        }
        final String sinkName = name.trim();
        final PipelineConfig c = root.subset(prefix(sinkName));

        final String type = c.getString(KEY_TYPE, null);
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Missing required configuration key: " + prefix(sinkName) + KEY_TYPE);
        }

        final RetryPolicy defaults = RetryPolicy.DEFAULT;
        final RetryPolicy retry = new RetryPolicy(
                c.getInt(KEY_RETRY_ATTEMPTS, defaults.maxAttempts()),
                Duration.ofMillis(c.getLong(KEY_RETRY_MIN_MS, defaults.minBackoff().toMillis())),
                Duration.ofMillis(c.getLong(KEY_RETRY_MAX_MS, defaults.maxBackoff().toMillis())),
                Duration.ofMillis(c.getLong(KEY_RETRY_DELTA_MS, defaults.deltaBackoff().toMillis())));

        final BufferingSettings buffering = new BufferingSettings(
                c.getMillis(KEY_INTERVAL_MS, BufferingSettings.DEFAULT_INTERVAL),
                c.getInt(KEY_COUNT, BufferingSettings.DEFAULT_BUFFERING_COUNT),
                c.getInt(KEY_MAX_BUFFER, BufferingSettings.DEFAULT_MAX_BUFFER_SIZE),
                c.getMillis(KEY_ONCOMPLETED_TIMEOUT_MS, null),
                retry);

        final String level = c.getString(KEY_LEVEL, null);
        final EventFilter filter = new EventFilter(
                (level == null || level.isBlank()) ? EventLevel.VERBOSE : EventLevel.parse(level),
                EventKeywords.parse(c.getString(KEY_KEYWORDS, null)));

        return new SinkSettings(sinkName, type.trim(), buffering, filter, c);
    }
}
