/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.plugins.file;

import com.intuitivedesigns.tracekernel.config.PipelineConfig;
import com.intuitivedesigns.tracekernel.core.EventSink;
import com.intuitivedesigns.tracekernel.spi.SinkContext;
import com.intuitivedesigns.tracekernel.spi.SinkPlugin;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * ID: ROLLING_FLAT_FILE.
 *
 * <pre>
 * sink.app.file.path=logs/app.log
 * sink.app.rolling.size.kb=1024
 * sink.app.rolling.interval=DAY
 * sink.app.rolling.timestamp.pattern=yyyy-MM-dd
 * sink.app.rolling.exists.behavior=INCREMENT
 * sink.app.rolling.max.archived.files=7
 * </pre>
 */
public final class RollingFlatFileSinkPlugin implements SinkPlugin {

    public static final String ID = "ROLLING_FLAT_FILE";

    public static final String KEY_SIZE_KB = "rolling.size.kb";
    public static final String KEY_INTERVAL = "rolling.interval";
    public static final String KEY_TIMESTAMP_PATTERN = "rolling.timestamp.pattern";
    public static final String KEY_EXISTS_BEHAVIOR = "rolling.exists.behavior";
    public static final String KEY_MAX_ARCHIVED = "rolling.max.archived.files";

    public static final String DEFAULT_TIMESTAMP_PATTERN = "yyyy-MM-dd";

    private final Clock clock;

    public RollingFlatFileSinkPlugin() {
        this(Clock.systemDefaultZone());
    }

    RollingFlatFileSinkPlugin(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public boolean buffered() {
        return false;
    }

    @Override
    public EventSink create(SinkContext context) throws IOException {
        Objects.requireNonNull(context, "context");
        final PipelineConfig config = context.config();
        final String path = config.getString(FlatFileSinkPlugin.KEY_PATH, null);
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Missing config: sink." + context.name() + "." + FlatFileSinkPlugin.KEY_PATH);
        }

        final long sizeKb = config.getLong(KEY_SIZE_KB, 0L);
        final RollingFlatFileSink.RollPolicy policy = new RollingFlatFileSink.RollPolicy(
                Math.max(0L, sizeKb) * 1024L,
                parse(RollInterval.class, config, KEY_INTERVAL, RollInterval.NONE, context.name()),
                config.getString(KEY_TIMESTAMP_PATTERN, DEFAULT_TIMESTAMP_PATTERN),
                parse(RollFileExistsBehavior.class, config, KEY_EXISTS_BEHAVIOR, RollFileExistsBehavior.OVERWRITE, context.name()),
                Math.max(0, config.getInt(KEY_MAX_ARCHIVED, 0)));

        return new RollingFlatFileSink(context.name(), Path.of(path), policy,
                FormattedLineWriter.formatterFor(context), context.diagnostics(), clock);
    }

    private static <E extends Enum<E>> E parse(Class<E> type, PipelineConfig config, String key, E defaultValue, String sinkName) {
        final String raw = config.getString(key, null);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, raw.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid config sink." + sinkName + "." + key + "='" + raw
                    + "', expected one of " + Arrays.toString(type.getEnumConstants()), e);
        }
    }
}
