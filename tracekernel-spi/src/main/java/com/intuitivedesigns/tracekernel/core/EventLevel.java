/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.core;

import java.util.Locale;

/**
 * Severity of a trace event.
 * <p>
 * Lower numeric values are more severe. {@link #LOG_ALWAYS} is a special level that
 * bypasses every threshold.
 */
public enum EventLevel {
    LOG_ALWAYS(0),
    CRITICAL(1),
    ERROR(2),
    WARNING(3),
    INFORMATIONAL(4),
    VERBOSE(5);

    private final int value;

    EventLevel(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    /**
     * @return true if an event at this level passes a subscription configured with {@code threshold}.
     */
    public boolean isEnabledFor(EventLevel threshold) {
        if (this == LOG_ALWAYS || threshold == null || threshold == LOG_ALWAYS) return true;
        return value <= threshold.value;
    }

    public static EventLevel fromValue(int value) {
        for (EventLevel level : values()) {
            if (level.value == value) return level;
        }
        throw new IllegalArgumentException("Unknown event level value: " + value);
    }

    /**
     * Accepts either the enum name (case-insensitive, e.g. "warning") or its numeric value ("3").
     */
    public static EventLevel parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Event level must not be blank");
        }
        final String s = raw.trim();
        if (Character.isDigit(s.charAt(0))) {
            return fromValue(Integer.parseInt(s));
        }
        return valueOf(s.toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
