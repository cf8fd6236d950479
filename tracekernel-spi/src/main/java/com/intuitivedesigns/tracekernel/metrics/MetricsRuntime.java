/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.metrics;

/**
 * The vendor-agnostic contract for pipeline telemetry.
 * <p>
 * Keeps the kernel free of a hard metrics dependency: every method has a NOOP default.
 * Tags are passed as alternating key/value pairs ({@code "sink", "db"}).
 */
public interface MetricsRuntime extends AutoCloseable {

    MetricsRuntime NOOP = () -> null;

    /**
     * Returns the underlying registry (e.g., MeterRegistry) for advanced usage, or null.
     */
    Object registry();

    /**
     * @return true if metrics are actually being recorded.
     */
    default boolean enabled() { return false; }

    /**
     * @return A string identifier for the implementation (e.g., "MICROMETER", "NOOP").
     */
    default String type() { return "NOOP"; }

    // --- Instrumentation (NOOP defaults) ---

    default void counter(String name) {}

    default void counter(String name, double increment) {}

    default void counter(String name, double increment, String... tags) {}

    default void timer(String name, long durationMillis) {}

    default void timer(String name, long durationMillis, String... tags) {}

    default void gauge(String name, double value) {}

    @Override
    default void close() {
        // no-op by default
    }
}
