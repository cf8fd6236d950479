/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.metrics;

/**
 * {@code metrics.provider=NOOP}: instrumentation calls are accepted and dropped.
 */
public final class NoopMetricsProvider implements MetricsProvider {

    @Override
    public String id() {
        return "NOOP";
    }

    @Override
    public MetricsRuntime create(MetricsSettings s) {
        // only when explicitly requested, never as a catch-all
        if (s == null || !matches(s.providerId)) {
            return null;
        }
        return MetricsRuntime.NOOP;
    }
}
