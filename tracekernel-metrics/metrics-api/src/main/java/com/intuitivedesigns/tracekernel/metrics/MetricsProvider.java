/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.metrics;

/**
 * Service Provider Interface (SPI) for metrics backends.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and registered in
 * {@code META-INF/services/com.intuitivedesigns.tracekernel.metrics.MetricsProvider}.
 */
public interface MetricsProvider {

    /**
     * Matched against {@code metrics.provider} (e.g. "PROMETHEUS").
     */
    String id();

    /**
     * @return a runtime if this provider is selected by {@code settings}, or {@code null} to be skipped
     */
    MetricsRuntime create(MetricsSettings settings);

    default boolean matches(String configuredId) {
        return configuredId != null && id().equalsIgnoreCase(configuredId.trim());
    }
}
