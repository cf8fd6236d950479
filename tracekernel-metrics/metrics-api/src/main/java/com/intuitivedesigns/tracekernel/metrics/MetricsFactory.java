/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Picks the first {@link MetricsProvider} that accepts the settings. Falls back to {@link MetricsRuntime#NOOP}.
 */
public final class MetricsFactory {

    private static final Logger log = LoggerFactory.getLogger(MetricsFactory.class);

    private MetricsFactory() {}

    public static MetricsRuntime init(MetricsSettings settings) {
        return init(settings, resolveClassLoader());
    }

    public static MetricsRuntime init(MetricsSettings settings, ClassLoader cl) {
        Objects.requireNonNull(settings, "settings");

        if (settings.isDisabled()) {
            log.info("Metrics disabled (metrics.provider={}).", settings.providerId);
            return MetricsRuntime.NOOP;
        }

        for (MetricsProvider p : ServiceLoader.load(MetricsProvider.class, cl)) {
            try {
                final MetricsRuntime rt = p.create(settings);
                if (rt != null) {
                    log.info("Metrics runtime initialized: {} ({})", p.id(), p.getClass().getName());
                    return rt;
                }
            } catch (Throwable t) {
                // LinkageError when a provider's backend is missing from the classpath
                log.warn("Failed to initialize metrics provider [{}]: {}", p.getClass().getName(), t.getMessage());
                log.debug("Provider init stack trace:", t);
            }
        }

        log.info("No metrics provider matched '{}' (NOOP active).", settings.providerId);
        return MetricsRuntime.NOOP;
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader threadCl = Thread.currentThread().getContextClassLoader();
        return (threadCl != null) ? threadCl : MetricsFactory.class.getClassLoader();
    }
}
