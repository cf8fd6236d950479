/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tracekernel.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics bridge for Micrometer.
 * <p>
 * Uses a composite registry so additional backends (Prometheus) can be attached, and maps
 * push-style {@link #gauge(String, double)} calls onto stateful holders.
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private final CompositeMeterRegistry registry;
    private final String type;

    // Micrometer gauges poll; keep the last pushed value here
    private final Map<String, AtomicDouble> gaugeState = new ConcurrentHashMap<>();

    public MicrometerMetricsRuntime() {
        this("MICROMETER");
    }

    public MicrometerMetricsRuntime(String type) {
        this.type = type;
        this.registry = new CompositeMeterRegistry();
        // SimpleRegistry keeps values readable in-process (tests, dev)
        this.registry.add(new SimpleMeterRegistry());
    }

    /**
     * Adds a specific registry (e.g., Prometheus) to the composite.
     */
    public MicrometerMetricsRuntime addRegistry(MeterRegistry specificRegistry) {
        this.registry.add(specificRegistry);
        return this;
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public void counter(String name) {
        registry.counter(name).increment();
    }

    @Override
    public void counter(String name, double increment) {
        if (increment > 0) {
            registry.counter(name).increment(increment);
        }
    }

    @Override
    public void counter(String name, double increment, String... tags) {
        if (increment > 0) {
            registry.counter(name, tags).increment(increment);
        }
    }

    @Override
    public void timer(String name, long durationMillis) {
        registry.timer(name).record(durationMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void timer(String name, long durationMillis, String... tags) {
        registry.timer(name, tags).record(durationMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void gauge(String name, double value) {
        final AtomicDouble state = gaugeState.computeIfAbsent(name, key -> {
            final AtomicDouble newState = new AtomicDouble(value);
            Gauge.builder(key, newState, AtomicDouble::get).register(registry);
            return newState;
        });
        state.set(value);
    }

    @Override
    public void close() {
        registry.close();
        log.info("Metrics Runtime Closed ({}).", type);
    }

    /**
     * Mutable double for gauge state. Extends Number to satisfy Micrometer's gauge builder.
     */
    private static final class AtomicDouble extends Number {
        private final AtomicLong bits;

        AtomicDouble(double initialValue) {
            this.bits = new AtomicLong(Double.doubleToLongBits(initialValue));
        }

        void set(double newValue) {
            bits.set(Double.doubleToLongBits(newValue));
        }

        double get() {
            return Double.longBitsToDouble(bits.get());
        }

        @Override public int intValue() { return (int) get(); }
        @Override public long longValue() { return (long) get(); }
        @Override public float floatValue() { return (float) get(); }
        @Override public double doubleValue() { return get(); }
    }
}
